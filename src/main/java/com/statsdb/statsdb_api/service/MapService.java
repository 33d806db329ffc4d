package com.statsdb.statsdb_api.service;

import com.statsdb.statsdb_api.model.Game;
import com.statsdb.statsdb_api.repository.GamePlayerRepository;
import com.statsdb.statsdb_api.repository.GameRepository;
import com.statsdb.statsdb_api.view.MapView;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Maps by name. The race variants of the listing only include maps that have
 * at least one timed race game.
 */
@Service
@Transactional(readOnly = true)
public class MapService extends EntityResolver<MapView> {

    private final GameRepository gameRepository;
    private final GamePlayerRepository playerRepository;
    private final GameFilters filters;

    public MapService(GameRepository gameRepository,
                      GamePlayerRepository playerRepository,
                      GameFilters filters) {
        this.gameRepository = gameRepository;
        this.playerRepository = playerRepository;
        this.filters = filters;
    }

    @Override
    public String kind() {
        return "map";
    }

    @Override
    public List<String> list() {
        return mapList(false);
    }

    @Override
    public long count() {
        return count(false);
    }

    public List<String> mapList(boolean race) {
        if (race) {
            return gameRepository.findMapNamesMatching(raceMaps());
        }
        return gameRepository.findMapNames();
    }

    public long count(boolean race) {
        if (race) {
            return gameRepository.countMapNamesMatching(raceMaps());
        }
        return gameRepository.countMapNames();
    }

    public List<MapView> all(int page, Integer pageSize, boolean race) {
        return Pagination.slice(mapList(race), page, pageSize).stream().map(this::load).toList();
    }

    public Pagination<MapView> paginate(int page, int perPage, boolean race) {
        return Pagination.of(page, perPage,
                (p, size) -> all(p, size, race),
                () -> count(race));
    }

    @Override
    protected MapView load(String name) {
        List<Long> gameIds = gameRepository.findIdsByMap(name);
        Game first = null;
        Game latest = null;
        if (!gameIds.isEmpty()) {
            first = gameRepository.findById(gameIds.get(0)).orElse(null);
            latest = gameRepository.findById(gameIds.get(gameIds.size() - 1)).orElse(null);
        }
        long gameTime = orZero(gameRepository.sumTimePlayedByMap(name));
        long playerTime = orZero(playerRepository.sumTimeActiveByMap(name));
        return new MapView(name, gameIds, first, latest, gameTime, playerTime);
    }

    // Any timed race game qualifies a map, freestyle or not.
    private GameFilter raceMaps() {
        return filters.builder()
                .mode(GameFilters.RACE_MODE)
                .mutator(GameFilters.TIMED)
                .build();
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }
}
