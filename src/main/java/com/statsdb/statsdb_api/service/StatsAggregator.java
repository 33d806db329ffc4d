package com.statsdb.statsdb_api.service;

import com.statsdb.statsdb_api.dto.TopMapEntry;
import com.statsdb.statsdb_api.dto.TopRaceEntry;
import com.statsdb.statsdb_api.model.Game;
import com.statsdb.statsdb_api.model.GamePlayer;
import com.statsdb.statsdb_api.repository.GamePlayerRepository;
import com.statsdb.statsdb_api.repository.GameIdBatches;
import com.statsdb.statsdb_api.repository.GameRepository;
import com.statsdb.statsdb_api.repository.GameWeaponRepository;
import com.statsdb.statsdb_api.repository.PlayerTotals;
import com.statsdb.statsdb_api.view.GameHistory;
import com.statsdb.statsdb_api.view.MapView;
import com.statsdb.statsdb_api.view.PlayerView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Derived statistics over an entity's games.
 *
 * Player ratios:
 *   dpm = damage / minutes alive
 *   fpm = frags  / minutes alive
 *   kdr = frags  / deaths
 *   dfr = damage / frags
 * Every denominator is floored at 1 (seconds, deaths or frags) so the result
 * is always finite. Ratios only count games played with stock weapons.
 *
 * Window arguments mean "the most recent N games"; 0 means all games.
 */
@Service
@Transactional(readOnly = true)
public class StatsAggregator {
    private static final Logger log = LoggerFactory.getLogger(StatsAggregator.class);

    private final GameRepository gameRepository;
    private final GamePlayerRepository playerRepository;
    private final GameWeaponRepository weaponRepository;
    private final GameFilters filters;
    private final int highscoreResults;

    public StatsAggregator(GameRepository gameRepository,
                           GamePlayerRepository playerRepository,
                           GameWeaponRepository weaponRepository,
                           GameFilters filters,
                           @Value("${statsdb.highscore-results:10}") int highscoreResults) {
        this.gameRepository = gameRepository;
        this.playerRepository = playerRepository;
        this.weaponRepository = weaponRepository;
        this.filters = filters;
        this.highscoreResults = highscoreResults;
    }

    // =========================================================================
    // Player ratios
    // =========================================================================

    public double dpm(PlayerView player, int windowSize) {
        List<Long> games = window(player, windowSize);
        if (games.isEmpty()) return 0;
        GameFilter filter = filters.normalWeapons();

        long damage = damage(player.handle(), games, filter);
        return damage / minutes(totals(player.handle(), games, filter).alive());
    }

    public double fpm(PlayerView player, int windowSize) {
        List<Long> games = window(player, windowSize);
        if (games.isEmpty()) return 0;

        Totals totals = totals(player.handle(), games, filters.normalWeapons());
        return totals.frags() / minutes(totals.alive());
    }

    public double kdr(PlayerView player, int windowSize) {
        List<Long> games = window(player, windowSize);
        if (games.isEmpty()) return 0;

        Totals totals = totals(player.handle(), games, filters.normalWeapons());
        return totals.frags() / (double) Math.max(1, totals.deaths());
    }

    public double dfr(PlayerView player, int windowSize) {
        List<Long> games = window(player, windowSize);
        if (games.isEmpty()) return 0;
        GameFilter filter = filters.normalWeapons();

        long damage = damage(player.handle(), games, filter);
        return damage / (double) Math.max(1, totals(player.handle(), games, filter).frags());
    }

    // =========================================================================
    // Rankings
    // =========================================================================

    /**
     * Maps played over the window, most played first; equal counts are ordered
     * by map name.
     */
    public List<TopMapEntry> topMaps(GameHistory history, int windowSize) {
        List<Long> games = window(history, windowSize);
        if (games.isEmpty()) return List.of();

        // Sorted by name first so the stable sort below keeps names ascending on ties.
        Map<String, Long> counts = GameIdBatches.split(games).stream()
                .flatMap(batch -> gameRepository.findMapsByIdIn(batch).stream())
                .collect(Collectors.groupingBy(Function.identity(), TreeMap::new, Collectors.counting()));

        List<TopMapEntry> entries = new ArrayList<>();
        counts.forEach((name, count) -> entries.add(new TopMapEntry(name, count)));
        entries.sort(Comparator.comparingLong(TopMapEntry::games).reversed());
        return entries;
    }

    /**
     * Best finished timed race run per handle on a map, fastest first, capped
     * at the configured number of results. Freestyle runs never count.
     *
     * @param endurance only consider endurance runs
     */
    public List<TopRaceEntry> topRaces(MapView map, boolean endurance) {
        List<GamePlayer> runs = playerRepository.findBestRuns(
                map.name(), filters.timedRace(endurance), highscoreResults);
        if (runs.isEmpty()) return List.of();

        Map<Long, LocalDateTime> playedAt = gameRepository
                .findByIdInOrderByIdAsc(runs.stream().map(GamePlayer::getGameId).distinct().toList())
                .stream()
                .collect(Collectors.toMap(Game::getId, Game::getPlayedAt));

        return runs.stream()
                .filter(run -> run.getScore() > 0)
                .map(run -> new TopRaceEntry(run.getGameId(), run.getHandle(), run.getName(),
                        run.getScore(), playedAt.get(run.getGameId())))
                .toList();
    }

    // =========================================================================
    // Helpers
    // =========================================================================

    private List<Long> window(GameHistory history, int windowSize) {
        List<Long> games = history.lastGames(windowSize);
        log.debug("Window of {} over {} games -> {} games", windowSize, history.gameIds().size(), games.size());
        return games;
    }

    // Summed per id batch; the sums are additive.
    private Totals totals(String handle, List<Long> games, GameFilter filter) {
        long frags = 0, deaths = 0, alive = 0;
        for (List<Long> batch : GameIdBatches.split(games)) {
            PlayerTotals sums = playerRepository.sumTotals(handle, batch, filter);
            if (sums == null) continue;
            frags += orZero(sums.getFrags());
            deaths += orZero(sums.getDeaths());
            alive += orZero(sums.getAlive());
        }
        return new Totals(frags, deaths, alive);
    }

    private long damage(String handle, List<Long> games, GameFilter filter) {
        long damage = 0;
        for (List<Long> batch : GameIdBatches.split(games)) {
            damage += orZero(weaponRepository.sumDamage(handle, batch, filter));
        }
        return damage;
    }

    /** Seconds to minutes, floored at one second. */
    private static double minutes(long seconds) {
        return Math.max(1, seconds) / 60.0;
    }

    private static long orZero(Long value) {
        return value != null ? value : 0L;
    }

    private record Totals(long frags, long deaths, long alive) {}
}
