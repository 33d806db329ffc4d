package com.statsdb.statsdb_api.service;

import com.statsdb.statsdb_api.model.GamePlayer;
import com.statsdb.statsdb_api.repository.GamePlayerRepository;
import com.statsdb.statsdb_api.view.PlayerView;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

@Service
@Transactional(readOnly = true)
public class PlayerService extends EntityResolver<PlayerView> {

    private final GamePlayerRepository playerRepository;

    public PlayerService(GamePlayerRepository playerRepository) {
        this.playerRepository = playerRepository;
    }

    @Override
    public String kind() {
        return "player";
    }

    @Override
    public List<String> list() {
        return playerRepository.findHandles();
    }

    @Override
    public long count() {
        return playerRepository.countHandles();
    }

    @Override
    protected PlayerView load(String handle) {
        List<Long> gameIds = playerRepository.findGameIdsByHandle(handle);
        if (gameIds.isEmpty()) {
            return new PlayerView(handle, gameIds, null, null);
        }
        GamePlayer first = playerRepository
                .findFirstByGameIdAndHandle(gameIds.get(0), handle).orElse(null);
        GamePlayer latest = playerRepository
                .findFirstByGameIdAndHandle(gameIds.get(gameIds.size() - 1), handle).orElse(null);
        return new PlayerView(handle, gameIds, first, latest);
    }

    /** The player's row in one game. */
    public Optional<GamePlayer> gamePlayer(PlayerView player, long gameId) {
        return playerRepository.findFirstByGameIdAndHandle(gameId, player.handle());
    }
}
