package com.statsdb.statsdb_api.service;

import com.statsdb.statsdb_api.model.Game;
import com.statsdb.statsdb_api.repository.GameIdBatches;
import com.statsdb.statsdb_api.repository.GameRepository;
import com.statsdb.statsdb_api.view.GameHistory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Loads full Game rows for any entity's game history.
 */
@Service
@Transactional(readOnly = true)
public class GameService {

    private final GameRepository gameRepository;

    public GameService(GameRepository gameRepository) {
        this.gameRepository = gameRepository;
    }

    /** Games for one page of the history, oldest first; a null page size loads all. */
    public List<Game> games(GameHistory history, int page, Integer pageSize) {
        List<Long> ids = Pagination.slice(history.gameIds(), page, pageSize);
        if (ids.isEmpty()) {
            return List.of();
        }
        // Ascending batches of an ascending list keep the overall order.
        return GameIdBatches.split(ids).stream()
                .flatMap(batch -> gameRepository.findByIdInOrderByIdAsc(batch).stream())
                .toList();
    }

    /** The last {@code number} games, newest first. */
    public List<Game> recentGames(GameHistory history, int number) {
        List<Long> ids = history.lastGames(number);
        if (ids.isEmpty()) {
            return List.of();
        }
        return GameIdBatches.split(ids).stream()
                .flatMap(batch -> gameRepository.findByIdInOrderByIdDesc(batch).stream())
                .toList();
    }

    public Pagination<Game> gamesPaginate(GameHistory history, int page, int perPage) {
        return Pagination.of(page, perPage,
                (p, size) -> games(history, p, size),
                () -> history.gameIds().size());
    }
}
