package com.statsdb.statsdb_api.view;

import com.statsdb.statsdb_api.dto.PlayerDTO;
import com.statsdb.statsdb_api.model.GamePlayer;

import java.util.List;

/**
 * A handle and its game history, built per request.
 *
 * @param first  the player's row in their first game, null if every game is gone
 * @param latest the player's row in their latest game, null if every game is gone
 */
public record PlayerView(String handle, List<Long> gameIds, GamePlayer first, GamePlayer latest)
        implements GameHistory {

    public PlayerView {
        gameIds = List.copyOf(gameIds);
    }

    public PlayerDTO toRecord() {
        return new PlayerDTO(handle, gameIds);
    }
}
