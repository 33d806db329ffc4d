package com.statsdb.statsdb_api.view;

import com.statsdb.statsdb_api.dto.ServerDTO;
import com.statsdb.statsdb_api.model.GameServer;

import java.util.List;

public record ServerView(String handle, List<Long> gameIds, GameServer first, GameServer latest)
        implements GameHistory {

    public ServerView {
        gameIds = List.copyOf(gameIds);
    }

    public ServerDTO toRecord() {
        return new ServerDTO(handle, gameIds,
                ServerDTO.Snapshot.from(latest), ServerDTO.Snapshot.from(first));
    }
}
