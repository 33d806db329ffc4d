package com.statsdb.statsdb_api.dto;

import com.statsdb.statsdb_api.model.GameServer;

import java.util.List;

public record ServerDTO(String handle, List<Long> gameIds, Snapshot latest, Snapshot first) {

    /** A server's self-reported details as recorded in one game. */
    public record Snapshot(Long gameId, String description, String host, int port, String version) {

        public static Snapshot from(GameServer server) {
            if (server == null) return null;
            return new Snapshot(server.getGameId(), server.getDescription(),
                    server.getHost(), server.getPort(), server.getVersion());
        }
    }
}
