package com.statsdb.statsdb_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.Immutable;

@Getter
@Entity
@Immutable
@Table(name = "game_servers")
public class GameServer {

    @Id
    private Long id;

    @Column(name = "game_id", nullable = false)
    private Long gameId;

    @Column(nullable = false)
    private String handle;

    private String description;

    private String host;

    private int port;

    private String version;

    protected GameServer() {}

    public GameServer(Long gameId, String handle, String description,
                      String host, int port, String version) {
        this.gameId = gameId;
        this.handle = handle;
        this.description = description;
        this.host = host;
        this.port = port;
        this.version = version;
    }
}
