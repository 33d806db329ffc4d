package com.statsdb.statsdb_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.Immutable;

/**
 * A player's line in one game. An empty handle means the player was not
 * logged in; those rows count towards game totals but never form a Player.
 *
 * `gameId` is a plain column, not a relation: rows may outlive their game.
 */
@Getter
@Entity
@Immutable
@Table(name = "game_players")
public class GamePlayer {

    @Id
    private Long id;

    @Column(name = "game_id", nullable = false)
    private Long gameId;

    @Column(nullable = false)
    private String handle;

    /** Display name at the time of the game. */
    @Column(nullable = false)
    private String name;

    // Race games store the elapsed time here; 0 means the run was never finished.
    private int score;

    private int frags;

    private int deaths;

    @Column(name = "time_alive")
    private int timeAlive;

    @Column(name = "time_active")
    private int timeActive;

    protected GamePlayer() {}

    public GamePlayer(Long gameId, String handle, String name,
                      int score, int frags, int deaths, int timeAlive, int timeActive) {
        this.gameId = gameId;
        this.handle = handle;
        this.name = name;
        this.score = score;
        this.frags = frags;
        this.deaths = deaths;
        this.timeAlive = timeAlive;
        this.timeActive = timeActive;
    }
}
