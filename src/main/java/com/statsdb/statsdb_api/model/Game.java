package com.statsdb.statsdb_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.Immutable;

import java.time.LocalDateTime;

/**
 * One finished game. Ids are assigned at completion time, so ordering by id
 * is ordering by time.
 *
 * The ruleset is stored encoded: `mode` is the mode index in the ruleset
 * catalog and `mutators` is a bit mask (see RulesetCatalog#mutatorMask).
 */
@Getter
@Entity
@Immutable
@Table(name = "games")
public class Game {

    @Id
    private Long id;

    @Column(name = "played_at", nullable = false)
    private LocalDateTime playedAt;

    @Column(nullable = false)
    private String map;

    @Column(nullable = false)
    private int mode;

    @Column(nullable = false)
    private int mutators;

    /** Seconds the game ran. */
    @Column(name = "time_played", nullable = false)
    private int timePlayed;

    // Constructors
    protected Game() {}

    public Game(Long id, LocalDateTime playedAt, String map, int mode, int mutators, int timePlayed) {
        this.id = id;
        this.playedAt = playedAt;
        this.map = map;
        this.mode = mode;
        this.mutators = mutators;
        this.timePlayed = timePlayed;
    }
}
