package com.statsdb.statsdb_api.model;

import jakarta.persistence.*;
import lombok.Getter;
import org.hibernate.annotations.Immutable;

/**
 * Per player, per weapon, per game counters. Columns suffixed 1 and 2 are
 * the primary and secondary fire modes.
 */
@Getter
@Entity
@Immutable
@Table(name = "game_weapons")
public class GameWeapon {

    @Id
    private Long id;

    @Column(name = "game_id", nullable = false)
    private Long gameId;

    @Column(name = "player_handle", nullable = false)
    private String playerHandle;

    @Column(nullable = false)
    private String weapon;

    @Column(name = "time_wielded")
    private int timeWielded;

    @Column(name = "time_loadout")
    private int timeLoadout;

    // Primary fire
    private int damage1;
    private int frags1;
    private int hits1;
    @Column(name = "flak_hits1")
    private int flakHits1;
    private int shots1;
    @Column(name = "flak_shots1")
    private int flakShots1;

    // Secondary fire
    private int damage2;
    private int frags2;
    private int hits2;
    @Column(name = "flak_hits2")
    private int flakHits2;
    private int shots2;
    @Column(name = "flak_shots2")
    private int flakShots2;

    protected GameWeapon() {}
}
