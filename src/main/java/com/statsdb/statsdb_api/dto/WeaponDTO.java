package com.statsdb.statsdb_api.dto;

public record WeaponDTO(
        String name,
        long timeWielded, long timeLoadout,
        long damage1, long frags1, long hits1, long flakHits1, long shots1, long flakShots1,
        long damage2, long frags2, long hits2, long flakHits2, long shots2, long flakShots2
) {}
