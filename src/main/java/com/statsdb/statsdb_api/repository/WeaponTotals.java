package com.statsdb.statsdb_api.repository;

/**
 * Summed weapon counters for one weapon. Sums over no rows are 0.
 */
public record WeaponTotals(
        String weapon,
        long timeWielded, long timeLoadout,
        long damage1, long frags1, long hits1, long flakHits1, long shots1, long flakShots1,
        long damage2, long frags2, long hits2, long flakHits2, long shots2, long flakShots2
) {
    public static WeaponTotals zero(String weapon) {
        return new WeaponTotals(weapon, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0);
    }

    /** Counter-wise sum; keeps this weapon's name. */
    public WeaponTotals plus(WeaponTotals o) {
        return new WeaponTotals(weapon,
                timeWielded + o.timeWielded, timeLoadout + o.timeLoadout,
                damage1 + o.damage1, frags1 + o.frags1, hits1 + o.hits1,
                flakHits1 + o.flakHits1, shots1 + o.shots1, flakShots1 + o.flakShots1,
                damage2 + o.damage2, frags2 + o.frags2, hits2 + o.hits2,
                flakHits2 + o.flakHits2, shots2 + o.shots2, flakShots2 + o.flakShots2);
    }
}
