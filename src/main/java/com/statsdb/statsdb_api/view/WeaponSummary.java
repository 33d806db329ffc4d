package com.statsdb.statsdb_api.view;

import com.statsdb.statsdb_api.dto.WeaponDTO;
import com.statsdb.statsdb_api.repository.WeaponTotals;

/**
 * Summed counters for one weapon over some scope.
 *
 * @param passive true for weapons that count while merely equipped
 */
public record WeaponSummary(String name, boolean passive, WeaponTotals totals) {

    /** Time that counts for this weapon: loadout time if passive, wielded time otherwise. */
    public long time() {
        return passive ? totals.timeLoadout() : totals.timeWielded();
    }

    public long damage() {
        return totals.damage1() + totals.damage2();
    }

    public long frags() {
        return totals.frags1() + totals.frags2();
    }

    public WeaponDTO toRecord() {
        WeaponTotals t = totals;
        return new WeaponDTO(name,
                t.timeWielded(), t.timeLoadout(),
                t.damage1(), t.frags1(), t.hits1(), t.flakHits1(), t.shots1(), t.flakShots1(),
                t.damage2(), t.frags2(), t.hits2(), t.flakHits2(), t.shots2(), t.flakShots2());
    }
}
