package com.statsdb.statsdb_api.repository;

import java.util.List;

public interface GameWeaponRepositoryCustom {

    /**
     * Sum every weapon counter over the rows in {@code scope}, one entry per
     * weapon that has at least one row. Rows of deleted games are ignored.
     */
    List<WeaponTotals> sumByWeapon(WeaponScope scope);
}
