package com.statsdb.statsdb_api.repository;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.Query;
import jakarta.persistence.Tuple;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Builds the weapon sum query from whichever parts of a WeaponScope are set.
 */
public class GameWeaponRepositoryImpl implements GameWeaponRepositoryCustom {
    private static final Logger log = LoggerFactory.getLogger(GameWeaponRepositoryImpl.class);

    // Order matters: matches the WeaponTotals constructor after the weapon name.
    static final List<String> COUNTER_COLUMNS = List.of(
            "time_wielded", "time_loadout",
            "damage1", "frags1", "hits1", "flak_hits1", "shots1", "flak_shots1",
            "damage2", "frags2", "hits2", "flak_hits2", "shots2", "flak_shots2");

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<WeaponTotals> sumByWeapon(WeaponScope scope) {
        if (scope.matchesNothing()) {
            return List.of();
        }
        if (scope.gameIds() == null) {
            return query(scope, null);
        }

        // Large game sets go out in batches; counters are summed per weapon.
        Map<String, WeaponTotals> merged = new LinkedHashMap<>();
        for (List<Long> batch : GameIdBatches.split(scope.gameIds())) {
            for (WeaponTotals totals : query(scope, batch)) {
                merged.merge(totals.weapon(), totals, WeaponTotals::plus);
            }
        }
        return new ArrayList<>(merged.values());
    }

    private List<WeaponTotals> query(WeaponScope scope, List<Long> gameIds) {
        StringBuilder sql = new StringBuilder("SELECT gw.weapon AS weapon");
        for (String column : COUNTER_COLUMNS) {
            sql.append(", COALESCE(SUM(gw.").append(column).append("), 0) AS ").append(column);
        }
        sql.append(" FROM game_weapons gw JOIN games g ON g.id = gw.game_id WHERE 1 = 1");

        Map<String, Object> params = new LinkedHashMap<>();
        if (scope.weapon() != null) {
            sql.append(" AND gw.weapon = :weapon");
            params.put("weapon", scope.weapon());
        }
        if (scope.handle() != null) {
            sql.append(" AND gw.player_handle = :handle");
            params.put("handle", scope.handle());
        }
        if (gameIds != null) {
            sql.append(" AND gw.game_id IN (:gameIds)");
            params.put("gameIds", gameIds);
        }
        if (scope.filter() != null) {
            sql.append(" AND (:mode < 0 OR g.mode = :mode)")
               .append(" AND (g.mutators & :required) = :required")
               .append(" AND (g.mutators & :excluded) = 0");
            params.put("mode", scope.filter().mode());
            params.put("required", scope.filter().requiredMutators());
            params.put("excluded", scope.filter().excludedMutators());
        }
        sql.append(" GROUP BY gw.weapon");

        log.debug("Weapon totals query for weapon={} handle={} over {} game ids",
                scope.weapon(), scope.handle(), gameIds != null ? gameIds.size() : "all");
        Query query = entityManager.createNativeQuery(sql.toString(), Tuple.class);
        params.forEach(query::setParameter);

        List<WeaponTotals> totals = new ArrayList<>();
        for (Object row : query.getResultList()) {
            totals.add(toTotals((Tuple) row));
        }
        return totals;
    }

    static WeaponTotals toTotals(Tuple row) {
        long[] v = new long[COUNTER_COLUMNS.size()];
        for (int i = 0; i < v.length; i++) {
            Object value = row.get(COUNTER_COLUMNS.get(i));
            v[i] = value != null ? ((Number) value).longValue() : 0L;
        }
        return new WeaponTotals(row.get("weapon", String.class),
                v[0], v[1],
                v[2], v[3], v[4], v[5], v[6], v[7],
                v[8], v[9], v[10], v[11], v[12], v[13]);
    }
}
