package com.statsdb.statsdb_api.service;

import com.statsdb.statsdb_api.config.RulesetCatalog;
import com.statsdb.statsdb_api.repository.GameWeaponRepository;
import com.statsdb.statsdb_api.repository.WeaponScope;
import com.statsdb.statsdb_api.repository.WeaponTotals;
import com.statsdb.statsdb_api.view.WeaponSummary;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Weapon summaries for the catalog's weapons over a chosen scope. Weapons with
 * no matching rows come back with every counter at 0.
 */
@Service
@Transactional(readOnly = true)
public class WeaponService {

    private final RulesetCatalog catalog;
    private final GameWeaponRepository weaponRepository;

    public WeaponService(RulesetCatalog catalog, GameWeaponRepository weaponRepository) {
        this.catalog = catalog;
        this.weaponRepository = weaponRepository;
    }

    public List<String> weaponList() {
        return catalog.weaponNames();
    }

    public long count() {
        return weaponList().size();
    }

    /** Totals for one weapon across every game. */
    public WeaponSummary resolve(String weapon) {
        if (!catalog.hasWeapon(weapon)) {
            throw new NotFoundException("weapon", weapon);
        }
        return fromWeapon(weapon);
    }

    // =========================================================================
    // Single weapon
    // =========================================================================

    public WeaponSummary fromWeapon(String weapon) {
        return single(weapon, WeaponScope.all());
    }

    public WeaponSummary fromPlayer(String weapon, String handle) {
        return single(weapon, WeaponScope.forPlayer(handle));
    }

    public WeaponSummary fromPlayerGames(String weapon, String handle, Collection<Long> gameIds) {
        return single(weapon, WeaponScope.forPlayer(handle).withGames(gameIds));
    }

    public WeaponSummary fromGame(String weapon, long gameId) {
        return single(weapon, WeaponScope.forGame(gameId));
    }

    public WeaponSummary fromGames(String weapon, Collection<Long> gameIds) {
        return single(weapon, WeaponScope.forGames(gameIds));
    }

    public WeaponSummary fromGamePlayer(String weapon, long gameId, String handle) {
        return single(weapon, WeaponScope.forGame(gameId).withPlayer(handle));
    }

    public WeaponSummary fromFilter(String weapon, GameFilter filter) {
        return single(weapon, WeaponScope.forFilter(filter));
    }

    // =========================================================================
    // Every catalog weapon, in catalog order
    // =========================================================================

    public List<WeaponSummary> all() {
        return allFrom(WeaponScope.all());
    }

    public List<WeaponSummary> allFromPlayer(String handle) {
        return allFrom(WeaponScope.forPlayer(handle));
    }

    public List<WeaponSummary> allFromPlayerGames(String handle, Collection<Long> gameIds) {
        return allFrom(WeaponScope.forPlayer(handle).withGames(gameIds));
    }

    public List<WeaponSummary> allFromGame(long gameId) {
        return allFrom(WeaponScope.forGame(gameId));
    }

    public List<WeaponSummary> allFromGames(Collection<Long> gameIds) {
        return allFrom(WeaponScope.forGames(gameIds));
    }

    public List<WeaponSummary> allFromFilter(GameFilter filter) {
        return allFrom(WeaponScope.forFilter(filter));
    }

    /** One summary per catalog weapon over an arbitrary scope. */
    public List<WeaponSummary> allFrom(WeaponScope scope) {
        if (scope.matchesNothing()) {
            return catalog.weaponNames().stream().map(name -> summary(name, null)).toList();
        }
        Map<String, WeaponTotals> sums = weaponRepository.sumByWeapon(scope).stream()
                .collect(Collectors.toMap(WeaponTotals::weapon, Function.identity()));
        return catalog.weaponNames().stream()
                .map(name -> summary(name, sums.get(name)))
                .toList();
    }

    private WeaponSummary single(String weapon, WeaponScope scope) {
        if (scope.matchesNothing()) {
            return summary(weapon, null);
        }
        List<WeaponTotals> rows = weaponRepository.sumByWeapon(scope.withWeapon(weapon));
        return summary(weapon, rows.isEmpty() ? null : rows.get(0));
    }

    private WeaponSummary summary(String weapon, WeaponTotals totals) {
        return new WeaponSummary(weapon, catalog.isPassiveWeapon(weapon),
                totals != null ? totals : WeaponTotals.zero(weapon));
    }
}
