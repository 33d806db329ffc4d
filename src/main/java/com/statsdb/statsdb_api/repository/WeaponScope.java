package com.statsdb.statsdb_api.repository;

import com.statsdb.statsdb_api.service.GameFilter;

import java.util.Collection;
import java.util.List;

/**
 * Which weapon rows to sum. Every non-null part narrows the selection.
 *
 * @param weapon  single weapon, or null for all weapons (grouped by weapon)
 * @param handle  single player, or null for every player
 * @param gameIds restrict to these games, or null for every game
 * @param filter  ruleset filter on the games, or null for none
 */
public record WeaponScope(String weapon, String handle, Collection<Long> gameIds, GameFilter filter) {

    public static WeaponScope all() {
        return new WeaponScope(null, null, null, null);
    }

    public static WeaponScope forPlayer(String handle) {
        return all().withPlayer(handle);
    }

    public static WeaponScope forGame(long gameId) {
        return all().withGames(List.of(gameId));
    }

    public static WeaponScope forGames(Collection<Long> gameIds) {
        return all().withGames(gameIds);
    }

    public static WeaponScope forFilter(GameFilter filter) {
        return new WeaponScope(null, null, null, filter);
    }

    public WeaponScope withWeapon(String weapon) {
        return new WeaponScope(weapon, handle, gameIds, filter);
    }

    public WeaponScope withPlayer(String handle) {
        return new WeaponScope(weapon, handle, gameIds, filter);
    }

    public WeaponScope withGames(Collection<Long> gameIds) {
        return new WeaponScope(weapon, handle, List.copyOf(gameIds), filter);
    }

    /** True when the scope names an empty game set and so can match nothing. */
    public boolean matchesNothing() {
        return gameIds != null && gameIds.isEmpty();
    }
}
