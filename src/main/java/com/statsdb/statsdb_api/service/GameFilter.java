package com.statsdb.statsdb_api.service;

import com.statsdb.statsdb_api.config.RulesetCatalog;

import java.util.ArrayList;
import java.util.List;

/**
 * Predicate over a game's stored ruleset encoding. Repositories render it into
 * SQL (see GameRepository#RULESET_FILTER); {@link #matches} is the same test
 * evaluated in-process.
 *
 * @param mode             required mode index, or {@link #ANY_MODE}
 * @param requiredMutators every bit here must be set on the game
 * @param excludedMutators no bit here may be set on the game
 */
public record GameFilter(int mode, int requiredMutators, int excludedMutators) {

    public static final int ANY_MODE = -1;

    public static final GameFilter ANY = new GameFilter(ANY_MODE, 0, 0);

    public boolean matches(int gameMode, int gameMutators) {
        if (mode != ANY_MODE && mode != gameMode) return false;
        if ((gameMutators & requiredMutators) != requiredMutators) return false;
        return (gameMutators & excludedMutators) == 0;
    }

    /** Both filters must hold. Two different required modes cannot be combined. */
    public GameFilter and(GameFilter other) {
        int combinedMode = mode;
        if (other.mode != ANY_MODE) {
            if (mode != ANY_MODE && mode != other.mode) {
                throw new IllegalArgumentException("Conflicting modes in filter: " + mode + " and " + other.mode);
            }
            combinedMode = other.mode;
        }
        return new GameFilter(combinedMode,
                requiredMutators | other.requiredMutators,
                excludedMutators | other.excludedMutators);
    }

    public static Builder builder(RulesetCatalog catalog) {
        return new Builder(catalog);
    }

    /**
     * Collects mode and mutator names, resolving them against the catalog on
     * {@link #build()} so mode specific mutators see the final mode.
     * Accepts qualified {@code <mode>-<mutator>} names, which also set the mode.
     */
    public static final class Builder {

        private final RulesetCatalog catalog;
        private String mode;
        private final List<String> with = new ArrayList<>();
        private final List<String> without = new ArrayList<>();

        private Builder(RulesetCatalog catalog) {
            this.catalog = catalog;
        }

        public Builder mode(String name) {
            if (mode != null && !mode.equals(name)) {
                throw new IllegalArgumentException("Conflicting modes in filter: " + mode + " and " + name);
            }
            catalog.modeIndex(name);
            this.mode = name;
            return this;
        }

        public Builder mutator(String name) {
            with.add(unqualify(name));
            return this;
        }

        public Builder withoutMutator(String name) {
            without.add(unqualify(name));
            return this;
        }

        public GameFilter build() {
            int required = 0;
            for (String mutator : with) {
                required |= catalog.mutatorMask(mode, mutator);
            }
            int excluded = 0;
            for (String mutator : without) {
                excluded |= catalog.mutatorMask(mode, mutator);
            }
            return new GameFilter(mode != null ? catalog.modeIndex(mode) : ANY_MODE, required, excluded);
        }

        private String unqualify(String name) {
            int split = name.indexOf(RulesetCatalog.MODE_SEPARATOR);
            if (split < 0 || catalog.isBaseMutator(name)) {
                return name;
            }
            mode(name.substring(0, split));
            return name.substring(split + 1);
        }
    }
}
