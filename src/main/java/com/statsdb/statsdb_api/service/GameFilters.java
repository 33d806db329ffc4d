package com.statsdb.statsdb_api.service;

import com.statsdb.statsdb_api.config.RulesetCatalog;
import org.springframework.stereotype.Component;

/**
 * Named filters used across the resolvers and the aggregator.
 */
@Component
public class GameFilters {

    public static final String RACE_MODE = "race";
    public static final String TIMED = "timed";
    public static final String ENDURANCE = "endurance";
    public static final String FREESTYLE = "freestyle";

    private final RulesetCatalog catalog;

    public GameFilters(RulesetCatalog catalog) {
        this.catalog = catalog;
    }

    public GameFilter.Builder builder() {
        return GameFilter.builder(catalog);
    }

    public GameFilter hasMode(String mode) {
        return builder().mode(mode).build();
    }

    /** Accepts plain and {@code <mode>-<mutator>} names. */
    public GameFilter hasMutator(String mutator) {
        return builder().mutator(mutator).build();
    }

    public GameFilter lacksMutator(String mutator) {
        return builder().withoutMutator(mutator).build();
    }

    /** Games played with the stock weapon set. */
    public GameFilter normalWeapons() {
        return new GameFilter(GameFilter.ANY_MODE, 0, catalog.nonStandardWeaponsMask());
    }

    /** Timed race runs, freestyle excluded; endurance runs only when asked. */
    public GameFilter timedRace(boolean endurance) {
        GameFilter.Builder builder = builder()
                .mode(RACE_MODE)
                .mutator(TIMED)
                .withoutMutator(FREESTYLE);
        if (endurance) {
            builder.mutator(ENDURANCE);
        }
        return builder.build();
    }
}
