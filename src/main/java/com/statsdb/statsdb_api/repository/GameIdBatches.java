package com.statsdb.statsdb_api.repository;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * Splits game id lists for {@code IN (...)} queries. The PostgreSQL driver
 * binds each id as its own parameter and rejects statements with more than
 * 65535 of them, so callers query batch by batch and combine the results.
 */
public final class GameIdBatches {

    public static final int BATCH_SIZE = 10_000;

    private GameIdBatches() {}

    /** Consecutive batches in the original order; empty input gives no batches. */
    public static List<List<Long>> split(Collection<Long> ids) {
        List<Long> ordered = ids instanceof List<Long> list ? list : new ArrayList<>(ids);
        List<List<Long>> batches = new ArrayList<>();
        for (int from = 0; from < ordered.size(); from += BATCH_SIZE) {
            batches.add(ordered.subList(from, Math.min(ordered.size(), from + BATCH_SIZE)));
        }
        return batches;
    }
}
