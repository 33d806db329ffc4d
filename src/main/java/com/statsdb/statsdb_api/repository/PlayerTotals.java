package com.statsdb.statsdb_api.repository;

/**
 * Summed player columns over a set of games. Column aliases in the native
 * query are lower case, hence the short getter names.
 */
public interface PlayerTotals {

    Long getFrags();

    Long getDeaths();

    /** Summed time alive, in seconds. */
    Long getAlive();
}
