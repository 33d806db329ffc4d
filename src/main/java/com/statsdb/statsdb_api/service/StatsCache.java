package com.statsdb.statsdb_api.service;

import com.fasterxml.jackson.core.type.TypeReference;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Cache-aside port. Callers never invalidate; entries simply expire.
 */
public interface StatsCache {

    /**
     * Return the cached value for {@code key}, or run {@code compute}, store
     * its result for {@code ttl} and return it. Failures of {@code compute}
     * propagate and nothing is stored.
     */
    <T> T getOrCompute(CacheKey key, Duration ttl, TypeReference<T> type, Supplier<T> compute);
}
