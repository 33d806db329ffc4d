package com.statsdb.statsdb_api.service;

import com.fasterxml.jackson.core.type.TypeReference;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.function.Supplier;

/** Used when caching is switched off: always computes. */
@Service
@ConditionalOnProperty(name = "statsdb.cache.enabled", havingValue = "false")
public class PassThroughStatsCache implements StatsCache {

    @Override
    public <T> T getOrCompute(CacheKey key, Duration ttl, TypeReference<T> type, Supplier<T> compute) {
        return compute.get();
    }
}
