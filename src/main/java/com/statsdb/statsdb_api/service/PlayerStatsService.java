package com.statsdb.statsdb_api.service;

import com.fasterxml.jackson.core.type.TypeReference;
import com.statsdb.statsdb_api.dto.TopMapEntry;
import com.statsdb.statsdb_api.view.PlayerView;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * Player statistics through the cache. Keys are per handle, method and window;
 * entries expire after the configured TTL.
 */
@Service
public class PlayerStatsService {

    private static final TypeReference<Double> RATIO = new TypeReference<>() {};
    private static final TypeReference<List<TopMapEntry>> TOP_MAPS = new TypeReference<>() {};

    private final StatsAggregator aggregator;
    private final StatsCache cache;
    private final Duration ttl;

    public PlayerStatsService(StatsAggregator aggregator,
                              StatsCache cache,
                              @Value("${statsdb.cache.ttl-seconds:300}") long ttlSeconds) {
        this.aggregator = aggregator;
        this.cache = cache;
        this.ttl = Duration.ofSeconds(ttlSeconds);
    }

    public double dpm(PlayerView player, int windowSize) {
        return ratio(player, "dpm", windowSize, () -> aggregator.dpm(player, windowSize));
    }

    public double fpm(PlayerView player, int windowSize) {
        return ratio(player, "fpm", windowSize, () -> aggregator.fpm(player, windowSize));
    }

    public double kdr(PlayerView player, int windowSize) {
        return ratio(player, "kdr", windowSize, () -> aggregator.kdr(player, windowSize));
    }

    public double dfr(PlayerView player, int windowSize) {
        return ratio(player, "dfr", windowSize, () -> aggregator.dfr(player, windowSize));
    }

    public List<TopMapEntry> topMaps(PlayerView player, int windowSize) {
        return cache.getOrCompute(key(player, "topmaps", windowSize), ttl, TOP_MAPS,
                () -> aggregator.topMaps(player, windowSize));
    }

    private double ratio(PlayerView player, String method, int windowSize, Supplier<Double> compute) {
        return cache.getOrCompute(key(player, method, windowSize), ttl, RATIO, compute);
    }

    static CacheKey key(PlayerView player, String method, int windowSize) {
        return CacheKey.of("player", player.handle(), method, Map.of("window", windowSize));
    }
}
