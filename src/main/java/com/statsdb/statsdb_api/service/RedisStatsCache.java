package com.statsdb.statsdb_api.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Redis backed cache-aside. Values are stored as JSON with a single SET ... EX,
 * so a key is either fully written or absent.
 *
 * Concurrent misses on the same key within this process wait for the first
 * caller's computation instead of repeating it. Across processes a value may
 * still be computed more than once, which is harmless since computations are
 * read-only.
 */
@Service
@ConditionalOnProperty(name = "statsdb.cache.enabled", havingValue = "true", matchIfMissing = true)
public class RedisStatsCache implements StatsCache {
    private static final Logger log = LoggerFactory.getLogger(RedisStatsCache.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    // Key: rendered cache key, Value: computation in progress
    private final Map<String, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

    public RedisStatsCache(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public <T> T getOrCompute(CacheKey key, Duration ttl, TypeReference<T> type, Supplier<T> compute) {
        String redisKey = key.render();

        // 1. Cached?
        T cached = read(redisKey, type);
        if (cached != null) {
            log.debug("Cache hit {}", redisKey);
            return cached;
        }

        // 2. Someone else already computing it?
        CompletableFuture<Object> mine = new CompletableFuture<>();
        CompletableFuture<Object> running = inFlight.putIfAbsent(redisKey, mine);
        if (running != null) {
            log.debug("Joining in-flight computation for {}", redisKey);
            return await(running);
        }

        // 3. Compute, store, publish to waiters
        log.debug("Cache miss {}", redisKey);
        try {
            T value = compute.get();
            write(redisKey, value, ttl);
            mine.complete(value);
            return value;
        } catch (RuntimeException e) {
            mine.completeExceptionally(e);
            throw e;
        } finally {
            inFlight.remove(redisKey, mine);
        }
    }

    private <T> T read(String redisKey, TypeReference<T> type) {
        String json = redisTemplate.opsForValue().get(redisKey);
        if (json == null) {
            return null;
        }
        try {
            return objectMapper.readValue(json, type);
        } catch (JsonProcessingException e) {
            log.warn("Discarding unreadable cache entry {}: {}", redisKey, e.getOriginalMessage());
            return null;
        }
    }

    private void write(String redisKey, Object value, Duration ttl) {
        try {
            redisTemplate.opsForValue().set(redisKey, objectMapper.writeValueAsString(value), ttl);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise cache value for " + redisKey, e);
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> T await(CompletableFuture<Object> running) {
        try {
            return (T) running.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException cause) {
                throw cause;
            }
            throw e;
        }
    }
}
