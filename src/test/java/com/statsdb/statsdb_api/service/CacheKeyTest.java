package com.statsdb.statsdb_api.service;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CacheKeyTest {

    @Test
    @DisplayName("render_includesKindIdentityMethodAndArgs")
    void render_includesKindIdentityMethodAndArgs() {
        CacheKey key = CacheKey.of("player", "Ace", "dpm", Map.of("window", 10));

        assertEquals("statsdb:player:Ace:dpm:window=10", key.render());
    }

    @Test
    @DisplayName("render_argumentOrderDoesNotMatter")
    void render_argumentOrderDoesNotMatter() {
        Map<String, Object> ab = new LinkedHashMap<>();
        ab.put("b", 2);
        ab.put("a", 1);
        Map<String, Object> ba = new LinkedHashMap<>();
        ba.put("a", 1);
        ba.put("b", 2);

        CacheKey first = CacheKey.of("map", "maze", "races", ab);
        CacheKey second = CacheKey.of("map", "maze", "races", ba);

        assertEquals(first, second);
        assertEquals("statsdb:map:maze:races:a=1:b=2", first.render());
    }

    @Test
    @DisplayName("render_escapesSeparatorInHandles")
    void render_escapesSeparatorInHandles() {
        CacheKey tricky = CacheKey.of("player", "a:b%", "kdr", Map.of());

        assertEquals("statsdb:player:a%3Ab%25:kdr", tricky.render());
        assertNotEquals(CacheKey.of("player", "a", "kdr", Map.of()).render(), tricky.render());
    }

    @Test
    @DisplayName("differentWindows_differentKeys")
    void differentWindows_differentKeys() {
        assertNotEquals(
                CacheKey.of("player", "Ace", "dpm", Map.of("window", 0)).render(),
                CacheKey.of("player", "Ace", "dpm", Map.of("window", 5)).render());
    }
}
