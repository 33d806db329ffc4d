package com.statsdb.statsdb_api.service;

import java.util.Collections;
import java.util.Map;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Identity of a cached computation: which entity, which method, which arguments.
 * Arguments are kept sorted by name so argument order never changes the key.
 */
public record CacheKey(String kind, String identity, String method, SortedMap<String, Object> args) {

    private static final String PREFIX = "statsdb";

    public static CacheKey of(String kind, String identity, String method, Map<String, ?> args) {
        return new CacheKey(kind, identity, method, Collections.unmodifiableSortedMap(new TreeMap<>(args)));
    }

    /** Format: {@code statsdb:<kind>:<identity>:<method>[:<arg>=<value>]...} */
    public String render() {
        StringBuilder key = new StringBuilder(PREFIX)
                .append(':').append(kind)
                .append(':').append(escape(identity))
                .append(':').append(method);
        args.forEach((name, value) ->
                key.append(':').append(name).append('=').append(escape(String.valueOf(value))));
        return key.toString();
    }

    // Handles may contain the separator.
    private static String escape(String part) {
        return part.replace("%", "%25").replace(":", "%3A");
    }
}
