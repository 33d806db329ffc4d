package com.statsdb.statsdb_api.dto;

/** A map and how many of the considered games were played on it. */
public record TopMapEntry(String name, long games) {}
