package com.statsdb.statsdb_api.dto;

import java.time.LocalDateTime;

/** A handle's best finished race run; lower score is faster. */
public record TopRaceEntry(Long gameId, String handle, String name, int score, LocalDateTime when) {}
