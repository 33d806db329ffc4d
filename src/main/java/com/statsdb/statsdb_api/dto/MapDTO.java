package com.statsdb.statsdb_api.dto;

import java.util.List;

public record MapDTO(String name, List<Long> gameIds, List<TopRaceEntry> topRaces) {}
