package com.statsdb.statsdb_api.dto;

import java.util.List;

public record ModeDTO(String name, List<Long> gameIds) {}
