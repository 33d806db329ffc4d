package com.statsdb.statsdb_api.dto;

import java.util.List;

public record MutatorDTO(String name, List<Long> gameIds) {}
