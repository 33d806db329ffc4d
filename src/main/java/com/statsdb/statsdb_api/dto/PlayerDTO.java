package com.statsdb.statsdb_api.dto;

import java.util.List;

public record PlayerDTO(String handle, List<Long> gameIds) {}
