package com.statsdb.statsdb_api.view;

import com.statsdb.statsdb_api.dto.MutatorDTO;

import java.util.List;

/** A mutator, possibly qualified as {@code <mode>-<mutator>}, and its games. */
public record MutatorView(String name, List<Long> gameIds) implements GameHistory {

    public MutatorView {
        gameIds = List.copyOf(gameIds);
    }

    public MutatorDTO toRecord() {
        return new MutatorDTO(name, gameIds);
    }
}
