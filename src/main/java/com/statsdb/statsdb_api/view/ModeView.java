package com.statsdb.statsdb_api.view;

import com.statsdb.statsdb_api.dto.ModeDTO;

import java.util.List;

public record ModeView(String name, String longName, List<Long> gameIds) implements GameHistory {

    public ModeView {
        gameIds = List.copyOf(gameIds);
    }

    public String modeStr(boolean shortName) {
        return shortName ? name : longName;
    }

    public ModeDTO toRecord() {
        return new ModeDTO(name, gameIds);
    }
}
