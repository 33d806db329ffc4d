package com.statsdb.statsdb_api.dto;

import com.statsdb.statsdb_api.model.Game;

import java.time.LocalDateTime;

public record GameDTO(Long id, LocalDateTime playedAt, String map, int mode, int mutators, int timePlayed) {

    public static GameDTO from(Game game) {
        return new GameDTO(game.getId(), game.getPlayedAt(), game.getMap(),
                game.getMode(), game.getMutators(), game.getTimePlayed());
    }
}
