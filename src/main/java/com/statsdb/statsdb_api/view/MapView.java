package com.statsdb.statsdb_api.view;

import com.statsdb.statsdb_api.dto.MapDTO;
import com.statsdb.statsdb_api.dto.TopRaceEntry;
import com.statsdb.statsdb_api.model.Game;

import java.util.List;

/**
 * @param gameTime   summed duration of every game on the map, seconds
 * @param playerTime summed active time of every player in those games, seconds
 */
public record MapView(String name, List<Long> gameIds, Game first, Game latest,
                      long gameTime, long playerTime) implements GameHistory {

    public MapView {
        gameIds = List.copyOf(gameIds);
    }

    public MapDTO toRecord(List<TopRaceEntry> topRaces) {
        return new MapDTO(name, gameIds, topRaces);
    }
}
