package com.statsdb.statsdb_api.controller;

import com.statsdb.statsdb_api.dto.MapDTO;
import com.statsdb.statsdb_api.dto.TopRaceEntry;
import com.statsdb.statsdb_api.service.MapService;
import com.statsdb.statsdb_api.service.Pagination;
import com.statsdb.statsdb_api.service.StatsAggregator;
import com.statsdb.statsdb_api.view.MapView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/maps")
public class MapController {
    private static final Logger log = LoggerFactory.getLogger(MapController.class);

    private final MapService mapService;
    private final StatsAggregator aggregator;
    private final int pageSize;

    public MapController(MapService mapService,
                         StatsAggregator aggregator,
                         @Value("${statsdb.api.page-size:25}") int pageSize) {
        this.mapService = mapService;
        this.aggregator = aggregator;
        this.pageSize = pageSize;
    }

    /**
     * GET /api/maps?page=0&race=false
     * With race=true only maps that have timed race games are listed.
     */
    @GetMapping
    public ResponseEntity<Pagination<MapSummaryDTO>> listMaps(
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "false") boolean race) {

        return ResponseEntity.ok(mapService.paginate(page, pageSize, race).map(MapSummaryDTO::from));
    }

    /**
     * GET /api/maps/{name}
     */
    @GetMapping("/{name}")
    public ResponseEntity<MapDTO> getMap(@PathVariable String name) {
        MapView map = mapService.resolve(name);
        log.info("Map {} with {} games", name, map.gameIds().size());
        return ResponseEntity.ok(map.toRecord(aggregator.topRaces(map, false)));
    }

    /**
     * GET /api/maps/{name}/races?endurance=false
     */
    @GetMapping("/{name}/races")
    public ResponseEntity<List<TopRaceEntry>> getTopRaces(
            @PathVariable String name,
            @RequestParam(defaultValue = "false") boolean endurance) {

        MapView map = mapService.resolve(name);
        return ResponseEntity.ok(aggregator.topRaces(map, endurance));
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    /** Listing row: no race table, which would cost a query per map. */
    public record MapSummaryDTO(String name, int games, long gameTime, long playerTime) {

        static MapSummaryDTO from(MapView map) {
            return new MapSummaryDTO(map.name(), map.gameIds().size(), map.gameTime(), map.playerTime());
        }
    }
}
