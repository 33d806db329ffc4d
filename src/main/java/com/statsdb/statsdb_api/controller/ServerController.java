package com.statsdb.statsdb_api.controller;

import com.statsdb.statsdb_api.dto.GameDTO;
import com.statsdb.statsdb_api.dto.ServerDTO;
import com.statsdb.statsdb_api.service.GameService;
import com.statsdb.statsdb_api.service.Pagination;
import com.statsdb.statsdb_api.service.ServerService;
import com.statsdb.statsdb_api.view.ServerView;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/servers")
public class ServerController {
    private static final Logger log = LoggerFactory.getLogger(ServerController.class);

    private final ServerService serverService;
    private final GameService gameService;
    private final int pageSize;

    public ServerController(ServerService serverService,
                            GameService gameService,
                            @Value("${statsdb.api.page-size:25}") int pageSize) {
        this.serverService = serverService;
        this.gameService = gameService;
        this.pageSize = pageSize;
    }

    /**
     * GET /api/servers?page=0
     */
    @GetMapping
    public ResponseEntity<Pagination<ServerDTO>> listServers(@RequestParam(defaultValue = "0") int page) {
        return ResponseEntity.ok(serverService.paginate(page, pageSize).map(ServerView::toRecord));
    }

    /**
     * GET /api/servers/{handle}
     */
    @GetMapping("/{handle}")
    public ResponseEntity<ServerDTO> getServer(@PathVariable String handle) {
        ServerView server = serverService.resolve(handle);
        log.info("Server {} with {} games", handle, server.gameIds().size());
        return ResponseEntity.ok(server.toRecord());
    }

    /**
     * GET /api/servers/{handle}/games?page=0
     */
    @GetMapping("/{handle}/games")
    public ResponseEntity<Pagination<GameDTO>> getServerGames(
            @PathVariable String handle,
            @RequestParam(defaultValue = "0") int page) {

        ServerView server = serverService.resolve(handle);
        return ResponseEntity.ok(gameService.gamesPaginate(server, page, pageSize).map(GameDTO::from));
    }
}
