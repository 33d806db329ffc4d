package com.statsdb.statsdb_api.controller;

import com.statsdb.statsdb_api.dto.GameDTO;
import com.statsdb.statsdb_api.dto.PlayerDTO;
import com.statsdb.statsdb_api.dto.TopMapEntry;
import com.statsdb.statsdb_api.dto.WeaponDTO;
import com.statsdb.statsdb_api.service.GameService;
import com.statsdb.statsdb_api.service.Pagination;
import com.statsdb.statsdb_api.service.PlayerService;
import com.statsdb.statsdb_api.service.PlayerStatsService;
import com.statsdb.statsdb_api.service.WeaponService;
import com.statsdb.statsdb_api.view.PlayerView;
import com.statsdb.statsdb_api.view.WeaponSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/players")
public class PlayerController {
    private static final Logger log = LoggerFactory.getLogger(PlayerController.class);

    private final PlayerService playerService;
    private final PlayerStatsService statsService;
    private final GameService gameService;
    private final WeaponService weaponService;
    private final int pageSize;

    public PlayerController(PlayerService playerService,
                            PlayerStatsService statsService,
                            GameService gameService,
                            WeaponService weaponService,
                            @Value("${statsdb.api.page-size:25}") int pageSize) {
        this.playerService = playerService;
        this.statsService = statsService;
        this.gameService = gameService;
        this.weaponService = weaponService;
        this.pageSize = pageSize;
    }

    // =========================================================================
    // Listing
    // =========================================================================

    /**
     * GET /api/players?page=0
     */
    @GetMapping
    public ResponseEntity<Pagination<PlayerDTO>> listPlayers(@RequestParam(defaultValue = "0") int page) {
        return ResponseEntity.ok(playerService.paginate(page, pageSize).map(PlayerView::toRecord));
    }

    // =========================================================================
    // Player profile
    // =========================================================================

    /**
     * GET /api/players/{handle}?window=0
     * Ratios and top maps over the last {@code window} games (0 = all).
     */
    @GetMapping("/{handle}")
    public ResponseEntity<PlayerProfileDTO> getPlayer(
            @PathVariable String handle,
            @RequestParam(defaultValue = "0") int window) {

        PlayerView player = playerService.resolve(handle);
        log.info("Player profile for {} over window {}", handle, window);

        return ResponseEntity.ok(new PlayerProfileDTO(
                player.toRecord(),
                player.latest() != null ? player.latest().getName() : null,
                statsService.dpm(player, window),
                statsService.fpm(player, window),
                statsService.kdr(player, window),
                statsService.dfr(player, window),
                statsService.topMaps(player, window)
        ));
    }

    /**
     * GET /api/players/{handle}/games?page=0
     */
    @GetMapping("/{handle}/games")
    public ResponseEntity<Pagination<GameDTO>> getPlayerGames(
            @PathVariable String handle,
            @RequestParam(defaultValue = "0") int page) {

        PlayerView player = playerService.resolve(handle);
        return ResponseEntity.ok(gameService.gamesPaginate(player, page, pageSize).map(GameDTO::from));
    }

    /**
     * GET /api/players/{handle}/weapons
     */
    @GetMapping("/{handle}/weapons")
    public ResponseEntity<List<WeaponDTO>> getPlayerWeapons(@PathVariable String handle) {
        PlayerView player = playerService.resolve(handle);
        return ResponseEntity.ok(weaponService.allFromPlayer(player.handle()).stream()
                .map(WeaponSummary::toRecord)
                .toList());
    }

    // =========================================================================
    // DTOs
    // =========================================================================

    public record PlayerProfileDTO(
            PlayerDTO player,
            String latestName,   // display name in their latest game
            double dpm, double fpm, double kdr, double dfr,
            List<TopMapEntry> topMaps
    ) {}
}
