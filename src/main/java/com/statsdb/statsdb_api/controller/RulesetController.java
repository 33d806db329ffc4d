package com.statsdb.statsdb_api.controller;

import com.statsdb.statsdb_api.dto.ModeDTO;
import com.statsdb.statsdb_api.dto.MutatorDTO;
import com.statsdb.statsdb_api.dto.WeaponDTO;
import com.statsdb.statsdb_api.service.ModeService;
import com.statsdb.statsdb_api.service.MutatorService;
import com.statsdb.statsdb_api.service.WeaponService;
import com.statsdb.statsdb_api.view.ModeView;
import com.statsdb.statsdb_api.view.MutatorView;
import com.statsdb.statsdb_api.view.WeaponSummary;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

/**
 * Modes, mutators and weapons: the names come from the ruleset catalog, the
 * numbers from the games.
 */
@RestController
@RequestMapping("/api")
public class RulesetController {

    private final ModeService modeService;
    private final MutatorService mutatorService;
    private final WeaponService weaponService;

    public RulesetController(ModeService modeService,
                             MutatorService mutatorService,
                             WeaponService weaponService) {
        this.modeService = modeService;
        this.mutatorService = mutatorService;
        this.weaponService = weaponService;
    }

    // =========================================================================
    // Modes
    // =========================================================================

    /**
     * GET /api/modes
     */
    @GetMapping("/modes")
    public ResponseEntity<List<ModeSummaryDTO>> listModes() {
        return ResponseEntity.ok(modeService.all().stream()
                .map(m -> new ModeSummaryDTO(m.name(), m.modeStr(false), m.gameIds().size()))
                .toList());
    }

    /**
     * GET /api/modes/{name}
     */
    @GetMapping("/modes/{name}")
    public ResponseEntity<ModeDTO> getMode(@PathVariable String name) {
        ModeView mode = modeService.resolve(name);
        return ResponseEntity.ok(mode.toRecord());
    }

    // =========================================================================
    // Mutators
    // =========================================================================

    /**
     * GET /api/mutators
     */
    @GetMapping("/mutators")
    public ResponseEntity<List<String>> listMutators() {
        return ResponseEntity.ok(mutatorService.list());
    }

    /**
     * GET /api/mutators/{name}
     * Mode specific mutators are addressed as {mode}-{mutator}, e.g. race-timed.
     */
    @GetMapping("/mutators/{name}")
    public ResponseEntity<MutatorDTO> getMutator(@PathVariable String name) {
        MutatorView mutator = mutatorService.resolve(name);
        return ResponseEntity.ok(mutator.toRecord());
    }

    // =========================================================================
    // Weapons
    // =========================================================================

    /**
     * GET /api/weapons
     */
    @GetMapping("/weapons")
    public ResponseEntity<List<WeaponDTO>> listWeapons() {
        return ResponseEntity.ok(weaponService.all().stream().map(WeaponSummary::toRecord).toList());
    }

    /**
     * GET /api/weapons/{name}
     */
    @GetMapping("/weapons/{name}")
    public ResponseEntity<WeaponDTO> getWeapon(@PathVariable String name) {
        return ResponseEntity.ok(weaponService.resolve(name).toRecord());
    }

    public record ModeSummaryDTO(String name, String longName, int games) {}
}
