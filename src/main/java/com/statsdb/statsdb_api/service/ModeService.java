package com.statsdb.statsdb_api.service;

import com.statsdb.statsdb_api.config.RulesetCatalog;
import com.statsdb.statsdb_api.repository.GameRepository;
import com.statsdb.statsdb_api.view.ModeView;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Modes come from the ruleset catalog; their games are found by pushing the
 * mode filter down to the games table.
 */
@Service
@Transactional(readOnly = true)
public class ModeService extends EntityResolver<ModeView> {

    private final RulesetCatalog catalog;
    private final GameRepository gameRepository;
    private final GameFilters filters;

    public ModeService(RulesetCatalog catalog, GameRepository gameRepository, GameFilters filters) {
        this.catalog = catalog;
        this.gameRepository = gameRepository;
        this.filters = filters;
    }

    @Override
    public String kind() {
        return "mode";
    }

    @Override
    public List<String> list() {
        return catalog.modeNames();
    }

    @Override
    protected ModeView load(String name) {
        return new ModeView(name, catalog.longName(name),
                gameRepository.findIdsMatching(filters.hasMode(name)));
    }
}
