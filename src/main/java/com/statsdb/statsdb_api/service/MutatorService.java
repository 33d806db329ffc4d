package com.statsdb.statsdb_api.service;

import com.statsdb.statsdb_api.config.RulesetCatalog;
import com.statsdb.statsdb_api.repository.GameRepository;
import com.statsdb.statsdb_api.view.MutatorView;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

@Service
@Transactional(readOnly = true)
public class MutatorService extends EntityResolver<MutatorView> {

    private final RulesetCatalog catalog;
    private final GameRepository gameRepository;
    private final GameFilters filters;

    public MutatorService(RulesetCatalog catalog, GameRepository gameRepository, GameFilters filters) {
        this.catalog = catalog;
        this.gameRepository = gameRepository;
        this.filters = filters;
    }

    @Override
    public String kind() {
        return "mutator";
    }

    @Override
    public List<String> list() {
        return catalog.mutatorNames();
    }

    // "race-timed" resolves to race games with the timed bit; plain names match any mode.
    @Override
    protected MutatorView load(String name) {
        return new MutatorView(name, gameRepository.findIdsMatching(filters.hasMutator(name)));
    }
}
