package com.statsdb.statsdb_api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RulesetProperties.class)
public class StatsConfig {
    private static final Logger log = LoggerFactory.getLogger(StatsConfig.class);

    @Bean
    public RulesetCatalog rulesetCatalog(RulesetProperties properties) {
        RulesetCatalog catalog = new RulesetCatalog(properties);
        log.info("Ruleset loaded: {} modes, {} mutators, {} weapons",
                catalog.modeNames().size(), catalog.mutatorNames().size(), catalog.weaponNames().size());
        return catalog;
    }
}
