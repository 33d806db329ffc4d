package com.statsdb.statsdb_api.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;
import java.util.Map;

/**
 * Raw ruleset metadata as bound from {@code statsdb.ruleset.*}.
 * Only read once, by {@link StatsConfig}, to build the {@link RulesetCatalog}.
 *
 * @param modes                     every mode in index order (index = stored games.mode)
 * @param longNames                 display names by mode
 * @param hiddenModes               modes never listed (non-competitive)
 * @param mutators                  base mutators in bit order
 * @param modeMutators              mode specific mutators, in game-specific bit order
 * @param weapons                   weapon names in display order
 * @param passiveWeapons            weapons whose time is loadout time, not wielded time
 * @param nonStandardWeaponMutators mutators that replace the stock weapon set
 */
@ConfigurationProperties(prefix = "statsdb.ruleset")
public record RulesetProperties(
        List<String> modes,
        Map<String, String> longNames,
        List<String> hiddenModes,
        List<String> mutators,
        Map<String, List<String>> modeMutators,
        List<String> weapons,
        List<String> passiveWeapons,
        List<String> nonStandardWeaponMutators
) {}
