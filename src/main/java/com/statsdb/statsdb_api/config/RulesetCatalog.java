package com.statsdb.statsdb_api.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Immutable lookup of the game's ruleset: modes, mutators and weapons.
 *
 * Mutator encoding on stored games:
 *   - base mutator i           -> bit i
 *   - mode specific mutator j  -> bit (baseCount + j), meaning depends on the game's mode
 *
 * Built once at startup and shared; never mutated afterwards.
 */
public class RulesetCatalog {

    public static final char MODE_SEPARATOR = '-';

    private final List<String> modes;
    private final Map<String, String> longNames;
    private final Set<String> hiddenModes;
    private final List<String> mutators;
    private final Map<String, List<String>> modeMutators;
    private final List<String> weapons;
    private final Set<String> passiveWeapons;
    private final List<String> nonStandardWeaponMutators;

    public RulesetCatalog(RulesetProperties properties) {
        this.modes = List.copyOf(properties.modes());
        this.longNames = Map.copyOf(orEmpty(properties.longNames()));
        this.hiddenModes = Set.copyOf(orEmpty(properties.hiddenModes()));
        this.mutators = List.copyOf(properties.mutators());
        this.weapons = List.copyOf(properties.weapons());
        this.passiveWeapons = Set.copyOf(orEmpty(properties.passiveWeapons()));
        this.nonStandardWeaponMutators = List.copyOf(orEmpty(properties.nonStandardWeaponMutators()));

        // Keep mode order for the specific mutators so listings are stable.
        Map<String, List<String>> specific = new LinkedHashMap<>();
        Map<String, List<String>> configured = orEmpty(properties.modeMutators());
        int widest = 0;
        for (String mode : modes) {
            List<String> muts = configured.get(mode);
            if (muts != null && !muts.isEmpty()) {
                specific.put(mode, List.copyOf(muts));
                widest = Math.max(widest, muts.size());
            }
        }
        for (String mode : configured.keySet()) {
            if (!modes.contains(mode)) {
                throw new IllegalStateException("Mode specific mutators configured for unknown mode: " + mode);
            }
        }
        if (mutators.size() + widest > Integer.SIZE - 1) {
            throw new IllegalStateException("Mutator set does not fit the stored mask: "
                    + mutators.size() + " base + " + widest + " mode specific");
        }
        this.modeMutators = Collections.unmodifiableMap(specific);

        for (String mutator : nonStandardWeaponMutators) {
            if (!mutators.contains(mutator)) {
                throw new IllegalStateException("Non-standard weapon mutator is not a base mutator: " + mutator);
            }
        }
    }

    // =========================================================================
    // Modes
    // =========================================================================

    /** Listable modes in index order; hidden modes excluded. */
    public List<String> modeNames() {
        return modes.stream().filter(m -> !hiddenModes.contains(m)).toList();
    }

    public boolean hasMode(String mode) {
        return modes.contains(mode);
    }

    public int modeIndex(String mode) {
        int index = modes.indexOf(mode);
        if (index < 0) {
            throw new IllegalArgumentException("Unknown mode: " + mode);
        }
        return index;
    }

    /** Display name for a mode, falling back to the short name. */
    public String longName(String mode) {
        modeIndex(mode);
        return longNames.getOrDefault(mode, mode);
    }

    // =========================================================================
    // Mutators
    // =========================================================================

    /**
     * Base mutators followed by every mode specific mutator qualified as
     * {@code <mode>-<mutator>}.
     */
    public List<String> mutatorNames() {
        List<String> names = new ArrayList<>(mutators);
        modeMutators.forEach((mode, muts) ->
                muts.forEach(mut -> names.add(mode + MODE_SEPARATOR + mut)));
        return Collections.unmodifiableList(names);
    }

    public boolean isBaseMutator(String mutator) {
        return mutators.contains(mutator);
    }

    /**
     * Bit for a mutator. Mode specific mutators need their mode, since
     * different modes reuse the same bits.
     *
     * @param mode    mode the game is in, may be null for base mutators
     * @param mutator unqualified mutator name
     */
    public int mutatorMask(String mode, String mutator) {
        int base = mutators.indexOf(mutator);
        if (base >= 0) {
            return 1 << base;
        }
        if (mode == null) {
            throw new IllegalArgumentException("Mutator '" + mutator + "' is mode specific; a mode is required");
        }
        modeIndex(mode);
        int specific = modeMutators.getOrDefault(mode, List.of()).indexOf(mutator);
        if (specific < 0) {
            throw new IllegalArgumentException("Unknown mutator '" + mutator + "' for mode " + mode);
        }
        return 1 << (mutators.size() + specific);
    }

    /** Mask of the mutators that swap out the stock weapons. */
    public int nonStandardWeaponsMask() {
        int mask = 0;
        for (String mutator : nonStandardWeaponMutators) {
            mask |= mutatorMask(null, mutator);
        }
        return mask;
    }

    // =========================================================================
    // Weapons
    // =========================================================================

    public List<String> weaponNames() {
        return weapons;
    }

    public boolean hasWeapon(String weapon) {
        return weapons.contains(weapon);
    }

    public boolean isPassiveWeapon(String weapon) {
        return passiveWeapons.contains(weapon);
    }

    private static <T> List<T> orEmpty(List<T> list) {
        return list != null ? list : List.of();
    }

    private static <K, V> Map<K, V> orEmpty(Map<K, V> map) {
        return map != null ? map : Map.of();
    }
}
