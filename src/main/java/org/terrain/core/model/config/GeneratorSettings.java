package org.terrain.core.model.config;

import java.util.function.Function;

/**
 * Tunables of one generation run. Elevations are in normalized heightmap units [0, 1].
 *
 * Every field can be overridden by a system property {@code terrain.<field>} or the local
 * properties file (see {@link LocalSettingsLoader}).
 */
public class GeneratorSettings {

    // --- Heightmap (diamond-square) ---
    public int perturbRange = 256;
    public double perturbDecrease = 0.35;

    // --- Elevation bands ---
    /** At or below: candidate sea. */
    public double seaLevel = 96 / 255.0;
    /** At or above: mountain, river source. */
    public double mountainLevel = 192 / 255.0;
    /** Width of the hills band below mountainLevel. */
    public double biomeBand = 15 / 255.0;

    // --- Sea ---
    /** Border-connected water bodies smaller than this stay land. */
    public int minSeaSize = 16;

    // --- Rivers ---
    public double riverDensity = 0.025;
    public int minRiverSources = 4;
    public int maxRiverSources = 255;

    // --- Biomes ---
    /** Forest/desert patches smaller than this revert to plains. */
    public int minBiomeSize = 8;
    /** Steps to sea or river that still count as moist (forest). */
    public int forestWaterReach = 2;
    /** Dry lowland at or below this is plains, above is desert. */
    public double plainsCeiling = 0.55;

    // --- Cities ---
    public double cityDensity = 0.005;
    public int minCities = 2;
    /** Minimum size of the contiguous land mass a city may stand on. */
    public int minPopSupportSize = 12;
    /** dimension / factor gives the minimum distance between two cities. */
    public int cityClosenessFactor = 8;
    public int minCityDistance = 2;
    public int maxCityDisallowRadius = 40;
    public double maxCitySlope = 0.15;

    // --- Roads (movement points) ---
    public double mpBase = 1.0;
    public double mpPenaltyDesert = -0.2;
    public double mpPenaltyForest = 0.5;
    public double mpPenaltyHills = 0.5;
    public double mpPenaltyMountain = 2.0;
    /** Per 1/255 of elevation change between two cells. */
    public double mpPenaltyElevation = 0.08;
    public double mpBridge = 5.0;
    public double mpRoad = 0.2;

    public GeneratorSettings() {
    }

    public static GeneratorSettings defaults() {
        return new GeneratorSettings();
    }

    /** Defaults, then the local properties file, then system properties. */
    public static GeneratorSettings fromEnvironment() {
        GeneratorSettings s = new GeneratorSettings();
        LocalSettingsLoader.apply(s);
        s.applyOverridesFromSystem();
        return s;
    }

    public void applyOverridesFromSystem() {
        applyOverrides(key -> System.getProperty("terrain." + key));
    }

    /**
     * Overrides each field whose key resolves to a parseable value. Keys are the field names.
     */
    public void applyOverrides(Function<String, String> lookup) {
        perturbRange = ipick(lookup, "perturbRange", perturbRange);
        perturbDecrease = dpick(lookup, "perturbDecrease", perturbDecrease);

        seaLevel = dpick(lookup, "seaLevel", seaLevel);
        mountainLevel = dpick(lookup, "mountainLevel", mountainLevel);
        biomeBand = dpick(lookup, "biomeBand", biomeBand);

        minSeaSize = ipick(lookup, "minSeaSize", minSeaSize);

        riverDensity = dpick(lookup, "riverDensity", riverDensity);
        minRiverSources = ipick(lookup, "minRiverSources", minRiverSources);
        maxRiverSources = ipick(lookup, "maxRiverSources", maxRiverSources);

        minBiomeSize = ipick(lookup, "minBiomeSize", minBiomeSize);
        forestWaterReach = ipick(lookup, "forestWaterReach", forestWaterReach);
        plainsCeiling = dpick(lookup, "plainsCeiling", plainsCeiling);

        cityDensity = dpick(lookup, "cityDensity", cityDensity);
        minCities = ipick(lookup, "minCities", minCities);
        minPopSupportSize = ipick(lookup, "minPopSupportSize", minPopSupportSize);
        cityClosenessFactor = ipick(lookup, "cityClosenessFactor", cityClosenessFactor);
        minCityDistance = ipick(lookup, "minCityDistance", minCityDistance);
        maxCityDisallowRadius = ipick(lookup, "maxCityDisallowRadius", maxCityDisallowRadius);
        maxCitySlope = dpick(lookup, "maxCitySlope", maxCitySlope);

        mpBase = dpick(lookup, "mpBase", mpBase);
        mpPenaltyDesert = dpick(lookup, "mpPenaltyDesert", mpPenaltyDesert);
        mpPenaltyForest = dpick(lookup, "mpPenaltyForest", mpPenaltyForest);
        mpPenaltyHills = dpick(lookup, "mpPenaltyHills", mpPenaltyHills);
        mpPenaltyMountain = dpick(lookup, "mpPenaltyMountain", mpPenaltyMountain);
        mpPenaltyElevation = dpick(lookup, "mpPenaltyElevation", mpPenaltyElevation);
        mpBridge = dpick(lookup, "mpBridge", mpBridge);
        mpRoad = dpick(lookup, "mpRoad", mpRoad);
    }

    public GeneratorSettings copy() {
        GeneratorSettings c = new GeneratorSettings();
        c.perturbRange = perturbRange;
        c.perturbDecrease = perturbDecrease;
        c.seaLevel = seaLevel;
        c.mountainLevel = mountainLevel;
        c.biomeBand = biomeBand;
        c.minSeaSize = minSeaSize;
        c.riverDensity = riverDensity;
        c.minRiverSources = minRiverSources;
        c.maxRiverSources = maxRiverSources;
        c.minBiomeSize = minBiomeSize;
        c.forestWaterReach = forestWaterReach;
        c.plainsCeiling = plainsCeiling;
        c.cityDensity = cityDensity;
        c.minCities = minCities;
        c.minPopSupportSize = minPopSupportSize;
        c.cityClosenessFactor = cityClosenessFactor;
        c.minCityDistance = minCityDistance;
        c.maxCityDisallowRadius = maxCityDisallowRadius;
        c.maxCitySlope = maxCitySlope;
        c.mpBase = mpBase;
        c.mpPenaltyDesert = mpPenaltyDesert;
        c.mpPenaltyForest = mpPenaltyForest;
        c.mpPenaltyHills = mpPenaltyHills;
        c.mpPenaltyMountain = mpPenaltyMountain;
        c.mpPenaltyElevation = mpPenaltyElevation;
        c.mpBridge = mpBridge;
        c.mpRoad = mpRoad;
        return c;
    }

    private static double dpick(Function<String, String> lookup, String key, double fallback) {
        String raw = lookup.apply(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }

    private static int ipick(Function<String, String> lookup, String key, int fallback) {
        String raw = lookup.apply(key);
        if (raw == null || raw.isBlank()) return fallback;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException ignored) {
            return fallback;
        }
    }
}
