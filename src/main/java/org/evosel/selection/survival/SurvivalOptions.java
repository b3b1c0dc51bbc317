package org.evosel.selection.survival;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import org.evosel.selection.sorting.IFrontAssigner;
import org.evosel.selection.sorting.SortAlgorithm;

import java.util.List;

/**
 * Reads the options shared by the survival policies.
 */
final class SurvivalOptions {

    static final String ALGORITHM = "algorithm";
    static final String CONSTRAINTS_AWARE = "constraints-aware";

    private SurvivalOptions() {
        // Utility class - no instantiation
    }

    /**
     * @param options The policy's options block.
     * @return The configured sorter, FAST and constraint-blind unless configured otherwise.
     */
    static IFrontAssigner frontAssigner(Config options) {
        SortAlgorithm algorithm = options.hasPath(ALGORITHM)
                ? SortAlgorithm.fromName(getString(options, ALGORITHM))
                : SortAlgorithm.FAST;
        return algorithm.create(getBoolean(options, CONSTRAINTS_AWARE, false));
    }

    static String getString(Config options, String key) {
        try {
            return options.getString(key);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "': " + e.getMessage(), e);
        }
    }

    static boolean getBoolean(Config options, String key, boolean defaultValue) {
        if (!options.hasPath(key)) {
            return defaultValue;
        }
        try {
            return options.getBoolean(key);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "': " + e.getMessage(), e);
        }
    }

    static List<Integer> getIntList(Config options, String key) {
        try {
            return options.getIntList(key);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "': " + e.getMessage(), e);
        }
    }

    static List<Double> getDoubleList(Config options, String key) {
        try {
            return options.getDoubleList(key);
        } catch (ConfigException e) {
            throw new IllegalArgumentException("Invalid value for '" + key + "': " + e.getMessage(), e);
        }
    }
}
