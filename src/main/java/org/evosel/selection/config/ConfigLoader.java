package org.evosel.selection.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Builds the application config from which a {@code SelectionEngine} reads its
 * {@value #SELECTION_PATH} block.
 * <p>
 * Layers, strongest first: JVM system properties, environment variables, an optional HOCON file,
 * and the library's {@code reference.conf}. The reference layer is parsed unresolved so that its
 * substitutions see values from the stronger layers.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Path of the selection block inside the application config. */
    public static final String SELECTION_PATH = "evosel.selection";

    /** File looked up relative to the working directory when no file is named. */
    public static final String DEFAULT_FILE = "config/evosel.conf";

    private ConfigLoader() {
        // Utility class - no instantiation
    }

    /**
     * Picks the selection config file and loads it.
     * <p>
     * The file is, in order: {@code selectionFile} if given, the path in {@code -Dconfig.file} if set,
     * {@value #DEFAULT_FILE} if it exists. Without any of them only {@code reference.conf} is used.
     *
     * @param selectionFile File named by the caller, may be {@code null}.
     * @return The resolved application config.
     * @throws IllegalArgumentException if a named file (argument or {@code -Dconfig.file}) is missing.
     */
    public static Config resolve(File selectionFile) {
        if (selectionFile != null) {
            return loadFromFile(requireExisting(selectionFile, "Selection config file"));
        }
        String property = System.getProperty("config.file");
        if (property != null && !property.isBlank()) {
            return loadFromFile(requireExisting(new File(property).getAbsoluteFile(), "File from -Dconfig.file"));
        }
        File local = new File(DEFAULT_FILE);
        if (local.isFile()) {
            LOG.info("Loading selection config from {}", local.getAbsolutePath());
            return loadFromFile(local);
        }
        LOG.warn("No {} in {}; using reference.conf", DEFAULT_FILE, new File("").getAbsolutePath());
        return loadDefaults();
    }

    /**
     * @param file A HOCON file.
     * @return System properties over environment over {@code file} over {@code reference.conf}, resolved.
     */
    public static Config loadFromFile(File file) {
        return overrides()
                .withFallback(ConfigFactory.parseFile(file))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    /**
     * @return System properties over environment over {@code reference.conf}, resolved.
     */
    public static Config loadDefaults() {
        return overrides()
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    /**
     * @param root A resolved application config.
     * @return Its {@value #SELECTION_PATH} block.
     * @throws com.typesafe.config.ConfigException.Missing if the block is absent.
     */
    public static Config selection(Config root) {
        return root.getConfig(SELECTION_PATH);
    }

    private static Config overrides() {
        return ConfigFactory.systemProperties().withFallback(ConfigFactory.systemEnvironment());
    }

    private static File requireExisting(File file, String what) {
        if (!file.isFile()) {
            throw new IllegalArgumentException(what + " not found: " + file.getAbsolutePath());
        }
        LOG.info("Loading selection config from {}", file.getAbsolutePath());
        return file;
    }
}
