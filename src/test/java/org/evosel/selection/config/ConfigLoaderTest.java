package org.evosel.selection.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link ConfigLoader} to verify the configuration priority hierarchy:
 * <ol>
 *   <li>System Properties (highest priority)</li>
 *   <li>Environment Variables</li>
 *   <li>Configuration File</li>
 *   <li>Default reference configuration (lowest priority)</li>
 * </ol>
 */
@Tag("unit")
class ConfigLoaderTest {

    @BeforeEach
    void setUp() {
        ConfigFactory.invalidateCaches();
    }

    @AfterEach
    void tearDown() {
        System.clearProperty("test.value");
        System.clearProperty("test.priority");
        System.clearProperty("test.nested.setting");
        System.clearProperty("config.file");
        System.clearProperty("evosel.selection.sorting.algorithm");
        ConfigFactory.invalidateCaches();
    }

    @Test
    @DisplayName("loadFromFile should load configuration file with defaults when no overrides present")
    void loadFromFile_shouldLoadConfigFileWithDefaults() {
        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("file-value", config.getString("test.value"));
        assertEquals("file-priority", config.getString("test.priority"));
        assertEquals("file-nested", config.getString("test.nested.setting"));
        assertEquals("FAST", config.getString("evosel.selection.sorting.algorithm"));
    }

    @Test
    @DisplayName("File values should override reference.conf")
    void loadFromFile_fileShouldOverrideDefaults() {
        Config selection = ConfigLoader.selection(ConfigLoader.loadFromFile(testResource("test-config.conf")));

        assertEquals(List.of(6), selection.getIntList("survival.options.divisions"));
        assertTrue(selection.getBoolean("survival.options.memory"));
    }

    @Test
    @DisplayName("System property should override file configuration")
    void loadFromFile_systemPropertyShouldOverrideFileConfig() {
        System.setProperty("test.value", "system-value");
        System.setProperty("test.nested.setting", "system-nested");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("test-config.conf"));

        assertEquals("system-value", config.getString("test.value"));
        assertEquals("system-nested", config.getString("test.nested.setting"));
        assertEquals("file-priority", config.getString("test.priority"));
    }

    @Test
    @DisplayName("Should resolve configuration references correctly")
    void loadFromFile_shouldResolveConfigurationReferences() {
        System.setProperty("test.priority", "system-override");
        ConfigFactory.invalidateCaches();

        Config config = ConfigLoader.loadFromFile(testResource("references-config.conf"));

        assertEquals("base-suffix", config.getString("test.referenced-value"));
        assertEquals("system-override", config.getString("test.priority"));
    }

    @Test
    @DisplayName("loadDefaults should expose the selection block from reference.conf")
    void loadDefaults_shouldContainSelectionBlock() {
        Config selection = ConfigLoader.selection(ConfigLoader.loadDefaults());

        assertEquals("FAST", selection.getString("sorting.algorithm"));
        assertFalse(selection.getBoolean("sorting.constraints-aware"));
        assertEquals("org.evosel.selection.survival.ReferencePointSurvival",
                selection.getString("survival.className"));
        assertEquals(List.of(12), selection.getIntList("survival.options.divisions"));
    }

    @Test
    @DisplayName("System property should override reference.conf defaults")
    void loadDefaults_systemPropertyShouldOverrideDefaults() {
        System.setProperty("evosel.selection.sorting.algorithm", "NAIVE");
        ConfigFactory.invalidateCaches();

        Config selection = ConfigLoader.selection(ConfigLoader.loadDefaults());

        assertEquals("NAIVE", selection.getString("sorting.algorithm"));
    }

    @Test
    @DisplayName("resolve should prefer an explicit file over -Dconfig.file")
    void resolve_shouldUseExplicitFile() {
        System.setProperty("config.file", "does-not-exist/evosel.conf");

        Config config = ConfigLoader.resolve(testResource("test-config.conf"));

        assertEquals("file-value", config.getString("test.value"));
    }

    @Test
    @DisplayName("resolve should reject a missing explicit file")
    void resolve_shouldRejectMissingExplicitFile() {
        File missing = new File("does-not-exist/evosel.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> ConfigLoader.resolve(missing));
        assertTrue(e.getMessage().contains("not found"));
    }

    @Test
    @DisplayName("resolve should honour -Dconfig.file")
    void resolve_shouldUseConfigFileProperty() {
        System.setProperty("config.file", testResource("test-config.conf").getAbsolutePath());

        Config config = ConfigLoader.resolve(null);

        assertEquals("file-nested", config.getString("test.nested.setting"));
    }

    @Test
    @DisplayName("resolve should reject a missing -Dconfig.file")
    void resolve_shouldRejectMissingConfigFileProperty() {
        System.setProperty("config.file", "does-not-exist/evosel.conf");

        IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> ConfigLoader.resolve(null));
        assertTrue(e.getMessage().contains("-Dconfig.file"));
    }

    @Test
    @DisplayName("resolve should fall back to classpath defaults")
    void resolve_shouldFallBackToDefaults() {
        Config config = ConfigLoader.resolve(null);

        assertEquals("FAST", ConfigLoader.selection(config).getString("sorting.algorithm"));
        assertFalse(config.hasPath("test.value"));
    }

    /**
     * Locates a test resource file on the classpath.
     *
     * @param name the resource file name (relative to this test class's package).
     * @return the {@link File} pointing to the test resource.
     */
    private File testResource(final String name) {
        final URL url = getClass().getResource(name);
        assertNotNull(url, "Test resource not found: " + name);
        try {
            return new File(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Invalid test resource URI: " + url, e);
        }
    }
}
