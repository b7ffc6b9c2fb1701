package org.otelbuffer.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Composes the application configuration.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Java system properties ({@code -Dotelbuffer.buffer.maxChunks=64})</li>
 *   <li>One configuration file: the explicit file, else {@code -Dconfig.file}, else
 *       {@code config/otelbuffer.conf} in the working directory</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved after all layers are composed, so overriding a referenced value
 * propagates to every reference.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /** Root path of all settings. */
    public static final String ROOT = "otelbuffer";

    static final Path WORKING_DIR_CONFIG = Path.of("config", "otelbuffer.conf");

    private ConfigLoader() {
    }

    /**
     * Loads the configuration.
     *
     * @param explicitFile configuration file given by the caller, or null to discover one
     * @return the resolved configuration
     * @throws IllegalArgumentException if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or resolved
     */
    public static Config load(Path explicitFile) {
        Path file = locate(explicitFile);
        Config layered = ConfigFactory.systemProperties();
        if (file != null) {
            log.info("Using configuration file {}", file.toAbsolutePath());
            layered = layered.withFallback(ConfigFactory.parseFile(file.toFile()));
        } else {
            log.debug("No configuration file found, using defaults");
        }
        return layered.withFallback(ConfigFactory.defaultReferenceUnresolved()).resolve();
    }

    /**
     * Loads the configuration and returns the subtree of one component.
     *
     * @param explicitFile configuration file, or null
     * @param section      e.g. {@code buffer}, {@code ingest}
     * @return the {@code otelbuffer.<section>} subtree
     */
    public static Config loadSection(Path explicitFile, String section) {
        return load(explicitFile).getConfig(ROOT + "." + section);
    }

    static Path locate(Path explicitFile) {
        if (explicitFile != null) {
            if (!Files.isRegularFile(explicitFile)) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitFile.toAbsolutePath());
            }
            return explicitFile;
        }
        String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            Path systemFile = Path.of(systemConfigPath).toAbsolutePath();
            if (!Files.isRegularFile(systemFile)) {
                throw new IllegalArgumentException("Configuration file specified via -Dconfig.file not found: " + systemFile);
            }
            return systemFile;
        }
        return Files.isRegularFile(WORKING_DIR_CONFIG) ? WORKING_DIR_CONFIG : null;
    }
}
