package org.pysymphony.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.security.CodeSource;

/**
 * Loads the HOCON configuration of the command line tools.
 * <p>
 * Precedence, highest first: Java system properties, environment variables, the selected
 * configuration file, then {@code reference.conf} from the classpath. Substitutions are
 * resolved only after all layers are stacked, so a file may override a value that
 * {@code reference.conf} refers to.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "pysymphony.conf";

    private ConfigLoader() {
    }

    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is being selected.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {
        void log(MessageLevel level, String message);
    }

    /**
     * Selects the configuration file and loads it. The first match wins:
     * <ol>
     *   <li>the file passed with {@code --config},</li>
     *   <li>the file named by {@code -Dconfig.file},</li>
     *   <li>{@code config/pysymphony.conf} in the working directory,</li>
     *   <li>{@code config/pysymphony.conf} in the installation directory,</li>
     *   <li>no file: classpath defaults only.</li>
     * </ol>
     *
     * @param explicitConfigFile The {@code --config} value, or {@code null}.
     * @param handler            Receives which file was chosen.
     * @return The resolved configuration.
     * @throws IllegalArgumentException                if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException     if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(File explicitConfigFile, ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            return loadRequired(explicitConfigFile, "--config", handler);
        }

        String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            return loadRequired(new File(systemConfigPath).getAbsoluteFile(), "-Dconfig.file", handler);
        }

        File workingDirectoryFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirectoryFile.isFile()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + workingDirectoryFile.getAbsolutePath());
            return loadFromFile(workingDirectoryFile);
        }

        File installationFile = installationConfigFile();
        if (installationFile != null) {
            handler.log(MessageLevel.INFO, "Using installation configuration file " + installationFile.getAbsolutePath());
            return loadFromFile(installationFile);
        }

        handler.log(MessageLevel.INFO, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME + " found, using defaults");
        return loadDefaults();
    }

    static Config loadFromFile(File configFile) {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.parseFile(configFile))
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(ConfigFactory.defaultReferenceUnresolved())
                .resolve();
    }

    private static Config loadRequired(File file, String origin, ConfigMessageHandler handler) {
        if (!file.isFile()) {
            throw new IllegalArgumentException("Configuration file given by " + origin + " not found: "
                    + file.getAbsolutePath());
        }
        handler.log(MessageLevel.INFO, "Using configuration file given by " + origin + ": " + file.getAbsolutePath());
        return loadFromFile(file);
    }

    /**
     * The distribution layout is {@code <home>/lib/pysymphony.jar} next to
     * {@code <home>/config/pysymphony.conf}.
     *
     * @return The installation's configuration file, or {@code null} if there is none.
     */
    private static File installationConfigFile() {
        CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null || codeSource.getLocation() == null) {
            return null;
        }
        File location;
        try {
            location = new File(codeSource.getLocation().toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        File home = location;
        if (location.isFile()) {
            File lib = location.getParentFile();
            home = lib == null ? null : lib.getParentFile();
        }
        if (home == null) {
            return null;
        }
        File candidate = new File(new File(home, CONFIG_DIR), CONFIG_FILE_NAME);
        return candidate.isFile() ? candidate : null;
    }
}
