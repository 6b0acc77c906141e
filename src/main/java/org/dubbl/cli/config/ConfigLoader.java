package org.dubbl.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.net.URL;
import java.security.CodeSource;
import java.security.ProtectionDomain;

/**
 * Loads the application configuration for the CLI.
 * <p>
 * Layers, highest priority first:
 * <ol>
 *   <li>Java system properties ({@code -Darchive.jdbcUrl=...})</li>
 *   <li>Environment variables</li>
 *   <li>The user configuration file, see {@link #resolve(File, ConfigMessageHandler)}</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved only after all layers are stacked, so a user file
 * can override a value that {@code reference.conf} refers to.
 */
public final class ConfigLoader {

    private static final String CONFIG_DIR = "config";
    private static final String CONFIG_FILE_NAME = "dubbl.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a message reported while the configuration file is located.
     */
    public enum MessageLevel {
        /** Which file was picked. */
        INFO,
        /** No file was found and only the built-in defaults apply. */
        WARN
    }

    /**
     * Receives progress messages while the configuration file is located.
     * <p>
     * The CLI forwards them to SLF4J; tests collect them in a list.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        /**
         * Called once per resolution with the outcome of the lookup.
         *
         * @param level   the severity of the message.
         * @param message the human-readable description.
         */
        void log(MessageLevel level, String message);
    }

    /**
     * Locates the user configuration file and loads it. The first match wins:
     * <ol>
     *   <li>the file given with {@code --config}</li>
     *   <li>the file named by {@code -Dconfig.file}</li>
     *   <li>{@code config/dubbl.conf} in the working directory</li>
     *   <li>{@code config/dubbl.conf} in the installation directory</li>
     *   <li>none: {@code reference.conf} only</li>
     * </ol>
     *
     * @param explicitConfigFile file from the CLI option, or {@code null}.
     * @param handler            receives which file was picked.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        // 1) --config
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file not found: " + explicitConfigFile.getAbsolutePath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file given via --config: " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        // 2) -Dconfig.file
        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            if (!systemConfigFile.exists()) {
                throw new IllegalArgumentException(
                        "Configuration file given via -Dconfig.file not found: " + systemConfigFile.getPath());
            }
            handler.log(MessageLevel.INFO,
                    "Using configuration file given via -Dconfig.file: " + systemConfigFile.getPath());
            return loadFromFile(systemConfigFile);
        }

        // 3) config/dubbl.conf relative to the working directory
        final File cwdConfigFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (cwdConfigFile.exists()) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file in working directory: " + cwdConfigFile.getAbsolutePath());
            return loadFromFile(cwdConfigFile);
        }

        // 4) APP_HOME/config/dubbl.conf next to the installed jar
        final File installationConfigFile = detectInstallationConfigFile();
        if (installationConfigFile != null) {
            handler.log(MessageLevel.INFO,
                    "Using configuration file in installation directory: " + installationConfigFile.getAbsolutePath());
            return loadFromFile(installationConfigFile);
        }

        handler.log(MessageLevel.WARN,
                "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME + " found, using built-in defaults.");
        return loadDefaults();
    }

    /**
     * Loads a configuration file on top of {@code reference.conf}. System
     * properties and environment variables still win over the file.
     *
     * @param configFile the file to load.
     * @return the fully resolved configuration.
     */
    static Config loadFromFile(final File configFile) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.parseFile(configFile))
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Loads {@code reference.conf} with system property and environment overrides,
     * for runs without any configuration file.
     *
     * @return the fully resolved configuration.
     */
    static Config loadDefaults() {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    /**
     * Looks for {@code APP_HOME/config/dubbl.conf}, where {@code APP_HOME} is the
     * parent of the directory holding the application jar.
     *
     * @return the file, or {@code null} if there is none.
     */
    private static File detectInstallationConfigFile() {
        final ProtectionDomain protectionDomain = ConfigLoader.class.getProtectionDomain();
        final CodeSource codeSource = protectionDomain != null ? protectionDomain.getCodeSource() : null;
        if (codeSource == null || codeSource.getLocation() == null) {
            return null;
        }
        final URL location = codeSource.getLocation();
        final File jarOrClasses;
        try {
            jarOrClasses = new File(location.toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            // Not a file location (e.g. nested jar); nothing to detect.
            return null;
        }
        if (!jarOrClasses.isFile()) {
            return null;
        }
        final File libDir = jarOrClasses.getParentFile();
        final File appHome = libDir != null ? libDir.getParentFile() : null;
        if (appHome == null) {
            return null;
        }
        final File configFile = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return configFile.exists() ? configFile : null;
    }
}
