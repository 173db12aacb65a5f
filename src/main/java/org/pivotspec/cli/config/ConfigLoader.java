package org.pivotspec.cli.config;

import java.io.File;
import java.net.URISyntaxException;
import java.security.CodeSource;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

/**
 * Locates and composes the HOCON configuration of the command line tool.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Java system properties ({@code -Dpivotspec.session.debounce=500ms})</li>
 *   <li>Environment variables</li>
 *   <li>The discovered configuration file, if any</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * <p>
 * The reference layer is loaded unresolved, so substitutions in {@code reference.conf} see
 * the values overridden by the layers above it.
 */
public final class ConfigLoader {

    /** Root path of all library settings. */
    public static final String ROOT = "pivotspec";

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "pivotspec.conf";

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Severity of a resolution message.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives progress messages while the configuration file is being located.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        /**
         * @param level   severity
         * @param message human-readable description
         */
        void log(MessageLevel level, String message);
    }

    /**
     * Locates the configuration file and composes the configuration. The first of these wins:
     * <ol>
     *   <li>the file given with {@code --config}</li>
     *   <li>the file given with {@code -Dconfig.file}</li>
     *   <li>{@code config/pivotspec.conf} in the working directory</li>
     *   <li>{@code config/pivotspec.conf} next to the installation's {@code lib} directory</li>
     *   <li>no file: classpath defaults only</li>
     * </ol>
     *
     * @param explicitConfigFile file from the command line, or null
     * @param handler            receives resolution messages
     * @return the resolved configuration
     * @throws IllegalArgumentException                if an explicitly named file does not exist
     * @throws com.typesafe.config.ConfigException     if the configuration cannot be parsed or resolved
     */
    public static Config resolve(File explicitConfigFile, ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            requireExists(explicitConfigFile, "Configuration file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            requireExists(systemConfigFile, "Configuration file named by -Dconfig.file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file from -Dconfig.file: "
                + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        File workingDirFile = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirFile.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + workingDirFile.getAbsolutePath());
            return loadFromFile(workingDirFile);
        }

        File installationFile = installationConfigFile();
        if (installationFile != null) {
            handler.log(MessageLevel.INFO, "Using installation configuration file "
                + installationFile.getAbsolutePath());
            return loadFromFile(installationFile);
        }

        handler.log(MessageLevel.WARN, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME
            + " found, using built-in defaults");
        return loadDefaults();
    }

    /**
     * Returns a subtree of the library settings, or an empty config if it is absent.
     *
     * @param config resolved configuration
     * @param path   path below {@code pivotspec}, e.g. {@code distinct}
     * @return the subtree
     */
    public static Config section(Config config, String path) {
        String fullPath = ROOT + "." + path;
        return config.hasPath(fullPath) ? config.getConfig(fullPath) : ConfigFactory.empty();
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

    private static void requireExists(File file, String message) {
        if (!file.exists()) {
            throw new IllegalArgumentException(message + file.getAbsolutePath());
        }
    }

    /**
     * Infers the installation directory from the location of the running jar
     * ({@code APP_HOME/lib/pivotspec.jar}) and returns {@code APP_HOME/config/pivotspec.conf}.
     *
     * @return the file, or null if it cannot be determined or does not exist
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
        if (!location.isFile() || location.getParentFile() == null) {
            // Classes directory during development; the working directory lookup covers it.
            return null;
        }
        File appHome = location.getParentFile().getParentFile();
        if (appHome == null) {
            return null;
        }
        File configFile = new File(new File(appHome, CONFIG_DIR), CONFIG_FILE_NAME);
        return configFile.exists() ? configFile : null;
    }
}
