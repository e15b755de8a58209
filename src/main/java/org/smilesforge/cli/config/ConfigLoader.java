package org.smilesforge.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;

import java.io.File;
import java.net.URISyntaxException;
import java.security.CodeSource;

/**
 * Loads the HOCON configuration of the command-line tool.
 * <p>
 * Layers, highest precedence first:
 * <ol>
 *   <li>Java system properties ({@code -Dsmilesforge.codegen.strict-metadata=true})</li>
 *   <li>Environment variables</li>
 *   <li>The user configuration file, if one is found</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 * Substitutions are resolved only after all layers are stacked, so an override of a referenced
 * value reaches every key that refers to it.
 */
public final class ConfigLoader {

    static final String CONFIG_DIR = "config";
    static final String CONFIG_FILE_NAME = "smiles-forge.conf";

    private ConfigLoader() {
    }

    /**
     * Severity of a resolution message.
     */
    public enum MessageLevel {
        INFO,
        WARN
    }

    /**
     * Receives the messages produced while looking for a configuration file.
     */
    @FunctionalInterface
    public interface ConfigMessageHandler {

        /**
         * @param level   the severity of the message.
         * @param message the human-readable description.
         */
        void log(MessageLevel level, String message);
    }

    /**
     * Finds the user configuration file and composes the configuration. The file is taken from,
     * in this order: the {@code --config} option, the {@code config.file} system property,
     * {@code config/smiles-forge.conf} below the working directory, and
     * {@code config/smiles-forge.conf} below the installation directory. Without any of them only
     * the classpath defaults apply.
     *
     * @param explicitConfigFile file from the {@code --config} option, or {@code null}.
     * @param handler            receives progress messages.
     * @return the resolved configuration.
     * @throws IllegalArgumentException            if an explicitly named file does not exist.
     * @throws com.typesafe.config.ConfigException if the configuration cannot be parsed or resolved.
     */
    public static Config resolve(final File explicitConfigFile, final ConfigMessageHandler handler) {
        if (explicitConfigFile != null) {
            requireExists(explicitConfigFile, "Configuration file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file " + explicitConfigFile.getAbsolutePath());
            return loadFromFile(explicitConfigFile);
        }

        final String systemConfigPath = System.getProperty("config.file");
        if (systemConfigPath != null && !systemConfigPath.isBlank()) {
            final File systemConfigFile = new File(systemConfigPath).getAbsoluteFile();
            requireExists(systemConfigFile, "Configuration file specified via -Dconfig.file not found: ");
            handler.log(MessageLevel.INFO, "Using configuration file from -Dconfig.file: "
                    + systemConfigFile.getAbsolutePath());
            return loadFromFile(systemConfigFile);
        }

        final File workingDirConfig = new File(CONFIG_DIR, CONFIG_FILE_NAME);
        if (workingDirConfig.exists()) {
            handler.log(MessageLevel.INFO, "Using configuration file " + workingDirConfig.getAbsolutePath());
            return loadFromFile(workingDirConfig);
        }

        final File installationConfig = detectInstallationConfigFile();
        if (installationConfig != null) {
            handler.log(MessageLevel.INFO, "Using configuration file from installation directory: "
                    + installationConfig.getAbsolutePath());
            return loadFromFile(installationConfig);
        }

        handler.log(MessageLevel.WARN, "No " + CONFIG_DIR + "/" + CONFIG_FILE_NAME
                + " found, using built-in defaults");
        return loadDefaults();
    }

    /**
     * Composes the configuration on top of a user file.
     */
    static Config loadFromFile(final File configFile) {
        return compose(ConfigFactory.parseFile(configFile));
    }

    /**
     * Composes the configuration from the classpath defaults alone.
     */
    static Config loadDefaults() {
        return compose(ConfigFactory.empty());
    }

    private static Config compose(final Config userConfig) {
        return ConfigFactory.systemProperties()
            .withFallback(ConfigFactory.systemEnvironment())
            .withFallback(userConfig)
            .withFallback(ConfigFactory.defaultReferenceUnresolved())
            .resolve();
    }

    private static void requireExists(final File file, final String errorPrefix) {
        if (!file.exists()) {
            throw new IllegalArgumentException(errorPrefix + file.getAbsolutePath());
        }
    }

    /**
     * Looks for {@code APP_HOME/config/smiles-forge.conf}, where {@code APP_HOME} is the parent of
     * the {@code lib} directory holding the running jar.
     *
     * @return the file, or {@code null} when not running from an installed jar or the file is absent.
     */
    private static File detectInstallationConfigFile() {
        final CodeSource codeSource = ConfigLoader.class.getProtectionDomain().getCodeSource();
        if (codeSource == null) {
            return null;
        }
        final File jar;
        try {
            jar = new File(codeSource.getLocation().toURI());
        } catch (URISyntaxException | IllegalArgumentException e) {
            return null;
        }
        if (!jar.isFile() || jar.getParentFile() == null || jar.getParentFile().getParentFile() == null) {
            return null;
        }
        final File configFile = new File(new File(jar.getParentFile().getParentFile(), CONFIG_DIR), CONFIG_FILE_NAME);
        return configFile.exists() ? configFile : null;
    }
}
