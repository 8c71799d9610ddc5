package org.broadinstitute.fusionworkbook.utils.config;

import com.google.common.annotations.VisibleForTesting;
import htsjdk.samtools.util.Log;
import org.aeonbits.owner.Config;
import org.aeonbits.owner.ConfigCache;
import org.apache.logging.log4j.Level;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.broadinstitute.fusionworkbook.exceptions.FusionWorkbookException;
import org.broadinstitute.fusionworkbook.exceptions.UserException;
import org.broadinstitute.fusionworkbook.utils.LoggingUtils;
import org.broadinstitute.fusionworkbook.utils.Utils;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * A singleton class to act as a user interface for loading configuration files from {@link org.aeonbits.owner}.
 * This class wraps functionality in the {@link org.aeonbits.owner} configuration utilities to be a more seamless user
 * interface.
 */
public final class ConfigFactory {

    private static final Logger logger = LogManager.getLogger(ConfigFactory.class);

    //=======================================
    // Singleton members / methods:
    private static final ConfigFactory instance;

    static {
        instance = new ConfigFactory();
    }

    /**
     * @return An instance of this {@link ConfigFactory}, which can be used to create a configuration.
     */
    public static ConfigFactory getInstance() {
        return instance;
    }

    // This class is a singleton, so no public construction.
    private ConfigFactory() {}

    //=======================================

    /**
     * Pattern to match path variables in the {@link Config.Sources} annotation, e.g. {@code ${var}}.
     */
    private static final Pattern sourcesAnnotationPathVariablePattern = Pattern.compile("\\$\\{(.*)}");

    /**
     * Value to set path variables to when they are not present, so that the source is skipped.
     */
    @VisibleForTesting
    static final String NO_PATH_VARIABLE_VALUE = "/dev/null";

    private final Set<Class<? extends Config>> alreadyResolvedPathVariables = new HashSet<>();

    /**
     * Checks each of the given path variables in the environment, the system properties and the owner
     * configuration factory properties. Any that is not defined anywhere is set to {@link #NO_PATH_VARIABLE_VALUE}.
     */
    @VisibleForTesting
    void checkFileNamePropertyExistenceAndSetConfigFactoryProperties(final List<String> filenameProperties) {
        final Properties systemProperties = System.getProperties();
        final Map<String, String> environmentProperties = System.getenv();

        for (final String property : filenameProperties) {
            if ( environmentProperties.containsKey(property) ) {
                logger.debug("Config path variable found in Environment Properties: " + property + "=" + environmentProperties.get(property) + " - will search for config here.");
            }
            else if ( systemProperties.containsKey(property) ) {
                logger.debug("Config path variable found in System Properties: " + property + "=" + systemProperties.get(property) + " - will search for config here.");
            }
            else if ( org.aeonbits.owner.ConfigFactory.getProperties().containsKey(property) ) {
                logger.debug("Config path variable found in Config Factory Properties(probably from the command-line): " + property + "=" + org.aeonbits.owner.ConfigFactory.getProperty(property) + " - will search for config here.");
            }
            else {
                logger.debug("Config path variable not found: " + property +
                        " - setting value to default empty variable: " + NO_PATH_VARIABLE_VALUE);
                org.aeonbits.owner.ConfigFactory.setProperty(property, NO_PATH_VARIABLE_VALUE);
            }
        }
    }

    /**
     * Get a list of the config path variables from the given configuration class's {@link Config.Sources} annotation.
     */
    @VisibleForTesting
    <T extends Config> List<String> getSourcesAnnotationPathVariables(final Class<? extends T> configClass) {
        final List<String> configPathVariableNames = new ArrayList<>();
        final Config.Sources annotation = configClass.getAnnotation(Config.Sources.class);
        if ( annotation != null ) {
            for (final String val : annotation.value()) {
                final Matcher m = sourcesAnnotationPathVariablePattern.matcher(val);
                if (m.find()) {
                    configPathVariableNames.add(m.group(1));
                }
            }
        }
        return configPathVariableNames;
    }

    // =================================================================================================================

    /**
     * Quick way to get the workbook configuration.
     */
    public FusionWorkbookConfig getFusionWorkbookConfig() {
        return getOrCreate( FusionWorkbookConfig.class );
    }

    /**
     * Creates a new configuration that is not cached, so later changes to its sources are picked up.
     *
     * @param clazz   the configuration interface.
     * @param imports additional properties that take precedence over every source.
     */
    public <T extends Config> T create(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return org.aeonbits.owner.ConfigFactory.create(clazz, imports);
    }

    /**
     * Gets the cached configuration for the given interface, creating it if needed.
     */
    public <T extends Config> T getOrCreate(final Class<? extends T> clazz, final Map<?, ?>... imports) {
        Utils.nonNull(clazz);
        resolvePathVariables(clazz);
        return ConfigCache.getOrCreate(clazz, imports);
    }

    private synchronized <T extends Config> void resolvePathVariables(final Class<? extends T> clazz) {
        if ( !alreadyResolvedPathVariables.contains(clazz) ) {
            checkFileNamePropertyExistenceAndSetConfigFactoryProperties(
                    getSourcesAnnotationPathVariables(clazz)
            );
            alreadyResolvedPathVariables.add(clazz);
        }
    }

    /**
     * Get the configuration file name from the given arguments.
     *
     * @return the file name after {@code configFileOption}, or {@code null} if the option is absent.
     * @throws UserException.BadInput if the option is present with no file name after it.
     */
    public static String getConfigFilenameFromArgs( final String[] args, final String configFileOption ) {
        Utils.nonNull(args);
        Utils.nonNull(configFileOption);

        for ( int i = 0 ; i < args.length ; ++i ) {
            if (args[i].equals(configFileOption)) {
                if ( ((i+1) < args.length) && (!args[i+1].startsWith("-")) ) {
                    return args[i+1];
                }
                else {
                    throw new UserException.BadInput("Configuration file not given after config file option specified: " + configFileOption);
                }
            }
        }
        return null;
    }

    /**
     * Points the {@link FusionWorkbookConfig} file variable at the file named in the arguments, if any,
     * and loads the configuration into the cache used by {@link #getFusionWorkbookConfig()}.
     */
    public synchronized FusionWorkbookConfig initializeConfigurationFromCommandLineArgs(final String[] argList,
                                                                                        final String configFileOption) {
        final String configFileName = getConfigFilenameFromArgs(argList, configFileOption);
        if ( configFileName != null ) {
            org.aeonbits.owner.ConfigFactory.setProperty( FusionWorkbookConfig.CONFIG_FILE_VARIABLE_FILE_NAME, configFileName );
            alreadyResolvedPathVariables.remove(FusionWorkbookConfig.class);
            // A cached instance was loaded without the file.
            ConfigCache.remove(FusionWorkbookConfig.class);
        }
        return getFusionWorkbookConfig();
    }

    /**
     * Logs all the parameters in the given {@link Config} object at {@link Log.LogLevel#DEBUG}.
     */
    public static <T extends Config> void logConfigFields(final T config) {
        logConfigFields(config, Log.LogLevel.DEBUG);
    }

    /**
     * Logs all the parameters in the given {@link Config} object at the given level.
     */
    public static <T extends Config> void logConfigFields(final T config, final Log.LogLevel logLevel) {
        Utils.nonNull(config);
        Utils.nonNull(logLevel);

        final Level level = LoggingUtils.levelToLog4jLevel(logLevel);
        if ( !logger.isEnabled(level) ) {
            return;
        }

        logger.log(level, "Configuration file values: ");
        for ( final Map.Entry<String, Object> entry : getConfigMap(config).entrySet() ) {
            logger.log(level, "\t" + entry.getKey() + " = " + entry.getValue());
        }
    }

    /**
     * Gets every property of the given configuration, keyed by property name.
     */
    @VisibleForTesting
    static <T extends Config> LinkedHashMap<String, Object> getConfigMap(final T config) {
        final LinkedHashMap<String, Object> configMap = new LinkedHashMap<>();

        // The runtime class is an owner proxy; only the interfaces that extend Config hold the properties.
        for ( final Class<?> classInterface : config.getClass().getInterfaces() ) {
            if ( !Config.class.isAssignableFrom(classInterface) ) {
                continue;
            }
            for (final Method propertyMethod : classInterface.getDeclaredMethods()) {
                final Config.Key key = propertyMethod.getAnnotation(Config.Key.class);
                final String propertyName = key != null ? key.value() : propertyMethod.getName();
                try {
                    configMap.put(propertyName, propertyMethod.invoke(config));
                } catch (final IllegalAccessException | InvocationTargetException ex) {
                    throw new FusionWorkbookException("Could not invoke the config getter: " +
                            config.getClass().getSimpleName() + "." + propertyMethod.getName(), ex);
                }
            }
        }
        return configMap;
    }
}
