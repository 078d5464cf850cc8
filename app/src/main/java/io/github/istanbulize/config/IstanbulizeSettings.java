package io.github.istanbulize.config;

import io.github.istanbulize.convert.ModuleWrapper;
import io.github.istanbulize.syntax.SourceType;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.jetbrains.annotations.Nullable;

/**
 * Conversion settings. Values are layered: the bundled {@code istanbulize.properties}, then an optional user file, then
 * JVM system properties with the same keys.
 */
public record IstanbulizeSettings(SourceType sourceType, ModuleWrapper wrapper, boolean prettyPrint) {
    private static final Logger logger = LogManager.getLogger(IstanbulizeSettings.class);

    public static final String KEY_SOURCE_TYPE = "istanbulize.sourceType";
    public static final String KEY_WRAPPER = "istanbulize.wrapper";
    public static final String KEY_PRETTY_PRINT = "istanbulize.prettyPrint";

    static final String DEFAULTS_RESOURCE = "/istanbulize.properties";

    public static final IstanbulizeSettings DEFAULTS =
            new IstanbulizeSettings(SourceType.SCRIPT, ModuleWrapper.NONE, true);

    /**
     * Loads the layered settings.
     *
     * @param userFile optional properties file overriding the bundled defaults
     * @throws IOException if {@code userFile} cannot be read
     * @throws IllegalArgumentException if a value is invalid
     */
    public static IstanbulizeSettings load(@Nullable Path userFile) throws IOException {
        var props = new Properties();
        try (var in = IstanbulizeSettings.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in != null) {
                try (var reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
                    props.load(reader);
                }
            } else {
                logger.debug("No bundled {} found, using built-in defaults", DEFAULTS_RESOURCE);
            }
        }
        if (userFile != null) {
            try (var reader = Files.newBufferedReader(userFile)) {
                props.load(reader);
            }
            logger.debug("Loaded settings from {}", userFile);
        }
        for (var key : new String[] {KEY_SOURCE_TYPE, KEY_WRAPPER, KEY_PRETTY_PRINT}) {
            var value = System.getProperty(key);
            if (value != null) {
                props.setProperty(key, value);
            }
        }
        return fromProperties(props);
    }

    /** Reads settings from {@code props}; missing keys take the built-in defaults. */
    public static IstanbulizeSettings fromProperties(Properties props) {
        var sourceType = DEFAULTS.sourceType();
        var rawSourceType = props.getProperty(KEY_SOURCE_TYPE);
        if (rawSourceType != null && !rawSourceType.isBlank()) {
            try {
                sourceType = SourceType.fromId(rawSourceType);
            } catch (IllegalArgumentException e) {
                throw invalid(KEY_SOURCE_TYPE, rawSourceType, e);
            }
        }

        var wrapper = DEFAULTS.wrapper();
        var rawWrapper = props.getProperty(KEY_WRAPPER);
        if (rawWrapper != null && !rawWrapper.isBlank()) {
            try {
                wrapper = ModuleWrapper.parse(rawWrapper);
            } catch (IllegalArgumentException e) {
                throw invalid(KEY_WRAPPER, rawWrapper, e);
            }
        }

        boolean prettyPrint = DEFAULTS.prettyPrint();
        var rawPrettyPrint = props.getProperty(KEY_PRETTY_PRINT);
        if (rawPrettyPrint != null && !rawPrettyPrint.isBlank()) {
            prettyPrint = switch (rawPrettyPrint.trim().toLowerCase(Locale.ROOT)) {
                case "true" -> true;
                case "false" -> false;
                default -> throw invalid(KEY_PRETTY_PRINT, rawPrettyPrint, null);
            };
        }

        return new IstanbulizeSettings(sourceType, wrapper, prettyPrint);
    }

    public IstanbulizeSettings withSourceType(SourceType newSourceType) {
        return new IstanbulizeSettings(newSourceType, wrapper, prettyPrint);
    }

    public IstanbulizeSettings withWrapper(ModuleWrapper newWrapper) {
        return new IstanbulizeSettings(sourceType, newWrapper, prettyPrint);
    }

    public IstanbulizeSettings withPrettyPrint(boolean newPrettyPrint) {
        return new IstanbulizeSettings(sourceType, wrapper, newPrettyPrint);
    }

    private static IllegalArgumentException invalid(String key, String value, @Nullable Throwable cause) {
        return new IllegalArgumentException("Invalid value for " + key + ": '" + value + "'", cause);
    }
}
