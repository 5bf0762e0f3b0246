package im.arun.printtree.config;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import im.arun.printtree.style.StyleRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Locale;
import java.util.Map;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);
    static final String DEFAULT_RESOURCE = "printtree.yaml";

    private final ObjectMapper yamlMapper = YAMLMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .build();
    private final PrintTreeConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private PrintTreeConfig loadDefaultConfig(String configPath) {
        try {
            // An explicit file wins over the bundled resource
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    return yamlMapper.readValue(path.toFile(), PrintTreeConfig.class);
                }
                logger.warn("Config file {} not found, falling back to {}", configPath, DEFAULT_RESOURCE);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, PrintTreeConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", DEFAULT_RESOURCE);
            return new PrintTreeConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new PrintTreeConfig();
        }
    }

    public PrintTreeConfig load() {
        return load(null);
    }

    public PrintTreeConfig load(Map<String, Object> userOptions) {
        PrintTreeConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            switch (key) {
                case "style":
                    if (value != null) config.setStyle(value.toString());
                    break;
                case "show_hidden":
                case "showHidden":
                    config.setShowHidden(parseBoolean(value));
                    break;
                case "show_sizes":
                case "showSizes":
                    config.setShowSizes(parseBoolean(value));
                    break;
                case "sort":
                    config.setSort(parseSortMode(value, config.getSort()));
                    break;
                case "path_separator":
                case "pathSeparator":
                    if (value instanceof String && !((String) value).isEmpty()) config.setPathSeparator((String) value);
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return config;
    }

    /**
     * Registers every custom style of the configuration under its name.
     *
     * @throws IllegalArgumentException if a definition is malformed
     */
    public void registerStyles(PrintTreeConfig config, StyleRegistry registry) {
        if (config.getStyles() == null) {
            return;
        }
        for (StyleDefinition definition : config.getStyles()) {
            registry.register(definition.getName(), definition.toScaffolding());
        }
    }

    private boolean parseBoolean(Object value) {
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return "yes".equalsIgnoreCase((String) value) || "true".equalsIgnoreCase((String) value);
        }
        return false;
    }

    private PrintTreeConfig.SortMode parseSortMode(Object value, PrintTreeConfig.SortMode fallback) {
        if (value instanceof PrintTreeConfig.SortMode) {
            return (PrintTreeConfig.SortMode) value;
        }
        if (value == null) {
            return fallback;
        }
        try {
            return PrintTreeConfig.SortMode.valueOf(value.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warn("Unknown sort mode '{}', keeping {}", value, fallback);
            return fallback;
        }
    }

    private PrintTreeConfig copyConfig(PrintTreeConfig source) {
        PrintTreeConfig copy = new PrintTreeConfig();
        copy.setStyle(source.getStyle());
        copy.setShowHidden(source.isShowHidden());
        copy.setShowSizes(source.isShowSizes());
        copy.setSort(source.getSort());
        copy.setPathSeparator(source.getPathSeparator());
        copy.setStyles(source.getStyles() == null ? new ArrayList<>() : new ArrayList<>(source.getStyles()));
        return copy;
    }
}
