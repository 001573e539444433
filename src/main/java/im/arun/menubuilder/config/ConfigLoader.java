package im.arun.menubuilder.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

public class ConfigLoader {
    private static final Logger logger = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String CONFIG_RESOURCE = "menubuilder.yaml";
    public static final String MENU_DIR_ENV = "MENUBUILDER_CONFIG_PATH";

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());
    private final Function<String, String> environment;
    private final MenuBuilderConfig defaultConfig;

    public ConfigLoader() {
        this(null);
    }

    public ConfigLoader(String configPath) {
        this(configPath, System::getenv);
    }

    ConfigLoader(String configPath, Function<String, String> environment) {
        this.environment = environment;
        this.defaultConfig = loadDefaultConfig(configPath);
    }

    private MenuBuilderConfig loadDefaultConfig(String configPath) {
        MenuBuilderConfig config = readConfig(configPath);
        applyEnvironment(config);
        return config;
    }

    private MenuBuilderConfig readConfig(String configPath) {
        try {
            // An explicit file wins over the bundled settings
            if (configPath != null) {
                Path path = Paths.get(configPath);
                if (Files.exists(path)) {
                    logger.debug("Loading configuration from {}", path);
                    return yamlMapper.readValue(path.toFile(), MenuBuilderConfig.class);
                }
                logger.warn("Config file {} not found", configPath);
            }

            try (InputStream resourceStream = getClass().getClassLoader().getResourceAsStream(CONFIG_RESOURCE)) {
                if (resourceStream != null) {
                    return yamlMapper.readValue(resourceStream, MenuBuilderConfig.class);
                }
            }

            logger.warn("No {} found, using default configuration", CONFIG_RESOURCE);
            return new MenuBuilderConfig();
        } catch (IOException e) {
            logger.warn("Failed to load configuration, using defaults: {}", e.getMessage());
            return new MenuBuilderConfig();
        }
    }

    private void applyEnvironment(MenuBuilderConfig config) {
        String menuDir = environment.apply(MENU_DIR_ENV);
        if (menuDir == null || menuDir.isEmpty()) {
            return;
        }
        if (Files.isDirectory(Paths.get(menuDir))) {
            logger.debug("Menu directory overridden by {}: {}", MENU_DIR_ENV, menuDir);
            config.setMenuItemsDir(menuDir);
        } else {
            logger.warn("{} points to {}, which is not a directory; ignoring", MENU_DIR_ENV, menuDir);
        }
    }

    public MenuBuilderConfig getDefaultConfig() {
        return copyConfig(defaultConfig);
    }

    public MenuBuilderConfig load(Map<String, Object> userOptions) {
        MenuBuilderConfig config = copyConfig(defaultConfig);

        if (userOptions == null || userOptions.isEmpty()) {
            return config;
        }

        userOptions.forEach((key, value) -> {
            switch (key) {
                case "menu_items_dir":
                case "menuItemsDir":
                    if (value instanceof String) config.setMenuItemsDir((String) value);
                    break;
                case "default_menu":
                case "defaultMenu":
                    if (value instanceof String) config.setDefaultMenu((String) value);
                    break;
                case "log_level":
                case "logLevel":
                    if (value instanceof String) config.setLogLevel((String) value);
                    break;
                case "log_modes":
                case "logModes":
                    if (value instanceof List) config.setLogModes(toStringList((List<?>) value));
                    break;
                case "language":
                    if (value instanceof String) config.setLanguage((String) value);
                    break;
                case "language_modes":
                case "languageModes":
                    if (value instanceof List) config.setLanguageModes(toStringList((List<?>) value));
                    break;
                default:
                    logger.warn("Unknown configuration key: {}", key);
            }
        });

        return config;
    }

    private List<String> toStringList(List<?> values) {
        List<String> result = new ArrayList<>();
        for (Object value : values) {
            result.add(String.valueOf(value));
        }
        return result;
    }

    private MenuBuilderConfig copyConfig(MenuBuilderConfig source) {
        MenuBuilderConfig copy = new MenuBuilderConfig();
        copy.setMenuItemsDir(source.getMenuItemsDir());
        copy.setDefaultMenu(source.getDefaultMenu());
        copy.setLogLevel(source.getLogLevel());
        copy.setLogModes(new ArrayList<>(source.getLogModes()));
        copy.setLanguage(source.getLanguage());
        copy.setLanguageModes(new ArrayList<>(source.getLanguageModes()));
        return copy;
    }
}
