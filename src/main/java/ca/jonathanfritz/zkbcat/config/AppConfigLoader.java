package ca.jonathanfritz.zkbcat.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Loads and saves application configuration from YAML files.
 * Handles auto-creation of config with defaults when file doesn't exist.
 */
public class AppConfigLoader {

    private static final Logger logger = LogManager.getLogger(AppConfigLoader.class);
    private static final String CONFIG_FILE_NAME = "config.yaml";

    private final ObjectMapper yamlMapper;

    public AppConfigLoader() {
        this.yamlMapper = new ObjectMapper(new YAMLFactory())
                .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Result of loading configuration, includes whether the file was newly created.
     */
    public record LoadResult(AppConfig config, Path configPath, boolean wasCreated) {}

    /**
     * Loads configuration from the specified directory.
     * If config.yaml doesn't exist, creates it with default values.
     *
     * @param configDirectory the directory to load config from (typically ~/.zkbcat/)
     * @return the load result containing the config and whether it was newly created
     */
    public LoadResult loadOrCreate(Path configDirectory) {
        Path configPath = configDirectory.resolve(CONFIG_FILE_NAME);

        if (Files.exists(configPath)) {
            return loadExisting(configPath);
        } else {
            return createDefault(configDirectory, configPath);
        }
    }

    private LoadResult loadExisting(Path configPath) {
        try {
            if (Files.size(configPath) == 0) {
                logger.debug("Config file is empty, using defaults: {}", configPath);
                return new LoadResult(AppConfig.defaults(), configPath, false);
            }

            AppConfig config = yamlMapper.readValue(configPath.toFile(), AppConfig.class);
            if (config == null) {
                config = AppConfig.defaults();
            }
            logger.info("Loaded configuration from {}", configPath);
            return new LoadResult(config, configPath, false);
        } catch (IOException e) {
            logger.error("Failed to load config from {}: {}. Using defaults.", configPath, e.getMessage());
            return new LoadResult(AppConfig.defaults(), configPath, false);
        }
    }

    private LoadResult createDefault(Path configDirectory, Path configPath) {
        AppConfig config = AppConfig.defaults();

        try {
            if (!Files.exists(configDirectory)) {
                Files.createDirectories(configDirectory);
                logger.debug("Created config directory: {}", configDirectory);
            }

            Files.writeString(configPath, generateConfigWithComments(config));
            logger.info("Created default configuration at {}", configPath);

            return new LoadResult(config, configPath, true);
        } catch (IOException e) {
            logger.error("Failed to create config file at {}: {}. Using defaults.", configPath, e.getMessage());
            return new LoadResult(config, configPath, false);
        }
    }

    /**
     * Generates YAML configuration content with helpful comments.
     * The staging directory is left commented out so that the system temp directory is used.
     */
    String generateConfigWithComments(AppConfig config) {
        final AppConfig.Limits limits = config.getLimits();
        return "# zkbcat configuration\n"
                + "# Edit this file to customize how statements are staged and parsed.\n"
                + "\n"
                + "# Directory that holds the short-lived, protected copy of a statement while it is parsed\n"
                + "# Default: <system temp directory>/zkbcat/secure-processing\n"
                + (config.getStagingDirectory() != null
                        ? "staging_directory: " + config.getStagingDirectory() + "\n"
                        : "# staging_directory: /path/to/dir\n")
                + "\n"
                + "# Hard limits applied before and during parsing\n"
                + "limits:\n"
                + "  # Default: 10485760 (10 MiB)\n"
                + "  max_file_size_bytes: " + limits.getMaxFileSizeBytes() + "\n"
                + "  # Default: 100\n"
                + "  max_page_count: " + limits.getMaxPageCount() + "\n"
                + "  # Default: 1000000\n"
                + "  max_content_characters: " + limits.getMaxContentCharacters() + "\n"
                + "\n"
                + "# File extensions that are accepted as statement documents\n"
                + "allowed_extensions: " + toFlowList(config.getAllowedExtensions()) + "\n"
                + "\n"
                + "# Text (case-insensitive) that identifies the first page of a statement\n"
                + "statement_markers: " + toFlowList(config.getStatementMarkers()) + "\n"
                + "\n"
                + "# Currency codes that may prefix an amount\n"
                + "currency_codes: " + toFlowList(config.getCurrencyCodes()) + "\n"
                + "\n"
                + "# Path to category keyword rules (relative to this config directory, or absolute)\n"
                + "# Default: category-rules.yaml\n"
                + "category_rules_path: " + config.getCategoryRulesPath() + "\n";
    }

    private static String toFlowList(List<String> values) {
        return values.stream()
                .map(v -> "\"" + v.replace("\"", "\\\"") + "\"")
                .collect(Collectors.joining(", ", "[", "]"));
    }
}
