package ca.jonathanfritz.zkbcat.matching;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads category rules from YAML files.
 * Handles missing files, empty files, and invalid YAML gracefully.
 */
public class CategoryRulesLoader {

    private static final Logger logger = LogManager.getLogger(CategoryRulesLoader.class);

    private final ObjectMapper yamlMapper;

    public CategoryRulesLoader() {
        this.yamlMapper = YAMLMapper.builder()
                .propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
                .build();
    }

    /**
     * Loads category rules from a file path.
     * Returns an empty configuration if the file doesn't exist, is empty, or contains invalid YAML.
     *
     * @param path the path to the YAML rules file
     * @return the loaded configuration, or empty configuration on error
     */
    public CategoryRulesConfig load(Path path) {
        if (path == null) {
            logger.debug("Category rules path is null, returning empty configuration");
            return CategoryRulesConfig.empty();
        }

        if (!Files.exists(path)) {
            logger.debug("Category rules file does not exist: {}", path);
            return CategoryRulesConfig.empty();
        }

        try {
            if (Files.size(path) == 0) {
                logger.debug("Category rules file is empty: {}", path);
                return CategoryRulesConfig.empty();
            }

            try (InputStream is = Files.newInputStream(path)) {
                return loadFromStream(is);
            }
        } catch (IOException e) {
            logger.error("Failed to load category rules from {}: {}", path, e.getMessage());
            return CategoryRulesConfig.empty();
        }
    }

    /**
     * Loads category rules from a YAML string.
     *
     * @param yaml the YAML content as a string
     * @return the loaded configuration, or empty configuration on error
     */
    public CategoryRulesConfig loadFromString(String yaml) {
        if (yaml == null || yaml.isBlank()) {
            logger.debug("YAML string is null or blank, returning empty configuration");
            return CategoryRulesConfig.empty();
        }

        try {
            return orEmpty(yamlMapper.readValue(yaml, CategoryRulesConfig.class));
        } catch (IOException e) {
            logger.error("Failed to parse category rules YAML: {}", e.getMessage());
            return CategoryRulesConfig.empty();
        }
    }

    /**
     * Loads the rules that ship inside the jar
     *
     * @param resourceName the classpath resource to read, i.e. category-rules.yaml
     */
    public CategoryRulesConfig loadBundled(String resourceName) {
        try (InputStream is = getClass().getClassLoader().getResourceAsStream(resourceName)) {
            if (is == null) {
                logger.warn("No bundled {} found in classpath", resourceName);
                return CategoryRulesConfig.empty();
            }
            return loadFromStream(is);
        } catch (IOException e) {
            logger.error("Failed to load bundled category rules: {}", e.getMessage());
            return CategoryRulesConfig.empty();
        }
    }

    private CategoryRulesConfig loadFromStream(InputStream inputStream) throws IOException {
        return orEmpty(yamlMapper.readValue(inputStream, CategoryRulesConfig.class));
    }

    private CategoryRulesConfig orEmpty(CategoryRulesConfig config) {
        if (config == null) {
            return CategoryRulesConfig.empty();
        }
        logger.info("Loaded {} category rules", config.getRules().size());
        return config;
    }
}
