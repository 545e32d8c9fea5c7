package ca.jonathanfritz.zkbcat.matching;

import ca.jonathanfritz.zkbcat.config.AppConfig;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;

/**
 * Guice module for categorization.
 * User rules in the config directory replace the bundled rules when they exist and contain at least one rule.
 */
public class MatchingModule extends AbstractModule {

    private static final Logger logger = LogManager.getLogger(MatchingModule.class);

    static final String BUNDLED_RULES_RESOURCE = "category-rules.yaml";

    private final Path configDirectory;

    public MatchingModule(Path configDirectory) {
        this.configDirectory = configDirectory;
    }

    @Provides
    @Singleton
    public CategoryRulesConfig provideCategoryRulesConfig(AppConfig appConfig) {
        final Path categoryRulesPath = appConfig.resolveCategoryRulesPath(configDirectory);

        // First try to load user rules from config directory
        final CategoryRulesLoader loader = new CategoryRulesLoader();
        final CategoryRulesConfig userConfig = loader.load(categoryRulesPath);
        if (!userConfig.getRules().isEmpty()) {
            logger.info("Loaded {} category rules from {}", userConfig.getRules().size(), categoryRulesPath);
            return userConfig;
        }

        // Fall back to bundled defaults from classpath
        logger.info("No user category rules found, loading bundled defaults");
        return loader.loadBundled(BUNDLED_RULES_RESOURCE);
    }
}
