package ca.jonathanfritz.zkbcat;

import ca.jonathanfritz.zkbcat.config.AppConfigLoader;
import ca.jonathanfritz.zkbcat.config.ConfigModule;
import ca.jonathanfritz.zkbcat.exception.SecureFileException;
import ca.jonathanfritz.zkbcat.io.DocumentIOModule;
import ca.jonathanfritz.zkbcat.matching.MatchingModule;
import ca.jonathanfritz.zkbcat.secure.SecureFileModule;
import ca.jonathanfritz.zkbcat.service.StatementImportService;
import ca.jonathanfritz.zkbcat.utils.PathUtils;
import com.google.inject.Guice;
import com.google.inject.Injector;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;

/**
 * The entrypoint to the library
 * Loads configuration and sets up the Guice injector that wires the import pipeline together
 */
public class ZkbCat {

    private static final Logger logger = LogManager.getLogger(ZkbCat.class);

    private ZkbCat() {
    }

    /**
     * Initializes the import pipeline from the configuration in ~/.zkbcat
     */
    public static StatementImportService initialize() {
        return initialize(new PathUtils().getConfigPath());
    }

    /**
     * Initializes the import pipeline from the configuration in the given directory. A default config.yaml is written
     * there if none exists. Staged copies left behind by an earlier process are destroyed before this method returns.
     *
     * @param configDirectory the directory that holds config.yaml and category-rules.yaml
     */
    public static StatementImportService initialize(Path configDirectory) {
        final AppConfigLoader.LoadResult loadResult = new AppConfigLoader().loadOrCreate(configDirectory);
        if (loadResult.wasCreated()) {
            logger.info("Wrote default configuration to {}", loadResult.configPath());
        }

        final Injector injector = Guice.createInjector(
                new ConfigModule(loadResult.config()),
                new SecureFileModule(),
                new DocumentIOModule(),
                new MatchingModule(configDirectory));
        final StatementImportService statementImportService = injector.getInstance(StatementImportService.class);

        try {
            statementImportService.clearSensitiveFiles();
        } catch (SecureFileException e) {
            logger.error("Failed to clear leftover staged files", e);
        }
        return statementImportService;
    }
}
