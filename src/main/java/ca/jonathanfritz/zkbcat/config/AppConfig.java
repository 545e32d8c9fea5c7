package ca.jonathanfritz.zkbcat.config;

import com.fasterxml.jackson.annotation.JsonIgnore;
import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

/**
 * Application configuration loaded from ~/.zkbcat/config.yaml.
 * The defaults are the hard limits that a statement must satisfy before it is parsed.
 */
public class AppConfig {

    public static final long DEFAULT_MAX_FILE_SIZE_BYTES = 10L * 1024 * 1024;
    public static final int DEFAULT_MAX_PAGE_COUNT = 100;
    public static final int DEFAULT_MAX_CONTENT_CHARACTERS = 1_000_000;

    private String stagingDirectory;
    private Limits limits;
    private List<String> allowedExtensions;
    private List<String> statementMarkers;
    private List<String> currencyCodes;
    private String categoryRulesPath;

    public AppConfig() {
        // Default values
        this.stagingDirectory = null;
        this.limits = new Limits();
        this.allowedExtensions = new ArrayList<>(List.of("pdf"));
        this.statementMarkers = new ArrayList<>(List.of("zürcher kantonalbank", "zkb", "kontoauszug"));
        this.currencyCodes = new ArrayList<>(List.of("CHF", "EUR", "USD", "GBP"));
        this.categoryRulesPath = "category-rules.yaml";
    }

    /**
     * Creates a default configuration with sensible defaults.
     */
    public static AppConfig defaults() {
        return new AppConfig();
    }

    public String getStagingDirectory() {
        return stagingDirectory;
    }

    public void setStagingDirectory(String stagingDirectory) {
        this.stagingDirectory = stagingDirectory;
    }

    public Limits getLimits() {
        return limits;
    }

    public void setLimits(Limits limits) {
        this.limits = limits != null ? limits : new Limits();
    }

    public List<String> getAllowedExtensions() {
        return allowedExtensions;
    }

    public void setAllowedExtensions(List<String> allowedExtensions) {
        this.allowedExtensions = allowedExtensions != null ? allowedExtensions : new ArrayList<>();
    }

    public List<String> getStatementMarkers() {
        return statementMarkers;
    }

    public void setStatementMarkers(List<String> statementMarkers) {
        this.statementMarkers = statementMarkers != null ? statementMarkers : new ArrayList<>();
    }

    public List<String> getCurrencyCodes() {
        return currencyCodes;
    }

    public void setCurrencyCodes(List<String> currencyCodes) {
        this.currencyCodes = currencyCodes != null ? currencyCodes : new ArrayList<>();
    }

    public String getCategoryRulesPath() {
        return categoryRulesPath;
    }

    public void setCategoryRulesPath(String categoryRulesPath) {
        this.categoryRulesPath = categoryRulesPath;
    }

    /**
     * Resolves the category rules path relative to the config directory.
     * If the path is absolute, returns it as-is.
     *
     * @param configDirectory the directory containing config.yaml
     * @return the resolved path to the category rules file
     */
    @JsonIgnore
    public Path resolveCategoryRulesPath(Path configDirectory) {
        Path rulesPath = Paths.get(categoryRulesPath);
        if (rulesPath.isAbsolute()) {
            return rulesPath;
        }
        return configDirectory.resolve(rulesPath);
    }

    /**
     * Resolves the directory that staged copies of statements are written to.
     * Falls back to a zkbcat/secure-processing folder under the system temp directory.
     */
    @JsonIgnore
    public Path resolveStagingDirectory() {
        if (StringUtils.isNotBlank(stagingDirectory)) {
            return Paths.get(stagingDirectory);
        }
        return Paths.get(System.getProperty("java.io.tmpdir"), "zkbcat", "secure-processing");
    }

    /**
     * Upper bounds that protect the parser from oversized or hostile documents.
     */
    public static class Limits {
        private long maxFileSizeBytes;
        private int maxPageCount;
        private int maxContentCharacters;

        public Limits() {
            this.maxFileSizeBytes = DEFAULT_MAX_FILE_SIZE_BYTES;
            this.maxPageCount = DEFAULT_MAX_PAGE_COUNT;
            this.maxContentCharacters = DEFAULT_MAX_CONTENT_CHARACTERS;
        }

        public long getMaxFileSizeBytes() {
            return maxFileSizeBytes;
        }

        public void setMaxFileSizeBytes(long maxFileSizeBytes) {
            this.maxFileSizeBytes = maxFileSizeBytes;
        }

        public int getMaxPageCount() {
            return maxPageCount;
        }

        public void setMaxPageCount(int maxPageCount) {
            this.maxPageCount = maxPageCount;
        }

        public int getMaxContentCharacters() {
            return maxContentCharacters;
        }

        public void setMaxContentCharacters(int maxContentCharacters) {
            this.maxContentCharacters = maxContentCharacters;
        }
    }
}
