package ca.jonathanfritz.zkbcat.parser;

import ca.jonathanfritz.zkbcat.config.AppConfig;
import ca.jonathanfritz.zkbcat.exception.ZkbCatException;
import ca.jonathanfritz.zkbcat.io.StatementDocument;
import ca.jonathanfritz.zkbcat.io.StatementDocumentLoader;
import ca.jonathanfritz.zkbcat.utils.StringUtils;
import com.google.inject.Inject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Cheap check that a document looks like a statement before it is fully parsed. Only the first page is read.
 * Checks run in a fixed order and the first one that fails determines the result.
 */
public class StatementValidator {

    private static final Logger logger = LogManager.getLogger(StatementValidator.class);

    static final String INVALID_DOCUMENT = "Invalid PDF file";
    static final String NO_PAGES = "PDF has no pages";
    static final String TOO_MANY_PAGES = "PDF has too many pages (potential security risk)";
    static final String UNREADABLE_CONTENT = "Cannot read PDF content";
    static final String CONTENT_TOO_LARGE = "PDF content too large";
    static final String NOT_A_STATEMENT = "PDF does not appear to be a ZKB statement";
    static final String VALID_STATEMENT = "Valid ZKB statement";

    private final StatementDocumentLoader documentLoader;
    private final int maxPageCount;
    private final int maxContentCharacters;
    private final List<String> statementMarkers;

    @Inject
    public StatementValidator(StatementDocumentLoader documentLoader, AppConfig appConfig) {
        this(documentLoader,
                appConfig.getLimits().getMaxPageCount(),
                appConfig.getLimits().getMaxContentCharacters(),
                appConfig.getStatementMarkers());
    }

    public StatementValidator(StatementDocumentLoader documentLoader, int maxPageCount, int maxContentCharacters,
                              List<String> statementMarkers) {
        this.documentLoader = documentLoader;
        this.maxPageCount = maxPageCount;
        this.maxContentCharacters = maxContentCharacters;
        // a blank marker would match every document
        this.statementMarkers = statementMarkers.stream()
                .map(StringUtils::coerceNullableString)
                .filter(m -> !m.isEmpty())
                .map(m -> m.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableList());
    }

    /**
     * Checks that the document can be loaded, has between 1 and the maximum number of pages, and that its first page
     * is readable, not too large, and mentions at least one statement marker
     *
     * @param documentPath the document to check. It is not modified
     * @return the result of the first failing check, or a valid result
     */
    public ValidationResult validate(Path documentPath) {
        final StatementDocument document;
        try {
            document = documentLoader.load(documentPath);
        } catch (ZkbCatException e) {
            logger.debug("Validation failed to load document: {}", e.getKind());
            return ValidationResult.invalid(INVALID_DOCUMENT);
        }

        final ValidationResult result;
        try {
            result = validate(document);
        } finally {
            closeDocument(document);
        }

        logger.debug("Validation result: {}", result);
        return result;
    }

    private ValidationResult validate(StatementDocument document) {
        final int pageCount = document.getPageCount();
        if (pageCount == 0) {
            return ValidationResult.invalid(NO_PAGES);
        }
        if (pageCount > maxPageCount) {
            return ValidationResult.invalid(TOO_MANY_PAGES);
        }

        final Optional<String> firstPage = document.getPageText(0);
        if (firstPage.isEmpty()) {
            return ValidationResult.invalid(UNREADABLE_CONTENT);
        }

        final String content = firstPage.get().toLowerCase(Locale.ROOT);
        if (content.length() >= maxContentCharacters) {
            return ValidationResult.invalid(CONTENT_TOO_LARGE);
        }

        if (statementMarkers.stream().noneMatch(content::contains)) {
            return ValidationResult.invalid(NOT_A_STATEMENT);
        }

        return ValidationResult.valid(VALID_STATEMENT);
    }

    private void closeDocument(StatementDocument document) {
        try {
            document.close();
        } catch (IOException e) {
            logger.warn("Failed to close document after validation", e);
        }
    }
}
