package ca.jonathanfritz.zkbcat.parser;

import ca.jonathanfritz.zkbcat.config.AppConfig;
import ca.jonathanfritz.zkbcat.exception.ErrorKind;
import ca.jonathanfritz.zkbcat.exception.ZkbCatException;
import ca.jonathanfritz.zkbcat.io.StatementDocument;
import ca.jonathanfritz.zkbcat.io.StatementDocumentLoader;
import ca.jonathanfritz.zkbcat.transactions.ParseResult;
import ca.jonathanfritz.zkbcat.transactions.Transaction;
import ca.jonathanfritz.zkbcat.utils.PathUtils;
import ca.jonathanfritz.zkbcat.utils.StringUtils;
import com.google.inject.Inject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Parses a whole statement document into a {@link ParseResult}.
 * <p>
 * Hard limits are enforced again here rather than trusted from an earlier check. A violated limit, or a document that
 * cannot be loaded, stops the parse immediately with a structural failure. Otherwise the text of every page is joined
 * in page order, split into lines, stripped of noise, and parsed line by line. Lines that are not transactions are
 * skipped without an error. A document without any transactions still completes, with a single soft warning.
 */
public class ParseCoordinator {

    private static final Logger logger = LogManager.getLogger(ParseCoordinator.class);

    public static final String NO_TRANSACTIONS_FOUND = "No transactions found in PDF. Check if format matches ZKB statement.";

    private final StatementDocumentLoader documentLoader;
    private final LineClassifier lineClassifier;
    private final TransactionLineParser transactionLineParser;
    private final long maxFileSizeBytes;
    private final int maxPageCount;
    private final int maxContentCharacters;

    @Inject
    public ParseCoordinator(StatementDocumentLoader documentLoader, LineClassifier lineClassifier,
                            TransactionLineParser transactionLineParser, AppConfig appConfig) {
        this(documentLoader, lineClassifier, transactionLineParser,
                appConfig.getLimits().getMaxFileSizeBytes(),
                appConfig.getLimits().getMaxPageCount(),
                appConfig.getLimits().getMaxContentCharacters());
    }

    public ParseCoordinator(StatementDocumentLoader documentLoader, LineClassifier lineClassifier,
                            TransactionLineParser transactionLineParser, long maxFileSizeBytes, int maxPageCount,
                            int maxContentCharacters) {
        this.documentLoader = documentLoader;
        this.lineClassifier = lineClassifier;
        this.transactionLineParser = transactionLineParser;
        this.maxFileSizeBytes = maxFileSizeBytes;
        this.maxPageCount = maxPageCount;
        this.maxContentCharacters = maxContentCharacters;
    }

    /**
     * Parses the document at the given path. Never throws for a bad document: every problem is reported through the
     * returned result.
     *
     * @param documentPath the staged copy of a statement document
     * @return a completed result, or a structural failure describing the first limit that was violated
     */
    public ParseResult parseStatement(Path documentPath) {
        final String sourceName = PathUtils.getFileName(documentPath);

        if (!Files.isRegularFile(documentPath)) {
            return structuralFailure(sourceName, ErrorKind.FILE_NOT_FOUND, "File not found");
        }

        final long fileSize;
        try {
            fileSize = Files.size(documentPath);
        } catch (IOException e) {
            logger.error("Failed to read size of document {}", sourceName, e);
            return structuralFailure(sourceName, ErrorKind.IO_FAILURE, "Failed to read file attributes");
        }
        if (fileSize > maxFileSizeBytes) {
            return structuralFailure(sourceName, ErrorKind.FILE_TOO_LARGE,
                    "File too large: " + StringUtils.formatMegabytes(fileSize));
        }

        final StatementDocument document;
        try {
            document = documentLoader.load(documentPath);
        } catch (ZkbCatException e) {
            return structuralFailure(sourceName, e.getKind(), e.getMessage());
        }

        try {
            return parseDocument(sourceName, document);
        } finally {
            closeDocument(document);
        }
    }

    private ParseResult parseDocument(String sourceName, StatementDocument document) {
        final int pageCount = document.getPageCount();
        if (pageCount > maxPageCount) {
            return structuralFailure(sourceName, ErrorKind.PAGE_LIMIT_EXCEEDED,
                    String.format("PDF has too many pages (%d). Maximum: %d", pageCount, maxPageCount));
        }

        final StringBuilder fullText = new StringBuilder();
        int pagesWithText = 0;
        for (int pageIndex = 0; pageIndex < pageCount; pageIndex++) {
            final Optional<String> pageText = document.getPageText(pageIndex);
            if (pageText.isEmpty()) {
                logger.debug("Page {} yielded no text, skipping it", pageIndex + 1);
                continue;
            }

            fullText.append(pageText.get()).append('\n');
            pagesWithText++;
            if (fullText.length() >= maxContentCharacters) {
                return structuralFailure(sourceName, ErrorKind.CONTENT_TOO_LARGE,
                        String.format("PDF content too large. Maximum: %d characters", maxContentCharacters));
            }
        }

        final List<String> rawLines = fullText.toString().lines().toList();
        final List<Transaction> transactions = new ArrayList<>();
        int noiseLines = 0;
        for (String line : rawLines) {
            if (lineClassifier.isNoise(line)) {
                noiseLines++;
                continue;
            }
            transactionLineParser.parse(line.strip()).ifPresent(transactions::add);
        }

        logger.info("Parsed {} transactions from {} lines ({} noise) on {} of {} pages",
                transactions.size(), rawLines.size(), noiseLines, pagesWithText, pageCount);

        final List<String> parseErrors = new ArrayList<>();
        if (transactions.isEmpty()) {
            logger.warn("No transactions found in document {}", sourceName);
            parseErrors.add(NO_TRANSACTIONS_FOUND);
        }
        return ParseResult.completed(sourceName, transactions, rawLines, parseErrors);
    }

    private ParseResult structuralFailure(String sourceName, ErrorKind kind, String reason) {
        logger.warn("Parse of document {} failed with {}", sourceName, kind);
        return ParseResult.structuralFailure(sourceName, kind, reason);
    }

    private void closeDocument(StatementDocument document) {
        try {
            document.close();
        } catch (IOException e) {
            logger.warn("Failed to close document after parsing", e);
        }
    }
}
