package ca.jonathanfritz.zkbcat.service;

import static org.junit.jupiter.api.Assertions.*;

import ca.jonathanfritz.zkbcat.TestUtils;
import ca.jonathanfritz.zkbcat.config.AppConfig;
import ca.jonathanfritz.zkbcat.exception.ErrorKind;
import ca.jonathanfritz.zkbcat.exception.SecureFileException;
import ca.jonathanfritz.zkbcat.io.PdfBoxDocumentLoader;
import ca.jonathanfritz.zkbcat.matching.Categorizer;
import ca.jonathanfritz.zkbcat.matching.CategoryRulesLoader;
import ca.jonathanfritz.zkbcat.parser.LineClassifier;
import ca.jonathanfritz.zkbcat.parser.ParseCoordinator;
import ca.jonathanfritz.zkbcat.parser.StatementValidator;
import ca.jonathanfritz.zkbcat.parser.TransactionLineParser;
import ca.jonathanfritz.zkbcat.parser.ValidationResult;
import ca.jonathanfritz.zkbcat.secure.LocalFileAccessScopeProvider;
import ca.jonathanfritz.zkbcat.secure.NoOpStorageProtection;
import ca.jonathanfritz.zkbcat.secure.SecureDocumentGateway;
import ca.jonathanfritz.zkbcat.transactions.Category;
import ca.jonathanfritz.zkbcat.transactions.ParseResult;
import ca.jonathanfritz.zkbcat.transactions.Transaction;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StatementImportServiceTest {

    @TempDir
    Path tempDir;

    private Path stagingDirectory;
    private StatementImportService statementImportService;

    @BeforeEach
    void setUp() {
        final AppConfig appConfig = AppConfig.defaults();
        stagingDirectory = tempDir.resolve("staging");

        final SecureDocumentGateway gateway = new SecureDocumentGateway(stagingDirectory,
                appConfig.getLimits().getMaxFileSizeBytes(), appConfig.getAllowedExtensions(),
                new NoOpStorageProtection(), new LocalFileAccessScopeProvider());
        final Categorizer categorizer = new Categorizer(new CategoryRulesLoader().loadBundled("category-rules.yaml"));
        final PdfBoxDocumentLoader documentLoader = new PdfBoxDocumentLoader();
        final ParseCoordinator parseCoordinator = new ParseCoordinator(documentLoader, new LineClassifier(),
                new TransactionLineParser(categorizer, appConfig), appConfig);
        final StatementValidator statementValidator = new StatementValidator(documentLoader, appConfig);

        statementImportService = new StatementImportService(gateway, parseCoordinator, statementValidator);
    }

    @Test
    void parsesStatementUnderItsOriginalName() throws Exception {
        // Setup
        Path original = TestUtils.createPdf(tempDir.resolve("Kontoauszug_Januar_2026.pdf"),
                List.of(TestUtils.SAMPLE_STATEMENT_PAGE));

        // Execute
        ParseResult result = statementImportService.parseStatement(original);

        // Verify: The staged name never reaches the caller
        assertEquals("Kontoauszug_Januar_2026.pdf", result.getSourceName());
        assertEquals(5, result.getTransactions().size());
        assertTrue(result.getParseErrors().isEmpty());

        // Verify: Nothing is left in the staging directory, the original is still there
        assertEquals(0, countStagedFiles());
        assertTrue(Files.exists(original));
    }

    @Test
    void corruptDocumentIsStructuralFailureNotException() throws Exception {
        // Setup
        Path original = Files.writeString(tempDir.resolve("corrupt.pdf"), "definitely not a pdf");

        // Execute
        ParseResult result = statementImportService.parseStatement(original);

        // Verify
        assertTrue(result.isStructuralFailure());
        assertEquals(ErrorKind.DOCUMENT_LOAD_FAILED, result.getFailureKind().orElseThrow());
        assertEquals("corrupt.pdf", result.getSourceName());
        assertEquals(0, countStagedFiles());
    }

    @Test
    void gatewayRejectionIsThrown() throws Exception {
        // Setup
        Path original = Files.writeString(tempDir.resolve("statement.csv"), "date;amount");

        // Execute
        SecureFileException ex = assertThrows(SecureFileException.class,
                () -> statementImportService.parseStatement(original));

        // Verify
        assertEquals(ErrorKind.INVALID_FILE_TYPE, ex.getKind());
    }

    @Test
    void validatesStatement() throws Exception {
        // Setup
        Path original = TestUtils.createPdf(tempDir.resolve("januar.pdf"), List.of(TestUtils.SAMPLE_STATEMENT_PAGE));

        // Execute
        ValidationResult result = statementImportService.validateStatement(original);

        // Verify
        assertEquals(ValidationResult.valid("Valid ZKB statement"), result);
        assertEquals(0, countStagedFiles());
    }

    @Test
    void validationReportsGatewayFailures() throws Exception {
        // Setup
        Path tooLarge = TestUtils.createFileOfSize(tempDir.resolve("huge.pdf"), AppConfig.DEFAULT_MAX_FILE_SIZE_BYTES + 1);

        // Execute
        ValidationResult missing = statementImportService.validateStatement(tempDir.resolve("missing.pdf"));
        ValidationResult large = statementImportService.validateStatement(tooLarge);

        // Verify
        assertEquals(ValidationResult.invalid("File not found"), missing);
        assertFalse(large.valid());
        assertTrue(large.reason().startsWith("File too large"));
    }

    @Test
    void confirmHandsTransactionsToSink() throws Exception {
        // Setup: Parse, then recategorize one transaction during the dry run
        Path original = TestUtils.createPdf(tempDir.resolve("januar.pdf"), List.of(TestUtils.SAMPLE_STATEMENT_PAGE));
        ParseResult result = statementImportService.parseStatement(original);
        result.getTransactions().get(0).setCategory(Category.DINING);
        List<Transaction> stored = new ArrayList<>();

        // Execute
        statementImportService.confirm(result, stored::addAll);

        // Verify
        assertEquals(result.getTransactions(), stored);
        assertEquals(Category.DINING, stored.get(0).getCategory());
    }

    @Test
    void confirmingFailedParseIsRejected() {
        // Setup
        ParseResult failed = ParseResult.structuralFailure("januar.pdf", ErrorKind.PAGE_LIMIT_EXCEEDED, "too many pages");

        // Execute + Verify
        assertThrows(IllegalStateException.class, () -> statementImportService.confirm(failed, transactions -> fail()));
    }

    @Test
    void confirmingEmptyResultDoesNothing() {
        // Setup
        ParseResult empty = ParseResult.completed("januar.pdf", List.of(), List.of(),
                List.of(ParseCoordinator.NO_TRANSACTIONS_FOUND));

        // Execute + Verify
        assertDoesNotThrow(() -> statementImportService.confirm(empty, transactions -> fail()));
    }

    @Test
    void clearsLeftoverStagedFiles() throws Exception {
        // Setup
        Files.createDirectories(stagingDirectory);
        Files.writeString(stagingDirectory.resolve("leftover.pdf"), "%PDF-1.7");

        // Execute
        int destroyed = statementImportService.clearSensitiveFiles();

        // Verify
        assertEquals(1, destroyed);
        assertEquals(0, countStagedFiles());
    }

    private long countStagedFiles() throws IOException {
        if (!Files.isDirectory(stagingDirectory)) {
            return 0;
        }
        try (Stream<Path> files = Files.list(stagingDirectory)) {
            return files.count();
        }
    }
}
