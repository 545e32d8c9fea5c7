package ca.jonathanfritz.zkbcat.parser;

import static org.junit.jupiter.api.Assertions.*;

import ca.jonathanfritz.zkbcat.TestUtils;
import ca.jonathanfritz.zkbcat.config.AppConfig;
import ca.jonathanfritz.zkbcat.io.FakeStatementDocumentLoader;
import ca.jonathanfritz.zkbcat.io.PdfBoxDocumentLoader;
import ca.jonathanfritz.zkbcat.io.StatementDocumentLoader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.apache.commons.lang3.StringUtils;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class StatementValidatorTest {

    private static final List<String> MARKERS = AppConfig.defaults().getStatementMarkers();
    private static final Path DOCUMENT = Path.of("statement.pdf");

    @TempDir
    Path tempDir;

    @Test
    void statementWithMarkerIsValid() {
        // Setup
        FakeStatementDocumentLoader loader = FakeStatementDocumentLoader.withPages("Zürcher Kantonalbank\nKontoauszug");

        // Execute
        ValidationResult result = newValidator(loader).validate(DOCUMENT);

        // Verify
        assertTrue(result.valid());
        assertEquals("Valid ZKB statement", result.reason());
        assertEquals(1, loader.getCloseCount());
    }

    @Test
    void markersAreMatchedCaseInsensitively() {
        // Setup
        FakeStatementDocumentLoader loader = FakeStatementDocumentLoader.withPages("ZÜRCHER KANTONALBANK");

        // Execute + Verify
        assertTrue(newValidator(loader).validate(DOCUMENT).valid());
    }

    @Test
    void unloadableDocumentIsInvalid() {
        // Execute
        ValidationResult result = newValidator(FakeStatementDocumentLoader.failing()).validate(DOCUMENT);

        // Verify
        assertEquals(ValidationResult.invalid("Invalid PDF file"), result);
    }

    @Test
    void documentWithoutPagesIsInvalid() {
        // Setup
        FakeStatementDocumentLoader loader = FakeStatementDocumentLoader.withPages(List.of());

        // Execute
        ValidationResult result = newValidator(loader).validate(DOCUMENT);

        // Verify
        assertEquals(ValidationResult.invalid("PDF has no pages"), result);
        assertEquals(1, loader.getCloseCount());
    }

    @Test
    void maximumPageCountIsValid() {
        // Execute
        ValidationResult result = newValidator(pages(100)).validate(DOCUMENT);

        // Verify
        assertTrue(result.valid());
    }

    @Test
    void oneMorePageThanMaximumIsInvalid() {
        // Execute
        ValidationResult result = newValidator(pages(101)).validate(DOCUMENT);

        // Verify
        assertEquals(ValidationResult.invalid("PDF has too many pages (potential security risk)"), result);
    }

    @Test
    void unreadableFirstPageIsInvalid() {
        // Setup: The first page yields no text, the second one would
        FakeStatementDocumentLoader loader = FakeStatementDocumentLoader.withPages(null, "Kontoauszug");

        // Execute
        ValidationResult result = newValidator(loader).validate(DOCUMENT);

        // Verify
        assertEquals(ValidationResult.invalid("Cannot read PDF content"), result);
    }

    @Test
    void contentLimitIsExclusive() {
        // Setup: A validator that allows up to 49 characters
        StatementValidator validator = new StatementValidator(
                FakeStatementDocumentLoader.withPages("zkb" + StringUtils.repeat('x', 47)), 100, 50, MARKERS);
        StatementValidator smallerPage = new StatementValidator(
                FakeStatementDocumentLoader.withPages("zkb" + StringUtils.repeat('x', 46)), 100, 50, MARKERS);

        // Execute + Verify
        assertEquals(ValidationResult.invalid("PDF content too large"), validator.validate(DOCUMENT));
        assertTrue(smallerPage.validate(DOCUMENT).valid());
    }

    @Test
    void pageWithoutMarkerIsInvalid() {
        // Setup
        FakeStatementDocumentLoader loader = FakeStatementDocumentLoader.withPages("UBS Switzerland AG\nAccount overview");

        // Execute
        ValidationResult result = newValidator(loader).validate(DOCUMENT);

        // Verify
        assertEquals(ValidationResult.invalid("PDF does not appear to be a ZKB statement"), result);
    }

    @Test
    void blankMarkersAreIgnored() {
        // Setup
        StatementValidator validator = new StatementValidator(FakeStatementDocumentLoader.withPages("Account overview"),
                100, 1000, Arrays.asList("", "  ", null));

        // Execute + Verify
        assertEquals(ValidationResult.invalid("PDF does not appear to be a ZKB statement"), validator.validate(DOCUMENT));
    }

    @Test
    void onlyFirstPageIsChecked() {
        // Setup: The marker only appears on the second page
        FakeStatementDocumentLoader loader = FakeStatementDocumentLoader.withPages("Account overview", "Kontoauszug");

        // Execute
        ValidationResult result = newValidator(loader).validate(DOCUMENT);

        // Verify
        assertFalse(result.valid());
        assertEquals(List.of(0), loader.getPagesRead());
    }

    @Test
    void validationIsIdempotent() throws Exception {
        // Setup
        Path pdf = TestUtils.createPdf(tempDir.resolve("statement.pdf"), List.of(TestUtils.SAMPLE_STATEMENT_PAGE));
        byte[] before = Files.readAllBytes(pdf);
        StatementValidator validator = newValidator(new PdfBoxDocumentLoader());

        // Execute
        ValidationResult first = validator.validate(pdf);
        ValidationResult second = validator.validate(pdf);

        // Verify: Same result, document untouched
        assertTrue(first.valid());
        assertEquals(first, second);
        assertArrayEquals(before, Files.readAllBytes(pdf));
    }

    @Test
    void pdfPageLimitBoundary() throws Exception {
        // Setup
        Path hundredPages = TestUtils.createPdf(tempDir.resolve("100.pdf"), List.of("Kontoauszug"), 100);
        Path hundredAndOnePages = TestUtils.createPdf(tempDir.resolve("101.pdf"), List.of("Kontoauszug"), 101);
        StatementValidator validator = newValidator(new PdfBoxDocumentLoader());

        // Execute + Verify
        assertTrue(validator.validate(hundredPages).valid());
        assertEquals(ValidationResult.invalid("PDF has too many pages (potential security risk)"),
                validator.validate(hundredAndOnePages));
    }

    @Test
    void pdfWithBlankFirstPageCannotBeRead() throws Exception {
        // Setup
        Path pdf = TestUtils.createPdf(tempDir.resolve("blank.pdf"), List.of(List.of(), List.of("Kontoauszug")));

        // Execute + Verify
        assertEquals(ValidationResult.invalid("Cannot read PDF content"),
                newValidator(new PdfBoxDocumentLoader()).validate(pdf));
    }

    @Test
    void fileThatIsNotAPdfIsInvalid() throws Exception {
        // Setup
        Path notAPdf = Files.writeString(tempDir.resolve("statement.pdf"), "plain text");

        // Execute + Verify
        assertEquals(ValidationResult.invalid("Invalid PDF file"), newValidator(new PdfBoxDocumentLoader()).validate(notAPdf));
    }

    private static StatementValidator newValidator(StatementDocumentLoader loader) {
        return new StatementValidator(loader, AppConfig.DEFAULT_MAX_PAGE_COUNT, AppConfig.DEFAULT_MAX_CONTENT_CHARACTERS,
                MARKERS);
    }

    private static FakeStatementDocumentLoader pages(int count) {
        final List<String> pages = new ArrayList<>();
        pages.add("Kontoauszug");
        pages.addAll(Collections.nCopies(count - 1, ""));
        return FakeStatementDocumentLoader.withPages(pages);
    }
}
