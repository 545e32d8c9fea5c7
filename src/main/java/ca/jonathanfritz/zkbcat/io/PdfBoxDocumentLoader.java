package ca.jonathanfritz.zkbcat.io;

import ca.jonathanfritz.zkbcat.exception.ErrorKind;
import ca.jonathanfritz.zkbcat.exception.ZkbCatException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Loads PDF statements with Apache PDFBox and extracts their text page by page
 */
public class PdfBoxDocumentLoader implements StatementDocumentLoader {

    private static final Logger logger = LogManager.getLogger(PdfBoxDocumentLoader.class);

    @Override
    public StatementDocument load(Path path) throws ZkbCatException {
        try {
            final PDDocument document = Loader.loadPDF(path.toFile());
            logger.debug("Loaded PDF with {} pages", document.getNumberOfPages());
            return new PdfBoxStatementDocument(document);
        } catch (IOException e) {
            throw new ZkbCatException(ErrorKind.DOCUMENT_LOAD_FAILED, "Failed to load PDF document", e);
        }
    }

    private static class PdfBoxStatementDocument implements StatementDocument {

        private final PDDocument document;
        private final PDFTextStripper stripper;

        private PdfBoxStatementDocument(PDDocument document) {
            this.document = document;
            this.stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            stripper.setLineSeparator("\n");
        }

        @Override
        public int getPageCount() {
            return document.getNumberOfPages();
        }

        @Override
        public Optional<String> getPageText(int pageIndex) {
            if (pageIndex < 0 || pageIndex >= getPageCount()) {
                return Optional.empty();
            }

            // PDFTextStripper page numbers are 1-based and inclusive
            stripper.setStartPage(pageIndex + 1);
            stripper.setEndPage(pageIndex + 1);
            try {
                final String text = stripper.getText(document);
                return text.isBlank() ? Optional.empty() : Optional.of(text);
            } catch (IOException e) {
                logger.warn("Failed to extract text from page {}, skipping it", pageIndex + 1, e);
                return Optional.empty();
            }
        }

        @Override
        public void close() throws IOException {
            document.close();
        }
    }
}
