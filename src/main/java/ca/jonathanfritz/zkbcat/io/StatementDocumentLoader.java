package ca.jonathanfritz.zkbcat.io;

import ca.jonathanfritz.zkbcat.exception.ZkbCatException;

import java.nio.file.Path;

/**
 * Turns a local file into a {@link StatementDocument}. This is the only place that knows about the document format.
 */
public interface StatementDocumentLoader {

    /**
     * @throws ZkbCatException with kind {@link ca.jonathanfritz.zkbcat.exception.ErrorKind#DOCUMENT_LOAD_FAILED} if the
     *                         file cannot be opened as a document
     */
    StatementDocument load(Path path) throws ZkbCatException;
}
