package ca.jonathanfritz.zkbcat.exception;

/**
 * The kinds of failure that can occur while staging, validating or parsing a statement.
 * Every kind except {@link #NO_TRANSACTIONS_FOUND} is fatal to the operation that raised it.
 */
public enum ErrorKind {
    FILE_TOO_LARGE,
    INVALID_FILE_TYPE,
    FILE_NOT_FOUND,
    SCOPE_ACCESS_FAILED,
    PAGE_LIMIT_EXCEEDED,
    CONTENT_TOO_LARGE,
    DOCUMENT_LOAD_FAILED,

    /**
     * soft warning, the parse still completes with an empty transaction list
     */
    NO_TRANSACTIONS_FOUND,

    /**
     * staging or destruction of the working copy failed
     */
    IO_FAILURE;

    public boolean isFatal() {
        return this != NO_TRANSACTIONS_FOUND;
    }
}
