package ca.jonathanfritz.zkbcat.exception;

/**
 * Thrown by the secure document gateway when the original document cannot be validated, staged or destroyed
 */
public class SecureFileException extends ZkbCatException {

    public SecureFileException(ErrorKind kind, String message) {
        super(kind, message);
    }

    public SecureFileException(ErrorKind kind, String message, Throwable t) {
        super(kind, message, t);
    }
}
