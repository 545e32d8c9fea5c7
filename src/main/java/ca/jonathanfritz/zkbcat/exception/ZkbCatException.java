package ca.jonathanfritz.zkbcat.exception;

public class ZkbCatException extends Exception {

    private final ErrorKind kind;

    public ZkbCatException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ZkbCatException(ErrorKind kind, String message, Throwable t) {
        super(message, t);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }
}
