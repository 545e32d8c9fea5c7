package ca.jonathanfritz.zkbcat.secure;

/**
 * Permission to read a user-selected document, held for the duration of a single gateway-mediated access.
 * Releasing a scope never fails.
 */
public interface AccessScope extends AutoCloseable {

    @Override
    void close();
}
