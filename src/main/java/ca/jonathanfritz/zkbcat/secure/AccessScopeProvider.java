package ca.jonathanfritz.zkbcat.secure;

import ca.jonathanfritz.zkbcat.exception.SecureFileException;

import java.nio.file.Path;

/**
 * Acquires whatever platform-specific permission is needed before a user-selected document can be read
 */
public interface AccessScopeProvider {

    /**
     * @throws SecureFileException with kind {@link ca.jonathanfritz.zkbcat.exception.ErrorKind#SCOPE_ACCESS_FAILED} if
     *                             access to the document cannot be obtained
     */
    AccessScope acquire(Path original) throws SecureFileException;
}
