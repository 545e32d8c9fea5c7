package ca.jonathanfritz.zkbcat.secure;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Makes files and directories unreadable to anyone but the current user, using whatever mechanism the platform offers.
 *
 * @see PosixStorageProtection
 * @see NoOpStorageProtection
 */
public interface StorageProtection {

    void protectDirectory(Path directory) throws IOException;

    void protectFile(Path file) throws IOException;

    /**
     * The displayable name of the protection mechanism, used for logging
     */
    String getName();
}
