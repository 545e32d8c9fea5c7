package ca.jonathanfritz.zkbcat.secure;

import java.nio.file.Path;

/**
 * Used on platforms without an equivalent of POSIX permissions, and in tests
 */
public class NoOpStorageProtection implements StorageProtection {

    @Override
    public void protectDirectory(Path directory) {
        // nothing to do
    }

    @Override
    public void protectFile(Path file) {
        // nothing to do
    }

    @Override
    public String getName() {
        return "none";
    }
}
