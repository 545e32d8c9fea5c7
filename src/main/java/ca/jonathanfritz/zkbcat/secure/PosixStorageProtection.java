package ca.jonathanfritz.zkbcat.secure;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.util.Set;

/**
 * Restricts staged files to owner read/write and the staging directory to owner read/write/execute
 */
public class PosixStorageProtection implements StorageProtection {

    static final Set<PosixFilePermission> OWNER_ONLY_DIRECTORY = PosixFilePermissions.fromString("rwx------");
    static final Set<PosixFilePermission> OWNER_ONLY_FILE = PosixFilePermissions.fromString("rw-------");

    /**
     * Returns true if the default file system exposes POSIX permissions
     */
    public static boolean isSupported() {
        return FileSystems.getDefault().supportedFileAttributeViews().contains("posix");
    }

    @Override
    public void protectDirectory(Path directory) throws IOException {
        Files.setPosixFilePermissions(directory, OWNER_ONLY_DIRECTORY);
    }

    @Override
    public void protectFile(Path file) throws IOException {
        Files.setPosixFilePermissions(file, OWNER_ONLY_FILE);
    }

    @Override
    public String getName() {
        return "posix owner-only permissions";
    }
}
