package ca.jonathanfritz.zkbcat.secure;

import ca.jonathanfritz.zkbcat.exception.ErrorKind;
import ca.jonathanfritz.zkbcat.exception.SecureFileException;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Local files need no scoped permission, so the only thing to check is that an existing file can actually be read.
 * Missing files are left for the gateway's validation step to report.
 */
public class LocalFileAccessScopeProvider implements AccessScopeProvider {

    private static final AccessScope NO_SCOPE = () -> {
    };

    @Override
    public AccessScope acquire(Path original) throws SecureFileException {
        if (Files.exists(original) && !Files.isReadable(original)) {
            throw new SecureFileException(ErrorKind.SCOPE_ACCESS_FAILED, "Failed to access file securely");
        }
        return NO_SCOPE;
    }
}
