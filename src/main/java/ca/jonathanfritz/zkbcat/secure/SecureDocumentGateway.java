package ca.jonathanfritz.zkbcat.secure;

import ca.jonathanfritz.zkbcat.config.AppConfig;
import ca.jonathanfritz.zkbcat.exception.ErrorKind;
import ca.jonathanfritz.zkbcat.exception.SecureFileException;
import ca.jonathanfritz.zkbcat.exception.ZkbCatException;
import ca.jonathanfritz.zkbcat.utils.PathUtils;
import ca.jonathanfritz.zkbcat.utils.StringUtils;
import com.google.inject.Inject;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.security.SecureRandom;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Mediates every access to a user-selected statement document.
 * <p>
 * The original document is validated against hard limits and then copied into a protected staging directory under
 * a random name. Callers only ever see the path of that copy, and only for the duration of a
 * {@link #withSecureAccess(Path, StagedDocumentFunction)} call. The copy is overwritten and deleted on every exit path,
 * including exceptions thrown by the caller's code. The original document is never modified.
 * <p>
 * A staged copy is registered with every gateway in the process and locked against other processes for as long as it
 * is in use. The staging directory sweep skips copies that are in use.
 */
public class SecureDocumentGateway {

    private static final Logger logger = LogManager.getLogger(SecureDocumentGateway.class);

    /**
     * number of leading bytes of a staged copy that are overwritten with random data before it is deleted
     */
    static final int OVERWRITE_LIMIT_BYTES = 1024;

    /**
     * absolute paths of the copies that are in use by any gateway in this process
     */
    private static final Set<Path> LIVE_STAGED_PATHS = ConcurrentHashMap.newKeySet();

    private final Path stagingDirectory;
    private final long maxFileSizeBytes;
    private final Set<String> allowedExtensions;
    private final StorageProtection storageProtection;
    private final AccessScopeProvider accessScopeProvider;
    private final SecureRandom random = new SecureRandom();

    @Inject
    public SecureDocumentGateway(AppConfig appConfig, StorageProtection storageProtection, AccessScopeProvider accessScopeProvider) {
        this(appConfig.resolveStagingDirectory(),
                appConfig.getLimits().getMaxFileSizeBytes(),
                appConfig.getAllowedExtensions(),
                storageProtection,
                accessScopeProvider);
    }

    public SecureDocumentGateway(Path stagingDirectory, long maxFileSizeBytes, List<String> allowedExtensions,
                                 StorageProtection storageProtection, AccessScopeProvider accessScopeProvider) {
        this.stagingDirectory = stagingDirectory;
        this.maxFileSizeBytes = maxFileSizeBytes;
        this.allowedExtensions = allowedExtensions.stream()
                .map(e -> e.toLowerCase(Locale.ROOT))
                .collect(Collectors.toUnmodifiableSet());
        this.storageProtection = storageProtection;
        this.accessScopeProvider = accessScopeProvider;
        logger.info("Staging directory is {}, storage protection is {}", stagingDirectory, storageProtection.getName());
    }

    /**
     * Validates the original document, stages a protected copy of it, and invokes body with the path of that copy.
     * The copy is securely destroyed before this method returns or throws, whatever body does.
     *
     * @param original the user-selected document. It is read but never modified
     * @param body     the work to do with the staged copy. It must not retain the path it is given
     * @param <T>      the type of object returned by body
     * @return whatever body returns
     * @throws SecureFileException if the original cannot be accessed, fails validation, or cannot be staged
     * @throws ZkbCatException     if body throws one. It is re-thrown after the copy has been destroyed
     */
    public <T> T withSecureAccess(Path original, StagedDocumentFunction<T> body) throws ZkbCatException {
        try (AccessScope ignored = accessScopeProvider.acquire(original)) {
            validateFile(original);

            try (StagedDocument stagedDocument = stage(original)) {
                logger.debug("Invoking body with staged document {}", stagedDocument.getOpaqueName());
                return body.apply(stagedDocument.getPath());
            }
        }
    }

    /**
     * Checks that the document exists, is no larger than the configured limit, and has an allowed extension
     *
     * @throws SecureFileException describing the first check that failed
     */
    public void validateFile(Path original) throws SecureFileException {
        if (!Files.isRegularFile(original)) {
            throw new SecureFileException(ErrorKind.FILE_NOT_FOUND, "File not found");
        }

        final long fileSize;
        try {
            fileSize = Files.size(original);
        } catch (IOException e) {
            throw new SecureFileException(ErrorKind.IO_FAILURE, "Failed to read file attributes", e);
        }
        if (fileSize > maxFileSizeBytes) {
            throw new SecureFileException(ErrorKind.FILE_TOO_LARGE, String.format("File too large (%s). Maximum allowed: %s",
                    StringUtils.formatMegabytes(fileSize), StringUtils.formatMegabytes(maxFileSizeBytes)));
        }

        final String extension = PathUtils.getExtension(original);
        if (!allowedExtensions.contains(extension)) {
            throw new SecureFileException(ErrorKind.INVALID_FILE_TYPE, String.format("Invalid file type: %s. Only %s files are allowed",
                    extension.isEmpty() ? "(none)" : extension, String.join(", ", allowedExtensions)));
        }
    }

    /**
     * Securely destroys every file left behind in the staging directory, i.e. by a process that was killed while a
     * document was staged. Copies that are still in use are skipped. Failures are logged and do not stop the sweep.
     *
     * @return the number of files that were destroyed
     * @throws SecureFileException if the staging directory cannot be listed
     */
    public int cleanupStagingDirectory() throws SecureFileException {
        if (!Files.isDirectory(stagingDirectory)) {
            return 0;
        }

        final List<Path> leftovers;
        try (Stream<Path> files = Files.list(stagingDirectory)) {
            leftovers = files.collect(Collectors.toList());
        } catch (IOException e) {
            throw new SecureFileException(ErrorKind.IO_FAILURE, "Failed to list staging directory", e);
        }

        int destroyed = 0;
        for (Path leftover : leftovers) {
            if (LIVE_STAGED_PATHS.contains(leftover.toAbsolutePath().normalize()) || isLockedByAnotherProcess(leftover)) {
                logger.debug("Skipping staged file {}, it is still in use", leftover.getFileName());
                continue;
            }
            try {
                securelyDeleteFile(leftover);
                destroyed++;
            } catch (SecureFileException e) {
                logger.error("Failed to destroy leftover staged file {}", leftover.getFileName(), e);
            }
        }
        if (destroyed > 0) {
            logger.info("Destroyed {} leftover staged files", destroyed);
        }
        return destroyed;
    }

    /**
     * Overwrites the first {@value #OVERWRITE_LIMIT_BYTES} bytes of the file with random data, then deletes it.
     * Does nothing if the file does not exist. The file is deleted even if it cannot be overwritten.
     *
     * @throws SecureFileException if either the overwrite or the delete fails
     */
    public void securelyDeleteFile(Path file) throws SecureFileException {
        if (!Files.exists(file, LinkOption.NOFOLLOW_LINKS)) {
            return;
        }

        IOException overwriteFailure = null;
        if (Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
            try {
                overwrite(file);
            } catch (IOException e) {
                overwriteFailure = e;
            }
        }

        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            if (overwriteFailure != null) {
                e.addSuppressed(overwriteFailure);
            }
            throw new SecureFileException(ErrorKind.IO_FAILURE, "Failed to delete staged file", e);
        }

        if (overwriteFailure != null) {
            throw new SecureFileException(ErrorKind.IO_FAILURE, "Deleted staged file, but failed to overwrite it first", overwriteFailure);
        }
    }

    Path getStagingDirectory() {
        return stagingDirectory;
    }

    /**
     * Called by a {@link StagedDocument} once its copy has been destroyed
     */
    void release(Path stagedPath) {
        LIVE_STAGED_PATHS.remove(stagedPath.toAbsolutePath().normalize());
    }

    private boolean isLockedByAnotherProcess(Path file) {
        if (!Files.isRegularFile(file, LinkOption.NOFOLLOW_LINKS)) {
            return false;
        }
        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE, LinkOption.NOFOLLOW_LINKS);
             FileLock lock = channel.tryLock(StagedDocument.LOCK_REGION_POSITION, 1, false)) {
            return lock == null;
        } catch (OverlappingFileLockException e) {
            // locked through another channel in this JVM
            return true;
        } catch (IOException e) {
            logger.debug("Could not check lock on staged file {}", file.getFileName(), e);
            return false;
        }
    }

    private void overwrite(Path file) throws IOException {
        final long fileSize = Files.size(file);
        if (fileSize == 0) {
            return;
        }

        final byte[] noise = new byte[(int) Math.min(fileSize, OVERWRITE_LIMIT_BYTES)];
        random.nextBytes(noise);

        try (FileChannel channel = FileChannel.open(file, StandardOpenOption.WRITE, LinkOption.NOFOLLOW_LINKS)) {
            final ByteBuffer buffer = ByteBuffer.wrap(noise);
            long position = 0;
            while (buffer.hasRemaining()) {
                position += channel.write(buffer, position);
            }
            channel.force(true);
        }
    }

    private StagedDocument stage(Path original) throws SecureFileException {
        final Path directory = prepareStagingDirectory();
        final Path stagedPath = directory.resolve(UUID.randomUUID() + "." + PathUtils.getExtension(original));
        LIVE_STAGED_PATHS.add(stagedPath.toAbsolutePath().normalize());
        final StagedDocument stagedDocument = new StagedDocument(stagedPath, this);

        try {
            stagedDocument.lock(FileChannel.open(stagedPath, StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE));

            // the copy is protected before any bytes of the original are written to it
            storageProtection.protectFile(stagedPath);
            try (InputStream in = Files.newInputStream(original)) {
                in.transferTo(Channels.newOutputStream(stagedDocument.getChannel()));
            }
        } catch (IOException e) {
            stagedDocument.close();
            throw new SecureFileException(ErrorKind.IO_FAILURE, "Failed to stage file securely", e);
        }

        logger.debug("Staged document as {}", stagedDocument.getOpaqueName());
        return stagedDocument;
    }

    private Path prepareStagingDirectory() throws SecureFileException {
        try {
            Files.createDirectories(stagingDirectory);
            storageProtection.protectDirectory(stagingDirectory);
            return stagingDirectory;
        } catch (IOException e) {
            throw new SecureFileException(ErrorKind.IO_FAILURE, "Failed to prepare staging directory", e);
        }
    }
}
