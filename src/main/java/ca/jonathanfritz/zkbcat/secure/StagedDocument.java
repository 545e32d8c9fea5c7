package ca.jonathanfritz.zkbcat.secure;

import ca.jonathanfritz.zkbcat.exception.SecureFileException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.Closeable;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.file.Path;

/**
 * A protected working copy of a statement. Closing it securely destroys the copy, so it must always be opened in a
 * try-with-resources block that covers every use of {@link #getPath()}.
 * Destruction failures are logged, not thrown.
 */
final class StagedDocument implements Closeable {

    private static final Logger logger = LogManager.getLogger(StagedDocument.class);

    /**
     * start of the one-byte region that marks a copy as in use. It lies past the end of any file, so holding the lock
     * never blocks reads of the content
     */
    static final long LOCK_REGION_POSITION = Long.MAX_VALUE - 1;

    private final Path path;
    private final SecureDocumentGateway gateway;
    private FileChannel channel;
    private boolean destroyed = false;

    StagedDocument(Path path, SecureDocumentGateway gateway) {
        this.path = path;
        this.gateway = gateway;
    }

    /**
     * Takes ownership of an open channel to the copy and holds the in-use lock through it until {@link #close()}
     */
    void lock(FileChannel channel) throws IOException {
        this.channel = channel;
        channel.lock(LOCK_REGION_POSITION, 1, false);
    }

    FileChannel getChannel() {
        return channel;
    }

    Path getPath() {
        return path;
    }

    /**
     * The generated file name of the copy. It carries no information about the original document.
     */
    String getOpaqueName() {
        return String.valueOf(path.getFileName());
    }

    @Override
    public synchronized void close() {
        if (destroyed) {
            return;
        }
        destroyed = true;

        if (channel != null) {
            try {
                // releases the lock
                channel.close();
            } catch (IOException e) {
                logger.warn("Failed to close channel to staged document {}", getOpaqueName(), e);
            }
        }

        try {
            gateway.securelyDeleteFile(path);
            logger.debug("Destroyed staged document {}", getOpaqueName());
        } catch (SecureFileException e) {
            logger.error("Failed to destroy staged document {}", getOpaqueName(), e);
        } finally {
            gateway.release(path);
        }
    }
}
