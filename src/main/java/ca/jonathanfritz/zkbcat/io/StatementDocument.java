package ca.jonathanfritz.zkbcat.io;

import java.io.IOException;
import java.util.Optional;

/**
 * A loaded statement document whose pages can be read as plain text, one page at a time.
 * Implementations hold native resources, so always use them in a try-with-resources block.
 */
public interface StatementDocument extends AutoCloseable {

    int getPageCount();

    /**
     * Extracts the plain text of a single page.
     *
     * @param pageIndex zero-based page index
     * @return the page text, or empty if the page yields no text or its text cannot be extracted
     */
    Optional<String> getPageText(int pageIndex);

    @Override
    void close() throws IOException;
}
