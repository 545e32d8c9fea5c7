package ca.jonathanfritz.zkbcat.utils;

import org.apache.commons.lang3.StringUtils;

import java.nio.file.Path;
import java.util.Locale;

public class PathUtils {

    /**
     * Returns the full path to the ~/.zkbcat directory, where config.yaml and category-rules.yaml live
     */
    public Path getConfigPath() {
        final String homeDirectory = System.getProperty("user.home");
        return Path.of(homeDirectory, ".zkbcat");
    }

    /**
     * Returns the lowercase extension of the file that the path points to, without the leading dot.
     * Returns an empty string if the file name has no extension.
     */
    public static String getExtension(Path path) {
        final String fileName = getFileName(path);
        final int dot = fileName.lastIndexOf('.');
        if (dot <= 0 || dot == fileName.length() - 1) {
            return "";
        }
        return fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    /**
     * Returns the last element of the path as a string, or an empty string for a root path
     */
    public static String getFileName(Path path) {
        final Path fileName = path.getFileName();
        return fileName != null ? StringUtils.defaultString(fileName.toString()) : "";
    }
}
