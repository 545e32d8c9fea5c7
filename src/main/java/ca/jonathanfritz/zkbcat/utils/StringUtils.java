package ca.jonathanfritz.zkbcat.utils;

import java.util.Locale;

public class StringUtils {

    private static final double BYTES_PER_MEGABYTE = 1024d * 1024d;

    /**
     * Renders a byte count as megabytes with one decimal place, i.e. 11010048 becomes "10.5 MB"
     */
    public static String formatMegabytes(long bytes) {
        return String.format(Locale.ROOT, "%.1f MB", bytes / BYTES_PER_MEGABYTE);
    }

    /**
     * Returns the value with leading and trailing whitespace removed, or an empty string if the value is blank
     */
    public static String coerceNullableString(String value) {
        return org.apache.commons.lang3.StringUtils.isNotBlank(value) ? value.strip() : "";
    }
}
