package com.mimecast.wren.util;

import java.io.File;
import java.util.Locale;

/**
 * Path utilities.
 */
public final class PathUtils {

    /**
     * Protected constructor.
     */
    private PathUtils() {
        throw new IllegalStateException("Static class");
    }

    /**
     * Normalizes a value for use as a single path segment.
     * <p>Lowercases and replaces anything outside letters, digits, dot, dash, underscore and plus with an underscore.
     * <br>Dot only segments are replaced entirely so they cannot traverse.
     *
     * @param value String.
     * @return Safe path segment.
     */
    public static String normalize(String value) {
        String segment = value.trim().toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9._+\\-]", "_");
        if (segment.isEmpty() || segment.matches("\\.+")) {
            return segment.replace('.', '_') + "_";
        }
        return segment;
    }

    /**
     * Makes directory path if it does not exist.
     *
     * @param path Directory path.
     * @return Boolean, true if the directory exists afterwards.
     */
    public static boolean makePath(String path) {
        File dir = new File(path);
        return dir.isDirectory() || dir.mkdirs() || dir.isDirectory();
    }
}
