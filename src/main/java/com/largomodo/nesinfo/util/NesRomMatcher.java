package com.largomodo.nesinfo.util;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * iNES image detection by file name.
 * <p>
 * Stateless utility performing filesystem checks. Safe for concurrent use when each
 * caller provides independent Path instances.
 */
public class NesRomMatcher {

    private static final String EXTENSION = ".nes";

    private NesRomMatcher() {
        // Static utility class - prevent instantiation
    }

    /**
     * Check if path is a regular file with a .nes extension (any case).
     *
     * @param path File path to check (can be null)
     * @return true if path is a regular file named like an iNES image, false otherwise
     */
    public static boolean isRom(Path path) {
        if (path == null) {
            return false;  // Safe filter predicate semantics (prevents NPE in stream filters)
        }
        if (!Files.isRegularFile(path)) {
            return false;
        }
        Path fileName = path.getFileName();
        return fileName != null && fileName.toString().toLowerCase(Locale.ROOT).endsWith(EXTENSION);
    }
}
