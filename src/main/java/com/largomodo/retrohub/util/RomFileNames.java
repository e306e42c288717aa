package com.largomodo.retrohub.util;

import java.util.Locale;

/**
 * File name splitting shared by platform detection, ID derivation and title cleaning.
 * <p>
 * The extension is everything from the LAST dot of the file name, dot included.
 * A leading dot counts: ".nes" has extension ".nes" and an empty base name.
 * Names without a dot have an empty extension.
 * <p>
 * Pure functions with no state. Safe for concurrent use.
 */
public class RomFileNames {

    private RomFileNames() {
        // Static utility class - prevent instantiation
    }

    /**
     * Extension of a file name, including the dot, with original case.
     *
     * @param fileName Bare file name (no directory part)
     * @return Extension such as ".SFC", or empty string
     */
    public static String extension(String fileName) {
        int lastDot = fileName.lastIndexOf('.');
        return lastDot >= 0 ? fileName.substring(lastDot) : "";
    }

    /**
     * Lower-cased extension used as platform lookup key.
     */
    public static String lowerCaseExtension(String fileName) {
        return extension(fileName).toLowerCase(Locale.ROOT);
    }

    /**
     * File name with its extension removed: "Zelda (USA).sfc" → "Zelda (USA)".
     */
    public static String baseName(String fileName) {
        int lastDot = fileName.lastIndexOf('.');
        return lastDot >= 0 ? fileName.substring(0, lastDot) : fileName;
    }

    /**
     * Last path element of a path string, accepting both '/' and '\' separators so
     * snapshots written on another OS still derive the same names.
     */
    public static String fileName(String path) {
        int slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
