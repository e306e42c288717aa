package com.largomodo.retrohub.util;

/**
 * Deterministic game identifier derivation.
 * <p>
 * ID = first 8 code points of the base file name, uppercased, followed by one
 * disambiguation letter {@code 'A' + (hash mod 26)} where hash is a 32-bit polynomial
 * rolling hash ({@code hash = hash * 31 + codePoint}) over the full path.
 * <p>
 * The format must stay bit-for-bit stable: persisted snapshots and clients keep IDs
 * across daemon restarts.
 * <p>
 * Only 26 suffixes exist. Two paths whose truncated uppercase base names match and whose
 * hashes agree mod 26 produce the same ID ("roms/a/Mario.nes" and "roms/b/Mario.nes"
 * collide roughly one time in 26). Lookups by ID then return the first match in scan order.
 * <p>
 * Pure function with no state. Safe for concurrent use.
 */
public class GameIds {

    private static final int MAX_BASE_LENGTH = 8;
    private static final int SUFFIX_ALPHABET = 26;

    private GameIds() {
        // Static utility class - prevent instantiation
    }

    /**
     * Derive the ID for a ROM path.
     *
     * @param path Full file path as recorded in the library
     * @return ID such as "SUPERMARK"
     * @throws IllegalArgumentException if path is null
     */
    public static String generate(String path) {
        if (path == null) {
            throw new IllegalArgumentException("Path cannot be null");
        }

        String base = RomFileNames.baseName(RomFileNames.fileName(path));

        char suffix = (char) ('A' + Integer.remainderUnsigned(pathHash(path), SUFFIX_ALPHABET));
        return upperPrefix(base) + suffix;
    }

    /**
     * First {@value #MAX_BASE_LENGTH} code points, uppercased one code point at a time.
     * Simple case mapping keeps the length ("ß" stays "ß" instead of growing to "SS").
     */
    static String upperPrefix(String base) {
        StringBuilder prefix = new StringBuilder(MAX_BASE_LENGTH);
        int count = 0;
        for (int i = 0; i < base.length() && count < MAX_BASE_LENGTH; count++) {
            int codePoint = base.codePointAt(i);
            prefix.appendCodePoint(Character.toUpperCase(codePoint));
            i += Character.charCount(codePoint);
        }
        return prefix.toString();
    }

    /**
     * 32-bit rolling hash over code points. Overflow wraps; the result is interpreted as unsigned
     * by callers.
     */
    static int pathHash(String path) {
        int hash = 0;
        for (int i = 0; i < path.length(); ) {
            int codePoint = path.codePointAt(i);
            hash = hash * 31 + codePoint;
            i += Character.charCount(codePoint);
        }
        return hash;
    }
}
