package com.largomodo.retrohub.util;

import java.util.List;

/**
 * Display title cleaning for scanned ROM file names.
 * <p>
 * "Super_Mario-World (USA).sfc" → "Super Mario World". Region tags are removed wherever
 * they occur, not only at the end; spacing left behind inside the title is kept.
 */
public class GameTitles {

    private static final List<String> REGION_TAGS = List.of("(USA)", "(Europe)", "(Japan)");

    private GameTitles() {
        // Static utility class - prevent instantiation
    }

    /**
     * Clean a bare file name into a display title.
     *
     * @param fileName File name including extension (no directory part)
     * @return Cleaned title, possibly empty
     */
    public static String clean(String fileName) {
        String title = RomFileNames.baseName(fileName)
                .replace('_', ' ')
                .replace('-', ' ');
        for (String tag : REGION_TAGS) {
            title = title.replace(tag, "");
        }
        return title.strip();
    }
}
