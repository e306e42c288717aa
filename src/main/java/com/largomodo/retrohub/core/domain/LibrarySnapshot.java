package com.largomodo.retrohub.core.domain;

import com.google.gson.annotations.SerializedName;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Full-state dump of a library, the unit of persistence.
 * <p>
 * Written whole on every save and read whole on load; there is no delta format.
 * Collections are copied on construction so a snapshot taken under the store lock
 * can be serialized after the lock is released.
 *
 * @param games      All records in discovery order
 * @param scanPaths  Configured scan roots
 * @param categories Record count per category
 * @param platforms  Record count per platform
 * @param lastScan   Completion time of the last scan, {@link GameRecord#NEVER_PLAYED} if none
 */
public record LibrarySnapshot(
        List<GameRecord> games,
        @SerializedName("scan_paths") List<String> scanPaths,
        Map<String, Integer> categories,
        Map<String, Integer> platforms,
        @SerializedName("last_scan") Instant lastScan
) {

    public LibrarySnapshot {
        games = games == null ? List.of() : List.copyOf(games);
        scanPaths = scanPaths == null ? List.of() : List.copyOf(scanPaths);
        categories = orderedCopy(categories);
        platforms = orderedCopy(platforms);
        lastScan = lastScan == null ? GameRecord.NEVER_PLAYED : lastScan;
    }

    // Preserves insertion order so counts appear in discovery order in the snapshot file
    private static Map<String, Integer> orderedCopy(Map<String, Integer> counts) {
        return counts == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(counts));
    }

    public static LibrarySnapshot empty() {
        return new LibrarySnapshot(List.of(), List.of(), Map.of(), Map.of(), GameRecord.NEVER_PLAYED);
    }
}
