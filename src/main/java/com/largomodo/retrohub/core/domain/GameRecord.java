package com.largomodo.retrohub.core.domain;

import com.google.gson.annotations.SerializedName;

import java.time.Instant;

/**
 * Immutable description of one ROM file discovered during a library scan.
 * <p>
 * Records are created by the scanner only. Favorite toggling and play recording
 * produce updated copies via {@link #withFavorite(boolean)} and {@link #withPlay(Instant)};
 * the store swaps the copy into the same position of its sequence.
 * <p>
 * Null components (possible when a hand-edited snapshot omits fields) are normalized
 * in the compact constructor so readers never see nulls.
 *
 * @param id          Derived identifier, see {@code GameIds}
 * @param title       Cleaned display title
 * @param description Free-form description (empty when unknown)
 * @param platform    Platform name from the platform table
 * @param path        Source file path, also the scan key
 * @param coverPath   Cover image path (empty when unknown)
 * @param lastPlayed  Time of last recorded play, {@link #NEVER_PLAYED} if none
 * @param playCount   Number of recorded plays (never negative)
 * @param favorite    Favorite flag
 * @param category    Grouping label, {@link #UNCATEGORIZED} by default
 */
public record GameRecord(
        String id,
        String title,
        String description,
        String platform,
        String path,
        @SerializedName("cover_path") String coverPath,
        @SerializedName("last_played") Instant lastPlayed,
        @SerializedName("play_count") int playCount,
        boolean favorite,
        String category
) {

    public static final String UNCATEGORIZED = "Uncategorized";

    /**
     * Zero timestamp used for games that were never played (year 1, UTC).
     */
    public static final Instant NEVER_PLAYED = Instant.parse("0001-01-01T00:00:00Z");

    public GameRecord {
        id = id == null ? "" : id;
        title = title == null ? "" : title;
        description = description == null ? "" : description;
        platform = platform == null ? "" : platform;
        path = path == null ? "" : path;
        coverPath = coverPath == null ? "" : coverPath;
        lastPlayed = lastPlayed == null ? NEVER_PLAYED : lastPlayed;
        category = category == null ? UNCATEGORIZED : category;
        if (playCount < 0) {
            throw new IllegalArgumentException("playCount must not be negative, got: " + playCount);
        }
    }

    /**
     * Create a freshly scanned record: never played, not a favorite, uncategorized.
     */
    public static GameRecord discovered(String id, String title, String platform, String path) {
        return new GameRecord(id, title, "", platform, path, "", NEVER_PLAYED, 0, false, UNCATEGORIZED);
    }

    public GameRecord withFavorite(boolean newFavorite) {
        return new GameRecord(id, title, description, platform, path, coverPath,
                lastPlayed, playCount, newFavorite, category);
    }

    public GameRecord withPlay(Instant playedAt) {
        return new GameRecord(id, title, description, platform, path, coverPath,
                playedAt, playCount + 1, favorite, category);
    }
}
