package com.largomodo.retrohub.persistence;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;

import java.time.Instant;

/**
 * Central Gson configuration so the snapshot file and the wire protocol agree on field
 * names and timestamp format.
 * <p>
 * Gson instances are immutable and thread-safe; callers may share them freely.
 */
public final class LibraryGson {

    private LibraryGson() {
        // Static factory class - prevent instantiation
    }

    /**
     * Compact single-line JSON for newline-delimited protocol messages.
     */
    public static Gson compact() {
        return baseBuilder().create();
    }

    /**
     * Indented JSON for the human-readable snapshot file.
     */
    public static Gson pretty() {
        return baseBuilder().setPrettyPrinting().create();
    }

    private static GsonBuilder baseBuilder() {
        return new GsonBuilder()
                .registerTypeAdapter(Instant.class, new InstantTypeAdapter().nullSafe())
                .disableHtmlEscaping();
    }
}
