package com.largomodo.retrohub.persistence;

import com.google.gson.Gson;
import com.largomodo.retrohub.core.domain.LibrarySnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Reads and writes library snapshots as pretty-printed JSON files.
 * <p>
 * Writes overwrite the target in place (truncate + write). This is NOT crash-atomic:
 * a crash or full disk mid-write can leave a truncated file that the next load rejects
 * with {@link SnapshotFormatException}. A temp-file-plus-rename strategy would close the
 * gap but changes on-disk behavior (extra file, different inode), so it is not done here.
 * <p>
 * Stateless apart from the shared Gson instance. Callers serialize access per file
 * (the store holds its write lock while saving).
 */
public class SnapshotPersistence {

    private static final Logger log = LoggerFactory.getLogger(SnapshotPersistence.class);

    private final Gson gson;

    public SnapshotPersistence() {
        this(LibraryGson.pretty());
    }

    public SnapshotPersistence(Gson gson) {
        this.gson = gson;
    }

    /**
     * Load a snapshot file.
     *
     * @param file Snapshot location
     * @return Decoded snapshot, or empty if the file does not exist
     * @throws SnapshotFormatException if the file exists but is not a valid snapshot
     * @throws IOException             if the file exists but cannot be read
     */
    public Optional<LibrarySnapshot> read(Path file) throws IOException {
        String json;
        try {
            json = Files.readString(file, StandardCharsets.UTF_8);
        } catch (NoSuchFileException e) {
            log.debug("No snapshot at {}, starting with an empty library", file);
            return Optional.empty();
        } catch (CharacterCodingException e) {
            throw new SnapshotFormatException(file, e);
        }

        LibrarySnapshot snapshot;
        try {
            snapshot = gson.fromJson(json, LibrarySnapshot.class);
        } catch (RuntimeException e) {
            // JsonParseException for syntax/type errors; Gson wraps record constructor
            // failures (e.g. null list elements) in plain RuntimeException
            throw new SnapshotFormatException(file, e);
        }

        if (snapshot == null) {
            throw new SnapshotFormatException(file, "document is empty");
        }

        log.debug("Read snapshot {} ({} games)", file, snapshot.games().size());
        return Optional.of(snapshot);
    }

    /**
     * Write a snapshot, creating parent directories as needed and overwriting any existing file.
     *
     * @param file     Snapshot location
     * @param snapshot Full library state
     * @throws IOException if directories cannot be created or the file cannot be written
     */
    public void write(Path file, LibrarySnapshot snapshot) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }

        Files.writeString(file, gson.toJson(snapshot), StandardCharsets.UTF_8);
        log.debug("Wrote snapshot {} ({} games)", file, snapshot.games().size());
    }
}
