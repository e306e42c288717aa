package com.largomodo.retrohub.persistence;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Thrown when a snapshot file exists but cannot be decoded into a library.
 */
public class SnapshotFormatException extends IOException {

    private final Path file;

    public SnapshotFormatException(Path file, Throwable cause) {
        super("Library snapshot is not valid JSON: " + file + " (" + cause.getMessage() + ")", cause);
        this.file = file;
    }

    public SnapshotFormatException(Path file, String reason) {
        super("Library snapshot is not valid: " + file + " (" + reason + ")");
        this.file = file;
    }

    public Path getFile() {
        return file;
    }
}
