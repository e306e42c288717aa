package com.largomodo.retrohub.ipc.payload;

/**
 * Payload of {@code add_scan_path}.
 *
 * @param path Directory to add to the scan roots
 */
public record ScanPathPayload(String path) {
}
