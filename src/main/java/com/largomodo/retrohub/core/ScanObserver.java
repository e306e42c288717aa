package com.largomodo.retrohub.core;

import com.largomodo.retrohub.core.domain.GameRecord;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Observer interface for library scan lifecycle events.
 * <p>
 * All methods have default no-op implementations so consumers override only the
 * events they care about. Callbacks run on the scanning thread while the store's
 * write lock is held: implementations must not call back into the store.
 *
 * @see LibraryStore#scan()
 */
public interface ScanObserver {

    ScanObserver NONE = new ScanObserver() {
    };

    /**
     * Called before a scan root is traversed.
     *
     * @param root the scan root
     */
    default void onRootStart(Path root) {}

    /**
     * Called for each ROM file that produced a record.
     *
     * @param game the new record
     */
    default void onGameDiscovered(GameRecord game) {}

    /**
     * Called when a root could not be traversed completely. The scan continues with the next root.
     *
     * @param root the scan root
     * @param e    the traversal failure
     */
    default void onRootFailure(Path root, IOException e) {}

    /**
     * Called once the new records are committed in memory, before persisting.
     *
     * @param gameCount number of records found
     */
    default void onScanComplete(int gameCount) {}
}
