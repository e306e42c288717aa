package com.largomodo.retrohub.core;

import com.largomodo.retrohub.core.domain.GameRecord;
import com.largomodo.retrohub.core.domain.LibrarySnapshot;
import com.largomodo.retrohub.persistence.SnapshotPersistence;
import com.largomodo.retrohub.util.GameIds;
import com.largomodo.retrohub.util.GameTitles;
import com.largomodo.retrohub.util.RomFileNames;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.NoSuchFileException;
import java.nio.file.NotDirectoryException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Thread-safe, persistent catalog of ROM files found under the configured scan roots.
 * <p>
 * Locking: a single {@link ReentrantReadWriteLock} guards all state. Mutations
 * ({@link #scan()}, {@link #toggleFavorite(String)}, {@link #recordPlay(String)},
 * {@link #addScanPath(String)}, {@link #load()}, {@link #save()}) take the write lock;
 * queries take the read lock. A scan holds the write lock for its whole duration, so a
 * slow disk blocks every other client until it finishes. There is no cancellation.
 * <p>
 * Rescan semantics: records are rebuilt from scratch. Favorite flags, play counts and
 * last-played times of the previous generation are discarded, not merged.
 * <p>
 * Persistence failures are reported to the caller but never roll back memory: after a
 * failed save the in-memory library is newer than the file until the next successful save.
 * <p>
 * All returned collections are copies; callers never see live store state.
 */
public class LibraryStore {

    private static final Logger log = LoggerFactory.getLogger(LibraryStore.class);

    // Most recent first; ID then path make the order total so equal timestamps sort stably
    private static final Comparator<GameRecord> RECENTLY_PLAYED_ORDER =
            Comparator.comparing(GameRecord::lastPlayed).reversed()
                    .thenComparing(GameRecord::id)
                    .thenComparing(GameRecord::path);

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final Path snapshotFile;
    private final PlatformTable platformTable;
    private final SnapshotPersistence persistence;
    private final Clock clock;
    private final ScanObserver observer;

    private List<GameRecord> games = new ArrayList<>();
    private final List<String> scanPaths = new ArrayList<>();
    private Map<String, Integer> platformCounts = new LinkedHashMap<>();
    private Map<String, Integer> categoryCounts = new LinkedHashMap<>();
    private Instant lastScan = GameRecord.NEVER_PLAYED;

    public LibraryStore(Path snapshotFile, PlatformTable platformTable) {
        this(snapshotFile, platformTable, new SnapshotPersistence(), Clock.systemUTC(), ScanObserver.NONE);
    }

    /**
     * @param snapshotFile  Where {@link #load()} reads and {@link #save()} writes
     * @param platformTable Immutable extension → platform mapping used by scans
     * @param persistence   Snapshot codec
     * @param clock         Source of scan and play timestamps
     * @param observer      Scan lifecycle callbacks (invoked under the write lock)
     */
    public LibraryStore(Path snapshotFile, PlatformTable platformTable, SnapshotPersistence persistence,
                        Clock clock, ScanObserver observer) {
        if (snapshotFile == null) {
            throw new IllegalArgumentException("snapshotFile must not be null");
        }
        if (platformTable == null) {
            throw new IllegalArgumentException("platformTable must not be null");
        }
        this.snapshotFile = snapshotFile;
        this.platformTable = platformTable;
        this.persistence = persistence;
        this.clock = clock;
        this.observer = observer == null ? ScanObserver.NONE : observer;
    }

    // --- Persistence ---

    /**
     * Replace in-memory state with the snapshot file's contents.
     * A missing file leaves the store unchanged (empty on first start).
     *
     * @throws com.largomodo.retrohub.persistence.SnapshotFormatException if the file is not a valid snapshot
     * @throws IOException                                                if the file cannot be read
     */
    public void load() throws IOException {
        lock.writeLock().lock();
        try {
            Optional<LibrarySnapshot> snapshot = persistence.read(snapshotFile);
            if (snapshot.isPresent()) {
                apply(snapshot.get());
                log.info("Library loaded from {}: {} games, {} scan paths",
                        snapshotFile, games.size(), scanPaths.size());
            }
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Write the full library state to the snapshot file, overwriting it in place.
     *
     * @throws IOException if the file or its parent directories cannot be written
     */
    public void save() throws IOException {
        lock.writeLock().lock();
        try {
            saveLocked();
        } finally {
            lock.writeLock().unlock();
        }
    }

    // --- Scan configuration and scanning ---

    /**
     * Register a directory to scan. Adding a path that is already registered (exact string
     * match) is a no-op. Not persisted until the next save or scan.
     *
     * @param path Directory path as given by the user
     * @return true if the path was added, false if it was already present
     * @throws NoSuchFileException   if the path does not exist
     * @throws NotDirectoryException if the path is not a directory
     */
    public boolean addScanPath(String path) throws NoSuchFileException, NotDirectoryException {
        Path dir;
        try {
            dir = Paths.get(path);
        } catch (InvalidPathException e) {
            throw new NoSuchFileException(path, null, e.getReason());
        }

        // Existence before type check: a missing path must not be reported as "not a directory"
        if (!Files.exists(dir)) {
            throw new NoSuchFileException(path);
        }
        if (!Files.isDirectory(dir)) {
            throw new NotDirectoryException(path);
        }

        lock.writeLock().lock();
        try {
            if (scanPaths.contains(path)) {
                log.debug("Scan path already registered: {}", path);
                return false;
            }
            scanPaths.add(path);
            log.info("Scan path added: {}", path);
            return true;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Rebuild the library from the scan roots, then persist it.
     * <p>
     * Every regular file below every root is classified by its lower-cased extension; files
     * whose extension is not in the platform table are skipped. The new records and both
     * count maps replace the old ones in a single step under the write lock.
     * <p>
     * A root that cannot be traversed is logged and skipped (records found before the failure
     * are kept). The scan itself only fails when persisting fails, and then the new records
     * stay in memory.
     *
     * @return Number of games found
     * @throws IOException if the snapshot cannot be written
     */
    public int scan() throws IOException {
        lock.writeLock().lock();
        try {
            List<GameRecord> found = new ArrayList<>();
            for (String root : scanPaths) {
                scanRoot(root, found);
            }

            Map<String, Integer> byPlatform = new LinkedHashMap<>();
            Map<String, Integer> byCategory = new LinkedHashMap<>();
            for (GameRecord game : found) {
                byPlatform.merge(game.platform(), 1, Integer::sum);
                byCategory.merge(game.category(), 1, Integer::sum);
            }

            // Commit: readers see either the old generation or the new one, never a mix
            games = found;
            platformCounts = byPlatform;
            categoryCounts = byCategory;
            lastScan = clock.instant();

            observer.onScanComplete(found.size());
            log.info("Scan complete: {} games across {} platforms", found.size(), byPlatform.size());

            saveLocked();
            return found.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private void scanRoot(String root, List<GameRecord> found) {
        Path rootPath;
        try {
            rootPath = Paths.get(root);
        } catch (InvalidPathException e) {
            log.warn("Skipping invalid scan path {}: {}", root, e.getReason());
            return;
        }

        observer.onRootStart(rootPath);
        log.debug("Scanning {}", rootPath);

        try (Stream<Path> stream = Files.walk(rootPath)) {
            stream.filter(Files::isRegularFile)
                    .forEach(file -> toRecord(file).ifPresent(game -> {
                        found.add(game);
                        observer.onGameDiscovered(game);
                    }));
        } catch (UncheckedIOException e) {
            // Mid-traversal failure (subdirectory became unreadable); keep what was found so far
            log.warn("Traversal of {} interrupted: {}", rootPath, e.getCause().getMessage());
            observer.onRootFailure(rootPath, e.getCause());
        } catch (IOException e) {
            // Root itself unreadable or deleted since it was added
            log.warn("Cannot traverse scan path {}: {}", rootPath, e.getMessage());
            observer.onRootFailure(rootPath, e);
        }
    }

    private Optional<GameRecord> toRecord(Path file) {
        String fileName = file.getFileName().toString();
        return platformTable.platformFor(RomFileNames.lowerCaseExtension(fileName))
                .map(platform -> {
                    String path = file.toString();
                    return GameRecord.discovered(GameIds.generate(path), GameTitles.clean(fileName), platform, path);
                });
    }

    // --- Mutations on existing records ---

    /**
     * Flip a game's favorite flag and persist immediately.
     *
     * @param id Game ID
     * @return The new favorite state
     * @throws GameNotFoundException if no game has this ID (nothing is saved)
     * @throws IOException           if persisting fails; the flag stays flipped in memory
     */
    public boolean toggleFavorite(String id) throws GameNotFoundException, IOException {
        lock.writeLock().lock();
        try {
            int index = indexOf(id);
            GameRecord updated = games.get(index).withFavorite(!games.get(index).favorite());
            games.set(index, updated);
            log.debug("Favorite {} -> {}", id, updated.favorite());
            saveLocked();
            return updated.favorite();
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Record that a game was launched: last-played becomes now and the play count increments.
     * Persists immediately.
     *
     * @param id Game ID
     * @return The updated record
     * @throws GameNotFoundException if no game has this ID (nothing is saved)
     * @throws IOException           if persisting fails; the play stays recorded in memory
     */
    public GameRecord recordPlay(String id) throws GameNotFoundException, IOException {
        lock.writeLock().lock();
        try {
            int index = indexOf(id);
            GameRecord updated = games.get(index).withPlay(clock.instant());
            games.set(index, updated);
            log.debug("Play recorded for {} (count {})", id, updated.playCount());
            saveLocked();
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    // --- Queries ---

    /**
     * Games matching every non-empty filter, in discovery order.
     *
     * @param platform Exact platform name, or null/empty for any
     * @param category Exact category name, or null/empty for any
     */
    public List<GameRecord> getGames(String platform, String category) {
        boolean anyPlatform = platform == null || platform.isEmpty();
        boolean anyCategory = category == null || category.isEmpty();

        lock.readLock().lock();
        try {
            if (anyPlatform && anyCategory) {
                return List.copyOf(games);
            }
            return games.stream()
                    .filter(game -> anyPlatform || game.platform().equals(platform))
                    .filter(game -> anyCategory || game.category().equals(category))
                    .collect(Collectors.toUnmodifiableList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * First game with this ID in discovery order (IDs can collide, see {@code GameIds}).
     */
    public Optional<GameRecord> getGameById(String id) {
        lock.readLock().lock();
        try {
            return games.stream().filter(game -> game.id().equals(id)).findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<GameRecord> getFavorites() {
        lock.readLock().lock();
        try {
            return games.stream().filter(GameRecord::favorite).collect(Collectors.toUnmodifiableList());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * All games ordered by last-played time, most recent first. Never-played games sort last.
     * Ties are broken by ID, then path.
     *
     * @param limit Maximum number of results; values &lt;= 0 mean no limit
     */
    public List<GameRecord> getRecentlyPlayed(int limit) {
        lock.readLock().lock();
        try {
            Stream<GameRecord> sorted = games.stream().sorted(RECENTLY_PLAYED_ORDER);
            if (limit > 0) {
                sorted = sorted.limit(limit);
            }
            return sorted.collect(Collectors.toUnmodifiableList());
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, Integer> getPlatformCounts() {
        lock.readLock().lock();
        try {
            return new LinkedHashMap<>(platformCounts);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Map<String, Integer> getCategoryCounts() {
        lock.readLock().lock();
        try {
            return new LinkedHashMap<>(categoryCounts);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<String> getScanPaths() {
        lock.readLock().lock();
        try {
            return List.copyOf(scanPaths);
        } finally {
            lock.readLock().unlock();
        }
    }

    public Instant getLastScan() {
        lock.readLock().lock();
        try {
            return lastScan;
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return games.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Point-in-time copy of the full state, identical to what {@link #save()} writes.
     */
    public LibrarySnapshot snapshot() {
        lock.readLock().lock();
        try {
            return snapshotLocked();
        } finally {
            lock.readLock().unlock();
        }
    }

    public Path getSnapshotFile() {
        return snapshotFile;
    }

    // --- Internals (caller holds the write lock) ---

    private int indexOf(String id) throws GameNotFoundException {
        for (int i = 0; i < games.size(); i++) {
            if (games.get(i).id().equals(id)) {
                return i;
            }
        }
        throw new GameNotFoundException(id);
    }

    private void saveLocked() throws IOException {
        persistence.write(snapshotFile, snapshotLocked());
    }

    private LibrarySnapshot snapshotLocked() {
        return new LibrarySnapshot(games, scanPaths, categoryCounts, platformCounts, lastScan);
    }

    private void apply(LibrarySnapshot snapshot) {
        games = new ArrayList<>(snapshot.games());
        scanPaths.clear();
        scanPaths.addAll(snapshot.scanPaths());
        platformCounts = new LinkedHashMap<>(snapshot.platforms());
        categoryCounts = new LinkedHashMap<>(snapshot.categories());
        lastScan = snapshot.lastScan();
    }
}
