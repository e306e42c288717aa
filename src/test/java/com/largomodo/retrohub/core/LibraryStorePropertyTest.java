package com.largomodo.retrohub.core;

import com.largomodo.retrohub.core.domain.GameRecord;
import com.largomodo.retrohub.core.domain.LibrarySnapshot;
import com.largomodo.retrohub.persistence.SnapshotPersistence;
import net.jqwik.api.*;
import net.jqwik.api.constraints.IntRange;
import net.jqwik.api.lifecycle.AfterTry;
import net.jqwik.api.lifecycle.BeforeTry;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Property tests for LibraryStore invariants.
 * <p>
 * jqwik has no @TempDir support, so each try gets its own temporary directory.
 */
class LibraryStorePropertyTest {

    private Path workDir;

    @BeforeTry
    void createWorkDir() throws IOException {
        workDir = Files.createTempDirectory("retrohub-prop");
    }

    @AfterTry
    void deleteWorkDir() throws IOException {
        try (Stream<Path> paths = Files.walk(workDir)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }

    private LibraryStore storeWith(List<GameRecord> games) throws IOException {
        Path snapshotFile = workDir.resolve("library.json");
        new SnapshotPersistence().write(snapshotFile,
                new LibrarySnapshot(games, List.of(), Map.of(), Map.of(), Instant.EPOCH));
        LibraryStore store = new LibraryStore(snapshotFile, PlatformTable.defaults());
        store.load();
        return store;
    }

    @Property(tries = 30)
    void addScanPathIsIdempotent(@ForAll @IntRange(min = 1, max = 5) int repeats) throws IOException {
        LibraryStore store = new LibraryStore(workDir.resolve("library.json"), PlatformTable.defaults());
        Path dir = Files.createDirectories(workDir.resolve("roms"));

        for (int i = 0; i < repeats; i++) {
            store.addScanPath(dir.toString());
        }

        assertEquals(List.of(dir.toString()), store.getScanPaths());
    }

    @Property(tries = 30)
    void toggleFavoriteFlipsParity(@ForAll @IntRange(min = 0, max = 6) int toggles) throws Exception {
        LibraryStore store = storeWith(List.of(GameRecord.discovered("METROIDA", "Metroid", "NES", "/r/Metroid.nes")));

        for (int i = 0; i < toggles; i++) {
            store.toggleFavorite("METROIDA");
        }

        assertEquals(toggles % 2 == 1, store.getGameById("METROIDA").orElseThrow().favorite());
    }

    @Property(tries = 50)
    void recentlyPlayedIsSortedAndBounded(@ForAll("playedGames") List<GameRecord> games,
                                          @ForAll @IntRange(min = -2, max = 12) int limit) throws IOException {
        LibraryStore store = storeWith(games);

        List<GameRecord> recent = store.getRecentlyPlayed(limit);

        int expectedSize = limit > 0 ? Math.min(limit, games.size()) : games.size();
        assertEquals(expectedSize, recent.size());
        for (int i = 1; i < recent.size(); i++) {
            assertFalse(recent.get(i - 1).lastPlayed().isBefore(recent.get(i).lastPlayed()),
                    "Entries must be ordered most recent first");
        }

        // Truncation keeps the head of the full ordering
        assertEquals(store.getRecentlyPlayed(0).subList(0, expectedSize), recent);
    }

    @Property(tries = 30)
    void saveThenLoadReproducesStore(@ForAll("playedGames") List<GameRecord> games) throws Exception {
        LibraryStore store = storeWith(games);
        if (!games.isEmpty()) {
            store.toggleFavorite(games.get(0).id());
        }
        store.save();

        LibraryStore reloaded = new LibraryStore(store.getSnapshotFile(), PlatformTable.defaults());
        reloaded.load();

        assertEquals(store.snapshot(), reloaded.snapshot());
    }

    @Provide
    Arbitrary<List<GameRecord>> playedGames() {
        Arbitrary<Instant> playedAt = Arbitraries.longs()
                .between(0, 4_000_000_000L)
                .map(Instant::ofEpochSecond)
                .injectDuplicates(0.3);
        Arbitrary<Integer> plays = Arbitraries.integers().between(0, 50);

        return Combinators.combine(playedAt, plays)
                .as(PlayHistory::new)
                .list().ofMaxSize(10)
                .map(LibraryStorePropertyTest::toGames);
    }

    private static List<GameRecord> toGames(List<PlayHistory> histories) {
        List<GameRecord> games = new ArrayList<>();
        for (int i = 0; i < histories.size(); i++) {
            PlayHistory history = histories.get(i);
            Instant played = history.count() == 0 ? GameRecord.NEVER_PLAYED : history.lastPlayed();
            games.add(new GameRecord("GAME" + i + "A", "Game " + i, "", "NES", "/roms/game" + i + ".nes", "",
                    played, history.count(), false, GameRecord.UNCATEGORIZED));
        }
        return games;
    }

    private record PlayHistory(Instant lastPlayed, int count) {
    }
}
