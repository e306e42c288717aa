package com.largomodo.retrohub.core.domain;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class GameRecordTest {

    @Test
    void testDiscoveredDefaults() {
        GameRecord game = GameRecord.discovered("ZELDAM", "Zelda", "SNES", "roms/Zelda.sfc");

        assertEquals("", game.description());
        assertEquals("", game.coverPath());
        assertEquals(GameRecord.NEVER_PLAYED, game.lastPlayed());
        assertEquals(0, game.playCount());
        assertFalse(game.favorite());
        assertEquals(GameRecord.UNCATEGORIZED, game.category());
    }

    @Test
    void testNullComponentsNormalized() {
        GameRecord game = new GameRecord(null, null, null, null, null, null, null, 0, false, null);

        assertEquals("", game.id());
        assertEquals("", game.path());
        assertEquals(GameRecord.NEVER_PLAYED, game.lastPlayed());
        assertEquals("Uncategorized", game.category());
    }

    @Test
    void testNegativePlayCountRejected() {
        assertThrows(IllegalArgumentException.class,
                () -> new GameRecord("A", "", "", "", "", "", null, -1, false, null));
    }

    @Test
    void testWithPlayIncrementsAndStamps() {
        Instant now = Instant.parse("2026-01-02T10:15:30Z");
        GameRecord game = GameRecord.discovered("A", "A", "NES", "a.nes").withFavorite(true);

        GameRecord played = game.withPlay(now).withPlay(now.plusSeconds(60));

        assertEquals(2, played.playCount());
        assertEquals(now.plusSeconds(60), played.lastPlayed());
        assertTrue(played.favorite(), "Play recording must not touch the favorite flag");
        assertEquals(0, game.playCount(), "Original record is immutable");
    }

    @Test
    void testNeverPlayedIsYearOne() {
        assertEquals("0001-01-01T00:00:00Z", GameRecord.NEVER_PLAYED.toString());
    }
}
