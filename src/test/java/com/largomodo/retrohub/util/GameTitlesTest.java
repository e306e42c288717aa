package com.largomodo.retrohub.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.junit.jupiter.api.Assertions.assertEquals;

class GameTitlesTest {

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "Super_Mario-World (USA).sfc | Super Mario World",
            "Sonic (Europe).gb           | Sonic",
            "Zelda (Japan).nes           | Zelda",
            "Metroid.nes                 | Metroid",
            "Tetris                      | Tetris",
            "game.v1.0.gba               | game.v1.0"
    })
    void testClean(String fileName, String expected) {
        assertEquals(expected, GameTitles.clean(fileName));
    }

    @Test
    void testRegionTagRemovedAnywhere() {
        // Interior spacing left behind is kept
        assertEquals("Mario  Kart", GameTitles.clean("Mario (USA) Kart.smc"));
        assertEquals("Combo", GameTitles.clean("(Japan)Combo(Europe).n64"));
    }

    @Test
    void testOtherTagsKept() {
        assertEquals("Pokemon Red (Rev 1)", GameTitles.clean("Pokemon_Red_(Rev 1).gb"));
        assertEquals("Game (usa)", GameTitles.clean("Game (usa).nes"));
    }

    @Test
    void testDegenerateNames() {
        assertEquals("", GameTitles.clean(".nes"));
        assertEquals("", GameTitles.clean("(USA).sfc"));
        assertEquals("", GameTitles.clean("___.gba"));
    }
}
