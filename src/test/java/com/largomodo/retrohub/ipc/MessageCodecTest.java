package com.largomodo.retrohub.ipc;

import com.google.gson.JsonParseException;
import com.largomodo.retrohub.core.domain.GameRecord;
import com.largomodo.retrohub.ipc.payload.ScanPathPayload;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MessageCodecTest {

    private final MessageCodec codec = new MessageCodec();

    @Test
    void testDecodeFullRequest() {
        Request request = codec.decode("{\"type\":\"get_game\",\"id\":\"r1\",\"payload\":\"ZELDAM\"}");

        assertEquals("get_game", request.type());
        assertEquals("r1", request.id());
        assertEquals("ZELDAM", request.payload().getAsString());
        assertTrue(request.hasPayload());
    }

    @Test
    void testDecodeMinimalRequest() {
        Request request = codec.decode("{\"type\":\"status\"}");

        assertEquals("status", request.type());
        assertNull(request.id());
        assertFalse(request.hasPayload());
    }

    @Test
    void testNullPayloadIsAbsent() {
        assertFalse(codec.decode("{\"type\":\"scan\",\"payload\":null}").hasPayload());
    }

    @ParameterizedTest
    @ValueSource(strings = {"not json", "[1,2]", "42", "{\"type\":", "null", "{\"type\":\"status\"} trailing"})
    void testMalformedLinesRejected(String line) {
        assertThrows(JsonParseException.class, () -> codec.decode(line));
    }

    @Test
    void testEncodeOmitsAbsentFields() {
        assertEquals("{\"type\":\"success\",\"success\":true}", codec.encode(Response.success(null, null)));
        assertEquals("{\"type\":\"success\",\"success\":true}", codec.encode(Response.success("", null)));
    }

    @Test
    void testEncodeFieldOrder() {
        assertEquals("{\"type\":\"error\",\"id\":\"r9\",\"success\":false,\"error\":\"boom\"}",
                codec.encode(Response.error("r9", "boom")));
    }

    @Test
    void testEncodeStatusData() {
        Map<String, String> data = new LinkedHashMap<>();
        data.put("status", "ready");
        data.put("version", "1.0.0");

        assertEquals("{\"type\":\"status\",\"success\":true,\"data\":{\"status\":\"ready\",\"version\":\"1.0.0\"}}",
                codec.encode(Response.status(null, data)));
    }

    @Test
    void testEncodeGameRecordUsesWireNames() {
        GameRecord game = GameRecord.discovered("TETRISO", "Tetris", "GB", "Tetris.gb");

        String json = codec.encode(Response.success("r2", List.of(game)));

        assertEquals("{\"type\":\"success\",\"id\":\"r2\",\"success\":true,\"data\":[{\"id\":\"TETRISO\","
                + "\"title\":\"Tetris\",\"description\":\"\",\"platform\":\"GB\",\"path\":\"Tetris.gb\","
                + "\"cover_path\":\"\",\"last_played\":\"0001-01-01T00:00:00Z\",\"play_count\":0,"
                + "\"favorite\":false,\"category\":\"Uncategorized\"}]}", json);
        assertFalse(json.contains("\n"), "Wire encoding must stay on one line");
    }

    @Test
    void testDecodePayloadShapes() {
        Request request = codec.decode("{\"type\":\"x\",\"payload\":{\"path\":\"/roms\"}}");

        assertEquals("/roms", codec.decodePayload(request.payload(), ScanPathPayload.class).path());
        assertThrows(JsonParseException.class, () -> codec.decodePayload(request.payload(), String.class));
        assertNull(codec.decodePayload(null, String.class));
    }
}
