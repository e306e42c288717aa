package com.largomodo.retrohub.ipc;

import com.google.gson.JsonElement;

/**
 * One decoded request line: {@code {"type": ..., "id"?: ..., "payload"?: ...}}.
 * <p>
 * The payload is kept as an undecoded JSON tree; each message type decodes it into
 * the shape it expects.
 *
 * @param type    Wire token of the message type (null when absent)
 * @param id      Client correlation ID echoed in the response (null when absent)
 * @param payload Raw payload, null or {@code JsonNull} when absent
 */
public record Request(String type, String id, JsonElement payload) {

    public boolean hasPayload() {
        return payload != null && !payload.isJsonNull();
    }
}
