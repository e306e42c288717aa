package com.largomodo.retrohub.ipc;

import com.google.gson.Gson;
import com.google.gson.JsonElement;
import com.google.gson.JsonParseException;
import com.largomodo.retrohub.persistence.LibraryGson;

/**
 * Newline-delimited JSON framing: one request or response object per line.
 * <p>
 * Thread-safe (the underlying Gson instance is immutable).
 */
public class MessageCodec {

    private final Gson gson;

    public MessageCodec() {
        this(LibraryGson.compact());
    }

    public MessageCodec(Gson gson) {
        this.gson = gson;
    }

    /**
     * Decode one request line.
     *
     * @param line Line without its terminator
     * @return Decoded request, never null
     * @throws JsonParseException if the line is not a JSON object of the request shape
     */
    public Request decode(String line) {
        Request request = gson.fromJson(line, Request.class);
        if (request == null) {
            throw new JsonParseException("request must be a JSON object");
        }
        return request;
    }

    /**
     * Encode a response as a single line of JSON without the trailing newline.
     */
    public String encode(Response response) {
        return gson.toJson(response);
    }

    /**
     * Decode a request payload into the shape a message type expects.
     *
     * @return Decoded value, or null if the payload is absent or JSON null
     * @throws JsonParseException if the payload does not have the expected shape
     */
    public <T> T decodePayload(JsonElement payload, Class<T> type) {
        if (payload == null || payload.isJsonNull()) {
            return null;
        }
        return gson.fromJson(payload, type);
    }
}
