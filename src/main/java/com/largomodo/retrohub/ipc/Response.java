package com.largomodo.retrohub.ipc;

/**
 * One response line. Serialized field order is type, id, success, data, error;
 * null fields are omitted from the JSON.
 *
 * @param type    "success", "status" or "error"
 * @param id      Echo of the request ID, null when the request had none
 * @param success Whether the request succeeded
 * @param data    Result payload, serialized with its runtime type
 * @param error   Failure message, null on success
 */
public record Response(String type, String id, boolean success, Object data, String error) {

    public static final String TYPE_SUCCESS = "success";
    public static final String TYPE_STATUS = "status";
    public static final String TYPE_ERROR = "error";

    public Response {
        if (type == null || type.isEmpty()) {
            throw new IllegalArgumentException("type must not be empty");
        }
        // Empty strings are omitted on the wire just like absent ones
        if (id != null && id.isEmpty()) {
            id = null;
        }
        if (error != null && error.isEmpty()) {
            error = null;
        }
    }

    public static Response success(String id, Object data) {
        return new Response(TYPE_SUCCESS, id, true, data, null);
    }

    public static Response status(String id, Object data) {
        return new Response(TYPE_STATUS, id, true, data, null);
    }

    public static Response error(String id, String message) {
        return new Response(TYPE_ERROR, id, false, null, message);
    }
}
