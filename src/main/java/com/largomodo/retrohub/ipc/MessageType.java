package com.largomodo.retrohub.ipc;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Closed set of request types understood by the daemon, keyed by their wire token.
 */
public enum MessageType {
    LIST_GAMES("list_games"),
    GET_GAME("get_game"),
    LAUNCH_GAME("launch_game"),
    GET_CATEGORIES("get_categories"),
    GET_PLATFORMS("get_platforms"),
    GET_FAVORITES("get_favorites"),
    TOGGLE_FAVORITE("toggle_favorite"),
    GET_RECENT("get_recent"),
    SCAN("scan"),
    ADD_SCAN_PATH("add_scan_path"),
    STATUS("status");

    private static final Map<String, MessageType> BY_TOKEN = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(MessageType::token, Function.identity()));

    private final String token;

    MessageType(String token) {
        this.token = token;
    }

    /**
     * Look up a type by its exact (case-sensitive) wire token.
     *
     * @param token Value of the request's "type" field, may be null
     * @return Matching type, or empty for null and unrecognized tokens
     */
    public static Optional<MessageType> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(BY_TOKEN.get(token));
    }

    public String token() {
        return token;
    }
}
