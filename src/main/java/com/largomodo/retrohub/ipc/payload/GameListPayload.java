package com.largomodo.retrohub.ipc.payload;

/**
 * Filters for {@code list_games}. Empty or absent filters match everything.
 *
 * @param platform Exact platform name
 * @param category Exact category name
 * @param limit    Maximum number of games; absent or &lt;= 0 means no limit
 */
public record GameListPayload(String platform, String category, Integer limit) {

    public static final GameListPayload ALL = new GameListPayload(null, null, null);

    public int effectiveLimit() {
        return limit == null ? 0 : limit;
    }
}
