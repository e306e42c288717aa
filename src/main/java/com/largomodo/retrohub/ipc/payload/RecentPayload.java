package com.largomodo.retrohub.ipc.payload;

/**
 * Payload of {@code get_recent}.
 *
 * @param limit Maximum number of games; absent or &lt;= 0 means all
 */
public record RecentPayload(Integer limit) {

    public static final RecentPayload ALL = new RecentPayload(null);

    public int effectiveLimit() {
        return limit == null ? 0 : limit;
    }
}
