package com.gitagent.server.api.dto;

/** Optional request body for POST /api/poll. */
public record PollRequest(Boolean force) {

    public boolean isForced() {
        return Boolean.TRUE.equals(force);
    }
}
