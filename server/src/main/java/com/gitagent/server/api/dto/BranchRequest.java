package com.gitagent.server.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Request body for POST /api/branch/switch and POST /api/branch/create.
 *
 * {@code switch} only matters for create, and defaults to true there.
 */
public record BranchRequest(String branch,
                            @JsonProperty("switch") Boolean switchTo) {

    public BranchRequest {
        if (switchTo == null) switchTo = Boolean.TRUE;
    }
}
