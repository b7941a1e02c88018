package com.gitagent.server.api.dto;

/** Request body for POST /api/set-repo. */
public record SetRepoRequest(String path) {}
