package com.gitagent.server.api.dto;

/** Request body for POST /api/commit. */
public record CommitRequest(String message) {}
