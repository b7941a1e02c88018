package com.gitagent.server.api.dto;

/** Request body for POST /api/file. An empty {@code content} is allowed; a missing one is not. */
public record FileWriteRequest(String path, String content) {}
