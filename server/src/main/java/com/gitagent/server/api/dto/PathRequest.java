package com.gitagent.server.api.dto;

/** Request body for the single-path operations: stage, unstage, revert. */
public record PathRequest(String path) {}
