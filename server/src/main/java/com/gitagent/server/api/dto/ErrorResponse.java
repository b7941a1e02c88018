package com.gitagent.server.api.dto;

/** Body of every non-2xx response. */
public record ErrorResponse(String error) {}
