package com.gitagent.server.api.dto;

/** Request body for POST /api/chat. */
public record ChatRequest(String message) {}
