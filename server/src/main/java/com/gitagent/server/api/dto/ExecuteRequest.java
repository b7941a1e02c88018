package com.gitagent.server.api.dto;

/** Request body for POST /api/execute: the script to run, one command per line. */
public record ExecuteRequest(String dsl) {}
