package com.gitagent.server.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.gitagent.server.assistant.ChangeAnalyzer.Analysis;
import com.gitagent.server.poll.PollResult;

/**
 * Response body for POST /api/poll. Field names are snake_case because that is what the
 * desktop UI reads.
 *
 * {@code summary} and {@code dsl_suggestion} are null unless an analysis ran.
 */
public record PollResponse(
        @JsonProperty("has_changed")    boolean hasChanged,
        @JsonProperty("files_changed")  boolean filesChanged,
        @JsonProperty("status")         String  status,
        @JsonProperty("summary")        String  summary,
        @JsonProperty("dsl_suggestion") String  dslSuggestion
) {
    public static PollResponse from(PollResult result, Analysis analysis) {
        return new PollResponse(
                result.hasChanged(),
                result.filesChanged(),
                result.statusText(),
                analysis != null ? analysis.summary() : null,
                analysis != null ? analysis.dsl() : null
        );
    }
}
