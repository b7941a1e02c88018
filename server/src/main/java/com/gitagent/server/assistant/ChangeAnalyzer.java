package com.gitagent.server.assistant;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gitagent.server.gemini.GeminiClient;
import com.gitagent.server.gemini.GeminiClient.GeminiApiException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Turns working-tree state into assistant output: a change summary with a suggested
 * commit script, or a chat reply.
 */
@Service
public class ChangeAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ChangeAnalyzer.class);

    static final String UNPARSABLE_SUMMARY = "Could not parse Gemini response.";

    /** @param dsl suggested script, or null */
    public record Analysis(String summary, String dsl) {}

    /** @param dsl script to run if the user asked for an action, or null */
    public record ChatReply(String response, String dsl) {}

    private final GeminiClient gemini;
    private final ObjectMapper json;

    public ChangeAnalyzer(GeminiClient gemini, ObjectMapper objectMapper) {
        this.gemini = gemini;
        this.json   = objectMapper;
    }

    /**
     * Summarise the pending changes. Never throws for model trouble: an API failure
     * becomes the summary text, an unparsable reply a fixed message.
     */
    public Analysis analyze(String statusText) {
        String text;
        try {
            text = gemini.generate(AssistantPrompts.changeSummary(statusText));
        } catch (GeminiApiException e) {
            log.warn("Change analysis failed: {}", e.getMessage());
            return new Analysis(e.getMessage(), null);
        }
        try {
            JsonNode reply = json.readTree(text);
            if (reply != null && reply.isObject()) {
                return new Analysis(textOrNull(reply, "summary"), textOrNull(reply, "dsl"));
            }
        } catch (JsonProcessingException e) {
            log.debug("Unparsable analysis reply: {}", text);
        }
        return new Analysis(UNPARSABLE_SUMMARY, null);
    }

    /**
     * Answer a chat message in the context of the current status and recent history.
     *
     * @throws GeminiApiException if the model cannot be reached
     */
    public ChatReply chat(String message, String statusText, String recentLog) {
        String text = gemini.generate(AssistantPrompts.chat(message, statusText, recentLog));
        try {
            JsonNode reply = json.readTree(text);
            if (reply != null && reply.isObject()) {
                return new ChatReply(textOrNull(reply, "response"), textOrNull(reply, "dsl"));
            }
        } catch (JsonProcessingException e) {
            log.debug("Chat reply is not JSON, returning it verbatim");
        }
        return new ChatReply(text, null);
    }

    private static String textOrNull(JsonNode node, String field) {
        if (node == null || !node.isObject()) return null;
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }
}
