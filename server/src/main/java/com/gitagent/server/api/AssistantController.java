package com.gitagent.server.api;

import com.gitagent.server.api.dto.ChatRequest;
import com.gitagent.server.api.dto.ExecuteRequest;
import com.gitagent.server.assistant.ChangeAnalyzer;
import com.gitagent.server.assistant.ChangeAnalyzer.ChatReply;
import com.gitagent.server.dsl.DslInterpreter;
import com.gitagent.server.git.GitCommandException;
import com.gitagent.server.git.GitOperations;
import com.gitagent.server.session.SessionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.Map;
import java.util.function.Supplier;

/**
 * The assistant: free-form chat about the repository, and execution of the scripts it
 * (or the user) writes.
 *
 * POST /api/chat     : {message} → {response, dsl}
 * POST /api/execute  : {dsl} → {output}
 */
@RestController
@RequestMapping("/api")
public class AssistantController {

    private static final Logger log = LoggerFactory.getLogger(AssistantController.class);

    private static final int CHAT_LOG_LIMIT = 10;

    private final SessionManager sessions;
    private final ChangeAnalyzer analyzer;

    public AssistantController(SessionManager sessions, ChangeAnalyzer analyzer) {
        this.sessions = sessions;
        this.analyzer = analyzer;
    }

    @PostMapping("/chat")
    public ChatReply chat(@RequestBody ChatRequest req) {
        GitOperations git = sessions.require().git();
        if (req.message() == null || req.message().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "No message provided");
        }
        String status = orElse(git::shortStatus, "No changes.");
        String recent = orElse(() -> git.log(CHAT_LOG_LIMIT), "No recent commits.");
        return analyzer.chat(req.message(), status, recent);
    }

    @PostMapping("/execute")
    public Map<String, String> execute(@RequestBody ExecuteRequest req) {
        GitOperations git = sessions.require().git();
        if (req.dsl() == null || req.dsl().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "No DSL code provided");
        }
        return Map.of("output", new DslInterpreter(git).execute(req.dsl()));
    }

    // Context for the prompt is best-effort: a fresh repository has no log yet.
    private static String orElse(Supplier<String> gitCall, String fallback) {
        try {
            String value = gitCall.get();
            return value.isEmpty() ? fallback : value;
        } catch (GitCommandException e) {
            log.debug("Chat context unavailable: {}", e.getMessage());
            return fallback;
        }
    }
}
