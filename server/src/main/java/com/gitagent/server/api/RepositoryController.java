package com.gitagent.server.api;

import com.gitagent.server.api.dto.FileWriteRequest;
import com.gitagent.server.api.dto.PollRequest;
import com.gitagent.server.api.dto.PollResponse;
import com.gitagent.server.api.dto.SetRepoRequest;
import com.gitagent.server.assistant.ChangeAnalyzer;
import com.gitagent.server.assistant.ChangeAnalyzer.Analysis;
import com.gitagent.server.poll.PollResult;
import com.gitagent.server.session.RepositorySession;
import com.gitagent.server.session.SessionManager;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.List;
import java.util.Map;

/**
 * Working-tree selection, change polling and file access.
 *
 * POST /api/set-repo   : select the working tree to watch
 * GET  /api/status     : short status listing
 * POST /api/poll       : has anything changed since the last poll?
 * GET  /api/files      : every file in the tree, sorted
 * GET  /api/file       : read one file
 * POST /api/file       : overwrite one file
 * GET  /api/diff       : diff of one file against HEAD
 */
@RestController
@RequestMapping("/api")
public class RepositoryController {

    private final SessionManager sessions;
    private final ChangeAnalyzer analyzer;

    public RepositoryController(SessionManager sessions, ChangeAnalyzer analyzer) {
        this.sessions = sessions;
        this.analyzer = analyzer;
    }

    @PostMapping("/set-repo")
    public Map<String, String> setRepo(@RequestBody SetRepoRequest req) {
        RepositorySession session = sessions.select(req.path());
        return Map.of("message", "Repository set", "path", session.root().toString());
    }

    @GetMapping("/status")
    public Map<String, String> status() {
        return Map.of("status", sessions.require().git().shortStatus());
    }

    /**
     * Poll for changes. The UI calls this on a short interval; a body of
     * {@code {"force": true}} asks for a fresh scan and a new analysis regardless.
     *
     * The analysis (an LLM round trip) only runs when something changed, so quiet
     * polls stay cheap.
     */
    @PostMapping("/poll")
    public PollResponse poll(@RequestBody(required = false) PollRequest req) {
        boolean force = req != null && req.isForced();
        PollResult result = sessions.require().poller().poll(force);
        Analysis analysis = result.analyze() ? analyzer.analyze(result.statusText()) : null;
        return PollResponse.from(result, analysis);
    }

    @GetMapping("/files")
    public Map<String, List<String>> files() {
        return Map.of("files", sessions.require().cache().files());
    }

    @GetMapping("/file")
    public Map<String, String> readFile(@RequestParam(required = false) String path) throws IOException {
        RepositorySession session = sessions.require();
        requirePath(path);
        return Map.of("content", session.files().read(path));
    }

    @PostMapping("/file")
    public Map<String, String> writeFile(@RequestBody FileWriteRequest req) throws IOException {
        RepositorySession session = sessions.require();
        if (req.path() == null || req.path().isBlank() || req.content() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Path and content required");
        }
        session.files().write(req.path(), req.content());
        return Map.of("message", "File saved");
    }

    @GetMapping("/diff")
    public Map<String, String> diff(@RequestParam(required = false) String path) {
        RepositorySession session = sessions.require();
        requirePath(path);
        return Map.of("diff", session.git().diff(path));
    }

    static void requirePath(String path) {
        if (path == null || path.isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Path required");
        }
    }
}
