package com.gitagent.server.api;

import com.gitagent.server.api.dto.BranchRequest;
import com.gitagent.server.api.dto.CommitRequest;
import com.gitagent.server.api.dto.PathRequest;
import com.gitagent.server.git.GitOperations;
import com.gitagent.server.git.GitOperations.BranchChange;
import com.gitagent.server.git.GitOperations.Branches;
import com.gitagent.server.git.GitOperations.CommitCounts;
import com.gitagent.server.session.SessionManager;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.io.IOException;
import java.util.Map;

/**
 * Manual git operations from the UI's controls.
 *
 * GET  /api/commits              : total / unpushed / behind counts
 * POST /api/commit               : stage everything and commit
 * POST /api/push, /api/pull
 * GET  /api/branch, /api/branches
 * POST /api/branch/switch        : local branch, or track origin/&lt;name&gt;
 * POST /api/branch/create
 * POST /api/file/stage|unstage|revert
 */
@RestController
@RequestMapping("/api")
public class GitController {

    private final SessionManager sessions;

    public GitController(SessionManager sessions) {
        this.sessions = sessions;
    }

    @GetMapping("/commits")
    public CommitCounts commits() {
        return git().commitCounts();
    }

    @PostMapping("/commit")
    public Map<String, String> commit(@RequestBody CommitRequest req) {
        GitOperations git = git();
        if (req.message() == null || req.message().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Commit message required");
        }
        return Map.of("output", git.commitAll(req.message()));
    }

    @PostMapping("/push")
    public Map<String, String> push() {
        return Map.of("output", git().push());
    }

    @PostMapping("/pull")
    public Map<String, String> pull() {
        return Map.of("output", git().pull());
    }

    @GetMapping("/branch")
    public Map<String, String> currentBranch() {
        return Map.of("branch", git().currentBranch());
    }

    @GetMapping("/branches")
    public Branches branches() {
        return git().branches();
    }

    @PostMapping("/branch/switch")
    public BranchChange switchBranch(@RequestBody BranchRequest req) {
        GitOperations git = git();
        return git.switchBranch(requireBranch(req));
    }

    @PostMapping("/branch/create")
    public Map<String, String> createBranch(@RequestBody BranchRequest req) {
        GitOperations git = git();
        String name = requireBranch(req);
        BranchChange change = git.createBranch(name, req.switchTo());
        return Map.of("output", change.output(), "branch", change.branch(), "created", name);
    }

    @PostMapping("/file/stage")
    public Map<String, String> stage(@RequestBody PathRequest req) {
        GitOperations git = git();
        String path = requirePath(req);
        return Map.of("message", "Staged '" + path + "'", "output", git.stage(path));
    }

    @PostMapping("/file/unstage")
    public Map<String, String> unstage(@RequestBody PathRequest req) {
        GitOperations git = git();
        String path = requirePath(req);
        return Map.of("message", "Unstaged '" + path + "'", "output", git.unstage(path));
    }

    @PostMapping("/file/revert")
    public Map<String, String> revert(@RequestBody PathRequest req) throws IOException {
        GitOperations git = git();
        return Map.of("message", git.revert(requirePath(req)));
    }

    // -------------------------------------------------------------------------
    // Private helpers
    // -------------------------------------------------------------------------

    private GitOperations git() {
        return sessions.require().git();
    }

    private static String requireBranch(BranchRequest req) {
        if (req.branch() == null || req.branch().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "Branch name required");
        }
        return req.branch().strip();
    }

    private static String requirePath(PathRequest req) {
        if (req.path() == null || req.path().isBlank()) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "File path required");
        }
        return req.path();
    }
}
