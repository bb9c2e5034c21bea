package com.ralphtown.dispatch.api;

import com.ralphtown.core.git.BranchInfo;
import com.ralphtown.core.git.CommandOutput;
import com.ralphtown.core.git.CommitInfo;
import com.ralphtown.core.git.FileDelta;
import com.ralphtown.core.git.GitCommandRunner;
import com.ralphtown.core.git.GitInspector;
import com.ralphtown.core.git.GitStatus;
import com.ralphtown.core.session.SessionService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Git inspection and commands against the repository a session works in.
 * Commands complete asynchronously on the git command pool.
 */
@RestController
@RequestMapping("/api/sessions/{id}/git")
public class GitController {

    static final int DEFAULT_LOG_LIMIT = 50;

    private final SessionService sessionService;
    private final GitInspector inspector;
    private final GitCommandRunner commands;

    public GitController(SessionService sessionService, GitInspector inspector, GitCommandRunner commands) {
        this.sessionService = sessionService;
        this.inspector = inspector;
        this.commands = commands;
    }

    @GetMapping("/status")
    public GitStatus status(@PathVariable String id) {
        return inspector.status(sessionService.repoPath(id));
    }

    @GetMapping("/log")
    public List<CommitInfo> log(@PathVariable String id, @RequestParam(required = false) Integer limit) {
        int effective = limit != null && limit > 0 ? limit : DEFAULT_LOG_LIMIT;
        return inspector.log(sessionService.repoPath(id), effective);
    }

    @GetMapping("/branches")
    public List<BranchInfo> branches(@PathVariable String id) {
        return inspector.branches(sessionService.repoPath(id));
    }

    @GetMapping("/diff")
    public List<FileDelta> diff(@PathVariable String id) {
        return inspector.diffStats(sessionService.repoPath(id));
    }

    @PostMapping("/pull")
    public CompletableFuture<CommandOutput> pull(@PathVariable String id) {
        return commands.pull(sessionService.repoPath(id));
    }

    @PostMapping("/push")
    public CompletableFuture<CommandOutput> push(@PathVariable String id) {
        return commands.push(sessionService.repoPath(id));
    }

    @PostMapping("/commit")
    public CompletableFuture<CommandOutput> commit(@PathVariable String id, @RequestBody CommitRequest request) {
        return commands.commit(sessionService.repoPath(id), request.message());
    }

    @PostMapping("/reset")
    public CompletableFuture<CommandOutput> reset(@PathVariable String id) {
        return commands.resetHard(sessionService.repoPath(id));
    }

    @PostMapping("/checkout")
    public CompletableFuture<CommandOutput> checkout(@PathVariable String id, @RequestBody CheckoutRequest request) {
        return commands.checkout(sessionService.repoPath(id), request.branch());
    }

    @PostMapping("/add")
    public CompletableFuture<CommandOutput> add(@PathVariable String id) {
        return commands.addAll(sessionService.repoPath(id));
    }
}
