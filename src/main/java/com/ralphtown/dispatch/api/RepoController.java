package com.ralphtown.dispatch.api;

import com.ralphtown.core.clone.CloneProgressRelay;
import com.ralphtown.core.model.Repo;
import com.ralphtown.core.repos.FoundRepo;
import com.ralphtown.core.repos.RepoService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.servlet.mvc.method.annotation.SseEmitter;

import java.util.List;
import java.util.Map;

/**
 * REST controller for registered repositories, directory scans and clones.
 */
@RestController
@RequestMapping("/api/repos")
public class RepoController {

    private final RepoService repoService;
    private final CloneProgressRelay cloneRelay;
    private final SseStreamingService sseStreamingService;

    public RepoController(RepoService repoService, CloneProgressRelay cloneRelay,
                          SseStreamingService sseStreamingService) {
        this.repoService = repoService;
        this.cloneRelay = cloneRelay;
        this.sseStreamingService = sseStreamingService;
    }

    @GetMapping
    public List<Repo> listRepos() {
        return repoService.list();
    }

    @PostMapping
    public Repo addRepo(@RequestBody AddRepoRequest request) {
        return repoService.add(request.path());
    }

    @DeleteMapping("/{id}")
    public Map<String, String> deleteRepo(@PathVariable String id) {
        repoService.delete(id);
        return Map.of("message", "Repository deleted");
    }

    @PostMapping("/scan")
    public ResponseEntity<?> scanRepos(@RequestBody ScanRequest request) {
        if (request.directories() == null || request.directories().isEmpty()) {
            return ResponseEntity.badRequest().body(Map.of("error", "directories is required"));
        }
        int depth = request.depth() != null ? request.depth() : RepoService.DEFAULT_SCAN_DEPTH;
        List<FoundRepo> found = repoService.scan(request.directories(), depth);
        return ResponseEntity.ok(Map.of("found", found));
    }

    /**
     * POST /api/repos/clone: Clone and register a repository, blocking until done.
     */
    @PostMapping("/clone")
    public Map<String, Object> cloneRepo(@RequestBody CloneRepoRequest request) {
        Repo repo = cloneRelay.cloneNow(request.url());
        return Map.of("repo", repo, "message", "Cloned to " + repo.path());
    }

    /**
     * GET /api/repos/clone-progress?url=: Clone with SSE progress events.
     */
    @GetMapping(value = "/clone-progress", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter cloneWithProgress(@RequestParam String url) {
        return sseStreamingService.createCloneEmitter(url);
    }
}
