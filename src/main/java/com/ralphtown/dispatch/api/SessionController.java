package com.ralphtown.dispatch.api;

import com.ralphtown.core.model.LogStream;
import com.ralphtown.core.model.Session;
import com.ralphtown.core.session.OutputPage;
import com.ralphtown.core.session.SessionDetails;
import com.ralphtown.core.session.SessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
 * REST controller for sessions and their agent runs.
 */
@RestController
@RequestMapping("/api/sessions")
public class SessionController {

    private static final Logger log = LoggerFactory.getLogger(SessionController.class);

    private final SessionService sessionService;
    private final SseStreamingService sseStreamingService;

    public SessionController(SessionService sessionService, SseStreamingService sseStreamingService) {
        this.sessionService = sessionService;
        this.sseStreamingService = sseStreamingService;
    }

    @GetMapping
    public List<Session> listSessions(@RequestParam(name = "repo_id", required = false) String repoId) {
        return repoId != null ? sessionService.listForRepo(repoId) : sessionService.list();
    }

    @PostMapping
    public ResponseEntity<?> createSession(@RequestBody CreateSessionRequest request) {
        if (request.repoId() == null || request.repoId().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "repo_id is required"));
        }
        return ResponseEntity.ok(sessionService.create(request.repoId(), request.name()));
    }

    @GetMapping("/{id}")
    public SessionDetails getSession(@PathVariable String id) {
        return sessionService.details(id);
    }

    @DeleteMapping("/{id}")
    public Map<String, String> deleteSession(@PathVariable String id) {
        sessionService.delete(id);
        return Map.of("message", "Session deleted");
    }

    /**
     * POST /api/sessions/{id}/run: Start the agent. Returns once the process is running.
     */
    @PostMapping("/{id}/run")
    public ResponseEntity<Map<String, String>> runSession(@PathVariable String id,
                                                          @RequestBody RunSessionRequest request) {
        if (request.prompt() == null || request.prompt().isBlank()) {
            return ResponseEntity.badRequest().body(Map.of("error", "Prompt is required"));
        }
        sessionService.run(id, request.prompt());
        log.info("Run accepted for session {}", id);
        return ResponseEntity.ok(Map.of(
                "session_id", id,
                "status", "running",
                "message", "Ralph process started"));
    }

    @PostMapping("/{id}/cancel")
    public Map<String, String> cancelSession(@PathVariable String id) {
        sessionService.cancel(id);
        return Map.of(
                "session_id", id,
                "status", "cancelled",
                "message", "Ralph process cancelled");
    }

    @GetMapping("/{id}/output")
    public OutputPage getOutput(@PathVariable String id,
                                @RequestParam(required = false) String stream,
                                @RequestParam(required = false) Integer limit,
                                @RequestParam(required = false) Integer offset) {
        LogStream filter = LogStream.parse(stream).orElse(null);
        return sessionService.output(id, filter, limit, offset);
    }

    /**
     * GET /api/sessions/{id}/events: SSE stream of status and output events.
     */
    @GetMapping(value = "/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public SseEmitter streamEvents(@PathVariable String id) {
        sessionService.get(id);
        return sseStreamingService.createEmitter(id);
    }
}
