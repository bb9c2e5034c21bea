package com.ralphtown.dispatch.api;

import com.ralphtown.core.clone.CloneRequestException;
import com.ralphtown.core.git.GitOperationException;
import com.ralphtown.core.persistence.RecordNotFoundException;
import com.ralphtown.core.persistence.StoreException;
import com.ralphtown.core.process.AgentNotFoundException;
import com.ralphtown.core.process.NotRunningException;
import com.ralphtown.core.process.RepoBusyException;
import com.ralphtown.core.process.SessionAlreadyRunningException;
import com.ralphtown.core.process.SpawnFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps domain failures onto {@code {"error", "message", "help_steps"}} JSON bodies.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String BAD_REQUEST = "bad_request";
    static final String NOT_FOUND = "not_found";
    static final String INTERNAL_ERROR = "internal_error";

    @ExceptionHandler(RecordNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(RecordNotFoundException e) {
        return body(HttpStatus.NOT_FOUND, NOT_FOUND, e.getMessage(), List.of());
    }

    @ExceptionHandler({RepoBusyException.class, SessionAlreadyRunningException.class,
            NotRunningException.class, IllegalArgumentException.class})
    public ResponseEntity<Map<String, Object>> handleBadRequest(RuntimeException e) {
        return body(HttpStatus.BAD_REQUEST, BAD_REQUEST, e.getMessage(), List.of());
    }

    @ExceptionHandler(CloneRequestException.class)
    public ResponseEntity<Map<String, Object>> handleCloneRequest(CloneRequestException e) {
        return body(HttpStatus.BAD_REQUEST, BAD_REQUEST, e.getMessage(), e.helpSteps());
    }

    @ExceptionHandler(AgentNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleAgentNotFound(AgentNotFoundException e) {
        return body(HttpStatus.UNPROCESSABLE_ENTITY, AgentNotFoundException.CODE, e.getMessage(), e.helpSteps());
    }

    @ExceptionHandler(SpawnFailedException.class)
    public ResponseEntity<Map<String, Object>> handleSpawnFailed(SpawnFailedException e) {
        log.error("Agent spawn failed: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, e.getMessage(), List.of());
    }

    @ExceptionHandler(GitOperationException.class)
    public ResponseEntity<Map<String, Object>> handleGit(GitOperationException e) {
        if (e.kind() == GitOperationException.Kind.INVALID_BRANCH
                || e.kind() == GitOperationException.Kind.NOT_A_REPO) {
            return body(HttpStatus.BAD_REQUEST, BAD_REQUEST, e.getMessage(), List.of());
        }
        log.error("Git operation failed: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, e.getMessage(), List.of());
    }

    @ExceptionHandler(StoreException.class)
    public ResponseEntity<Map<String, Object>> handleStore(StoreException e) {
        log.error("Store failure: {}", e.getMessage(), e);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, INTERNAL_ERROR, "Database error: " + e.getMessage(), List.of());
    }

    private static ResponseEntity<Map<String, Object>> body(HttpStatus status, String code,
                                                            String message, List<String> helpSteps) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", code);
        body.put("message", message);
        if (!helpSteps.isEmpty()) {
            body.put("help_steps", helpSteps);
        }
        return ResponseEntity.status(status).body(body);
    }
}
