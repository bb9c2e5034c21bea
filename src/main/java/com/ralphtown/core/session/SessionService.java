package com.ralphtown.core.session;

import com.ralphtown.core.model.LogStream;
import com.ralphtown.core.model.MessageRole;
import com.ralphtown.core.model.OutputLog;
import com.ralphtown.core.model.Repo;
import com.ralphtown.core.model.Session;
import com.ralphtown.core.persistence.RecordNotFoundException;
import com.ralphtown.core.persistence.SessionStore;
import com.ralphtown.core.process.NotRunningException;
import com.ralphtown.core.process.ProcessOrchestrator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.List;

/**
 * Session CRUD and the entry points for starting and cancelling a session's agent.
 * Process lifecycle itself is delegated to {@link ProcessOrchestrator}.
 */
@Service
public class SessionService {

    private static final Logger log = LoggerFactory.getLogger(SessionService.class);

    private final SessionStore store;
    private final ProcessOrchestrator orchestrator;

    public SessionService(SessionStore store, ProcessOrchestrator orchestrator) {
        this.store = store;
        this.orchestrator = orchestrator;
    }

    public List<Session> list() {
        return store.listSessions();
    }

    public List<Session> listForRepo(String repoId) {
        return store.listSessionsByRepo(repoId);
    }

    public Session get(String id) {
        return store.getSession(id).orElseThrow(() -> new RecordNotFoundException("Session", id));
    }

    public SessionDetails details(String id) {
        return new SessionDetails(get(id), store.listMessages(id));
    }

    /**
     * @throws IllegalArgumentException if the repo does not exist
     */
    public Session create(String repoId, String name) {
        if (store.getRepo(repoId).isEmpty()) {
            throw new IllegalArgumentException("Repository not found: " + repoId);
        }
        Session session = store.insertSession(repoId, name);
        log.info("Created session {} for repo {}", session.id(), repoId);
        return session;
    }

    /**
     * Deletes a session, stopping its agent first if one is running.
     */
    public void delete(String id) {
        get(id);
        if (orchestrator.isSessionRunning(id)) {
            try {
                orchestrator.cancel(id);
            } catch (NotRunningException e) {
                log.debug("Session {} stopped before delete could cancel it", id);
            }
        }
        store.deleteSession(id);
        log.info("Deleted session {}", id);
    }

    /**
     * Records the prompt as a user message and starts the agent in the session's repo.
     */
    public Session run(String id, String prompt) {
        if (prompt == null || prompt.isBlank()) {
            throw new IllegalArgumentException("Prompt cannot be empty");
        }
        Session session = get(id);
        Repo repo = store.getRepo(session.repoId())
                .orElseThrow(() -> new RecordNotFoundException("Repo", session.repoId()));

        orchestrator.run(session.id(), repo.id(), Path.of(repo.path()), prompt);
        try {
            store.insertMessage(session.id(), MessageRole.USER, prompt);
        } catch (RuntimeException e) {
            log.warn("Failed to record prompt for session {}: {}", id, e.getMessage());
        }
        return session;
    }

    public void cancel(String id) {
        get(id);
        orchestrator.cancel(id);
    }

    public OutputPage output(String id, LogStream stream, Integer limit, Integer offset) {
        get(id);
        List<OutputLog> logs = store.listOutputLogs(id, stream, limit, offset);
        long total = store.countOutputLogs(id, stream);
        return new OutputPage(id, logs, total);
    }

    public Path repoPath(String sessionId) {
        Session session = get(sessionId);
        Repo repo = store.getRepo(session.repoId())
                .orElseThrow(() -> new RecordNotFoundException("Repo", session.repoId()));
        return Path.of(repo.path());
    }
}
