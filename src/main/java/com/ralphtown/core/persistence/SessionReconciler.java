package com.ralphtown.core.persistence;

import com.ralphtown.core.config.RalphtownProperties;
import com.ralphtown.core.events.EventBus;
import com.ralphtown.core.events.SessionEvent;
import com.ralphtown.core.model.Session;
import com.ralphtown.core.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Demotes sessions left {@code running} by a previous process to {@code error}
 * and broadcasts the new status.
 * <p>
 * The active-process registry is empty after a restart, so a persisted
 * {@code running} status cannot be backed by a live child process.
 * Runs only when the HTTP server starts, so CLI invocations next to a live server
 * leave its sessions alone. Disabled with {@code ralphtown.sessions.reconcile-on-startup=false}.
 */
@Component
public class SessionReconciler {

    private static final Logger log = LoggerFactory.getLogger(SessionReconciler.class);

    private final SessionStore store;
    private final RalphtownProperties properties;
    private final EventBus eventBus;

    public SessionReconciler(SessionStore store, RalphtownProperties properties, EventBus eventBus) {
        this.store = store;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    @EventListener(WebServerInitializedEvent.class)
    public void onStartup() {
        if (properties.isReconcileOnStartup()) {
            reconcileOrphans();
        }
    }

    /**
     * @return number of sessions demoted
     */
    public int reconcileOrphans() {
        List<Session> orphans = store.listSessionsByStatus(SessionStatus.RUNNING);
        int demoted = 0;
        for (Session session : orphans) {
            try {
                store.updateSessionStatus(session.id(), SessionStatus.ERROR);
                demoted++;
                eventBus.publish(SessionEvent.status(session.id(), SessionStatus.ERROR.value()));
            } catch (StoreException e) {
                log.warn("Could not demote orphaned session {}: {}", session.id(), e.getMessage());
            }
        }
        if (demoted > 0) {
            log.info("Demoted {} orphaned running session(s) to error", demoted);
        }
        return demoted;
    }
}
