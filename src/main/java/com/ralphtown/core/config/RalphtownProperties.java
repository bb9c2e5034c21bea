package com.ralphtown.core.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "ralphtown")
public class RalphtownProperties {

    private Agent agent = new Agent();
    private Store store = new Store();
    private Clone clone = new Clone();
    private Sessions sessions = new Sessions();

    // -- Convenience accessors (delegate to nested) --
    public String getAgentExecutable() { return agent.executable; }
    public Duration getCancelGrace() { return agent.cancelGrace; }
    public Path getStorePath() { return Path.of(store.path); }
    public Path getCloneRoot() { return Path.of(clone.root); }
    public int getProgressCapacity() { return clone.progressCapacity; }
    public boolean isReconcileOnStartup() { return sessions.reconcileOnStartup; }

    public Agent getAgent() { return agent; }
    public void setAgent(Agent agent) { this.agent = agent; }
    public Store getStore() { return store; }
    public void setStore(Store store) { this.store = store; }
    public Clone getClone() { return clone; }
    public void setClone(Clone clone) { this.clone = clone; }
    public Sessions getSessions() { return sessions; }
    public void setSessions(Sessions sessions) { this.sessions = sessions; }

    public static class Agent {
        /** Executable resolved on PATH and invoked as {@code <exe> run --autonomous --prompt <prompt>}. */
        private String executable = "ralph";
        /** Window between the graceful stop request and the forced kill on cancel. */
        private Duration cancelGrace = Duration.ofSeconds(5);

        public String getExecutable() { return executable; }
        public void setExecutable(String executable) { this.executable = executable; }
        public Duration getCancelGrace() { return cancelGrace; }
        public void setCancelGrace(Duration cancelGrace) { this.cancelGrace = cancelGrace; }
    }

    public static class Store {
        private String path = System.getProperty("user.home") + "/.ralphtown/ralphtown.db";

        public String getPath() { return path; }
        public void setPath(String path) { this.path = path; }
    }

    public static class Clone {
        private String root = System.getProperty("user.home") + "/ralphtown";
        private int progressCapacity = 32;

        public String getRoot() { return root; }
        public void setRoot(String root) { this.root = root; }
        public int getProgressCapacity() { return progressCapacity; }
        public void setProgressCapacity(int progressCapacity) { this.progressCapacity = progressCapacity; }
    }

    public static class Sessions {
        private boolean reconcileOnStartup = true;

        public boolean isReconcileOnStartup() { return reconcileOnStartup; }
        public void setReconcileOnStartup(boolean reconcileOnStartup) { this.reconcileOnStartup = reconcileOnStartup; }
    }
}
