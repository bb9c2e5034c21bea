package com.ralphtown.core.process;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Signals the agent process together with all of its descendants.
 * <p>
 * Descendants are snapshotted on every signal and remembered, because once the
 * parent exits its children are re-parented and no longer reachable through it.
 */
class SubtreeProcessGroup implements ProcessGroup {

    private final Process process;
    private final Set<ProcessHandle> seen = ConcurrentHashMap.newKeySet();

    SubtreeProcessGroup(Process process) {
        this.process = process;
    }

    @Override
    public void requestGracefulStop() {
        snapshotDescendants();
        process.destroy();
        for (ProcessHandle child : seen) {
            child.destroy();
        }
    }

    @Override
    public void forceStop() {
        snapshotDescendants();
        process.destroyForcibly();
        for (ProcessHandle child : seen) {
            if (child.isAlive()) {
                child.destroyForcibly();
            }
        }
    }

    @Override
    public boolean isAlive() {
        snapshotDescendants();
        if (process.isAlive()) {
            return true;
        }
        for (ProcessHandle child : seen) {
            if (child.isAlive()) {
                return true;
            }
        }
        return false;
    }

    private void snapshotDescendants() {
        process.descendants().forEach(seen::add);
    }
}
