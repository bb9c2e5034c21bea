package com.ralphtown.core.process;

/**
 * Fallback for platforms without graceful termination: only the direct child is
 * stopped, and a graceful request is already forcible there.
 */
class SingleProcessGroup implements ProcessGroup {

    private final Process process;

    SingleProcessGroup(Process process) {
        this.process = process;
    }

    @Override
    public void requestGracefulStop() {
        process.destroy();
    }

    @Override
    public void forceStop() {
        process.destroyForcibly();
    }

    @Override
    public boolean isAlive() {
        return process.isAlive();
    }
}
