package com.ralphtown.core.process;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ActiveProcessRegistryTest {

    private final ActiveProcessRegistry registry = new ActiveProcessRegistry();

    @Test
    void reserveOccupiesSessionAndRepo() {
        ActiveProcess entry = registry.reserve("S-1", "R-1");

        assertTrue(registry.isSessionRunning("S-1"));
        assertTrue(registry.isRepoBusy("R-1"));
        assertSame(entry, registry.get("S-1").orElseThrow());
        assertNull(entry.process());
    }

    @Test
    void sessionCheckPrecedesRepoCheck() {
        registry.reserve("S-1", "R-1");

        assertThrows(SessionAlreadyRunningException.class, () -> registry.reserve("S-1", "R-2"));
        assertThrows(RepoBusyException.class, () -> registry.reserve("S-2", "R-1"));
        assertFalse(registry.isRepoBusy("R-2"));
    }

    @Test
    void releaseIsIdentityChecked() {
        ActiveProcess first = registry.reserve("S-1", "R-1");
        assertTrue(registry.release(first));
        ActiveProcess second = registry.reserve("S-1", "R-1");

        assertFalse(registry.release(first));
        assertTrue(registry.contains(second));
        assertTrue(registry.isRepoBusy("R-1"));
    }

    @Test
    void terminalStatusIsClaimedOnce() {
        ActiveProcess entry = registry.reserve("S-1", "R-1");

        assertTrue(entry.claimTerminalStatus());
        assertFalse(entry.claimTerminalStatus());
    }

    @Test
    void snapshotListsActiveEntries() {
        registry.reserve("S-1", "R-1");
        registry.reserve("S-2", "R-2");

        assertEquals(2, registry.snapshot().size());
    }
}
