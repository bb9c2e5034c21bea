package com.ralphtown.core.process;

/**
 * How an agent process ended.
 *
 * @param exitCode the process exit code; -1 when it could not be observed
 * @param success  true only for a zero exit code
 */
public record ExitOutcome(int exitCode, boolean success) {

    public static ExitOutcome of(int exitCode) {
        return new ExitOutcome(exitCode, exitCode == 0);
    }

    public static ExitOutcome abnormal() {
        return new ExitOutcome(-1, false);
    }
}
