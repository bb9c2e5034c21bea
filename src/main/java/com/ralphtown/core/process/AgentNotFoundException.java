package com.ralphtown.core.process;

import java.util.List;

/**
 * The agent executable could not be resolved on the search path. Always carries
 * installation steps for the user.
 */
public class AgentNotFoundException extends ProcessControlException {

    public static final String CODE = "RALPH_NOT_FOUND";

    static final List<String> INSTALL_STEPS = List.of(
            "Install ralph: cargo install ralph",
            "Or download from release page",
            "Ensure ~/.cargo/bin is in your PATH",
            "Restart your terminal after installation"
    );

    private final List<String> helpSteps;

    public AgentNotFoundException(String executable) {
        this(executable + " CLI not found in PATH", INSTALL_STEPS);
    }

    public AgentNotFoundException(String message, List<String> helpSteps) {
        super(message);
        this.helpSteps = List.copyOf(helpSteps);
    }

    @Override
    public List<String> helpSteps() {
        return helpSteps;
    }
}
