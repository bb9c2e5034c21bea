package com.ralphtown.core.clone;

import java.util.List;

/**
 * A synchronous clone request ended with an error event.
 */
public class CloneRequestException extends RuntimeException {

    private final List<String> helpSteps;

    public CloneRequestException(String message, List<String> helpSteps) {
        super(message);
        this.helpSteps = List.copyOf(helpSteps);
    }

    public List<String> helpSteps() {
        return helpSteps;
    }
}
