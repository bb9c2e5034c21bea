package com.ralphtown.core.clone;

import com.ralphtown.core.model.Repo;

import java.util.List;

/**
 * Event on a clone progress stream. A stream carries zero or more {@link Progress}
 * events followed by exactly one terminal {@link Complete} or {@link Failed}.
 */
public interface CloneEvent {

    String PROGRESS = "progress";
    String COMPLETE = "complete";
    String ERROR = "error";

    String type();

    default boolean isTerminal() {
        return !PROGRESS.equals(type());
    }

    record Progress(CloneProgress progress) implements CloneEvent {
        @Override
        public String type() {
            return PROGRESS;
        }
    }

    record Complete(Repo repo, String message) implements CloneEvent {
        @Override
        public String type() {
            return COMPLETE;
        }
    }

    record Failed(String message, List<String> helpSteps) implements CloneEvent {
        public Failed {
            helpSteps = List.copyOf(helpSteps);
        }

        static Failed of(String message) {
            return new Failed(message, List.of());
        }

        @Override
        public String type() {
            return ERROR;
        }
    }
}
