package com.ralphtown.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/** Which output stream of the agent process a log line came from. */
public enum LogStream {
    STDOUT,
    STDERR;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static LogStream fromValue(String value) {
        return parse(value).orElseThrow(() -> new IllegalArgumentException("Unknown stream: " + value));
    }

    /** Lenient lookup: empty for null or unrecognised names. */
    public static Optional<LogStream> parse(String value) {
        for (LogStream stream : values()) {
            if (stream.value().equalsIgnoreCase(value)) {
                return Optional.of(stream);
            }
        }
        return Optional.empty();
    }
}
