package com.ralphtown.core.clone;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class GitUrlsTest {

    @ParameterizedTest(name = "{0} -> {1}")
    @CsvSource({
            "https://github.com/acme/widgets.git, widgets",
            "https://github.com/acme/widgets, widgets",
            "https://github.com/acme/widgets/, widgets",
            "git@github.com:acme/widgets.git, widgets",
            "git@example.com:widgets.git, widgets",
            "ssh://git@example.com:2222/acme/widgets.git, widgets",
            "file:///srv/git/widgets, widgets"
    })
    @DisplayName("derives the directory name from the URL")
    void extractsName(String url, String expected) {
        assertEquals(expected, GitUrls.extractRepoName(url));
    }

    @ParameterizedTest
    @ValueSource(strings = {"", "   ", "/", ".git", "https://example.com/acme/..", "git@host:"})
    @DisplayName("rejects URLs without a usable name")
    void rejects(String url) {
        var ex = assertThrows(IllegalArgumentException.class, () -> GitUrls.extractRepoName(url));
        assertEquals("Could not extract repository name from URL", ex.getMessage());
    }

    @Test
    void rejectsNull() {
        assertThrows(IllegalArgumentException.class, () -> GitUrls.extractRepoName(null));
    }
}
