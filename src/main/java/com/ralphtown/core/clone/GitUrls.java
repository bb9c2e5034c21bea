package com.ralphtown.core.clone;

/**
 * Helpers for git remote URLs.
 */
public final class GitUrls {

    private GitUrls() {}

    /**
     * Derives the repository directory name from a remote URL: the segment after the
     * last {@code /}, or after the last {@code :} for scp-like SSH URLs, with trailing
     * {@code /} and {@code .git} removed.
     *
     * @throws IllegalArgumentException if no usable name can be derived
     */
    public static String extractRepoName(String url) {
        if (url == null) {
            throw new IllegalArgumentException("Could not extract repository name from URL");
        }
        String trimmed = url.strip();
        while (trimmed.endsWith("/")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        while (trimmed.endsWith(".git")) {
            trimmed = trimmed.substring(0, trimmed.length() - ".git".length());
        }

        String name = trimmed.substring(trimmed.lastIndexOf('/') + 1);
        if (name.isEmpty() || name.equals(trimmed)) {
            name = trimmed.substring(trimmed.lastIndexOf(':') + 1);
        }

        if (name.isEmpty() || name.contains("/") || name.equals(".") || name.equals("..")) {
            throw new IllegalArgumentException("Could not extract repository name from URL");
        }
        return name;
    }
}
