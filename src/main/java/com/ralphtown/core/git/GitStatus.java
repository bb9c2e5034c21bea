package com.ralphtown.core.git;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Working tree status relative to HEAD and the upstream branch.
 *
 * @param branch    current branch, or the commit id when HEAD is detached
 * @param ahead     commits on the branch not on its upstream; 0 without upstream
 * @param behind    commits on the upstream not on the branch; 0 without upstream
 * @param staged    changes in the index
 * @param unstaged  changes in the working tree to tracked files
 * @param untracked untracked paths
 */
public record GitStatus(
    String branch,
    int ahead,
    int behind,
    List<FileChange> staged,
    List<FileChange> unstaged,
    List<String> untracked
) {

    public record FileChange(String path, ChangeType status, @JsonProperty("old_path") String oldPath) {}

    public enum ChangeType {
        @JsonProperty("added") ADDED,
        @JsonProperty("modified") MODIFIED,
        @JsonProperty("deleted") DELETED
    }
}
