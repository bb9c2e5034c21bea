package com.ralphtown.core.git;

import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.ListBranchCommand;
import org.eclipse.jgit.api.Status;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.diff.DiffEntry;
import org.eclipse.jgit.diff.DiffFormatter;
import org.eclipse.jgit.diff.Edit;
import org.eclipse.jgit.errors.RepositoryNotFoundException;
import org.eclipse.jgit.lib.BranchConfig;
import org.eclipse.jgit.lib.BranchTrackingStatus;
import org.eclipse.jgit.lib.ObjectId;
import org.eclipse.jgit.lib.ObjectReader;
import org.eclipse.jgit.lib.Ref;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.treewalk.AbstractTreeIterator;
import org.eclipse.jgit.treewalk.CanonicalTreeParser;
import org.eclipse.jgit.treewalk.EmptyTreeIterator;
import org.eclipse.jgit.treewalk.FileTreeIterator;
import org.eclipse.jgit.util.io.DisabledOutputStream;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only repository inspection through JGit.
 */
@Component
public class GitInspector {

    public GitStatus status(Path repoPath) {
        try (Git git = open(repoPath)) {
            Repository repo = git.getRepository();
            Status status = git.status().call();

            List<GitStatus.FileChange> staged = new ArrayList<>();
            sorted(status.getAdded()).forEach(p -> staged.add(change(p, GitStatus.ChangeType.ADDED)));
            sorted(status.getChanged()).forEach(p -> staged.add(change(p, GitStatus.ChangeType.MODIFIED)));
            sorted(status.getRemoved()).forEach(p -> staged.add(change(p, GitStatus.ChangeType.DELETED)));

            List<GitStatus.FileChange> unstaged = new ArrayList<>();
            sorted(status.getModified()).forEach(p -> unstaged.add(change(p, GitStatus.ChangeType.MODIFIED)));
            sorted(status.getMissing()).forEach(p -> unstaged.add(change(p, GitStatus.ChangeType.DELETED)));

            int ahead = 0;
            int behind = 0;
            String branch = repo.getBranch();
            BranchTrackingStatus tracking = BranchTrackingStatus.of(repo, branch);
            if (tracking != null) {
                ahead = tracking.getAheadCount();
                behind = tracking.getBehindCount();
            }

            return new GitStatus(branch, ahead, behind, staged, unstaged, List.copyOf(sorted(status.getUntracked())));
        } catch (GitAPIException | IOException e) {
            throw failed(e);
        }
    }

    public List<CommitInfo> log(Path repoPath, int limit) {
        try (Git git = open(repoPath)) {
            List<CommitInfo> commits = new ArrayList<>();
            for (RevCommit commit : git.log().setMaxCount(limit).call()) {
                commits.add(new CommitInfo(
                        commit.getName(),
                        commit.abbreviate(7).name(),
                        commit.getFullMessage().trim(),
                        commit.getAuthorIdent().getName(),
                        commit.getAuthorIdent().getEmailAddress(),
                        Instant.ofEpochSecond(commit.getCommitTime()).toString()));
            }
            return commits;
        } catch (GitAPIException e) {
            throw failed(e);
        }
    }

    public List<BranchInfo> branches(Path repoPath) {
        try (Git git = open(repoPath)) {
            Repository repo = git.getRepository();
            String current = repo.getBranch();
            List<BranchInfo> branches = new ArrayList<>();

            for (Ref ref : git.branchList().call()) {
                String name = Repository.shortenRefName(ref.getName());
                String tracking = new BranchConfig(repo.getConfig(), name).getTrackingBranch();
                branches.add(new BranchInfo(name, name.equals(current), false,
                        tracking != null ? Repository.shortenRefName(tracking) : null));
            }
            for (Ref ref : git.branchList().setListMode(ListBranchCommand.ListMode.REMOTE).call()) {
                String name = Repository.shortenRefName(ref.getName());
                if (name.endsWith("/HEAD")) {
                    continue;
                }
                branches.add(new BranchInfo(name, false, true, null));
            }
            return branches;
        } catch (GitAPIException | IOException e) {
            throw failed(e);
        }
    }

    /**
     * Line statistics for tracked changes (staged and unstaged) against HEAD.
     */
    public List<FileDelta> diffStats(Path repoPath) {
        try (Git git = open(repoPath);
             DiffFormatter formatter = new DiffFormatter(DisabledOutputStream.INSTANCE)) {
            Repository repo = git.getRepository();
            Set<String> untracked = git.status().call().getUntracked();
            formatter.setRepository(repo);

            List<FileDelta> deltas = new ArrayList<>();
            try (ObjectReader reader = repo.newObjectReader()) {
                for (DiffEntry entry : formatter.scan(headTree(repo, reader), new FileTreeIterator(repo))) {
                    String path = entry.getChangeType() == DiffEntry.ChangeType.DELETE
                            ? entry.getOldPath() : entry.getNewPath();
                    if (untracked.contains(path)) {
                        continue;
                    }
                    int added = 0;
                    int removed = 0;
                    for (Edit edit : formatter.toFileHeader(entry).toEditList()) {
                        added += edit.getLengthB();
                        removed += edit.getLengthA();
                    }
                    deltas.add(new FileDelta(path, added, removed));
                }
            }
            return deltas;
        } catch (GitAPIException | IOException e) {
            throw failed(e);
        }
    }

    private static AbstractTreeIterator headTree(Repository repo, ObjectReader reader) throws IOException {
        ObjectId tree = repo.resolve("HEAD^{tree}");
        if (tree == null) {
            return new EmptyTreeIterator();
        }
        CanonicalTreeParser parser = new CanonicalTreeParser();
        parser.reset(reader, tree);
        return parser;
    }

    private static Git open(Path repoPath) {
        try {
            return Git.open(repoPath.toFile());
        } catch (RepositoryNotFoundException e) {
            throw GitOperationException.notARepo(repoPath.toString());
        } catch (IOException e) {
            throw new GitOperationException(GitOperationException.Kind.NOT_A_REPO,
                    "Not a git repository: " + repoPath + " (" + e.getMessage() + ")", e);
        }
    }

    private static GitOperationException failed(Exception e) {
        return new GitOperationException(GitOperationException.Kind.OPERATION_FAILED,
                "Git operation failed: " + e.getMessage(), e);
    }

    private static GitStatus.FileChange change(String path, GitStatus.ChangeType type) {
        return new GitStatus.FileChange(path, type, null);
    }

    private static Set<String> sorted(Set<String> paths) {
        return new TreeSet<>(paths);
    }
}
