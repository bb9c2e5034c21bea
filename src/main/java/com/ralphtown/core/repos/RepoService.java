package com.ralphtown.core.repos;

import com.ralphtown.core.model.Repo;
import com.ralphtown.core.persistence.RecordNotFoundException;
import com.ralphtown.core.persistence.SessionStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Registration and discovery of local git working trees.
 */
@Service
public class RepoService {

    private static final Logger log = LoggerFactory.getLogger(RepoService.class);

    public static final int DEFAULT_SCAN_DEPTH = 2;

    private final SessionStore store;

    public RepoService(SessionStore store) {
        this.store = store;
    }

    public List<Repo> list() {
        return store.listRepos();
    }

    public Repo get(String id) {
        return store.getRepo(id).orElseThrow(() -> new RecordNotFoundException("Repo", id));
    }

    /**
     * Registers an existing working tree under its canonical path.
     *
     * @throws IllegalArgumentException if the path is missing, not a git repository,
     *                                  or already registered
     */
    public Repo add(String path) {
        if (path == null || path.isBlank()) {
            throw new IllegalArgumentException("Path cannot be empty");
        }
        Path candidate = Path.of(path);
        if (!Files.exists(candidate)) {
            throw new IllegalArgumentException("Path does not exist: " + path);
        }
        if (!isGitRepo(candidate)) {
            throw new IllegalArgumentException("Not a git repository: " + path);
        }

        Path canonical;
        try {
            canonical = candidate.toRealPath();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to canonicalize path: " + path, e);
        }
        String canonicalPath = canonical.toString();
        if (store.findRepoByPath(canonicalPath).isPresent()) {
            throw new IllegalArgumentException("Repository already added: " + canonicalPath);
        }

        Path fileName = canonical.getFileName();
        Repo repo = store.insertRepo(canonicalPath, fileName != null ? fileName.toString() : canonicalPath);
        log.info("Registered repo {} at {}", repo.id(), canonicalPath);
        return repo;
    }

    public void delete(String id) {
        if (!store.deleteRepo(id)) {
            throw new RecordNotFoundException("Repo", id);
        }
        log.info("Deleted repo {}", id);
    }

    /**
     * Finds git working trees under the given directories. Hidden directories are
     * skipped and a repository's own subdirectories are not searched.
     *
     * @param depth how many directory levels below each root to descend
     */
    public List<FoundRepo> scan(List<String> directories, int depth) {
        List<FoundRepo> found = new ArrayList<>();
        for (String dir : directories) {
            Path root = Path.of(dir);
            if (Files.isDirectory(root)) {
                scanDirectory(root, 0, depth, found);
            }
        }
        return found;
    }

    private void scanDirectory(Path path, int currentDepth, int maxDepth, List<FoundRepo> found) {
        if (isGitRepo(path)) {
            Path name = path.getFileName();
            found.add(new FoundRepo(path.toString(), name != null ? name.toString() : "unknown"));
            return;
        }
        if (currentDepth >= maxDepth) {
            return;
        }
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(path, Files::isDirectory)) {
            for (Path entry : entries) {
                if (entry.getFileName().toString().startsWith(".")) {
                    continue;
                }
                scanDirectory(entry, currentDepth + 1, maxDepth, found);
            }
        } catch (IOException e) {
            log.debug("Skipping unreadable directory {}: {}", path, e.getMessage());
        }
    }

    static boolean isGitRepo(Path path) {
        return Files.isDirectory(path) && Files.exists(path.resolve(".git"));
    }
}
