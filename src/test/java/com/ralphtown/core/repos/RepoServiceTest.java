package com.ralphtown.core.repos;

import com.ralphtown.core.model.Repo;
import com.ralphtown.core.persistence.RecordNotFoundException;
import com.ralphtown.core.persistence.SessionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class RepoServiceTest {

    @TempDir
    Path tempDir;

    private SessionStore store;
    private RepoService service;

    @BeforeEach
    void setUp() {
        store = mock(SessionStore.class);
        service = new RepoService(store);
    }

    private Path gitDir(Path parent, String name) throws Exception {
        Path dir = Files.createDirectories(parent.resolve(name));
        Files.createDirectories(dir.resolve(".git"));
        return dir;
    }

    @Nested
    @DisplayName("add")
    class AddTests {

        @Test
        @DisplayName("registers the canonical path under the directory name")
        void addsRepo() throws Exception {
            Path repoDir = gitDir(tempDir, "widgets");
            String canonical = repoDir.toRealPath().toString();
            Instant now = Instant.now();
            Repo repo = new Repo("R-1", canonical, "widgets", now, now);
            when(store.findRepoByPath(canonical)).thenReturn(Optional.empty());
            when(store.insertRepo(canonical, "widgets")).thenReturn(repo);

            assertSame(repo, service.add(repoDir.resolve("..").resolve("widgets").toString()));
        }

        @Test
        void rejectsEmptyPath() {
            var ex = assertThrows(IllegalArgumentException.class, () -> service.add(" "));
            assertEquals("Path cannot be empty", ex.getMessage());
        }

        @Test
        void rejectsMissingPath() {
            String missing = tempDir.resolve("missing").toString();
            var ex = assertThrows(IllegalArgumentException.class, () -> service.add(missing));
            assertEquals("Path does not exist: " + missing, ex.getMessage());
        }

        @Test
        void rejectsNonRepository() throws Exception {
            Path plain = Files.createDirectories(tempDir.resolve("plain"));
            var ex = assertThrows(IllegalArgumentException.class, () -> service.add(plain.toString()));
            assertEquals("Not a git repository: " + plain, ex.getMessage());
        }

        @Test
        void rejectsDuplicate() throws Exception {
            Path repoDir = gitDir(tempDir, "widgets");
            String canonical = repoDir.toRealPath().toString();
            Instant now = Instant.now();
            when(store.findRepoByPath(canonical)).thenReturn(Optional.of(new Repo("R-1", canonical, "widgets", now, now)));

            var ex = assertThrows(IllegalArgumentException.class, () -> service.add(repoDir.toString()));
            assertEquals("Repository already added: " + canonical, ex.getMessage());
            verify(store, never()).insertRepo(anyString(), anyString());
        }
    }

    @Test
    @DisplayName("delete of an unknown repo throws RecordNotFoundException")
    void deleteMissing() {
        when(store.deleteRepo("nope")).thenReturn(false);
        assertThrows(RecordNotFoundException.class, () -> service.delete("nope"));
    }

    @Nested
    @DisplayName("scan")
    class ScanTests {

        @Test
        @DisplayName("finds repositories up to the depth, skipping hidden and nested ones")
        void scans() throws Exception {
            Path root = Files.createDirectories(tempDir.resolve("code"));
            gitDir(root, "alpha");
            gitDir(root.resolve("group"), "beta");
            gitDir(root.resolve("group").resolve("deeper"), "gamma");
            gitDir(root, ".hidden");
            Path alpha = root.resolve("alpha");
            gitDir(alpha, "vendored");

            List<FoundRepo> found = service.scan(List.of(root.toString()), RepoService.DEFAULT_SCAN_DEPTH);

            Set<String> names = found.stream().map(FoundRepo::name).collect(Collectors.toSet());
            assertEquals(Set.of("alpha", "beta"), names);
        }

        @Test
        @DisplayName("a root that is itself a repository is returned")
        void rootIsRepo() throws Exception {
            Path repo = gitDir(tempDir, "solo");

            List<FoundRepo> found = service.scan(List.of(repo.toString()), 0);

            assertEquals(List.of(new FoundRepo(repo.toString(), "solo")), found);
        }

        @Test
        @DisplayName("missing roots are ignored")
        void missingRoot() {
            assertTrue(service.scan(List.of(tempDir.resolve("nope").toString()), 2).isEmpty());
        }
    }
}
