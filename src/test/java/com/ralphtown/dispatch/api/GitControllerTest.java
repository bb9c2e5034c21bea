package com.ralphtown.dispatch.api;

import com.ralphtown.core.git.BranchInfo;
import com.ralphtown.core.git.CommandOutput;
import com.ralphtown.core.git.CommitInfo;
import com.ralphtown.core.git.FileDelta;
import com.ralphtown.core.git.GitCommandRunner;
import com.ralphtown.core.git.GitInspector;
import com.ralphtown.core.git.GitOperationException;
import com.ralphtown.core.git.GitStatus;
import com.ralphtown.core.session.SessionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.MvcResult;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.hamcrest.Matchers.hasSize;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.asyncDispatch;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(GitController.class)
class GitControllerTest {

    private static final Path REPO = Path.of("/home/u/code/widgets");

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private SessionService sessionService;

    @MockitoBean
    private GitInspector inspector;

    @MockitoBean
    private GitCommandRunner commands;

    @BeforeEach
    void setUp() {
        when(sessionService.repoPath("S-1")).thenReturn(REPO);
    }

    @Test
    @DisplayName("GET /git/status reports branch and changes")
    void statusReportsBranchAndChanges() throws Exception {
        when(inspector.status(REPO)).thenReturn(new GitStatus("main", 1, 0,
                List.of(new GitStatus.FileChange("a.txt", GitStatus.ChangeType.ADDED, null)),
                List.of(),
                List.of("notes.md")));

        mockMvc.perform(get("/api/sessions/S-1/git/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.branch").value("main"))
                .andExpect(jsonPath("$.ahead").value(1))
                .andExpect(jsonPath("$.staged[0].status").value("added"))
                .andExpect(jsonPath("$.untracked[0]").value("notes.md"));
    }

    @Test
    @DisplayName("GET /git/log defaults the limit")
    void logDefaultLimit() throws Exception {
        when(inspector.log(REPO, GitController.DEFAULT_LOG_LIMIT)).thenReturn(List.of(
                new CommitInfo("abc1234def", "abc1234", "initial", "Dev", "dev@example.com",
                        "2026-03-01T12:00:00Z")));

        mockMvc.perform(get("/api/sessions/S-1/git/log"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].short_id").value("abc1234"));
    }

    @Test
    @DisplayName("GET /git/log honours an explicit limit")
    void logLimit() throws Exception {
        when(inspector.log(REPO, 5)).thenReturn(List.of());

        mockMvc.perform(get("/api/sessions/S-1/git/log").param("limit", "5"))
                .andExpect(status().isOk());

        verify(inspector).log(REPO, 5);
    }

    @Test
    void branches() throws Exception {
        when(inspector.branches(REPO)).thenReturn(List.of(
                new BranchInfo("main", true, false, "origin/main"),
                new BranchInfo("origin/main", false, true, null)));

        mockMvc.perform(get("/api/sessions/S-1/git/branches"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$", hasSize(2)))
                .andExpect(jsonPath("$[0].is_current").value(true))
                .andExpect(jsonPath("$[1].is_remote").value(true));
    }

    @Test
    void diff() throws Exception {
        when(inspector.diffStats(REPO)).thenReturn(List.of(new FileDelta("a.txt", 2, 1)));

        mockMvc.perform(get("/api/sessions/S-1/git/diff"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].path").value("a.txt"))
                .andExpect(jsonPath("$[0].added").value(2))
                .andExpect(jsonPath("$[0].removed").value(1));
    }

    @Test
    @DisplayName("POST /git/commit completes asynchronously with command output")
    void commit() throws Exception {
        when(commands.commit(REPO, "wip")).thenReturn(
                CompletableFuture.completedFuture(new CommandOutput(true, "1 file changed", "")));

        MvcResult result = mockMvc.perform(post("/api/sessions/S-1/git/commit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"message":"wip"}
                                """))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.stdout").value("1 file changed"));
    }

    @Test
    @DisplayName("POST /git/commit with an empty message returns 400")
    void commitBlank() throws Exception {
        when(commands.commit(REPO, "")).thenThrow(new IllegalArgumentException("Commit message cannot be empty"));

        mockMvc.perform(post("/api/sessions/S-1/git/commit")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"message":""}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Commit message cannot be empty"));
    }

    @Test
    @DisplayName("POST /git/checkout with an option-like branch returns 400")
    void checkoutInvalidBranch() throws Exception {
        when(commands.checkout(REPO, "--force")).thenThrow(new GitOperationException(
                GitOperationException.Kind.INVALID_BRANCH, "Invalid branch name: --force"));

        mockMvc.perform(post("/api/sessions/S-1/git/checkout")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("""
                                {"branch":"--force"}
                                """))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("bad_request"));
    }

    @Test
    @DisplayName("a failing git command surfaces as 500")
    void pullFails() throws Exception {
        when(commands.pull(REPO)).thenReturn(CompletableFuture.failedFuture(new GitOperationException(
                GitOperationException.Kind.COMMAND_FAILED, "Failed to run git: no such file")));

        MvcResult result = mockMvc.perform(post("/api/sessions/S-1/git/pull"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.message").value("Failed to run git: no such file"));
    }

    @Test
    void reset() throws Exception {
        when(commands.resetHard(REPO)).thenReturn(
                CompletableFuture.completedFuture(new CommandOutput(true, "HEAD is now at abc1234", "")));

        MvcResult result = mockMvc.perform(post("/api/sessions/S-1/git/reset"))
                .andExpect(request().asyncStarted())
                .andReturn();

        mockMvc.perform(asyncDispatch(result))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true));
    }
}
