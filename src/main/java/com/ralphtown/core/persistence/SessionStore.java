package com.ralphtown.core.persistence;

import com.ralphtown.core.model.LogStream;
import com.ralphtown.core.model.Message;
import com.ralphtown.core.model.MessageRole;
import com.ralphtown.core.model.OutputLog;
import com.ralphtown.core.model.Repo;
import com.ralphtown.core.model.Session;
import com.ralphtown.core.model.SessionStatus;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Durable CRUD over repositories, sessions, messages, output records and config.
 * <p>
 * Implementations must be safe for concurrent use: the process orchestrator writes
 * output records from two reader threads per session while HTTP requests read.
 */
public interface SessionStore {

    // -- Repos --

    Repo insertRepo(String path, String name);

    Optional<Repo> getRepo(String id);

    Optional<Repo> findRepoByPath(String path);

    List<Repo> listRepos();

    /** Deletes the repo and, by cascade, its sessions. Returns false if it did not exist. */
    boolean deleteRepo(String id);

    // -- Sessions --

    Session insertSession(String repoId, String name);

    Optional<Session> getSession(String id);

    List<Session> listSessions();

    List<Session> listSessionsByRepo(String repoId);

    List<Session> listSessionsByStatus(SessionStatus status);

    /**
     * @throws RecordNotFoundException if the session does not exist
     */
    void updateSessionStatus(String id, SessionStatus status);

    boolean deleteSession(String id);

    // -- Messages --

    Message insertMessage(String sessionId, MessageRole role, String content);

    List<Message> listMessages(String sessionId);

    // -- Output logs --

    OutputLog insertOutputLog(String sessionId, LogStream stream, String content);

    /**
     * @param stream optional stream filter; null for both
     * @param limit  optional page size; null for unlimited
     * @param offset optional page offset; null for zero
     */
    List<OutputLog> listOutputLogs(String sessionId, LogStream stream, Integer limit, Integer offset);

    long countOutputLogs(String sessionId, LogStream stream);

    // -- Config --

    Optional<String> getConfig(String key);

    void setConfig(String key, String value);

    Map<String, String> listConfig();
}
