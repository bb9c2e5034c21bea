package com.ralphtown.core.persistence;

import com.ralphtown.core.model.LogStream;
import com.ralphtown.core.model.Message;
import com.ralphtown.core.model.MessageRole;
import com.ralphtown.core.model.OutputLog;
import com.ralphtown.core.model.Repo;
import com.ralphtown.core.model.Session;
import com.ralphtown.core.model.SessionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * JDBC {@link SessionStore} backed by an embedded SQLite database.
 * <p>
 * Tables are created on startup via {@link #createTables()}. Identifiers are UUID
 * strings except for output records, which use the SQLite rowid so that their order
 * matches insertion order. Timestamps are stored as ISO-8601 text.
 */
public class JdbcSessionStore implements SessionStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcSessionStore.class);

    private static final List<String> SCHEMA = List.of(
            """
            CREATE TABLE IF NOT EXISTS repos (
                id          TEXT PRIMARY KEY,
                path        TEXT NOT NULL UNIQUE,
                name        TEXT NOT NULL,
                created_at  TEXT NOT NULL,
                updated_at  TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS sessions (
                id           TEXT PRIMARY KEY,
                repo_id      TEXT NOT NULL REFERENCES repos(id) ON DELETE CASCADE,
                name         TEXT,
                orchestrator TEXT NOT NULL DEFAULT 'ralph',
                status       TEXT NOT NULL DEFAULT 'idle',
                created_at   TEXT NOT NULL,
                updated_at   TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS messages (
                id          TEXT PRIMARY KEY,
                session_id  TEXT NOT NULL REFERENCES sessions(id) ON DELETE CASCADE,
                role        TEXT NOT NULL CHECK (role IN ('user', 'assistant', 'system')),
                content     TEXT NOT NULL,
                created_at  TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS output_logs (
                id          INTEGER PRIMARY KEY AUTOINCREMENT,
                session_id  TEXT NOT NULL REFERENCES sessions(id) ON DELETE CASCADE,
                stream      TEXT NOT NULL CHECK (stream IN ('stdout', 'stderr')),
                content     TEXT NOT NULL,
                created_at  TEXT NOT NULL
            )
            """,
            """
            CREATE TABLE IF NOT EXISTS config (
                key         TEXT PRIMARY KEY,
                value       TEXT NOT NULL,
                updated_at  TEXT NOT NULL
            )
            """,
            "CREATE INDEX IF NOT EXISTS idx_sessions_repo_id ON sessions(repo_id)",
            "CREATE INDEX IF NOT EXISTS idx_sessions_status ON sessions(status)",
            "CREATE INDEX IF NOT EXISTS idx_messages_session_id ON messages(session_id)",
            "CREATE INDEX IF NOT EXISTS idx_output_logs_session_id ON output_logs(session_id)"
    );

    private static final String REPO_COLUMNS = "id, path, name, created_at, updated_at";
    private static final String SESSION_COLUMNS = "id, repo_id, name, orchestrator, status, created_at, updated_at";
    private static final String LOG_COLUMNS = "id, session_id, stream, content, created_at";

    /** Fixed-width so that text ordering matches time ordering. */
    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private final DataSource dataSource;

    public JdbcSessionStore(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * Creates all tables and indexes if they do not already exist.
     */
    public void createTables() {
        try (Connection conn = dataSource.getConnection();
             Statement stmt = conn.createStatement()) {
            for (String ddl : SCHEMA) {
                stmt.execute(ddl);
            }
            log.info("Session store schema ready");
        } catch (SQLException e) {
            throw new StoreException("Failed to create store tables", e);
        }
    }

    // -- Repos ---------------------------------------------------------------

    @Override
    public Repo insertRepo(String path, String name) {
        Instant now = now();
        Repo repo = new Repo(UUID.randomUUID().toString(), path, name, now, now);
        update("INSERT INTO repos (" + REPO_COLUMNS + ") VALUES (?, ?, ?, ?, ?)", ps -> {
            ps.setString(1, repo.id());
            ps.setString(2, repo.path());
            ps.setString(3, repo.name());
            ps.setString(4, format(now));
            ps.setString(5, format(now));
        });
        return repo;
    }

    @Override
    public Optional<Repo> getRepo(String id) {
        return queryOne("SELECT " + REPO_COLUMNS + " FROM repos WHERE id = ?",
                ps -> ps.setString(1, id), JdbcSessionStore::mapRepo);
    }

    @Override
    public Optional<Repo> findRepoByPath(String path) {
        return queryOne("SELECT " + REPO_COLUMNS + " FROM repos WHERE path = ?",
                ps -> ps.setString(1, path), JdbcSessionStore::mapRepo);
    }

    @Override
    public List<Repo> listRepos() {
        return query("SELECT " + REPO_COLUMNS + " FROM repos ORDER BY name",
                ps -> {}, JdbcSessionStore::mapRepo);
    }

    @Override
    public boolean deleteRepo(String id) {
        return update("DELETE FROM repos WHERE id = ?", ps -> ps.setString(1, id)) > 0;
    }

    // -- Sessions ------------------------------------------------------------

    @Override
    public Session insertSession(String repoId, String name) {
        Instant now = now();
        Session session = new Session(UUID.randomUUID().toString(), repoId, name, "ralph",
                SessionStatus.IDLE, now, now);
        update("INSERT INTO sessions (" + SESSION_COLUMNS + ") VALUES (?, ?, ?, ?, ?, ?, ?)", ps -> {
            ps.setString(1, session.id());
            ps.setString(2, repoId);
            ps.setString(3, name);
            ps.setString(4, session.orchestrator());
            ps.setString(5, session.status().value());
            ps.setString(6, format(now));
            ps.setString(7, format(now));
        });
        return session;
    }

    @Override
    public Optional<Session> getSession(String id) {
        return queryOne("SELECT " + SESSION_COLUMNS + " FROM sessions WHERE id = ?",
                ps -> ps.setString(1, id), JdbcSessionStore::mapSession);
    }

    @Override
    public List<Session> listSessions() {
        return query("SELECT " + SESSION_COLUMNS + " FROM sessions ORDER BY updated_at DESC",
                ps -> {}, JdbcSessionStore::mapSession);
    }

    @Override
    public List<Session> listSessionsByRepo(String repoId) {
        return query("SELECT " + SESSION_COLUMNS + " FROM sessions WHERE repo_id = ? ORDER BY updated_at DESC",
                ps -> ps.setString(1, repoId), JdbcSessionStore::mapSession);
    }

    @Override
    public List<Session> listSessionsByStatus(SessionStatus status) {
        return query("SELECT " + SESSION_COLUMNS + " FROM sessions WHERE status = ? ORDER BY updated_at DESC",
                ps -> ps.setString(1, status.value()), JdbcSessionStore::mapSession);
    }

    @Override
    public void updateSessionStatus(String id, SessionStatus status) {
        int rows = update("UPDATE sessions SET status = ?, updated_at = ? WHERE id = ?", ps -> {
            ps.setString(1, status.value());
            ps.setString(2, format(now()));
            ps.setString(3, id);
        });
        if (rows == 0) {
            throw new RecordNotFoundException("Session", id);
        }
    }

    @Override
    public boolean deleteSession(String id) {
        return update("DELETE FROM sessions WHERE id = ?", ps -> ps.setString(1, id)) > 0;
    }

    // -- Messages ------------------------------------------------------------

    @Override
    public Message insertMessage(String sessionId, MessageRole role, String content) {
        Message message = new Message(UUID.randomUUID().toString(), sessionId, role, content, now());
        update("INSERT INTO messages (id, session_id, role, content, created_at) VALUES (?, ?, ?, ?, ?)", ps -> {
            ps.setString(1, message.id());
            ps.setString(2, sessionId);
            ps.setString(3, role.value());
            ps.setString(4, content);
            ps.setString(5, format(message.createdAt()));
        });
        return message;
    }

    @Override
    public List<Message> listMessages(String sessionId) {
        return query("""
                SELECT id, session_id, role, content, created_at
                FROM messages
                WHERE session_id = ?
                ORDER BY rowid
                """,
                ps -> ps.setString(1, sessionId),
                rs -> new Message(
                        rs.getString("id"),
                        rs.getString("session_id"),
                        MessageRole.fromValue(rs.getString("role")),
                        rs.getString("content"),
                        Instant.parse(rs.getString("created_at"))));
    }

    // -- Output logs ---------------------------------------------------------

    @Override
    public OutputLog insertOutputLog(String sessionId, LogStream stream, String content) {
        Instant now = now();
        try (Connection conn = dataSource.getConnection()) {
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO output_logs (session_id, stream, content, created_at) VALUES (?, ?, ?, ?)")) {
                ps.setString(1, sessionId);
                ps.setString(2, stream.value());
                ps.setString(3, content);
                ps.setString(4, format(now));
                ps.executeUpdate();
            }
            try (Statement stmt = conn.createStatement();
                 ResultSet rs = stmt.executeQuery("SELECT last_insert_rowid()")) {
                rs.next();
                return new OutputLog(rs.getLong(1), sessionId, stream, content, now);
            }
        } catch (SQLException e) {
            throw new StoreException("Failed to insert output log for session " + sessionId, e);
        }
    }

    @Override
    public List<OutputLog> listOutputLogs(String sessionId, LogStream stream, Integer limit, Integer offset) {
        String sql = "SELECT " + LOG_COLUMNS + " FROM output_logs WHERE session_id = ?"
                + (stream != null ? " AND stream = ?" : "")
                + " ORDER BY id LIMIT ? OFFSET ?";
        return query(sql, ps -> {
            int i = 1;
            ps.setString(i++, sessionId);
            if (stream != null) {
                ps.setString(i++, stream.value());
            }
            // SQLite treats a negative LIMIT as unlimited
            ps.setInt(i++, limit != null ? limit : -1);
            ps.setInt(i, offset != null ? offset : 0);
        }, rs -> new OutputLog(
                rs.getLong("id"),
                rs.getString("session_id"),
                LogStream.fromValue(rs.getString("stream")),
                rs.getString("content"),
                Instant.parse(rs.getString("created_at"))));
    }

    @Override
    public long countOutputLogs(String sessionId, LogStream stream) {
        String sql = "SELECT COUNT(*) FROM output_logs WHERE session_id = ?"
                + (stream != null ? " AND stream = ?" : "");
        return queryOne(sql, ps -> {
            ps.setString(1, sessionId);
            if (stream != null) {
                ps.setString(2, stream.value());
            }
        }, rs -> rs.getLong(1)).orElse(0L);
    }

    // -- Config --------------------------------------------------------------

    @Override
    public Optional<String> getConfig(String key) {
        return queryOne("SELECT value FROM config WHERE key = ?",
                ps -> ps.setString(1, key), rs -> rs.getString("value"));
    }

    @Override
    public void setConfig(String key, String value) {
        update("""
                INSERT INTO config (key, value, updated_at) VALUES (?, ?, ?)
                ON CONFLICT (key) DO UPDATE SET value = excluded.value, updated_at = excluded.updated_at
                """, ps -> {
            ps.setString(1, key);
            ps.setString(2, value);
            ps.setString(3, format(now()));
        });
    }

    @Override
    public Map<String, String> listConfig() {
        Map<String, String> result = new LinkedHashMap<>();
        for (String[] row : query("SELECT key, value FROM config ORDER BY key", ps -> {},
                rs -> new String[]{rs.getString("key"), rs.getString("value")})) {
            result.put(row[0], row[1]);
        }
        return result;
    }

    // -- JDBC plumbing -------------------------------------------------------

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    @FunctionalInterface
    private interface RowMapper<T> {
        T map(ResultSet rs) throws SQLException;
    }

    private int update(String sql, Binder binder) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Store update failed: " + e.getMessage(), e);
        }
    }

    private <T> List<T> query(String sql, Binder binder, RowMapper<T> mapper) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {
            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                List<T> rows = new ArrayList<>();
                while (rs.next()) {
                    rows.add(mapper.map(rs));
                }
                return rows;
            }
        } catch (SQLException e) {
            throw new StoreException("Store query failed: " + e.getMessage(), e);
        }
    }

    private <T> Optional<T> queryOne(String sql, Binder binder, RowMapper<T> mapper) {
        List<T> rows = query(sql, binder, mapper);
        return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MILLIS);
    }

    private static String format(Instant instant) {
        return TIMESTAMP.format(instant);
    }

    private static Repo mapRepo(ResultSet rs) throws SQLException {
        return new Repo(
                rs.getString("id"),
                rs.getString("path"),
                rs.getString("name"),
                Instant.parse(rs.getString("created_at")),
                Instant.parse(rs.getString("updated_at")));
    }

    private static Session mapSession(ResultSet rs) throws SQLException {
        return new Session(
                rs.getString("id"),
                rs.getString("repo_id"),
                rs.getString("name"),
                rs.getString("orchestrator"),
                SessionStatus.fromValue(rs.getString("status")),
                Instant.parse(rs.getString("created_at")),
                Instant.parse(rs.getString("updated_at")));
    }
}
