package com.ralphtown.core.persistence;

import com.ralphtown.core.config.RalphtownProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import javax.sql.DataSource;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Spring {@link Configuration} for the embedded SQLite store.
 * <p>
 * The database file lives at {@code ralphtown.store.path}; its parent directory is
 * created on startup. Every connection enforces foreign keys (session deletes cascade
 * to messages and output records) and waits on a busy database instead of failing,
 * since output readers write concurrently.
 */
@Configuration
public class StoreConfig {

    private static final Logger log = LoggerFactory.getLogger(StoreConfig.class);

    private static final int BUSY_TIMEOUT_MS = 5_000;

    @Bean
    public DataSource dataSource(RalphtownProperties properties) throws IOException {
        Path dbPath = properties.getStorePath().toAbsolutePath();
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }
        log.info("Using SQLite store at {}", dbPath);
        return sqliteDataSource(dbPath);
    }

    @Bean
    public SessionStore sessionStore(DataSource dataSource) {
        var store = new JdbcSessionStore(dataSource);
        store.createTables();
        return store;
    }

    static DataSource sqliteDataSource(Path dbPath) {
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        SQLiteDataSource dataSource = new SQLiteDataSource(config);
        dataSource.setUrl("jdbc:sqlite:" + dbPath);
        return dataSource;
    }
}
