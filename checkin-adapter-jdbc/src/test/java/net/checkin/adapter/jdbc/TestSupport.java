package net.checkin.adapter.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.flywaydb.core.Flyway;
import org.junit.jupiter.api.AfterAll;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.TestInstance;

import javax.sql.DataSource;
import java.nio.file.Files;
import java.nio.file.Path;

/** Fresh SQLite file per test class, migrated with Flyway. Tables are emptied before each test. */
@TestInstance(TestInstance.Lifecycle.PER_CLASS)
public abstract class TestSupport {
    protected DataSource ds;
    private Path dbFile;

    @BeforeAll
    void setupDb() throws Exception {
        dbFile = Files.createTempFile("checkin-test-", ".db");

        HikariConfig cfg = new HikariConfig();
        cfg.setJdbcUrl("jdbc:sqlite:" + dbFile.toAbsolutePath() + "?journal_mode=WAL&busy_timeout=5000");
        cfg.setMaximumPoolSize(4);
        cfg.setMinimumIdle(1);
        cfg.setConnectionTimeout(30_000);
        cfg.setDriverClassName("org.sqlite.JDBC");
        ds = new HikariDataSource(cfg);

        Flyway.configure()
                .dataSource(ds)
                .locations("classpath:db/migration/sqlite")
                .load()
                .migrate();
    }

    @BeforeEach
    void truncateAll() throws Exception {
        new JdbcTxRunner(ds).required(() -> {
            try (var st = TxContext.get().createStatement()) {
                for (String t : new String[]{"TB_CHECKIN_HISTORY", "TB_ACCOUNT", "TB_NOTIFICATION_SETTINGS"}) {
                    st.execute("DELETE FROM " + t);
                }
            }
            return null;
        });
    }

    @AfterAll
    void cleanup() throws Exception {
        if (ds instanceof HikariDataSource h) h.close();
        Files.deleteIfExists(dbFile);
        Files.deleteIfExists(Path.of(dbFile + "-wal"));
        Files.deleteIfExists(Path.of(dbFile + "-shm"));
    }
}
