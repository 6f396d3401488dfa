package com.kmg.sync.repo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;

public final class SyncSchema {
    private static final Logger log = LoggerFactory.getLogger(SyncSchema.class);

    private SyncSchema() {
    }

    public static void create(JdbcTemplate jdbcTemplate) {
        configureSqlitePragmas(jdbcTemplate);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS warehouses (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              name TEXT UNIQUE NOT NULL,
              description TEXT
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS scripts (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              name TEXT NOT NULL,
              locator TEXT NOT NULL,
              warehouse_id INTEGER NOT NULL,
              description TEXT,
              FOREIGN KEY (warehouse_id) REFERENCES warehouses(id)
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS jobs (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              trigger_id TEXT UNIQUE NOT NULL,
              script_id INTEGER NOT NULL,
              cron_expression TEXT,
              enabled INTEGER NOT NULL DEFAULT 1,
              created_at TEXT NOT NULL,
              FOREIGN KEY (script_id) REFERENCES scripts(id)
            )
            """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS job_executions (
              id INTEGER PRIMARY KEY AUTOINCREMENT,
              job_id INTEGER NOT NULL,
              start_time TEXT NOT NULL,
              end_time TEXT,
              status TEXT NOT NULL,
              error_message TEXT,
              FOREIGN KEY (job_id) REFERENCES jobs(id) ON DELETE CASCADE
            )
            """);

        jdbcTemplate.execute("CREATE INDEX IF NOT EXISTS idx_job_executions_job ON job_executions(job_id, start_time)");
    }

    private static void configureSqlitePragmas(JdbcTemplate jdbcTemplate) {
        try {
            jdbcTemplate.queryForObject("PRAGMA journal_mode=WAL", String.class);
            jdbcTemplate.execute("PRAGMA synchronous=NORMAL");
            jdbcTemplate.execute("PRAGMA busy_timeout=30000");
        } catch (Exception e) {
            log.warn("Failed to configure SQLite pragmas: {}", e.getMessage());
        }
    }
}
