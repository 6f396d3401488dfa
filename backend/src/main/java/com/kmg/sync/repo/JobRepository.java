package com.kmg.sync.repo;

import com.kmg.sync.model.JobDefinition;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public class JobRepository {
    private static final String SELECT_JOBS = """
            SELECT j.*, s.locator AS unit_locator
              FROM jobs j
              JOIN scripts s ON s.id = j.script_id
            """;

    private final JdbcTemplate jdbcTemplate;

    public JobRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<JobDefinition> MAPPER = new RowMapper<>() {
        @Override
        public JobDefinition mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new JobDefinition(
                    rs.getLong("id"),
                    rs.getString("trigger_id"),
                    rs.getLong("script_id"),
                    rs.getString("unit_locator"),
                    rs.getString("cron_expression"),
                    rs.getInt("enabled") != 0,
                    SqlTime.parse(rs.getString("created_at"))
            );
        }
    };

    public JobDefinition insert(String triggerId, long scriptId, String cronExpression, boolean enabled) {
        OffsetDateTime now = SqlTime.now();
        Long id = jdbcTemplate.queryForObject(
                """
                INSERT INTO jobs(trigger_id, script_id, cron_expression, enabled, created_at)
                VALUES (?, ?, ?, ?, ?)
                RETURNING id
                """,
                Long.class,
                triggerId,
                scriptId,
                cronExpression,
                enabled ? 1 : 0,
                SqlTime.toText(now)
        );
        return findById(id).orElseThrow(() -> new IllegalStateException("Inserted job vanished: " + id));
    }

    public Optional<JobDefinition> findById(long id) {
        return jdbcTemplate.query(SELECT_JOBS + " WHERE j.id = ?", MAPPER, id).stream().findFirst();
    }

    public Optional<JobDefinition> findByTriggerId(String triggerId) {
        return jdbcTemplate.query(SELECT_JOBS + " WHERE j.trigger_id = ?", MAPPER, triggerId).stream().findFirst();
    }

    public List<JobDefinition> findAll() {
        return jdbcTemplate.query(SELECT_JOBS + " ORDER BY j.id", MAPPER);
    }

    public List<JobDefinition> findEnabled() {
        return jdbcTemplate.query(SELECT_JOBS + " WHERE j.enabled = 1 ORDER BY j.id", MAPPER);
    }

    public void updateEnabled(long id, boolean enabled) {
        jdbcTemplate.update("UPDATE jobs SET enabled = ? WHERE id = ?", enabled ? 1 : 0, id);
    }

    public void updateCronExpression(long id, String cronExpression) {
        jdbcTemplate.update("UPDATE jobs SET cron_expression = ? WHERE id = ?", cronExpression, id);
    }

    public int deleteByTriggerPrefix(String prefix) {
        String pattern = prefix.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_") + "%";
        return jdbcTemplate.update("DELETE FROM jobs WHERE trigger_id LIKE ? ESCAPE '\\'", pattern);
    }

    public boolean delete(long id) {
        return jdbcTemplate.update("DELETE FROM jobs WHERE id = ?", id) > 0;
    }
}
