package com.kmg.sync.repo;

import com.kmg.sync.model.ExecutionRecord;
import com.kmg.sync.model.ExecutionStatus;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Repository
public class ExecutionRepository {
    private final JdbcTemplate jdbcTemplate;

    public ExecutionRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<ExecutionRecord> MAPPER = (rs, rowNum) -> new ExecutionRecord(
            rs.getLong("id"),
            rs.getLong("job_id"),
            SqlTime.parse(rs.getString("start_time")),
            SqlTime.parse(rs.getString("end_time")),
            ExecutionStatus.valueOf(rs.getString("status")),
            rs.getString("error_message")
    );

    public ExecutionRecord insertRunning(long jobId, OffsetDateTime startTime) {
        Long id = jdbcTemplate.queryForObject(
                "INSERT INTO job_executions(job_id, start_time, status) VALUES (?, ?, ?) RETURNING id",
                Long.class,
                jobId,
                SqlTime.toText(startTime),
                ExecutionStatus.RUNNING.name()
        );
        return new ExecutionRecord(id, jobId, startTime, null, ExecutionStatus.RUNNING, null);
    }

    /**
     * Writes the terminal state of a run. Only a record still {@code RUNNING} is touched, so a second terminal update
     * is a no-op and returns {@code false}.
     */
    public boolean finish(long id, ExecutionStatus status, OffsetDateTime endTime, String errorMessage) {
        if (!status.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal status: " + status);
        }
        int updated = jdbcTemplate.update(
                """
                UPDATE job_executions
                   SET status = ?,
                       end_time = ?,
                       error_message = ?
                 WHERE id = ?
                   AND status = 'RUNNING'
                """,
                status.name(),
                SqlTime.toText(endTime),
                errorMessage,
                id
        );
        return updated > 0;
    }

    public Optional<ExecutionRecord> findById(long id) {
        return jdbcTemplate.query("SELECT * FROM job_executions WHERE id = ?", MAPPER, id).stream().findFirst();
    }

    public List<ExecutionRecord> findByJobId(long jobId) {
        return jdbcTemplate.query(
                "SELECT * FROM job_executions WHERE job_id = ? ORDER BY start_time DESC, id DESC",
                MAPPER,
                jobId
        );
    }

    public int recoverRunningAfterRestart() {
        return jdbcTemplate.update(
                """
                UPDATE job_executions
                   SET status = 'FAILED',
                       end_time = COALESCE(end_time, ?),
                       error_message = COALESCE(error_message, 'Application restarted while job was running')
                 WHERE status = 'RUNNING'
                """,
                SqlTime.nowText()
        );
    }
}
