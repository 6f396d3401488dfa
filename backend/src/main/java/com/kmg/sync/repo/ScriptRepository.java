package com.kmg.sync.repo;

import com.kmg.sync.model.ScriptRecord;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class ScriptRepository {
    private final JdbcTemplate jdbcTemplate;

    public ScriptRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<ScriptRecord> MAPPER = (rs, rowNum) -> new ScriptRecord(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("locator"),
            rs.getLong("warehouse_id"),
            rs.getString("description")
    );

    public List<ScriptRecord> findByWarehouseId(long warehouseId) {
        return jdbcTemplate.query("SELECT * FROM scripts WHERE warehouse_id = ? ORDER BY id", MAPPER, warehouseId);
    }

    public Optional<ScriptRecord> findById(long id) {
        return jdbcTemplate.query("SELECT * FROM scripts WHERE id = ?", MAPPER, id).stream().findFirst();
    }

    public ScriptRecord insert(String name, String locator, long warehouseId, String description) {
        Long id = jdbcTemplate.queryForObject(
                "INSERT INTO scripts(name, locator, warehouse_id, description) VALUES (?, ?, ?, ?) RETURNING id",
                Long.class,
                name,
                locator,
                warehouseId,
                description
        );
        return new ScriptRecord(id, name, locator, warehouseId, description);
    }

    public void update(ScriptRecord script) {
        jdbcTemplate.update(
                "UPDATE scripts SET name = ?, locator = ?, description = ? WHERE id = ?",
                script.name(),
                script.locator(),
                script.description(),
                script.id()
        );
    }

    public boolean delete(long id) {
        return jdbcTemplate.update("DELETE FROM scripts WHERE id = ?", id) > 0;
    }

    public int countByWarehouseId(long warehouseId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM scripts WHERE warehouse_id = ?", Integer.class, warehouseId);
        return count == null ? 0 : count;
    }

    public int countJobs(long scriptId) {
        Integer count = jdbcTemplate.queryForObject(
                "SELECT COUNT(*) FROM jobs WHERE script_id = ?", Integer.class, scriptId);
        return count == null ? 0 : count;
    }
}
