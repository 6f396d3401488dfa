package com.kmg.sync.repo;

import com.kmg.sync.model.Warehouse;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public class WarehouseRepository {
    private final JdbcTemplate jdbcTemplate;

    public WarehouseRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    private static final RowMapper<Warehouse> MAPPER = (rs, rowNum) -> new Warehouse(
            rs.getLong("id"),
            rs.getString("name"),
            rs.getString("description")
    );

    public List<Warehouse> findAll() {
        return jdbcTemplate.query("SELECT * FROM warehouses ORDER BY id", MAPPER);
    }

    public Optional<Warehouse> findById(long id) {
        return jdbcTemplate.query("SELECT * FROM warehouses WHERE id = ?", MAPPER, id).stream().findFirst();
    }

    public Optional<Warehouse> findByName(String name) {
        return jdbcTemplate.query("SELECT * FROM warehouses WHERE name = ?", MAPPER, name).stream().findFirst();
    }

    public Warehouse insert(String name, String description) {
        Long id = jdbcTemplate.queryForObject(
                "INSERT INTO warehouses(name, description) VALUES (?, ?) RETURNING id",
                Long.class,
                name,
                description
        );
        return new Warehouse(id, name, description);
    }

    public void update(Warehouse warehouse) {
        jdbcTemplate.update(
                "UPDATE warehouses SET name = ?, description = ? WHERE id = ?",
                warehouse.name(),
                warehouse.description(),
                warehouse.id()
        );
    }

    public boolean delete(long id) {
        return jdbcTemplate.update("DELETE FROM warehouses WHERE id = ?", id) > 0;
    }
}
