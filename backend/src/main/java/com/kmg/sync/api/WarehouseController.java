package com.kmg.sync.api;

import com.kmg.sync.dto.ScriptRequest;
import com.kmg.sync.dto.WarehouseRequest;
import com.kmg.sync.dto.WarehouseUpdateRequest;
import com.kmg.sync.model.ScriptRecord;
import com.kmg.sync.model.Warehouse;
import com.kmg.sync.service.CatalogService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/warehouses")
public class WarehouseController {
    private final CatalogService catalogService;

    public WarehouseController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @GetMapping
    public List<Warehouse> list() {
        return catalogService.listWarehouses();
    }

    @GetMapping("/{id}")
    public Warehouse get(@PathVariable long id) {
        return catalogService.getWarehouse(id);
    }

    @PostMapping
    public ResponseEntity<Warehouse> create(@Valid @RequestBody WarehouseRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.createWarehouse(request));
    }

    @PutMapping("/{id}")
    public Warehouse update(@PathVariable long id, @Valid @RequestBody WarehouseUpdateRequest request) {
        return catalogService.updateWarehouse(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable long id) {
        catalogService.deleteWarehouse(id);
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{warehouseId}/scripts")
    public List<ScriptRecord> scripts(@PathVariable long warehouseId) {
        return catalogService.listScripts(warehouseId);
    }

    @PostMapping("/{warehouseId}/scripts")
    public ResponseEntity<ScriptRecord> createScript(
            @PathVariable long warehouseId,
            @Valid @RequestBody ScriptRequest request
    ) {
        return ResponseEntity.status(HttpStatus.CREATED).body(catalogService.createScript(warehouseId, request));
    }
}
