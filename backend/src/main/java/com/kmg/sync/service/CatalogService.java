package com.kmg.sync.service;

import com.kmg.sync.dto.ScriptRequest;
import com.kmg.sync.dto.ScriptUpdateRequest;
import com.kmg.sync.dto.WarehouseRequest;
import com.kmg.sync.dto.WarehouseUpdateRequest;
import com.kmg.sync.error.NotFoundException;
import com.kmg.sync.error.ValidationException;
import com.kmg.sync.model.ScriptRecord;
import com.kmg.sync.model.Warehouse;
import com.kmg.sync.repo.ScriptRepository;
import com.kmg.sync.repo.WarehouseRepository;
import com.kmg.sync.unit.ProcessingUnitDefinition;
import com.kmg.sync.unit.ProcessingUnitResolver;
import com.kmg.sync.unit.UnitLocator;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Warehouses and the scripts that point at their processing units.
 */
@Service
public class CatalogService {
    private final WarehouseRepository warehouseRepository;
    private final ScriptRepository scriptRepository;
    private final ProcessingUnitResolver unitResolver;

    public CatalogService(
            WarehouseRepository warehouseRepository,
            ScriptRepository scriptRepository,
            ProcessingUnitResolver unitResolver
    ) {
        this.warehouseRepository = warehouseRepository;
        this.scriptRepository = scriptRepository;
        this.unitResolver = unitResolver;
    }

    public List<Warehouse> listWarehouses() {
        return warehouseRepository.findAll();
    }

    public Warehouse getWarehouse(long id) {
        return warehouseRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Warehouse " + id + " not found"));
    }

    @Transactional
    public Warehouse createWarehouse(WarehouseRequest request) {
        if (warehouseRepository.findByName(request.name()).isPresent()) {
            throw new ValidationException("Warehouse name already exists");
        }
        return warehouseRepository.insert(request.name(), orEmpty(request.description()));
    }

    @Transactional
    public Warehouse updateWarehouse(long id, WarehouseUpdateRequest request) {
        Warehouse current = getWarehouse(id);
        String name = current.name();
        if (request.name() != null && !request.name().equals(current.name())) {
            if (warehouseRepository.findByName(request.name()).isPresent()) {
                throw new ValidationException("Warehouse name already exists");
            }
            name = request.name();
        }
        String description = request.description() != null ? request.description() : current.description();
        Warehouse updated = new Warehouse(id, name, description);
        warehouseRepository.update(updated);
        return updated;
    }

    @Transactional
    public void deleteWarehouse(long id) {
        getWarehouse(id);
        if (scriptRepository.countByWarehouseId(id) > 0) {
            throw new ValidationException("Cannot delete warehouse that has scripts. Delete scripts first.");
        }
        warehouseRepository.delete(id);
    }

    public List<ScriptRecord> listScripts(long warehouseId) {
        getWarehouse(warehouseId);
        return scriptRepository.findByWarehouseId(warehouseId);
    }

    public ScriptRecord getScript(long id) {
        return scriptRepository.findById(id)
                .orElseThrow(() -> new NotFoundException("Script " + id + " not found"));
    }

    @Transactional
    public ScriptRecord createScript(long warehouseId, ScriptRequest request) {
        getWarehouse(warehouseId);
        UnitLocator locator = requireRegistered(request.locator());
        return scriptRepository.insert(request.name(), locator.toString(), warehouseId, orEmpty(request.description()));
    }

    @Transactional
    public ScriptRecord updateScript(long id, ScriptUpdateRequest request) {
        ScriptRecord current = getScript(id);
        String name = request.name() != null ? request.name() : current.name();
        String locator = request.locator() != null ? requireRegistered(request.locator()).toString() : current.locator();
        String description = request.description() != null ? request.description() : current.description();
        ScriptRecord updated = new ScriptRecord(id, name, locator, current.warehouseId(), description);
        scriptRepository.update(updated);
        return updated;
    }

    @Transactional
    public void deleteScript(long id) {
        getScript(id);
        if (scriptRepository.countJobs(id) > 0) {
            throw new ValidationException("Cannot delete script that has associated jobs. Delete jobs first.");
        }
        scriptRepository.delete(id);
    }

    public List<ProcessingUnitDefinition> availableUnits() {
        return unitResolver.definitions();
    }

    private UnitLocator requireRegistered(String value) {
        UnitLocator locator = UnitLocator.parse(value);
        if (!unitResolver.exists(locator)) {
            throw new ValidationException("Processing unit does not exist: " + locator);
        }
        return locator;
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
