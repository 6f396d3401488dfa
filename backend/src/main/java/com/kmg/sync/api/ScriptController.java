package com.kmg.sync.api;

import com.kmg.sync.dto.ScriptUpdateRequest;
import com.kmg.sync.dto.UnitView;
import com.kmg.sync.model.ScriptRecord;
import com.kmg.sync.service.CatalogService;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/scripts")
public class ScriptController {
    private final CatalogService catalogService;

    public ScriptController(CatalogService catalogService) {
        this.catalogService = catalogService;
    }

    @GetMapping("/units")
    public List<UnitView> units() {
        return catalogService.availableUnits().stream()
                .map(definition -> new UnitView(
                        definition.locator().toString(),
                        definition.description(),
                        definition.requiredStores().stream().sorted().toList()))
                .toList();
    }

    @GetMapping("/{id}")
    public ScriptRecord get(@PathVariable long id) {
        return catalogService.getScript(id);
    }

    @PutMapping("/{id}")
    public ScriptRecord update(@PathVariable long id, @Valid @RequestBody ScriptUpdateRequest request) {
        return catalogService.updateScript(id, request);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@PathVariable long id) {
        catalogService.deleteScript(id);
        return ResponseEntity.noContent().build();
    }
}
