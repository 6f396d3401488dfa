package com.kmg.sync.api;

import com.kmg.sync.SyncFixture;
import com.kmg.sync.execution.ExecutionTracker;
import com.kmg.sync.repo.ScriptRepository;
import com.kmg.sync.repo.WarehouseRepository;
import com.kmg.sync.service.CatalogService;
import com.kmg.sync.unit.RecordingUnits;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

class CatalogApiTest {
    @TempDir
    Path tempDir;

    private SyncFixture fixture;
    private MockMvc mvc;
    private final AtomicInteger runs = new AtomicInteger();

    @BeforeEach
    void setUp() {
        fixture = new SyncFixture(tempDir, List.of(RecordingUnits.counting("byggmakker/store_data", runs)));
        CatalogService catalog = new CatalogService(
                new WarehouseRepository(fixture.jdbc), new ScriptRepository(fixture.jdbc), fixture.resolver);
        ExecutionTracker tracker = fixture.tracker;
        mvc = MockMvcBuilders.standaloneSetup(
                        new WarehouseController(catalog),
                        new ScriptController(catalog),
                        new JobController(fixture.scheduler, fixture.registry),
                        new ExecutionController(tracker, fixture.runner))
                .setControllerAdvice(new ApiExceptionHandler())
                .build();
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private void createWarehouse(String name) throws Exception {
        mvc.perform(post("/api/warehouses").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"" + name + "\",\"description\":\"Building supplies\"}"))
                .andExpect(status().isCreated());
    }

    @Test
    void warehouseLifecycle() throws Exception {
        createWarehouse("Byggmakker");

        mvc.perform(get("/api/warehouses"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].name").value("Byggmakker"));

        mvc.perform(post("/api/warehouses").contentType(MediaType.APPLICATION_JSON).content("{\"name\":\"Byggmakker\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("Warehouse name already exists"));
    }

    @Test
    void blankName_badRequest() throws Exception {
        mvc.perform(post("/api/warehouses").contentType(MediaType.APPLICATION_JSON).content("{\"name\":\"\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").exists());
    }

    @Test
    void unknownWarehouse_notFound() throws Exception {
        mvc.perform(get("/api/warehouses/42"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("Warehouse 42 not found"));
    }

    @Test
    void scriptNeedsRegisteredUnit() throws Exception {
        createWarehouse("Byggmakker");
        long warehouseId = fixture.warehouses.findByName("Byggmakker").orElseThrow().id();

        mvc.perform(post("/api/warehouses/" + warehouseId + "/scripts").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Stores\",\"locator\":\"byggmakker/unknown\"}"))
                .andExpect(status().isBadRequest());

        mvc.perform(post("/api/warehouses/" + warehouseId + "/scripts").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"name\":\"Stores\",\"locator\":\"byggmakker/store_data\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.locator").value("byggmakker/store_data"));
    }

    @Test
    void jobLifecycleOverHttp() throws Exception {
        long scriptId = fixture.script("byggmakker/store_data").id();

        mvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scriptId\":" + scriptId + ",\"cronExpression\":\"0 2 * * *\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.triggerId").value("script_" + scriptId))
                .andExpect(jsonPath("$.triggerRegistered").value(true));

        long jobId = fixture.jobs.findAll().get(0).id();

        mvc.perform(post("/api/jobs/" + jobId + "/toggle"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Job paused successfully"))
                .andExpect(jsonPath("$.enabled").value(false));

        mvc.perform(put("/api/jobs/" + jobId).contentType(MediaType.APPLICATION_JSON)
                        .content("{\"cronExpression\":\"bad\"}"))
                .andExpect(status().isBadRequest());

        mvc.perform(delete("/api/scripts/" + scriptId))
                .andExpect(status().isBadRequest());

        mvc.perform(delete("/api/jobs/" + jobId))
                .andExpect(status().isNoContent());
        mvc.perform(delete("/api/jobs/" + jobId))
                .andExpect(status().isNotFound());
    }

    @Test
    void invalidCron_badRequestWithFormatHint() throws Exception {
        long scriptId = fixture.script("byggmakker/store_data").id();

        mvc.perform(post("/api/jobs").contentType(MediaType.APPLICATION_JSON)
                        .content("{\"scriptId\":" + scriptId + ",\"cronExpression\":\"* * *\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error")
                        .value("Invalid cron expression. Expected format: 'minute hour day month day_of_week'"));
    }

    @Test
    void runNowAndHistory() throws Exception {
        long scriptId = fixture.script("byggmakker/store_data").id();

        mvc.perform(post("/api/run_now/" + scriptId))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("completed"));

        mvc.perform(get("/api/executions/999"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.length()").value(0));
    }
}
