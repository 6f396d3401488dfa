package com.kmg.sync.config;

import com.kmg.sync.execution.JobRunner;
import com.kmg.sync.repo.ExecutionRepository;
import com.kmg.sync.repo.SyncSchema;
import com.kmg.sync.schedule.JobScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

@Component
public class StartupInitializer implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(StartupInitializer.class);

    private final SyncProperties properties;
    private final JdbcTemplate jdbcTemplate;
    private final ExecutionRepository executionRepository;
    private final JobRunner jobRunner;
    private final JobScheduler jobScheduler;

    public StartupInitializer(
            SyncProperties properties,
            JdbcTemplate jdbcTemplate,
            ExecutionRepository executionRepository,
            JobRunner jobRunner,
            JobScheduler jobScheduler
    ) {
        this.properties = properties;
        this.jdbcTemplate = jdbcTemplate;
        this.executionRepository = executionRepository;
        this.jobRunner = jobRunner;
        this.jobScheduler = jobScheduler;
    }

    @Override
    public void run(ApplicationArguments args) throws Exception {
        createDirectories();
        SyncSchema.create(jdbcTemplate);

        int recovered = executionRepository.recoverRunningAfterRestart();
        if (recovered > 0) {
            log.warn("Marked {} interrupted executions as failed", recovered);
        }
        int leftovers = jobRunner.removeTransientJobs();
        if (leftovers > 0) {
            log.info("Removed {} transient jobs left by an earlier run", leftovers);
        }
        jobScheduler.restoreTriggers();
    }

    private void createDirectories() throws IOException {
        Files.createDirectories(properties.baseDirPath());
        Files.createDirectories(Path.of(properties.getLogs().getDir()));
        Path dbPath = Path.of(properties.getState().getDbPath());
        if (dbPath.getParent() != null) {
            Files.createDirectories(dbPath.getParent());
        }
    }
}
