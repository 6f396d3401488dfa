package com.kmg.sync.execution;

import com.kmg.sync.config.SyncProperties;
import com.kmg.sync.error.NotFoundException;
import com.kmg.sync.model.ExecutionRecord;
import com.kmg.sync.model.JobDefinition;
import com.kmg.sync.model.ScriptRecord;
import com.kmg.sync.repo.JobRepository;
import com.kmg.sync.repo.ScriptRepository;
import com.kmg.sync.unit.ProcessingUnitResolver;
import com.kmg.sync.unit.ResolvedUnit;
import com.kmg.sync.unit.UnitLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runs one job end to end: open an execution record, resolve the unit, run it, close the record on every exit
 * path.
 */
@Service
public class JobRunner {
    private static final Logger log = LoggerFactory.getLogger(JobRunner.class);
    static final String TRANSIENT_TRIGGER_PREFIX = "temp_";
    static final String TRANSIENT_CRON = "once";

    private final JobRepository jobRepository;
    private final ScriptRepository scriptRepository;
    private final ExecutionTracker executionTracker;
    private final ProcessingUnitResolver unitResolver;
    private final boolean allowOverlap;
    private final Set<Long> runningJobs = ConcurrentHashMap.newKeySet();

    public JobRunner(
            JobRepository jobRepository,
            ScriptRepository scriptRepository,
            ExecutionTracker executionTracker,
            ProcessingUnitResolver unitResolver,
            SyncProperties properties
    ) {
        this.jobRepository = jobRepository;
        this.scriptRepository = scriptRepository;
        this.executionTracker = executionTracker;
        this.unitResolver = unitResolver;
        this.allowOverlap = properties.getScheduler().isAllowOverlap();
    }

    /**
     * Entry point of a trigger firing, called on a worker thread. Failures are already on the execution record, so
     * they end here.
     */
    public void runScheduled(long jobId) {
        if (allowOverlap) {
            executeLogged(jobId);
            return;
        }
        if (!runningJobs.add(jobId)) {
            log.warn("Skipping fire of job {}: previous run still in progress", jobId);
            return;
        }
        try {
            executeLogged(jobId);
        } finally {
            runningJobs.remove(jobId);
        }
    }

    public ExecutionRecord execute(long jobId) {
        log.info("Starting script execution for job ID: {}", jobId);
        JobDefinition job = jobRepository.findById(jobId)
                .orElseThrow(() -> new NotFoundException("Job " + jobId + " not found"));

        TrackedRun run = executionTracker.beginRun(job.id());
        try (run) {
            try {
                UnitLocator locator = UnitLocator.parse(job.unitLocator());
                try (ResolvedUnit unit = unitResolver.resolve(locator)) {
                    unit.run();
                }
                run.completed();
                log.info("Script execution completed successfully for job {} ({})", jobId, locator);
            } catch (RuntimeException | Error e) {
                log.error("Script execution failed for job {}: {}", jobId, e.getMessage(), e);
                run.failed(e);
                throw e;
            }
        }
        return run.record();
    }

    /**
     * Runs a script once, outside its schedule. A transient job row carries the run and is deleted afterwards,
     * together with its execution record, whatever the outcome.
     */
    public ExecutionRecord runNow(long scriptId) {
        ScriptRecord script = scriptRepository.findById(scriptId)
                .orElseThrow(() -> new NotFoundException("Script " + scriptId + " not found"));

        String triggerId = TRANSIENT_TRIGGER_PREFIX + script.id() + "_" + System.currentTimeMillis();
        JobDefinition transientJob = jobRepository.insert(triggerId, script.id(), TRANSIENT_CRON, false);
        try {
            return execute(transientJob.id());
        } finally {
            jobRepository.delete(transientJob.id());
            log.info("Removed transient job {} for script {}", triggerId, script.id());
        }
    }

    public boolean isRunning(long jobId) {
        return runningJobs.contains(jobId);
    }

    public int removeTransientJobs() {
        return jobRepository.deleteByTriggerPrefix(TRANSIENT_TRIGGER_PREFIX);
    }

    private void executeLogged(long jobId) {
        try {
            execute(jobId);
        } catch (RuntimeException e) {
            log.error("Scheduled run of job {} failed: {}", jobId, e.getMessage());
        }
    }
}
