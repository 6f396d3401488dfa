package com.kmg.sync.schedule;

import com.kmg.sync.error.NotFoundException;
import com.kmg.sync.error.ValidationException;
import com.kmg.sync.execution.JobRunner;
import com.kmg.sync.model.JobDefinition;
import com.kmg.sync.model.ScriptRecord;
import com.kmg.sync.repo.JobRepository;
import com.kmg.sync.repo.ScriptRepository;
import com.kmg.sync.unit.ProcessingUnitResolver;
import com.kmg.sync.unit.UnitLocator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionSynchronization;
import org.springframework.transaction.support.TransactionSynchronizationManager;

import java.util.List;

/**
 * Keeps the job table and the live trigger registry in step.
 *
 * <p>The job table is the source of truth. A trigger missing from the registry (the registry does not survive a
 * restart) is harmless when the goal is to stop firing, and is recreated from the stored cron expression when the
 * goal is to fire. Trigger changes are applied only once the job table change has committed.</p>
 */
@Service
public class JobScheduler {
    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);
    static final String TRIGGER_PREFIX = "script_";

    private final JobRepository jobRepository;
    private final ScriptRepository scriptRepository;
    private final ProcessingUnitResolver unitResolver;
    private final CronTriggerRegistry registry;
    private final JobRunner jobRunner;
    private final TaskExecutor workerExecutor;

    public JobScheduler(
            JobRepository jobRepository,
            ScriptRepository scriptRepository,
            ProcessingUnitResolver unitResolver,
            CronTriggerRegistry registry,
            JobRunner jobRunner,
            @Qualifier("syncWorkerExecutor") TaskExecutor workerExecutor
    ) {
        this.jobRepository = jobRepository;
        this.scriptRepository = scriptRepository;
        this.unitResolver = unitResolver;
        this.registry = registry;
        this.jobRunner = jobRunner;
        this.workerExecutor = workerExecutor;
    }

    @Transactional
    public JobDefinition addJob(long scriptId, String cronExpression) {
        ScriptRecord script = scriptRepository.findById(scriptId)
                .orElseThrow(() -> new NotFoundException("Script not found"));

        UnitLocator locator = UnitLocator.parse(script.locator());
        if (!unitResolver.exists(locator)) {
            throw new ValidationException("Processing unit not found: " + locator);
        }
        CronExpressions.parse(cronExpression);
        String normalized = CronExpressions.normalize(cronExpression);

        String triggerId = TRIGGER_PREFIX + script.id();
        if (jobRepository.findByTriggerId(triggerId).isPresent()) {
            throw new ValidationException("Script " + script.id() + " is already scheduled");
        }

        JobDefinition job = jobRepository.insert(triggerId, script.id(), normalized, true);
        afterCommit(() -> arm(job));
        log.info("Successfully added job {} for script: {}", job.id(), script.locator());
        return job;
    }

    @Transactional
    public void removeJob(long jobId) {
        JobDefinition job = findJob(jobId);

        jobRepository.delete(job.id());
        afterCommit(() -> {
            if (registry.remove(job.triggerId()) == TriggerResult.ABSENT_HARMLESS) {
                log.warn("Trigger {} not found in registry - might have been lost after restart", job.triggerId());
            }
        });
        log.info("Successfully removed job ID: {}", jobId);
    }

    @Transactional
    public boolean toggleJob(long jobId) {
        JobDefinition job = findJob(jobId);
        boolean enabled = !job.enabled();

        jobRepository.updateEnabled(job.id(), enabled);
        afterCommit(() -> {
            if (enabled) {
                if (registry.resume(job.triggerId()) == TriggerResult.ABSENT_MUST_RECREATE) {
                    log.info("Trigger {} missing on resume, recreating from stored cron '{}'",
                            job.triggerId(), job.cronExpression());
                    arm(job);
                }
            } else if (registry.pause(job.triggerId()) == TriggerResult.ABSENT_HARMLESS) {
                log.info("Trigger {} not in registry, nothing to pause", job.triggerId());
            }
        });
        log.info("Job {} {}", jobId, enabled ? "resumed" : "paused");
        return enabled;
    }

    /**
     * Reschedules a job. A blank or missing expression leaves the job untouched. The trigger of a disabled job is
     * not recreated here; enabling the job builds it from the stored expression.
     */
    @Transactional
    public JobDefinition updateJob(long jobId, String cronExpression) {
        JobDefinition job = findJob(jobId);
        if (cronExpression == null || cronExpression.isBlank()) {
            return job;
        }

        CronExpressions.parse(cronExpression);
        JobDefinition updated = job.withCronExpression(CronExpressions.normalize(cronExpression));

        jobRepository.updateCronExpression(job.id(), updated.cronExpression());
        afterCommit(() -> {
            if (registry.reschedule(job.triggerId(), updated.cronExpression()) == TriggerResult.ABSENT_MUST_RECREATE
                    && updated.enabled()) {
                log.info("Trigger {} missing on reschedule, recreating", job.triggerId());
                arm(updated);
            }
        });
        log.info("Job {} rescheduled to '{}'", jobId, updated.cronExpression());
        return updated;
    }

    /**
     * Re-arms the trigger of every enabled job that the registry does not hold. Returns the number of triggers
     * created.
     */
    public int restoreTriggers() {
        int restored = 0;
        for (JobDefinition job : jobRepository.findEnabled()) {
            if (registry.contains(job.triggerId())) {
                continue;
            }
            try {
                arm(job);
                restored++;
            } catch (ValidationException e) {
                log.warn("Not restoring job {}: {}", job.id(), e.getMessage());
            }
        }
        log.info("Restored {} triggers from the job table", restored);
        return restored;
    }

    public List<JobDefinition> listJobs() {
        return jobRepository.findAll();
    }

    public JobDefinition getJob(long jobId) {
        return findJob(jobId);
    }

    private JobDefinition findJob(long jobId) {
        return jobRepository.findById(jobId)
                .orElseThrow(() -> new NotFoundException("Job " + jobId + " not found"));
    }

    /**
     * Runs a registry change after the surrounding transaction commits, or at once when there is none.
     */
    private static void afterCommit(Runnable change) {
        if (!TransactionSynchronizationManager.isSynchronizationActive()) {
            change.run();
            return;
        }
        TransactionSynchronizationManager.registerSynchronization(new TransactionSynchronization() {
            @Override
            public void afterCommit() {
                change.run();
            }
        });
    }

    private void arm(JobDefinition job) {
        long jobId = job.id();
        registry.register(job.triggerId(), job.cronExpression(), () -> fire(jobId));
    }

    private void fire(long jobId) {
        log.info("Trigger fired for job {}", jobId);
        workerExecutor.execute(() -> jobRunner.runScheduled(jobId));
    }
}
