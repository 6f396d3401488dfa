package com.kmg.sync.execution;

import com.kmg.sync.config.SyncProperties;
import com.kmg.sync.model.ExecutionRecord;
import com.kmg.sync.model.ExecutionStatus;
import com.kmg.sync.repo.ExecutionRepository;
import com.kmg.sync.repo.SqlTime;
import com.kmg.sync.service.EventService;
import com.kmg.sync.service.RunEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.List;
import java.util.Optional;

@Service
public class ExecutionTracker {
    private static final Logger log = LoggerFactory.getLogger(ExecutionTracker.class);

    private final ExecutionRepository executionRepository;
    private final EventService eventService;
    private final int maxErrorLength;

    public ExecutionTracker(
            ExecutionRepository executionRepository,
            EventService eventService,
            SyncProperties properties
    ) {
        this.executionRepository = executionRepository;
        this.eventService = eventService;
        this.maxErrorLength = properties.getExecution().getMaxErrorLength();
    }

    public TrackedRun beginRun(long jobId) {
        ExecutionRecord record = executionRepository.insertRunning(jobId, SqlTime.now());
        log.info("Created execution record {} for job {}", record.id(), jobId);
        eventService.publish(RunEvent.STARTED, jobId, record.id(), "Run started");
        return new TrackedRun(this, record);
    }

    /**
     * Writes the terminal state of a run. A failing write is logged and the in-memory outcome is returned, so the
     * caller still sees how the run itself ended.
     */
    public ExecutionRecord endRun(ExecutionRecord record, ExecutionStatus status, String errorMessage) {
        OffsetDateTime endTime = SqlTime.now();
        String bounded = bound(errorMessage);
        ExecutionRecord ended = new ExecutionRecord(record.id(), record.jobId(), record.startTime(), endTime, status, bounded);
        try {
            if (!executionRepository.finish(record.id(), status, endTime, bounded)) {
                Optional<ExecutionRecord> stored = executionRepository.findById(record.id());
                if (stored.isEmpty()) {
                    log.warn("Execution record {} no longer exists, job {} was removed while running",
                            record.id(), record.jobId());
                    return ended;
                }
                log.warn("Execution record {} was already closed", record.id());
                return stored.get();
            }
            log.info("Execution record {} updated. Status: {}", record.id(), status);
        } catch (RuntimeException e) {
            log.error("Failed to update execution record {}: {}", record.id(), e.getMessage(), e);
            return ended;
        }

        if (status == ExecutionStatus.COMPLETED) {
            eventService.publish(RunEvent.COMPLETED, record.jobId(), record.id(), "Run completed");
        } else {
            eventService.publish(RunEvent.FAILED, record.jobId(), record.id(), bounded);
        }
        return ended;
    }

    public List<ExecutionRecord> history(long jobId) {
        return executionRepository.findByJobId(jobId);
    }

    String bound(String errorMessage) {
        if (errorMessage == null || errorMessage.length() <= maxErrorLength) {
            return errorMessage;
        }
        return errorMessage.substring(0, maxErrorLength - 3) + "...";
    }
}
