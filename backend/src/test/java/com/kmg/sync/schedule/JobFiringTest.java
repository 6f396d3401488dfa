package com.kmg.sync.schedule;

import com.kmg.sync.SyncFixture;
import com.kmg.sync.model.ExecutionRecord;
import com.kmg.sync.model.ExecutionStatus;
import com.kmg.sync.model.JobDefinition;
import com.kmg.sync.model.ScriptRecord;
import com.kmg.sync.unit.RecordingUnits;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Lets a real trigger fire. The cron clock is shifted to a few seconds before a minute boundary so an every-minute
 * job fires almost at once.
 */
class JobFiringTest {
    private static final Duration FIRE_TIMEOUT = Duration.ofSeconds(65);

    @TempDir
    Path tempDir;

    private final AtomicInteger runs = new AtomicInteger();
    private SyncFixture fixture;

    @BeforeEach
    void setUp() {
        Instant now = Instant.now();
        Instant justBeforeMinute = now.truncatedTo(ChronoUnit.MINUTES).plusSeconds(57);
        Clock cronClock = Clock.offset(Clock.systemUTC(), Duration.between(now, justBeforeMinute));
        fixture = new SyncFixture(tempDir, List.of(RecordingUnits.counting("byggmakker/store_data", runs)), cronClock);
    }

    @AfterEach
    void tearDown() {
        fixture.close();
    }

    private List<ExecutionRecord> awaitCompleted(long jobId) throws InterruptedException {
        Instant deadline = Instant.now().plus(FIRE_TIMEOUT);
        while (Instant.now().isBefore(deadline)) {
            List<ExecutionRecord> history = fixture.tracker.history(jobId);
            if (history.stream().anyMatch(record -> record.status() == ExecutionStatus.COMPLETED)) {
                return history;
            }
            Thread.sleep(100);
        }
        return fail("No completed execution for job " + jobId + " within " + FIRE_TIMEOUT);
    }

    @Test
    void recreatedTriggerFiresAndRecordsRun() throws Exception {
        ScriptRecord script = fixture.script("byggmakker/store_data");
        JobDefinition job = fixture.scheduler.addJob(script.id(), "* * * * *");
        fixture.registry.clear();

        assertFalse(fixture.scheduler.toggleJob(job.id()));
        assertTrue(fixture.scheduler.toggleJob(job.id()));
        assertTrue(fixture.registry.contains(job.triggerId()));

        List<ExecutionRecord> history = awaitCompleted(job.id());

        assertTrue(runs.get() >= 1);
        ExecutionRecord record = history.stream()
                .filter(candidate -> candidate.status() == ExecutionStatus.COMPLETED)
                .findFirst()
                .orElseThrow();
        assertEquals(job.id(), record.jobId());
        assertNotNull(record.endTime());
        assertNull(record.errorMessage());
    }
}
