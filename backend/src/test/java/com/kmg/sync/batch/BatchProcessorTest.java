package com.kmg.sync.batch;

import com.kmg.sync.error.RecordProcessingException;
import com.kmg.sync.error.RunFailedException;
import com.kmg.sync.store.StoreConnectionManager;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

class BatchProcessorTest {

    private static final class ListProcessor extends BatchProcessor<String> {
        private final List<String> candidates;
        private final Predicate<String> failing;
        private final RuntimeException failure;
        final List<String> handled = new ArrayList<>();

        ListProcessor(List<String> candidates, int batchSize, Predicate<String> failing, RuntimeException failure) {
            super(new StoreConnectionManager(Map.of(), List.of()), batchSize);
            this.candidates = candidates;
            this.failing = failing;
            this.failure = failure;
        }

        @Override
        protected List<String> fetchCandidates() {
            return candidates;
        }

        @Override
        protected void processOne(String record) {
            handled.add(record);
            if (failing.test(record)) {
                throw failure;
            }
        }
    }

    @Test
    void failingRecord_countedAndRunContinues() {
        ListProcessor processor = new ListProcessor(List.of("A", "B", "C"), 100,
                "B"::equals, new RecordProcessingException("bad B"));

        BatchRunStats stats = processor.runAll();

        assertEquals(List.of("A", "B", "C"), processor.handled);
        assertEquals(3, stats.totalCount());
        assertEquals(2, stats.processedCount());
        assertEquals(1, stats.errorCount());
    }

    @Test
    void everyThirdRecordFails_acrossBatches() {
        List<String> records = IntStream.rangeClosed(1, 10).mapToObj(String::valueOf).toList();
        ListProcessor processor = new ListProcessor(records, 4,
                r -> Integer.parseInt(r) % 3 == 0, new IllegalStateException("fail"));

        BatchRunStats stats = processor.runAll();

        assertEquals(records, processor.handled);
        assertEquals(10, stats.totalCount());
        assertEquals(7, stats.processedCount());
        assertEquals(3, stats.errorCount());
    }

    @Test
    void emptyInput_noWork() {
        ListProcessor processor = new ListProcessor(List.of(), 10, r -> false, null);

        BatchRunStats stats = processor.runAll();

        assertEquals(0, stats.totalCount());
        assertEquals(0, stats.processedCount());
        assertTrue(processor.handled.isEmpty());
    }

    @Test
    void systemicFailure_abortsRun() {
        ListProcessor processor = new ListProcessor(List.of("A", "B", "C", "D"), 2,
                "C"::equals, new DataAccessResourceFailureException("connection lost"));

        RunFailedException e = assertThrows(RunFailedException.class, processor::runAll);

        assertEquals(List.of("A", "B", "C"), processor.handled);
        assertInstanceOf(DataAccessResourceFailureException.class, e.getCause());
        assertTrue(e.getMessage().contains("Batch 2"));
    }

    @Test
    void fetchFailure_propagates() {
        BatchProcessor<String> processor = new BatchProcessor<>(new StoreConnectionManager(Map.of(), List.of())) {
            @Override
            protected List<String> fetchCandidates() {
                throw new DataAccessResourceFailureException("raw_data unreachable");
            }

            @Override
            protected void processOne(String record) {
                fail("nothing to process");
            }
        };

        assertThrows(DataAccessResourceFailureException.class, processor::run);
    }

    @Test
    void batchSize_mustBePositive() {
        assertThrows(IllegalArgumentException.class,
                () -> new ListProcessor(List.of(), 0, r -> false, null));
        assertEquals(BatchProcessor.DEFAULT_BATCH_SIZE, new BatchProcessor<String>(new StoreConnectionManager(Map.of(), List.of())) {
            @Override
            protected List<String> fetchCandidates() {
                return List.of();
            }

            @Override
            protected void processOne(String record) {
            }
        }.batchSize());
    }
}
