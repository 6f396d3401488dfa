package com.kmg.sync.api;

import com.kmg.sync.dto.ExecutionView;
import com.kmg.sync.execution.ExecutionTracker;
import com.kmg.sync.execution.JobRunner;
import com.kmg.sync.model.ExecutionRecord;
import com.kmg.sync.repo.SqlTime;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api")
public class ExecutionController {
    private final ExecutionTracker executionTracker;
    private final JobRunner jobRunner;

    public ExecutionController(ExecutionTracker executionTracker, JobRunner jobRunner) {
        this.executionTracker = executionTracker;
        this.jobRunner = jobRunner;
    }

    @GetMapping("/executions/{jobId}")
    public List<ExecutionView> history(@PathVariable long jobId) {
        return executionTracker.history(jobId).stream().map(ExecutionController::toView).toList();
    }

    @PostMapping("/run_now/{scriptId}")
    public ExecutionView runNow(@PathVariable long scriptId) {
        return toView(jobRunner.runNow(scriptId));
    }

    static ExecutionView toView(ExecutionRecord record) {
        return new ExecutionView(
                record.id(),
                SqlTime.toText(record.startTime()),
                SqlTime.toText(record.endTime()),
                record.status(),
                record.errorMessage()
        );
    }
}
