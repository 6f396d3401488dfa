package com.kmg.sync.api;

import com.kmg.sync.dto.CreateJobRequest;
import com.kmg.sync.dto.JobView;
import com.kmg.sync.dto.ToggleJobResponse;
import com.kmg.sync.dto.UpdateJobRequest;
import com.kmg.sync.model.JobDefinition;
import com.kmg.sync.repo.SqlTime;
import com.kmg.sync.schedule.CronTriggerRegistry;
import com.kmg.sync.schedule.JobScheduler;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/jobs")
public class JobController {
    private final JobScheduler jobScheduler;
    private final CronTriggerRegistry triggerRegistry;

    public JobController(JobScheduler jobScheduler, CronTriggerRegistry triggerRegistry) {
        this.jobScheduler = jobScheduler;
        this.triggerRegistry = triggerRegistry;
    }

    @GetMapping
    public List<JobView> listJobs() {
        return jobScheduler.listJobs().stream().map(this::toView).toList();
    }

    @GetMapping("/{id}")
    public JobView getJob(@PathVariable long id) {
        return toView(jobScheduler.getJob(id));
    }

    @PostMapping
    public ResponseEntity<JobView> createJob(@Valid @RequestBody CreateJobRequest request) {
        JobDefinition job = jobScheduler.addJob(request.scriptId(), request.cronExpression());
        return ResponseEntity.status(HttpStatus.CREATED).body(toView(job));
    }

    @PutMapping("/{id}")
    public JobView updateJob(@PathVariable long id, @RequestBody UpdateJobRequest request) {
        return toView(jobScheduler.updateJob(id, request.cronExpression()));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> deleteJob(@PathVariable long id) {
        jobScheduler.removeJob(id);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/toggle")
    public ToggleJobResponse toggle(@PathVariable long id) {
        boolean enabled = jobScheduler.toggleJob(id);
        return new ToggleJobResponse("Job " + (enabled ? "resumed" : "paused") + " successfully", enabled);
    }

    private JobView toView(JobDefinition job) {
        return new JobView(
                job.id(),
                job.triggerId(),
                job.scriptId(),
                job.unitLocator(),
                job.cronExpression(),
                job.enabled(),
                SqlTime.toText(job.createdAt()),
                triggerRegistry.contains(job.triggerId()),
                triggerRegistry.nextFireTime(job.triggerId()).map(Object::toString).orElse(null)
        );
    }
}
