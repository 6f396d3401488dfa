package com.kmg.sync.schedule;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.scheduling.support.CronTrigger;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.*;
import java.util.concurrent.ScheduledFuture;

/**
 * In-memory registry of live cron triggers, keyed by trigger id.
 *
 * <p>Firings are evaluated by the {@link TaskScheduler} handed in; the registered task must hand real work off to
 * another executor so a long run never delays other triggers. The registry is lost with the process and is rebuilt
 * from the job table on start.</p>
 *
 * <p>Missed fires are not replayed: a trigger that is (re)armed computes its next fire time from the current
 * instant.</p>
 */
public class CronTriggerRegistry {
    private static final Logger log = LoggerFactory.getLogger(CronTriggerRegistry.class);

    private final TaskScheduler taskScheduler;
    private final ZoneId zoneId;
    private final Map<String, LiveTrigger> triggers = new HashMap<>();
    private boolean stopped;

    public CronTriggerRegistry(TaskScheduler taskScheduler, ZoneId zoneId) {
        this.taskScheduler = taskScheduler;
        this.zoneId = zoneId;
    }

    /**
     * Arms a trigger, replacing any trigger registered under the same id.
     */
    public synchronized void register(String triggerId, String cronExpression, Runnable task) {
        if (stopped) {
            throw new IllegalStateException("Trigger registry is stopped");
        }
        String springExpression = CronExpressions.toSpringExpression(cronExpression);
        LiveTrigger previous = triggers.remove(triggerId);
        if (previous != null) {
            previous.cancel();
            log.info("Replacing trigger {}", triggerId);
        }
        LiveTrigger trigger = new LiveTrigger(CronExpressions.normalize(cronExpression), springExpression, task);
        arm(trigger);
        triggers.put(triggerId, trigger);
        log.info("Registered trigger {} with cron '{}'", triggerId, trigger.cronExpression);
    }

    public synchronized TriggerResult remove(String triggerId) {
        LiveTrigger trigger = triggers.remove(triggerId);
        if (trigger == null) {
            return TriggerResult.ABSENT_HARMLESS;
        }
        trigger.cancel();
        return TriggerResult.UPDATED;
    }

    public synchronized TriggerResult pause(String triggerId) {
        LiveTrigger trigger = triggers.get(triggerId);
        if (trigger == null) {
            return TriggerResult.ABSENT_HARMLESS;
        }
        trigger.cancel();
        trigger.paused = true;
        return TriggerResult.UPDATED;
    }

    public synchronized TriggerResult resume(String triggerId) {
        LiveTrigger trigger = triggers.get(triggerId);
        if (trigger == null) {
            return TriggerResult.ABSENT_MUST_RECREATE;
        }
        if (trigger.paused) {
            trigger.paused = false;
            arm(trigger);
        }
        return TriggerResult.UPDATED;
    }

    /**
     * Replaces the cron expression of a live trigger in place. A paused trigger stays paused.
     */
    public synchronized TriggerResult reschedule(String triggerId, String cronExpression) {
        LiveTrigger trigger = triggers.get(triggerId);
        if (trigger == null) {
            CronExpressions.toSpringExpression(cronExpression);
            return TriggerResult.ABSENT_MUST_RECREATE;
        }
        LiveTrigger replacement = new LiveTrigger(
                CronExpressions.normalize(cronExpression),
                CronExpressions.toSpringExpression(cronExpression),
                trigger.task
        );
        replacement.paused = trigger.paused;
        trigger.cancel();
        if (!replacement.paused) {
            arm(replacement);
        }
        triggers.put(triggerId, replacement);
        return TriggerResult.UPDATED;
    }

    public synchronized boolean contains(String triggerId) {
        return triggers.containsKey(triggerId);
    }

    public synchronized boolean isPaused(String triggerId) {
        LiveTrigger trigger = triggers.get(triggerId);
        return trigger != null && trigger.paused;
    }

    public synchronized Optional<String> cronExpression(String triggerId) {
        return Optional.ofNullable(triggers.get(triggerId)).map(trigger -> trigger.cronExpression);
    }

    /**
     * Next fire time of an armed trigger; empty when the trigger is absent or paused.
     */
    public synchronized Optional<Instant> nextFireTime(String triggerId) {
        LiveTrigger trigger = triggers.get(triggerId);
        if (trigger == null || trigger.paused) {
            return Optional.empty();
        }
        ZonedDateTime next = CronExpression.parse(trigger.springExpression).next(ZonedDateTime.now(zoneId));
        return Optional.ofNullable(next).map(ZonedDateTime::toInstant);
    }

    public synchronized Set<String> triggerIds() {
        return Collections.unmodifiableSet(new TreeSet<>(triggers.keySet()));
    }

    /**
     * Drops every live trigger, as a process restart would.
     */
    public synchronized void clear() {
        triggers.values().forEach(LiveTrigger::cancel);
        triggers.clear();
    }

    public synchronized void shutdown() {
        if (stopped) {
            return;
        }
        int count = triggers.size();
        clear();
        stopped = true;
        log.info("Trigger registry stopped, {} triggers cancelled", count);
    }

    public ZoneId zoneId() {
        return zoneId;
    }

    private void arm(LiveTrigger trigger) {
        trigger.future = taskScheduler.schedule(trigger.task, new CronTrigger(trigger.springExpression, zoneId));
    }

    private static final class LiveTrigger {
        private final String cronExpression;
        private final String springExpression;
        private final Runnable task;
        private ScheduledFuture<?> future;
        private boolean paused;

        private LiveTrigger(String cronExpression, String springExpression, Runnable task) {
            this.cronExpression = cronExpression;
            this.springExpression = springExpression;
            this.task = task;
        }

        private void cancel() {
            if (future != null) {
                future.cancel(false);
                future = null;
            }
        }
    }
}
