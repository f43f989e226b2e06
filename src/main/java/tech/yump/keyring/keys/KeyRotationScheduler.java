package tech.yump.keyring.keys;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;
import tech.yump.keyring.config.KeyringConfiguration;
import tech.yump.keyring.config.KeyringProperties;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

/**
 * Background driver of the rotation schedule. Sleeps until the active key is due for
 * rotation, never longer than {@code keyring.rotation.max-poll-interval}, then asks the
 * controller to rotate if due. Each wake-up schedules the next one.
 * <p>
 * On shutdown the pending wake-up is cancelled; a rotation already in progress is left to finish.
 */
@Component
@Slf4j
public class KeyRotationScheduler implements SmartLifecycle {

    private final KeyRotationController controller;
    private final TaskScheduler taskScheduler;
    private final Clock clock;
    private final Duration maxPollInterval;
    private final boolean enabled;

    private final Object monitor = new Object();
    private ScheduledFuture<?> pendingWakeUp;
    private volatile boolean running;

    public KeyRotationScheduler(
            KeyRotationController controller,
            @Qualifier(KeyringConfiguration.ROTATION_TASK_SCHEDULER) TaskScheduler taskScheduler,
            Clock clock,
            KeyringProperties properties) {
        this.controller = controller;
        this.taskScheduler = taskScheduler;
        this.clock = clock;
        this.maxPollInterval = properties.rotation().maxPollInterval();
        this.enabled = properties.rotation().schedulerEnabled();
        controller.addRotationListener(this::scheduleNext);
    }

    @Override
    public void start() {
        if (!enabled) {
            log.info("Key rotation scheduler is disabled (keyring.rotation.scheduler-enabled=false). Only forced rotations will occur.");
            return;
        }
        synchronized (monitor) {
            running = true;
        }
        log.info("Key rotation scheduler started (max poll interval {}).", maxPollInterval);
        scheduleNext();
    }

    @Override
    public void stop() {
        synchronized (monitor) {
            running = false;
            if (pendingWakeUp != null) {
                pendingWakeUp.cancel(false);
                pendingWakeUp = null;
            }
        }
        log.info("Key rotation scheduler stopped.");
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Replaces any pending wake-up with one at {@link #nextWakeUp(Instant)}.
     */
    void scheduleNext() {
        synchronized (monitor) {
            if (!running) {
                return;
            }
            if (pendingWakeUp != null) {
                pendingWakeUp.cancel(false);
            }
            Instant wakeAt = nextWakeUp(clock.instant());
            pendingWakeUp = taskScheduler.schedule(this::tick, wakeAt);
            log.debug("Next rotation check scheduled at {}", wakeAt);
        }
    }

    /**
     * The earlier of the rotation deadline and {@code now + maxPollInterval}, never before
     * {@code now}. An overdue deadline therefore wakes up immediately.
     */
    Instant nextWakeUp(Instant now) {
        Instant cap = now.plus(maxPollInterval);
        Instant due;
        try {
            due = controller.nextRotationAt();
        } catch (NoActiveKeyException e) {
            log.warn("Key ring not bootstrapped yet; polling again at {}", cap);
            return cap;
        }
        Instant wakeAt = due.isBefore(cap) ? due : cap;
        return wakeAt.isBefore(now) ? now : wakeAt;
    }

    void tick() {
        if (!running) {
            return;
        }
        try {
            controller.rotateIfDue();
        } catch (RuntimeException e) {
            log.error("Scheduled rotation check failed: {}", e.getMessage(), e);
        } finally {
            scheduleNext();
        }
    }
}
