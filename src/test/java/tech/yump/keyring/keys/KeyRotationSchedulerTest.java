package tech.yump.keyring.keys;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.scheduling.TaskScheduler;
import tech.yump.keyring.config.KeyringProperties;
import tech.yump.keyring.support.MutableClock;
import tech.yump.keyring.support.TestProperties;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.ScheduledFuture;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doReturn;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class KeyRotationSchedulerTest {

    private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");
    private static final Duration MAX_POLL = Duration.ofMinutes(1);

    @Mock
    private KeyRotationController controller;

    @Mock
    private TaskScheduler taskScheduler;

    @Mock
    private ScheduledFuture<Object> pendingFuture;

    @Captor
    private ArgumentCaptor<Runnable> taskCaptor;

    private MutableClock clock;
    private KeyRotationScheduler scheduler;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(NOW);
        scheduler = new KeyRotationScheduler(controller, taskScheduler, clock, TestProperties.keyring());
    }

    @Test
    @DisplayName("constructor: Should register for rotation notifications")
    void registersRotationListener() {
        verify(controller).addRotationListener(any(Runnable.class));
    }

    @Test
    @DisplayName("start: Should schedule nothing when the scheduler is disabled")
    void start_disabled() {
        // Arrange
        KeyringProperties.RotationProperties rotation = new KeyringProperties.RotationProperties(
                Duration.ofDays(7), Duration.ofDays(1), Duration.ofMinutes(5), 5, true, MAX_POLL, false);
        KeyRotationScheduler disabled = new KeyRotationScheduler(controller, taskScheduler, clock,
                TestProperties.keyring(TestProperties.ecSigning(), rotation));

        // Act
        disabled.start();

        // Assert
        assertThat(disabled.isRunning()).isFalse();
        verifyNoInteractions(taskScheduler);
    }

    @Test
    @DisplayName("start: Should wake up at the rotation deadline when it is before the poll cap")
    void start_schedulesAtDeadline() {
        // Arrange
        when(controller.nextRotationAt()).thenReturn(NOW.plusSeconds(10));
        doReturn(pendingFuture).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));

        // Act
        scheduler.start();

        // Assert
        assertThat(scheduler.isRunning()).isTrue();
        verify(taskScheduler).schedule(any(Runnable.class), eq(NOW.plusSeconds(10)));
    }

    @Test
    @DisplayName("nextWakeUp: Should never sleep longer than the max poll interval")
    void nextWakeUp_cappedByPollInterval() {
        when(controller.nextRotationAt()).thenReturn(NOW.plus(Duration.ofDays(7)));

        assertThat(scheduler.nextWakeUp(NOW)).isEqualTo(NOW.plus(MAX_POLL));
    }

    @Test
    @DisplayName("nextWakeUp: Should wake up immediately when the deadline has passed")
    void nextWakeUp_overdue() {
        when(controller.nextRotationAt()).thenReturn(NOW.minusSeconds(30));

        assertThat(scheduler.nextWakeUp(NOW)).isEqualTo(NOW);
    }

    @Test
    @DisplayName("nextWakeUp: Should poll at the cap while the key ring is not bootstrapped")
    void nextWakeUp_notBootstrapped() {
        when(controller.nextRotationAt()).thenThrow(new NoActiveKeyException());

        assertThat(scheduler.nextWakeUp(NOW)).isEqualTo(NOW.plus(MAX_POLL));
    }

    @Test
    @DisplayName("tick: Should reschedule even when the rotation check throws")
    void tick_reschedulesAfterFailure() {
        // Arrange
        when(controller.nextRotationAt()).thenReturn(NOW.plusSeconds(10));
        doReturn(pendingFuture).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
        scheduler.start();
        verify(taskScheduler).schedule(taskCaptor.capture(), any(Instant.class));
        when(controller.rotateIfDue()).thenThrow(new IllegalStateException("store unavailable"));
        clock.advance(Duration.ofSeconds(10));

        // Act
        taskCaptor.getValue().run();

        // Assert
        verify(controller).rotateIfDue();
        verify(taskScheduler, times(2)).schedule(any(Runnable.class), any(Instant.class));
    }

    @Test
    @DisplayName("stop: Should cancel the pending wake-up without interrupting a running rotation")
    void stop_cancelsPendingWakeUp() {
        // Arrange
        when(controller.nextRotationAt()).thenReturn(NOW.plusSeconds(10));
        doReturn(pendingFuture).when(taskScheduler).schedule(any(Runnable.class), any(Instant.class));
        scheduler.start();

        // Act
        scheduler.stop();
        scheduler.tick();

        // Assert
        assertThat(scheduler.isRunning()).isFalse();
        verify(pendingFuture).cancel(false);
        verify(controller, never()).rotateIfDue();
    }
}
