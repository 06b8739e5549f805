package orion.domain.scheduling;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import orion.common.SyncConstants;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for ExecutorEngineScheduler
 * @author Orion team
 * @since 17/10/2026
 */
class ExecutorEngineSchedulerTest {

    private ExecutorEngineScheduler scheduler;

    @BeforeEach
    void setUp() {
        scheduler = new ExecutorEngineScheduler();
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    @Test
    @DisplayName("Tasks should run in submission order on the engine thread")
    void tasksShouldRunInOrderOnEngineThread() throws InterruptedException {
        // Given
        List<String> order = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);

        // When
        for (int i = 0; i < 20; i++) {
            int n = i;
            scheduler.execute(() -> order.add(n + "@" + Thread.currentThread().getName()));
        }
        scheduler.execute(done::countDown);

        // Then
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(order).hasSize(20);
        for (int i = 0; i < 20; i++) {
            assertThat(order.get(i)).isEqualTo(i + "@" + SyncConstants.SCHEDULER_THREAD_NAME);
        }
    }

    @Test
    @DisplayName("A failing task should not stop later tasks")
    void failingTaskShouldNotStopEngine() throws InterruptedException {
        // Given
        CountDownLatch done = new CountDownLatch(1);

        // When
        scheduler.execute(() -> {
            throw new IllegalStateException("boom");
        });
        scheduler.execute(done::countDown);

        // Then
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    @DisplayName("Cancelled delayed task should never run")
    void cancelledTaskShouldNotRun() throws InterruptedException {
        // Given
        CountDownLatch cancelledRan = new CountDownLatch(1);
        CountDownLatch later = new CountDownLatch(1);

        // When
        ScheduledTask task = scheduler.schedule(cancelledRan::countDown, 100);
        task.cancel();
        scheduler.schedule(later::countDown, 200);

        // Then
        assertThat(later.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(cancelledRan.getCount()).isEqualTo(1);
        assertThat(task.isDone()).isTrue();
    }

    @Test
    @DisplayName("Tasks submitted after shutdown should be dropped")
    void tasksAfterShutdownShouldBeDropped() {
        // Given
        scheduler.shutdown();

        // When
        scheduler.execute(() -> {
            throw new AssertionError("must not run");
        });
        ScheduledTask task = scheduler.schedule(() -> {
        }, 10);

        // Then
        assertThat(task.isDone()).isTrue();
    }

    @Test
    @DisplayName("Only tasks on the engine thread should see themselves on it")
    void isEngineThreadShouldOnlyHoldInsideTasks() throws InterruptedException {
        // Given
        List<Boolean> inside = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);

        // When
        scheduler.execute(() -> {
            inside.add(scheduler.isEngineThread());
            done.countDown();
        });

        // Then
        assertThat(done.await(5, TimeUnit.SECONDS)).isTrue();
        assertThat(inside).containsExactly(true);
        assertThat(scheduler.isEngineThread()).isFalse();
    }
}
