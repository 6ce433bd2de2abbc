package com.remediation.unit.orchestration;

import static org.assertj.core.api.Assertions.assertThat;

import com.remediation.orchestration.ExecutionQueue;
import com.remediation.orchestration.QueuedExecution;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

/**
 * Unit tests for ExecutionQueue covering priority ordering, FIFO within the same priority,
 * duplicate suppression and blocking take().
 */
class ExecutionQueueTest {

    private ExecutionQueue executionQueue;

    @BeforeEach
    void setUp() {
        executionQueue = new ExecutionQueue();
    }

    @Test
    @DisplayName("Higher priority dequeues first, FIFO within a priority")
    void priorityThenFifo() {
        executionQueue.enqueue("low-1", 1);
        executionQueue.enqueue("high-1", 10);
        executionQueue.enqueue("low-2", 1);
        executionQueue.enqueue("high-2", 10);

        List<String> order = new ArrayList<>();
        QueuedExecution queued;
        while ((queued = executionQueue.poll()) != null) {
            order.add(queued.getExecutionId());
        }

        assertThat(order).containsExactly("high-1", "high-2", "low-1", "low-2");
    }

    @Test
    @DisplayName("An execution already waiting is not queued twice")
    void duplicateIgnored() {
        assertThat(executionQueue.enqueue("e-1", 1)).isTrue();
        assertThat(executionQueue.enqueue("e-1", 5)).isFalse();

        assertThat(executionQueue.size()).isEqualTo(1);
        assertThat(executionQueue.contains("e-1")).isTrue();
    }

    @Test
    @DisplayName("An execution can be queued again once taken")
    void requeueAfterTake() {
        executionQueue.enqueue("e-1", 1);
        executionQueue.poll();

        assertThat(executionQueue.contains("e-1")).isFalse();
        assertThat(executionQueue.enqueue("e-1", 1)).isTrue();
    }

    @Test
    @DisplayName("take() blocks until an execution is queued")
    void takeBlocks() throws Exception {
        CountDownLatch taken = new CountDownLatch(1);
        AtomicReference<QueuedExecution> result = new AtomicReference<>();
        Thread consumer = new Thread(() -> {
            try {
                result.set(executionQueue.take());
                taken.countDown();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        consumer.start();

        assertThat(taken.await(100, TimeUnit.MILLISECONDS)).isFalse();
        executionQueue.enqueue("e-1", 3);

        assertThat(taken.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(result.get().getExecutionId()).isEqualTo("e-1");
        assertThat(result.get().getPriority()).isEqualTo(3);
        assertThat(executionQueue.isEmpty()).isTrue();
    }
}
