package com.remediation.orchestration;

import java.util.Comparator;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Dispatch queue between admission and the worker pool.
 *
 * <p>Ordered by trigger priority (higher first), then by enqueue sequence (FIFO within a
 * priority). Unbounded: admission is already bounded by the rate limiter and circuit breaker,
 * and a growing backlog shows up on the queue depth gauge.
 *
 * <p>An execution id is held at most once; enqueueing an id that is already waiting is a no-op.
 */
@Component
public class ExecutionQueue {

    private static final Logger log = LoggerFactory.getLogger(ExecutionQueue.class);

    private static final int INITIAL_CAPACITY = 64;

    private final AtomicLong sequenceCounter = new AtomicLong(0);

    private final Set<String> queuedIds = ConcurrentHashMap.newKeySet();

    private final PriorityBlockingQueue<QueuedExecution> queue = new PriorityBlockingQueue<>(
            INITIAL_CAPACITY,
            Comparator.comparingInt(QueuedExecution::getPriority)
                    .reversed()
                    .thenComparingLong(QueuedExecution::getSequenceNumber));

    /**
     * @return false if the execution was already waiting in the queue
     */
    public boolean enqueue(String executionId, int priority) {
        if (!queuedIds.add(executionId)) {
            log.debug("Execution {} already queued", executionId);
            return false;
        }

        QueuedExecution queued = QueuedExecution.builder()
                .executionId(executionId)
                .priority(priority)
                .sequenceNumber(sequenceCounter.incrementAndGet())
                .enqueuedAt(System.currentTimeMillis())
                .build();

        queue.put(queued);
        log.debug("Execution enqueued: id={}, priority={}, queueSize={}", executionId, priority, queue.size());
        return true;
    }

    /**
     * Removes the highest-priority entry, blocking until one is available.
     *
     * @throws InterruptedException if the waiting thread is interrupted
     */
    public QueuedExecution take() throws InterruptedException {
        QueuedExecution queued = queue.take();
        queuedIds.remove(queued.getExecutionId());
        return queued;
    }

    /** Non-blocking variant of {@link #take()}; null when empty. */
    public QueuedExecution poll() {
        QueuedExecution queued = queue.poll();
        if (queued != null) {
            queuedIds.remove(queued.getExecutionId());
        }
        return queued;
    }

    public boolean contains(String executionId) {
        return queuedIds.contains(executionId);
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }
}
