package com.ryuqq.lifecycle.application.runtime;

/**
 * Cooperative scheduling runtime.
 *
 * <p>This interface defines one cycle of the scheduling substrate that lets
 * many tasks progress in a single process without blocking a thread per task.</p>
 *
 * <p><strong>Runtime Operation Flow:</strong></p>
 * <pre>
 * pump() starts
 *   ↓
 * for each registered task whose next poll time has come:
 *   a. not started → invoke the backend call
 *   b. started     → probe once
 *   c. terminal    → complete the task handle and unregister
 *   d. otherwise   → re-arm at now + poll interval
 * </pre>
 *
 * <p><strong>Execution Context:</strong></p>
 * <ul>
 *   <li>pump() runs on a single thread at a time; tasks never run concurrently with each other</li>
 *   <li>Tasks yield only between polls; the backend call and each probe are atomic</li>
 *   <li>Caller is responsible for continuous invocation (loop or scheduler)</li>
 * </ul>
 *
 * <p><strong>Usage Example:</strong></p>
 * <pre>
 * ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor();
 * timer.scheduleWithFixedDelay(runtime::pump, 0, 50, TimeUnit.MILLISECONDS);
 * </pre>
 *
 * @author Lifecycle Team
 * @since 1.0.0
 */
public interface Runtime {

    /**
     * Executes a single scheduling cycle.
     *
     * <p>Per-task failures are delivered through the task's handle and never
     * escape this method.</p>
     *
     * @throws IllegalStateException if the runtime has been shut down
     */
    void pump();
}
