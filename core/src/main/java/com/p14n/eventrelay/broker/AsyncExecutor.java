package com.p14n.eventrelay.broker;

import java.util.concurrent.*;

/**
 * Interface for the relay's task execution: a timer facility and a serial
 * worker.
 *
 * <p>
 * Tasks passed to {@link #submit(Callable)} run one at a time, in submission
 * order, on a single worker. Tasks passed to
 * {@link #scheduleAtFixedRate(Runnable, long, long, TimeUnit)} run on a
 * separate scheduler and must not block.
 * </p>
 */
public interface AsyncExecutor extends AutoCloseable {

    /**
     * Schedules a task for repeated fixed-rate execution.
     *
     * @param command      The task to execute
     * @param initialDelay The time to delay first execution
     * @param period       The period between successive executions
     * @param unit         The time unit of the initialDelay and period parameters
     * @return A ScheduledFuture representing pending completion of the task
     */
    ScheduledFuture<?> scheduleAtFixedRate(Runnable command,
            long initialDelay,
            long period,
            TimeUnit unit);

    /**
     * Submits a task to the serial worker.
     *
     * @param task The task to submit
     * @param <T>  The type of the task result
     * @return A Future representing pending completion of the task
     * @throws RejectedExecutionException if the executor has been shut down
     */
    <T> Future<T> submit(Callable<T> task);

}
