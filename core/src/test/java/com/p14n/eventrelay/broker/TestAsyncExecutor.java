package com.p14n.eventrelay.broker;

import java.util.*;
import java.util.concurrent.*;

/**
 * Records tasks instead of running them. Tests drive execution explicitly
 * with {@link #runPending()}, {@link #runScheduled()} or {@link #tick}.
 *
 * <p>
 * {@link #close()} stops new submissions but keeps tasks already queued, so
 * a test can still run work queued during shutdown.
 * </p>
 */
public class TestAsyncExecutor implements AsyncExecutor {
    private final List<Task> pendingTasks = new CopyOnWriteArrayList<>();
    private final List<Task> scheduledTasks = new CopyOnWriteArrayList<>();
    private volatile boolean isShutdown = false;

    private static class Task {
        final Runnable runnable;
        final long initialDelay;
        final long period;
        final TimeUnit unit;
        final Callable<?> callable;
        final Future<?> future;

        Task(Runnable runnable, long initialDelay, long period, TimeUnit unit, ScheduledFuture<?> future) {
            this.runnable = runnable;
            this.initialDelay = initialDelay;
            this.period = period;
            this.unit = unit;
            this.callable = null;
            this.future = future;
        }

        Task(Callable<?> callable, Future<?> future) {
            this.runnable = null;
            this.initialDelay = 0;
            this.period = 0;
            this.unit = null;
            this.callable = callable;
            this.future = future;
        }
    }

    private static class CompletableFutureImpl<T> implements Future<T> {
        private boolean cancelled = false;
        private boolean done = false;
        private T result;
        private Exception exception;

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            cancelled = true;
            done = true;
            return true;
        }

        @Override
        public boolean isCancelled() {
            return cancelled;
        }

        @Override
        public boolean isDone() {
            return done;
        }

        @Override
        public T get() throws ExecutionException {
            if (exception != null) {
                throw new ExecutionException(exception);
            }
            return result;
        }

        @Override
        public T get(long timeout, TimeUnit unit) throws ExecutionException {
            return get();
        }

        void complete(T value) {
            result = value;
            done = true;
        }

        void completeExceptionally(Exception e) {
            exception = e;
            done = true;
        }
    }

    @Override
    public ScheduledFuture<?> scheduleAtFixedRate(Runnable command, long initialDelay, long period, TimeUnit unit) {
        if (isShutdown) {
            throw new RejectedExecutionException("Executor is shutdown");
        }
        ScheduledFuture<?> future = new ScheduledFuture<Void>() {
            @Override
            public long getDelay(TimeUnit unit) {
                return 0;
            }

            @Override
            public int compareTo(Delayed o) {
                return 0;
            }

            @Override
            public boolean cancel(boolean mayInterruptIfRunning) {
                return scheduledTasks.removeIf(t -> t.future == this);
            }

            @Override
            public boolean isCancelled() {
                return scheduledTasks.stream().noneMatch(t -> t.future == this);
            }

            @Override
            public boolean isDone() {
                return false;
            }

            @Override
            public Void get() {
                return null;
            }

            @Override
            public Void get(long timeout, TimeUnit unit) {
                return null;
            }
        };
        scheduledTasks.add(new Task(command, initialDelay, period, unit, future));
        return future;
    }

    @Override
    public <T> Future<T> submit(Callable<T> task) {
        if (isShutdown) {
            throw new RejectedExecutionException("Executor is shutdown");
        }
        CompletableFutureImpl<T> future = new CompletableFutureImpl<>();
        pendingTasks.add(new Task(task, future));
        return future;
    }

    @Override
    public void close() {
        isShutdown = true;
        scheduledTasks.clear();
    }

    public boolean isShutdown() {
        return isShutdown;
    }

    public int pendingCount() {
        return pendingTasks.size();
    }

    public int scheduledCount() {
        return scheduledTasks.size();
    }

    public List<Long> scheduledPeriods(TimeUnit unit) {
        List<Long> periods = new ArrayList<>();
        for (Task task : scheduledTasks) {
            periods.add(unit.convert(task.period, task.unit));
        }
        return periods;
    }

    /**
     * Runs every queued task in submission order, including tasks queued
     * while running.
     *
     * @return the number of tasks run
     */
    public int runPending() {
        int count = 0;
        while (!pendingTasks.isEmpty()) {
            Task task = pendingTasks.remove(0);
            run(task);
            count++;
        }
        return count;
    }

    /**
     * Fires every scheduled task once, in scheduling order.
     */
    public void runScheduled() {
        for (Task task : new ArrayList<>(scheduledTasks)) {
            task.runnable.run();
        }
    }

    /**
     * Runs one task picked at random from the queue head or, when asked, from
     * the scheduled tasks. Queued tasks keep their relative order.
     *
     * @param random           source of choices
     * @param includeScheduled whether a timer may fire instead
     */
    public void tick(Random random, boolean includeScheduled) {
        var handleScheduled = includeScheduled && !scheduledTasks.isEmpty();
        if (pendingTasks.isEmpty() && !handleScheduled) {
            return;
        }
        if (handleScheduled && (pendingTasks.isEmpty() || random.nextInt(4) == 0)) {
            Task timer = scheduledTasks.get(random.nextInt(scheduledTasks.size()));
            timer.runnable.run();
            return;
        }
        run(pendingTasks.remove(0));
    }

    @SuppressWarnings("unchecked")
    private void run(Task task) {
        CompletableFutureImpl<Object> future = (CompletableFutureImpl<Object>) task.future;
        try {
            future.complete(task.callable.call());
        } catch (Exception e) {
            future.completeExceptionally(e);
        }
    }
}
