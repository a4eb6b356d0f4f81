package com.p14n.eventrelay.relay;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.p14n.eventrelay.broker.AsyncExecutor;

import io.opentelemetry.api.trace.Tracer;

import static com.p14n.eventrelay.telemetry.OpenTelemetryFunctions.processWithTelemetry;

/**
 * Serializes all store work onto the executor's single worker.
 *
 * <p>
 * Any number of threads may {@link #submit(WorkItem)}; submission never
 * blocks and reports nothing back. Items run to completion one at a time in
 * submission order, which is what keeps the connection and the subscription
 * mapping free of concurrent access. A failing item is logged and the worker
 * moves on to the next one.
 * </p>
 *
 * <p>
 * There is no per-item timeout: an item blocked on the store holds up every
 * item queued behind it.
 * </p>
 */
public class CommandPipeline implements AutoCloseable {

    private static final Logger logger = LoggerFactory.getLogger(CommandPipeline.class);

    private final AsyncExecutor executor;
    private final Tracer tracer;
    private final AtomicInteger pending = new AtomicInteger();
    private final AtomicBoolean closed = new AtomicBoolean(false);

    public CommandPipeline(AsyncExecutor executor, Tracer tracer) {
        this.executor = executor;
        this.tracer = tracer;
    }

    /**
     * Queues a work item.
     *
     * @param item the item to run
     * @return false if the pipeline no longer accepts work
     */
    public boolean submit(WorkItem item) {
        if (closed.get()) {
            logger.atDebug().addArgument(item.description()).log("Pipeline closed, discarding {}");
            return false;
        }
        pending.incrementAndGet();
        try {
            executor.submit(() -> {
                run(item);
                return null;
            });
            return true;
        } catch (RejectedExecutionException e) {
            pending.decrementAndGet();
            logger.atWarn().setCause(e).addArgument(item.description()).log("Pipeline rejected {}");
            return false;
        }
    }

    private void run(WorkItem item) {
        try {
            processWithTelemetry(tracer, item.spanName(), () -> {
                item.action().run();
                return null;
            });
        } catch (RuntimeException e) {
            logger.atError()
                    .setCause(e)
                    .addArgument(item.description())
                    .log("Work item {} failed");
        } finally {
            pending.decrementAndGet();
        }
    }

    /**
     * Number of submitted items that have not finished yet.
     *
     * @return the pending count
     */
    public int pending() {
        return pending.get();
    }

    public boolean isClosed() {
        return closed.get();
    }

    /**
     * Stops accepting new items. Items already queued still run.
     */
    @Override
    public void close() {
        closed.set(true);
    }
}
