package io.fullerstack.workqueue.demo;

import io.fullerstack.workqueue.TaskContext;
import io.fullerstack.workqueue.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Work queue demo.
 * <p>
 * Submits a handful of sleeping tasks to a narrow queue under a shared deadline, then waits
 * for whichever happens first: the deadline passing or the queue going idle. Each task sleeps
 * by waiting on its context, so tasks still running at the deadline stop early.
 * <p>
 * Configured through environment variables, see {@link DemoConfig}.
 */
public class WorkQueueDemoApplication {
    private static final Logger logger = LoggerFactory.getLogger(WorkQueueDemoApplication.class);

    /**
     * How a demo run ended.
     */
    public enum Outcome {
        /** The deadline passed before all tasks finished. */
        DEADLINE,
        /** Every task finished before the deadline. */
        IDLE
    }

    public static void main(String[] args) {
        if (!launch(() -> DemoConfig.fromArgs(args))) {
            System.exit(1);
        }
    }

    /**
     * Loads the configuration and runs the demo, logging any failure.
     *
     * @return false if the configuration could not be loaded or the run failed
     */
    static boolean launch(Supplier<DemoConfig> configSource) {
        try {
            Outcome outcome = run(configSource.get());
            logger.info("Demo finished: {}", outcome);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.error("Demo interrupted", e);
            return false;
        } catch (Exception e) {
            logger.error("Demo failed", e);
            return false;
        }
    }

    public static Outcome run(DemoConfig config) throws InterruptedException, ExecutionException {
        logger.info("Starting demo: maxActive={}, deadline={}ms, tasks={}",
            config.maxActive(), config.deadline().toMillis(), config.taskSleeps().size());

        TaskContext context = TaskContext.withTimeout(TaskContext.background(), config.deadline());
        WorkQueue queue = new WorkQueue("demo", config.maxActive());

        for (Duration sleep : config.taskSleeps()) {
            queue.submit(context, ctx -> {
                if (ctx.awaitDone(sleep.toMillis(), TimeUnit.MILLISECONDS)) {
                    logger.info("{}ms task stopped early: {}", sleep.toMillis(), ctx.cause().orElseThrow());
                } else {
                    logger.info("{}ms sleep", sleep.toMillis());
                }
            });
        }
        logger.info("Submitted {} tasks, backlog={}", config.taskSleeps().size(), queue.backlogLength());

        // The context completes with its cause, the idle future with null
        Object first = CompletableFuture.anyOf(context.done(), queue.idle().toFuture()).get();

        if (first instanceof TaskContext.Cause) {
            logger.info("Deadline reached: active={}, backlog={}", queue.activeCount(), queue.backlogLength());
            return Outcome.DEADLINE;
        }
        logger.info("All work finished before the deadline");
        return Outcome.IDLE;
    }
}
