package io.fullerstack.workqueue;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Cancellation and deadline carrier handed to every {@link Task}.
 * <p>
 * Contexts form a tree: a child is done when it is cancelled, when its deadline
 * passes, or when its parent is done. The root is {@link #background()}, which is
 * never done. A {@link WorkQueue} only forwards contexts; it never inspects them.
 * <p>
 * A child stays registered with its parent only until it is done, so a long-lived parent
 * does not accumulate cancelled or expired children.
 *
 * <p><b>Usage:</b>
 * <pre>
 * TaskContext ctx = TaskContext.withTimeout(TaskContext.background(), Duration.ofSeconds(4));
 * queue.submit(ctx, c -&gt; {
 *     if (c.awaitDone(5, TimeUnit.SECONDS)) {
 *         return; // gave up, deadline passed
 *     }
 *     download();
 * });
 * </pre>
 */
public final class TaskContext {

    /**
     * Why a context is done.
     */
    public enum Cause {
        CANCELLED,
        DEADLINE_EXCEEDED
    }

    private static final TaskContext BACKGROUND = new TaskContext(null, false);

    private final CompletableFuture<Cause> done = new CompletableFuture<>();
    private final CompletableFuture<Cause> view = done.copy();
    private final Set<TaskContext> children = ConcurrentHashMap.newKeySet();
    private final Instant deadline;
    private final boolean cancellable;

    private TaskContext(Instant deadline, boolean cancellable) {
        this.deadline = deadline;
        this.cancellable = cancellable;
        done.thenAccept(this::propagate);
    }

    /**
     * Root context: never done, no deadline, {@link #cancel()} does nothing.
     */
    public static TaskContext background() {
        return BACKGROUND;
    }

    /**
     * Cancellable child of {@code parent}, inheriting its deadline.
     */
    public static TaskContext withCancel(TaskContext parent) {
        Objects.requireNonNull(parent, "parent cannot be null");
        TaskContext child = new TaskContext(parent.deadline, true);
        child.follow(parent);
        return child;
    }

    /**
     * Cancellable child of {@code parent} that is done at {@code deadline} or at the
     * parent's deadline, whichever comes first.
     */
    public static TaskContext withDeadline(TaskContext parent, Instant deadline) {
        Objects.requireNonNull(parent, "parent cannot be null");
        Objects.requireNonNull(deadline, "deadline cannot be null");
        Instant effective = parent.deadline != null && parent.deadline.isBefore(deadline)
            ? parent.deadline
            : deadline;
        TaskContext child = new TaskContext(effective, true);
        child.follow(parent);

        long delayNanos = Duration.between(Instant.now(), effective).toNanos();
        if (delayNanos <= 0) {
            child.done.complete(Cause.DEADLINE_EXCEEDED);
        } else {
            child.done.completeOnTimeout(Cause.DEADLINE_EXCEEDED, delayNanos, TimeUnit.NANOSECONDS);
        }
        return child;
    }

    /**
     * Shorthand for {@code withDeadline(parent, Instant.now().plus(timeout))}.
     */
    public static TaskContext withTimeout(TaskContext parent, Duration timeout) {
        Objects.requireNonNull(timeout, "timeout cannot be null");
        return withDeadline(parent, Instant.now().plus(timeout));
    }

    private void follow(TaskContext parent) {
        // background never completes, registering on it would only pile up children
        if (parent == BACKGROUND) {
            return;
        }
        parent.children.add(this);
        done.thenRun(() -> parent.children.remove(this));
        // parent may have finished propagating before this child was added
        Cause inherited = parent.done.getNow(null);
        if (inherited != null) {
            done.complete(inherited);
        }
    }

    private void propagate(Cause cause) {
        for (TaskContext child : children) {
            child.done.complete(cause);
        }
    }

    int childCount() {
        return children.size();
    }

    /**
     * Marks this context and its descendants done with {@link Cause#CANCELLED}.
     * No effect on the background context or on a context that is already done.
     */
    public void cancel() {
        if (cancellable) {
            done.complete(Cause.CANCELLED);
        }
    }

    public boolean isDone() {
        return done.isDone();
    }

    /**
     * @return why this context is done, empty while it is not
     */
    public Optional<Cause> cause() {
        return Optional.ofNullable(done.getNow(null));
    }

    public Optional<Instant> deadline() {
        return Optional.ofNullable(deadline);
    }

    /**
     * Time left until the deadline, never negative. Empty when there is no deadline.
     */
    public Optional<Duration> remaining() {
        if (deadline == null) {
            return Optional.empty();
        }
        Duration left = Duration.between(Instant.now(), deadline);
        return Optional.of(left.isNegative() ? Duration.ZERO : left);
    }

    /**
     * Future completing with the cause once this context is done. Every call returns the
     * same instance. Completing or cancelling it does not affect the context, but other
     * holders of the future would see it, so callers should only attach stages to it.
     */
    public CompletableFuture<Cause> done() {
        return view;
    }

    /**
     * Waits until this context is done or the timeout elapses.
     *
     * @return true if the context is done, false on timeout
     * @throws InterruptedException if interrupted while waiting
     */
    public boolean awaitDone(long timeout, TimeUnit unit) throws InterruptedException {
        try {
            done.get(timeout, unit);
            return true;
        } catch (TimeoutException e) {
            return false;
        } catch (ExecutionException e) {
            // done is only ever completed normally
            throw new IllegalStateException("Context completed exceptionally", e.getCause());
        }
    }

    /**
     * @throws CancellationException if this context is done
     */
    public void throwIfDone() {
        Cause cause = done.getNow(null);
        if (cause != null) {
            throw new CancellationException("Task context is done: " + cause);
        }
    }

    @Override
    public String toString() {
        if (this == BACKGROUND) {
            return "TaskContext[background]";
        }
        return "TaskContext[deadline=" + deadline + ", cause=" + done.getNow(null) + "]";
    }
}
