package io.fullerstack.workqueue;

import io.fullerstack.workqueue.config.WorkQueueConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.ReentrantLock;

/**
 * WorkQueue - runs submitted tasks with at most {@code maxActive} executing at once.
 * <p>
 * < p >< b >Admission:</b >
 * < ul >
 * < li >While fewer than {@code maxActive} tasks run, {@link #submit} starts a worker for the task right away</li >
 * < li >At capacity, the task is appended to the backlog (FIFO) and no worker is started</li >
 * < li >{@link #submit} never blocks and never waits for the task to start</li >
 * </ul >
 * <p>
 * < p >< b >Worker Hand-off:</b >
 * A worker that finishes a task checks the backlog. If it holds work, the worker takes the
 * head and keeps running; otherwise it gives up its slot and ends. One worker therefore
 * drains many backlog items, and there is no dispatcher thread.
 * < pre >
 * maxActive = 1
 * submit(A) → worker-1 runs A
 * submit(B) → backlog [B]
 * submit(C) → backlog [B, C]
 * A returns  → worker-1 runs B, backlog [C]
 * B returns  → worker-1 runs C, backlog []
 * C returns  → worker-1 ends, queue idle
 * </pre >
 * <p>
 * Backlogged tasks run in submission order. Tasks admitted directly may overtake backlog items
 * submitted earlier, so ordering is only guaranteed within the backlog.
 * <p>
 * < p >< b >Idleness:</b >
 * {@link #idle()} hands out an {@link IdleSignal} that fires once no task runs and the backlog
 * is empty. It fires after the last worker has given up its slot, outside the queue's lock, so
 * stages attached to {@link IdleSignal#toFuture()} run on that worker thread without blocking
 * other callers of the queue.
 * <p>
 * < p >< b >Faults:</b >
 * An exception thrown by a task goes to the {@link TaskFaultHandler} and the worker carries on.
 * An {@link Error} ends the worker thread, but only after its slot has been passed to the next
 * backlog item or released.
 * <p>
 * The queue has no shutdown. Workers run on daemon threads by default, so backlog items left
 * at JVM exit never run.
 *
 * @see Task
 * @see TaskContext
 */
public class WorkQueue {

  private static final Logger logger = LoggerFactory.getLogger ( WorkQueue.class );

  static final String DEFAULT_NAME = "workqueue";

  private final String           name;
  private final int              maxActive;
  private final Executor         workers;
  private final TaskFaultHandler faultHandler;

  private final ReentrantLock lock = new ReentrantLock ();

  // Guarded by lock
  private final Deque < Pending > backlog = new ArrayDeque <> ();
  private       int               active;
  private       IdleSignal        idle;

  private record Pending( TaskContext context, Task task ) {
  }

  /**
   * Creates a queue named {@value #DEFAULT_NAME} running workers on daemon threads.
   *
   * @param maxActive maximum number of tasks running at once
   * @throws InvalidCapacityException if {@code maxActive < 1}
   */
  public WorkQueue ( int maxActive ) {
    this ( DEFAULT_NAME, maxActive );
  }

  /**
   * Creates a named queue running workers on daemon threads.
   *
   * @param name      queue name, used for worker threads and log messages
   * @param maxActive maximum number of tasks running at once
   * @throws InvalidCapacityException if {@code maxActive < 1}
   */
  public WorkQueue ( String name, int maxActive ) {
    this ( builder ().name ( name ).maxActive ( maxActive ) );
  }

  private WorkQueue ( Builder builder ) {
    Objects.requireNonNull ( builder.name, "name cannot be null" );
    if ( builder.name.isBlank () ) {
      throw new IllegalArgumentException ( "name cannot be blank" );
    }
    if ( builder.maxActive < 1 ) {
      throw new InvalidCapacityException ( builder.maxActive );
    }
    this.name = builder.name;
    this.maxActive = builder.maxActive;
    this.faultHandler = builder.faultHandler;
    if ( builder.executor != null ) {
      this.workers = builder.executor;
    } else {
      ThreadFactory threads = new WorkerThreadFactory ( builder.threadNamePrefix, name, builder.daemonThreads );
      this.workers = worker -> threads.newThread ( worker ).start ();
    }
    logger.debug ( "Created work queue '{}' with maxActive={}", name, maxActive );
  }

  /**
   * Creates a queue from {@link WorkQueueConfig#forQueue(String)}.
   *
   * @param name queue name, also selects {@code workqueue.<name>.*} overrides
   * @throws InvalidCapacityException if the configured capacity is below one
   */
  public static WorkQueue fromConfig ( String name ) {
    WorkQueueConfig config = WorkQueueConfig.forQueue ( name );
    return builder ()
      .name ( name )
      .maxActive ( config.getInt ( WorkQueueConfig.MAX_ACTIVE ) )
      .threadNamePrefix ( config.getString ( WorkQueueConfig.THREAD_NAME_PREFIX, DEFAULT_NAME ) )
      .daemonThreads ( config.getBoolean ( WorkQueueConfig.DAEMON_THREADS, true ) )
      .build ();
  }

  public static Builder builder () {
    return new Builder ();
  }

  /**
   * Submits a task with the {@link TaskContext#background() background} context.
   *
   * @see #submit(TaskContext, Task)
   */
  public void submit ( Task task ) {
    submit ( TaskContext.background (), task );
  }

  /**
   * Submits a task. Returns without waiting for the task to start.
   * <p>
   * If a slot is free the task starts on a new worker; otherwise it joins the tail of the
   * backlog. {@code context} is handed to the task unchanged whenever it eventually runs.
   *
   * @param context context passed to {@link Task#execute(TaskContext)}
   * @param task    the work
   */
  public void submit ( TaskContext context, Task task ) {
    Objects.requireNonNull ( context, "context cannot be null" );
    Objects.requireNonNull ( task, "task cannot be null" );
    Pending pending = new Pending ( context, task );

    lock.lock ();
    try {
      if ( active == maxActive ) {
        backlog.addLast ( pending );
        logger.trace ( "Work queue '{}' at capacity, backlog={}", name, backlog.size () );
        return;
      }
      if ( active == 0 ) {
        // Leaving idle: the fired signal stays fired, later idle() calls get a new one
        idle = null;
      }
      active++;
    } finally {
      lock.unlock ();
    }

    workers.execute ( new Worker ( pending ) );
  }

  /**
   * Returns the signal that fires when this queue is next idle.
   * <p>
   * On an idle queue the returned signal has already fired. While the queue is busy every
   * call returns the same instance.
   */
  public IdleSignal idle () {
    lock.lock ();
    try {
      if ( idle == null ) {
        idle = new IdleSignal ( active == 0 );
      }
      return idle;
    } finally {
      lock.unlock ();
    }
  }

  /**
   * Blocks until the queue is idle.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void awaitIdle () throws InterruptedException {
    idle ().await ();
  }

  /**
   * Blocks until the queue is idle or the timeout elapses.
   *
   * @return true if the queue went idle, false on timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean awaitIdle ( long timeout, TimeUnit unit ) throws InterruptedException {
    return idle ().await ( timeout, unit );
  }

  /**
   * @return number of tasks waiting for a slot, not counting running tasks
   */
  public int backlogLength () {
    lock.lock ();
    try {
      return backlog.size ();
    } finally {
      lock.unlock ();
    }
  }

  /**
   * @return number of slots currently held by workers
   */
  public int activeCount () {
    lock.lock ();
    try {
      return active;
    } finally {
      lock.unlock ();
    }
  }

  public int maxActive () {
    return maxActive;
  }

  public String name () {
    return name;
  }

  /**
   * Called by a worker that finished a task. Returns the next backlog item for the worker to
   * run, or null after releasing the worker's slot.
   */
  private Pending handOff () {
    IdleSignal reached;
    lock.lock ();
    try {
      Pending next = backlog.pollFirst ();
      if ( next != null ) {
        return next;
      }
      reached = --active == 0 ? idle : null;
    } finally {
      lock.unlock ();
    }
    // Fired outside the lock: completing the signal runs callers' future stages on this thread
    if ( reached != null ) {
      reached.fire ();
    }
    return null;
  }

  /**
   * Passes the slot of a worker killed by an {@link Error} to a replacement worker, or releases
   * it. A backlog item whose replacement worker cannot be started is dropped and the next one
   * is tried, so the slot is never lost.
   */
  private void replaceWorker () {
    Pending successor = handOff ();
    while ( successor != null ) {
      try {
        workers.execute ( new Worker ( successor ) );
        return;
      } catch ( RuntimeException | Error e ) {
        logger.error ( "Could not start worker for work queue '{}', dropping task {}", name, successor.task (), e );
        successor = handOff ();
      }
    }
  }

  private void report ( Task task, Exception cause ) {
    try {
      faultHandler.taskFailed ( name, task, cause );
    } catch ( RuntimeException e ) {
      e.addSuppressed ( cause );
      logger.error ( "Fault handler failed in work queue '{}'", name, e );
    }
  }

  @Override
  public String toString () {
    lock.lock ();
    try {
      return "WorkQueue[name=" + name + ", active=" + active + ", backlog=" + backlog.size () + ", maxActive=" + maxActive + "]";
    } finally {
      lock.unlock ();
    }
  }

  /**
   * Runs its first task, then keeps taking backlog items until the backlog is empty.
   */
  private final class Worker implements Runnable {

    private Pending current;

    Worker ( Pending first ) {
      this.current = first;
    }

    @Override
    public void run () {
      logger.debug ( "Worker started for work queue '{}'", name );
      try {
        while ( current != null ) {
          execute ( current );
          current = handOff ();
        }
      } finally {
        if ( current != null ) {
          // Error thrown by the task: keep the backlog moving before the thread dies
          replaceWorker ();
        }
        logger.debug ( "Worker ended for work queue '{}'", name );
      }
    }

    private void execute ( Pending pending ) {
      try {
        pending.task ().execute ( pending.context () );
      } catch ( Exception e ) {
        report ( pending.task (), e );
      } finally {
        // An interrupt aimed at this task must not reach the next one
        Thread.interrupted ();
      }
    }
  }

  /**
   * Builder for {@link WorkQueue}.
   */
  public static final class Builder {

    private String           name             = DEFAULT_NAME;
    private int              maxActive;
    private Executor         executor;
    private String           threadNamePrefix = DEFAULT_NAME;
    private boolean          daemonThreads    = true;
    private TaskFaultHandler faultHandler     = LoggingFaultHandler.INSTANCE;

    private Builder () {
    }

    public Builder name ( String name ) {
      this.name = name;
      return this;
    }

    public Builder maxActive ( int maxActive ) {
      this.maxActive = maxActive;
      return this;
    }

    /**
     * Runs workers on {@code executor} instead of dedicated threads. The executor must run
     * every worker it receives; a rejected or dropped worker leaks its slot.
     */
    public Builder executor ( Executor executor ) {
      this.executor = Objects.requireNonNull ( executor, "executor cannot be null" );
      return this;
    }

    /**
     * Ignored when an {@link #executor(Executor)} is set.
     */
    public Builder threadNamePrefix ( String threadNamePrefix ) {
      this.threadNamePrefix = Objects.requireNonNull ( threadNamePrefix, "threadNamePrefix cannot be null" );
      return this;
    }

    /**
     * Ignored when an {@link #executor(Executor)} is set.
     */
    public Builder daemonThreads ( boolean daemonThreads ) {
      this.daemonThreads = daemonThreads;
      return this;
    }

    public Builder faultHandler ( TaskFaultHandler faultHandler ) {
      this.faultHandler = Objects.requireNonNull ( faultHandler, "faultHandler cannot be null" );
      return this;
    }

    /**
     * @throws InvalidCapacityException if {@code maxActive < 1}
     */
    public WorkQueue build () {
      return new WorkQueue ( this );
    }
  }
}
