package io.fullerstack.workqueue;

/**
 * A unit of work submitted to a {@link WorkQueue}.
 * <p>
 * The queue passes the {@link TaskContext} given at submission time to
 * {@link #execute(TaskContext)} unchanged. Honouring cancellation and deadlines is
 * up to the task; the queue never interrupts a running task and produces no result.
 *
 * @see WorkQueue#submit(TaskContext, Task)
 */
@FunctionalInterface
public interface Task {

  /**
   * Runs the work.
   *
   * @param context the context supplied to {@link WorkQueue#submit(TaskContext, Task)}
   * @throws Exception any failure; it is reported to the queue's {@link TaskFaultHandler}
   */
  void execute ( TaskContext context ) throws Exception;
}
