package io.fullerstack.workqueue;

/**
 * Receives exceptions thrown by tasks running on a {@link WorkQueue}.
 * <p>
 * Called on the worker thread after the task returned abruptly, before the worker
 * moves on to the next backlog item. Implementations should be quick and must not
 * block for long, since the worker still holds its execution slot.
 *
 * @see LoggingFaultHandler
 */
@FunctionalInterface
public interface TaskFaultHandler {

  /**
   * @param queueName name of the queue the task ran on
   * @param task      the failed task
   * @param cause     what the task threw
   */
  void taskFailed ( String queueName, Task task, Exception cause );
}
