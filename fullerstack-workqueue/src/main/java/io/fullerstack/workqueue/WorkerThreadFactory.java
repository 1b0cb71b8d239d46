package io.fullerstack.workqueue;

import java.util.Objects;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Creates worker threads named {@code <prefix>-<queue>-<n>}, numbered from 1.
 */
public class WorkerThreadFactory implements ThreadFactory {

  private final String        baseName;
  private final boolean       daemon;
  private final AtomicInteger counter = new AtomicInteger ();

  public WorkerThreadFactory ( String prefix, String queueName, boolean daemon ) {
    Objects.requireNonNull ( prefix, "prefix cannot be null" );
    Objects.requireNonNull ( queueName, "queueName cannot be null" );
    this.baseName = prefix + "-" + queueName + "-";
    this.daemon = daemon;
  }

  @Override
  public Thread newThread ( Runnable runnable ) {
    Thread thread = new Thread ( runnable, baseName + counter.incrementAndGet () );
    thread.setDaemon ( daemon );
    return thread;
  }
}
