package io.fullerstack.workqueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Default {@link TaskFaultHandler}: logs the failure at ERROR with its stack trace.
 */
public final class LoggingFaultHandler implements TaskFaultHandler {

  private static final Logger logger = LoggerFactory.getLogger ( LoggingFaultHandler.class );

  public static final LoggingFaultHandler INSTANCE = new LoggingFaultHandler ();

  private LoggingFaultHandler () {
  }

  @Override
  public void taskFailed ( String queueName, Task task, Exception cause ) {
    logger.error ( "Task {} failed in work queue '{}'", task, queueName, cause );
  }
}
