package io.fullerstack.workqueue;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * One-shot notification that a {@link WorkQueue} has become idle.
 * <p>
 * < p >A signal fires at most once and never resets. Any number of threads may wait on
 * it concurrently without further synchronization. When the queue picks up new work
 * after being idle it drops its reference to the fired signal, and the next
 * {@link WorkQueue#idle()} call hands out a fresh one.
 * <p>
 * < p >< b >Usage:</b >
 * < pre >
 * IdleSignal idle = queue.idle();
 * if ( !idle.await ( 5, TimeUnit.SECONDS ) ) {
 *   logger.warn ( "queue still busy" );
 * }
 * </pre >
 */
public final class IdleSignal {

  private final CountDownLatch            latch  = new CountDownLatch ( 1 );
  private final CompletableFuture < Void > future = new CompletableFuture <> ();

  IdleSignal ( boolean fired ) {
    if ( fired ) {
      fire ();
    }
  }

  // Only the owning queue fires, after releasing its lock
  void fire () {
    latch.countDown ();
    future.complete ( null );
  }

  /**
   * @return true once the queue has gone idle
   */
  public boolean isFired () {
    return latch.getCount () == 0;
  }

  /**
   * Blocks until the signal fires.
   *
   * @throws InterruptedException if interrupted while waiting
   */
  public void await () throws InterruptedException {
    latch.await ();
  }

  /**
   * Blocks until the signal fires or the timeout elapses.
   *
   * @return true if the signal fired, false on timeout
   * @throws InterruptedException if interrupted while waiting
   */
  public boolean await ( long timeout, TimeUnit unit ) throws InterruptedException {
    return latch.await ( timeout, unit );
  }

  /**
   * Returns a future completing when the signal fires. Completing or cancelling the
   * returned future has no effect on the signal.
   */
  public CompletableFuture < Void > toFuture () {
    return future.copy ();
  }

  @Override
  public String toString () {
    return "IdleSignal[fired=" + isFired () + "]";
  }
}
