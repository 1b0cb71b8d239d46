package io.fullerstack.workqueue;

/**
 * Thrown when a {@link WorkQueue} is created with a capacity below one.
 */
public class InvalidCapacityException extends IllegalArgumentException {

  private static final long serialVersionUID = 1L;

  private final int capacity;

  public InvalidCapacityException ( int capacity ) {
    super ( "maxActive must be > 0 (was " + capacity + ")" );
    this.capacity = capacity;
  }

  /**
   * @return the rejected capacity
   */
  public int capacity () {
    return capacity;
  }
}
