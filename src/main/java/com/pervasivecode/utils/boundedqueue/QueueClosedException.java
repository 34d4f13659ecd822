package com.pervasivecode.utils.boundedqueue;

/**
 * Thrown when an element is put into a queue that has already been closed. This indicates a
 * producer that kept producing after its input was declared finished, so it is not retried.
 */
public class QueueClosedException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  public static final String MESSAGE = "Queue is already closed.";

  public QueueClosedException() {
    super(MESSAGE);
  }
}
