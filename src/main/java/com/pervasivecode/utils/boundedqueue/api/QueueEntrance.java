package com.pervasivecode.utils.boundedqueue.api;

import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;

/**
 * The input side of a bounded queue, allowing callers to put elements into the queue until it is
 * closed.
 *
 * @param <E> The type of object that can be put into the queue.
 */
public interface QueueEntrance<E> {
  /**
   * Close the entrance of the queue. After this has been called, no more elements will be
   * accepted, but any elements that have not yet been taken from the corresponding
   * {@link QueueExit} will still be available.
   * <p>
   * Closing an already-closed queue has no effect.
   */
  public void close();

  /**
   * Returns true if the entrance to the queue has been closed. This does not necessarily mean that
   * all of the elements that were put into the queue have been removed yet, though.
   *
   * @see QueueExit#isClosedAndEmpty() for a method that also verifies that all elements have been
   *      taken from the QueueExit.
   */
  public boolean isClosed();

  /**
   * Put an element in the queue, blocking as long as the queue is full.
   *
   * @param element The element to append to the tail of the queue.
   * @throws InterruptedException if the blocked thread is interrupted.
   * @throws com.pervasivecode.utils.boundedqueue.QueueClosedException if the queue is already
   *         closed, or is closed while the caller is blocked waiting for space.
   */
  public void put(@Nonnull E element) throws InterruptedException;

  /**
   * Put an element in the queue, blocking for up to a specified amount of time while the queue is
   * full.
   *
   * @param element The element to append to the tail of the queue.
   * @param timeout The magnitude of the timeout value.
   * @param timeoutUnit The units of the timeout value.
   * @return true if the element was added, or false if no space became available in time.
   * @throws InterruptedException if the blocked thread is interrupted.
   * @throws com.pervasivecode.utils.boundedqueue.QueueClosedException if the queue is already
   *         closed, or is closed while the caller is blocked waiting for space.
   */
  public boolean tryPut(@Nonnull E element, long timeout, @Nonnull TimeUnit timeoutUnit)
      throws InterruptedException;
}
