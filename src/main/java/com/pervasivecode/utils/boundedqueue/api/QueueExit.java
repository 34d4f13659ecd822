package com.pervasivecode.utils.boundedqueue.api;

import java.util.Optional;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nonnull;

/**
 * The output side of a bounded queue, allowing callers to take elements from the queue until it is
 * closed and drained.
 * <p>
 * Running out of elements is not an error: every method here signals "closed and empty" by
 * returning Optional.empty().
 *
 * @param <E> The type of object that can be taken from the queue.
 */
public interface QueueExit<E> {
  /**
   * Block for an unlimited amount of time, taking an element.
   * <p>
   * If the caller blocks on an empty queue and the queue is closed during that time, the return
   * value will be Optional.empty().
   *
   * @return An element if one was available before the queue was closed and drained, or
   *         Optional.empty if none will ever be available again.
   * @throws InterruptedException if the calling thread is interrupted while waiting.
   */
  public @Nonnull Optional<E> get() throws InterruptedException;

  /**
   * Block for up to a specified amount of time, taking an element. If the timeout expires, or if
   * the queue is closed while the caller is blocked waiting for an element, the return value will
   * be Optional.empty(). Use {@link #isClosedAndEmpty()} to tell the two cases apart.
   *
   * @param timeout The magnitude of the timeout value.
   * @param timeoutUnit The units of the timeout value.
   * @return An element (if one was available in time), or Optional.empty() otherwise.
   * @throws InterruptedException if the calling thread is interrupted while waiting.
   */
  public @Nonnull Optional<E> tryGet(long timeout, @Nonnull TimeUnit timeoutUnit)
      throws InterruptedException;

  /**
   * Take an element if it's available immediately. Otherwise, Optional.empty() is returned.
   *
   * @return An immediately-available element, or Optional.empty if no element was available.
   */
  public @Nonnull Optional<E> tryGetNow();

  /**
   * Return true if both of the following are true:
   * <ul>
   * <li>the queue has been closed (so that new elements cannot be added), and
   * <li>there are no remaining elements in the queue.
   * </ul>
   * This means that this queue will never return an element again.
   * <p>
   * A false return value means that this queue <i>may</i> return elements in the future. It is not
   * a guarantee, though: other consumers may take the remaining elements first.
   *
   * @return Whether the queue is both closed and empty.
   */
  public boolean isClosedAndEmpty();
}
