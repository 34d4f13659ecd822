package com.pervasivecode.utils.boundedqueue.api;

/**
 * A bounded queue is a fixed-capacity FIFO blocking queue that you can close. After being closed,
 * a bounded queue will not accept new elements, but the elements it already holds can still be
 * taken.
 *
 * @param <E> The type of object that can be sent through the queue.
 */
public interface BoundedQueue<E> extends QueueEntrance<E>, QueueExit<E> {
  /**
   * The maximum number of elements this queue will hold before {@link #put} blocks.
   *
   * @return the capacity that the queue was created with.
   */
  public int capacity();

  /**
   * The number of elements currently held in the queue. Other threads may change this at any time,
   * so the value is only advisory.
   *
   * @return the number of buffered elements.
   */
  public int size();
}
