package com.pervasivecode.utils.boundedqueue;

import static com.google.common.base.Preconditions.checkNotNull;
import java.util.ArrayDeque;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import javax.annotation.Nonnull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import com.pervasivecode.utils.boundedqueue.api.BoundedQueue;

/**
 * This BoundedQueue implementation holds its elements in a fixed-capacity buffer guarded by a
 * single lock, with one condition that producers wait on while the buffer is full and another that
 * consumers wait on while the buffer is empty and the queue is still open.
 * <p>
 * Closing the queue wakes every waiting thread: blocked producers then fail with
 * {@link QueueClosedException}, and blocked consumers either take one of the remaining elements or
 * observe that the queue is closed and empty.
 * <p>
 * No fairness is guaranteed among threads waiting on the same condition. Only the order of the
 * queue's contents is FIFO.
 *
 * @param <E> The type of object that can be sent through the LockingBoundedQueue.
 */
public class LockingBoundedQueue<E> implements BoundedQueue<E> {
  private static final Logger logger = LoggerFactory.getLogger(LockingBoundedQueue.class);

  private final int capacity;

  // All of the following are guarded by lock.
  private final ArrayDeque<E> buffer;
  private boolean closed = false;

  private final ReentrantLock lock = new ReentrantLock();
  private final Condition notFull = lock.newCondition();
  private final Condition notEmptyOrClosed = lock.newCondition();

  /**
   * Create an empty, open queue.
   *
   * @param capacity The maximum number of elements the queue will hold.
   * @throws InvalidCapacityException if capacity is not positive.
   */
  public LockingBoundedQueue(int capacity) {
    if (capacity <= 0) {
      throw new InvalidCapacityException(capacity);
    }
    this.capacity = capacity;
    this.buffer = new ArrayDeque<>(capacity);
  }

  //
  // Methods from QueueEntrance
  //

  @Override
  public void close() {
    lock.lock();
    try {
      if (closed) {
        return;
      }
      closed = true;
      logger.debug("Closed queue with {} buffered element(s).", buffer.size());
      notFull.signalAll();
      notEmptyOrClosed.signalAll();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean isClosed() {
    lock.lock();
    try {
      return closed;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void put(@Nonnull E element) throws InterruptedException {
    checkNotNull(element, "Null elements are not allowed");
    lock.lockInterruptibly();
    try {
      while (!closed && buffer.size() == capacity) {
        notFull.await();
      }
      enqueue(element);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean tryPut(@Nonnull E element, long timeout, @Nonnull TimeUnit timeoutUnit)
      throws InterruptedException {
    checkNotNull(element, "Null elements are not allowed");
    checkNotNull(timeoutUnit);
    long remainingNanos = timeoutUnit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (!closed && buffer.size() == capacity) {
        if (remainingNanos <= 0) {
          return false;
        }
        remainingNanos = notFull.awaitNanos(remainingNanos);
      }
      enqueue(element);
      return true;
    } finally {
      lock.unlock();
    }
  }

  // Must be called with the lock held, once the buffer has room or the queue is closed.
  private void enqueue(E element) {
    if (closed) {
      throw new QueueClosedException();
    }
    buffer.addLast(element);
    notEmptyOrClosed.signal();
  }

  //
  // Methods from QueueExit
  //

  @Override
  public Optional<E> get() throws InterruptedException {
    lock.lockInterruptibly();
    try {
      while (!closed && buffer.isEmpty()) {
        notEmptyOrClosed.await();
      }
      return dequeue();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<E> tryGet(long timeout, @Nonnull TimeUnit timeoutUnit)
      throws InterruptedException {
    checkNotNull(timeoutUnit);
    long remainingNanos = timeoutUnit.toNanos(timeout);
    lock.lockInterruptibly();
    try {
      while (!closed && buffer.isEmpty()) {
        if (remainingNanos <= 0) {
          return Optional.empty();
        }
        remainingNanos = notEmptyOrClosed.awaitNanos(remainingNanos);
      }
      return dequeue();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public Optional<E> tryGetNow() {
    lock.lock();
    try {
      return dequeue();
    } finally {
      lock.unlock();
    }
  }

  // Must be called with the lock held. Returns empty if there is nothing buffered.
  private Optional<E> dequeue() {
    E head = buffer.pollFirst();
    if (head == null) {
      return Optional.empty();
    }
    notFull.signal();
    return Optional.of(head);
  }

  @Override
  public boolean isClosedAndEmpty() {
    lock.lock();
    try {
      return closed && buffer.isEmpty();
    } finally {
      lock.unlock();
    }
  }

  //
  // Methods from BoundedQueue
  //

  @Override
  public int capacity() {
    return capacity;
  }

  @Override
  public int size() {
    lock.lock();
    try {
      return buffer.size();
    } finally {
      lock.unlock();
    }
  }
}
