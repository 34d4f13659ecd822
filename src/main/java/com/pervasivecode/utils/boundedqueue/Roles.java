package com.pervasivecode.utils.boundedqueue;

import static com.google.common.base.Preconditions.checkNotNull;
import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.Callable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import com.pervasivecode.utils.boundedqueue.api.QueueEntrance;
import com.pervasivecode.utils.boundedqueue.api.QueueExit;

/**
 * Factory methods for the two sides of a producer/consumer exchange. Each returns a plain Callable
 * that can be run on any thread or submitted to any ExecutorService.
 */
public class Roles {
  private static final Logger logger = LoggerFactory.getLogger(Roles.class);

  private Roles() {}

  /**
   * Create a producer task that puts every element of a source into a QueueEntrance, in source
   * order.
   * <p>
   * If putting an element fails (for example because the entrance was closed by someone else), or
   * if the source throws while being iterated, the exception propagates out of {@link
   * Callable#call()} and no further elements are put.
   *
   * @param source The elements to put. The source is only read, never modified.
   * @param entrance The QueueEntrance into which elements will be put.
   * @param closeEntranceWhenDone If true, the task will close the entrance after the last element
   *        has been put. This is only appropriate when this task is the only producer for the
   *        entrance. With several producers, leave this false and use a LastProducerCloser.
   * @return A Callable that returns the number of elements it put.
   */
  public static <E> Callable<Integer> producer(Iterable<? extends E> source,
      QueueEntrance<E> entrance, boolean closeEntranceWhenDone) {
    checkNotNull(source);
    checkNotNull(entrance);
    return () -> {
      String name = Thread.currentThread().getName();
      logger.info("Producer {} started.", name);
      int numPut = 0;
      for (E element : source) {
        entrance.put(element);
        numPut++;
      }
      if (closeEntranceWhenDone) {
        logger.info("Producer {} finished after {} element(s). Closing queue.", name, numPut);
        entrance.close();
      } else {
        logger.info("Producer {} finished after {} element(s).", name, numPut);
      }
      return numPut;
    };
  }

  /**
   * Create a consumer task that takes elements from a QueueExit and adds them to a destination
   * collection, in the order received, until the queue is closed and empty.
   * <p>
   * When several consumers share one queue, each one's destination holds a subsequence of the
   * queue's contents in dequeue order; how elements are split between consumers is unspecified.
   *
   * @param exit The QueueExit from which elements will be taken.
   * @param destination The collection that receives the elements. Only this task should modify it
   *        while the task is running.
   * @return A Callable that returns the number of elements it received.
   */
  public static <E> Callable<Integer> consumer(QueueExit<E> exit,
      Collection<? super E> destination) {
    checkNotNull(exit);
    checkNotNull(destination);
    return () -> {
      String name = Thread.currentThread().getName();
      logger.info("Consumer {} started.", name);
      int numReceived = 0;
      Optional<E> taken = exit.get();
      while (taken.isPresent()) {
        destination.add(taken.get());
        numReceived++;
        taken = exit.get();
      }
      logger.info("Consumer {} exiting after {} element(s). Queue closed.", name, numReceived);
      return numReceived;
    };
  }
}
