package com.pervasivecode.utils.boundedqueue.coordination;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;
import java.util.concurrent.Callable;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import com.pervasivecode.utils.boundedqueue.api.QueueEntrance;

/**
 * Closes a QueueEntrance shared by several producers once the last of them has finished.
 * <p>
 * Every producer must report completion exactly once, whether it succeeded or failed. The report
 * that brings the count of running producers to zero closes the entrance, so no producer can close
 * the queue while another is still writing to it. A closer created for zero producers closes the
 * entrance immediately.
 */
public class LastProducerCloser {
  private static final Logger logger = LoggerFactory.getLogger(LastProducerCloser.class);

  private final QueueEntrance<?> entrance;
  private final AtomicInteger numRunningProducers;

  public LastProducerCloser(QueueEntrance<?> entrance, int numProducers) {
    this.entrance = checkNotNull(entrance);
    checkArgument(numProducers >= 0, "numProducers cannot be negative. Got %s", numProducers);
    this.numRunningProducers = new AtomicInteger(numProducers);
    if (numProducers == 0) {
      entrance.close();
    }
  }

  /**
   * Record that one producer has finished, closing the entrance if it was the last one.
   *
   * @throws IllegalStateException if every producer has already reported completion.
   */
  public void producerFinished() {
    int remaining = numRunningProducers.decrementAndGet();
    checkState(remaining >= 0, "More producers finished than were registered.");
    if (remaining == 0) {
      logger.debug("Last producer finished. Closing queue.");
      entrance.close();
    }
  }

  /** How many producers have not yet reported completion. */
  public int numRunningProducers() {
    return Math.max(0, numRunningProducers.get());
  }

  /**
   * Wrap a producer task so that it reports completion to this closer when it ends, however it
   * ends.
   *
   * @param producer The producer task, which should not close the entrance itself.
   * @return A task that runs the producer and then calls {@link #producerFinished()}.
   */
  public <V> Callable<V> reportingCompletion(Callable<V> producer) {
    checkNotNull(producer);
    return () -> {
      try {
        return producer.call();
      } finally {
        producerFinished();
      }
    };
  }
}
