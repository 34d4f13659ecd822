package com.pervasivecode.utils.boundedqueue.coordination;

import static com.google.common.base.Preconditions.checkNotNull;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.pervasivecode.utils.boundedqueue.LockingBoundedQueue;
import com.pervasivecode.utils.boundedqueue.Roles;
import com.pervasivecode.utils.boundedqueue.api.BoundedQueue;
import com.pervasivecode.utils.boundedqueue.api.QueueEntrance;

/**
 * Moves elements from any number of sources to a fixed number of consumers through a single
 * {@link LockingBoundedQueue}, running every producer and consumer on its own thread.
 * <p>
 * Each call to {@link #transfer} owns a fresh queue and a fresh thread pool, and does not return
 * until every task it started has ended, or, if it was interrupted, until its interrupted tasks
 * have ended or {@link #TERMINATION_TIMEOUT_SECONDS} have passed. The queue is closed by the last producer to finish (see
 * {@link LastProducerCloser}), so consumers keep draining until all sources are exhausted.
 * <p>
 * Failures inside tasks cannot be observed by the queue, so the coordinator records them and
 * rethrows them as a single {@link TransferFailedException} once everything has shut down. A
 * consumer that fails closes the queue on its way out, so producers blocked on a full queue fail
 * fast instead of waiting forever for space.
 */
public class TransferCoordinator {
  private static final Logger logger = LoggerFactory.getLogger(TransferCoordinator.class);

  /** How long to wait for interrupted tasks to stop before giving up on them. */
  public static final long TERMINATION_TIMEOUT_SECONDS = 10;

  private final TransferConfig config;

  /**
   * Create a TransferCoordinator with the specified configuration.
   *
   * @param config An object containing configuration information for the transfers that this
   *        coordinator will run.
   */
  public TransferCoordinator(TransferConfig config) {
    // Config values were already validated by TransferConfig.Builder#build().
    this.config = checkNotNull(config);
  }

  /**
   * Run one producer per source and the configured number of consumers, wait for all of them to
   * finish, and return what the consumers received.
   *
   * @param sources The sources to produce from. Each source is read by exactly one producer, in
   *        order; elements from different sources may be interleaved arbitrarily in the queue.
   * @return The elements received by each consumer.
   * @throws InterruptedException if the calling thread is interrupted while waiting for the tasks.
   *         In that case every task is interrupted, the queue is closed, and the interrupted tasks
   *         are given up to {@link #TERMINATION_TIMEOUT_SECONDS} to stop before this is thrown.
   * @throws TransferFailedException if any producer or consumer task failed.
   */
  public <E> TransferResult<E> transfer(List<? extends Iterable<? extends E>> sources)
      throws InterruptedException, TransferFailedException {
    return transfer(sources, ArrayList::new);
  }

  /**
   * Like {@link #transfer(List)}, but each consumer adds the elements it receives to a collection
   * obtained from destinationFactory instead of to a plain list. The factory is called once per
   * consumer, on the calling thread, just before that consumer starts.
   *
   * @param sources The sources to produce from.
   * @param destinationFactory Supplies one new, empty destination collection per consumer.
   * @return The elements received by each consumer, copied from their destination collections in
   *         iteration order.
   * @throws InterruptedException if the calling thread is interrupted while waiting for the tasks.
   * @throws TransferFailedException if any producer or consumer task failed.
   */
  public <E> TransferResult<E> transfer(List<? extends Iterable<? extends E>> sources,
      Supplier<? extends Collection<E>> destinationFactory)
      throws InterruptedException, TransferFailedException {
    checkNotNull(destinationFactory);
    ImmutableList<Iterable<? extends E>> sourceList = ImmutableList.copyOf(sources);
    int numConsumers = config.numConsumers();

    BoundedQueue<E> queue = new LockingBoundedQueue<>(config.queueCapacity());
    LastProducerCloser closer = new LastProducerCloser(queue, sourceList.size());

    // Every task must be able to run at once, or producers and consumers could starve each other.
    int numThreads = sourceList.size() + numConsumers;
    ExecutorService executor = Executors.newFixedThreadPool(numThreads,
        new ThreadFactoryBuilder().setNameFormat(config.nameFormat()).build());

    logger.info("Starting transfer: {} producer(s), {} consumer(s), queue capacity {}.",
        sourceList.size(), numConsumers, queue.capacity());

    List<Future<Integer>> producerResults = new ArrayList<>(sourceList.size());
    List<Future<Integer>> consumerResults = new ArrayList<>(numConsumers);
    List<Collection<E>> destinations = new ArrayList<>(numConsumers);
    try {
      for (Iterable<? extends E> source : sourceList) {
        Callable<Integer> producer = Roles.producer(source, queue, false);
        producerResults.add(executor.submit(closer.reportingCompletion(producer)));
      }
      for (int i = 0; i < numConsumers; i++) {
        Collection<E> destination = checkNotNull(destinationFactory.get());
        destinations.add(destination);
        consumerResults.add(executor.submit(closingOnFailure(Roles.consumer(queue, destination),
            queue)));
      }

      List<Throwable> failures = new ArrayList<>();
      int itemsProduced = 0;
      for (Future<Integer> result : producerResults) {
        itemsProduced += awaitCount(result, failures);
      }
      for (Future<Integer> result : consumerResults) {
        awaitCount(result, failures);
      }

      if (!failures.isEmpty()) {
        logger.warn("Transfer failed: {} task(s) failed.", failures.size());
        throw new TransferFailedException(failures);
      }

      // Future.get() made each consumer's writes to its destination visible here.
      ImmutableList.Builder<ImmutableList<E>> outputs = ImmutableList.builder();
      for (Collection<E> destination : destinations) {
        outputs.add(ImmutableList.copyOf(destination));
      }
      TransferResult<E> result = TransferResult.create(outputs.build(), itemsProduced);
      logger.info("Transfer finished: {} element(s) produced, {} received.", itemsProduced,
          result.itemsReceived());
      return result;
    } finally {
      executor.shutdownNow();
      queue.close();
      if (!MoreExecutors.shutdownAndAwaitTermination(executor, TERMINATION_TIMEOUT_SECONDS,
          TimeUnit.SECONDS)) {
        logger.warn("Transfer tasks did not stop within {} seconds.", TERMINATION_TIMEOUT_SECONDS);
      }
    }
  }

  private static int awaitCount(Future<Integer> result, List<Throwable> failures)
      throws InterruptedException {
    try {
      return result.get();
    } catch (ExecutionException ee) {
      failures.add(ee.getCause());
      return 0;
    }
  }

  private static <V> Callable<V> closingOnFailure(Callable<V> consumer,
      QueueEntrance<?> entrance) {
    return () -> {
      try {
        return consumer.call();
      } catch (Throwable t) {
        logger.warn("Consumer failed; closing queue to release producers.", t);
        entrance.close();
        throw t;
      }
    };
  }
}
