package com.pervasivecode.utils.boundedqueue.coordination;

import com.google.auto.value.AutoValue;
import com.google.common.collect.ImmutableList;

/**
 * The outcome of a successful {@link TransferCoordinator#transfer} call.
 *
 * @param <E> The type of element that was transferred.
 */
@AutoValue
public abstract class TransferResult<E> {
  protected TransferResult() {}

  public static <E> TransferResult<E> create(ImmutableList<ImmutableList<E>> consumerOutputs,
      int itemsProduced) {
    return new AutoValue_TransferResult<>(consumerOutputs, itemsProduced);
  }

  /**
   * The elements received by each consumer, one list per consumer, each in the order that
   * consumer took them from the queue.
   *
   * @return the per-consumer outputs.
   */
  public abstract ImmutableList<ImmutableList<E>> consumerOutputs();

  /**
   * The total number of elements put into the queue by all producers.
   *
   * @return the number of elements produced.
   */
  public abstract int itemsProduced();

  public int itemsReceived() {
    int total = 0;
    for (ImmutableList<E> output : consumerOutputs()) {
      total += output.size();
    }
    return total;
  }

  /**
   * Every element received by any consumer, concatenated in consumer order. With a single consumer
   * this is exactly the order in which elements left the queue; with several consumers the
   * relative order of elements taken by different consumers is not meaningful.
   *
   * @return all received elements.
   */
  public ImmutableList<E> allItemsReceived() {
    ImmutableList.Builder<E> builder = ImmutableList.builder();
    for (ImmutableList<E> output : consumerOutputs()) {
      builder.addAll(output);
    }
    return builder.build();
  }
}
