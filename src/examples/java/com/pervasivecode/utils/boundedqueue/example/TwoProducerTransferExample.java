package com.pervasivecode.utils.boundedqueue.example;

import java.io.PrintWriter;
import java.util.List;
import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.Iterables;
import com.google.common.collect.Ordering;
import com.google.common.collect.Range;
import com.pervasivecode.utils.boundedqueue.coordination.TransferConfig;
import com.pervasivecode.utils.boundedqueue.coordination.TransferCoordinator;
import com.pervasivecode.utils.boundedqueue.coordination.TransferResult;

/**
 * Example of how to use {@link TransferCoordinator} with two producers writing into a queue that
 * holds a single element. The elements from the two producers are interleaved unpredictably, but
 * each producer's own elements arrive in the order it produced them.
 */
public class TwoProducerTransferExample implements ExampleApplication {
  private static ImmutableList<Integer> range(int fromInclusive, int toExclusive) {
    return ContiguousSet.create(Range.closedOpen(fromInclusive, toExclusive),
        DiscreteDomain.integers()).asList();
  }

  @Override
  public void runExample(PrintWriter output) throws Exception {
    ImmutableList<Integer> low = range(0, 50);
    ImmutableList<Integer> high = range(100, 150);

    TransferConfig config = TransferConfig.builder().setQueueCapacity(1).build();
    TransferResult<Integer> result =
        new TransferCoordinator(config).transfer(ImmutableList.of(low, high));

    ImmutableList<Integer> received = result.allItemsReceived();
    boolean exactlyOnce = received.size() == low.size() + high.size()
        && ImmutableSet.copyOf(received).equals(ImmutableSet.copyOf(Iterables.concat(low, high)));

    output.println("Produced " + result.itemsProduced() + " items.");
    output.println("Received " + result.itemsReceived() + " items.");
    output.println("Every item received exactly once: " + exactlyOnce);
    output.println("Low producer order preserved: " + isInOrder(received, low));
    output.println("High producer order preserved: " + isInOrder(received, high));
  }

  private static boolean isInOrder(List<Integer> received, ImmutableList<Integer> producerItems) {
    ImmutableList<Integer> fromProducer = ImmutableList
        .copyOf(Iterables.filter(received, producerItems::contains));
    return fromProducer.equals(producerItems) && Ordering.natural().isOrdered(fromProducer);
  }

  public static void main(String[] args) throws Exception {
    new TwoProducerTransferExample().runExample(new PrintWriter(System.out, true));
  }
}
