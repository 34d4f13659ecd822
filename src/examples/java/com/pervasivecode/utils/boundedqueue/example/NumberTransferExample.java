package com.pervasivecode.utils.boundedqueue.example;

import java.io.PrintWriter;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import com.google.common.collect.ContiguousSet;
import com.google.common.collect.DiscreteDomain;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Range;
import com.pervasivecode.utils.boundedqueue.LockingBoundedQueue;
import com.pervasivecode.utils.boundedqueue.Roles;
import com.pervasivecode.utils.boundedqueue.api.BoundedQueue;

/**
 * Example of how to use {@link LockingBoundedQueue} and {@link Roles} directly: one producer hands
 * ten numbers through a queue that only holds three at a time to one consumer, which collects them
 * in a list.
 */
public class NumberTransferExample implements ExampleApplication {
  private static final int QUEUE_CAPACITY = 3;

  @Override
  public void runExample(PrintWriter output) throws Exception {
    ImmutableList<Integer> source =
        ContiguousSet.create(Range.closedOpen(0, 10), DiscreteDomain.integers()).asList();
    List<Integer> destination = new ArrayList<>();

    BoundedQueue<Integer> queue = new LockingBoundedQueue<>(QUEUE_CAPACITY);

    ExecutorService es = Executors.newFixedThreadPool(2);
    try {
      Future<Integer> produced = es.submit(Roles.producer(source, queue, true));
      Future<Integer> consumed = es.submit(Roles.consumer(queue, destination));
      produced.get();
      consumed.get();
    } finally {
      es.shutdownNow();
    }

    output.println("Source:      " + source);
    output.println("Destination: " + destination);
  }

  public static void main(String[] args) throws Exception {
    new NumberTransferExample().runExample(new PrintWriter(System.out, true));
  }
}
