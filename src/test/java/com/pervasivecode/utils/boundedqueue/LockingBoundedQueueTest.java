package com.pervasivecode.utils.boundedqueue;

import static com.google.common.truth.Truth.assertThat;
import static java.util.concurrent.TimeUnit.MILLISECONDS;
import static java.util.concurrent.TimeUnit.SECONDS;
import static org.junit.Assert.fail;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeoutException;
import org.junit.After;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import com.pervasivecode.utils.boundedqueue.api.BoundedQueue;
import com.pervasivecode.utils.boundedqueue.testing.Repeat;
import com.pervasivecode.utils.boundedqueue.testing.RepeatRule;

public class LockingBoundedQueueTest {
  // Use NUM_REPEATS=500 for torture testing.
  private static final int NUM_REPEATS = 20;

  // How long to wait before concluding that a call is blocked.
  private static final long GRACE_PERIOD_MILLIS = 50;

  @Rule
  public RepeatRule rule = new RepeatRule();

  private ExecutorService es;

  @Before
  public void setup() {
    es = Executors.newCachedThreadPool();
  }

  @After
  public void tearDown() throws Exception {
    es.shutdownNow();
    es.awaitTermination(1, SECONDS);
  }

  private static void assertStillBlocked(Future<?> future) throws Exception {
    try {
      future.get(GRACE_PERIOD_MILLIS, MILLISECONDS);
      fail("Expected the call to still be blocked.");
    } catch (@SuppressWarnings("unused") TimeoutException te) {
      // expected
    }
  }

  // --------------------------------------------------------------------------
  //
  // Constructor tests
  //
  // --------------------------------------------------------------------------

  @Test
  public void constructor_shouldRejectZeroCapacity() {
    try {
      new LockingBoundedQueue<String>(0);
      fail("Expected InvalidCapacityException.");
    } catch (InvalidCapacityException ice) {
      assertThat(ice.capacity()).isEqualTo(0);
      assertThat(ice).hasMessageThat().contains("Got 0");
    }
  }

  @Test(expected = InvalidCapacityException.class)
  public void constructor_shouldRejectNegativeCapacity() {
    new LockingBoundedQueue<String>(-3);
  }

  @Test
  public void constructor_shouldCreateEmptyOpenQueue() {
    BoundedQueue<String> q = new LockingBoundedQueue<>(7);
    assertThat(q.capacity()).isEqualTo(7);
    assertThat(q.size()).isEqualTo(0);
    assertThat(q.isClosed()).isFalse();
    assertThat(q.isClosedAndEmpty()).isFalse();
  }

  // --------------------------------------------------------------------------
  //
  // Tests for put
  //
  // --------------------------------------------------------------------------

  @Test(expected = NullPointerException.class)
  public void put_withNullElement_shouldThrow() throws Exception {
    new LockingBoundedQueue<String>(1).put(null);
  }

  @Test
  public void put_withAvailableCapacity_shouldNotBlock() throws Exception {
    BoundedQueue<String> q = new LockingBoundedQueue<>(2);
    q.put("a");
    q.put("b");
    assertThat(q.size()).isEqualTo(2);
  }

  @Test
  @Repeat(times = NUM_REPEATS)
  public void put_onFullQueue_shouldBlockUntilNextGet() throws Exception {
    BoundedQueue<String> q = new LockingBoundedQueue<>(2);
    q.put("first");
    q.put("second");

    Future<?> blockedPut = es.submit(() -> {
      q.put("third");
      return null;
    });
    assertStillBlocked(blockedPut);
    assertThat(q.size()).isEqualTo(2);

    assertThat(q.get()).hasValue("first");

    blockedPut.get(1, SECONDS);
    assertThat(q.size()).isEqualTo(2);
    assertThat(q.get()).hasValue("second");
    assertThat(q.get()).hasValue("third");
  }

  @Test
  public void put_onClosedQueue_shouldImmediatelyFail() throws Exception {
    BoundedQueue<String> q = new LockingBoundedQueue<>(1);
    q.close();
    try {
      q.put("this should fail, since the queue is closed");
      fail("Expected QueueClosedException.");
    } catch (QueueClosedException qce) {
      assertThat(qce).hasMessageThat().isEqualTo(QueueClosedException.MESSAGE);
    }
    assertThat(q.size()).isEqualTo(0);
  }

  @Test
  public void put_onClosedFullQueue_shouldFailRatherThanBlock() throws Exception {
    BoundedQueue<String> q = new LockingBoundedQueue<>(1);
    q.put("filler");
    q.close();

    Future<?> putResult = es.submit(() -> {
      q.put("late");
      return null;
    });
    try {
      putResult.get(1, SECONDS);
      fail("Expected the put to fail.");
    } catch (ExecutionException ee) {
      assertThat(ee).hasCauseThat().isInstanceOf(QueueClosedException.class);
    }
  }

  @Test
  @Repeat(times = NUM_REPEATS)
  public void put_blockedOnFullQueue_shouldFailWhenQueueIsClosed() throws Exception {
    BoundedQueue<String> q = new LockingBoundedQueue<>(1);
    q.put("filler");

    Future<?> blockedPut = es.submit(() -> {
      q.put("never delivered");
      return null;
    });
    assertStillBlocked(blockedPut);

    q.close();
    try {
      blockedPut.get(1, SECONDS);
      fail("Expected the blocked put to fail.");
    } catch (ExecutionException ee) {
      assertThat(ee).hasCauseThat().isInstanceOf(QueueClosedException.class);
    }

    // The element that was buffered before closing is still there; the failed one is not.
    assertThat(q.get()).hasValue("filler");
    assertThat(q.get()).isEmpty();
  }

  @Test
  @Repeat(times = NUM_REPEATS)
  public void put_whenInterrupted_shouldThrowInterruptedException() throws Exception {
    BoundedQueue<String> q = new LockingBoundedQueue<>(1);
    q.put("filler");

    CountDownLatch putInterrupted = new CountDownLatch(1);
    Future<?> blockedPut = es.submit(() -> {
      try {
        q.put("interrupted");
      } catch (@SuppressWarnings("unused") InterruptedException e) {
        putInterrupted.countDown();
      }
      return null;
    });
    assertStillBlocked(blockedPut);
    blockedPut.cancel(true);

    assertThat(putInterrupted.await(1, SECONDS)).isTrue();
    assertThat(q.size()).isEqualTo(1);
    assertThat(q.tryGetNow()).hasValue("filler");
    assertThat(q.tryGetNow()).isEmpty();
  }

  // --------------------------------------------------------------------------
  //
  // Tests for tryPut
  //
  // --------------------------------------------------------------------------

  @Test
  public void tryPut_withAvailableCapacity_shouldSucceed() throws Exception {
    BoundedQueue<String> q = new LockingBoundedQueue<>(1);
    assertThat(q.tryPut("a", 0, MILLISECONDS)).isTrue();
    assertThat(q.get()).hasValue("a");
  }

  @Test
  public void tryPut_onFullQueue_shouldTimeOut() throws Exception {
    BoundedQueue<String> q = new LockingBoundedQueue<>(1);
    q.put("filler");
    assertThat(q.tryPut("rejected", 10, MILLISECONDS)).isFalse();
    assertThat(q.size()).isEqualTo(1);
  }

  @Test
  @Repeat(times = NUM_REPEATS)
  public void tryPut_onFullQueue_shouldSucceedIfSpaceOpensInTime() throws Exception {
    BoundedQueue<String> q = new LockingBoundedQueue<>(1);
    q.put("filler");

    Future<Boolean> patientPut = es.submit(() -> q.tryPut("patient", 10, SECONDS));
    assertStillBlocked(patientPut);

    assertThat(q.get()).hasValue("filler");
    assertThat(patientPut.get(1, SECONDS)).isTrue();
    assertThat(q.get()).hasValue("patient");
  }

  @Test(expected = QueueClosedException.class)
  public void tryPut_onClosedQueue_shouldFail() throws Exception {
    BoundedQueue<String> q = new LockingBoundedQueue<>(1);
    q.close();
    q.tryPut("late", 10, MILLISECONDS);
  }

  // --------------------------------------------------------------------------
  //
  // Tests for get
  //
  // --------------------------------------------------------------------------

  @Test
  @Repeat(times = NUM_REPEATS)
  public void get_onEmptyQueue_shouldBlockUntilElementArrives() throws Exception {
    BoundedQueue<String> q = new LockingBoundedQueue<>(1);

    Future<Optional<String>> blockedGet = es.submit(() -> q.get());
    assertStillBlocked(blockedGet);

    q.put("thanks for waiting");
    assertThat(blockedGet.get(1, SECONDS)).hasValue("thanks for waiting");
  }

  @Test
  @Repeat(times = NUM_REPEATS)
  public void get_onEmptyQueue_thatLaterCloses_shouldReturnEmpty() throws Exception {
    BoundedQueue<String> q = new LockingBoundedQueue<>(1);

    CountDownLatch aboutToGet = new CountDownLatch(1);
    Future<Optional<String>> blockedGet = es.submit(() -> {
      aboutToGet.countDown();
      return q.get();
    });
    aboutToGet.await(1, SECONDS);
    assertStillBlocked(blockedGet);

    q.close();
    assertThat(blockedGet.get(1, SECONDS)).isEmpty();
  }

  @Test
  @Repeat(times = NUM_REPEATS)
  public void get_withSeveralBlockedConsumers_shouldReleaseAllOnClose() throws Exception {
    BoundedQueue<String> q = new LockingBoundedQueue<>(1);
    List<Future<Optional<String>>> blockedGets = new ArrayList<>();
    for (int i = 0; i < 4; i++) {
      blockedGets.add(es.submit(() -> q.get()));
    }
    for (Future<Optional<String>> blockedGet : blockedGets) {
      assertStillBlocked(blockedGet);
    }

    q.close();
    for (Future<Optional<String>> blockedGet : blockedGets) {
      assertThat(blockedGet.get(1, SECONDS)).isEmpty();
    }
  }

  @Test
  public void get_afterClose_shouldDrainBufferedElementsThenReturnEmpty() throws Exception {
    BoundedQueue<Integer> q = new LockingBoundedQueue<>(3);
    q.put(1);
    q.put(2);
    q.put(3);
    q.close();

    assertThat(q.isClosed()).isTrue();
    assertThat(q.isClosedAndEmpty()).isFalse();
    assertThat(q.get()).hasValue(1);
    assertThat(q.get()).hasValue(2);
    assertThat(q.get()).hasValue(3);
    assertThat(q.isClosedAndEmpty()).isTrue();

    assertThat(q.get()).isEmpty();
    assertThat(q.get()).isEmpty();
  }

  @Test
  public void get_shouldPreserveFifoOrder() throws Exception {
    BoundedQueue<Integer> q = new LockingBoundedQueue<>(100);
    for (int i = 0; i < 100; i++) {
      q.put(i);
    }
    for (int i = 0; i < 100; i++) {
      assertThat(q.get()).hasValue(i);
    }
  }

  // --------------------------------------------------------------------------
  //
  // Tests for tryGet and tryGetNow
  //
  // --------------------------------------------------------------------------

  @Test
  public void tryGet_onEmptyOpenQueue_shouldTimeOut() throws Exception {
    BoundedQueue<String> q = new LockingBoundedQueue<>(1);
    assertThat(q.tryGet(10, MILLISECONDS)).isEmpty();
    assertThat(q.isClosedAndEmpty()).isFalse();
  }

  @Test
  public void tryGet_onQueueContainingElement_shouldImmediatelyReturnElement() throws Exception {
    BoundedQueue<String> q = new LockingBoundedQueue<>(1);
    q.put("foo");
    // 0ms should be sufficient to grab an element that's already waiting.
    assertThat(q.tryGet(0, MILLISECONDS)).hasValue("foo");
  }

  @Test
  @Repeat(times = NUM_REPEATS)
  public void tryGet_onEmptyQueue_thatLaterCloses_shouldReturnEmptyBeforeTimeout()
      throws Exception {
    BoundedQueue<String> q = new LockingBoundedQueue<>(1);
    Future<Optional<String>> patientGet = es.submit(() -> q.tryGet(10, SECONDS));
    assertStillBlocked(patientGet);

    q.close();
    assertThat(patientGet.get(1, SECONDS)).isEmpty();
    assertThat(q.isClosedAndEmpty()).isTrue();
  }

  @Test
  public void tryGetNow_shouldNeverBlock() throws Exception {
    BoundedQueue<String> q = new LockingBoundedQueue<>(2);
    assertThat(q.tryGetNow()).isEmpty();
    q.put("hiya");
    assertThat(q.tryGetNow()).hasValue("hiya");
    q.close();
    assertThat(q.tryGetNow()).isEmpty();
  }

  // --------------------------------------------------------------------------
  //
  // Tests for close
  //
  // --------------------------------------------------------------------------

  @Test
  public void close_calledRepeatedly_shouldBehaveLikeCalledOnce() throws Exception {
    BoundedQueue<String> q = new LockingBoundedQueue<>(2);
    q.put("kept");
    for (int i = 0; i < 5; i++) {
      q.close();
    }
    assertThat(q.isClosed()).isTrue();
    assertThat(q.size()).isEqualTo(1);
    assertThat(q.get()).hasValue("kept");
    assertThat(q.get()).isEmpty();
    assertThat(q.isClosedAndEmpty()).isTrue();
  }

  @Test
  @Repeat(times = NUM_REPEATS)
  public void close_onFullQueue_shouldNotBlock() throws Exception {
    BoundedQueue<String> q = new LockingBoundedQueue<>(1);
    q.put("filler");
    Future<?> closeResult = es.submit(q::close);
    closeResult.get(1, SECONDS);
    assertThat(q.isClosed()).isTrue();
  }

  // --------------------------------------------------------------------------
  //
  // Tests with several threads on each side
  //
  // --------------------------------------------------------------------------

  @Test
  @Repeat(times = NUM_REPEATS)
  public void size_shouldNeverExceedCapacity() throws Exception {
    int capacity = 3;
    BoundedQueue<Integer> q = new LockingBoundedQueue<>(capacity);
    List<Future<?>> producers = new ArrayList<>();
    for (int p = 0; p < 4; p++) {
      producers.add(es.submit(() -> {
        for (int i = 0; i < 200; i++) {
          q.put(i);
        }
        return null;
      }));
    }

    int taken = 0;
    while (taken < 800) {
      assertThat(q.size()).isAtMost(capacity);
      if (q.tryGet(1, SECONDS).isPresent()) {
        taken++;
      }
    }
    for (Future<?> producer : producers) {
      producer.get(1, SECONDS);
    }
    assertThat(q.size()).isEqualTo(0);
  }
}
