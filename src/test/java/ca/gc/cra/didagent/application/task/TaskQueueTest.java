package ca.gc.cra.didagent.application.task;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class TaskQueueTest {
  private TaskQueue queue;

  @AfterEach
  void tearDown() {
    if (queue != null) {
      queue.close();
    }
  }

  @Test
  void runCompletesWithTaskResult() throws Exception {
    queue = new TaskQueue("test", 0);

    CompletableFuture<String> result = queue.run(() -> "done");

    assertEquals("done", result.get(2, TimeUnit.SECONDS));
  }

  @Test
  void putHoldsTasksBeyondCapInOrder() throws Exception {
    queue = new TaskQueue("test", 1);
    CountDownLatch release = new CountDownLatch(1);
    List<String> order = new CopyOnWriteArrayList<>();

    CompletableFuture<Object> first = queue.put(() -> {
      release.await(5, TimeUnit.SECONDS);
      order.add("first");
      return null;
    });
    CompletableFuture<Object> second = queue.put(() -> order.add("second"));
    CompletableFuture<Object> third = queue.put(() -> order.add("third"));

    assertEquals(1, queue.activeCount());
    assertEquals(2, queue.pendingCount());

    release.countDown();
    CompletableFuture.allOf(first, second, third).get(5, TimeUnit.SECONDS);
    assertEquals(List.of("first", "second", "third"), order);
    assertEquals(0, queue.size());
  }

  @Test
  void runIgnoresCap() throws Exception {
    queue = new TaskQueue("test", 1);
    CountDownLatch release = new CountDownLatch(1);
    queue.put(() -> release.await(5, TimeUnit.SECONDS));

    CompletableFuture<String> bypass = queue.run(() -> "ran");

    assertEquals("ran", bypass.get(2, TimeUnit.SECONDS));
    release.countDown();
  }

  @Test
  void callbackReceivesUnwrappedFailure() throws Exception {
    queue = new TaskQueue("test", 0);
    AtomicReference<Throwable> seen = new AtomicReference<>();
    CountDownLatch called = new CountDownLatch(1);

    CompletableFuture<Object> result = queue.run(() -> {
      throw new IOException("boom");
    }, (task, failure) -> {
      seen.set(failure);
      called.countDown();
    });

    assertTrue(called.await(2, TimeUnit.SECONDS));
    assertInstanceOf(IOException.class, seen.get());
    ExecutionException thrown = assertThrows(ExecutionException.class, () -> result.get(2, TimeUnit.SECONDS));
    assertInstanceOf(IOException.class, thrown.getCause());
  }

  @Test
  void callbackReceivesTaskHandle() throws Exception {
    queue = new TaskQueue("test", 0);
    AtomicReference<Object> handle = new AtomicReference<>();
    CountDownLatch called = new CountDownLatch(1);

    CompletableFuture<String> result = queue.run(() -> "x", (task, failure) -> {
      handle.set(task);
      called.countDown();
    });

    assertTrue(called.await(2, TimeUnit.SECONDS));
    assertSame(result, handle.get());
  }

  @Test
  void completeReturnsTrueWhenTasksFinish() throws Exception {
    queue = new TaskQueue("test", 0);
    queue.run(() -> "a");
    queue.run(() -> {
      throw new IllegalStateException("failure does not block completion");
    });

    assertTrue(queue.complete(Duration.ofSeconds(2)));
  }

  @Test
  void completeCancelsTasksStillRunningAtDeadline() throws Exception {
    queue = new TaskQueue("test", 0);
    CountDownLatch interrupted = new CountDownLatch(1);
    CompletableFuture<Object> slow = queue.run(() -> {
      try {
        Thread.sleep(10_000);
      } catch (InterruptedException ex) {
        interrupted.countDown();
        throw ex;
      }
      return null;
    });

    assertFalse(queue.complete(Duration.ofMillis(50)));
    assertTrue(slow.isCancelled());
    assertTrue(interrupted.await(2, TimeUnit.SECONDS), "running task should be interrupted");
  }

  @Test
  void cancelAllDropsPendingTasks() throws Exception {
    queue = new TaskQueue("test", 1);
    CountDownLatch release = new CountDownLatch(1);
    queue.put(() -> release.await(5, TimeUnit.SECONDS));
    CompletableFuture<String> pending = queue.put(() -> "never");

    queue.cancelAll();
    release.countDown();

    assertTrue(pending.isCancelled());
    assertEquals(0, queue.pendingCount());
  }

  @Test
  void closedQueueRejectsTasks() {
    queue = new TaskQueue("test", 0);
    queue.close();

    assertThrows(IllegalStateException.class, () -> queue.run(() -> "late"));
  }

  @Test
  void negativeCapIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> new TaskQueue("test", -1));
  }
}
