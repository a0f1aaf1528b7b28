package ca.gc.cra.didagent.application.task;

import ca.gc.cra.didagent.application.port.CompletionCallback;
import ca.gc.cra.didagent.infrastructure.exec.ExecutorFactories;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs background tasks with an optional cap on how many run at once.
 *
 * <p>{@link #run} starts a task immediately regardless of the cap; {@link #put} starts it when a
 * slot is free and otherwise parks it in FIFO order. Both return without waiting for the task.
 * Every returned future completes exactly once: with the task result, its failure, or
 * cancellation. Cancelling a running task interrupts its worker thread.</p>
 *
 * <p><strong>Thread-safety:</strong> all methods may be called from any thread. Worker threads are
 * daemons, so a task stuck in a blocking call never keeps the JVM alive.</p>
 *
 * @since 0.1.0
 */
public final class TaskQueue implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(TaskQueue.class);

  private final String name;
  private final int maxActive;
  private final ExecutorService executor;
  private final Object lock = new Object();
  private final Deque<TaskHandle<?>> pending = new ArrayDeque<>();
  private final Set<TaskHandle<?>> tracked = ConcurrentHashMap.newKeySet();
  private int active;
  private volatile boolean closed;

  /**
   * @param name thread-name prefix and log label
   * @param maxActive maximum concurrently running {@link #put} tasks; {@code 0} means unbounded
   */
  public TaskQueue(String name, int maxActive) {
    if (maxActive < 0) {
      throw new IllegalArgumentException("maxActive must be >= 0");
    }
    this.name = Objects.requireNonNull(name, "name");
    this.maxActive = maxActive;
    this.executor = ExecutorFactories.newTaskPool(
        name, (thread, ex) -> log.error("Uncaught failure on {} worker {}", name, thread.getName(), ex));
  }

  public <T> CompletableFuture<T> run(Callable<T> task) {
    return run(task, null);
  }

  /**
   * Starts {@code task} now, ignoring the concurrency cap.
   *
   * @param task work to run
   * @param callback notified once on completion; may be {@code null}
   * @return handle completing with the task outcome
   */
  public <T> CompletableFuture<T> run(Callable<T> task, CompletionCallback callback) {
    TaskHandle<T> handle = track(task, callback);
    synchronized (lock) {
      start(handle);
    }
    return handle;
  }

  public <T> CompletableFuture<T> put(Callable<T> task) {
    return put(task, null);
  }

  /**
   * Starts {@code task} when a slot is free, otherwise queues it behind earlier tasks.
   *
   * @param task work to run
   * @param callback notified once on completion; may be {@code null}
   * @return handle completing with the task outcome
   */
  public <T> CompletableFuture<T> put(Callable<T> task, CompletionCallback callback) {
    TaskHandle<T> handle = track(task, callback);
    synchronized (lock) {
      if (pending.isEmpty() && hasFreeSlot()) {
        start(handle);
      } else {
        pending.addLast(handle);
      }
    }
    return handle;
  }

  public int activeCount() {
    synchronized (lock) {
      return active;
    }
  }

  public int pendingCount() {
    synchronized (lock) {
      return pending.size();
    }
  }

  /**
   * @return number of tasks submitted and not yet finished
   */
  public int size() {
    return tracked.size();
  }

  /**
   * Waits for every task submitted so far. Tasks still unfinished at the deadline are cancelled.
   *
   * @param timeout maximum wait
   * @return {@code true} if all tasks finished in time
   * @throws InterruptedException if the calling thread is interrupted while waiting
   */
  public boolean complete(Duration timeout) throws InterruptedException {
    List<TaskHandle<?>> snapshot = new ArrayList<>(tracked);
    if (snapshot.isEmpty()) {
      return true;
    }
    CompletableFuture<Void> all = CompletableFuture.allOf(snapshot.toArray(new CompletableFuture<?>[0]));
    try {
      all.get(timeout.toNanos(), TimeUnit.NANOSECONDS);
      return true;
    } catch (ExecutionException | CancellationException ex) {
      // every task finished; individual failures stay on their own handles
      return true;
    } catch (TimeoutException ex) {
      log.debug("{} tasks on {} still running after {}; cancelling", tracked.size(), name, timeout);
      cancelAll();
      return false;
    }
  }

  /** Cancels queued and running tasks. */
  public void cancelAll() {
    synchronized (lock) {
      pending.clear();
    }
    for (TaskHandle<?> handle : new ArrayList<>(tracked)) {
      handle.cancel(true);
    }
  }

  @Override
  public void close() {
    closed = true;
    cancelAll();
    executor.shutdownNow();
  }

  private <T> TaskHandle<T> track(Callable<T> task, CompletionCallback callback) {
    Objects.requireNonNull(task, "task");
    if (closed) {
      throw new IllegalStateException("Task queue " + name + " is closed");
    }
    TaskHandle<T> handle = new TaskHandle<>(task);
    tracked.add(handle);
    handle.whenComplete((value, failure) -> {
      tracked.remove(handle);
      if (callback != null) {
        notify(callback, handle, failure);
      }
    });
    return handle;
  }

  private void notify(CompletionCallback callback, TaskHandle<?> handle, Throwable failure) {
    Throwable cause = failure instanceof CompletionException && failure.getCause() != null
        ? failure.getCause()
        : failure;
    try {
      callback.onComplete(handle, cause);
    } catch (RuntimeException ex) {
      log.error("Completion callback failed on {}", name, ex);
    }
  }

  private boolean hasFreeSlot() {
    return maxActive == 0 || active < maxActive;
  }

  // caller holds lock
  private void start(TaskHandle<?> handle) {
    if (handle.isDone()) {
      return;
    }
    active++;
    try {
      executor.execute(() -> execute(handle));
    } catch (RejectedExecutionException ex) {
      active--;
      handle.completeExceptionally(ex);
    }
  }

  private <T> void execute(TaskHandle<T> handle) {
    try {
      if (!handle.attach(Thread.currentThread())) {
        return;
      }
      try {
        handle.complete(handle.task.call());
      } catch (Exception ex) {
        handle.completeExceptionally(ex);
      } catch (Error err) {
        handle.completeExceptionally(err);
        throw err;
      }
    } finally {
      handle.detach();
      Thread.interrupted();
      synchronized (lock) {
        active--;
        while (!pending.isEmpty() && hasFreeSlot()) {
          start(pending.pollFirst());
        }
      }
    }
  }

  private static final class TaskHandle<T> extends CompletableFuture<T> {
    private final Callable<T> task;
    private Thread runner;

    private TaskHandle(Callable<T> task) {
      this.task = task;
    }

    synchronized boolean attach(Thread thread) {
      if (isDone()) {
        return false;
      }
      runner = thread;
      return true;
    }

    synchronized void detach() {
      runner = null;
    }

    @Override
    public boolean cancel(boolean mayInterruptIfRunning) {
      boolean cancelled = super.cancel(mayInterruptIfRunning);
      if (cancelled && mayInterruptIfRunning) {
        synchronized (this) {
          if (runner != null) {
            runner.interrupt();
          }
        }
      }
      return cancelled;
    }
  }
}
