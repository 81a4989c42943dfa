package com.consullo.prover.dispatch;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.apache.commons.lang3.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs scheduled tasks one at a time, in submission order, on a single worker thread.
 *
 * <p>Each task performs one request/response exchange with the prover and the next task starts only
 * after it returns. Requests depend on state ids returned by earlier answers, so exchanges must never
 * overlap. A task completes by returning or throwing; a thrown exception is logged and the worker
 * moves on.
 *
 * <p>When an idle task is configured, the worker runs it whenever the queue has stayed empty for the
 * idle interval. It runs on the worker thread and therefore never overlaps a scheduled task.
 *
 * @since 1.0
 */
public final class SequentialDispatcher implements AutoCloseable {

  private static final Logger LOGGER = LoggerFactory.getLogger(SequentialDispatcher.class);

  /**
   * A unit of work run on the worker thread.
   */
  @FunctionalInterface
  public interface DispatchTask {
    void run() throws Exception;
  }

  private record Scheduled(String name, DispatchTask task) {
  }

  private static final Scheduled POISON = new Scheduled("<shutdown>", () -> { });

  private final String name;
  private final BlockingQueue<Scheduled> queue;
  private final Duration idleInterval;
  private final Runnable idleTask;
  private final Thread worker;
  private final Object countLock = new Object();

  private int pendingCount;
  private volatile boolean shuttingDown;

  /**
   * Creates and starts a dispatcher without an idle task.
   *
   * @param name name used in the worker thread name and log lines
   * @param capacity maximum number of queued tasks
   */
  public SequentialDispatcher(final String name, final int capacity) {
    this(name, capacity, null, null);
  }

  /**
   * Creates and starts a dispatcher.
   *
   * @param name name used in the worker thread name and log lines
   * @param capacity maximum number of queued tasks
   * @param idleInterval how long the queue must stay empty before the idle task runs (null if no idle task)
   * @param idleTask task run on the worker while idle (null if none)
   */
  public SequentialDispatcher(final String name, final int capacity, final Duration idleInterval,
      final Runnable idleTask) {
    Validate.notBlank(name, "name must not be blank");
    Validate.isTrue(capacity > 0, "capacity must be positive");
    Validate.isTrue((idleInterval == null) == (idleTask == null),
        "idleInterval and idleTask must be given together");
    if (idleInterval != null) {
      Validate.isTrue(!idleInterval.isNegative() && !idleInterval.isZero(), "idleInterval must be positive");
    }
    this.name = name;
    this.queue = new LinkedBlockingQueue<>(capacity);
    this.idleInterval = idleInterval;
    this.idleTask = idleTask;
    this.worker = new Thread(this::workerLoop, "ProverDispatcher-" + name);
    this.worker.setDaemon(true);
    this.worker.start();
  }

  /**
   * Enqueues a task without blocking.
   *
   * @param taskName name for log lines
   * @param task the task
   * @throws RejectedExecutionException if the queue is full or the dispatcher is shut down
   */
  public void schedule(final String taskName, final DispatchTask task) {
    Validate.notNull(taskName, "taskName must not be null");
    Validate.notNull(task, "task must not be null");
    if (shuttingDown) {
      throw new RejectedExecutionException("Dispatcher " + name + " is shut down");
    }
    synchronized (countLock) {
      pendingCount++;
    }
    if (!queue.offer(new Scheduled(taskName, task))) {
      decrement(1);
      throw new RejectedExecutionException("Dispatcher " + name + " queue is full");
    }
    LOGGER.debug("[{}] scheduled {}", name, taskName);
  }

  /**
   * Drops every task that has not started yet. A running task is not affected.
   *
   * @return number of dropped tasks
   */
  public int discardPending() {
    final List<Scheduled> dropped = new ArrayList<>();
    queue.drainTo(dropped);
    int count = 0;
    for (Scheduled s : dropped) {
      if (s == POISON) {
        // keep shutdown pending
        queue.offer(POISON);
        continue;
      }
      LOGGER.debug("[{}] discarded {}", name, s.name());
      count++;
    }
    decrement(count);
    return count;
  }

  /**
   * Number of tasks scheduled or running.
   *
   * @return pending count
   */
  public int pendingCount() {
    synchronized (countLock) {
      return pendingCount;
    }
  }

  public boolean isBusy() {
    return pendingCount() > 0;
  }

  public boolean isWorkerThread() {
    return Thread.currentThread() == worker;
  }

  /**
   * Waits until no task is scheduled or running.
   *
   * @param timeout maximum wait
   * @return true if idle, false on timeout
   * @throws InterruptedException if interrupted
   */
  public boolean awaitIdle(final Duration timeout) throws InterruptedException {
    final long deadline = System.nanoTime() + timeout.toNanos();
    synchronized (countLock) {
      while (pendingCount > 0) {
        final long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          return false;
        }
        TimeUnit.NANOSECONDS.timedWait(countLock, remaining);
      }
      return true;
    }
  }

  /**
   * Stops accepting tasks, drops pending ones and joins the worker, interrupting it if the running
   * task does not finish within {@code timeout}.
   *
   * @param timeout join timeout
   */
  public void shutdown(final Duration timeout) {
    if (shuttingDown) {
      return;
    }
    shuttingDown = true;
    discardPending();
    queue.offer(POISON);
    if (isWorkerThread()) {
      return;
    }
    try {
      worker.join(timeout.toMillis());
      if (worker.isAlive()) {
        LOGGER.warn("[{}] worker still busy after {}, interrupting", name, timeout);
        worker.interrupt();
        worker.join(timeout.toMillis());
      }
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
    }
    LOGGER.debug("[{}] dispatcher shut down", name);
  }

  public boolean isShutdown() {
    return shuttingDown;
  }

  @Override
  public void close() {
    shutdown(Duration.ofSeconds(5));
  }

  private void workerLoop() {
    LOGGER.debug("[{}] dispatcher started", name);
    while (true) {
      final Scheduled next;
      try {
        next = idleTask == null ? queue.take() : queue.poll(idleInterval.toMillis(), TimeUnit.MILLISECONDS);
      } catch (final InterruptedException e) {
        if (shuttingDown) {
          break;
        }
        continue;
      }
      if (next == POISON || shuttingDown) {
        if (next != null && next != POISON) {
          decrement(1);
        }
        break;
      }
      if (next == null) {
        runIdle();
        continue;
      }
      run(next);
    }
    LOGGER.debug("[{}] dispatcher quits normally", name);
  }

  private void run(final Scheduled scheduled) {
    LOGGER.debug("[{}] runs {}", name, scheduled.name());
    try {
      scheduled.task().run();
    } catch (final InterruptedException e) {
      LOGGER.debug("[{}] {} interrupted", name, scheduled.name());
    } catch (final Exception e) {
      LOGGER.error("[{}] task {} failed", name, scheduled.name(), e);
    } finally {
      decrement(1);
      LOGGER.debug("[{}] finished {}", name, scheduled.name());
    }
  }

  private void runIdle() {
    try {
      idleTask.run();
    } catch (final RuntimeException e) {
      LOGGER.error("[{}] idle task failed", name, e);
    }
  }

  private void decrement(final int count) {
    if (count == 0) {
      return;
    }
    synchronized (countLock) {
      pendingCount -= count;
      if (pendingCount <= 0) {
        pendingCount = 0;
        countLock.notifyAll();
      }
    }
  }
}
