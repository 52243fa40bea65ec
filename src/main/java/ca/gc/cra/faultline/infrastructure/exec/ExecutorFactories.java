package ca.gc.cra.faultline.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the executors faultline owns.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds the bounded pool that runs event transmissions.
   *
   * <p>Threads are daemons so a pending send never keeps the host JVM alive. Submissions beyond
   * {@code queueCapacity} pending tasks are rejected with {@link java.util.concurrent.RejectedExecutionException}.</p>
   *
   * @param workers number of worker threads
   * @param queueCapacity pending-task bound
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor
   */
  public static ThreadPoolExecutor newDispatchPool(
      int workers, int queueCapacity, String prefix, UncaughtExceptionHandler handler) {
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    if (queueCapacity <= 0) {
      throw new IllegalArgumentException("queueCapacity must be positive");
    }
    String threadPrefix = (prefix == null || prefix.isBlank()) ? "faultline-dispatch" : prefix;
    UncaughtExceptionHandler effectiveHandler = Objects.requireNonNullElse(handler, (t, ex) -> {});
    AtomicInteger index = new AtomicInteger();
    ThreadFactory factory =
        runnable -> {
          Thread thread = new Thread(runnable);
          thread.setName(threadPrefix + "-" + index.getAndIncrement());
          thread.setDaemon(true);
          thread.setUncaughtExceptionHandler(effectiveHandler);
          return thread;
        };

    return new ThreadPoolExecutor(
        workers,
        workers,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(queueCapacity),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }
}
