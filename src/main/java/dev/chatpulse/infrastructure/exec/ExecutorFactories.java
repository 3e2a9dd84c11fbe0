package dev.chatpulse.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Factory helpers for the named, non-daemon threads of the detection pipeline.
 */
public final class ExecutorFactories {

  private ExecutorFactories() {}

  /**
   * Builds a fixed-size executor for detection workers.
   *
   * <p>The executor has no task queue: exactly {@code size} long-running workers are submitted and a
   * further submission is rejected.</p>
   *
   * @param size number of worker threads to allocate
   * @param prefix thread-name prefix used to tag worker threads
   * @param handler uncaught exception handler installed on each worker thread
   * @return configured executor service
   */
  public static ExecutorService newWorkerPool(int size, String prefix, UncaughtExceptionHandler handler) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    ThreadFactory factory = namedThreads(prefix == null || prefix.isBlank() ? "chatpulse-worker" : prefix, handler);
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new SynchronousQueue<>(),
        factory,
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Returns a thread factory producing non-daemon threads named {@code prefix-N}.
   *
   * @param prefix thread-name prefix
   * @param handler uncaught exception handler; {@code null} keeps the JVM default
   * @return thread factory
   */
  public static ThreadFactory namedThreads(String prefix, UncaughtExceptionHandler handler) {
    Objects.requireNonNull(prefix, "prefix");
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(prefix + "-" + index.getAndIncrement());
      thread.setDaemon(false);
      if (handler != null) {
        thread.setUncaughtExceptionHandler(handler);
      }
      return thread;
    };
  }
}
