package ca.gc.cra.ember.infrastructure.exec;

import java.lang.Thread.UncaughtExceptionHandler;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.SynchronousQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Factory helpers for the named, bounded executors used by ingestion, fusion, and scheduling.
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);
  private static final UncaughtExceptionHandler LOGGING_HANDLER =
      (thread, ex) -> log.error("Uncaught failure on thread {}", thread.getName(), ex);

  private ExecutorFactories() {}

  /**
   * Builds a bounded pool that hands tasks directly to idle threads and rejects work once every thread is busy.
   *
   * <p>Connection handlers rely on the rejection to refuse sockets beyond {@code maxThreads} instead of
   * queueing them.</p>
   *
   * @param maxThreads maximum number of worker threads
   * @param prefix thread-name prefix used to tag worker threads
   * @return executor that throws {@link java.util.concurrent.RejectedExecutionException} when saturated
   */
  public static ExecutorService newBoundedHandoffPool(int maxThreads, String prefix) {
    if (maxThreads <= 0) {
      throw new IllegalArgumentException("maxThreads must be positive");
    }
    return new ThreadPoolExecutor(
        0,
        maxThreads,
        30L,
        TimeUnit.SECONDS,
        new SynchronousQueue<>(),
        namedFactory(prefix, "ember-worker", false),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Builds a fixed-size pool with an unbounded work queue for short CPU-bound tasks.
   *
   * @param size number of worker threads
   * @param prefix thread-name prefix
   * @return configured executor
   */
  public static ExecutorService newFixedPool(int size, String prefix) {
    if (size <= 0) {
      throw new IllegalArgumentException("size must be positive");
    }
    return new ThreadPoolExecutor(
        size,
        size,
        0L,
        TimeUnit.MILLISECONDS,
        new LinkedBlockingQueue<>(),
        namedFactory(prefix, "ember-pool", false));
  }

  /**
   * Builds a single-threaded scheduler used for periodic ticks.
   *
   * @param name thread name
   * @return scheduler that drops delayed tasks on shutdown
   */
  public static ScheduledExecutorService newSingleScheduler(String name) {
    ScheduledThreadPoolExecutor executor =
        new ScheduledThreadPoolExecutor(1, namedFactory(name, "ember-tick", false));
    executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
    executor.setContinueExistingPeriodicTasksAfterShutdownPolicy(false);
    executor.setRemoveOnCancelPolicy(true);
    return executor;
  }

  private static ThreadFactory namedFactory(String prefix, String fallback, boolean daemon) {
    String threadPrefix = (prefix == null || prefix.isBlank()) ? fallback : prefix;
    AtomicInteger index = new AtomicInteger();
    return runnable -> {
      Thread thread = new Thread(runnable);
      thread.setName(threadPrefix + "-" + index.getAndIncrement());
      thread.setDaemon(daemon);
      thread.setUncaughtExceptionHandler(LOGGING_HANDLER);
      return thread;
    };
  }
}
