package ca.gc.cra.rollup.infrastructure.exec;

import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread and pool construction for batch compression and relay shutdown.
 *
 * <p>Every thread created here is named and non-daemon, and logs uncaught failures through SLF4J
 * instead of printing them to stderr.</p>
 */
public final class ExecutorFactories {
  private static final Logger log = LoggerFactory.getLogger(ExecutorFactories.class);

  /** Thread-name prefix of batch compression workers. */
  public static final String BATCH_THREAD_PREFIX = "rollup-batch";

  private ExecutorFactories() {}

  /**
   * Builds a pool for one batch call.
   *
   * <p>The pool never holds more threads than there are units, and its queue is sized to the unit
   * count, so a caller that submits each unit once cannot be rejected.</p>
   *
   * @param workers configured concurrency cap
   * @param units number of payloads in the batch
   * @return pool with {@code min(workers, units)} threads named {@code rollup-batch-N}
   * @throws IllegalArgumentException if {@code workers} or {@code units} is not positive
   */
  public static ExecutorService newBatchPool(int workers, int units) {
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    if (units <= 0) {
      throw new IllegalArgumentException("units must be positive");
    }
    int threads = Math.min(workers, units);
    return new ThreadPoolExecutor(
        threads,
        threads,
        0L,
        TimeUnit.MILLISECONDS,
        new ArrayBlockingQueue<>(units),
        namedFactory(BATCH_THREAD_PREFIX),
        new ThreadPoolExecutor.AbortPolicy());
  }

  /**
   * Creates an unstarted thread with a fixed name, suitable for {@link Runtime#addShutdownHook}.
   *
   * @param name thread name; must not be blank
   * @param task work to run
   * @return new thread
   */
  public static Thread newNamedThread(String name, Runnable task) {
    if (name == null || name.isBlank()) {
      throw new IllegalArgumentException("thread name must not be blank");
    }
    Thread thread = new Thread(task, name);
    thread.setDaemon(false);
    thread.setUncaughtExceptionHandler(ExecutorFactories::logUncaught);
    return thread;
  }

  private static ThreadFactory namedFactory(String prefix) {
    AtomicInteger index = new AtomicInteger();
    return runnable -> newNamedThread(prefix + "-" + index.getAndIncrement(), runnable);
  }

  private static void logUncaught(Thread thread, Throwable ex) {
    log.error("Uncaught failure on {}", thread.getName(), ex);
  }
}
