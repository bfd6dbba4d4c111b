package io.nudge.queue.diagnostics;

import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Hands errors to a delegate on a single daemon thread so that slow or failing error handlers
 * never stall the listener.
 */
public final class AsyncErrorNotifier implements ErrorNotifier, AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(AsyncErrorNotifier.class);

  public static final String DEFAULT_THREAD_NAME = "nudge-queue-errors";

  private final Consumer<Throwable> delegate;
  private final ExecutorService executor;

  public AsyncErrorNotifier() {
    this(AsyncErrorNotifier::logError, DEFAULT_THREAD_NAME);
  }

  public AsyncErrorNotifier(Consumer<Throwable> delegate, String threadName) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    String name = threadName == null || threadName.isBlank() ? DEFAULT_THREAD_NAME : threadName;
    this.executor = Executors.newSingleThreadExecutor(runnable -> {
      Thread thread = new Thread(runnable, name);
      thread.setDaemon(true);
      return thread;
    });
  }

  @Override
  public void notifyAsync(Throwable error) {
    if (error == null) {
      return;
    }
    try {
      executor.execute(() -> deliver(error));
    } catch (RejectedExecutionException e) {
      log.warn("Error notifier is shut down; logging inline", e);
      logError(error);
    }
  }

  private void deliver(Throwable error) {
    try {
      delegate.accept(error);
    } catch (RuntimeException e) {
      log.error("Error notifier delegate failed while reporting {}", error.toString(), e);
    }
  }

  /**
   * Stops accepting errors and waits briefly for queued ones to be delivered.
   */
  @Override
  public void close() {
    executor.shutdown();
    try {
      if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
        executor.shutdownNow();
      }
    } catch (InterruptedException e) {
      executor.shutdownNow();
      Thread.currentThread().interrupt();
    }
  }

  static void logError(Throwable error) {
    log.warn("Queue notification problem: {}", error.getMessage(), error);
  }
}
