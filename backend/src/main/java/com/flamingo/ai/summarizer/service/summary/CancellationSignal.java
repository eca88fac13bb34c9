package com.flamingo.ai.summarizer.service.summary;

import com.flamingo.ai.summarizer.exception.SummarizationCancelledException;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import lombok.extern.slf4j.Slf4j;

/**
 * Cancellation flag shared by a caller and one running summarization.
 *
 * <p>Callbacks registered with {@link #onCancel(Runnable)} run once, on the thread that calls
 * {@link #cancel()}, or immediately if the signal is already cancelled.
 */
@Slf4j
public class CancellationSignal {

  private static final CancellationSignal NONE = new CancellationSignal();

  private volatile boolean cancelled;
  private final List<Runnable> callbacks = new CopyOnWriteArrayList<>();

  /** A signal nobody cancels; {@link #cancel()} on it is ignored. */
  public static CancellationSignal none() {
    return NONE;
  }

  /** Requests cancellation and runs the registered callbacks. */
  public void cancel() {
    if (this == NONE || cancelled) {
      return;
    }
    synchronized (this) {
      if (cancelled) {
        return;
      }
      cancelled = true;
    }
    for (Runnable callback : callbacks) {
      if (!callbacks.remove(callback)) {
        continue;
      }
      try {
        callback.run();
      } catch (RuntimeException e) {
        log.warn("Cancellation callback failed: {}", e.getMessage());
      }
    }
  }

  public boolean isCancelled() {
    return cancelled;
  }

  /**
   * Throws if cancellation was requested.
   *
   * @param state the pipeline state reported in the exception
   */
  public void throwIfCancelled(ReductionState state) {
    if (cancelled) {
      throw new SummarizationCancelledException(state);
    }
  }

  /**
   * Registers a callback to run on cancellation.
   *
   * @return a handle that removes the callback when closed
   */
  public Registration onCancel(Runnable callback) {
    if (this == NONE) {
      return () -> {};
    }
    callbacks.add(callback);
    if (cancelled && callbacks.remove(callback)) {
      callback.run();
    }
    return () -> callbacks.remove(callback);
  }

  /** Handle returned by {@link #onCancel(Runnable)}. */
  @FunctionalInterface
  public interface Registration extends AutoCloseable {
    @Override
    void close();
  }
}
