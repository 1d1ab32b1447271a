package com.scholary.recipe.media.client;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.Future;

/**
 * Cancels the pending work of one upload: scheduled polls, in-flight requests and the resumable
 * transfer loop.
 *
 * <p>Work registered after cancellation is cancelled immediately. A token cannot be reused; each
 * upload gets a fresh one.
 */
public class CancellationToken {

  private final List<Future<?>> tracked = new ArrayList<>();
  private final List<Runnable> callbacks = new ArrayList<>();
  private boolean cancelled;

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  /**
   * Register a future to be cancelled together with this token. Completed futures are dropped on
   * the next registration.
   */
  public <F extends Future<?>> F track(F future) {
    boolean cancelNow;
    synchronized (this) {
      cancelNow = cancelled;
      if (!cancelNow) {
        tracked.removeIf(Future::isDone);
        tracked.add(future);
      }
    }
    if (cancelNow) {
      future.cancel(true);
    }
    return future;
  }

  /** Run {@code callback} once when the token is cancelled, or right away if it already is. */
  public void onCancel(Runnable callback) {
    boolean runNow;
    synchronized (this) {
      runNow = cancelled;
      if (!runNow) {
        callbacks.add(callback);
      }
    }
    if (runNow) {
      callback.run();
    }
  }

  /** Throw {@link CancellationException} if the token was cancelled. */
  public void throwIfCancelled() {
    if (isCancelled()) {
      throw new CancellationException("Upload cancelled");
    }
  }

  public void cancel() {
    List<Future<?>> futures;
    List<Runnable> toRun;
    synchronized (this) {
      if (cancelled) {
        return;
      }
      cancelled = true;
      futures = new ArrayList<>(tracked);
      toRun = new ArrayList<>(callbacks);
      tracked.clear();
      callbacks.clear();
    }
    futures.forEach(future -> future.cancel(true));
    toRun.forEach(Runnable::run);
  }
}
