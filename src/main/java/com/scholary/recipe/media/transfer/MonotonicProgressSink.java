package com.scholary.recipe.media.transfer;

/**
 * Progress sink that clamps values to 0..100 and drops any value lower than or equal to the last
 * one forwarded.
 *
 * <p>Resumable transfers can move their byte offset backwards after a resume; callers still see a
 * non-decreasing percentage. Use one instance per transfer.
 */
public class MonotonicProgressSink implements ProgressSink {

  private final ProgressSink delegate;
  private int last = -1;

  public MonotonicProgressSink(ProgressSink delegate) {
    this.delegate = delegate;
  }

  @Override
  public void report(int percent) {
    int clamped = Math.max(0, Math.min(100, percent));
    synchronized (this) {
      if (clamped <= last) {
        return;
      }
      last = clamped;
    }
    delegate.report(clamped);
  }

  /** Highest value forwarded so far, or -1 if none. */
  public synchronized int last() {
    return last;
  }

  /** Convert transferred bytes to a rounded percentage of {@code total}. */
  public static int percentOf(long transferred, long total) {
    if (total <= 0) {
      return 0;
    }
    return (int) Math.round(transferred * 100.0 / total);
  }
}
