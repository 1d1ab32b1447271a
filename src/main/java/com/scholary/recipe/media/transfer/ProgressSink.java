package com.scholary.recipe.media.transfer;

/** Receives transfer progress as a whole percentage. */
@FunctionalInterface
public interface ProgressSink {

  ProgressSink NONE = percent -> {};

  void report(int percent);
}
