package com.scholary.recipe.media.client;

/** Thrown when a video is still processing after the last allowed poll. */
public class ProcessingTimeoutException extends RuntimeException {

  private final int attempts;

  public ProcessingTimeoutException(String message, int attempts) {
    super(message);
    this.attempts = attempts;
  }

  /** Number of polls that were made. */
  public int getAttempts() {
    return attempts;
  }
}
