package com.scholary.recipe.media.client;

/**
 * Thrown when a video ends up in {@code error} or its status can no longer be read.
 *
 * <p>Not thrown for a poll budget running out; see {@link ProcessingTimeoutException}.
 */
public class ProcessingFailedException extends RuntimeException {

  public ProcessingFailedException(String message) {
    super(message);
  }

  public ProcessingFailedException(String message, Throwable cause) {
    super(message, cause);
  }
}
