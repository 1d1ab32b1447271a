package com.scholary.recipe.media.client;

/** Thrown when the server does not finalize an uploaded image. */
public class ConfirmationException extends RuntimeException {

  public ConfirmationException(String message) {
    super(message);
  }

  public ConfirmationException(String message, Throwable cause) {
    super(message, cause);
  }
}
