package com.scholary.recipe.media.provider;

/**
 * Thrown when a call to the media provider fails.
 *
 * <p>{@code rejected} distinguishes the provider refusing the request or the content (a 4xx, a
 * missing object, a corrupt image) from the provider being unreachable or failing internally.
 */
public class ProviderException extends RuntimeException {

  private final int statusCode;
  private final boolean rejected;

  public ProviderException(String message, int statusCode, boolean rejected) {
    super(message);
    this.statusCode = statusCode;
    this.rejected = rejected;
  }

  public ProviderException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
    this.rejected = false;
  }

  public static ProviderException rejected(String message) {
    return new ProviderException(message, -1, true);
  }

  /** HTTP status returned by the provider, or -1 if none was received. */
  public int getStatusCode() {
    return statusCode;
  }

  public boolean isRejected() {
    return rejected;
  }
}
