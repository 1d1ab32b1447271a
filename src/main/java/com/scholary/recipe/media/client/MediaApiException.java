package com.scholary.recipe.media.client;

/**
 * Thrown when a call to the media API fails.
 *
 * <p>{@code statusCode} is the HTTP status of a non-2xx response, or -1 when no response was
 * received at all. The message is the server's {@code error} text where it sent one.
 */
public class MediaApiException extends RuntimeException {

  private final int statusCode;

  public MediaApiException(int statusCode, String message) {
    super(message);
    this.statusCode = statusCode;
  }

  public MediaApiException(String message, Throwable cause) {
    super(message, cause);
    this.statusCode = -1;
  }

  public int getStatusCode() {
    return statusCode;
  }

  public boolean isTransportFailure() {
    return statusCode < 0;
  }
}
