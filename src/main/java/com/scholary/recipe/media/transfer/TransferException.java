package com.scholary.recipe.media.transfer;

/**
 * Thrown when the bytes of a file could not be delivered to the upload host.
 *
 * <p>{@link Kind#NETWORK} means no usable response was received; {@link Kind#REJECTED} means the
 * host answered with a non-2xx status, kept together with its raw response text.
 */
public class TransferException extends RuntimeException {

  public enum Kind {
    NETWORK,
    REJECTED
  }

  private final Kind kind;
  private final int statusCode;
  private final String responseBody;

  private TransferException(
      Kind kind, int statusCode, String responseBody, String message, Throwable cause) {
    super(message, cause);
    this.kind = kind;
    this.statusCode = statusCode;
    this.responseBody = responseBody;
  }

  public static TransferException network(String message, Throwable cause) {
    return new TransferException(Kind.NETWORK, -1, null, message, cause);
  }

  public static TransferException rejected(int statusCode, String responseBody) {
    String message = "Upload failed with status " + statusCode;
    if (responseBody != null && !responseBody.isBlank()) {
      message += ": " + responseBody;
    }
    return new TransferException(Kind.REJECTED, statusCode, responseBody, message, null);
  }

  public Kind getKind() {
    return kind;
  }

  /** HTTP status of a rejection, -1 for network failures. */
  public int getStatusCode() {
    return statusCode;
  }

  public String getResponseBody() {
    return responseBody;
  }
}
