package com.scholary.recipe.media.client;

/** Thrown when no upload target could be obtained for a file. */
public class UploadRequestException extends RuntimeException {

  public UploadRequestException(String message) {
    super(message);
  }

  public UploadRequestException(String message, Throwable cause) {
    super(message, cause);
  }
}
