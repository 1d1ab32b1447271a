package com.scholary.recipe.media.service;

/** Thrown when an upload request is well-formed JSON but not acceptable, e.g. a video profile. */
public class InvalidUploadRequestException extends RuntimeException {

  public InvalidUploadRequestException(String message) {
    super(message);
  }
}
