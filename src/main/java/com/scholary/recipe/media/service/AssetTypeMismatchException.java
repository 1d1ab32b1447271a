package com.scholary.recipe.media.service;

/** Thrown when an image-only operation is called for a video or the other way round. */
public class AssetTypeMismatchException extends RuntimeException {

  public AssetTypeMismatchException(String message) {
    super(message);
  }
}
