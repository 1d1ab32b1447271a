package com.scholary.recipe.media.service;

/** Thrown when a user tries to act on a media asset uploaded by someone else. */
public class AssetAccessDeniedException extends RuntimeException {

  public AssetAccessDeniedException(String message) {
    super(message);
  }
}
