package com.scholary.recipe.media.objectstore;

/**
 * Exception thrown when object storage operations fail.
 *
 * <p>A missing object is not an error for this client; lookups return an empty result instead.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
