package com.scholary.recipe.media.session;

/**
 * Observes an upload session.
 *
 * <p>Called synchronously, in order, for every change, on whichever thread made the change.
 * Implementations must return quickly and must not call back into the session.
 */
@FunctionalInterface
public interface UploadListener {

  void onChange(UploadSnapshot snapshot);
}
