package com.scholary.recipe.media.session;

/** Thrown when an event is not allowed in the session's current status. */
public class IllegalUploadTransitionException extends IllegalStateException {

  private final UploadStatus from;
  private final UploadEvent event;

  public IllegalUploadTransitionException(UploadStatus from, UploadEvent event) {
    super("Illegal upload transition: " + event + " in status " + from.value());
    this.from = from;
    this.event = event;
  }

  public UploadStatus getFrom() {
    return from;
  }

  public UploadEvent getEvent() {
    return event;
  }
}
