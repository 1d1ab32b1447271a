package com.scholary.recipe.media.session;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Phase of an upload session.
 *
 * <p>All transitions go through {@link #next(UploadEvent)}:
 *
 * <pre>
 * idle -STARTED-> requesting -TARGET_ISSUED-> uploading
 * uploading -IMAGE_TRANSFERRED-> confirming -ASSET_READY-> ready
 * uploading -VIDEO_TRANSFERRED-> processing -ASSET_READY-> ready
 * requesting | uploading | confirming | processing -FAILED-> error
 * any -RESET-> idle
 * idle -ADOPTED_READY | ADOPTED_PROCESSING | ADOPTED_ERROR-> ready | processing | error
 * </pre>
 */
public enum UploadStatus {
  IDLE("idle"),
  REQUESTING("requesting"),
  UPLOADING("uploading"),
  CONFIRMING("confirming"),
  PROCESSING("processing"),
  READY("ready"),
  ERROR("error");

  private final String value;

  UploadStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  /** True while an upload is in flight. */
  public boolean isActive() {
    return this == REQUESTING || this == UPLOADING || this == CONFIRMING || this == PROCESSING;
  }

  public boolean isTerminal() {
    return this == READY || this == ERROR;
  }

  /**
   * The status reached from this one on {@code event}.
   *
   * @throws IllegalUploadTransitionException if the event is not allowed in this status
   */
  public UploadStatus next(UploadEvent event) {
    UploadStatus target = target(event);
    if (target == null) {
      throw new IllegalUploadTransitionException(this, event);
    }
    return target;
  }

  private UploadStatus target(UploadEvent event) {
    return switch (event) {
      case RESET -> IDLE;
      case STARTED -> this == IDLE ? REQUESTING : null;
      case TARGET_ISSUED -> this == REQUESTING ? UPLOADING : null;
      case IMAGE_TRANSFERRED -> this == UPLOADING ? CONFIRMING : null;
      case VIDEO_TRANSFERRED -> this == UPLOADING ? PROCESSING : null;
      case ASSET_READY -> this == CONFIRMING || this == PROCESSING ? READY : null;
      case FAILED -> isActive() ? ERROR : null;
      case ADOPTED_READY -> this == IDLE ? READY : null;
      case ADOPTED_PROCESSING -> this == IDLE ? PROCESSING : null;
      case ADOPTED_ERROR -> this == IDLE ? ERROR : null;
    };
  }
}
