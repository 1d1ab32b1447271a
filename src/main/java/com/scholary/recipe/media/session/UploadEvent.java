package com.scholary.recipe.media.session;

/** Things that happen to an upload session; each drives one {@link UploadStatus} transition. */
public enum UploadEvent {
  STARTED,
  TARGET_ISSUED,
  IMAGE_TRANSFERRED,
  VIDEO_TRANSFERRED,
  ASSET_READY,
  FAILED,
  RESET,
  ADOPTED_READY,
  ADOPTED_PROCESSING,
  ADOPTED_ERROR
}
