package com.scholary.recipe.media.session;

/** Which stage of the pipeline an upload failed in. */
public enum UploadErrorKind {
  REQUEST,
  TRANSFER,
  CONFIRMATION,
  PROCESSING,
  PROCESSING_TIMEOUT
}
