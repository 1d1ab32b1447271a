package com.scholary.recipe.media.session;

/** Why an upload session ended in {@code error}. */
public record UploadError(UploadErrorKind kind, String message) {}
