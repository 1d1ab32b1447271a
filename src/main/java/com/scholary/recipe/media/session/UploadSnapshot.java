package com.scholary.recipe.media.session;

import com.scholary.recipe.media.asset.MediaAsset;

/**
 * Immutable view of an upload session at one point in time.
 *
 * <p>{@code asset} is set once the session is ready, or while an adopted video is processing;
 * {@code error} only in {@code error}.
 */
public record UploadSnapshot(
    UploadStatus status, int progress, MediaAsset asset, UploadError error) {

  static final UploadSnapshot IDLE = new UploadSnapshot(UploadStatus.IDLE, 0, null, null);
}
