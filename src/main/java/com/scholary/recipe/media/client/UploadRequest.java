package com.scholary.recipe.media.client;

import com.scholary.recipe.media.asset.AssetType;
import com.scholary.recipe.media.asset.MediaContext;
import java.util.Objects;

/**
 * One file to upload and where it will be shown.
 *
 * <p>{@code maxDurationSeconds} only applies to videos; null leaves the server default.
 */
public record UploadRequest(
    AssetType type,
    MediaContext context,
    String entityId,
    MediaFile file,
    Integer maxDurationSeconds) {

  public UploadRequest {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(context, "context");
    Objects.requireNonNull(file, "file");
  }

  public static UploadRequest image(MediaContext context, String entityId, MediaFile file) {
    return new UploadRequest(AssetType.IMAGE, context, entityId, file, null);
  }

  public static UploadRequest video(MediaContext context, String entityId, MediaFile file) {
    return new UploadRequest(AssetType.VIDEO, context, entityId, file, null);
  }
}
