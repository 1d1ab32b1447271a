package com.scholary.recipe.media.api;

import com.scholary.recipe.media.asset.MediaContext;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/**
 * Request for a video upload target.
 *
 * <p>When {@code fileSize} is given the provider may issue a resumable target.
 */
public record VideoUploadRequest(
    @NotNull MediaContext context,
    @Size(max = 128) String entityId,
    @Size(max = 255) String originalName,
    @Size(max = 127) String mimeType,
    @Positive Long fileSize,
    @Min(1) @Max(3600) Integer maxDurationSeconds) {

  public static final int DEFAULT_MAX_DURATION_SECONDS = 600;

  public VideoUploadRequest {
    if (maxDurationSeconds == null) {
      maxDurationSeconds = DEFAULT_MAX_DURATION_SECONDS;
    }
  }
}
