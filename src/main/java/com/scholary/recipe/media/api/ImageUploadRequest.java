package com.scholary.recipe.media.api;

import com.scholary.recipe.media.asset.MediaContext;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.Size;

/** Request for an image upload target. */
public record ImageUploadRequest(
    @NotNull MediaContext context,
    @Size(max = 128) String entityId,
    @Size(max = 255) String originalName,
    @Size(max = 127) String mimeType,
    @Positive Long fileSize) {}
