package com.scholary.recipe.media.provider;

import com.scholary.recipe.media.asset.MediaContext;

/** What the provider is told about an upload when the target is requested. */
public record UploadMetadata(
    String userId,
    MediaContext context,
    String entityId,
    String originalName,
    String mimeType,
    Long fileSize) {}
