package com.scholary.recipe.media.api;

import com.scholary.recipe.media.asset.MediaAsset;

/** Envelope for single-asset responses: {@code {"asset": {...}}}. */
public record AssetResponse(MediaAsset asset) {}
