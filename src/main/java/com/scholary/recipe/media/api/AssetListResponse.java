package com.scholary.recipe.media.api;

import com.scholary.recipe.media.asset.MediaAsset;
import java.util.List;

/** The caller's assets, newest first. */
public record AssetListResponse(List<MediaAsset> assets) {}
