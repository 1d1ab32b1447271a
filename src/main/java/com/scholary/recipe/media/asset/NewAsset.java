package com.scholary.recipe.media.asset;

/** Data captured when the provider issues an upload target; becomes a {@code pending} asset. */
public record NewAsset(
    AssetType type,
    String provider,
    String providerAssetId,
    String originalName,
    String mimeType,
    Long fileSize,
    String uploadedBy) {}
