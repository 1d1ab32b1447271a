package com.scholary.recipe.media.provider;

import com.scholary.recipe.media.asset.UploadProtocol;

/** A one-time upload target issued by the provider. */
public record UploadGrant(String providerAssetId, String uploadUrl, UploadProtocol protocol) {}
