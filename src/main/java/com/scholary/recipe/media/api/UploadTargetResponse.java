package com.scholary.recipe.media.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.recipe.media.asset.UploadProtocol;

/**
 * One-time upload target handed to the client.
 *
 * <p>{@code protocol} tells the client how to send the file to {@code uploadURL}.
 */
public record UploadTargetResponse(
    String assetId,
    @JsonProperty("uploadURL") String uploadUrl,
    String providerAssetId,
    UploadProtocol protocol) {}
