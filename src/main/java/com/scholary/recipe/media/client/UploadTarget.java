package com.scholary.recipe.media.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.scholary.recipe.media.asset.UploadProtocol;

/**
 * Where and how to send the file for one upload, as issued by the media API.
 *
 * <p>A server that does not say which protocol to use expects a multipart form post.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record UploadTarget(
    String assetId,
    @JsonProperty("uploadURL") String uploadUrl,
    String providerAssetId,
    UploadProtocol protocol) {

  public UploadTarget {
    if (protocol == null) {
      protocol = UploadProtocol.FORM_POST;
    }
  }
}
