package com.scholary.recipe.media.provider.cloudflare;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/** Result payloads of the Cloudflare Images and Stream endpoints this provider calls. */
final class CloudflareResults {

  private CloudflareResults() {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ImageDirectUpload(String id, @JsonProperty("uploadURL") String uploadUrl) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record ImageDetails(String id, String filename, List<String> variants, Boolean draft) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  record StreamDirectUpload(String uid, @JsonProperty("uploadURL") String uploadUrl) {}
}
