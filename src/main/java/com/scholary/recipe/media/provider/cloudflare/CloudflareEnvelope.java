package com.scholary.recipe.media.provider.cloudflare;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.util.List;

/** Standard Cloudflare v4 API response wrapper. */
@JsonIgnoreProperties(ignoreUnknown = true)
record CloudflareEnvelope<T>(boolean success, List<CloudflareError> errors, T result) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  record CloudflareError(int code, String message) {}

  String firstErrorMessage() {
    if (errors == null || errors.isEmpty() || errors.get(0).message() == null) {
      return "Unknown error";
    }
    return errors.get(0).message();
  }
}
