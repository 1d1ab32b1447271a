package com.scholary.recipe.media.provider.cloudflare;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.scholary.recipe.media.asset.ReadyDetails;
import com.scholary.recipe.media.provider.ProviderVideoState;
import java.util.Map;

/**
 * A Cloudflare Stream video as returned by {@code GET /stream/{uid}}.
 *
 * <p>Stream posts the same document to the webhook endpoint when processing finishes or fails.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record StreamVideo(
    String uid,
    Boolean readyToStream,
    Status status,
    String thumbnail,
    Playback playback,
    Double duration,
    Input input,
    Map<String, String> meta) {

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Status(
      String state, String pctComplete, String errorReasonCode, String errorReasonText) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Playback(String hls, String dash) {}

  @JsonIgnoreProperties(ignoreUnknown = true)
  public record Input(Integer width, Integer height) {}

  /** Map the Stream document onto the provider-neutral video state. */
  public ProviderVideoState toVideoState() {
    if (Boolean.TRUE.equals(readyToStream) && playback != null && playback.hls() != null) {
      return ProviderVideoState.ready(
          new ReadyDetails(
              playback.hls(),
              thumbnail,
              duration,
              input != null ? input.width() : null,
              input != null ? input.height() : null));
    }
    if (status != null && "error".equalsIgnoreCase(status.state())) {
      String reason = status.errorReasonText();
      if (reason == null || reason.isBlank()) {
        reason = status.errorReasonCode();
      }
      return ProviderVideoState.error(
          reason == null || reason.isBlank() ? "Processing failed" : reason);
    }
    return ProviderVideoState.processing();
  }
}
