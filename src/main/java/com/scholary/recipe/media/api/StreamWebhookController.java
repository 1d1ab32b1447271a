package com.scholary.recipe.media.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.recipe.media.provider.cloudflare.StreamVideo;
import com.scholary.recipe.media.provider.cloudflare.StreamWebhookVerifier;
import com.scholary.recipe.media.service.MediaAssetService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Receives Cloudflare Stream notifications so videos can become ready without being polled.
 *
 * <p>The body is read as a raw string because the signature covers the exact bytes sent.
 * Notifications for unknown videos are acknowledged and ignored.
 */
@RestController
@RequestMapping("/api/media/webhook")
@ConditionalOnProperty(name = "media.provider.type", havingValue = "cloudflare")
@Tag(name = "Media webhooks", description = "Provider push notifications")
public class StreamWebhookController {

  static final String SIGNATURE_HEADER = "Webhook-Signature";

  private static final Logger LOGGER = LoggerFactory.getLogger(StreamWebhookController.class);

  private final MediaAssetService mediaAssetService;
  private final StreamWebhookVerifier verifier;
  private final ObjectMapper objectMapper;

  public StreamWebhookController(
      MediaAssetService mediaAssetService,
      StreamWebhookVerifier verifier,
      ObjectMapper objectMapper) {
    this.mediaAssetService = mediaAssetService;
    this.verifier = verifier;
    this.objectMapper = objectMapper;
  }

  @PostMapping("/stream")
  @Operation(summary = "Cloudflare Stream video state notification")
  public ResponseEntity<ErrorResponse> onStreamNotification(
      @RequestHeader(value = SIGNATURE_HEADER, required = false) String signature,
      @RequestBody String rawBody) {
    if (verifier.isEnabled() && !verifier.verify(signature, rawBody)) {
      LOGGER.warn("Rejected Stream webhook with invalid signature");
      return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
          .body(ErrorResponse.of("Invalid webhook signature"));
    }

    StreamVideo video;
    try {
      video = objectMapper.readValue(rawBody, StreamVideo.class);
    } catch (JsonProcessingException e) {
      LOGGER.warn("Unreadable Stream webhook body: {}", e.getOriginalMessage());
      return ResponseEntity.badRequest().body(ErrorResponse.of("Invalid webhook body"));
    }
    if (video.uid() == null || video.uid().isBlank()) {
      return ResponseEntity.badRequest().body(ErrorResponse.of("Missing video uid"));
    }

    LOGGER.info("Stream webhook received: uid={}", video.uid());
    mediaAssetService.handleVideoNotification(video.uid(), video.toVideoState());
    return ResponseEntity.ok().build();
  }
}
