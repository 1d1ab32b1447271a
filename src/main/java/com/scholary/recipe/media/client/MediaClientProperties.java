package com.scholary.recipe.media.client;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the upload client.
 *
 * <p>These map to the "media.client.*" keys in application.yml. {@code bearerToken} and {@code
 * userId} are optional; {@code userId} is only needed when talking to the media API without the
 * authenticating gateway in front of it. Timeouts are in seconds.
 */
@ConfigurationProperties(prefix = "media.client")
@Validated
public record MediaClientProperties(
    @NotBlank String baseUrl,
    String bearerToken,
    String userId,
    @Positive int connectTimeout,
    @Positive int requestTimeout,
    @NotNull @Valid PollingProperties polling,
    @NotNull @Valid TransferProperties transfer,
    @NotNull @Valid LimitProperties limits) {

  public record PollingProperties(@Positive long intervalMillis, @Positive int maxAttempts) {}

  /**
   * Byte transfer settings. {@code timeout} bounds a single HTTP exchange with the upload host, not
   * the whole transfer.
   */
  public record TransferProperties(
      @Positive int chunkSizeBytes,
      @PositiveOrZero int maxResumeAttempts,
      @PositiveOrZero long resumeBackoffMillis,
      @Positive int timeout) {}

  public record LimitProperties(
      @Positive long maxImageBytes,
      @Positive long maxVideoBytes,
      @NotEmpty List<String> imageMimeTypes,
      @NotEmpty List<String> videoMimeTypes) {}
}
