package com.scholary.recipe.media.provider.cloudflare;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the Cloudflare Images and Stream provider.
 *
 * <p>These map to the "media.provider.cloudflare.*" keys in application.yml. {@code webhookSecret}
 * is optional; without it Stream webhooks are accepted unsigned. Timeouts are in seconds.
 */
@ConfigurationProperties(prefix = "media.provider.cloudflare")
@Validated
public record CloudflareProperties(
    @NotBlank String apiBaseUrl,
    @NotBlank String accountId,
    @NotBlank String apiToken,
    @NotBlank String imagesAccountHash,
    @NotBlank String imageDeliveryBaseUrl,
    String webhookSecret,
    @Positive int webhookMaxAgeSeconds,
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int maxRetries) {}
