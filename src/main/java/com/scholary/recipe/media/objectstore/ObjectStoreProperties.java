package com.scholary.recipe.media.objectstore;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the S3-compatible object store provider.
 *
 * <p>These map to the "objectstore.*" keys in application.yml and are only bound when {@code
 * media.provider.type=object-store}. {@code publicBaseUrl} is the CDN or bucket URL objects are
 * served from.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotBlank String endpoint,
    @NotBlank String accessKey,
    @NotBlank String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess,
    @NotBlank String publicBaseUrl,
    @Positive int presignTtlMinutes) {}
