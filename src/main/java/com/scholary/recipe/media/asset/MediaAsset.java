package com.scholary.recipe.media.asset;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import java.time.Instant;

/**
 * One media asset as stored by the {@link AssetRecordStore} and returned by the media API.
 *
 * <p>Immutable: status changes produce a new instance through the {@code with*} methods, which
 * also refresh {@code updatedAt}. Delivery URLs and provider-reported dimensions are only set when
 * the asset becomes ready; {@code errorMessage} only when it fails.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record MediaAsset(
    String id,
    AssetType type,
    String provider,
    String providerAssetId,
    AssetStatus status,
    String url,
    String thumbnailUrl,
    String originalName,
    String mimeType,
    Long fileSize,
    Double durationSeconds,
    Integer width,
    Integer height,
    String errorMessage,
    String uploadedBy,
    Instant createdAt,
    Instant updatedAt) {

  public boolean isReady() {
    return status == AssetStatus.READY;
  }

  public MediaAsset withProcessing(Instant now) {
    return new MediaAsset(
        id,
        type,
        provider,
        providerAssetId,
        AssetStatus.PROCESSING,
        url,
        thumbnailUrl,
        originalName,
        mimeType,
        fileSize,
        durationSeconds,
        width,
        height,
        null,
        uploadedBy,
        createdAt,
        now);
  }

  public MediaAsset withReady(ReadyDetails details, Instant now) {
    return new MediaAsset(
        id,
        type,
        provider,
        providerAssetId,
        AssetStatus.READY,
        details.url(),
        details.thumbnailUrl(),
        originalName,
        mimeType,
        fileSize,
        details.durationSeconds(),
        details.width(),
        details.height(),
        null,
        uploadedBy,
        createdAt,
        now);
  }

  public MediaAsset withError(String message, Instant now) {
    return new MediaAsset(
        id,
        type,
        provider,
        providerAssetId,
        AssetStatus.ERROR,
        null,
        null,
        originalName,
        mimeType,
        fileSize,
        durationSeconds,
        width,
        height,
        message,
        uploadedBy,
        createdAt,
        now);
  }
}
