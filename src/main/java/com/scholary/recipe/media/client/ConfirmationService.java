package com.scholary.recipe.media.client;

import com.scholary.recipe.media.asset.AssetStatus;
import com.scholary.recipe.media.asset.MediaAsset;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Finalizes an image after its bytes reached the upload host.
 *
 * <p>One request, never retried. The future completes with the asset only when the server reports
 * it {@code ready} with a delivery URL; anything else fails with {@link ConfirmationException}.
 */
public class ConfirmationService {

  private static final Logger LOGGER = LoggerFactory.getLogger(ConfirmationService.class);

  static final String DEFAULT_FAILURE = "Failed to confirm image upload";

  private final MediaApiClient apiClient;

  public ConfirmationService(MediaApiClient apiClient) {
    this.apiClient = apiClient;
  }

  public CompletableFuture<MediaAsset> confirm(String assetId) {
    return apiClient
        .confirmImageUpload(assetId)
        .handle(
            (asset, error) -> {
              if (error != null) {
                Throwable cause = Futures.unwrap(error);
                String message = cause.getMessage() != null ? cause.getMessage() : DEFAULT_FAILURE;
                throw new ConfirmationException(message, cause);
              }
              return check(assetId, asset);
            });
  }

  private MediaAsset check(String assetId, MediaAsset asset) {
    if (asset == null) {
      throw new ConfirmationException(DEFAULT_FAILURE);
    }
    if (asset.status() == AssetStatus.ERROR) {
      String message =
          asset.errorMessage() != null && !asset.errorMessage().isBlank()
              ? asset.errorMessage()
              : "Image processing failed";
      LOGGER.info("Image {} was rejected: {}", assetId, message);
      throw new ConfirmationException(message);
    }
    if (asset.status() != AssetStatus.READY || asset.url() == null) {
      throw new ConfirmationException(
          "Image is not ready after confirmation: status=" + asset.status().value());
    }
    return asset;
  }
}
