package com.scholary.recipe.media.client;

import com.scholary.recipe.media.api.ImageUploadRequest;
import com.scholary.recipe.media.api.VideoUploadRequest;
import com.scholary.recipe.media.asset.AssetType;
import com.scholary.recipe.media.client.MediaClientProperties.LimitProperties;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Obtains a one-time upload target for a file.
 *
 * <p>The file is checked against the context and the configured size and type limits before any
 * request is sent. Every failure, local or remote, completes the future with {@link
 * UploadRequestException}. Retrying after a failure asks for a new target and a new asset.
 */
public class UploadBroker {

  private static final Logger LOGGER = LoggerFactory.getLogger(UploadBroker.class);

  private final MediaApiClient apiClient;
  private final LimitProperties limits;

  public UploadBroker(MediaApiClient apiClient, LimitProperties limits) {
    this.apiClient = apiClient;
    this.limits = limits;
  }

  public CompletableFuture<UploadTarget> requestTarget(UploadRequest request) {
    try {
      validate(request);
    } catch (UploadRequestException e) {
      LOGGER.debug("Upload request refused locally: {}", e.getMessage());
      return CompletableFuture.failedFuture(e);
    }

    MediaFile file = request.file();
    CompletableFuture<UploadTarget> target;
    if (request.type() == AssetType.IMAGE) {
      target =
          apiClient.requestImageUpload(
              new ImageUploadRequest(
                  request.context(),
                  request.entityId(),
                  file.name(),
                  file.mimeType(),
                  file.size()));
    } else {
      target =
          apiClient.requestVideoUpload(
              new VideoUploadRequest(
                  request.context(),
                  request.entityId(),
                  file.name(),
                  file.mimeType(),
                  file.size(),
                  request.maxDurationSeconds()));
    }

    String fallback = "Failed to request " + request.type().value() + " upload";
    return target.handle(
        (issued, error) -> {
          if (error != null) {
            Throwable cause = Futures.unwrap(error);
            String message = cause.getMessage() != null ? cause.getMessage() : fallback;
            throw new UploadRequestException(message, cause);
          }
          if (issued == null || issued.assetId() == null || issued.uploadUrl() == null) {
            throw new UploadRequestException(fallback + ": incomplete upload target");
          }
          LOGGER.debug(
              "Upload target issued: assetId={}, protocol={}",
              issued.assetId(),
              issued.protocol().value());
          return issued;
        });
  }

  void validate(UploadRequest request) {
    AssetType type = request.type();
    if (!request.context().supports(type)) {
      throw new UploadRequestException(
          "Context " + request.context().value() + " does not accept " + type.value() + "s");
    }

    MediaFile file = request.file();
    List<String> allowedTypes =
        type == AssetType.IMAGE ? limits.imageMimeTypes() : limits.videoMimeTypes();
    String mimeType = file.mimeType() == null ? "" : file.mimeType().toLowerCase(Locale.ROOT);
    if (!allowedTypes.contains(mimeType)) {
      throw new UploadRequestException(
          "Unsupported " + type.value() + " type: " + file.mimeType());
    }

    long maxBytes = type == AssetType.IMAGE ? limits.maxImageBytes() : limits.maxVideoBytes();
    if (file.size() <= 0) {
      throw new UploadRequestException("File is empty");
    }
    if (file.size() > maxBytes) {
      throw new UploadRequestException(
          String.format(
              "File too large: %d bytes, the %s limit is %d bytes",
              file.size(), type.value(), maxBytes));
    }
  }
}
