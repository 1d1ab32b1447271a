package com.scholary.recipe.media.service;

import com.scholary.recipe.media.api.ImageUploadRequest;
import com.scholary.recipe.media.api.UploadTargetResponse;
import com.scholary.recipe.media.api.VideoUploadRequest;
import com.scholary.recipe.media.asset.AssetNotFoundException;
import com.scholary.recipe.media.asset.AssetRecordStore;
import com.scholary.recipe.media.asset.AssetStatus;
import com.scholary.recipe.media.asset.AssetType;
import com.scholary.recipe.media.asset.IllegalAssetTransitionException;
import com.scholary.recipe.media.asset.MediaAsset;
import com.scholary.recipe.media.asset.NewAsset;
import com.scholary.recipe.media.asset.ReadyDetails;
import com.scholary.recipe.media.logging.StructuredLogger;
import com.scholary.recipe.media.provider.MediaProvider;
import com.scholary.recipe.media.provider.ProviderException;
import com.scholary.recipe.media.provider.ProviderVideoState;
import com.scholary.recipe.media.provider.UploadGrant;
import com.scholary.recipe.media.provider.UploadMetadata;
import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Server side of the media upload pipeline.
 *
 * <p>Issues upload targets through the configured {@link MediaProvider} and keeps the matching
 * {@link MediaAsset} records in the {@link AssetRecordStore}. A record is only created after the
 * provider has issued a target, so a failed request leaves nothing behind.
 *
 * <p>Every operation on an existing asset checks that the caller uploaded it.
 */
public class MediaAssetService {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaAssetService.class);
  private static final String DEFAULT_PROCESSING_ERROR = "Processing failed";

  private final MediaProvider provider;
  private final AssetRecordStore store;
  private final StructuredLogger structuredLogger;

  public MediaAssetService(MediaProvider provider, AssetRecordStore store) {
    this.provider = provider;
    this.store = store;
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  /**
   * Ask the provider for a one-time image upload target and record a pending asset.
   *
   * @throws InvalidUploadRequestException if the context does not accept images
   * @throws ProviderException if the provider could not issue a target
   */
  public UploadTargetResponse createImageUpload(String userId, ImageUploadRequest request) {
    if (!request.context().supports(AssetType.IMAGE)) {
      throw new InvalidUploadRequestException(
          "Context " + request.context().value() + " does not accept images");
    }
    UploadMetadata metadata =
        new UploadMetadata(
            userId,
            request.context(),
            request.entityId(),
            request.originalName(),
            request.mimeType(),
            request.fileSize());

    UploadGrant grant = provider.createImageUpload(metadata);
    return register(AssetType.IMAGE, userId, metadata, grant);
  }

  /**
   * Ask the provider for a one-time video upload target and record a pending asset.
   *
   * @throws InvalidUploadRequestException if the context does not accept videos
   * @throws ProviderException if the provider could not issue a target
   */
  public UploadTargetResponse createVideoUpload(String userId, VideoUploadRequest request) {
    if (!request.context().supports(AssetType.VIDEO)) {
      throw new InvalidUploadRequestException(
          "Context " + request.context().value() + " does not accept videos");
    }
    UploadMetadata metadata =
        new UploadMetadata(
            userId,
            request.context(),
            request.entityId(),
            request.originalName(),
            request.mimeType(),
            request.fileSize());

    UploadGrant grant = provider.createVideoUpload(metadata, request.maxDurationSeconds());
    return register(AssetType.VIDEO, userId, metadata, grant);
  }

  /**
   * Look up an asset the caller owns.
   *
   * @throws AssetNotFoundException if there is no such asset
   * @throws AssetAccessDeniedException if someone else uploaded it
   */
  public MediaAsset getOwned(String userId, String assetId) {
    MediaAsset asset =
        store.findById(assetId).orElseThrow(() -> new AssetNotFoundException(assetId));
    if (!asset.uploadedBy().equals(userId)) {
      throw new AssetAccessDeniedException("Not allowed to access media asset " + assetId);
    }
    return asset;
  }

  public List<MediaAsset> listForUser(String userId) {
    return store.findByUploader(userId);
  }

  /**
   * Finalize an image after the client transferred it.
   *
   * <p>If the provider refuses the image (upload never completed, corrupt file) the asset is
   * marked {@code error} and returned; an unreachable provider propagates as {@link
   * ProviderException} and leaves the asset untouched so the call can be repeated.
   */
  public MediaAsset confirmImageUpload(String userId, String assetId) {
    MediaAsset asset = getOwned(userId, assetId);
    if (asset.type() != AssetType.IMAGE) {
      throw new AssetTypeMismatchException("Only images can be confirmed");
    }
    if (asset.status().isTerminal()) {
      return asset;
    }

    try {
      ReadyDetails details = provider.finalizeImage(asset.providerAssetId());
      return transition(asset, () -> store.markReady(assetId, details));
    } catch (ProviderException e) {
      if (!e.isRejected()) {
        throw e;
      }
      LOGGER.warn("Provider rejected image {}: {}", assetId, e.getMessage());
      return transition(asset, () -> store.markError(assetId, e.getMessage()));
    }
  }

  /**
   * Refresh a video's processing state from the provider.
   *
   * <p>Terminal assets are returned as they are, without a provider call.
   */
  public MediaAsset pollVideoStatus(String userId, String assetId) {
    MediaAsset asset = getOwned(userId, assetId);
    if (asset.type() != AssetType.VIDEO) {
      throw new AssetTypeMismatchException("Only videos can be polled");
    }
    if (asset.status().isTerminal()) {
      return asset;
    }
    return apply(asset, provider.fetchVideoState(asset.providerAssetId()));
  }

  /**
   * Delete an asset and its provider object.
   *
   * <p>The provider delete is best effort: a failure is logged and the record is removed anyway.
   */
  public void delete(String userId, String assetId) {
    MediaAsset asset = getOwned(userId, assetId);
    try {
      provider.deleteAsset(asset.type(), asset.providerAssetId());
    } catch (ProviderException e) {
      LOGGER.warn(
          "Failed to delete provider object {} for asset {}: {}",
          asset.providerAssetId(),
          assetId,
          e.getMessage());
    }
    store.delete(assetId);
    LOGGER.info("Deleted media asset: id={}, type={}", assetId, asset.type().value());
  }

  /**
   * Apply a provider push notification for a video.
   *
   * @return the updated asset, or empty if the video is unknown or already terminal
   */
  public Optional<MediaAsset> handleVideoNotification(
      String providerAssetId, ProviderVideoState state) {
    Optional<MediaAsset> found = store.findByProviderAssetId(providerAssetId);
    if (found.isEmpty()) {
      LOGGER.info("Ignoring notification for unknown video {}", providerAssetId);
      return Optional.empty();
    }
    MediaAsset asset = found.get();
    if (asset.type() != AssetType.VIDEO || asset.status().isTerminal()) {
      LOGGER.debug(
          "Ignoring notification for asset {} in status {}", asset.id(), asset.status().value());
      return Optional.empty();
    }
    return Optional.of(apply(asset, state));
  }

  private UploadTargetResponse register(
      AssetType type, String userId, UploadMetadata metadata, UploadGrant grant) {
    MediaAsset asset =
        store.createPending(
            new NewAsset(
                type,
                provider.name(),
                grant.providerAssetId(),
                metadata.originalName(),
                metadata.mimeType(),
                metadata.fileSize(),
                userId));

    LOGGER.info(
        "Issued {} upload target: assetId={}, providerAssetId={}, protocol={}, context={}",
        type.value(),
        asset.id(),
        grant.providerAssetId(),
        grant.protocol().value(),
        metadata.context().value());

    return new UploadTargetResponse(
        asset.id(), grant.uploadUrl(), grant.providerAssetId(), grant.protocol());
  }

  private MediaAsset apply(MediaAsset asset, ProviderVideoState state) {
    return switch (state.phase()) {
      case READY -> transition(asset, () -> store.markReady(asset.id(), state.details()));
      case ERROR -> transition(asset, () -> store.markError(asset.id(), errorMessage(state)));
      case PROCESSING -> asset.status() == AssetStatus.PROCESSING
          ? asset
          : transition(asset, () -> store.markProcessing(asset.id()));
    };
  }

  /**
   * Run a status change. A poll, a confirmation and a provider notification can race on the same
   * asset; when another one already moved it to a later status, the current record is returned.
   */
  private MediaAsset transition(MediaAsset before, Supplier<MediaAsset> change) {
    try {
      return transitioned(before, change.get());
    } catch (IllegalAssetTransitionException e) {
      MediaAsset current =
          store.findById(before.id()).orElseThrow(() -> new AssetNotFoundException(before.id()));
      LOGGER.debug(
          "Asset {} already moved to {}: {}",
          before.id(),
          current.status().value(),
          e.getMessage());
      return current;
    }
  }

  private static String errorMessage(ProviderVideoState state) {
    String message = state.errorMessage();
    return message == null || message.isBlank() ? DEFAULT_PROCESSING_ERROR : message;
  }

  private MediaAsset transitioned(MediaAsset before, MediaAsset after) {
    structuredLogger.logAssetStatus(after.id(), before.status().value(), after.status().value());
    return after;
  }
}
