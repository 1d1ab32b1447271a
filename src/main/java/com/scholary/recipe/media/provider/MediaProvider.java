package com.scholary.recipe.media.provider;

import com.scholary.recipe.media.asset.AssetType;
import com.scholary.recipe.media.asset.ReadyDetails;

/**
 * Contract with the external media host.
 *
 * <p>The provider issues one-time upload targets, accepts the file directly from the client,
 * finalizes images and reports video transcoding status. Implementations throw {@link
 * ProviderException} on failure and never touch the asset record store.
 */
public interface MediaProvider {

  /** Short provider name stored on each asset, e.g. {@code cloudflare}. */
  String name();

  /**
   * Issue an upload target for an image.
   *
   * @param metadata caller and file information forwarded to the provider
   * @return the provider asset id and the target the client sends bytes to
   * @throws ProviderException if the provider refuses or cannot be reached
   */
  UploadGrant createImageUpload(UploadMetadata metadata);

  /**
   * Issue an upload target for a video. Targets for large files should be resumable.
   *
   * @param metadata caller and file information forwarded to the provider
   * @param maxDurationSeconds longest video the provider should accept
   * @return the provider asset id and the target the client sends bytes to
   * @throws ProviderException if the provider refuses or cannot be reached
   */
  UploadGrant createVideoUpload(UploadMetadata metadata, int maxDurationSeconds);

  /**
   * Finalize an uploaded image and resolve its delivery URLs.
   *
   * @throws ProviderException with {@link ProviderException#isRejected()} set if the provider does
   *     not accept the uploaded content
   */
  ReadyDetails finalizeImage(String providerAssetId);

  /** Ask the provider how far transcoding of a video has progressed. */
  ProviderVideoState fetchVideoState(String providerAssetId);

  /** Remove the asset from the provider. */
  void deleteAsset(AssetType type, String providerAssetId);
}
