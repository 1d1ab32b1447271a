package com.scholary.recipe.media.asset;

import java.util.List;
import java.util.Optional;

/**
 * Persistence for media asset records.
 *
 * <p>The upload pipeline only creates pending records and moves them forward through {@link
 * AssetStatus}. Implementations must reject backward transitions with {@link
 * IllegalAssetTransitionException}.
 */
public interface AssetRecordStore {

  /**
   * Create a record in {@code pending} status.
   *
   * @param asset data captured at request time
   * @return the stored record with its assigned id
   */
  MediaAsset createPending(NewAsset asset);

  /**
   * Move an asset to {@code processing}.
   *
   * @throws AssetNotFoundException if the asset does not exist
   * @throws IllegalAssetTransitionException if the asset is already terminal
   */
  MediaAsset markProcessing(String assetId);

  /**
   * Move an asset to {@code ready} with its delivery data.
   *
   * @throws AssetNotFoundException if the asset does not exist
   * @throws IllegalAssetTransitionException if the asset is already terminal
   */
  MediaAsset markReady(String assetId, ReadyDetails details);

  /**
   * Move an asset to {@code error}.
   *
   * @throws AssetNotFoundException if the asset does not exist
   * @throws IllegalAssetTransitionException if the asset is already terminal
   */
  MediaAsset markError(String assetId, String errorMessage);

  Optional<MediaAsset> findById(String assetId);

  Optional<MediaAsset> findByProviderAssetId(String providerAssetId);

  /** All assets uploaded by a user, newest first. */
  List<MediaAsset> findByUploader(String userId);

  /**
   * Remove a record. Only used by the explicit delete endpoint.
   *
   * @return true if a record was removed
   */
  boolean delete(String assetId);
}
