package com.scholary.recipe.media.asset;

/**
 * Thrown when a status change would move an asset backwards, e.g. {@code ready -> processing}.
 *
 * <p>Terminal assets are never resurrected; callers that want to retry must start a new upload.
 */
public class IllegalAssetTransitionException extends RuntimeException {

  public IllegalAssetTransitionException(String assetId, AssetStatus from, AssetStatus to) {
    super(
        String.format(
            "Illegal status transition for asset %s: %s -> %s", assetId, from.value(), to.value()));
  }
}
