package com.scholary.recipe.media.asset;

/** Thrown when a media asset id does not resolve to a record. */
public class AssetNotFoundException extends RuntimeException {

  private final String assetId;

  public AssetNotFoundException(String assetId) {
    super("Media asset not found: " + assetId);
    this.assetId = assetId;
  }

  public String getAssetId() {
    return assetId;
  }
}
