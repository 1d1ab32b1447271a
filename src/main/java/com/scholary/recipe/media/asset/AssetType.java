package com.scholary.recipe.media.asset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Kind of media asset.
 *
 * <p>Fixed when the asset is created. Images are finalized by an explicit confirmation round trip,
 * videos by polling the provider until transcoding finishes.
 */
public enum AssetType {
  IMAGE("image"),
  VIDEO("video");

  private final String value;

  AssetType(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static AssetType fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (AssetType type : values()) {
        if (type.value.equals(normalized)) {
          return type;
        }
      }
    }
    throw new IllegalArgumentException("Unknown asset type: " + value);
  }
}
