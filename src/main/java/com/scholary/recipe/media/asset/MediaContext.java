package com.scholary.recipe.media.asset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Where an uploaded asset will be shown.
 *
 * <p>Each context accepts a fixed set of asset types: profile photos are images only, recipe heroes
 * and steps accept both images and videos.
 */
public enum MediaContext {
  RECIPE("recipe", EnumSet.of(AssetType.IMAGE, AssetType.VIDEO)),
  STEP("step", EnumSet.of(AssetType.IMAGE, AssetType.VIDEO)),
  PROFILE("profile", EnumSet.of(AssetType.IMAGE));

  private final String value;
  private final Set<AssetType> supportedTypes;

  MediaContext(String value, Set<AssetType> supportedTypes) {
    this.value = value;
    this.supportedTypes = supportedTypes;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean supports(AssetType type) {
    return supportedTypes.contains(type);
  }

  @JsonCreator
  public static MediaContext fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (MediaContext context : values()) {
        if (context.value.equals(normalized)) {
          return context;
        }
      }
    }
    throw new IllegalArgumentException("Unknown media context: " + value);
  }
}
