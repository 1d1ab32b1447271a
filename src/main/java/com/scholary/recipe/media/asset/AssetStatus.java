package com.scholary.recipe.media.asset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/**
 * Lifecycle status of a persisted media asset.
 *
 * <p>Transitions only move forward: {@code pending -> processing -> ready|error} or {@code pending
 * -> ready|error}. Once an asset is {@link #READY} or {@link #ERROR} it never changes status again;
 * a retried upload creates a new asset instead.
 */
public enum AssetStatus {
  PENDING("pending"),
  PROCESSING("processing"),
  READY("ready"),
  ERROR("error");

  private final String value;

  AssetStatus(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  public boolean isTerminal() {
    return this == READY || this == ERROR;
  }

  /**
   * Whether an asset currently in this status may move to {@code next}.
   *
   * <p>{@code processing -> processing} is allowed so repeated polls can refresh {@code updatedAt}.
   */
  public boolean canTransitionTo(AssetStatus next) {
    return switch (this) {
      case PENDING -> next != PENDING;
      case PROCESSING -> next != PENDING;
      case READY, ERROR -> false;
    };
  }

  @JsonCreator
  public static AssetStatus fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (AssetStatus status : values()) {
        if (status.value.equals(normalized)) {
          return status;
        }
      }
    }
    throw new IllegalArgumentException("Unknown asset status: " + value);
  }
}
