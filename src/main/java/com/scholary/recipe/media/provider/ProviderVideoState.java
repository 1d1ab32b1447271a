package com.scholary.recipe.media.provider;

import com.scholary.recipe.media.asset.ReadyDetails;

/**
 * Transcoding state of a video as reported by the provider.
 *
 * <p>{@code details} is only present when {@code phase} is {@link Phase#READY}, {@code
 * errorMessage} only when it is {@link Phase#ERROR}.
 */
public record ProviderVideoState(Phase phase, ReadyDetails details, String errorMessage) {

  public enum Phase {
    PROCESSING,
    READY,
    ERROR
  }

  public static ProviderVideoState processing() {
    return new ProviderVideoState(Phase.PROCESSING, null, null);
  }

  public static ProviderVideoState ready(ReadyDetails details) {
    return new ProviderVideoState(Phase.READY, details, null);
  }

  public static ProviderVideoState error(String errorMessage) {
    return new ProviderVideoState(Phase.ERROR, null, errorMessage);
  }
}
