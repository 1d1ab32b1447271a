package com.scholary.recipe.media.asset;

/**
 * Delivery data the provider reports once an asset is ready.
 *
 * <p>Duration and dimensions are usually only known for video.
 */
public record ReadyDetails(
    String url, String thumbnailUrl, Double durationSeconds, Integer width, Integer height) {

  public ReadyDetails {
    if (url == null || url.isBlank()) {
      throw new IllegalArgumentException("A ready asset needs a delivery url");
    }
  }

  public static ReadyDetails image(String url, String thumbnailUrl) {
    return new ReadyDetails(url, thumbnailUrl, null, null, null);
  }
}
