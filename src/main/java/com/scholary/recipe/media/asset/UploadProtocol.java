package com.scholary.recipe.media.asset;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Locale;

/** How the bytes of a file are moved to a provider-issued upload target. */
public enum UploadProtocol {
  /** Single {@code POST}, whole file as the only part of a multipart body. */
  FORM_POST("form-post"),
  /** Resumable tus 1.0.0 upload: {@code HEAD} for the offset, {@code PATCH} per chunk. */
  TUS("tus"),
  /** Single {@code PUT} of the raw bytes to a presigned object-store URL. */
  PUT("put");

  private final String value;

  UploadProtocol(String value) {
    this.value = value;
  }

  @JsonValue
  public String value() {
    return value;
  }

  @JsonCreator
  public static UploadProtocol fromValue(String value) {
    if (value != null) {
      String normalized = value.trim().toLowerCase(Locale.ROOT);
      for (UploadProtocol protocol : values()) {
        if (protocol.value.equals(normalized)) {
          return protocol;
        }
      }
    }
    throw new IllegalArgumentException("Unknown upload protocol: " + value);
  }
}
