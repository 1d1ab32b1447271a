package com.scholary.recipe.media.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.recipe.media.api.AssetResponse;
import com.scholary.recipe.media.api.ImageUploadRequest;
import com.scholary.recipe.media.api.VideoUploadRequest;
import com.scholary.recipe.media.asset.MediaAsset;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asynchronous HTTP client for the media API.
 *
 * <p>Every call returns a future that fails with {@link MediaApiException}: with the HTTP status
 * and the server's {@code error} text for a non-2xx response, or with status -1 when the request
 * never got a response.
 *
 * <p>One instance is shared by the broker, the confirmation service and the poller of every
 * upload session; it holds no per-upload state.
 */
public class MediaApiClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(MediaApiClient.class);

  static final String USER_HEADER = "X-User-Id";

  private final HttpClient httpClient;
  private final MediaClientProperties properties;
  private final ObjectMapper objectMapper;
  private final String baseUrl;

  public MediaApiClient(
      MediaClientProperties properties, ObjectMapper objectMapper, Executor executor) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.baseUrl = stripTrailingSlash(properties.baseUrl());

    HttpClient.Builder builder =
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()));
    if (executor != null) {
      builder.executor(executor);
    }
    this.httpClient = builder.build();

    LOGGER.info("Initialized media API client: baseUrl={}", baseUrl);
  }

  /** Ask for a one-time image upload target. */
  public CompletableFuture<UploadTarget> requestImageUpload(ImageUploadRequest request) {
    return post("/upload/image", request, UploadTarget.class);
  }

  /** Ask for a one-time video upload target. */
  public CompletableFuture<UploadTarget> requestVideoUpload(VideoUploadRequest request) {
    return post("/upload/video", request, UploadTarget.class);
  }

  /** Finalize a transferred image. */
  public CompletableFuture<MediaAsset> confirmImageUpload(String assetId) {
    return post("/" + assetId + "/confirm", null, AssetResponse.class)
        .thenApply(AssetResponse::asset);
  }

  /** Ask the server to refresh a video's processing status. */
  public CompletableFuture<MediaAsset> pollVideoStatus(String assetId) {
    return post("/" + assetId + "/poll", null, AssetResponse.class)
        .thenApply(AssetResponse::asset);
  }

  public CompletableFuture<MediaAsset> getAsset(String assetId) {
    HttpRequest request = newRequest("/" + assetId).GET().build();
    return exchange(request, AssetResponse.class).thenApply(AssetResponse::asset);
  }

  public CompletableFuture<Void> deleteAsset(String assetId) {
    HttpRequest request = newRequest("/" + assetId).DELETE().build();
    return exchange(request, Void.class);
  }

  private <T> CompletableFuture<T> post(String path, Object body, Class<T> responseType) {
    HttpRequest.Builder builder = newRequest(path);
    if (body == null) {
      builder.POST(BodyPublishers.noBody());
    } else {
      try {
        builder
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofByteArray(objectMapper.writeValueAsBytes(body)));
      } catch (JsonProcessingException e) {
        return CompletableFuture.failedFuture(
            new MediaApiException("Failed to encode request body", e));
      }
    }
    return exchange(builder.build(), responseType);
  }

  private HttpRequest.Builder newRequest(String path) {
    HttpRequest.Builder builder =
        HttpRequest.newBuilder()
            .uri(URI.create(baseUrl + "/api/media" + path))
            .timeout(Duration.ofSeconds(properties.requestTimeout()))
            .header("Accept", "application/json");
    if (hasText(properties.bearerToken())) {
      builder.header("Authorization", "Bearer " + properties.bearerToken());
    }
    if (hasText(properties.userId())) {
      builder.header(USER_HEADER, properties.userId());
    }
    return builder;
  }

  private <T> CompletableFuture<T> exchange(HttpRequest request, Class<T> responseType) {
    LOGGER.debug("Media API request: {} {}", request.method(), request.uri());
    return httpClient
        .sendAsync(request, HttpResponse.BodyHandlers.ofString())
        .handle(
            (response, error) -> {
              if (error != null) {
                Throwable cause = Futures.unwrap(error);
                throw new MediaApiException("Network error: " + describe(cause), cause);
              }
              return parse(request, response, responseType);
            });
  }

  private <T> T parse(HttpRequest request, HttpResponse<String> response, Class<T> responseType) {
    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      String message = errorMessage(response.body(), status);
      LOGGER.debug(
          "Media API error: {} {} -> {} {}", request.method(), request.uri(), status, message);
      throw new MediaApiException(status, message);
    }
    if (responseType == Void.class) {
      return null;
    }
    try {
      return objectMapper.readValue(response.body(), responseType);
    } catch (JsonProcessingException e) {
      throw new MediaApiException("Unreadable response from media API", e);
    }
  }

  private String errorMessage(String body, int status) {
    if (hasText(body)) {
      try {
        JsonNode error = objectMapper.readTree(body).path("error");
        if (error.isTextual() && !error.asText().isBlank()) {
          return error.asText();
        }
      } catch (JsonProcessingException e) {
        LOGGER.debug("Error response is not JSON: status={}", status);
      }
    }
    return "Media API returned status " + status;
  }

  private static String describe(Throwable cause) {
    return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }

  private static String stripTrailingSlash(String url) {
    return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
  }
}
