package com.scholary.recipe.media.provider.cloudflare;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JavaType;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.recipe.media.asset.AssetType;
import com.scholary.recipe.media.asset.ReadyDetails;
import com.scholary.recipe.media.asset.UploadProtocol;
import com.scholary.recipe.media.provider.MediaProvider;
import com.scholary.recipe.media.provider.ProviderException;
import com.scholary.recipe.media.provider.ProviderVideoState;
import com.scholary.recipe.media.provider.UploadGrant;
import com.scholary.recipe.media.provider.UploadMetadata;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Media provider backed by Cloudflare Images (pictures) and Cloudflare Stream (video).
 *
 * <p>Images get a one-time direct upload URL that accepts a multipart {@code POST}. Videos get a
 * resumable tus upload when the client announced the file size, otherwise a basic direct upload
 * URL. Stream transcodes asynchronously; its progress is read back through {@link
 * #fetchVideoState(String)} or pushed to the webhook endpoint.
 *
 * <p>Transport failures are retried with exponential backoff. Responses are never retried: a 4xx
 * from Cloudflare is reported as a rejection, a 5xx as a provider failure.
 */
public class CloudflareMediaProvider implements MediaProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(CloudflareMediaProvider.class);

  static final String NAME = "cloudflare";
  private static final String TUS_VERSION = "1.0.0";

  private final HttpClient httpClient;
  private final CloudflareProperties properties;
  private final ObjectMapper objectMapper;

  public CloudflareMediaProvider(CloudflareProperties properties, ObjectMapper objectMapper) {
    this.properties = properties;
    this.objectMapper = objectMapper;
    this.httpClient =
        HttpClient.newBuilder()
            .version(HttpClient.Version.HTTP_1_1)
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .build();

    LOGGER.info(
        "Initialized Cloudflare provider: apiBaseUrl={}, accountId={}",
        properties.apiBaseUrl(),
        properties.accountId());
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public UploadGrant createImageUpload(UploadMetadata metadata) {
    LOGGER.debug("Creating image direct upload: context={}", metadata.context().value());

    String boundary = UUID.randomUUID().toString();
    Map<String, String> fields = new LinkedHashMap<>();
    fields.put("metadata", toJson(providerMeta(metadata)));
    fields.put("requireSignedURLs", "false");

    HttpRequest request =
        authorized(accountUri("/images/v2/direct_upload"))
            .header("Content-Type", "multipart/form-data; boundary=" + boundary)
            .POST(BodyPublishers.ofByteArray(buildFormFields(fields, boundary)))
            .build();

    CloudflareResults.ImageDirectUpload result =
        sendForResult(request, CloudflareResults.ImageDirectUpload.class, "Cloudflare Images");

    LOGGER.debug("Image upload URL created: {}", result.id());
    return new UploadGrant(result.id(), result.uploadUrl(), UploadProtocol.FORM_POST);
  }

  @Override
  public UploadGrant createVideoUpload(UploadMetadata metadata, int maxDurationSeconds) {
    if (metadata.fileSize() != null && metadata.fileSize() > 0) {
      return createResumableVideoUpload(metadata, maxDurationSeconds);
    }

    LOGGER.debug("Creating video direct upload: context={}", metadata.context().value());

    Map<String, Object> body = new LinkedHashMap<>();
    body.put("maxDurationSeconds", maxDurationSeconds);
    body.put("meta", providerMeta(metadata));

    HttpRequest request =
        authorized(accountUri("/stream/direct_upload"))
            .header("Content-Type", "application/json")
            .POST(BodyPublishers.ofString(toJson(body)))
            .build();

    CloudflareResults.StreamDirectUpload result =
        sendForResult(request, CloudflareResults.StreamDirectUpload.class, "Cloudflare Stream");

    LOGGER.debug("Video upload URL created: {}", result.uid());
    return new UploadGrant(result.uid(), result.uploadUrl(), UploadProtocol.FORM_POST);
  }

  /**
   * Create a tus upload on Stream on behalf of the end user.
   *
   * <p>Stream answers with the upload location in the {@code Location} header and the video uid in
   * {@code stream-media-id}; the client then talks tus directly to that location.
   */
  private UploadGrant createResumableVideoUpload(UploadMetadata metadata, int maxDurationSeconds) {
    LOGGER.debug(
        "Creating resumable video upload: context={}, fileSize={}",
        metadata.context().value(),
        metadata.fileSize());

    StringBuilder uploadMetadata =
        new StringBuilder("maxDurationSeconds ").append(base64(String.valueOf(maxDurationSeconds)));
    if (metadata.originalName() != null && !metadata.originalName().isBlank()) {
      uploadMetadata.append(",name ").append(base64(metadata.originalName()));
    }

    HttpRequest request =
        authorized(accountUri("/stream?direct_user=true"))
            .header("Tus-Resumable", TUS_VERSION)
            .header("Upload-Length", String.valueOf(metadata.fileSize()))
            .header("Upload-Metadata", uploadMetadata.toString())
            .POST(BodyPublishers.noBody())
            .build();

    HttpResponse<String> response = send(request);
    if (response.statusCode() / 100 != 2) {
      throw failure("Cloudflare Stream", response);
    }

    String location = response.headers().firstValue("Location").orElse(null);
    String uid = response.headers().firstValue("stream-media-id").orElse(null);
    if (location == null || uid == null) {
      throw new ProviderException(
          "Cloudflare Stream error: tus creation response is missing Location or stream-media-id",
          response.statusCode(),
          false);
    }

    LOGGER.debug("Resumable video upload created: {}", uid);
    return new UploadGrant(uid, location, UploadProtocol.TUS);
  }

  /**
   * Resolve delivery URLs for an uploaded image.
   *
   * <p>An image that is still a draft (its direct upload URL was never used) counts as rejected.
   */
  @Override
  public ReadyDetails finalizeImage(String providerAssetId) {
    HttpRequest request =
        authorized(accountUri("/images/v1/" + providerAssetId)).GET().build();

    CloudflareResults.ImageDetails details =
        sendForResult(request, CloudflareResults.ImageDetails.class, "Cloudflare Images");

    if (Boolean.TRUE.equals(details.draft())) {
      throw ProviderException.rejected("Image upload has not completed");
    }

    return ReadyDetails.image(
        deliveryUrl(providerAssetId, "public"), deliveryUrl(providerAssetId, "thumbnail"));
  }

  @Override
  public ProviderVideoState fetchVideoState(String providerAssetId) {
    HttpRequest request = authorized(accountUri("/stream/" + providerAssetId)).GET().build();
    StreamVideo video = sendForResult(request, StreamVideo.class, "Cloudflare Stream");
    return video.toVideoState();
  }

  @Override
  public void deleteAsset(AssetType type, String providerAssetId) {
    String path =
        type == AssetType.VIDEO ? "/stream/" + providerAssetId : "/images/v1/" + providerAssetId;
    LOGGER.debug("Deleting {} from Cloudflare: {}", type.value(), providerAssetId);

    HttpRequest request = authorized(accountUri(path)).DELETE().build();
    HttpResponse<String> response = send(request);

    if (response.statusCode() / 100 != 2) {
      LOGGER.error(
          "Failed to delete {} {}: status={}",
          type.value(),
          providerAssetId,
          response.statusCode());
      throw failure("Cloudflare delete", response);
    }
  }

  String deliveryUrl(String imageId, String variant) {
    return String.format(
        "%s/%s/%s/%s",
        properties.imageDeliveryBaseUrl(), properties.imagesAccountHash(), imageId, variant);
  }

  private <T> T sendForResult(HttpRequest request, Class<T> resultType, String service) {
    HttpResponse<String> response = send(request);

    CloudflareEnvelope<T> envelope = parseEnvelope(response, resultType);
    if (response.statusCode() / 100 != 2 || envelope == null || !envelope.success()) {
      String message =
          envelope != null ? envelope.firstErrorMessage() : "HTTP " + response.statusCode();
      LOGGER.error("{} call failed: status={}, error={}", service, response.statusCode(), message);
      throw new ProviderException(
          service + " error: " + message,
          response.statusCode(),
          isRejection(response.statusCode()));
    }
    if (envelope.result() == null) {
      throw new ProviderException(
          service + " error: response has no result", response.statusCode(), false);
    }
    return envelope.result();
  }

  private <T> CloudflareEnvelope<T> parseEnvelope(HttpResponse<String> response, Class<T> type) {
    String body = response.body();
    if (body == null || body.isBlank()) {
      return null;
    }
    JavaType envelopeType =
        objectMapper.getTypeFactory().constructParametricType(CloudflareEnvelope.class, type);
    try {
      return objectMapper.readValue(body, envelopeType);
    } catch (JsonProcessingException e) {
      LOGGER.warn(
          "Unparseable Cloudflare response (status {}): {}",
          response.statusCode(),
          e.getMessage());
      return null;
    }
  }

  /**
   * Send a request, retrying transport failures with exponential backoff and jitter.
   *
   * @throws ProviderException if every attempt fails or the thread is interrupted
   */
  private HttpResponse<String> send(HttpRequest request) {
    int attempt = 0;
    IOException lastException = null;

    while (attempt < properties.maxRetries()) {
      try {
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
      } catch (IOException e) {
        lastException = e;
        attempt++;
        if (attempt < properties.maxRetries()) {
          long backoffMs = (long) (Math.pow(2, attempt) * 250 + Math.random() * 250);
          LOGGER.warn(
              "Cloudflare request {} {} failed (attempt {}), retrying in {}ms: {}",
              request.method(),
              request.uri().getPath(),
              attempt,
              backoffMs,
              e.getMessage());
          try {
            Thread.sleep(backoffMs);
          } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            throw new ProviderException("Cloudflare request interrupted", ie);
          }
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new ProviderException("Cloudflare request interrupted", e);
      }
    }

    throw new ProviderException(
        String.format("Cloudflare request failed after %d attempts", properties.maxRetries()),
        lastException);
  }

  private ProviderException failure(String service, HttpResponse<String> response) {
    return new ProviderException(
        String.format("%s error: HTTP %d", service, response.statusCode()),
        response.statusCode(),
        isRejection(response.statusCode()));
  }

  private static boolean isRejection(int statusCode) {
    return statusCode >= 400 && statusCode < 500;
  }

  private HttpRequest.Builder authorized(URI uri) {
    return HttpRequest.newBuilder()
        .uri(uri)
        .timeout(Duration.ofSeconds(properties.readTimeout()))
        .header("Authorization", "Bearer " + properties.apiToken());
  }

  private URI accountUri(String path) {
    return URI.create(properties.apiBaseUrl() + "/accounts/" + properties.accountId() + path);
  }

  private static Map<String, String> providerMeta(UploadMetadata metadata) {
    Map<String, String> meta = new LinkedHashMap<>();
    meta.put("userId", metadata.userId());
    meta.put("context", metadata.context().value());
    if (metadata.entityId() != null && !metadata.entityId().isBlank()) {
      meta.put("entityId", metadata.entityId());
    }
    return meta;
  }

  private String toJson(Object value) {
    try {
      return objectMapper.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new ProviderException("Failed to encode Cloudflare request", e);
    }
  }

  private static String base64(String value) {
    return Base64.getEncoder().encodeToString(value.getBytes(StandardCharsets.UTF_8));
  }

  /**
   * Build a multipart/form-data body made only of text fields.
   *
   * <pre>
   * --boundary
   * Content-Disposition: form-data; name="metadata"
   *
   * {"userId":"u1","context":"recipe"}
   * --boundary--
   * </pre>
   */
  private static byte[] buildFormFields(Map<String, String> fields, String boundary) {
    StringBuilder sb = new StringBuilder();
    for (Map.Entry<String, String> field : fields.entrySet()) {
      sb.append("--").append(boundary).append("\r\n");
      sb.append("Content-Disposition: form-data; name=\"")
          .append(field.getKey())
          .append("\"\r\n\r\n");
      sb.append(field.getValue()).append("\r\n");
    }
    sb.append("--").append(boundary).append("--\r\n");
    return sb.toString().getBytes(StandardCharsets.UTF_8);
  }
}
