package com.scholary.recipe.media.provider.objectstore;

import com.scholary.recipe.media.asset.AssetType;
import com.scholary.recipe.media.asset.ReadyDetails;
import com.scholary.recipe.media.asset.UploadProtocol;
import com.scholary.recipe.media.objectstore.ObjectStoreClient;
import com.scholary.recipe.media.objectstore.ObjectStoreClient.ObjectMetadata;
import com.scholary.recipe.media.objectstore.ObjectStoreException;
import com.scholary.recipe.media.objectstore.ObjectStoreProperties;
import com.scholary.recipe.media.provider.MediaProvider;
import com.scholary.recipe.media.provider.ProviderException;
import com.scholary.recipe.media.provider.ProviderVideoState;
import com.scholary.recipe.media.provider.UploadGrant;
import com.scholary.recipe.media.provider.UploadMetadata;
import java.time.Duration;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Media provider that stores files as-is in an S3-compatible bucket.
 *
 * <p>Meant for self-hosted and local setups (MinIO). There is no transcoding: an uploaded object is
 * served directly from {@code publicBaseUrl}, so a video is ready as soon as its object exists.
 * The object key doubles as the provider asset id.
 */
public class ObjectStoreMediaProvider implements MediaProvider {

  private static final Logger LOGGER = LoggerFactory.getLogger(ObjectStoreMediaProvider.class);

  static final String NAME = "object-store";

  private final ObjectStoreClient objectStoreClient;
  private final ObjectStoreProperties properties;

  public ObjectStoreMediaProvider(
      ObjectStoreClient objectStoreClient, ObjectStoreProperties properties) {
    this.objectStoreClient = objectStoreClient;
    this.properties = properties;
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public UploadGrant createImageUpload(UploadMetadata metadata) {
    return presign("images", metadata);
  }

  @Override
  public UploadGrant createVideoUpload(UploadMetadata metadata, int maxDurationSeconds) {
    return presign("videos", metadata);
  }

  @Override
  public ReadyDetails finalizeImage(String providerAssetId) {
    ObjectMetadata metadata =
        lookup(providerAssetId)
            .orElseThrow(() -> ProviderException.rejected("Uploaded image not found in storage"));
    if (metadata.contentLength() == 0) {
      throw ProviderException.rejected("Uploaded image is empty");
    }
    String url = publicUrl(providerAssetId);
    return ReadyDetails.image(url, url);
  }

  @Override
  public ProviderVideoState fetchVideoState(String providerAssetId) {
    return lookup(providerAssetId)
        .map(
            metadata ->
                ProviderVideoState.ready(
                    new ReadyDetails(publicUrl(providerAssetId), null, null, null, null)))
        .orElseGet(ProviderVideoState::processing);
  }

  @Override
  public void deleteAsset(AssetType type, String providerAssetId) {
    try {
      objectStoreClient.deleteObject(properties.bucket(), providerAssetId);
    } catch (ObjectStoreException e) {
      throw new ProviderException("Object store delete failed: " + e.getMessage(), e);
    }
  }

  private UploadGrant presign(String prefix, UploadMetadata metadata) {
    String key = buildKey(prefix, metadata);
    try {
      String url =
          objectStoreClient
              .presignPut(
                  properties.bucket(),
                  key,
                  metadata.mimeType(),
                  Duration.ofMinutes(properties.presignTtlMinutes()))
              .toString();
      LOGGER.debug("Issued presigned upload: key={}", key);
      return new UploadGrant(key, url, UploadProtocol.PUT);
    } catch (ObjectStoreException e) {
      throw new ProviderException("Object store presign failed: " + e.getMessage(), e);
    }
  }

  private Optional<ObjectMetadata> lookup(String key) {
    try {
      return objectStoreClient.findObjectMetadata(properties.bucket(), key);
    } catch (ObjectStoreException e) {
      throw new ProviderException("Object store lookup failed: " + e.getMessage(), e);
    }
  }

  String publicUrl(String key) {
    String base = properties.publicBaseUrl();
    return base.endsWith("/") ? base + key : base + "/" + key;
  }

  static String buildKey(String prefix, UploadMetadata metadata) {
    StringBuilder key =
        new StringBuilder(prefix)
            .append('/')
            .append(metadata.context().value())
            .append('/')
            .append(UUID.randomUUID());
    String extension = extensionOf(metadata.originalName());
    if (extension != null) {
      key.append('.').append(extension);
    }
    return key.toString();
  }

  private static String extensionOf(String filename) {
    if (filename == null) {
      return null;
    }
    int dot = filename.lastIndexOf('.');
    if (dot < 0 || dot == filename.length() - 1) {
      return null;
    }
    String extension = filename.substring(dot + 1).toLowerCase(Locale.ROOT);
    return extension.matches("[a-z0-9]{1,8}") ? extension : null;
  }
}
