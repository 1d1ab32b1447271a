package com.scholary.recipe.media.objectstore;

import java.net.URL;
import java.time.Duration;
import java.util.Optional;

/**
 * Abstraction for the object storage operations the media pipeline needs.
 *
 * <p>Clients never stream bytes through this service: they receive a presigned URL and upload
 * directly to the store. The service only checks that the object arrived and removes it on delete.
 */
public interface ObjectStoreClient {

  /**
   * Generate a presigned URL the client can {@code PUT} the object to.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @param contentType MIME type the upload must declare, or null to leave it open
   * @param ttl how long the URL stays valid
   * @return a presigned URL
   * @throws ObjectStoreException if URL generation fails
   */
  URL presignPut(String bucket, String key, String contentType, Duration ttl);

  /**
   * Get object metadata without downloading the content.
   *
   * @param bucket the bucket name
   * @param key the object key
   * @return the metadata, or empty if no such object exists
   * @throws ObjectStoreException if the lookup fails for any other reason
   */
  Optional<ObjectMetadata> findObjectMetadata(String bucket, String key);

  /**
   * Delete an object. Deleting a missing object succeeds.
   *
   * @throws ObjectStoreException if the deletion fails
   */
  void deleteObject(String bucket, String key);

  /** Object metadata returned by findObjectMetadata. */
  record ObjectMetadata(long contentLength, String contentType) {}
}
