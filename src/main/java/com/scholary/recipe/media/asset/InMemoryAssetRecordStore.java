package com.scholary.recipe.media.asset;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-memory asset record store backed by a Caffeine cache.
 *
 * <p>The cache is bounded by size only; records do not expire on their own. Status changes go
 * through {@code asMap().compute} so the transition check and the write happen atomically per
 * asset.
 */
public class InMemoryAssetRecordStore implements AssetRecordStore {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryAssetRecordStore.class);

  private final Cache<String, MediaAsset> cache;
  private final Clock clock;

  public InMemoryAssetRecordStore(long maxSize, Clock clock) {
    this.cache = Caffeine.newBuilder().maximumSize(maxSize).build();
    this.clock = clock;
    LOGGER.info("Initialized in-memory asset store: maxSize={}", maxSize);
  }

  @Override
  public MediaAsset createPending(NewAsset asset) {
    Instant now = clock.instant();
    MediaAsset created =
        new MediaAsset(
            UUID.randomUUID().toString(),
            asset.type(),
            asset.provider(),
            asset.providerAssetId(),
            AssetStatus.PENDING,
            null,
            null,
            asset.originalName(),
            asset.mimeType(),
            asset.fileSize(),
            null,
            null,
            null,
            null,
            asset.uploadedBy(),
            now,
            now);
    cache.put(created.id(), created);
    LOGGER.debug(
        "Created pending asset: id={}, type={}, providerAssetId={}",
        created.id(),
        created.type().value(),
        created.providerAssetId());
    return created;
  }

  @Override
  public MediaAsset markProcessing(String assetId) {
    return transition(assetId, AssetStatus.PROCESSING, current -> current.withProcessing(now()));
  }

  @Override
  public MediaAsset markReady(String assetId, ReadyDetails details) {
    return transition(assetId, AssetStatus.READY, current -> current.withReady(details, now()));
  }

  @Override
  public MediaAsset markError(String assetId, String errorMessage) {
    return transition(
        assetId, AssetStatus.ERROR, current -> current.withError(errorMessage, now()));
  }

  @Override
  public Optional<MediaAsset> findById(String assetId) {
    return Optional.ofNullable(cache.getIfPresent(assetId));
  }

  @Override
  public Optional<MediaAsset> findByProviderAssetId(String providerAssetId) {
    return cache.asMap().values().stream()
        .filter(asset -> providerAssetId.equals(asset.providerAssetId()))
        .findFirst();
  }

  @Override
  public List<MediaAsset> findByUploader(String userId) {
    return cache.asMap().values().stream()
        .filter(asset -> userId.equals(asset.uploadedBy()))
        .sorted(Comparator.comparing(MediaAsset::createdAt).reversed())
        .toList();
  }

  @Override
  public boolean delete(String assetId) {
    return cache.asMap().remove(assetId) != null;
  }

  private MediaAsset transition(
      String assetId, AssetStatus target, Function<MediaAsset, MediaAsset> update) {
    MediaAsset updated =
        cache
            .asMap()
            .computeIfPresent(
                assetId,
                (id, current) -> {
                  if (!current.status().canTransitionTo(target)) {
                    throw new IllegalAssetTransitionException(id, current.status(), target);
                  }
                  return update.apply(current);
                });
    if (updated == null) {
      throw new AssetNotFoundException(assetId);
    }
    LOGGER.debug("Asset {} is now {}", assetId, target.value());
    return updated;
  }

  private Instant now() {
    return clock.instant();
  }
}
