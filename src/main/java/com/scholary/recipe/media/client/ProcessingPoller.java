package com.scholary.recipe.media.client;

import com.scholary.recipe.media.asset.AssetStatus;
import com.scholary.recipe.media.asset.MediaAsset;
import com.scholary.recipe.media.logging.StructuredLogger;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Polls a transferred video until the server reports it ready or failed.
 *
 * <p>The loop is bounded by the {@link PollingPolicy}. Each poll is scheduled one interval after
 * the previous response arrived, so requests never overlap; the first poll runs one interval after
 * {@link #awaitReady} is called. When the {@code maxAttempts}-th poll comes back non-terminal, the
 * future fails with {@link ProcessingTimeoutException} right away.
 *
 * <p>A failed poll request is not retried: it fails the future with {@link
 * ProcessingFailedException}, as does a response without an asset status. Cancelling the token
 * stops scheduling, cancels the in-flight request and cancels the returned future.
 */
public class ProcessingPoller {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProcessingPoller.class);

  static final String DEFAULT_FAILURE = "Video processing failed";

  private final MediaApiClient apiClient;
  private final ScheduledExecutorService scheduler;
  private final PollingPolicy policy;
  private final StructuredLogger structuredLogger;

  public ProcessingPoller(
      MediaApiClient apiClient, ScheduledExecutorService scheduler, PollingPolicy policy) {
    this.apiClient = apiClient;
    this.scheduler = scheduler;
    this.policy = policy;
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  public PollingPolicy policy() {
    return policy;
  }

  /**
   * Wait for a video to finish processing.
   *
   * @param assetId the video asset
   * @param token cancels the loop
   * @return completes with the ready asset
   */
  public CompletableFuture<MediaAsset> awaitReady(String assetId, CancellationToken token) {
    CompletableFuture<MediaAsset> result = new CompletableFuture<>();
    token.onCancel(() -> result.cancel(false));
    scheduleNext(assetId, 1, token, result);
    return result;
  }

  private void scheduleNext(
      String assetId, int attempt, CancellationToken token, CompletableFuture<MediaAsset> result) {
    if (token.isCancelled() || result.isDone()) {
      return;
    }
    token.track(
        scheduler.schedule(
            () -> poll(assetId, attempt, token, result),
            policy.interval().toMillis(),
            TimeUnit.MILLISECONDS));
  }

  private void poll(
      String assetId, int attempt, CancellationToken token, CompletableFuture<MediaAsset> result) {
    if (token.isCancelled() || result.isDone()) {
      return;
    }

    token
        .track(apiClient.pollVideoStatus(assetId))
        .whenComplete(
            (asset, error) -> {
              if (token.isCancelled() || result.isDone()) {
                return;
              }
              if (error != null) {
                Throwable cause = Futures.unwrap(error);
                result.completeExceptionally(
                    new ProcessingFailedException(
                        cause.getMessage() != null ? cause.getMessage() : DEFAULT_FAILURE, cause));
                return;
              }
              try {
                handle(assetId, attempt, asset, token, result);
              } catch (RuntimeException e) {
                LOGGER.warn("Failed to handle poll response for video {}", assetId, e);
                result.completeExceptionally(new ProcessingFailedException(DEFAULT_FAILURE, e));
              }
            });
  }

  private void handle(
      String assetId,
      int attempt,
      MediaAsset asset,
      CancellationToken token,
      CompletableFuture<MediaAsset> result) {
    if (asset == null || asset.status() == null) {
      LOGGER.warn("Poll response for video {} carried no status", assetId);
      result.completeExceptionally(new ProcessingFailedException(DEFAULT_FAILURE));
      return;
    }
    AssetStatus status = asset.status();
    structuredLogger.logPollAttempt(assetId, attempt, policy.maxAttempts(), status.value());

    if (status == AssetStatus.READY) {
      result.complete(asset);
    } else if (status == AssetStatus.ERROR) {
      String message =
          asset.errorMessage() != null && !asset.errorMessage().isBlank()
              ? asset.errorMessage()
              : DEFAULT_FAILURE;
      result.completeExceptionally(new ProcessingFailedException(message));
    } else if (attempt >= policy.maxAttempts()) {
      LOGGER.warn("Video {} still processing after {} polls", assetId, attempt);
      result.completeExceptionally(
          new ProcessingTimeoutException(
              String.format(
                  "Video processing timed out after %d polls over %d seconds",
                  attempt, policy.interval().multipliedBy(attempt).toSeconds()),
              attempt));
    } else {
      scheduleNext(assetId, attempt + 1, token, result);
    }
  }
}
