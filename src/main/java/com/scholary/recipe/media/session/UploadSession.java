package com.scholary.recipe.media.session;

import com.scholary.recipe.media.asset.AssetStatus;
import com.scholary.recipe.media.asset.AssetType;
import com.scholary.recipe.media.asset.MediaAsset;
import com.scholary.recipe.media.asset.MediaContext;
import com.scholary.recipe.media.client.CancellationToken;
import com.scholary.recipe.media.client.ConfirmationException;
import com.scholary.recipe.media.client.ConfirmationService;
import com.scholary.recipe.media.client.Futures;
import com.scholary.recipe.media.client.MediaFile;
import com.scholary.recipe.media.client.ProcessingFailedException;
import com.scholary.recipe.media.client.ProcessingPoller;
import com.scholary.recipe.media.client.ProcessingTimeoutException;
import com.scholary.recipe.media.client.UploadBroker;
import com.scholary.recipe.media.client.UploadRequest;
import com.scholary.recipe.media.client.UploadRequestException;
import com.scholary.recipe.media.client.UploadTarget;
import com.scholary.recipe.media.logging.StructuredLogger;
import com.scholary.recipe.media.transfer.TransferClient;
import com.scholary.recipe.media.transfer.TransferException;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Drives one file through the upload pipeline and exposes where it is.
 *
 * <p>An upload runs request, transfer and then confirmation (images) or processing (videos) as one
 * future chain; the caller is never blocked. The session publishes {@link #status()}, {@link
 * #progress()}, {@link #asset()} and {@link #error()}, and notifies listeners on every change.
 *
 * <p>Every {@link #upload}, {@link #reset()} and {@link #adoptExisting} starts a new generation.
 * Results that belong to an older generation are dropped, and the older generation's scheduled
 * polls and in-flight requests are cancelled, so a superseded upload can never overwrite the state
 * of the current one.
 *
 * <p>Thread-safe. State changes and listener calls happen under the session monitor.
 */
public class UploadSession {

  private static final Logger LOGGER = LoggerFactory.getLogger(UploadSession.class);
  private static final String DEFAULT_ERROR = "Upload failed";

  private final String sessionId = UUID.randomUUID().toString();
  private final UploadBroker broker;
  private final TransferClient transferClient;
  private final ConfirmationService confirmationService;
  private final ProcessingPoller poller;
  private final StructuredLogger structuredLogger;
  private final List<UploadListener> listeners = new CopyOnWriteArrayList<>();

  private UploadStatus status = UploadStatus.IDLE;
  private int progress;
  private MediaAsset asset;
  private UploadError error;
  private long generation;
  private long resumedGeneration = -1;
  private CancellationToken token = new CancellationToken();

  public UploadSession(
      UploadBroker broker,
      TransferClient transferClient,
      ConfirmationService confirmationService,
      ProcessingPoller poller) {
    this.broker = broker;
    this.transferClient = transferClient;
    this.confirmationService = confirmationService;
    this.poller = poller;
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  public String id() {
    return sessionId;
  }

  public CompletableFuture<Optional<MediaAsset>> uploadImage(
      MediaFile file, MediaContext context, String entityId) {
    return upload(UploadRequest.image(context, entityId, file));
  }

  public CompletableFuture<Optional<MediaAsset>> uploadVideo(
      MediaFile file, MediaContext context, String entityId) {
    return upload(UploadRequest.video(context, entityId, file));
  }

  /**
   * Upload a file, discarding whatever this session was doing before.
   *
   * @return completes with the ready asset, or empty if the upload failed or was superseded; never
   *     completes exceptionally
   */
  public CompletableFuture<Optional<MediaAsset>> upload(UploadRequest request) {
    long gen;
    CancellationToken current;
    synchronized (this) {
      resetState();
      gen = generation;
      current = token;
      move(UploadEvent.STARTED, progress);
    }
    LOGGER.info(
        "Starting {} upload: session={}, file={}",
        request.type().value(),
        sessionId,
        request.file());

    CompletableFuture<MediaAsset> pipeline =
        broker
            .requestTarget(request)
            .thenCompose(target -> transfer(gen, current, request, target))
            .thenCompose(
                target ->
                    request.type() == AssetType.IMAGE
                        ? confirm(gen, current, target)
                        : awaitProcessing(gen, current, target.assetId()));
    return pipeline.handle((ready, failure) -> finish(gen, ready, failure));
  }

  /**
   * Return to {@code idle} right away. Pending polls and in-flight requests of the current upload
   * are cancelled, and their late results ignored.
   */
  public synchronized void reset() {
    resetState();
  }

  /**
   * Show an asset that was uploaded earlier, without any network call.
   *
   * <p>A ready asset makes the session {@code ready}, a failed one {@code error}; a pending or
   * processing asset makes it {@code processing} (see {@link #resumeProcessing()}). Null resets.
   */
  public synchronized void adoptExisting(MediaAsset existing) {
    resetState();
    if (existing == null) {
      return;
    }
    asset = existing;
    if (existing.status() == AssetStatus.READY) {
      move(UploadEvent.ADOPTED_READY, 100);
    } else if (existing.status() == AssetStatus.ERROR) {
      error =
          new UploadError(
              UploadErrorKind.PROCESSING,
              hasText(existing.errorMessage()) ? existing.errorMessage() : DEFAULT_ERROR);
      move(UploadEvent.ADOPTED_ERROR, 0);
    } else {
      move(UploadEvent.ADOPTED_PROCESSING, 100);
    }
  }

  /**
   * Poll an adopted video that is still processing until it is ready.
   *
   * @return completes like the processing phase of {@link #upload}
   * @throws IllegalStateException if the session does not hold a processing video, or is already
   *     polling it
   */
  public CompletableFuture<Optional<MediaAsset>> resumeProcessing() {
    long gen;
    CancellationToken current;
    String assetId;
    synchronized (this) {
      if (status != UploadStatus.PROCESSING || asset == null || asset.type() != AssetType.VIDEO) {
        throw new IllegalStateException("No adopted video is processing in this session");
      }
      if (resumedGeneration == generation) {
        throw new IllegalStateException("Processing is already being polled");
      }
      resumedGeneration = generation;
      gen = generation;
      current = token;
      assetId = asset.id();
    }
    LOGGER.info("Resuming processing poll: session={}, asset={}", sessionId, assetId);
    return poller
        .awaitReady(assetId, current)
        .handle((ready, failure) -> finish(gen, ready, failure));
  }

  public synchronized UploadStatus status() {
    return status;
  }

  public synchronized int progress() {
    return progress;
  }

  public synchronized MediaAsset asset() {
    return asset;
  }

  public synchronized UploadError error() {
    return error;
  }

  public synchronized UploadSnapshot snapshot() {
    return new UploadSnapshot(status, progress, asset, error);
  }

  public void addListener(UploadListener listener) {
    listeners.add(listener);
  }

  public void removeListener(UploadListener listener) {
    listeners.remove(listener);
  }

  private CompletableFuture<UploadTarget> transfer(
      long gen, CancellationToken current, UploadRequest request, UploadTarget target) {
    advance(gen, UploadEvent.TARGET_ISSUED, 0);
    return current
        .track(
            transferClient.transfer(
                target, request.file(), percent -> onProgress(gen, percent), current))
        .thenApply(ignored -> target);
  }

  private CompletableFuture<MediaAsset> confirm(
      long gen, CancellationToken current, UploadTarget target) {
    advance(gen, UploadEvent.IMAGE_TRANSFERRED, 100);
    return current.track(confirmationService.confirm(target.assetId()));
  }

  private CompletableFuture<MediaAsset> awaitProcessing(
      long gen, CancellationToken current, String assetId) {
    advance(gen, UploadEvent.VIDEO_TRANSFERRED, 100);
    return poller.awaitReady(assetId, current);
  }

  /** Apply a pipeline step, or abort the chain if the upload was superseded. */
  private synchronized void advance(long gen, UploadEvent event, int newProgress) {
    if (gen != generation) {
      throw new CancellationException("Upload superseded");
    }
    if (event == UploadEvent.VIDEO_TRANSFERRED) {
      resumedGeneration = gen;
    }
    move(event, newProgress);
  }

  private synchronized void onProgress(long gen, int percent) {
    if (gen != generation || status != UploadStatus.UPLOADING || percent <= progress) {
      return;
    }
    progress = Math.min(100, percent);
    notifyListeners();
  }

  private synchronized Optional<MediaAsset> finish(long gen, MediaAsset ready, Throwable failure) {
    if (gen != generation) {
      LOGGER.debug("Dropping result of superseded upload: session={}", sessionId);
      return Optional.empty();
    }
    if (failure == null) {
      asset = ready;
      move(UploadEvent.ASSET_READY, 100);
      structuredLogger.logUploadReady(sessionId, ready.id(), ready.type().value());
      return Optional.of(ready);
    }

    Throwable cause = Futures.unwrap(failure);
    UploadErrorKind kind = classify(cause);
    String message = hasText(cause.getMessage()) ? cause.getMessage() : DEFAULT_ERROR;
    error = new UploadError(kind, message);
    move(UploadEvent.FAILED, progress);
    structuredLogger.logUploadFailed(sessionId, kind.name(), message);
    return Optional.empty();
  }

  private UploadErrorKind classify(Throwable cause) {
    if (cause instanceof UploadRequestException) {
      return UploadErrorKind.REQUEST;
    }
    if (cause instanceof TransferException) {
      return UploadErrorKind.TRANSFER;
    }
    if (cause instanceof ConfirmationException) {
      return UploadErrorKind.CONFIRMATION;
    }
    if (cause instanceof ProcessingTimeoutException) {
      return UploadErrorKind.PROCESSING_TIMEOUT;
    }
    if (cause instanceof ProcessingFailedException) {
      return UploadErrorKind.PROCESSING;
    }
    // anything else is blamed on the phase it happened in
    return switch (status) {
      case REQUESTING -> UploadErrorKind.REQUEST;
      case UPLOADING -> UploadErrorKind.TRANSFER;
      case CONFIRMING -> UploadErrorKind.CONFIRMATION;
      default -> UploadErrorKind.PROCESSING;
    };
  }

  /** Start a new generation in {@code idle}; must hold the monitor. */
  private void resetState() {
    generation++;
    token.cancel();
    token = new CancellationToken();
    boolean changed =
        status != UploadStatus.IDLE || progress != 0 || asset != null || error != null;
    asset = null;
    error = null;
    if (changed) {
      move(UploadEvent.RESET, 0);
    }
  }

  /** Apply a transition and notify; must hold the monitor. */
  private void move(UploadEvent event, int newProgress) {
    UploadStatus from = status;
    status = status.next(event);
    progress = newProgress;
    structuredLogger.logPhaseChanged(sessionId, from.value(), status.value(), progress);
    notifyListeners();
  }

  private void notifyListeners() {
    UploadSnapshot snapshot = new UploadSnapshot(status, progress, asset, error);
    for (UploadListener listener : listeners) {
      try {
        listener.onChange(snapshot);
      } catch (RuntimeException e) {
        LOGGER.warn("Upload listener failed: session={}", sessionId, e);
      }
    }
  }

  private static boolean hasText(String value) {
    return value != null && !value.isBlank();
  }
}
