package com.scholary.recipe.media.transfer;

import com.scholary.recipe.media.asset.UploadProtocol;
import com.scholary.recipe.media.client.CancellationToken;
import com.scholary.recipe.media.client.Futures;
import com.scholary.recipe.media.client.MediaClientProperties.TransferProperties;
import com.scholary.recipe.media.client.MediaFile;
import com.scholary.recipe.media.client.UploadTarget;
import com.scholary.recipe.media.logging.StructuredLogger;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublishers;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resumable chunked transfer using the tus 1.0.0 protocol.
 *
 * <p>The upload resource already exists (the provider created it when issuing the target), so the
 * client only reads the server offset with {@code HEAD} and sends the remaining bytes as {@code
 * PATCH} chunks. When a chunk fails on the network, the server answers {@code 409 Conflict}
 * (offset mismatch), or the server acknowledges a chunk without moving its offset forward, the
 * client asks for the offset again and continues from there; it never starts over from byte zero.
 * Consecutive resumes are bounded by {@code maxResumeAttempts}; a chunk that advances the offset
 * resets the count.
 *
 * <p>Every request is sent with {@code sendAsync} and the loop never blocks a thread, so the
 * executor may be the same pool the {@link HttpClient} completes its responses on. The executor
 * runs the first step and the resume backoff. The cancellation token is checked before every
 * request and cancels the one in flight.
 */
public class TusTransferStrategy implements TransferStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(TusTransferStrategy.class);

  static final String TUS_RESUMABLE = "Tus-Resumable";
  static final String TUS_VERSION = "1.0.0";
  static final String UPLOAD_OFFSET = "Upload-Offset";
  static final String OFFSET_CONTENT_TYPE = "application/offset+octet-stream";

  /** Chunk answered with {@code 409 Conflict}. */
  private static final long CONFLICT = -1;

  /** Chunk acknowledged without moving the server offset forward. */
  private static final long STALLED = -2;

  private final HttpClient httpClient;
  private final TransferProperties properties;
  private final Executor executor;
  private final StructuredLogger structuredLogger;

  public TusTransferStrategy(
      HttpClient httpClient, TransferProperties properties, Executor executor) {
    this.httpClient = httpClient;
    this.properties = properties;
    this.executor = executor;
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  @Override
  public UploadProtocol protocol() {
    return UploadProtocol.TUS;
  }

  @Override
  public CompletableFuture<Void> transfer(
      UploadTarget target, MediaFile file, ProgressSink progress, CancellationToken token) {
    Upload upload = new Upload(URI.create(target.uploadUrl()), file, progress, token);
    return CompletableFuture.completedFuture(null)
        .thenComposeAsync(ignored -> step(upload, -1), executor);
  }

  /** Run one HEAD or PATCH at {@code offset}, -1 meaning the server offset is unknown. */
  private CompletableFuture<Void> step(Upload upload, long offset) {
    upload.token.throwIfCancelled();
    long size = upload.file.size();

    if (offset >= size) {
      upload.progress.report(100);
      LOGGER.debug("tus upload complete: {} bytes to {}", size, upload.uri);
      return CompletableFuture.completedFuture(null);
    }

    if (offset < 0) {
      return readOffset(upload)
          .handle(
              (serverOffset, error) -> {
                if (error != null) {
                  return resumeAfter(upload, offset, error);
                }
                LOGGER.debug("tus upload at offset {}/{}: {}", serverOffset, size, upload.uri);
                upload.progress.report(MonotonicProgressSink.percentOf(serverOffset, size));
                return step(upload, serverOffset);
              })
          .thenCompose(Function.identity());
    }

    return sendChunk(upload, offset)
        .handle(
            (acknowledged, error) -> {
              if (error != null) {
                return resumeAfter(upload, offset, error);
              }
              if (acknowledged == CONFLICT) {
                return resume(upload, offset, "offset conflict");
              }
              if (acknowledged == STALLED) {
                return resume(upload, offset, "offset not advanced");
              }
              upload.resumes = 0;
              structuredLogger.logChunkTransferred(acknowledged, size);
              return step(upload, acknowledged);
            })
        .thenCompose(Function.identity());
  }

  /**
   * Send one chunk at {@code offset}.
   *
   * @return completes with the offset acknowledged by the server, {@link #CONFLICT} or {@link
   *     #STALLED}
   */
  private CompletableFuture<Long> sendChunk(Upload upload, long offset) {
    byte[] chunk;
    try {
      chunk = upload.file.readRange(offset, properties.chunkSizeBytes());
    } catch (IOException e) {
      throw TransferException.network(
          "Failed to read " + upload.file.name() + ": " + describe(e), e);
    }
    long size = upload.file.size();

    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(upload.uri)
            .timeout(Duration.ofSeconds(properties.timeout()))
            .header(TUS_RESUMABLE, TUS_VERSION)
            .header(UPLOAD_OFFSET, Long.toString(offset))
            .header("Content-Type", OFFSET_CONTENT_TYPE)
            .method(
                "PATCH",
                new CountingBodyPublisher(
                    BodyPublishers.ofByteArray(chunk),
                    sent ->
                        upload.progress.report(
                            MonotonicProgressSink.percentOf(offset + sent, size))))
            .build();

    return upload
        .token
        .track(httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()))
        .thenApply(
            response -> {
              int status = response.statusCode();
              if (status == 409) {
                return CONFLICT;
              }
              if (status < 200 || status >= 300) {
                throw TransferException.rejected(status, response.body());
              }
              long acknowledged =
                  response
                      .headers()
                      .firstValue(UPLOAD_OFFSET)
                      .map(value -> parseOffset(status, value))
                      .orElse(offset + chunk.length);
              return acknowledged > offset ? acknowledged : STALLED;
            });
  }

  private CompletableFuture<Long> readOffset(Upload upload) {
    HttpRequest request =
        HttpRequest.newBuilder()
            .uri(upload.uri)
            .timeout(Duration.ofSeconds(properties.timeout()))
            .header(TUS_RESUMABLE, TUS_VERSION)
            .method("HEAD", BodyPublishers.noBody())
            .build();

    return upload
        .token
        .track(httpClient.sendAsync(request, HttpResponse.BodyHandlers.ofString()))
        .thenApply(
            response -> {
              int status = response.statusCode();
              if (status < 200 || status >= 300) {
                throw TransferException.rejected(status, response.body());
              }
              String offset =
                  response
                      .headers()
                      .firstValue(UPLOAD_OFFSET)
                      .orElseThrow(
                          () -> TransferException.rejected(status, "Missing Upload-Offset"));
              return parseOffset(status, offset);
            });
  }

  /** Resume after a network failure; any other failure ends the transfer. */
  private CompletableFuture<Void> resumeAfter(Upload upload, long offset, Throwable error) {
    Throwable cause = Futures.unwrap(error);
    if (cause instanceof IOException) {
      return resume(upload, offset, describe((IOException) cause));
    }
    if (cause instanceof RuntimeException) {
      throw (RuntimeException) cause;
    }
    throw new CompletionException(cause);
  }

  private CompletableFuture<Void> resume(Upload upload, long offset, String reason) {
    int attempt = upload.resumes + 1;
    if (attempt > properties.maxResumeAttempts()) {
      throw TransferException.network(
          String.format(
              "Upload interrupted: gave up after %d resume attempts (%s)",
              properties.maxResumeAttempts(), reason),
          null);
    }
    upload.resumes = attempt;
    structuredLogger.logTransferResume(attempt, properties.maxResumeAttempts(), offset, reason);

    Executor next =
        properties.resumeBackoffMillis() > 0
            ? CompletableFuture.delayedExecutor(
                properties.resumeBackoffMillis(), TimeUnit.MILLISECONDS, executor)
            : executor;
    // the offset is unknown again until the next HEAD
    return CompletableFuture.completedFuture(null)
        .thenComposeAsync(ignored -> step(upload, -1), next);
  }

  private static long parseOffset(int status, String value) {
    try {
      return Long.parseLong(value.trim());
    } catch (NumberFormatException e) {
      throw TransferException.rejected(status, "Invalid Upload-Offset: " + value);
    }
  }

  private static String describe(IOException e) {
    return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
  }

  /** State of one transfer; the future chain hands it from step to step. */
  private static final class Upload {

    private final URI uri;
    private final MediaFile file;
    private final ProgressSink progress;
    private final CancellationToken token;
    private int resumes;

    private Upload(URI uri, MediaFile file, ProgressSink progress, CancellationToken token) {
      this.uri = uri;
      this.file = file;
      this.progress = progress;
      this.token = token;
    }
  }
}
