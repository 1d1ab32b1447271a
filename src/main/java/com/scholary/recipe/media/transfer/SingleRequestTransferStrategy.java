package com.scholary.recipe.media.transfer;

import com.scholary.recipe.media.client.CancellationToken;
import com.scholary.recipe.media.client.Futures;
import com.scholary.recipe.media.client.MediaFile;
import com.scholary.recipe.media.client.UploadTarget;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Base for protocols that send the whole file in one request.
 *
 * <p>Progress is the share of the request body handed to the transport. A single-shot transfer is
 * not resumable: a failure means sending the file again under a new target.
 */
abstract class SingleRequestTransferStrategy implements TransferStrategy {

  private static final Logger LOGGER = LoggerFactory.getLogger(SingleRequestTransferStrategy.class);

  private final HttpClient httpClient;
  private final Duration timeout;

  SingleRequestTransferStrategy(HttpClient httpClient, Duration timeout) {
    this.httpClient = httpClient;
    this.timeout = timeout;
  }

  /** HTTP method used for the upload request. */
  abstract String method();

  /**
   * Add protocol headers to the upload request and build its body.
   *
   * @return the request body; its content length must be known
   */
  abstract BodyPublisher prepare(HttpRequest.Builder request, MediaFile file) throws IOException;

  @Override
  public CompletableFuture<Void> transfer(
      UploadTarget target, MediaFile file, ProgressSink progress, CancellationToken token) {
    if (token.isCancelled()) {
      return CompletableFuture.failedFuture(new CancellationException("Upload cancelled"));
    }

    HttpRequest.Builder request =
        HttpRequest.newBuilder().uri(URI.create(target.uploadUrl())).timeout(timeout);
    BodyPublisher body;
    try {
      body = prepare(request, file);
    } catch (IOException e) {
      return CompletableFuture.failedFuture(
          TransferException.network("Failed to read " + file.name() + ": " + e.getMessage(), e));
    }
    long total = body.contentLength();
    BodyPublisher counted =
        new CountingBodyPublisher(
            body, sent -> progress.report(MonotonicProgressSink.percentOf(sent, total)));
    request.method(method(), counted);

    LOGGER.debug(
        "Starting {} transfer: assetId={}, bytes={}", protocol().value(), target.assetId(), total);

    return token
        .track(httpClient.sendAsync(request.build(), HttpResponse.BodyHandlers.ofString()))
        .handle(
            (response, error) -> {
              if (error != null) {
                Throwable cause = Futures.unwrap(error);
                if (cause instanceof CancellationException) {
                  throw (CancellationException) cause;
                }
                throw TransferException.network(
                    "Upload failed: network error (" + cause.getMessage() + ")", cause);
              }
              if (response.statusCode() < 200 || response.statusCode() >= 300) {
                throw TransferException.rejected(response.statusCode(), response.body());
              }
              progress.report(100);
              LOGGER.debug(
                  "Finished {} transfer: assetId={}", protocol().value(), target.assetId());
              return null;
            });
  }
}
