package com.scholary.recipe.media.transfer;

import com.scholary.recipe.media.asset.UploadProtocol;
import com.scholary.recipe.media.client.MediaFile;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.time.Duration;

/**
 * Sends the raw file bytes with a single PUT to a presigned object-store URL.
 *
 * <p>The {@code Content-Type} must match the one the URL was signed with.
 */
public class PresignedPutTransferStrategy extends SingleRequestTransferStrategy {

  public PresignedPutTransferStrategy(HttpClient httpClient, Duration timeout) {
    super(httpClient, timeout);
  }

  @Override
  public UploadProtocol protocol() {
    return UploadProtocol.PUT;
  }

  @Override
  String method() {
    return "PUT";
  }

  @Override
  BodyPublisher prepare(HttpRequest.Builder request, MediaFile file) throws IOException {
    request.header("Content-Type", file.mimeType());
    return file.bodyPublisher();
  }
}
