package com.scholary.recipe.media.transfer;

import com.scholary.recipe.media.asset.UploadProtocol;
import com.scholary.recipe.media.client.MediaFile;
import java.io.IOException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpRequest.BodyPublisher;
import java.net.http.HttpRequest.BodyPublishers;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.UUID;

/**
 * Sends the file as the single {@code file} part of a multipart/form-data POST.
 *
 * <p>This is what direct-upload URLs for images and small videos expect. The multipart envelope is
 * built by hand around a streamed file body:
 *
 * <pre>
 * --boundary
 * Content-Disposition: form-data; name="file"; filename="dish.jpg"
 * Content-Type: image/jpeg
 *
 * [binary data]
 * --boundary--
 * </pre>
 */
public class FormPostTransferStrategy extends SingleRequestTransferStrategy {

  public FormPostTransferStrategy(HttpClient httpClient, Duration timeout) {
    super(httpClient, timeout);
  }

  @Override
  public UploadProtocol protocol() {
    return UploadProtocol.FORM_POST;
  }

  @Override
  String method() {
    return "POST";
  }

  @Override
  BodyPublisher prepare(HttpRequest.Builder request, MediaFile file) throws IOException {
    String boundary = boundary();
    request.header("Content-Type", "multipart/form-data; boundary=" + boundary);
    String head =
        "--"
            + boundary
            + "\r\n"
            + "Content-Disposition: form-data; name=\"file\"; filename=\""
            + escape(file.name())
            + "\"\r\n"
            + "Content-Type: "
            + file.mimeType()
            + "\r\n\r\n";
    String tail = "\r\n--" + boundary + "--\r\n";
    return BodyPublishers.concat(
        BodyPublishers.ofByteArray(head.getBytes(StandardCharsets.UTF_8)),
        file.bodyPublisher(),
        BodyPublishers.ofByteArray(tail.getBytes(StandardCharsets.UTF_8)));
  }

  String boundary() {
    return "----RecipeMedia" + UUID.randomUUID().toString().replace("-", "");
  }

  private static String escape(String filename) {
    return filename.replace("\"", "%22").replace("\r", "").replace("\n", "");
  }
}
