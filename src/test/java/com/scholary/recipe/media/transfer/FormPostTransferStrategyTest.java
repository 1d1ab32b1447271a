package com.scholary.recipe.media.transfer;

import static com.github.tomakehurst.wiremock.client.WireMock.aMultipart;
import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.binaryEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.containing;
import static com.github.tomakehurst.wiremock.client.WireMock.post;
import static com.github.tomakehurst.wiremock.client.WireMock.postRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.github.tomakehurst.wiremock.http.Fault;
import com.scholary.recipe.media.asset.UploadProtocol;
import com.scholary.recipe.media.client.CancellationToken;
import com.scholary.recipe.media.client.MediaFile;
import com.scholary.recipe.media.client.UploadTarget;
import java.net.http.HttpClient;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FormPostTransferStrategyTest {

  private static final byte[] CONTENT = "not really a jpeg".getBytes(StandardCharsets.UTF_8);

  private WireMockServer wireMock;
  private FormPostTransferStrategy strategy;
  private UploadTarget target;

  @BeforeEach
  void setUp() {
    wireMock = new WireMockServer(options().dynamicPort());
    wireMock.start();
    HttpClient httpClient = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    strategy = new FormPostTransferStrategy(httpClient, Duration.ofSeconds(5));
    target =
        new UploadTarget("a1", wireMock.baseUrl() + "/upload/a1", "p1", UploadProtocol.FORM_POST);
  }

  @AfterEach
  void tearDown() {
    wireMock.stop();
  }

  @Test
  void transfer_shouldPostFileAsMultipartPart(@TempDir Path dir) throws Exception {
    wireMock.stubFor(post(urlEqualTo("/upload/a1")).willReturn(aResponse().withStatus(200)));
    Path path = Files.write(dir.resolve("dish.jpg"), CONTENT);
    List<Integer> progress = new CopyOnWriteArrayList<>();

    strategy
        .transfer(target, MediaFile.of(path, "image/jpeg"), progress::add, new CancellationToken())
        .join();

    wireMock.verify(
        postRequestedFor(urlEqualTo("/upload/a1"))
            .withHeader("Content-Type", containing("multipart/form-data; boundary="))
            .withAnyRequestBodyPart(
                aMultipart()
                    .withName("file")
                    .withHeader("Content-Type", containing("image/jpeg"))
                    .withBody(binaryEqualTo(CONTENT))));
    assertThat(progress).isNotEmpty().isSorted().last().isEqualTo(100);
  }

  @Test
  void transfer_shouldReportRejectionWithResponseBody() {
    wireMock.stubFor(
        post(urlEqualTo("/upload/a1"))
            .willReturn(aResponse().withStatus(413).withBody("Payload Too Large")));

    assertThatThrownBy(
            () ->
                strategy
                    .transfer(
                        target,
                        MediaFile.of("dish.jpg", "image/jpeg", CONTENT),
                        ProgressSink.NONE,
                        new CancellationToken())
                    .join())
        .cause()
        .isInstanceOf(TransferException.class)
        .hasMessage("Upload failed with status 413: Payload Too Large")
        .satisfies(
            e -> {
              TransferException failure = (TransferException) e;
              assertThat(failure.getKind()).isEqualTo(TransferException.Kind.REJECTED);
              assertThat(failure.getStatusCode()).isEqualTo(413);
            });
  }

  @Test
  void transfer_shouldReportNetworkFailure() {
    wireMock.stubFor(
        post(urlEqualTo("/upload/a1"))
            .willReturn(aResponse().withFault(Fault.CONNECTION_RESET_BY_PEER)));

    assertThatThrownBy(
            () ->
                strategy
                    .transfer(
                        target,
                        MediaFile.of("dish.jpg", "image/jpeg", CONTENT),
                        ProgressSink.NONE,
                        new CancellationToken())
                    .join())
        .cause()
        .isInstanceOf(TransferException.class)
        .satisfies(
            e ->
                assertThat(((TransferException) e).getKind())
                    .isEqualTo(TransferException.Kind.NETWORK));
  }

  @Test
  void transfer_shouldNotSendWhenAlreadyCancelled() {
    CancellationToken token = new CancellationToken();
    token.cancel();

    assertThatThrownBy(
            () ->
                strategy
                    .transfer(
                        target,
                        MediaFile.of("dish.jpg", "image/jpeg", CONTENT),
                        ProgressSink.NONE,
                        token)
                    .join())
        .isInstanceOf(CancellationException.class);
    assertThat(wireMock.getAllServeEvents()).isEmpty();
  }
}
