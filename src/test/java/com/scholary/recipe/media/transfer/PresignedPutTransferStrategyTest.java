package com.scholary.recipe.media.transfer;

import static com.github.tomakehurst.wiremock.client.WireMock.aResponse;
import static com.github.tomakehurst.wiremock.client.WireMock.binaryEqualTo;
import static com.github.tomakehurst.wiremock.client.WireMock.equalTo;
import static com.github.tomakehurst.wiremock.client.WireMock.put;
import static com.github.tomakehurst.wiremock.client.WireMock.putRequestedFor;
import static com.github.tomakehurst.wiremock.client.WireMock.urlPathEqualTo;
import static com.github.tomakehurst.wiremock.core.WireMockConfiguration.options;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.github.tomakehurst.wiremock.WireMockServer;
import com.scholary.recipe.media.asset.UploadProtocol;
import com.scholary.recipe.media.client.CancellationToken;
import com.scholary.recipe.media.client.MediaFile;
import com.scholary.recipe.media.client.UploadTarget;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PresignedPutTransferStrategyTest {

  private static final byte[] CONTENT = new byte[] {0, 0, 0, 24, 'f', 't', 'y', 'p'};

  private WireMockServer wireMock;
  private PresignedPutTransferStrategy strategy;
  private UploadTarget target;

  @BeforeEach
  void setUp() {
    wireMock = new WireMockServer(options().dynamicPort());
    wireMock.start();
    HttpClient httpClient = HttpClient.newBuilder().version(HttpClient.Version.HTTP_1_1).build();
    strategy = new PresignedPutTransferStrategy(httpClient, Duration.ofSeconds(5));
    target =
        new UploadTarget(
            "v1",
            wireMock.baseUrl() + "/media/video/v1.mp4?X-Amz-Signature=abc",
            "video/v1.mp4",
            UploadProtocol.PUT);
  }

  @AfterEach
  void tearDown() {
    wireMock.stop();
  }

  @Test
  void transfer_shouldPutRawBytesWithSignedContentType() {
    wireMock.stubFor(
        put(urlPathEqualTo("/media/video/v1.mp4")).willReturn(aResponse().withStatus(200)));
    List<Integer> progress = new CopyOnWriteArrayList<>();

    strategy
        .transfer(
            target,
            MediaFile.of("step.mp4", "video/mp4", CONTENT),
            progress::add,
            new CancellationToken())
        .join();

    wireMock.verify(
        putRequestedFor(urlPathEqualTo("/media/video/v1.mp4"))
            .withQueryParam("X-Amz-Signature", equalTo("abc"))
            .withHeader("Content-Type", equalTo("video/mp4"))
            .withRequestBody(binaryEqualTo(CONTENT)));
    assertThat(progress).contains(100);
  }

  @Test
  void transfer_shouldReportSignatureMismatchAsRejection() {
    wireMock.stubFor(
        put(urlPathEqualTo("/media/video/v1.mp4"))
            .willReturn(aResponse().withStatus(403).withBody("SignatureDoesNotMatch")));

    assertThatThrownBy(
            () ->
                strategy
                    .transfer(
                        target,
                        MediaFile.of("step.mp4", "video/mp4", CONTENT),
                        ProgressSink.NONE,
                        new CancellationToken())
                    .join())
        .cause()
        .isInstanceOf(TransferException.class)
        .hasMessage("Upload failed with status 403: SignatureDoesNotMatch");
  }
}
