package com.scholary.recipe.media.client;

import static com.scholary.recipe.media.support.TestAssets.asset;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.after;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.scholary.recipe.media.asset.AssetStatus;
import com.scholary.recipe.media.asset.AssetType;
import com.scholary.recipe.media.asset.MediaAsset;
import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class ProcessingPollerTest {

  private static final MediaAsset PROCESSING = asset("v1", AssetType.VIDEO, AssetStatus.PROCESSING);

  @Mock private MediaApiClient apiClient;

  private ScheduledExecutorService scheduler;
  private ProcessingPoller poller;

  @BeforeEach
  void setUp() {
    scheduler = Executors.newSingleThreadScheduledExecutor();
    poller = new ProcessingPoller(apiClient, scheduler, new PollingPolicy(Duration.ofMillis(5), 3));
  }

  @AfterEach
  void tearDown() {
    scheduler.shutdownNow();
  }

  @Test
  void awaitReady_shouldCompleteWhenVideoIsReady() throws Exception {
    MediaAsset ready = asset("v1", AssetType.VIDEO, AssetStatus.READY);
    when(apiClient.pollVideoStatus("v1"))
        .thenReturn(
            CompletableFuture.completedFuture(PROCESSING),
            CompletableFuture.completedFuture(ready));

    MediaAsset result = poller.awaitReady("v1", new CancellationToken()).get(5, TimeUnit.SECONDS);

    assertThat(result).isEqualTo(ready);
    verify(apiClient, times(2)).pollVideoStatus("v1");
  }

  @Test
  void awaitReady_shouldFailWithProviderError() {
    MediaAsset failed = asset("v1", AssetType.VIDEO, AssetStatus.ERROR);
    when(apiClient.pollVideoStatus("v1")).thenReturn(CompletableFuture.completedFuture(failed));

    assertThatThrownBy(
            () -> poller.awaitReady("v1", new CancellationToken()).get(5, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .cause()
        .isInstanceOf(ProcessingFailedException.class)
        .hasMessage("Transcoding failed");
  }

  @Test
  void awaitReady_shouldTimeOutAfterMaxAttempts() {
    when(apiClient.pollVideoStatus("v1")).thenReturn(CompletableFuture.completedFuture(PROCESSING));

    assertThatThrownBy(
            () -> poller.awaitReady("v1", new CancellationToken()).get(5, TimeUnit.SECONDS))
        .cause()
        .isInstanceOf(ProcessingTimeoutException.class)
        .hasMessageStartingWith("Video processing timed out after 3 polls")
        .satisfies(e -> assertThat(((ProcessingTimeoutException) e).getAttempts()).isEqualTo(3));
    verify(apiClient, times(3)).pollVideoStatus("v1");
  }

  @Test
  void awaitReady_shouldTimeOutAsSoonAsLastPollReturns() {
    ProcessingPoller singlePoll =
        new ProcessingPoller(apiClient, scheduler, new PollingPolicy(Duration.ofMillis(500), 1));
    CompletableFuture<MediaAsset> inFlight = new CompletableFuture<>();
    when(apiClient.pollVideoStatus("v1")).thenReturn(inFlight);

    CompletableFuture<MediaAsset> result = singlePoll.awaitReady("v1", new CancellationToken());
    verify(apiClient, timeout(2000)).pollVideoStatus("v1");
    inFlight.complete(PROCESSING);

    // well within the next interval
    assertThatThrownBy(() -> result.get(250, TimeUnit.MILLISECONDS))
        .isInstanceOf(ExecutionException.class)
        .cause()
        .isInstanceOf(ProcessingTimeoutException.class)
        .hasMessage("Video processing timed out after 1 polls over 0 seconds");
  }

  @Test
  void awaitReady_shouldFailWhenResponseHasNoAsset() {
    when(apiClient.pollVideoStatus("v1")).thenReturn(CompletableFuture.completedFuture(null));

    assertThatThrownBy(
            () -> poller.awaitReady("v1", new CancellationToken()).get(2, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .cause()
        .isInstanceOf(ProcessingFailedException.class)
        .hasMessage("Video processing failed");
    verify(apiClient, times(1)).pollVideoStatus("v1");
  }

  @Test
  void awaitReady_shouldFailWhenAssetHasNoStatus() {
    when(apiClient.pollVideoStatus("v1"))
        .thenReturn(CompletableFuture.completedFuture(asset("v1", AssetType.VIDEO, null)));

    assertThatThrownBy(
            () -> poller.awaitReady("v1", new CancellationToken()).get(2, TimeUnit.SECONDS))
        .isInstanceOf(ExecutionException.class)
        .cause()
        .isInstanceOf(ProcessingFailedException.class)
        .hasMessage("Video processing failed");
  }

  @Test
  void awaitReady_shouldNotRetryFailedRequest() {
    when(apiClient.pollVideoStatus("v1"))
        .thenReturn(
            CompletableFuture.failedFuture(
                new MediaApiException("Network error: connection reset", null)));

    assertThatThrownBy(
            () -> poller.awaitReady("v1", new CancellationToken()).get(5, TimeUnit.SECONDS))
        .cause()
        .isInstanceOf(ProcessingFailedException.class)
        .hasMessage("Network error: connection reset");
    verify(apiClient, times(1)).pollVideoStatus("v1");
  }

  @Test
  void awaitReady_shouldStopPollingWhenCancelled() {
    CompletableFuture<MediaAsset> inFlight = new CompletableFuture<>();
    when(apiClient.pollVideoStatus("v1")).thenReturn(inFlight);
    CancellationToken token = new CancellationToken();

    CompletableFuture<MediaAsset> result = poller.awaitReady("v1", token);
    verify(apiClient, timeout(2000)).pollVideoStatus("v1");
    token.cancel();

    assertThat(result).isCancelled();
    assertThat(inFlight).isCancelled();
    verify(apiClient, after(50).times(1)).pollVideoStatus("v1");
  }

  @Test
  void defaults_shouldPollEveryThreeSecondsUpTo120Times() {
    PollingPolicy policy = PollingPolicy.defaults();

    assertThat(policy.interval()).isEqualTo(Duration.ofSeconds(3));
    assertThat(policy.maxAttempts()).isEqualTo(120);
    assertThatThrownBy(() -> new PollingPolicy(Duration.ZERO, 1))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
