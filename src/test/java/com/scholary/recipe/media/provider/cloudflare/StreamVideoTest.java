package com.scholary.recipe.media.provider.cloudflare;

import static org.assertj.core.api.Assertions.assertThat;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.recipe.media.provider.ProviderVideoState;
import com.scholary.recipe.media.provider.ProviderVideoState.Phase;
import com.scholary.recipe.media.support.TestAssets;
import org.junit.jupiter.api.Test;

class StreamVideoTest {

  private final ObjectMapper objectMapper = TestAssets.objectMapper();

  @Test
  void toVideoState_shouldMapReadyVideo() throws Exception {
    StreamVideo video =
        objectMapper.readValue(
            "{\"uid\":\"cf-v1\",\"readyToStream\":true,"
                + "\"status\":{\"state\":\"ready\",\"pctComplete\":\"100.000000\"},"
                + "\"thumbnail\":\"https://videodelivery.net/cf-v1/thumbnails/thumbnail.jpg\","
                + "\"playback\":{"
                + "\"hls\":\"https://videodelivery.net/cf-v1/manifest/video.m3u8\","
                + "\"dash\":\"https://videodelivery.net/cf-v1/manifest/video.mpd\"},"
                + "\"duration\":34.0,"
                + "\"input\":{\"width\":1920,\"height\":1080},"
                + "\"meta\":{\"userId\":\"user-1\",\"context\":\"step\"},"
                + "\"creator\":null}",
            StreamVideo.class);

    ProviderVideoState state = video.toVideoState();

    assertThat(state.phase()).isEqualTo(Phase.READY);
    assertThat(state.details().url())
        .isEqualTo("https://videodelivery.net/cf-v1/manifest/video.m3u8");
    assertThat(state.details().durationSeconds()).isEqualTo(34.0);
    assertThat(state.details().width()).isEqualTo(1920);
    assertThat(state.details().height()).isEqualTo(1080);
  }

  @Test
  void toVideoState_shouldStayProcessingUntilPlaybackIsAvailable() throws Exception {
    StreamVideo video =
        objectMapper.readValue(
            "{\"uid\":\"cf-v1\",\"readyToStream\":false,"
                + "\"status\":{\"state\":\"inprogress\",\"pctComplete\":\"42.5\"}}",
            StreamVideo.class);

    assertThat(video.toVideoState()).isEqualTo(ProviderVideoState.processing());
  }

  @Test
  void toVideoState_shouldUseErrorReasonText() throws Exception {
    StreamVideo video =
        objectMapper.readValue(
            "{\"uid\":\"cf-v1\",\"readyToStream\":false,\"status\":{\"state\":\"error\","
                + "\"errorReasonCode\":\"ERR_DURATION_EXCEED_CONSTRAINT\","
                + "\"errorReasonText\":\"Video exceeds max duration\"}}",
            StreamVideo.class);

    assertThat(video.toVideoState())
        .isEqualTo(ProviderVideoState.error("Video exceeds max duration"));
  }

  @Test
  void toVideoState_shouldFallBackToErrorCode() throws Exception {
    StreamVideo video =
        objectMapper.readValue(
            "{\"uid\":\"cf-v1\",\"status\":{\"state\":\"error\",\"errorReasonCode\":\"ERR_X\"}}",
            StreamVideo.class);

    assertThat(video.toVideoState().errorMessage()).isEqualTo("ERR_X");
  }
}
