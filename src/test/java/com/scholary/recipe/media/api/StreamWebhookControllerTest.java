package com.scholary.recipe.media.api;

import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.argThat;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.scholary.recipe.media.provider.ProviderVideoState.Phase;
import com.scholary.recipe.media.provider.cloudflare.StreamWebhookVerifier;
import com.scholary.recipe.media.service.MediaAssetService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(
    controllers = StreamWebhookController.class,
    properties = "media.provider.type=cloudflare")
@Import(ApiExceptionHandler.class)
class StreamWebhookControllerTest {

  private static final String READY_BODY =
      "{\"uid\":\"cf-v1\",\"readyToStream\":true,\"status\":{\"state\":\"ready\"},"
          + "\"playback\":{\"hls\":\"https://videodelivery.net/cf-v1/manifest/video.m3u8\"},"
          + "\"duration\":21.5}";

  @Autowired private MockMvc mockMvc;

  @MockBean private MediaAssetService mediaAssetService;

  @MockBean private StreamWebhookVerifier verifier;

  @Test
  void onStreamNotification_shouldApplySignedNotification() throws Exception {
    when(verifier.isEnabled()).thenReturn(true);
    when(verifier.verify("time=1,sig1=abc", READY_BODY)).thenReturn(true);

    mockMvc
        .perform(
            post("/api/media/webhook/stream")
                .header("Webhook-Signature", "time=1,sig1=abc")
                .contentType(MediaType.APPLICATION_JSON)
                .content(READY_BODY))
        .andExpect(status().isOk())
        .andExpect(content().string(""));

    verify(mediaAssetService)
        .handleVideoNotification(
            eq("cf-v1"),
            argThat(
                state ->
                    state.phase() == Phase.READY
                        && state.details().durationSeconds().equals(21.5)));
  }

  @Test
  void onStreamNotification_shouldRejectBadSignature() throws Exception {
    when(verifier.isEnabled()).thenReturn(true);
    when(verifier.verify(anyString(), anyString())).thenReturn(false);

    mockMvc
        .perform(
            post("/api/media/webhook/stream")
                .header("Webhook-Signature", "time=1,sig1=forged")
                .contentType(MediaType.APPLICATION_JSON)
                .content(READY_BODY))
        .andExpect(status().isUnauthorized())
        .andExpect(jsonPath("$.error").value("Invalid webhook signature"));

    verifyNoInteractions(mediaAssetService);
  }

  @Test
  void onStreamNotification_shouldSkipVerificationWithoutSecret() throws Exception {
    when(verifier.isEnabled()).thenReturn(false);

    mockMvc
        .perform(
            post("/api/media/webhook/stream")
                .contentType(MediaType.APPLICATION_JSON)
                .content(
                    "{\"uid\":\"cf-v2\",\"status\":{\"state\":\"error\","
                        + "\"errorReasonText\":\"Unsupported codec\"}}"))
        .andExpect(status().isOk());

    verify(mediaAssetService)
        .handleVideoNotification(
            eq("cf-v2"),
            argThat(
                state ->
                    state.phase() == Phase.ERROR
                        && "Unsupported codec".equals(state.errorMessage())));
  }

  @Test
  void onStreamNotification_shouldRejectUnreadableBody() throws Exception {
    mockMvc
        .perform(
            post("/api/media/webhook/stream")
                .contentType(MediaType.APPLICATION_JSON)
                .content("not json"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Invalid webhook body"));

    verifyNoInteractions(mediaAssetService);
  }

  @Test
  void onStreamNotification_shouldRequireUid() throws Exception {
    mockMvc
        .perform(
            post("/api/media/webhook/stream")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"readyToStream\":false}"))
        .andExpect(status().isBadRequest())
        .andExpect(jsonPath("$.error").value("Missing video uid"));

    verifyNoInteractions(mediaAssetService);
  }
}
