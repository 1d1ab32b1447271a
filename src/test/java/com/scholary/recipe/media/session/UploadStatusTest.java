package com.scholary.recipe.media.session;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class UploadStatusTest {

  @Test
  void next_shouldFollowImagePath() {
    UploadStatus status = UploadStatus.IDLE;

    status = status.next(UploadEvent.STARTED);
    assertThat(status).isEqualTo(UploadStatus.REQUESTING);
    status = status.next(UploadEvent.TARGET_ISSUED);
    assertThat(status).isEqualTo(UploadStatus.UPLOADING);
    status = status.next(UploadEvent.IMAGE_TRANSFERRED);
    assertThat(status).isEqualTo(UploadStatus.CONFIRMING);
    status = status.next(UploadEvent.ASSET_READY);
    assertThat(status).isEqualTo(UploadStatus.READY);
  }

  @Test
  void next_shouldFollowVideoPath() {
    UploadStatus status =
        UploadStatus.IDLE
            .next(UploadEvent.STARTED)
            .next(UploadEvent.TARGET_ISSUED)
            .next(UploadEvent.VIDEO_TRANSFERRED);

    assertThat(status).isEqualTo(UploadStatus.PROCESSING);
    assertThat(status.next(UploadEvent.ASSET_READY)).isEqualTo(UploadStatus.READY);
  }

  @Test
  void next_shouldAllowFailureOnlyWhileActive() {
    for (UploadStatus status : UploadStatus.values()) {
      if (status.isActive()) {
        assertThat(status.next(UploadEvent.FAILED)).isEqualTo(UploadStatus.ERROR);
      } else {
        assertThatThrownBy(() -> status.next(UploadEvent.FAILED))
            .isInstanceOf(IllegalUploadTransitionException.class);
      }
    }
  }

  @Test
  void next_shouldResetFromAnyStatus() {
    for (UploadStatus status : UploadStatus.values()) {
      assertThat(status.next(UploadEvent.RESET)).isEqualTo(UploadStatus.IDLE);
    }
  }

  @Test
  void next_shouldRejectSkippingPhases() {
    assertThatThrownBy(() -> UploadStatus.IDLE.next(UploadEvent.TARGET_ISSUED))
        .isInstanceOf(IllegalUploadTransitionException.class);
    assertThatThrownBy(() -> UploadStatus.REQUESTING.next(UploadEvent.ASSET_READY))
        .isInstanceOf(IllegalUploadTransitionException.class);
    assertThatThrownBy(() -> UploadStatus.READY.next(UploadEvent.STARTED))
        .isInstanceOf(IllegalUploadTransitionException.class);
  }

  @Test
  void next_shouldOnlyAdoptFromIdle() {
    assertThat(UploadStatus.IDLE.next(UploadEvent.ADOPTED_READY)).isEqualTo(UploadStatus.READY);
    assertThat(UploadStatus.IDLE.next(UploadEvent.ADOPTED_PROCESSING))
        .isEqualTo(UploadStatus.PROCESSING);
    assertThat(UploadStatus.IDLE.next(UploadEvent.ADOPTED_ERROR)).isEqualTo(UploadStatus.ERROR);
    assertThatThrownBy(() -> UploadStatus.UPLOADING.next(UploadEvent.ADOPTED_READY))
        .isInstanceOf(IllegalUploadTransitionException.class);
  }

  @Test
  void isActive_shouldExcludeIdleAndTerminalStatuses() {
    assertThat(UploadStatus.IDLE.isActive()).isFalse();
    assertThat(UploadStatus.READY.isActive()).isFalse();
    assertThat(UploadStatus.ERROR.isActive()).isFalse();
    assertThat(UploadStatus.CONFIRMING.isActive()).isTrue();
    assertThat(UploadStatus.READY.isTerminal()).isTrue();
  }
}
