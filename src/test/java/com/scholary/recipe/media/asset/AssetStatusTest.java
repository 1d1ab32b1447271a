package com.scholary.recipe.media.asset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

class AssetStatusTest {

  @Test
  void canTransitionTo_shouldOnlyMoveForward() {
    assertThat(AssetStatus.PENDING.canTransitionTo(AssetStatus.PROCESSING)).isTrue();
    assertThat(AssetStatus.PENDING.canTransitionTo(AssetStatus.READY)).isTrue();
    assertThat(AssetStatus.PENDING.canTransitionTo(AssetStatus.ERROR)).isTrue();
    assertThat(AssetStatus.PROCESSING.canTransitionTo(AssetStatus.READY)).isTrue();
    assertThat(AssetStatus.PROCESSING.canTransitionTo(AssetStatus.PROCESSING)).isTrue();

    assertThat(AssetStatus.PROCESSING.canTransitionTo(AssetStatus.PENDING)).isFalse();
    assertThat(AssetStatus.PENDING.canTransitionTo(AssetStatus.PENDING)).isFalse();
  }

  @Test
  void canTransitionTo_shouldNeverLeaveTerminalStatus() {
    for (AssetStatus next : AssetStatus.values()) {
      assertThat(AssetStatus.READY.canTransitionTo(next)).isFalse();
      assertThat(AssetStatus.ERROR.canTransitionTo(next)).isFalse();
    }
  }

  @Test
  void fromValue_shouldBeCaseInsensitive() {
    assertThat(AssetStatus.fromValue("Ready")).isEqualTo(AssetStatus.READY);
    assertThat(AssetStatus.fromValue(" processing ")).isEqualTo(AssetStatus.PROCESSING);
  }

  @Test
  void fromValue_shouldRejectUnknownStatus() {
    assertThatThrownBy(() -> AssetStatus.fromValue("uploaded"))
        .isInstanceOf(IllegalArgumentException.class)
        .hasMessageContaining("uploaded");
  }

  @Test
  void mediaContext_shouldRestrictProfileToImages() {
    assertThat(MediaContext.PROFILE.supports(AssetType.IMAGE)).isTrue();
    assertThat(MediaContext.PROFILE.supports(AssetType.VIDEO)).isFalse();
    assertThat(MediaContext.STEP.supports(AssetType.VIDEO)).isTrue();
  }
}
