package com.scholary.recipe.media.transfer;

import static org.assertj.core.api.Assertions.assertThat;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.Test;

class MonotonicProgressSinkTest {

  @Test
  void report_shouldForwardOnlyIncreasingValues() {
    List<Integer> reported = new ArrayList<>();
    MonotonicProgressSink sink = new MonotonicProgressSink(reported::add);

    sink.report(0);
    sink.report(25);
    sink.report(25);
    sink.report(10);
    sink.report(80);

    assertThat(reported).containsExactly(0, 25, 80);
    assertThat(sink.last()).isEqualTo(80);
  }

  @Test
  void report_shouldClampToPercentRange() {
    List<Integer> reported = new ArrayList<>();
    MonotonicProgressSink sink = new MonotonicProgressSink(reported::add);

    sink.report(-5);
    sink.report(140);
    sink.report(100);

    assertThat(reported).containsExactly(0, 100);
  }

  @Test
  void percentOf_shouldRoundAndHandleEmptyTotal() {
    assertThat(MonotonicProgressSink.percentOf(1, 3)).isEqualTo(33);
    assertThat(MonotonicProgressSink.percentOf(2, 3)).isEqualTo(67);
    assertThat(MonotonicProgressSink.percentOf(10, 10)).isEqualTo(100);
    assertThat(MonotonicProgressSink.percentOf(5, 0)).isZero();
  }
}
