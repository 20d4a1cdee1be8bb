package com.faultline.core.util;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link Outcome}.
 */
class OutcomeTest {

    @Test
    @DisplayName("Should capture thrown exceptions as failures")
    void shouldCaptureExceptions() {
        Outcome<String> outcome = Outcome.of(() -> {
            throw new IOException("disk gone");
        });

        assertThat(outcome.isOk()).isFalse();
        assertThat(outcome.getError()).containsInstanceOf(IOException.class);
        assertThat(outcome.orElse("fallback")).isEqualTo("fallback");
        assertThatThrownBy(outcome::get)
                .isInstanceOf(IllegalStateException.class)
                .hasCauseInstanceOf(IOException.class);
    }

    @Test
    @DisplayName("Map should transform values and pass failures through")
    void shouldMap() {
        assertThat(Outcome.ok(20).map(n -> n + 1).get()).isEqualTo(21);

        Outcome<Integer> failed = Outcome.<Integer>failure(new IllegalStateException("boom")).map(n -> n + 1);
        assertThat(failed.getError()).containsInstanceOf(IllegalStateException.class);

        Outcome<Integer> thrown = Outcome.ok("x").map(Integer::parseInt);
        assertThat(thrown.getError()).containsInstanceOf(NumberFormatException.class);
    }

    @Test
    @DisplayName("OrElseGet should receive the failure")
    void shouldPassErrorToFallback() {
        Outcome<String> outcome = Outcome.failure(new IllegalArgumentException("bad"));

        assertThat(outcome.orElseGet(Throwable::getMessage)).isEqualTo("bad");
    }
}
