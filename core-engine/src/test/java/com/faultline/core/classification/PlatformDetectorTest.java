package com.faultline.core.classification;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link PlatformDetector}.
 */
class PlatformDetectorTest {

    @Test
    @DisplayName("Should detect Apple devices case-insensitively")
    void shouldDetectIos() {
        assertThat(PlatformDetector.detect("Mozilla/5.0 (iPhone; CPU iPhone OS 17_0)")).isEqualTo("iOS");
        assertThat(PlatformDetector.detect("MyApp/2.1 ipad")).isEqualTo("iOS");
    }

    @Test
    @DisplayName("Should detect Android")
    void shouldDetectAndroid() {
        assertThat(PlatformDetector.detect("Mozilla/5.0 (Linux; Android 14; Pixel 8)")).isEqualTo("Android");
    }

    @Test
    @DisplayName("Should resolve Expo clients by their OS token")
    void shouldDetectExpo() {
        assertThat(PlatformDetector.detect("Expo/2.30 CFNetwork iOS")).isEqualTo("iOS");
        assertThat(PlatformDetector.detect("Expo/2.30 okhttp")).isEqualTo("Mobile");
    }

    @Test
    @DisplayName("Should default to API for servers and missing agents")
    void shouldDefaultToApi() {
        assertThat(PlatformDetector.detect("curl/8.4.0")).isEqualTo("API");
        assertThat(PlatformDetector.detect(null)).isEqualTo("API");
        assertThat(PlatformDetector.detect("  ")).isEqualTo("API");
    }

    @Test
    @DisplayName("Should prefer an explicit platform")
    void shouldPreferExplicitPlatform() {
        assertThat(PlatformDetector.resolve("Web", "Mozilla/5.0 (iPhone)")).isEqualTo("Web");
        assertThat(PlatformDetector.resolve(null, "Mozilla/5.0 (iPhone)")).isEqualTo("iOS");
    }
}
