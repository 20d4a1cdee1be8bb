package com.faultline.core.config;

import com.faultline.core.model.AnomalyLevel;
import com.faultline.core.model.Severity;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ConfigLoader}.
 */
class ConfigLoaderTest {

    @Test
    @DisplayName("Should load settings from classpath")
    void shouldLoadFromClasspath() {
        FaultlineConfig config = ConfigLoader.fromClasspath("test-faultline.yml");

        assertThat(config.getIgnoredExceptions()).containsExactly("ActionController::RoutingError", "/.*NotFound$/");
        assertThat(config.getSamplingRate()).isEqualTo(0.5);
        assertThat(config.severityOverrideTable()).containsEntry("com.acme.PaymentDeclined", Severity.CRITICAL);
        assertThat(config.minimumNotificationSeverity()).isEqualTo(Severity.MEDIUM);
        assertThat(config.notificationCooldown()).isEqualTo(Duration.ofMinutes(10));
        assertThat(config.getNotificationThresholdAlerts()).containsExactly(5, 25);
        assertThat(config.baselineAlertLevels()).containsExactlyInAnyOrder(AnomalyLevel.ELEVATED, AnomalyLevel.HIGH,
                AnomalyLevel.CRITICAL);
        assertThat(config.zone()).isEqualTo(ZoneId.of("Europe/Berlin"));
    }

    @Test
    @DisplayName("Unset keys should keep their defaults")
    void shouldKeepDefaults() {
        FaultlineConfig config = ConfigLoader.fromClasspath("test-faultline.yml");

        assertThat(config.activeWindow()).isEqualTo(Duration.ofHours(24));
        assertThat(config.cascadeMaxDelay()).isEqualTo(Duration.ofSeconds(60));
        assertThat(config.getLibraryPathMarkers()).contains("/gems/", "/node_modules/");
    }

    @Test
    @DisplayName("Should collect every validation problem")
    void shouldRejectInvalidSettings() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("invalid-faultline.yml"))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("samplingRate")
                .hasMessageContaining("notificationMinimumSeverity")
                .hasMessageContaining("timeZone");
    }

    @Test
    @DisplayName("Should throw when classpath resource does not exist")
    void shouldThrowForMissingResource() {
        assertThatThrownBy(() -> ConfigLoader.fromClasspath("does-not-exist.yml"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not found");
    }

    @Test
    @DisplayName("Should throw when the file does not exist")
    void shouldThrowForMissingFile() {
        assertThatThrownBy(() -> ConfigLoader.fromFile("/nonexistent/faultline.yml"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("An empty file should yield defaults")
    void shouldUseDefaultsForEmptyFile() {
        FaultlineConfig config = ConfigLoader.fromClasspath("empty-faultline.yml");

        assertThat(config.getNotificationThresholdAlerts()).containsExactly(10, 50, 100, 500, 1000);
        assertThat(config.minimumNotificationSeverity()).isEqualTo(Severity.LOW);
    }

    @Test
    @DisplayName("Automatic resolution should pick up the bundled configuration")
    void shouldLoadBundledConfiguration() {
        FaultlineConfig config = ConfigLoader.load();

        assertThat(config.getIgnoredExceptions()).contains("java.lang.InterruptedException");
    }

    @Test
    @DisplayName("Defaults should validate")
    void defaultsShouldBeValid() {
        FaultlineConfig config = ConfigLoader.defaults();

        assertThat(config.getSamplingRate()).isEqualTo(1.0);
        assertThat(config.isEnableBaselineAlerts()).isTrue();
    }
}
