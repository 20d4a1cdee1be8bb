package com.faultline.core.config;

import com.faultline.core.model.AnomalyLevel;
import com.faultline.core.model.Severity;

import java.io.Serializable;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Top-level POJO for the Faultline YAML configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional):
 * </p>
 *
 * <pre>
 * ignoredExceptions:
 *   - java.lang.InterruptedException
 *   - /.*NotFoundException/
 * samplingRate: 0.5
 * severityOverrides:
 *   com.acme.PaymentDeclinedException: high
 * notificationMinimumSeverity: medium
 * notificationCooldownMinutes: 5
 * notificationThresholdAlerts: [10, 50, 100]
 * enableBaselineAlerts: true
 * baselineAlertThresholdStdDevs: 2.0
 * baselineAlertSeverities: [high, critical]
 * baselineAlertCooldownMinutes: 120
 * cascadeMaxDelaySeconds: 60
 * analysisLookbackDays: 7
 * timeZone: UTC
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading. Typed accessors such as
 * {@link #minimumNotificationSeverity()} assume a validated instance.
 * </p>
 *
 * @since 1.0.0
 */
public class FaultlineConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    static final List<String> DEFAULT_LIBRARY_PATH_MARKERS = List.of(
            "/gems/", "/vendor/", "/node_modules/", "/site-packages/", "/.m2/repository/",
            "at java.", "at javax.", "at jdk.", "at sun.");

    // --- Filter ---
    private List<String> ignoredExceptions = new ArrayList<>();
    private double samplingRate = 1.0;

    // --- Classification ---
    private Map<String, String> severityOverrides = new LinkedHashMap<>();
    private List<String> libraryPathMarkers = new ArrayList<>(DEFAULT_LIBRARY_PATH_MARKERS);

    // --- Aggregation ---
    private int activeWindowHours = 24;

    // --- Notification throttling ---
    private String notificationMinimumSeverity = "low";
    private int notificationCooldownMinutes = 5;
    private List<Integer> notificationThresholdAlerts = new ArrayList<>(List.of(10, 50, 100, 500, 1000));

    // --- Baseline alerts ---
    private boolean enableBaselineAlerts = true;
    private double baselineAlertThresholdStdDevs = 2.0;
    private List<String> baselineAlertSeverities = new ArrayList<>(List.of("high", "critical"));
    private int baselineAlertCooldownMinutes = 120;

    // --- Periodic analysis ---
    private long cascadeMaxDelaySeconds = 60;
    private int analysisLookbackDays = 7;
    private String timeZone = "UTC";

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every setting, collecting all problems before failing.
     *
     * @throws IllegalStateException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (samplingRate < 0.0 || samplingRate > 1.0) {
            errors.add("'samplingRate' must be within [0.0, 1.0], got: " + samplingRate);
        }
        severityOverrides.forEach((type, severity) -> {
            try {
                Severity.parse(severity);
            } catch (IllegalArgumentException e) {
                errors.add("'severityOverrides." + type + "': " + e.getMessage());
            }
        });
        try {
            Severity.parse(notificationMinimumSeverity);
        } catch (IllegalArgumentException e) {
            errors.add("'notificationMinimumSeverity': " + e.getMessage());
        }
        for (Integer threshold : notificationThresholdAlerts) {
            if (threshold == null || threshold < 1) {
                errors.add("'notificationThresholdAlerts' entries must be >= 1, got: " + threshold);
            }
        }
        for (String level : baselineAlertSeverities) {
            try {
                AnomalyLevel.parse(level);
            } catch (IllegalArgumentException e) {
                errors.add("'baselineAlertSeverities': " + e.getMessage());
            }
        }
        if (activeWindowHours < 1) {
            errors.add("'activeWindowHours' must be >= 1, got: " + activeWindowHours);
        }
        if (baselineAlertThresholdStdDevs <= 0) {
            errors.add("'baselineAlertThresholdStdDevs' must be > 0, got: " + baselineAlertThresholdStdDevs);
        }
        if (cascadeMaxDelaySeconds < 1) {
            errors.add("'cascadeMaxDelaySeconds' must be >= 1, got: " + cascadeMaxDelaySeconds);
        }
        if (analysisLookbackDays < 1) {
            errors.add("'analysisLookbackDays' must be >= 1, got: " + analysisLookbackDays);
        }
        try {
            ZoneId.of(timeZone);
        } catch (DateTimeException | NullPointerException e) {
            errors.add("'timeZone' is not a valid zone id: " + timeZone);
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Faultline configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    // ---------------------------------------------------------------
    // Typed views
    // ---------------------------------------------------------------

    public Severity minimumNotificationSeverity() {
        return Severity.parse(notificationMinimumSeverity);
    }

    public Duration notificationCooldown() {
        return Duration.ofMinutes(notificationCooldownMinutes);
    }

    public Duration baselineAlertCooldown() {
        return Duration.ofMinutes(baselineAlertCooldownMinutes);
    }

    public Duration activeWindow() {
        return Duration.ofHours(activeWindowHours);
    }

    public Duration cascadeMaxDelay() {
        return Duration.ofSeconds(cascadeMaxDelaySeconds);
    }

    public Duration analysisLookback() {
        return Duration.ofDays(analysisLookbackDays);
    }

    public ZoneId zone() {
        return ZoneId.of(timeZone);
    }

    public Map<String, Severity> severityOverrideTable() {
        Map<String, Severity> table = new LinkedHashMap<>();
        severityOverrides.forEach((type, severity) -> table.put(type, Severity.parse(severity)));
        return table;
    }

    public Set<AnomalyLevel> baselineAlertLevels() {
        Set<AnomalyLevel> levels = EnumSet.noneOf(AnomalyLevel.class);
        for (String level : baselineAlertSeverities) {
            levels.add(AnomalyLevel.parse(level));
        }
        return levels;
    }

    // ---------------------------------------------------------------
    // Getters / Setters (used by SnakeYAML)
    // ---------------------------------------------------------------

    public List<String> getIgnoredExceptions() {
        return Collections.unmodifiableList(ignoredExceptions);
    }

    public void setIgnoredExceptions(List<String> ignoredExceptions) {
        this.ignoredExceptions = ignoredExceptions != null ? new ArrayList<>(ignoredExceptions) : new ArrayList<>();
    }

    public double getSamplingRate() {
        return samplingRate;
    }

    public void setSamplingRate(double samplingRate) {
        this.samplingRate = samplingRate;
    }

    public Map<String, String> getSeverityOverrides() {
        return Collections.unmodifiableMap(severityOverrides);
    }

    public void setSeverityOverrides(Map<String, String> severityOverrides) {
        this.severityOverrides = severityOverrides != null
                ? new LinkedHashMap<>(severityOverrides)
                : new LinkedHashMap<>();
    }

    public List<String> getLibraryPathMarkers() {
        return Collections.unmodifiableList(libraryPathMarkers);
    }

    public void setLibraryPathMarkers(List<String> libraryPathMarkers) {
        this.libraryPathMarkers = libraryPathMarkers != null
                ? new ArrayList<>(libraryPathMarkers)
                : new ArrayList<>(DEFAULT_LIBRARY_PATH_MARKERS);
    }

    public int getActiveWindowHours() {
        return activeWindowHours;
    }

    public void setActiveWindowHours(int activeWindowHours) {
        this.activeWindowHours = activeWindowHours;
    }

    public String getNotificationMinimumSeverity() {
        return notificationMinimumSeverity;
    }

    public void setNotificationMinimumSeverity(String notificationMinimumSeverity) {
        this.notificationMinimumSeverity = notificationMinimumSeverity;
    }

    public int getNotificationCooldownMinutes() {
        return notificationCooldownMinutes;
    }

    public void setNotificationCooldownMinutes(int notificationCooldownMinutes) {
        this.notificationCooldownMinutes = notificationCooldownMinutes;
    }

    public List<Integer> getNotificationThresholdAlerts() {
        return Collections.unmodifiableList(notificationThresholdAlerts);
    }

    public void setNotificationThresholdAlerts(List<Integer> notificationThresholdAlerts) {
        this.notificationThresholdAlerts = notificationThresholdAlerts != null
                ? new ArrayList<>(notificationThresholdAlerts)
                : new ArrayList<>();
    }

    public boolean isEnableBaselineAlerts() {
        return enableBaselineAlerts;
    }

    public void setEnableBaselineAlerts(boolean enableBaselineAlerts) {
        this.enableBaselineAlerts = enableBaselineAlerts;
    }

    public double getBaselineAlertThresholdStdDevs() {
        return baselineAlertThresholdStdDevs;
    }

    public void setBaselineAlertThresholdStdDevs(double baselineAlertThresholdStdDevs) {
        this.baselineAlertThresholdStdDevs = baselineAlertThresholdStdDevs;
    }

    public List<String> getBaselineAlertSeverities() {
        return Collections.unmodifiableList(baselineAlertSeverities);
    }

    public void setBaselineAlertSeverities(List<String> baselineAlertSeverities) {
        this.baselineAlertSeverities = baselineAlertSeverities != null
                ? new ArrayList<>(baselineAlertSeverities)
                : new ArrayList<>();
    }

    public int getBaselineAlertCooldownMinutes() {
        return baselineAlertCooldownMinutes;
    }

    public void setBaselineAlertCooldownMinutes(int baselineAlertCooldownMinutes) {
        this.baselineAlertCooldownMinutes = baselineAlertCooldownMinutes;
    }

    public long getCascadeMaxDelaySeconds() {
        return cascadeMaxDelaySeconds;
    }

    public void setCascadeMaxDelaySeconds(long cascadeMaxDelaySeconds) {
        this.cascadeMaxDelaySeconds = cascadeMaxDelaySeconds;
    }

    public int getAnalysisLookbackDays() {
        return analysisLookbackDays;
    }

    public void setAnalysisLookbackDays(int analysisLookbackDays) {
        this.analysisLookbackDays = analysisLookbackDays;
    }

    public String getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(String timeZone) {
        this.timeZone = timeZone;
    }

    @Override
    public String toString() {
        return "FaultlineConfig{" +
                "ignoredExceptions=" + ignoredExceptions +
                ", samplingRate=" + samplingRate +
                ", severityOverrides=" + severityOverrides +
                ", notificationMinimumSeverity='" + notificationMinimumSeverity + '\'' +
                ", notificationCooldownMinutes=" + notificationCooldownMinutes +
                ", enableBaselineAlerts=" + enableBaselineAlerts +
                ", baselineAlertSeverities=" + baselineAlertSeverities +
                ", timeZone='" + timeZone + '\'' +
                '}';
    }
}
