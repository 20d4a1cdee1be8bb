package com.faultline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Durable record tracking every occurrence of one fingerprint for one tenant.
 *
 * <p>
 * Instances are owned by the aggregation engine: stores hand out copies and
 * only accept changes through {@code ErrorStore#update}. Callers outside the
 * engine should treat the objects they receive as snapshots.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Not thread-safe. Use {@link #copy()} before sharing an instance.
 * </p>
 *
 * @since 1.0.0
 */
public class AggregatedError implements Serializable {

    private static final long serialVersionUID = 1L;

    private long id;
    private String fingerprint;
    private String tenantId;

    private String errorType;
    private String message;
    private String platform;
    private String controller;
    private String action;

    private long occurrenceCount;
    private Instant firstSeenAt;
    private Instant lastSeenAt;

    private ErrorState state = ErrorState.NEW;
    private Instant resolvedAt;
    private Instant reopenedAt;

    // Last-occurrence context, refreshed on each increment
    private String userId;
    private String requestUrl;
    private String userAgent;
    private String ipAddress;

    private int priorityScore;

    public AggregatedError() {
    }

    /**
     * Start a new record from the first signal of a fingerprint.
     *
     * @param fingerprint fingerprint of the signal
     * @param signal      the signal, must have passed validation
     * @param platform    resolved platform name
     * @param now         timestamp used for both first and last seen
     * @return a record with {@code occurrenceCount == 1} in state NEW
     */
    public static AggregatedError firstOccurrence(String fingerprint, ErrorSignal signal,
            String platform, Instant now) {
        Objects.requireNonNull(fingerprint, "fingerprint must not be null");
        Objects.requireNonNull(signal, "signal must not be null");
        AggregatedError error = new AggregatedError();
        error.fingerprint = fingerprint;
        error.tenantId = signal.getTenantId();
        error.errorType = signal.getType();
        error.message = signal.getMessage();
        error.platform = platform;
        error.controller = signal.getController();
        error.action = signal.getAction();
        error.occurrenceCount = 1;
        error.firstSeenAt = now;
        error.lastSeenAt = now;
        error.state = ErrorState.NEW;
        error.userId = signal.getUserId();
        error.requestUrl = signal.getRequestUrl();
        error.userAgent = signal.getUserAgent();
        error.ipAddress = signal.getIp();
        return error;
    }

    /**
     * Fold another occurrence into this record.
     *
     * <p>
     * Context attributes are only replaced when the new signal carries a
     * value, so a sparse signal never erases what an earlier one reported.
     * </p>
     *
     * @param signal the recurring signal
     * @param now    new last-seen timestamp
     */
    public void recordOccurrence(ErrorSignal signal, Instant now) {
        occurrenceCount++;
        lastSeenAt = now;
        userId = preferNew(signal.getUserId(), userId);
        requestUrl = preferNew(signal.getRequestUrl(), requestUrl);
        userAgent = preferNew(signal.getUserAgent(), userAgent);
        ipAddress = preferNew(signal.getIp(), ipAddress);
    }

    /**
     * Move a terminal record back to {@link ErrorState#NEW}. {@code firstSeenAt}
     * is left untouched.
     *
     * @param now reopen timestamp
     */
    public void reopen(Instant now) {
        state = ErrorState.NEW;
        resolvedAt = null;
        reopenedAt = now;
    }

    /**
     * @return a detached copy of this record
     */
    public AggregatedError copy() {
        AggregatedError c = new AggregatedError();
        c.id = id;
        c.fingerprint = fingerprint;
        c.tenantId = tenantId;
        c.errorType = errorType;
        c.message = message;
        c.platform = platform;
        c.controller = controller;
        c.action = action;
        c.occurrenceCount = occurrenceCount;
        c.firstSeenAt = firstSeenAt;
        c.lastSeenAt = lastSeenAt;
        c.state = state;
        c.resolvedAt = resolvedAt;
        c.reopenedAt = reopenedAt;
        c.userId = userId;
        c.requestUrl = requestUrl;
        c.userAgent = userAgent;
        c.ipAddress = ipAddress;
        c.priorityScore = priorityScore;
        return c;
    }

    private static String preferNew(String candidate, String current) {
        return candidate != null ? candidate : current;
    }

    // ---------------------------------------------------------------
    // Derived
    // ---------------------------------------------------------------

    public boolean isResolved() {
        return state != null && state.isTerminal();
    }

    /**
     * @return the (tenant, fingerprint) lock key for this record
     */
    @JsonIgnore
    public String getKey() {
        return keyOf(tenantId, fingerprint);
    }

    /**
     * Build the composite key under which writes for a fingerprint are
     * serialized.
     *
     * @param tenantId    tenant, may be {@code null}
     * @param fingerprint fingerprint
     * @return composite key
     */
    public static String keyOf(String tenantId, String fingerprint) {
        return (tenantId == null ? "" : tenantId) + "|" + fingerprint;
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public long getId() {
        return id;
    }

    public void setId(long id) {
        this.id = id;
    }

    public String getFingerprint() {
        return fingerprint;
    }

    public void setFingerprint(String fingerprint) {
        this.fingerprint = fingerprint;
    }

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public String getErrorType() {
        return errorType;
    }

    public void setErrorType(String errorType) {
        this.errorType = errorType;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    public String getPlatform() {
        return platform;
    }

    public void setPlatform(String platform) {
        this.platform = platform;
    }

    public String getController() {
        return controller;
    }

    public void setController(String controller) {
        this.controller = controller;
    }

    public String getAction() {
        return action;
    }

    public void setAction(String action) {
        this.action = action;
    }

    public long getOccurrenceCount() {
        return occurrenceCount;
    }

    public void setOccurrenceCount(long occurrenceCount) {
        this.occurrenceCount = occurrenceCount;
    }

    public Instant getFirstSeenAt() {
        return firstSeenAt;
    }

    public void setFirstSeenAt(Instant firstSeenAt) {
        this.firstSeenAt = firstSeenAt;
    }

    public Instant getLastSeenAt() {
        return lastSeenAt;
    }

    public void setLastSeenAt(Instant lastSeenAt) {
        this.lastSeenAt = lastSeenAt;
    }

    public ErrorState getState() {
        return state;
    }

    public void setState(ErrorState state) {
        this.state = state;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public void setResolvedAt(Instant resolvedAt) {
        this.resolvedAt = resolvedAt;
    }

    public Instant getReopenedAt() {
        return reopenedAt;
    }

    public void setReopenedAt(Instant reopenedAt) {
        this.reopenedAt = reopenedAt;
    }

    public String getUserId() {
        return userId;
    }

    public void setUserId(String userId) {
        this.userId = userId;
    }

    public String getRequestUrl() {
        return requestUrl;
    }

    public void setRequestUrl(String requestUrl) {
        this.requestUrl = requestUrl;
    }

    public String getUserAgent() {
        return userAgent;
    }

    public void setUserAgent(String userAgent) {
        this.userAgent = userAgent;
    }

    public String getIpAddress() {
        return ipAddress;
    }

    public void setIpAddress(String ipAddress) {
        this.ipAddress = ipAddress;
    }

    public int getPriorityScore() {
        return priorityScore;
    }

    public void setPriorityScore(int priorityScore) {
        this.priorityScore = priorityScore;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AggregatedError that))
            return false;
        return id == that.id
                && Objects.equals(fingerprint, that.fingerprint)
                && Objects.equals(tenantId, that.tenantId);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, fingerprint, tenantId);
    }

    @Override
    public String toString() {
        return "AggregatedError{" +
                "id=" + id +
                ", fingerprint='" + fingerprint + '\'' +
                ", tenantId='" + tenantId + '\'' +
                ", errorType='" + errorType + '\'' +
                ", occurrenceCount=" + occurrenceCount +
                ", state=" + state +
                ", firstSeenAt=" + firstSeenAt +
                ", lastSeenAt=" + lastSeenAt +
                '}';
    }
}
