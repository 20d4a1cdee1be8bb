package com.faultline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * A single captured error, as reported by an instrumented application.
 *
 * <p>
 * Signals are ephemeral: they are consumed once by the ingestion pipeline and
 * folded into an {@link AggregatedError}. Only {@code type} and
 * {@code message} are mandatory; every other field is optional context.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder} in code. The no-arg constructor and setters exist
 * for Jackson, which maps the snake_case wire names
 * ({@code stack_frames}, {@code occurred_at}, ...) when configured with a
 * snake_case naming strategy.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class ErrorSignal implements Serializable {

    private static final long serialVersionUID = 1L;

    private String type;
    private String message;
    private List<String> stackFrames = new ArrayList<>();
    private String controller;
    private String action;
    private String tenantId;
    private String platform;
    private Instant occurredAt;
    private String userId;
    private String requestUrl;
    private String userAgent;
    private String ip;

    /** No-arg constructor required by Jackson. */
    public ErrorSignal() {
    }

    private ErrorSignal(Builder b) {
        this.type = b.type;
        this.message = b.message;
        setStackFrames(b.stackFrames);
        this.controller = b.controller;
        this.action = b.action;
        this.tenantId = b.tenantId;
        this.platform = b.platform;
        this.occurredAt = b.occurredAt;
        this.userId = b.userId;
        this.requestUrl = b.requestUrl;
        this.userAgent = b.userAgent;
        this.ip = b.ip;
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Check the mandatory fields.
     *
     * @return list of problems, empty if the signal can be fingerprinted
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (type == null || type.isBlank()) {
            problems.add("type is required");
        }
        if (message == null) {
            problems.add("message is required");
        }
        return problems;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link ErrorSignal}. Performs no validation; call
     * {@link ErrorSignal#validate()} on the result.
     */
    public static class Builder {
        private String type;
        private String message;
        private List<String> stackFrames;
        private String controller;
        private String action;
        private String tenantId;
        private String platform;
        private Instant occurredAt;
        private String userId;
        private String requestUrl;
        private String userAgent;
        private String ip;

        public Builder type(String type) {
            this.type = type;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder stackFrames(List<String> stackFrames) {
            this.stackFrames = stackFrames;
            return this;
        }

        public Builder stackFrames(String... stackFrames) {
            this.stackFrames = List.of(stackFrames);
            return this;
        }

        public Builder controller(String controller) {
            this.controller = controller;
            return this;
        }

        public Builder action(String action) {
            this.action = action;
            return this;
        }

        public Builder tenantId(String tenantId) {
            this.tenantId = tenantId;
            return this;
        }

        public Builder platform(String platform) {
            this.platform = platform;
            return this;
        }

        public Builder occurredAt(Instant occurredAt) {
            this.occurredAt = occurredAt;
            return this;
        }

        public Builder userId(String userId) {
            this.userId = userId;
            return this;
        }

        public Builder requestUrl(String requestUrl) {
            this.requestUrl = requestUrl;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder ip(String ip) {
            this.ip = ip;
            return this;
        }

        public ErrorSignal build() {
            return new ErrorSignal(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    /**
     * @return unmodifiable view of the raw stack frames, never {@code null}
     */
    public List<String> getStackFrames() {
        return Collections.unmodifiableList(stackFrames);
    }

    public void setStackFrames(List<String> stackFrames) {
        this.stackFrames = stackFrames != null ? new ArrayList<>(stackFrames) : new ArrayList<>();
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

    public String getTenantId() {
        return tenantId;
    }

    public void setTenantId(String tenantId) {
        this.tenantId = tenantId;
    }

    public String getPlatform() {
        return platform;
    }

    public void setPlatform(String platform) {
        this.platform = platform;
    }

    public Instant getOccurredAt() {
        return occurredAt;
    }

    public void setOccurredAt(Instant occurredAt) {
        this.occurredAt = occurredAt;
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

    public String getIp() {
        return ip;
    }

    public void setIp(String ip) {
        this.ip = ip;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ErrorSignal that))
            return false;
        return Objects.equals(type, that.type)
                && Objects.equals(message, that.message)
                && Objects.equals(stackFrames, that.stackFrames)
                && Objects.equals(tenantId, that.tenantId)
                && Objects.equals(occurredAt, that.occurredAt);
    }

    @Override
    public int hashCode() {
        return Objects.hash(type, message, stackFrames, tenantId, occurredAt);
    }

    @Override
    public String toString() {
        return "ErrorSignal{" +
                "type='" + type + '\'' +
                ", message='" + message + '\'' +
                ", tenantId='" + tenantId + '\'' +
                ", controller='" + controller + '\'' +
                ", action='" + action + '\'' +
                ", occurredAt=" + occurredAt +
                '}';
    }
}
