package com.faultline.core.classification;

import com.faultline.core.model.Severity;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps an error type name to a {@link Severity}.
 *
 * <p>
 * Lookup order: the configured override table (exact type name), then the
 * built-in critical, high and medium lists, then {@link Severity#LOW}.
 * </p>
 *
 * @since 1.0.0
 */
public class SeverityClassifier {

    static final Set<String> CRITICAL_TYPES = Set.of(
            "java.lang.OutOfMemoryError",
            "java.lang.StackOverflowError",
            "java.lang.SecurityException",
            "java.lang.LinkageError",
            "java.lang.ExceptionInInitializerError",
            "java.sql.SQLException",
            "java.sql.SQLNonTransientConnectionException",
            "javax.net.ssl.SSLException",
            "SecurityError",
            "NoMemoryError",
            "SystemStackError",
            "SignalException",
            "LoadError",
            "SyntaxError",
            "ActiveRecord::StatementInvalid",
            "ActiveRecord::ConnectionNotEstablished",
            "Redis::ConnectionError",
            "OpenSSL::SSL::SSLError");

    static final Set<String> HIGH_TYPES = Set.of(
            "java.lang.NullPointerException",
            "java.lang.IllegalArgumentException",
            "java.lang.IllegalStateException",
            "java.lang.ClassCastException",
            "java.lang.ArithmeticException",
            "java.lang.IndexOutOfBoundsException",
            "java.lang.ArrayIndexOutOfBoundsException",
            "java.util.NoSuchElementException",
            "ArgumentError",
            "TypeError",
            "NoMethodError",
            "NameError",
            "ZeroDivisionError",
            "FloatDomainError",
            "IndexError",
            "KeyError",
            "RangeError",
            "ActiveRecord::RecordNotFound");

    static final Set<String> MEDIUM_TYPES = Set.of(
            "java.net.SocketTimeoutException",
            "java.net.ConnectException",
            "java.util.concurrent.TimeoutException",
            "java.sql.SQLIntegrityConstraintViolationException",
            "java.time.format.DateTimeParseException",
            "java.lang.NumberFormatException",
            "com.fasterxml.jackson.core.JsonParseException",
            "Timeout::Error",
            "Net::ReadTimeout",
            "Net::OpenTimeout",
            "JSON::ParserError",
            "CSV::MalformedCSVError",
            "Errno::ECONNREFUSED",
            "ActiveRecord::RecordInvalid",
            "ActiveRecord::RecordNotUnique");

    private final Map<String, Severity> overrides;

    public SeverityClassifier() {
        this(Map.of());
    }

    /**
     * @param overrides exact type name to severity, consulted first
     */
    public SeverityClassifier(Map<String, Severity> overrides) {
        this.overrides = Map.copyOf(Objects.requireNonNull(overrides, "overrides must not be null"));
    }

    /**
     * @param errorType error class name, may be {@code null}
     * @return the severity, {@link Severity#LOW} when unknown
     */
    public Severity classify(String errorType) {
        if (errorType == null) {
            return Severity.LOW;
        }
        Severity override = overrides.get(errorType);
        if (override != null) {
            return override;
        }
        if (CRITICAL_TYPES.contains(errorType)) {
            return Severity.CRITICAL;
        }
        if (HIGH_TYPES.contains(errorType)) {
            return Severity.HIGH;
        }
        if (MEDIUM_TYPES.contains(errorType)) {
            return Severity.MEDIUM;
        }
        return Severity.LOW;
    }

    public boolean isCritical(String errorType) {
        return classify(errorType) == Severity.CRITICAL;
    }
}
