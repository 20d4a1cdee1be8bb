package com.faultline.core.notification;

import com.faultline.core.classification.SeverityClassifier;
import com.faultline.core.model.AggregatedError;
import com.faultline.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Decides whether an aggregated error should trigger a notification.
 *
 * <p>
 * A notification is allowed when the error's severity meets the configured
 * minimum and its fingerprint is outside the cooldown window. Occurrence
 * milestones ({@link #thresholdReached(AggregatedError)}) are reported
 * independently of the cooldown.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * A map of fingerprint to last-notified instant, guarded by a single lock.
 * The state is per process: in a multi-process deployment each process
 * enforces its own cooldown. Construct one instance per process and inject
 * it; call {@link #prune(Duration)} periodically to bound memory.
 * </p>
 *
 * <h3>Failure policy</h3>
 * <p>
 * Checks fail open: an internal error allows the notification.
 * </p>
 *
 * @since 1.0.0
 */
public class NotificationThrottler {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationThrottler.class);

    private final SeverityClassifier severityClassifier;
    private final Severity minimumSeverity;
    private final Duration cooldown;
    private final Set<Long> thresholds;
    private final Clock clock;

    private final Map<String, Instant> lastNotified = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    /**
     * @param severityClassifier classifies the record's error type
     * @param minimumSeverity    lowest severity that may notify
     * @param cooldown           per-fingerprint quiet period; zero or negative
     *                           disables it
     * @param thresholds         occurrence-count milestones
     * @param clock              time source
     */
    public NotificationThrottler(SeverityClassifier severityClassifier, Severity minimumSeverity,
            Duration cooldown, List<Integer> thresholds, Clock clock) {
        this.severityClassifier = Objects.requireNonNull(severityClassifier, "severityClassifier must not be null");
        this.minimumSeverity = Objects.requireNonNull(minimumSeverity, "minimumSeverity must not be null");
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.thresholds = new TreeSet<>();
        for (Integer t : Objects.requireNonNull(thresholds, "thresholds must not be null")) {
            if (t != null) {
                this.thresholds.add(t.longValue());
            }
        }
    }

    /**
     * @return {@code true} if a notification should be sent now
     */
    public boolean shouldNotify(AggregatedError record) {
        try {
            if (!severityMeetsMinimum(record)) {
                return false;
            }
            return cooldownElapsed(record.getFingerprint());
        } catch (RuntimeException e) {
            LOG.warn("Throttle check failed for {}, allowing notification: {}", describe(record), e.toString());
            return true;
        }
    }

    public boolean severityMeetsMinimum(AggregatedError record) {
        try {
            return severityClassifier.classify(record.getErrorType()).isAtLeast(minimumSeverity);
        } catch (RuntimeException e) {
            LOG.warn("Severity check failed for {}, allowing notification: {}", describe(record), e.toString());
            return true;
        }
    }

    /**
     * @return {@code true} if the occurrence count is exactly a configured
     *         milestone
     */
    public boolean thresholdReached(AggregatedError record) {
        try {
            return thresholds.contains(record.getOccurrenceCount());
        } catch (RuntimeException e) {
            LOG.warn("Threshold check failed for {}: {}", describe(record), e.toString());
            return false;
        }
    }

    public void recordNotification(AggregatedError record) {
        Objects.requireNonNull(record, "record must not be null");
        Instant now = clock.instant();
        lock.lock();
        try {
            lastNotified.put(record.getFingerprint(), now);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            lastNotified.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Forget fingerprints last notified more than {@code maxAge} ago.
     *
     * @return number of removed entries
     */
    public int prune(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        lock.lock();
        try {
            int before = lastNotified.size();
            lastNotified.values().removeIf(at -> at.isBefore(cutoff));
            int removed = before - lastNotified.size();
            if (removed > 0) {
                LOG.debug("Pruned {} notification throttle entries", removed);
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return copy of the per-fingerprint last notification times
     */
    public Map<String, Instant> snapshot() {
        lock.lock();
        try {
            return new HashMap<>(lastNotified);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replace the cooldown state with entries taken by {@link #snapshot()}.
     */
    public void restore(Map<String, Instant> entries) {
        Objects.requireNonNull(entries, "entries must not be null");
        lock.lock();
        try {
            lastNotified.clear();
            lastNotified.putAll(entries);
        } finally {
            lock.unlock();
        }
    }

    public int trackedCount() {
        lock.lock();
        try {
            return lastNotified.size();
        } finally {
            lock.unlock();
        }
    }

    private boolean cooldownElapsed(String fingerprint) {
        if (cooldown.isZero() || cooldown.isNegative()) {
            return true;
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            Instant last = lastNotified.get(fingerprint);
            return last == null || now.isAfter(last.plus(cooldown));
        } finally {
            lock.unlock();
        }
    }

    private static String describe(AggregatedError record) {
        return record == null ? "null" : record.getFingerprint();
    }
}
