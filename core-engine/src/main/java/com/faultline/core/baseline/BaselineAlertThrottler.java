package com.faultline.core.baseline;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Cooldown for baseline anomaly alerts, keyed by (error type, platform).
 *
 * <p>
 * Independent of the per-fingerprint notification cooldown: a burst of new
 * fingerprints sharing an error type raises at most one baseline alert per
 * window. Per-process state, like the notification throttler.
 * </p>
 *
 * @since 1.0.0
 */
public class BaselineAlertThrottler {

    private static final Logger LOG = LoggerFactory.getLogger(BaselineAlertThrottler.class);

    private final Duration cooldown;
    private final Clock clock;

    private final Map<String, Instant> lastAlerted = new HashMap<>();
    private final ReentrantLock lock = new ReentrantLock();

    public BaselineAlertThrottler(Duration cooldown, Clock clock) {
        this.cooldown = Objects.requireNonNull(cooldown, "cooldown must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public boolean shouldAlert(String errorType, String platform) {
        if (cooldown.isZero() || cooldown.isNegative()) {
            return true;
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            Instant last = lastAlerted.get(key(errorType, platform));
            return last == null || now.isAfter(last.plus(cooldown));
        } finally {
            lock.unlock();
        }
    }

    public void recordAlert(String errorType, String platform) {
        Instant now = clock.instant();
        lock.lock();
        try {
            lastAlerted.put(key(errorType, platform), now);
        } finally {
            lock.unlock();
        }
    }

    public void clear() {
        lock.lock();
        try {
            lastAlerted.clear();
        } finally {
            lock.unlock();
        }
    }

    /**
     * @return number of removed entries
     */
    public int prune(Duration maxAge) {
        Instant cutoff = clock.instant().minus(maxAge);
        lock.lock();
        try {
            int before = lastAlerted.size();
            lastAlerted.values().removeIf(at -> at.isBefore(cutoff));
            int removed = before - lastAlerted.size();
            LOG.trace("Pruned {} baseline alert entries", removed);
            return removed;
        } finally {
            lock.unlock();
        }
    }

    public Map<String, Instant> snapshot() {
        lock.lock();
        try {
            return new HashMap<>(lastAlerted);
        } finally {
            lock.unlock();
        }
    }

    public void restore(Map<String, Instant> entries) {
        Objects.requireNonNull(entries, "entries must not be null");
        lock.lock();
        try {
            lastAlerted.clear();
            lastAlerted.putAll(entries);
        } finally {
            lock.unlock();
        }
    }

    public int trackedCount() {
        lock.lock();
        try {
            return lastAlerted.size();
        } finally {
            lock.unlock();
        }
    }

    private static String key(String errorType, String platform) {
        return errorType + "|" + platform;
    }
}
