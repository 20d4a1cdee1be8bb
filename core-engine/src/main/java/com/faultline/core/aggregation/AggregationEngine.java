package com.faultline.core.aggregation;

import com.faultline.core.classification.PlatformDetector;
import com.faultline.core.classification.PriorityScoreCalculator;
import com.faultline.core.model.AggregatedError;
import com.faultline.core.model.AggregationResult;
import com.faultline.core.model.ErrorOccurrence;
import com.faultline.core.model.ErrorSignal;
import com.faultline.core.util.Outcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Folds error signals into aggregated records.
 *
 * <h3>Decision order</h3>
 * <ol>
 * <li><b>Increment</b> the unresolved record for the key last seen within the
 * active window.</li>
 * <li><b>Reopen</b> a RESOLVED or WONT_FIX record for the key, regardless of
 * age. {@code firstSeenAt} is preserved.</li>
 * <li><b>Create</b> a new record with {@code occurrenceCount == 1}.</li>
 * </ol>
 *
 * <p>
 * The whole decision and its write run inside
 * {@link ErrorStore#withLock(String, java.util.function.Supplier)} for the
 * {@code tenant|fingerprint} key. If the insert still collides with a
 * concurrent writer, the key is re-read once and the signal is applied as an
 * increment or reopen.
 * </p>
 *
 * <h3>Failure semantics</h3>
 * <p>
 * {@link #aggregate(String, ErrorSignal)} never throws. Failures are logged
 * at ERROR and returned as {@link Outcome#failure(Exception)}; callers treat
 * them as "error not recorded".
 * </p>
 *
 * @since 1.0.0
 */
public class AggregationEngine {

    private static final Logger LOG = LoggerFactory.getLogger(AggregationEngine.class);

    private final ErrorStore store;
    private final PriorityScoreCalculator priorityCalculator;
    private final Duration activeWindow;
    private final Clock clock;

    /**
     * @param store              backing store
     * @param priorityCalculator recomputes the score after every aggregation
     * @param activeWindow       how recently a record must have been seen to be
     *                           incremented rather than recreated
     * @param clock              time source for first/last seen timestamps
     */
    public AggregationEngine(ErrorStore store, PriorityScoreCalculator priorityCalculator,
            Duration activeWindow, Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.priorityCalculator = Objects.requireNonNull(priorityCalculator, "priorityCalculator must not be null");
        this.activeWindow = Objects.requireNonNull(activeWindow, "activeWindow must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        if (activeWindow.isNegative() || activeWindow.isZero()) {
            throw new IllegalArgumentException("activeWindow must be positive, got: " + activeWindow);
        }
    }

    /**
     * Aggregate one validated signal.
     *
     * @param fingerprint fingerprint of {@code signal}
     * @param signal      the signal
     * @return the result, or a failure if the signal could not be recorded
     */
    public Outcome<AggregationResult> aggregate(String fingerprint, ErrorSignal signal) {
        if (fingerprint == null || signal == null) {
            return Outcome.failure(new IllegalArgumentException("fingerprint and signal are required"));
        }
        String key = AggregatedError.keyOf(signal.getTenantId(), fingerprint);
        Outcome<AggregationResult> outcome = Outcome.of(
                () -> store.withLock(key, () -> aggregateLocked(fingerprint, signal)));

        outcome.getError().ifPresent(e -> LOG.error("Failed to aggregate {} [{}]: {}",
                signal.getType(), key, e.toString(), e));
        return outcome;
    }

    private AggregationResult aggregateLocked(String fingerprint, ErrorSignal signal) {
        Instant now = clock.instant();
        String tenant = signal.getTenantId();

        AggregationResult result = findAndApply(fingerprint, signal, now)
                .orElseGet(() -> createOrRetry(fingerprint, signal, now));

        AggregatedError record = result.getError();
        store.update(record);
        Instant occurredAt = signal.getOccurredAt() != null ? signal.getOccurredAt() : now;
        store.recordOccurrence(new ErrorOccurrence(record.getId(), tenant, record.getErrorType(),
                record.getPlatform(), occurredAt, signal.getUserId(), now));

        // Scored after the write so the distinct-user count sees this record's state
        int previousScore = record.getPriorityScore();
        int score = Outcome.of(() -> priorityCalculator.compute(record))
                .orElseGet(e -> {
                    LOG.warn("Priority computation failed for error {}, keeping {}: {}",
                            record.getId(), previousScore, e.toString());
                    return previousScore;
                });
        if (score != previousScore) {
            record.setPriorityScore(score);
            store.update(record);
        }

        LOG.debug("{} error id={} key={} count={}", result.getAction(), record.getId(),
                record.getKey(), record.getOccurrenceCount());
        return new AggregationResult(record.copy(), result.getAction());
    }

    /**
     * Steps 1 and 2: increment an active record or reopen a terminal one.
     */
    private Optional<AggregationResult> findAndApply(String fingerprint, ErrorSignal signal, Instant now) {
        String tenant = signal.getTenantId();
        Optional<AggregatedError> active = store.findActiveMatch(tenant, fingerprint, now.minus(activeWindow));
        if (active.isPresent()) {
            AggregatedError record = active.get();
            record.recordOccurrence(signal, now);
            return Optional.of(AggregationResult.incremented(record));
        }

        Optional<AggregatedError> terminal = store.findTerminalMatch(tenant, fingerprint);
        if (terminal.isPresent()) {
            AggregatedError record = terminal.get();
            LOG.info("Reopening error id={} ({}) previously {}", record.getId(), record.getErrorType(),
                    record.getState());
            record.reopen(now);
            record.recordOccurrence(signal, now);
            return Optional.of(AggregationResult.reopened(record));
        }
        return Optional.empty();
    }

    /**
     * Step 3, with retry-as-lookup when another writer created the row first.
     */
    private AggregationResult createOrRetry(String fingerprint, ErrorSignal signal, Instant now) {
        String platform = PlatformDetector.resolve(signal.getPlatform(), signal.getUserAgent());
        AggregatedError fresh = AggregatedError.firstOccurrence(fingerprint, signal, platform, now);
        try {
            return AggregationResult.created(store.insert(fresh));
        } catch (DuplicateErrorException e) {
            LOG.debug("Insert raced on {}, retrying as lookup", e.getKey());
            return findAndApply(fingerprint, signal, now)
                    .orElseThrow(() -> new IllegalStateException(
                            "Insert conflict on " + e.getKey() + " but no existing record found", e));
        }
    }
}
