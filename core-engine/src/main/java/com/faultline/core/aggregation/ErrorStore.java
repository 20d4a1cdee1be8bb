package com.faultline.core.aggregation;

import com.faultline.core.model.AggregatedError;
import com.faultline.core.model.Baseline;
import com.faultline.core.model.CascadePattern;
import com.faultline.core.model.ErrorOccurrence;
import com.faultline.core.model.PeriodType;

import java.time.Instant;
import java.time.ZoneId;
import java.util.List;
import java.util.Optional;
import java.util.SortedMap;
import java.util.function.Supplier;

/**
 * Persistence operations required by the aggregation core.
 *
 * <p>
 * Implementations must serialize {@link #withLock(String, Supplier)} per key
 * while letting different keys proceed in parallel. Records returned by the
 * finder methods are detached snapshots; changes become visible only through
 * {@link #update(AggregatedError)}.
 * </p>
 *
 * @since 1.0.0
 */
public interface ErrorStore {

    /**
     * Run {@code action} while holding the exclusive lock for {@code key}.
     * Reentrant for the calling thread.
     *
     * @param key    lock key, e.g. {@link AggregatedError#keyOf(String, String)}
     * @param action work to perform under the lock
     * @param <T>    result type
     * @return the action's result
     */
    <T> T withLock(String key, Supplier<T> action);

    // ---------------------------------------------------------------
    // Aggregated errors
    // ---------------------------------------------------------------

    /**
     * Find the unresolved record for a key last seen at or after
     * {@code since}. When several qualify, the most recently seen wins.
     */
    Optional<AggregatedError> findActiveMatch(String tenantId, String fingerprint, Instant since);

    /**
     * Find a RESOLVED or WONT_FIX record for a key, regardless of age. When
     * several qualify, the most recently seen wins.
     */
    Optional<AggregatedError> findTerminalMatch(String tenantId, String fingerprint);

    /**
     * Insert a new record and assign its id.
     *
     * @return the stored record, with id populated
     * @throws DuplicateErrorException if an active record for the same key exists
     */
    AggregatedError insert(AggregatedError record);

    /**
     * Replace a stored record.
     *
     * @throws IllegalArgumentException if no record with that id exists
     */
    void update(AggregatedError record);

    Optional<AggregatedError> findById(long id);

    // ---------------------------------------------------------------
    // Occurrences
    // ---------------------------------------------------------------

    void recordOccurrence(ErrorOccurrence occurrence);

    /**
     * @return number of occurrences recorded for one aggregated error
     */
    long countOccurrences(long errorId);

    /**
     * Count distinct user ids seen on unresolved records of an error type.
     */
    long countDistinctUsers(String tenantId, String errorType);

    /**
     * @return occurrences in {@code [from, to)}, ordered by time
     */
    List<ErrorOccurrence> findOccurrences(Instant from, Instant to);

    /**
     * Group occurrence counts of one error type and platform into buckets.
     * Only non-empty buckets are returned.
     *
     * @param platform platform to match, {@code null} matches every platform
     * @return bucket start to count, ascending
     */
    SortedMap<Instant, Long> countOccurrences(String errorType, String platform, PeriodType periodType,
            Instant from, Instant to, ZoneId zone);

    /**
     * Drop occurrences older than {@code cutoff}.
     *
     * @return number of removed occurrences
     */
    int pruneOccurrences(Instant cutoff);

    // ---------------------------------------------------------------
    // Baselines and cascades
    // ---------------------------------------------------------------

    /**
     * Create or replace the baseline for (type, platform, period type). An
     * existing row with the same period start is updated in place; a row for
     * an older window is replaced.
     */
    Baseline upsertBaseline(Baseline baseline);

    Optional<Baseline> findBaseline(String errorType, String platform, PeriodType periodType);

    Optional<CascadePattern> findCascade(long parentErrorId, long childErrorId);

    CascadePattern upsertCascade(CascadePattern pattern);

    List<CascadePattern> findCascades();
}
