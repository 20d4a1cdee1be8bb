package com.faultline.core.aggregation;

import com.faultline.core.model.AggregatedError;
import com.faultline.core.model.Baseline;
import com.faultline.core.model.CascadePattern;
import com.faultline.core.model.ErrorOccurrence;
import com.faultline.core.model.ErrorState;
import com.faultline.core.model.PeriodType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Process-local {@link ErrorStore}.
 *
 * <h3>Locking</h3>
 * <p>
 * One {@link ReentrantLock} per key, created on demand in a
 * {@link ConcurrentHashMap}. Keys never block each other. Inserts enforce
 * the active-record uniqueness rule independently of the key locks, so a
 * caller that skips {@link #withLock(String, Supplier)} still gets a
 * {@link DuplicateErrorException} instead of a second active row.
 * </p>
 *
 * <p>
 * Every record handed out is a copy.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryErrorStore implements ErrorStore {

    private static final Logger LOG = LoggerFactory.getLogger(InMemoryErrorStore.class);

    private final Duration activeWindow;

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();
    private final Map<Long, AggregatedError> records = new ConcurrentHashMap<>();
    private final AtomicLong ids = new AtomicLong();
    private final Object insertMutex = new Object();

    private final List<ErrorOccurrence> occurrences = new ArrayList<>();
    private final ReentrantReadWriteLock occurrenceLock = new ReentrantReadWriteLock();

    private final Map<String, Baseline> baselines = new ConcurrentHashMap<>();
    private final Map<String, CascadePattern> cascades = new ConcurrentHashMap<>();

    public InMemoryErrorStore() {
        this(Duration.ofHours(24));
    }

    /**
     * @param activeWindow how long an unresolved record blocks a new insert
     *                     for the same key
     */
    public InMemoryErrorStore(Duration activeWindow) {
        this.activeWindow = Objects.requireNonNull(activeWindow, "activeWindow must not be null");
    }

    @Override
    public <T> T withLock(String key, Supplier<T> action) {
        Objects.requireNonNull(key, "key must not be null");
        ReentrantLock lock = locks.computeIfAbsent(key, k -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    // ---------------------------------------------------------------
    // Aggregated errors
    // ---------------------------------------------------------------

    @Override
    public Optional<AggregatedError> findActiveMatch(String tenantId, String fingerprint, Instant since) {
        return mostRecent(tenantId, fingerprint,
                r -> !r.isResolved() && !r.getLastSeenAt().isBefore(since));
    }

    @Override
    public Optional<AggregatedError> findTerminalMatch(String tenantId, String fingerprint) {
        return mostRecent(tenantId, fingerprint, AggregatedError::isResolved);
    }

    private Optional<AggregatedError> mostRecent(String tenantId, String fingerprint,
            Predicate<AggregatedError> filter) {
        String key = AggregatedError.keyOf(tenantId, fingerprint);
        return records.values().stream()
                .filter(r -> key.equals(r.getKey()))
                .filter(filter)
                .max(Comparator.comparing(AggregatedError::getLastSeenAt))
                .map(AggregatedError::copy);
    }

    @Override
    public AggregatedError insert(AggregatedError record) {
        Objects.requireNonNull(record, "record must not be null");
        synchronized (insertMutex) {
            Instant since = record.getFirstSeenAt().minus(activeWindow);
            boolean conflict = records.values().stream()
                    .anyMatch(r -> r.getKey().equals(record.getKey())
                            && !r.isResolved()
                            && !r.getLastSeenAt().isBefore(since));
            if (conflict) {
                throw new DuplicateErrorException(record.getKey());
            }
            AggregatedError stored = record.copy();
            stored.setId(ids.incrementAndGet());
            records.put(stored.getId(), stored);
            LOG.trace("Inserted error id={} key={}", stored.getId(), stored.getKey());
            return stored.copy();
        }
    }

    @Override
    public void update(AggregatedError record) {
        Objects.requireNonNull(record, "record must not be null");
        AggregatedError replaced = records.computeIfPresent(record.getId(), (id, old) -> record.copy());
        if (replaced == null) {
            throw new IllegalArgumentException("No error with id " + record.getId());
        }
    }

    @Override
    public Optional<AggregatedError> findById(long id) {
        return Optional.ofNullable(records.get(id)).map(AggregatedError::copy);
    }

    /**
     * @return snapshot of every stored record
     */
    public List<AggregatedError> findAll() {
        return records.values().stream()
                .sorted(Comparator.comparingLong(AggregatedError::getId))
                .map(AggregatedError::copy)
                .collect(Collectors.toList());
    }

    // ---------------------------------------------------------------
    // Occurrences
    // ---------------------------------------------------------------

    @Override
    public void recordOccurrence(ErrorOccurrence occurrence) {
        Objects.requireNonNull(occurrence, "occurrence must not be null");
        occurrenceLock.writeLock().lock();
        try {
            occurrences.add(occurrence);
        } finally {
            occurrenceLock.writeLock().unlock();
        }
    }

    @Override
    public long countOccurrences(long errorId) {
        occurrenceLock.readLock().lock();
        try {
            return occurrences.stream().filter(o -> o.getErrorId() == errorId).count();
        } finally {
            occurrenceLock.readLock().unlock();
        }
    }

    @Override
    public long countDistinctUsers(String tenantId, String errorType) {
        Set<Long> unresolvedIds = records.values().stream()
                .filter(r -> !r.isResolved())
                .filter(r -> Objects.equals(r.getTenantId(), tenantId))
                .filter(r -> Objects.equals(r.getErrorType(), errorType))
                .map(AggregatedError::getId)
                .collect(Collectors.toSet());
        if (unresolvedIds.isEmpty()) {
            return 0;
        }
        Set<String> users = new HashSet<>();
        occurrenceLock.readLock().lock();
        try {
            for (ErrorOccurrence o : occurrences) {
                if (o.getUserId() != null && unresolvedIds.contains(o.getErrorId())) {
                    users.add(o.getUserId());
                }
            }
        } finally {
            occurrenceLock.readLock().unlock();
        }
        return users.size();
    }

    @Override
    public List<ErrorOccurrence> findOccurrences(Instant from, Instant to) {
        occurrenceLock.readLock().lock();
        try {
            return occurrences.stream()
                    .filter(o -> inRange(o.getOccurredAt(), from, to))
                    .sorted(Comparator.comparing(ErrorOccurrence::getOccurredAt))
                    .collect(Collectors.toList());
        } finally {
            occurrenceLock.readLock().unlock();
        }
    }

    @Override
    public SortedMap<Instant, Long> countOccurrences(String errorType, String platform, PeriodType periodType,
            Instant from, Instant to, ZoneId zone) {
        SortedMap<Instant, Long> buckets = new TreeMap<>();
        occurrenceLock.readLock().lock();
        try {
            for (ErrorOccurrence o : occurrences) {
                if (errorType.equals(o.getErrorType())
                        && (platform == null || platform.equals(o.getPlatform()))
                        && inRange(o.getOccurredAt(), from, to)) {
                    buckets.merge(periodType.bucketStart(o.getOccurredAt(), zone), 1L, Long::sum);
                }
            }
        } finally {
            occurrenceLock.readLock().unlock();
        }
        return buckets;
    }

    @Override
    public int pruneOccurrences(Instant cutoff) {
        occurrenceLock.writeLock().lock();
        try {
            int removed = 0;
            Iterator<ErrorOccurrence> it = occurrences.iterator();
            while (it.hasNext()) {
                if (it.next().getOccurredAt().isBefore(cutoff)) {
                    it.remove();
                    removed++;
                }
            }
            return removed;
        } finally {
            occurrenceLock.writeLock().unlock();
        }
    }

    private static boolean inRange(Instant at, Instant from, Instant to) {
        return !at.isBefore(from) && at.isBefore(to);
    }

    // ---------------------------------------------------------------
    // Baselines and cascades
    // ---------------------------------------------------------------

    @Override
    public Baseline upsertBaseline(Baseline baseline) {
        Objects.requireNonNull(baseline, "baseline must not be null");
        String key = baselineKey(baseline.getErrorType(), baseline.getPlatform(), baseline.getPeriodType());
        // Only the latest window per (type, platform, period type) is kept
        Baseline stored = baseline.copy();
        baselines.put(key, stored);
        return stored.copy();
    }

    @Override
    public Optional<Baseline> findBaseline(String errorType, String platform, PeriodType periodType) {
        return Optional.ofNullable(baselines.get(baselineKey(errorType, platform, periodType)))
                .map(Baseline::copy);
    }

    @Override
    public Optional<CascadePattern> findCascade(long parentErrorId, long childErrorId) {
        return Optional.ofNullable(cascades.get(CascadePattern.keyOf(parentErrorId, childErrorId)))
                .map(CascadePattern::copy);
    }

    @Override
    public CascadePattern upsertCascade(CascadePattern pattern) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        CascadePattern stored = pattern.copy();
        cascades.put(pattern.getKey(), stored);
        return stored.copy();
    }

    @Override
    public List<CascadePattern> findCascades() {
        return cascades.values().stream().map(CascadePattern::copy).collect(Collectors.toList());
    }

    private static String baselineKey(String errorType, String platform, PeriodType periodType) {
        return errorType + "|" + platform + "|" + periodType;
    }

    /**
     * Mark a record terminal. Workflow transitions live outside the core;
     * this exists for embedding applications and tests.
     */
    public void resolve(long id, ErrorState terminalState, Instant resolvedAt) {
        if (!terminalState.isTerminal()) {
            throw new IllegalArgumentException("Not a terminal state: " + terminalState);
        }
        AggregatedError record = findById(id)
                .orElseThrow(() -> new IllegalArgumentException("No error with id " + id));
        withLock(record.getKey(), () -> {
            record.setState(terminalState);
            record.setResolvedAt(resolvedAt);
            update(record);
            return record;
        });
    }

    // ---------------------------------------------------------------
    // Snapshots
    // ---------------------------------------------------------------

    /**
     * Copy the full store contents. Concurrent writers may or may not be
     * included; every record in the snapshot is internally consistent.
     */
    public Snapshot snapshot() {
        List<ErrorOccurrence> occurrenceCopy;
        occurrenceLock.readLock().lock();
        try {
            occurrenceCopy = new ArrayList<>(occurrences);
        } finally {
            occurrenceLock.readLock().unlock();
        }
        return new Snapshot(ids.get(), findAll(), occurrenceCopy,
                baselines.values().stream().map(Baseline::copy).collect(Collectors.toList()),
                findCascades());
    }

    /**
     * Replace the store contents with a {@link #snapshot()}. Not safe to call
     * while other threads use the store.
     */
    public void restore(Snapshot snapshot) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        records.clear();
        snapshot.records.forEach(r -> records.put(r.getId(), r.copy()));
        ids.set(snapshot.lastId);

        occurrenceLock.writeLock().lock();
        try {
            occurrences.clear();
            occurrences.addAll(snapshot.occurrences);
        } finally {
            occurrenceLock.writeLock().unlock();
        }

        baselines.clear();
        snapshot.baselines.forEach(this::upsertBaseline);
        cascades.clear();
        snapshot.cascades.forEach(this::upsertCascade);
        LOG.info("Restored store: {} records, {} occurrences, {} baselines, {} cascades",
                records.size(), snapshot.occurrences.size(), baselines.size(), cascades.size());
    }

    /**
     * Serializable copy of an {@link InMemoryErrorStore}.
     */
    public static final class Snapshot implements Serializable {

        private static final long serialVersionUID = 1L;

        private final long lastId;
        private final ArrayList<AggregatedError> records;
        private final ArrayList<ErrorOccurrence> occurrences;
        private final ArrayList<Baseline> baselines;
        private final ArrayList<CascadePattern> cascades;

        Snapshot(long lastId, List<AggregatedError> records, List<ErrorOccurrence> occurrences,
                List<Baseline> baselines, List<CascadePattern> cascades) {
            this.lastId = lastId;
            this.records = new ArrayList<>(records);
            this.occurrences = new ArrayList<>(occurrences);
            this.baselines = new ArrayList<>(baselines);
            this.cascades = new ArrayList<>(cascades);
        }

        public int recordCount() {
            return records.size();
        }

        public int occurrenceCount() {
            return occurrences.size();
        }
    }
}
