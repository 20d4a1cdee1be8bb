package com.faultline.core.pattern;

import com.faultline.core.model.ErrorOccurrence;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Pairs parent occurrences with the child occurrences that follow them.
 *
 * <p>
 * For every occurrence of an error P and every other error C, the first
 * occurrence of C strictly after P and no later than {@code maxDelay} yields
 * one {@link CascadeDetection}. Simultaneous occurrences are not paired.
 * </p>
 *
 * @since 1.0.0
 */
public final class CascadeDetector {

    private CascadeDetector() {
    }

    public static List<CascadeDetection> detect(List<ErrorOccurrence> occurrences, Duration maxDelay) {
        Objects.requireNonNull(occurrences, "occurrences must not be null");
        Objects.requireNonNull(maxDelay, "maxDelay must not be null");
        List<ErrorOccurrence> sorted = new ArrayList<>(occurrences);
        sorted.sort(Comparator.comparing(ErrorOccurrence::getOccurredAt));

        List<CascadeDetection> detections = new ArrayList<>();
        for (int i = 0; i < sorted.size(); i++) {
            ErrorOccurrence parent = sorted.get(i);
            Set<Long> paired = new HashSet<>();
            for (int j = i + 1; j < sorted.size(); j++) {
                ErrorOccurrence candidate = sorted.get(j);
                Duration delay = Duration.between(parent.getOccurredAt(), candidate.getOccurredAt());
                if (delay.compareTo(maxDelay) > 0) {
                    break;
                }
                if (delay.isZero() || candidate.getErrorId() == parent.getErrorId()) {
                    continue;
                }
                if (paired.add(candidate.getErrorId())) {
                    detections.add(new CascadeDetection(parent.getErrorId(), candidate.getErrorId(),
                            delay.toMillis() / 1000.0, parent.getOccurredAt(), parent.getRecordedAt()));
                }
            }
        }
        return detections;
    }
}
