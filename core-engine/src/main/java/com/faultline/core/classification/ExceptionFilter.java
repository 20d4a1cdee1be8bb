package com.faultline.core.classification;

import com.faultline.core.model.ErrorSignal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Gate applied before aggregation.
 *
 * <p>
 * A signal is dropped when its type matches an ignore rule, or when sampling
 * is active and the signal loses the random draw. Ignore rules are either an
 * exact class name or a regular expression written as {@code /pattern/}.
 * Critical types are exempt from sampling.
 * </p>
 *
 * <p>
 * Rules are compiled once at construction. A malformed regex is logged at
 * WARN and never matches.
 * </p>
 *
 * @since 1.0.0
 */
public class ExceptionFilter {

    private static final Logger LOG = LoggerFactory.getLogger(ExceptionFilter.class);

    private final Set<String> exactRules = new HashSet<>();
    private final List<Pattern> patternRules = new ArrayList<>();
    private final double samplingRate;
    private final SeverityClassifier severityClassifier;
    private final Random random;

    public ExceptionFilter(List<String> ignoreRules, double samplingRate,
            SeverityClassifier severityClassifier) {
        this(ignoreRules, samplingRate, severityClassifier, new Random());
    }

    /**
     * @param ignoreRules        exact names or {@code /regex/} entries
     * @param samplingRate       keep probability for non-critical signals
     * @param severityClassifier used to exempt critical types from sampling
     * @param random             random source for the sampling draw
     */
    public ExceptionFilter(List<String> ignoreRules, double samplingRate,
            SeverityClassifier severityClassifier, Random random) {
        Objects.requireNonNull(ignoreRules, "ignoreRules must not be null");
        this.samplingRate = samplingRate;
        this.severityClassifier = Objects.requireNonNull(severityClassifier, "severityClassifier must not be null");
        this.random = Objects.requireNonNull(random, "random must not be null");

        for (String rule : ignoreRules) {
            if (rule == null || rule.isBlank()) {
                continue;
            }
            if (rule.length() > 2 && rule.startsWith("/") && rule.endsWith("/")) {
                String regex = rule.substring(1, rule.length() - 1);
                try {
                    patternRules.add(Pattern.compile(regex));
                } catch (PatternSyntaxException e) {
                    LOG.warn("Ignoring malformed exception rule '{}': {}", rule, e.getDescription());
                }
            } else {
                exactRules.add(rule);
            }
        }
        LOG.debug("ExceptionFilter ready: {} exact rules, {} pattern rules, samplingRate={}",
                exactRules.size(), patternRules.size(), samplingRate);
    }

    /**
     * @param signal a validated signal
     * @return {@code true} if the signal should be aggregated
     */
    public boolean shouldKeep(ErrorSignal signal) {
        Objects.requireNonNull(signal, "signal must not be null");
        String type = signal.getType();
        if (isIgnored(type)) {
            LOG.trace("Dropping {}: matches ignore rule", type);
            return false;
        }
        if (!sampledIn(type)) {
            LOG.trace("Dropping {}: sampled out", type);
            return false;
        }
        return true;
    }

    public boolean isIgnored(String errorType) {
        if (errorType == null) {
            return false;
        }
        if (exactRules.contains(errorType)) {
            return true;
        }
        for (Pattern pattern : patternRules) {
            if (pattern.matcher(errorType).find()) {
                return true;
            }
        }
        return false;
    }

    private boolean sampledIn(String errorType) {
        if (samplingRate >= 1.0 || severityClassifier.isCritical(errorType)) {
            return true;
        }
        if (samplingRate <= 0.0) {
            return false;
        }
        return random.nextDouble() <= samplingRate;
    }

    List<Pattern> getPatternRules() {
        return Collections.unmodifiableList(patternRules);
    }
}
