package com.faultline.flink;

import com.faultline.core.classification.ExceptionFilter;
import com.faultline.core.classification.SeverityClassifier;
import com.faultline.core.config.FaultlineConfig;
import com.faultline.core.model.ErrorSignal;
import org.apache.flink.api.common.functions.RichFilterFunction;
import org.apache.flink.configuration.Configuration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Drops malformed and ignored signals before they are keyed.
 *
 * <p>
 * Sampling is left to the pipeline so each signal is sampled exactly once.
 * </p>
 */
public class SignalGateFunction extends RichFilterFunction<ErrorSignal> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(SignalGateFunction.class);

    private final FaultlineConfig config;

    private transient ExceptionFilter filter;

    public SignalGateFunction(FaultlineConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    @Override
    public void open(Configuration parameters) {
        filter = new ExceptionFilter(config.getIgnoredExceptions(), 1.0,
                new SeverityClassifier(config.severityOverrideTable()));
    }

    @Override
    public boolean filter(ErrorSignal signal) {
        if (signal == null) {
            return false;
        }
        List<String> problems = signal.validate();
        if (!problems.isEmpty()) {
            LOG.warn("Rejected malformed signal {}: {}", signal, problems);
            return false;
        }
        return !filter.isIgnored(signal.getType());
    }
}
