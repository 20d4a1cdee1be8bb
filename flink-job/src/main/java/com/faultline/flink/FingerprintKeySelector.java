package com.faultline.flink;

import com.faultline.core.fingerprint.FingerprintGenerator;
import com.faultline.core.model.AggregatedError;
import com.faultline.core.model.ErrorSignal;
import org.apache.flink.api.java.functions.KeySelector;

import java.util.ArrayList;
import java.util.List;

/**
 * Keys the signal stream by {@code tenant|fingerprint}, the same key the
 * aggregation engine locks on, so one subtask owns each aggregated error.
 */
public class FingerprintKeySelector implements KeySelector<ErrorSignal, String> {

    private static final long serialVersionUID = 1L;

    private final ArrayList<String> libraryPathMarkers;

    private transient FingerprintGenerator generator;

    public FingerprintKeySelector(List<String> libraryPathMarkers) {
        this.libraryPathMarkers = new ArrayList<>(libraryPathMarkers);
    }

    @Override
    public String getKey(ErrorSignal signal) {
        if (generator == null) {
            generator = new FingerprintGenerator(libraryPathMarkers);
        }
        return AggregatedError.keyOf(signal.getTenantId(), generator.generate(signal));
    }
}
