package com.faultline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Directed edge recording that the child error tends to follow the parent
 * error within a short delay.
 *
 * @since 1.0.0
 */
public class CascadePattern implements Serializable {

    private static final long serialVersionUID = 1L;

    private long parentErrorId;
    private long childErrorId;
    private int frequency;
    private double avgDelaySeconds;
    /** {@code null} until the parent has at least one recorded occurrence. */
    private Double cascadeProbability;
    private Instant lastDetectedAt;

    public CascadePattern() {
    }

    public CascadePattern(long parentErrorId, long childErrorId) {
        this.parentErrorId = parentErrorId;
        this.childErrorId = childErrorId;
    }

    public CascadePattern copy() {
        CascadePattern c = new CascadePattern(parentErrorId, childErrorId);
        c.frequency = frequency;
        c.avgDelaySeconds = avgDelaySeconds;
        c.cascadeProbability = cascadeProbability;
        c.lastDetectedAt = lastDetectedAt;
        return c;
    }

    /**
     * @return the lock and storage key of this edge
     */
    @JsonIgnore
    public String getKey() {
        return keyOf(parentErrorId, childErrorId);
    }

    public static String keyOf(long parentErrorId, long childErrorId) {
        return "cascade|" + parentErrorId + "->" + childErrorId;
    }

    public long getParentErrorId() {
        return parentErrorId;
    }

    public void setParentErrorId(long parentErrorId) {
        this.parentErrorId = parentErrorId;
    }

    public long getChildErrorId() {
        return childErrorId;
    }

    public void setChildErrorId(long childErrorId) {
        this.childErrorId = childErrorId;
    }

    public int getFrequency() {
        return frequency;
    }

    public void setFrequency(int frequency) {
        this.frequency = frequency;
    }

    public double getAvgDelaySeconds() {
        return avgDelaySeconds;
    }

    public void setAvgDelaySeconds(double avgDelaySeconds) {
        this.avgDelaySeconds = avgDelaySeconds;
    }

    public Double getCascadeProbability() {
        return cascadeProbability;
    }

    public void setCascadeProbability(Double cascadeProbability) {
        this.cascadeProbability = cascadeProbability;
    }

    public Instant getLastDetectedAt() {
        return lastDetectedAt;
    }

    public void setLastDetectedAt(Instant lastDetectedAt) {
        this.lastDetectedAt = lastDetectedAt;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CascadePattern that))
            return false;
        return parentErrorId == that.parentErrorId && childErrorId == that.childErrorId;
    }

    @Override
    public int hashCode() {
        return Objects.hash(parentErrorId, childErrorId);
    }

    @Override
    public String toString() {
        return "CascadePattern{" +
                parentErrorId + " -> " + childErrorId +
                ", frequency=" + frequency +
                ", avgDelaySeconds=" + avgDelaySeconds +
                ", cascadeProbability=" + cascadeProbability +
                '}';
    }
}
