package com.example.verification.metrics;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.function.DoubleUnaryOperator;

/**
 * A derived metric that is either a finite number or explicitly undefined.
 *
 * <p>Undefined means the metric has no data behind it (zero denominator, empty
 * sample), which is different from a metric that evaluates to zero. Undefined
 * values serialize as JSON {@code null}.
 *
 * <pre>{@code
 * MetricValue hitRate = MetricValue.ratio(hits, hits + misses);
 * if (hitRate.isDefined()) {
 *     report(hitRate.getAsDouble());
 * }
 * }</pre>
 */
public final class MetricValue {

    private static final MetricValue UNDEFINED = new MetricValue(Double.NaN);

    private final double value;

    private MetricValue(double value) {
        this.value = value;
    }

    public static MetricValue undefined() {
        return UNDEFINED;
    }

    /**
     * Wraps a number; non-finite input becomes undefined.
     */
    public static MetricValue of(double value) {
        return Double.isFinite(value) ? new MetricValue(value) : UNDEFINED;
    }

    /**
     * Returns {@code numerator / denominator}, undefined when the denominator is zero.
     */
    public static MetricValue ratio(double numerator, double denominator) {
        if (denominator == 0.0) {
            return UNDEFINED;
        }
        return of(numerator / denominator);
    }

    @JsonCreator
    static MetricValue fromJson(Double value) {
        return value == null ? UNDEFINED : of(value);
    }

    @JsonValue
    Double toJson() {
        return isDefined() ? value : null;
    }

    public boolean isDefined() {
        return !Double.isNaN(value);
    }

    /**
     * Returns the number.
     *
     * @throws IllegalStateException if the metric is undefined
     */
    public double getAsDouble() {
        if (!isDefined()) {
            throw new IllegalStateException("metric is undefined");
        }
        return value;
    }

    public double orElse(double fallback) {
        return isDefined() ? value : fallback;
    }

    /**
     * Applies a function to a defined value; undefined stays undefined.
     */
    public MetricValue map(DoubleUnaryOperator fn) {
        return isDefined() ? of(fn.applyAsDouble(value)) : UNDEFINED;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        MetricValue other = (MetricValue) o;
        return Double.compare(value, other.value) == 0;
    }

    @Override
    public int hashCode() {
        return Double.hashCode(value);
    }

    @Override
    public String toString() {
        return isDefined() ? Double.toString(value) : "undefined";
    }
}
