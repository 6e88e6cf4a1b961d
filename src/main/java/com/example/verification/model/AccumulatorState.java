package com.example.verification.model;

import com.example.verification.exception.IncompatibleAccumulatorException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Sufficient statistics for one accumulator.
 *
 * <p>The state is a monoid: {@link #empty} is the identity and {@link #combine}
 * is associative and commutative. Counters combine exactly; sums combine up to
 * floating-point summation order. Every reported metric is derived from these
 * fields alone, so it cannot depend on how the pairs were chunked.
 *
 * <p>Memory is fixed by the configuration (one table per threshold, one entry
 * per probability bin) and never grows with the number of pairs folded in.
 *
 * <p>Instances are mutable through {@link #add} only; that is how an
 * accumulator folds batch contributions into its running state. Not thread-safe.
 */
public final class AccumulatorState {

    private long sampleCount;
    private long missingCount;

    private double sumForecast;
    private double sumObservation;
    private double sumAbsError;
    private double sumError;
    private double sumSquaredError;
    private double sumForecastSquared;
    private double sumObservationSquared;

    private final ContingencyTable[] contingency;

    private long probabilitySampleCount;
    private long observedEventCount;
    private double sumSquaredProbabilityError;
    private final ReliabilityBin[] reliability;

    @JsonCreator
    public AccumulatorState(
            @JsonProperty("sampleCount") long sampleCount,
            @JsonProperty("missingCount") long missingCount,
            @JsonProperty("sumForecast") double sumForecast,
            @JsonProperty("sumObservation") double sumObservation,
            @JsonProperty("sumAbsError") double sumAbsError,
            @JsonProperty("sumError") double sumError,
            @JsonProperty("sumSquaredError") double sumSquaredError,
            @JsonProperty("sumForecastSquared") double sumForecastSquared,
            @JsonProperty("sumObservationSquared") double sumObservationSquared,
            @JsonProperty("contingency") List<ContingencyTable> contingency,
            @JsonProperty("probabilitySampleCount") long probabilitySampleCount,
            @JsonProperty("observedEventCount") long observedEventCount,
            @JsonProperty("sumSquaredProbabilityError") double sumSquaredProbabilityError,
            @JsonProperty("reliability") List<ReliabilityBin> reliability
    ) {
        this.sampleCount = sampleCount;
        this.missingCount = missingCount;
        this.sumForecast = sumForecast;
        this.sumObservation = sumObservation;
        this.sumAbsError = sumAbsError;
        this.sumError = sumError;
        this.sumSquaredError = sumSquaredError;
        this.sumForecastSquared = sumForecastSquared;
        this.sumObservationSquared = sumObservationSquared;
        this.contingency = contingency != null
                ? contingency.toArray(new ContingencyTable[0])
                : new ContingencyTable[0];
        this.probabilitySampleCount = probabilitySampleCount;
        this.observedEventCount = observedEventCount;
        this.sumSquaredProbabilityError = sumSquaredProbabilityError;
        this.reliability = reliability != null
                ? reliability.toArray(new ReliabilityBin[0])
                : new ReliabilityBin[0];
    }

    private AccumulatorState(int thresholdCount, int binCount) {
        this.contingency = new ContingencyTable[thresholdCount];
        Arrays.fill(contingency, ContingencyTable.zero());
        this.reliability = new ReliabilityBin[binCount];
        Arrays.fill(reliability, ReliabilityBin.zero());
    }

    /**
     * Creates the all-zero state shaped for the given configuration.
     */
    public static AccumulatorState empty(AccumulatorConfig config) {
        return new AccumulatorState(config.thresholds().size(), config.binCount());
    }

    /**
     * Folds another state into this one, field by field.
     *
     * @param other state with the same shape
     * @return this state
     * @throws IncompatibleAccumulatorException if the shapes differ
     */
    public AccumulatorState add(AccumulatorState other) {
        requireSameShape(other);
        sampleCount += other.sampleCount;
        missingCount += other.missingCount;
        sumForecast += other.sumForecast;
        sumObservation += other.sumObservation;
        sumAbsError += other.sumAbsError;
        sumError += other.sumError;
        sumSquaredError += other.sumSquaredError;
        sumForecastSquared += other.sumForecastSquared;
        sumObservationSquared += other.sumObservationSquared;
        for (int k = 0; k < contingency.length; k++) {
            contingency[k] = contingency[k].plus(other.contingency[k]);
        }
        probabilitySampleCount += other.probabilitySampleCount;
        observedEventCount += other.observedEventCount;
        sumSquaredProbabilityError += other.sumSquaredProbabilityError;
        for (int k = 0; k < reliability.length; k++) {
            reliability[k] = reliability[k].plus(other.reliability[k]);
        }
        return this;
    }

    /**
     * Returns a new state holding the sum of this and {@code other}; neither
     * side is modified.
     */
    public AccumulatorState combine(AccumulatorState other) {
        return copy().add(other);
    }

    public AccumulatorState copy() {
        return new AccumulatorState(
                sampleCount, missingCount,
                sumForecast, sumObservation,
                sumAbsError, sumError, sumSquaredError,
                sumForecastSquared, sumObservationSquared,
                getContingency(),
                probabilitySampleCount, observedEventCount, sumSquaredProbabilityError,
                getReliability()
        );
    }

    /**
     * Returns true if this state has the table and bin layout implied by the configuration.
     */
    public boolean hasShapeOf(AccumulatorConfig config) {
        return contingency.length == config.thresholds().size()
                && reliability.length == config.binCount();
    }

    /**
     * Describes the first malformed field of a state read from outside, or
     * returns empty when every table and bin is present, every counter is
     * non-negative and every sum is finite.
     */
    public Optional<String> defect() {
        if (sampleCount < 0 || missingCount < 0 || probabilitySampleCount < 0 || observedEventCount < 0) {
            return Optional.of("negative counter");
        }
        double[] sums = {sumForecast, sumObservation, sumAbsError, sumError, sumSquaredError,
                sumForecastSquared, sumObservationSquared, sumSquaredProbabilityError};
        for (double sum : sums) {
            if (!Double.isFinite(sum)) {
                return Optional.of("non-finite sum " + sum);
            }
        }
        for (int k = 0; k < contingency.length; k++) {
            ContingencyTable table = contingency[k];
            if (table == null) {
                return Optional.of("missing contingency table " + k);
            }
            if (table.hits() < 0 || table.misses() < 0 || table.falseAlarms() < 0 || table.correctNegatives() < 0) {
                return Optional.of("negative count in contingency table " + k);
            }
        }
        for (int k = 0; k < reliability.length; k++) {
            ReliabilityBin bin = reliability[k];
            if (bin == null) {
                return Optional.of("missing reliability bin " + k);
            }
            if (bin.sampleCount() < 0 || bin.observedEventCount() < 0 || !Double.isFinite(bin.forecastProbabilitySum())) {
                return Optional.of("malformed reliability bin " + k);
            }
        }
        return Optional.empty();
    }

    private void requireSameShape(AccumulatorState other) {
        if (contingency.length != other.contingency.length || reliability.length != other.reliability.length) {
            throw new IncompatibleAccumulatorException(
                    "state shapes differ: " + contingency.length + "/" + reliability.length
                            + " vs " + other.contingency.length + "/" + other.reliability.length);
        }
    }

    public long getSampleCount() {
        return sampleCount;
    }

    public long getMissingCount() {
        return missingCount;
    }

    public double getSumForecast() {
        return sumForecast;
    }

    public double getSumObservation() {
        return sumObservation;
    }

    public double getSumAbsError() {
        return sumAbsError;
    }

    public double getSumError() {
        return sumError;
    }

    public double getSumSquaredError() {
        return sumSquaredError;
    }

    public double getSumForecastSquared() {
        return sumForecastSquared;
    }

    public double getSumObservationSquared() {
        return sumObservationSquared;
    }

    public List<ContingencyTable> getContingency() {
        return List.of(contingency);
    }

    @JsonIgnore
    public ContingencyTable contingency(int thresholdIndex) {
        return contingency[thresholdIndex];
    }

    public long getProbabilitySampleCount() {
        return probabilitySampleCount;
    }

    public long getObservedEventCount() {
        return observedEventCount;
    }

    public double getSumSquaredProbabilityError() {
        return sumSquaredProbabilityError;
    }

    public List<ReliabilityBin> getReliability() {
        return List.of(reliability);
    }

    @JsonIgnore
    public boolean isEmpty() {
        return sampleCount == 0 && missingCount == 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        AccumulatorState other = (AccumulatorState) o;
        return sampleCount == other.sampleCount
                && missingCount == other.missingCount
                && Double.compare(sumForecast, other.sumForecast) == 0
                && Double.compare(sumObservation, other.sumObservation) == 0
                && Double.compare(sumAbsError, other.sumAbsError) == 0
                && Double.compare(sumError, other.sumError) == 0
                && Double.compare(sumSquaredError, other.sumSquaredError) == 0
                && Double.compare(sumForecastSquared, other.sumForecastSquared) == 0
                && Double.compare(sumObservationSquared, other.sumObservationSquared) == 0
                && Arrays.equals(contingency, other.contingency)
                && probabilitySampleCount == other.probabilitySampleCount
                && observedEventCount == other.observedEventCount
                && Double.compare(sumSquaredProbabilityError, other.sumSquaredProbabilityError) == 0
                && Arrays.equals(reliability, other.reliability);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(sampleCount, missingCount, sumForecast, sumObservation,
                sumAbsError, sumError, sumSquaredError, sumForecastSquared, sumObservationSquared,
                probabilitySampleCount, observedEventCount, sumSquaredProbabilityError);
        result = 31 * result + Arrays.hashCode(contingency);
        result = 31 * result + Arrays.hashCode(reliability);
        return result;
    }

    @Override
    public String toString() {
        return "AccumulatorState{n=" + sampleCount
                + ", missing=" + missingCount
                + ", sumAbsError=" + sumAbsError
                + ", sumSquaredError=" + sumSquaredError
                + ", thresholds=" + contingency.length
                + ", bins=" + reliability.length + "}";
    }
}
