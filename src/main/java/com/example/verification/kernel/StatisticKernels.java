package com.example.verification.kernel;

import com.example.verification.exception.ConfigurationException;
import com.example.verification.exception.ShapeMismatchException;
import com.example.verification.model.AccumulatorConfig;
import com.example.verification.model.AccumulatorState;
import com.example.verification.model.ContingencyTable;
import com.example.verification.model.ProbabilityBins;
import com.example.verification.model.ProbabilityPolicy;
import com.example.verification.model.ReliabilityBin;

import java.util.ArrayList;
import java.util.List;

/**
 * Stateless kernels turning a batch of forecast/observation pairs into a
 * contribution to the sufficient statistics.
 *
 * <p>The output of {@link #contribute} is itself an {@link AccumulatorState}
 * (the delta), so folding a batch into a running state is just
 * {@code running.add(delta)} and splitting a batch anywhere gives the same
 * counters after the deltas are added back together.
 *
 * <p>A pair is excluded, and counted as missing, when the forecast or the
 * observation is non-finite or equal to the configured sentinel, or when a
 * supplied probability is non-finite or rejected by the
 * {@link ProbabilityPolicy}. Excluded pairs never touch any sum.
 */
public final class StatisticKernels {

    private StatisticKernels() {
    }

    /**
     * Computes the contribution of one batch.
     *
     * @param config thresholds, bins and missing-value convention
     * @param forecasts forecast values
     * @param observations observation values, same length as {@code forecasts}
     * @param probabilities forecast event probabilities, same length, or {@code null}
     * @return the delta state and the accepted/rejected counts
     * @throws ShapeMismatchException if the arrays are not aligned
     * @throws ConfigurationException if probabilities are given but no bins are configured
     */
    public static BatchContribution contribute(
            AccumulatorConfig config,
            double[] forecasts,
            double[] observations,
            double[] probabilities
    ) {
        validate(config, forecasts, observations, probabilities);

        List<Double> thresholds = config.thresholds();
        int thresholdCount = thresholds.size();
        long[] hits = new long[thresholdCount];
        long[] misses = new long[thresholdCount];
        long[] falseAlarms = new long[thresholdCount];
        long[] correctNegatives = new long[thresholdCount];

        ProbabilityBins bins = config.probabilityBins();
        int binCount = config.binCount();
        double[] binProbabilitySum = new double[binCount];
        long[] binEvents = new long[binCount];
        long[] binSamples = new long[binCount];

        long accepted = 0;
        long rejected = 0;
        double sumForecast = 0.0;
        double sumObservation = 0.0;
        double sumAbsError = 0.0;
        double sumError = 0.0;
        double sumSquaredError = 0.0;
        double sumForecastSquared = 0.0;
        double sumObservationSquared = 0.0;
        long probabilitySamples = 0;
        long observedEvents = 0;
        double sumSquaredProbabilityError = 0.0;

        for (int i = 0; i < forecasts.length; i++) {
            double f = forecasts[i];
            double o = observations[i];
            if (config.isMissing(f) || config.isMissing(o)) {
                rejected++;
                continue;
            }
            double p = Double.NaN;
            if (probabilities != null) {
                p = admitProbability(probabilities[i], config.probabilityPolicy());
                if (Double.isNaN(p)) {
                    rejected++;
                    continue;
                }
            }

            accepted++;
            double error = f - o;
            sumForecast += f;
            sumObservation += o;
            sumAbsError += Math.abs(error);
            sumError += error;
            sumSquaredError += error * error;
            sumForecastSquared += f * f;
            sumObservationSquared += o * o;

            for (int k = 0; k < thresholdCount; k++) {
                double t = thresholds.get(k);
                boolean forecastEvent = isEvent(f, t);
                boolean observedEvent = isEvent(o, t);
                if (forecastEvent && observedEvent) {
                    hits[k]++;
                } else if (observedEvent) {
                    misses[k]++;
                } else if (forecastEvent) {
                    falseAlarms[k]++;
                } else {
                    correctNegatives[k]++;
                }
            }

            if (probabilities != null) {
                boolean event = isEvent(o, config.eventThreshold());
                double outcome = event ? 1.0 : 0.0;
                double probabilityError = p - outcome;
                probabilitySamples++;
                sumSquaredProbabilityError += probabilityError * probabilityError;
                int bin = bins.indexOf(p);
                binProbabilitySum[bin] += p;
                binSamples[bin]++;
                if (event) {
                    observedEvents++;
                    binEvents[bin]++;
                }
            }
        }

        List<ContingencyTable> tables = new ArrayList<>(thresholdCount);
        for (int k = 0; k < thresholdCount; k++) {
            tables.add(new ContingencyTable(hits[k], misses[k], falseAlarms[k], correctNegatives[k]));
        }
        List<ReliabilityBin> reliability = new ArrayList<>(binCount);
        for (int k = 0; k < binCount; k++) {
            reliability.add(new ReliabilityBin(binProbabilitySum[k], binEvents[k], binSamples[k]));
        }

        AccumulatorState delta = new AccumulatorState(
                accepted, rejected,
                sumForecast, sumObservation,
                sumAbsError, sumError, sumSquaredError,
                sumForecastSquared, sumObservationSquared,
                tables,
                probabilitySamples, observedEvents, sumSquaredProbabilityError,
                reliability
        );
        return new BatchContribution(delta, accepted, rejected);
    }

    /**
     * Event predicate shared by categorical and probabilistic scoring.
     */
    public static boolean isEvent(double value, double threshold) {
        return value >= threshold;
    }

    /**
     * Returns the probability to score, or NaN if the pair must be excluded.
     */
    static double admitProbability(double probability, ProbabilityPolicy policy) {
        if (!Double.isFinite(probability)) {
            return Double.NaN;
        }
        if (probability >= 0.0 && probability <= 1.0) {
            return probability;
        }
        if (policy == ProbabilityPolicy.CLIP) {
            return Math.max(0.0, Math.min(1.0, probability));
        }
        return Double.NaN;
    }

    private static void validate(
            AccumulatorConfig config,
            double[] forecasts,
            double[] observations,
            double[] probabilities
    ) {
        if (forecasts == null || observations == null) {
            throw new ShapeMismatchException("forecast and observation batches are required");
        }
        if (observations.length != forecasts.length) {
            throw ShapeMismatchException.lengths("observation batch", forecasts.length, observations.length);
        }
        if (probabilities != null) {
            if (!config.hasProbabilities()) {
                throw new ConfigurationException("probability batch supplied but no probability bins are configured");
            }
            if (probabilities.length != forecasts.length) {
                throw ShapeMismatchException.lengths("probability batch", forecasts.length, probabilities.length);
            }
        }
    }
}
