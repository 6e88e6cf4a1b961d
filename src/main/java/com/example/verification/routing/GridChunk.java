package com.example.verification.routing;

import com.example.verification.exception.ShapeMismatchException;
import com.example.verification.model.AccumulatorId;

import java.util.Objects;

/**
 * Gridded forecast/observation pairs for a rectangle of cells over several time steps.
 *
 * <p>Values are stored step-major: the value of cell {@code c} at step {@code s}
 * is at index {@code s * range.cellCount() + c}. {@code probabilities} may be
 * {@code null} when the variable has no probability forecast.
 *
 * <p>Missing values follow the accumulator's convention (NaN, infinities, or the
 * configured sentinel) and are simply counted.
 */
public record GridChunk(
        String chunkId,
        String variable,
        String group,
        GridRange range,
        int steps,
        double[] forecasts,
        double[] observations,
        double[] probabilities
) implements VerificationChunk {

    public GridChunk {
        Objects.requireNonNull(chunkId, "chunkId must not be null");
        Objects.requireNonNull(variable, "variable must not be null");
        Objects.requireNonNull(range, "range must not be null");
        group = group != null ? group : AccumulatorId.DEFAULT_GROUP;
    }

    public static GridChunk of(String chunkId, String variable, GridRange range, int steps,
                               double[] forecasts, double[] observations) {
        return new GridChunk(chunkId, variable, AccumulatorId.DEFAULT_GROUP, range, steps,
                forecasts, observations, null);
    }

    /**
     * Checks that every array holds {@code cells x steps} values.
     *
     * @throws ShapeMismatchException if an array is missing or has the wrong length, or the
     *         chunk is too large to index
     */
    public void validate() {
        if (steps < 0) {
            throw new ShapeMismatchException("chunk " + chunkId + " has negative step count " + steps);
        }
        int expected;
        try {
            expected = Math.multiplyExact(range.cellCount(), steps);
        } catch (ArithmeticException e) {
            throw new ShapeMismatchException("chunk " + chunkId + " covers more than "
                    + Integer.MAX_VALUE + " values: " + range + " x " + steps + " steps", e);
        }
        if (forecasts == null || observations == null) {
            throw new ShapeMismatchException("chunk " + chunkId + " is missing forecast or observation values");
        }
        if (forecasts.length != expected) {
            throw ShapeMismatchException.lengths("forecasts of chunk " + chunkId, expected, forecasts.length);
        }
        if (observations.length != expected) {
            throw ShapeMismatchException.lengths("observations of chunk " + chunkId, expected, observations.length);
        }
        if (probabilities != null && probabilities.length != expected) {
            throw ShapeMismatchException.lengths("probabilities of chunk " + chunkId, expected, probabilities.length);
        }
    }

    public double[] forecastSeries(int cell) {
        return series(forecasts, cell);
    }

    public double[] observationSeries(int cell) {
        return series(observations, cell);
    }

    /**
     * Returns the probability series of a cell, or {@code null} if the chunk has none.
     */
    public double[] probabilitySeries(int cell) {
        return probabilities != null ? series(probabilities, cell) : null;
    }

    private double[] series(double[] values, int cell) {
        int cells = range.cellCount();
        double[] out = new double[steps];
        for (int s = 0; s < steps; s++) {
            out[s] = values[s * cells + cell];
        }
        return out;
    }
}
