package com.example.verification.model;

import com.example.verification.exception.ConfigurationException;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Equal-width probability bins over [0, 1] used for reliability and ROC.
 *
 * <p>Bin {@code k} covers {@code [k/count, (k+1)/count)}; a probability of exactly
 * 1.0 lands in the last bin.
 */
public record ProbabilityBins(int count) {

    public static final int DEFAULT_COUNT = 10;

    @JsonCreator
    public ProbabilityBins(@JsonProperty("count") int count) {
        if (count < 1) {
            throw new ConfigurationException("probability bin count must be >= 1, got " + count);
        }
        this.count = count;
    }

    public static ProbabilityBins deciles() {
        return new ProbabilityBins(DEFAULT_COUNT);
    }

    public int indexOf(double probability) {
        int index = (int) Math.floor(probability * count);
        return Math.max(0, Math.min(count - 1, index));
    }

    public double lowerEdge(int bin) {
        return (double) bin / count;
    }

    public double upperEdge(int bin) {
        return (double) (bin + 1) / count;
    }
}
