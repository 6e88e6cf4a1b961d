package com.example.verification.kernel;

import com.example.verification.model.AccumulatorState;

/**
 * Result of running the kernels over one batch.
 *
 * @param delta sufficient statistics of the accepted pairs, missing pairs counted in {@code missingCount}
 * @param accepted pairs that entered the statistics
 * @param rejected pairs excluded as missing or invalid
 */
public record BatchContribution(
        AccumulatorState delta,
        long accepted,
        long rejected
) {
}
