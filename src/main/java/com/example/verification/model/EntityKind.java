package com.example.verification.model;

/**
 * The closed set of things an accumulator can describe.
 *
 * <p>The statistics are identical for every kind; only identity and routing differ.
 */
public enum EntityKind {
    /** One cell of the forecast grid. */
    GRIDPOINT,
    /** A named polygon aggregating many gridpoints. */
    REGION,
    /** A point observation site compared against its nearest gridpoint. */
    STATION
}
