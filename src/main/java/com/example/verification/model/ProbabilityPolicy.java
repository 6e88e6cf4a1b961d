package com.example.verification.model;

/**
 * What to do with a forecast probability outside [0, 1].
 */
public enum ProbabilityPolicy {
    /** Count the pair as missing. */
    REJECT,
    /** Clamp the probability into [0, 1] and keep the pair. */
    CLIP
}
