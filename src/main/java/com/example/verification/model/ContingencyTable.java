package com.example.verification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 2x2 tally of forecast/observed event co-occurrence at one threshold.
 *
 * <p>Tables are values: {@link #plus} returns a new table and never mutates
 * either side, so partial tables from different chunks or workers can be
 * combined in any order.
 */
public record ContingencyTable(
        long hits,
        long misses,
        long falseAlarms,
        long correctNegatives
) {
    @JsonCreator
    public ContingencyTable(
            @JsonProperty("hits") long hits,
            @JsonProperty("misses") long misses,
            @JsonProperty("falseAlarms") long falseAlarms,
            @JsonProperty("correctNegatives") long correctNegatives
    ) {
        this.hits = hits;
        this.misses = misses;
        this.falseAlarms = falseAlarms;
        this.correctNegatives = correctNegatives;
    }

    /**
     * Creates an empty table, the identity for {@link #plus}.
     */
    public static ContingencyTable zero() {
        return new ContingencyTable(0, 0, 0, 0);
    }

    /**
     * Combines two tables cell by cell.
     *
     * @param other the table to add
     * @return new table with summed tallies
     */
    public ContingencyTable plus(ContingencyTable other) {
        return new ContingencyTable(
                hits + other.hits,
                misses + other.misses,
                falseAlarms + other.falseAlarms,
                correctNegatives + other.correctNegatives
        );
    }

    @JsonIgnore
    public long total() {
        return hits + misses + falseAlarms + correctNegatives;
    }
}
