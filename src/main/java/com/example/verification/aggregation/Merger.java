package com.example.verification.aggregation;

import com.example.verification.exception.IncompatibleAccumulatorException;
import com.example.verification.model.AccumulatorId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Combines partial accumulators from chunks or workers.
 *
 * <p>Because {@link Accumulator#merge} is associative and commutative, the
 * sequential and tree-shaped reductions below produce the same state (up to
 * floating-point summation order for sums). Inputs are never modified.
 *
 * <p>A configuration mismatch under one key means the run is corrupt; it is
 * reported as {@link IncompatibleAccumulatorException} and never resolved here.
 */
public final class Merger {

    private static final Logger log = LoggerFactory.getLogger(Merger.class);

    private Merger() {
    }

    /**
     * Sequentially merges accumulators that all share one key.
     *
     * @throws IllegalArgumentException if {@code accumulators} is empty
     * @throws IncompatibleAccumulatorException if keys or configurations differ
     */
    public static Accumulator merge(Collection<Accumulator> accumulators) {
        if (accumulators.isEmpty()) {
            throw new IllegalArgumentException("cannot merge an empty list of accumulators");
        }
        Accumulator merged = null;
        for (Accumulator accumulator : accumulators) {
            merged = merged == null ? accumulator.copy() : merged.absorb(accumulator);
        }
        return merged;
    }

    /**
     * Merges accumulators that all share one key as a balanced binary tree.
     *
     * @throws IllegalArgumentException if {@code accumulators} is empty
     * @throws IncompatibleAccumulatorException if keys or configurations differ
     */
    public static Accumulator treeMerge(List<Accumulator> accumulators) {
        if (accumulators.isEmpty()) {
            throw new IllegalArgumentException("cannot merge an empty list of accumulators");
        }
        List<Accumulator> level = accumulators;
        while (level.size() > 1) {
            List<Accumulator> next = new ArrayList<>((level.size() + 1) / 2);
            for (int i = 0; i + 1 < level.size(); i += 2) {
                next.add(level.get(i).merge(level.get(i + 1)));
            }
            if (level.size() % 2 == 1) {
                next.add(level.get(level.size() - 1));
            }
            level = next;
        }
        return level.get(0).copy();
    }

    /**
     * Groups accumulators by key and merges each group into one.
     *
     * @throws IncompatibleAccumulatorException if two accumulators under one key disagree on configuration
     */
    public static Map<AccumulatorId, Accumulator> mergeByKey(Collection<Accumulator> accumulators) {
        Map<AccumulatorId, Accumulator> merged = accumulators.stream()
                .collect(AccumulatorMergeCollector.toMergedMap());
        log.debug("merge.by_key inputs={} keys={}", accumulators.size(), merged.size());
        return merged;
    }

    /**
     * Merges the private sets of several workers into one new set.
     *
     * @param factory factory for the merged set
     * @param sets worker outputs, left unmodified
     * @throws IncompatibleAccumulatorException if two workers disagree on a key's configuration
     */
    public static AccumulatorSet mergeSets(AccumulatorFactory factory, Collection<AccumulatorSet> sets) {
        AccumulatorSet merged = new AccumulatorSet(factory);
        int inputs = 0;
        for (AccumulatorSet set : sets) {
            merged.mergeFrom(set);
            inputs += set.size();
        }
        log.info("merge.sets workers={} inputs={} keys={}", sets.size(), inputs, merged.size());
        return merged;
    }
}
