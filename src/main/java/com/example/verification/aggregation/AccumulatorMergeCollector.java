package com.example.verification.aggregation;

import com.example.verification.model.AccumulatorId;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.function.BiConsumer;
import java.util.function.BinaryOperator;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.stream.Collector;

/**
 * A Collector that merges accumulators sharing an {@link AccumulatorId} into
 * one accumulator per key.
 *
 * <p>Only one accumulator per key is held at any time, so memory is bounded by
 * the number of distinct keys rather than the number of inputs. Inputs are
 * never modified: the first accumulator seen for a key is copied and later
 * ones are folded into the copy.
 *
 * <p>Example usage:
 * <pre>{@code
 * Map<AccumulatorId, Accumulator> merged = workerOutputs.stream()
 *         .flatMap(set -> set.accumulators().stream())
 *         .collect(AccumulatorMergeCollector.toMergedMap());
 * }</pre>
 *
 * <p>Fails with {@link com.example.verification.exception.IncompatibleAccumulatorException}
 * as soon as two accumulators under the same key disagree on configuration.
 */
public class AccumulatorMergeCollector
        implements Collector<Accumulator, AccumulatorMergeCollector.Partial, Map<AccumulatorId, Accumulator>> {

    /**
     * Mutable container holding one merged accumulator per key.
     */
    public static class Partial {
        private final Map<AccumulatorId, Accumulator> merged = new LinkedHashMap<>();

        /**
         * Folds one accumulator into the partial result.
         */
        public void accumulate(Accumulator accumulator) {
            Accumulator existing = merged.get(accumulator.id());
            if (existing == null) {
                merged.put(accumulator.id(), accumulator.copy());
            } else {
                existing.absorb(accumulator);
            }
        }

        /**
         * Combines this partial with another (for parallel streams).
         */
        public Partial combine(Partial other) {
            for (Accumulator accumulator : other.merged.values()) {
                accumulate(accumulator);
            }
            return this;
        }

        public Map<AccumulatorId, Accumulator> finish() {
            return Collections.unmodifiableMap(merged);
        }
    }

    public static AccumulatorMergeCollector toMergedMap() {
        return new AccumulatorMergeCollector();
    }

    @Override
    public Supplier<Partial> supplier() {
        return Partial::new;
    }

    @Override
    public BiConsumer<Partial, Accumulator> accumulator() {
        return Partial::accumulate;
    }

    @Override
    public BinaryOperator<Partial> combiner() {
        return Partial::combine;
    }

    @Override
    public Function<Partial, Map<AccumulatorId, Accumulator>> finisher() {
        return Partial::finish;
    }

    @Override
    public Set<Characteristics> characteristics() {
        // merging is commutative, encounter order does not matter
        return Set.of(Characteristics.UNORDERED);
    }
}
