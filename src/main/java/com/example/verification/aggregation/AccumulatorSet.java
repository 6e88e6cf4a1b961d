package com.example.verification.aggregation;

import com.example.verification.exception.ConfigurationException;
import com.example.verification.metrics.MetricRecord;
import com.example.verification.model.AccumulatorId;
import com.example.verification.model.CompletenessPolicy;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * The live accumulators owned by one worker, keyed by {@link AccumulatorId}.
 *
 * <p>Accumulators are created lazily on first use through the
 * {@link AccumulatorFactory}, so every accumulator in a set carries the
 * configuration the factory defines for its variable.
 *
 * <p><b>Thread Safety:</b> This class is NOT thread-safe. Parallel workers each
 * own a set and are combined with {@link Merger#mergeSets}.
 */
public final class AccumulatorSet implements Iterable<Accumulator> {

    private final AccumulatorFactory factory;
    private final Map<AccumulatorId, Accumulator> accumulators = new LinkedHashMap<>();

    public AccumulatorSet(AccumulatorFactory factory) {
        this.factory = factory;
    }

    /**
     * Rebuilds a set from restored accumulators.
     *
     * @throws ConfigurationException if an accumulator's configuration differs from
     *         what the factory now defines for its variable, or a key appears twice
     */
    public static AccumulatorSet restore(AccumulatorFactory factory, Collection<Accumulator> restored) {
        AccumulatorSet set = new AccumulatorSet(factory);
        for (Accumulator accumulator : restored) {
            if (!factory.configFor(accumulator.id().variable()).equals(accumulator.config())) {
                throw new ConfigurationException(
                        "restored configuration of " + accumulator.id() + " differs from the run configuration");
            }
            if (set.accumulators.putIfAbsent(accumulator.id(), accumulator) != null) {
                throw new ConfigurationException("duplicate accumulator " + accumulator.id());
            }
        }
        return set;
    }

    public Accumulator getOrCreate(AccumulatorId id) {
        return accumulators.computeIfAbsent(id, factory::create);
    }

    public Optional<Accumulator> get(AccumulatorId id) {
        return Optional.ofNullable(accumulators.get(id));
    }

    /**
     * Folds every accumulator of {@code other} into this set. {@code other} is not modified.
     */
    public AccumulatorSet mergeFrom(AccumulatorSet other) {
        for (Accumulator accumulator : other.accumulators.values()) {
            Accumulator existing = accumulators.get(accumulator.id());
            if (existing == null) {
                accumulators.put(accumulator.id(), accumulator.copy());
            } else {
                existing.absorb(accumulator);
            }
        }
        return this;
    }

    /**
     * Deep copies of all accumulators, safe to hand to a checkpoint writer.
     */
    public List<Accumulator> snapshot() {
        List<Accumulator> copies = new ArrayList<>(accumulators.size());
        for (Accumulator accumulator : accumulators.values()) {
            copies.add(accumulator.copy());
        }
        return copies;
    }

    public List<MetricRecord> toRecords() {
        return toRecords(CompletenessPolicy.none());
    }

    /**
     * Output rows with each entity's sufficiency judged against {@code policy}.
     */
    public List<MetricRecord> toRecords(CompletenessPolicy policy) {
        List<MetricRecord> records = new ArrayList<>(accumulators.size());
        for (Accumulator accumulator : accumulators.values()) {
            records.add(accumulator.toRecord(policy));
        }
        return records;
    }

    public Collection<Accumulator> accumulators() {
        return Collections.unmodifiableCollection(accumulators.values());
    }

    public AccumulatorFactory factory() {
        return factory;
    }

    public int size() {
        return accumulators.size();
    }

    public boolean isEmpty() {
        return accumulators.isEmpty();
    }

    @Override
    public Iterator<Accumulator> iterator() {
        return accumulators().iterator();
    }
}
