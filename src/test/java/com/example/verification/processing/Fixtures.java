package com.example.verification.processing;

import com.example.verification.aggregation.Accumulator;
import com.example.verification.aggregation.AccumulatorFactory;
import com.example.verification.aggregation.AccumulatorSet;
import com.example.verification.model.AccumulatorConfig;
import com.example.verification.model.AccumulatorId;
import com.example.verification.model.AccumulatorState;
import com.example.verification.model.EntityKey;
import com.example.verification.routing.ChunkRouter;
import com.example.verification.routing.GridChunk;
import com.example.verification.routing.GridGeometry;
import com.example.verification.routing.GridRange;
import com.example.verification.routing.InMemorySpatialIndex;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared test data: a 2x3 grid, two regions and a deterministic chunk sequence.
 *
 * <p>All values are small integers so sums are exact and states from different
 * merge orders can be compared with {@code equals}.
 */
final class Fixtures {

    static final String VARIABLE = "TMP_2m";
    static final AccumulatorConfig CONFIG = AccumulatorConfig.continuous().withThresholds(3.0);
    static final EntityKey BOU = EntityKey.region("CWA", "BOU");
    static final EntityKey CO = EntityKey.region("STATE", "CO");
    static final EntityKey KDEN = EntityKey.station("KDEN");

    static final GridGeometry GEOMETRY = new GridGeometry() {
        @Override
        public double latitude(int i, int j) {
            return 39.0 + i;
        }

        @Override
        public double longitude(int i, int j) {
            return -105.0 + j;
        }
    };

    private Fixtures() {
    }

    static AccumulatorFactory factory() {
        return AccumulatorFactory.of(VARIABLE, CONFIG);
    }

    static ChunkRouter router() {
        InMemorySpatialIndex.Builder index = InMemorySpatialIndex.builder()
                .addMembership(GEOMETRY.gridpointKey(0, 0), BOU)
                .addMembership(GEOMETRY.gridpointKey(0, 1), BOU)
                .addMembership(GEOMETRY.gridpointKey(1, 1), BOU)
                .addStation(KDEN, GEOMETRY.gridpointKey(0, 0));
        for (int i = 0; i < 2; i++) {
            for (int j = 0; j < 3; j++) {
                index.addMembership(GEOMETRY.gridpointKey(i, j), CO);
            }
        }
        return new ChunkRouter(GEOMETRY, index.build());
    }

    static EntityKey gridpoint(int i, int j) {
        return GEOMETRY.gridpointKey(i, j);
    }

    /**
     * Chunk {@code k} covers row {@code k % 2} over two steps.
     */
    static GridChunk chunk(int k) {
        GridRange row = new GridRange(k % 2, k % 2 + 1, 0, 3);
        int steps = 2;
        double[] forecasts = new double[row.cellCount() * steps];
        double[] observations = new double[forecasts.length];
        for (int s = 0; s < steps; s++) {
            for (int c = 0; c < row.cellCount(); c++) {
                int index = s * row.cellCount() + c;
                forecasts[index] = (k + s + c) % 6;
                observations[index] = (k * c + s) % 5;
            }
        }
        if (k % 3 == 2) {
            observations[1] = Double.NaN;
        }
        return GridChunk.of("chunk-" + k, VARIABLE, row, steps, forecasts, observations);
    }

    static List<GridChunk> chunks(int count) {
        List<GridChunk> chunks = new ArrayList<>(count);
        for (int k = 0; k < count; k++) {
            chunks.add(chunk(k));
        }
        return chunks;
    }

    static Map<AccumulatorId, AccumulatorState> statesOf(AccumulatorSet set) {
        Map<AccumulatorId, AccumulatorState> states = new LinkedHashMap<>();
        for (Accumulator accumulator : set) {
            states.put(accumulator.id(), accumulator.state());
        }
        return states;
    }
}
