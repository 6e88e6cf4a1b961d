package com.example.verification.routing;

import com.example.verification.model.EntityKey;
import com.example.verification.model.EntityKind;

import java.util.HashMap;
import java.util.HashSet;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Immutable {@link SpatialIndex} backed by precomputed maps.
 *
 * <p>Example usage:
 * <pre>{@code
 * SpatialIndex index = InMemorySpatialIndex.builder()
 *         .addMembership(cell, EntityKey.region("CWA", "BOU"))
 *         .addStation(EntityKey.station("KDEN"), cell)
 *         .build();
 * }</pre>
 */
public final class InMemorySpatialIndex implements SpatialIndex {

    private final Map<EntityKey, Set<EntityKey>> regionsByGridpoint;
    private final Map<EntityKey, EntityKey> gridpointByStation;

    private InMemorySpatialIndex(Map<EntityKey, Set<EntityKey>> regionsByGridpoint,
                                 Map<EntityKey, EntityKey> gridpointByStation) {
        Map<EntityKey, Set<EntityKey>> regions = new HashMap<>();
        regionsByGridpoint.forEach((gridpoint, set) -> regions.put(gridpoint, Set.copyOf(set)));
        this.regionsByGridpoint = Map.copyOf(regions);
        this.gridpointByStation = Map.copyOf(gridpointByStation);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static InMemorySpatialIndex empty() {
        return builder().build();
    }

    @Override
    public Set<EntityKey> regionsContaining(EntityKey gridpoint) {
        return regionsByGridpoint.getOrDefault(gridpoint, Set.of());
    }

    @Override
    public Optional<EntityKey> nearestGridpoint(EntityKey station) {
        return Optional.ofNullable(gridpointByStation.get(station));
    }

    /**
     * Collects memberships before freezing them into an index.
     */
    public static final class Builder {
        private final Map<EntityKey, Set<EntityKey>> regionsByGridpoint = new HashMap<>();
        private final Map<EntityKey, EntityKey> gridpointByStation = new HashMap<>();

        private Builder() {
        }

        public Builder addMembership(EntityKey gridpoint, EntityKey region) {
            require(gridpoint, EntityKind.GRIDPOINT);
            require(region, EntityKind.REGION);
            regionsByGridpoint.computeIfAbsent(gridpoint, k -> new HashSet<>()).add(region);
            return this;
        }

        public Builder addStation(EntityKey station, EntityKey gridpoint) {
            require(station, EntityKind.STATION);
            require(gridpoint, EntityKind.GRIDPOINT);
            gridpointByStation.put(station, gridpoint);
            return this;
        }

        public InMemorySpatialIndex build() {
            return new InMemorySpatialIndex(regionsByGridpoint, gridpointByStation);
        }

        private static void require(EntityKey key, EntityKind kind) {
            if (key.kind() != kind) {
                throw new IllegalArgumentException("expected a " + kind + " key but got " + key);
            }
        }
    }
}
