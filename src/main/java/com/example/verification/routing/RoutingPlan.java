package com.example.verification.routing;

import com.example.verification.model.EntityKey;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Accumulators a grid chunk must update: one gridpoint key per cell, in cell
 * order, and the regions containing each of them.
 */
public record RoutingPlan(
        List<EntityKey> gridpoints,
        Map<EntityKey, Set<EntityKey>> regionsByGridpoint
) {
    public RoutingPlan {
        gridpoints = List.copyOf(gridpoints);
        regionsByGridpoint = Map.copyOf(regionsByGridpoint);
    }

    public Set<EntityKey> regionsFor(EntityKey gridpoint) {
        return regionsByGridpoint.getOrDefault(gridpoint, Set.of());
    }
}
