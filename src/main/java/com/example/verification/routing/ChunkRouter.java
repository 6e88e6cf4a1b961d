package com.example.verification.routing;

import com.example.verification.model.EntityKey;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Maps a chunk to the accumulators it must update.
 *
 * <p>Region membership and nearest-gridpoint lookups are delegated to the
 * {@link SpatialIndex} once per key and cached for the router's lifetime; the
 * router never recomputes geometry.
 *
 * <p><b>Thread Safety:</b> This class is thread-safe; parallel workers share one router.
 */
public final class ChunkRouter {

    private final GridGeometry geometry;
    private final SpatialIndex spatialIndex;
    private final ConcurrentMap<EntityKey, Set<EntityKey>> regionCache = new ConcurrentHashMap<>();
    private final ConcurrentMap<EntityKey, Optional<EntityKey>> stationCache = new ConcurrentHashMap<>();

    public ChunkRouter(GridGeometry geometry, SpatialIndex spatialIndex) {
        this.geometry = geometry;
        this.spatialIndex = spatialIndex;
    }

    /**
     * Returns the gridpoint keys of a range in cell order, with their regions.
     */
    public RoutingPlan route(GridRange range) {
        int cells = range.cellCount();
        List<EntityKey> gridpoints = new ArrayList<>(cells);
        Map<EntityKey, Set<EntityKey>> regions = new HashMap<>();
        for (int c = 0; c < cells; c++) {
            EntityKey gridpoint = geometry.gridpointKey(range.rowOf(c), range.colOf(c));
            gridpoints.add(gridpoint);
            Set<EntityKey> containing = regionsFor(gridpoint);
            if (!containing.isEmpty()) {
                regions.put(gridpoint, containing);
            }
        }
        return new RoutingPlan(gridpoints, regions);
    }

    public Set<EntityKey> regionsFor(EntityKey gridpoint) {
        return regionCache.computeIfAbsent(gridpoint, key -> Set.copyOf(spatialIndex.regionsContaining(key)));
    }

    public Optional<EntityKey> gridpointForStation(EntityKey station) {
        return stationCache.computeIfAbsent(station, spatialIndex::nearestGridpoint);
    }

    /**
     * Number of gridpoints whose membership has been resolved so far.
     */
    public int cachedGridpoints() {
        return regionCache.size();
    }
}
