package com.example.verification.routing;

import com.example.verification.model.EntityKey;

import java.util.Optional;
import java.util.Set;

/**
 * Region membership and station lookups, computed once by the spatial
 * collaborator and read-only while chunks are processed.
 *
 * <p>Implementations must be pure lookups and safe for concurrent reads.
 */
public interface SpatialIndex {

    /**
     * Returns the regions whose geometry contains the gridpoint, possibly empty.
     */
    Set<EntityKey> regionsContaining(EntityKey gridpoint);

    /**
     * Returns the gridpoint nearest to the station, or empty if the station lies off the grid.
     */
    Optional<EntityKey> nearestGridpoint(EntityKey station);
}
