package com.example.verification.routing;

import com.example.verification.model.EntityKey;

/**
 * Coordinates of the forecast grid, supplied by the grid reader.
 */
public interface GridGeometry {

    double latitude(int i, int j);

    double longitude(int i, int j);

    /**
     * Builds the key of gridpoint {@code (i, j)}.
     */
    default EntityKey gridpointKey(int i, int j) {
        return EntityKey.gridpoint(i, j, latitude(i, j), longitude(i, j));
    }
}
