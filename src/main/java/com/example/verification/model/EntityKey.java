package com.example.verification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;

/**
 * Immutable identity of a verified entity.
 *
 * <p>The {@code id} is unique within a {@link EntityKind}; {@code attributes} carry
 * descriptive values (grid indices, coordinates, region type, station name) that
 * are part of the identity too, so two keys built from different metadata never
 * compare equal.
 *
 * <p>Use the factory methods rather than the canonical constructor:
 * <pre>{@code
 * EntityKey cell = EntityKey.gridpoint(120, 455, 39.74, -104.99);
 * EntityKey cwa = EntityKey.region("CWA", "BOU");
 * EntityKey site = EntityKey.station("KDEN");
 * }</pre>
 */
public record EntityKey(
        EntityKind kind,
        String id,
        SortedMap<String, String> attributes
) {
    @JsonCreator
    public EntityKey(
            @JsonProperty("kind") EntityKind kind,
            @JsonProperty("id") String id,
            @JsonProperty("attributes") SortedMap<String, String> attributes
    ) {
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.attributes = attributes != null
                ? Collections.unmodifiableSortedMap(new TreeMap<>(attributes))
                : Collections.emptySortedMap();
    }

    public static EntityKey gridpoint(int i, int j, double lat, double lon) {
        SortedMap<String, String> attrs = new TreeMap<>();
        attrs.put("i", Integer.toString(i));
        attrs.put("j", Integer.toString(j));
        attrs.put("lat", Double.toString(lat));
        attrs.put("lon", Double.toString(lon));
        return new EntityKey(EntityKind.GRIDPOINT, i + "," + j, attrs);
    }

    public static EntityKey region(String regionType, String regionId) {
        return region(regionType, regionId, null);
    }

    public static EntityKey region(String regionType, String regionId, String regionName) {
        SortedMap<String, String> attrs = new TreeMap<>();
        attrs.put("region_type", Objects.requireNonNull(regionType, "regionType must not be null"));
        attrs.put("region_id", Objects.requireNonNull(regionId, "regionId must not be null"));
        if (regionName != null) {
            attrs.put("region_name", regionName);
        }
        return new EntityKey(EntityKind.REGION, regionType + ":" + regionId, attrs);
    }

    public static EntityKey station(String stationId) {
        return new EntityKey(EntityKind.STATION, stationId, null);
    }

    public static EntityKey station(String stationId, double lat, double lon) {
        SortedMap<String, String> attrs = new TreeMap<>();
        attrs.put("lat", Double.toString(lat));
        attrs.put("lon", Double.toString(lon));
        return new EntityKey(EntityKind.STATION, stationId, attrs);
    }

    /**
     * Returns a descriptive attribute, or {@code null} if it was not recorded.
     */
    public String attribute(String name) {
        return attributes.get(name);
    }

    @Override
    public String toString() {
        return kind + "[" + id + "]";
    }
}
