package com.example.verification.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * Key of one accumulator: the entity, the verified variable and the temporal
 * group (for example an init-hour/lead-time bucket) the pairs belong to.
 */
public record AccumulatorId(
        EntityKey entity,
        String variable,
        String group
) {
    /** Group used when the caller does not split pairs by time. */
    public static final String DEFAULT_GROUP = "all";

    @JsonCreator
    public AccumulatorId(
            @JsonProperty("entity") EntityKey entity,
            @JsonProperty("variable") String variable,
            @JsonProperty("group") String group
    ) {
        this.entity = Objects.requireNonNull(entity, "entity must not be null");
        this.variable = Objects.requireNonNull(variable, "variable must not be null");
        this.group = group != null ? group : DEFAULT_GROUP;
    }

    public static AccumulatorId of(EntityKey entity, String variable) {
        return new AccumulatorId(entity, variable, DEFAULT_GROUP);
    }

    public static AccumulatorId of(EntityKey entity, String variable, String group) {
        return new AccumulatorId(entity, variable, group);
    }

    public EntityKind kind() {
        return entity.kind();
    }

    @Override
    public String toString() {
        return entity + "/" + variable + "/" + group;
    }
}
