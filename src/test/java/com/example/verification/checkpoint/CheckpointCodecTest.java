package com.example.verification.checkpoint;

import com.example.verification.exception.CheckpointCorruptException;
import com.example.verification.model.AccumulatorId;
import com.example.verification.model.EntityKind;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for CheckpointCodec schema handling.
 */
class CheckpointCodecTest {

    private final CheckpointCodec codec = new CheckpointCodec();

    private static byte[] bytes(String json) {
        return json.getBytes(StandardCharsets.UTF_8);
    }

    // =========================================================================
    // MIGRATION
    // =========================================================================

    /**
     * Version 1 snapshots had no temporal group on accumulator ids.
     */
    @Test
    @DisplayName("Should migrate a version 1 snapshot")
    void shouldMigrateVersionOne() throws Exception {
        // Given
        String v1 = """
                {
                  "schemaVersion": 1,
                  "sequenceNumber": 4,
                  "completedChunkIds": ["chunk-0"],
                  "accumulators": [{
                    "id": {
                      "entity": {"kind": "STATION", "id": "KDEN", "attributes": {}},
                      "variable": "TMP_2m"
                    },
                    "config": {"thresholds": [], "probabilityPolicy": "REJECT"},
                    "state": {"sampleCount": 2, "sumAbsError": 3.0}
                  }]
                }
                """;

        // When
        CheckpointRecord record = codec.decode(bytes(v1));

        // Then
        assertThat(record.schemaVersion()).isEqualTo(CheckpointCodec.SCHEMA_VERSION);
        assertThat(record.sequenceNumber()).isEqualTo(4);
        AccumulatorSnapshot snapshot = record.accumulators().get(0);
        assertThat(snapshot.id().group()).isEqualTo(AccumulatorId.DEFAULT_GROUP);
        assertThat(snapshot.id().kind()).isEqualTo(EntityKind.STATION);
        assertThat(snapshot.toAccumulator().computeMetrics().mae().getAsDouble()).isEqualTo(1.5);
    }

    // =========================================================================
    // REJECTION
    // =========================================================================

    @Test
    @DisplayName("Should refuse a version with no migration path")
    void shouldRefuseUnknownOldVersion() {
        assertThatThrownBy(() -> codec.decode(bytes("{\"schemaVersion\":0}")))
                .isInstanceOf(CheckpointCorruptException.class)
                .hasMessageContaining("no migration");
    }

    @Test
    @DisplayName("Should refuse a body without schema version")
    void shouldRefuseMissingVersion() {
        assertThatThrownBy(() -> codec.decode(bytes("{\"sequenceNumber\":1}")))
                .isInstanceOf(CheckpointCorruptException.class)
                .hasMessageContaining("schema version");
    }

    @Test
    @DisplayName("Should refuse bodies that are not JSON objects")
    void shouldRefuseNonObjects() {
        assertThatThrownBy(() -> codec.decode(bytes("[1, 2]"))).isInstanceOf(CheckpointCorruptException.class);
        assertThatThrownBy(() -> codec.decode(bytes("{not json"))).isInstanceOf(CheckpointCorruptException.class);
    }

    @Test
    @DisplayName("Should refuse a body that does not bind to the current schema")
    void shouldRefuseUnbindableBody() {
        String invalidConfig = """
                {"schemaVersion": 2, "sequenceNumber": 1, "accumulators": [{
                  "id": {"entity": {"kind": "STATION", "id": "KDEN"}, "variable": "T", "group": "all"},
                  "config": {"probabilityBins": {"count": 10}},
                  "state": {}
                }]}
                """;

        assertThatThrownBy(() -> codec.decode(bytes(invalidConfig)))
                .isInstanceOf(CheckpointCorruptException.class)
                .hasMessageContaining("does not match schema");
    }
}
