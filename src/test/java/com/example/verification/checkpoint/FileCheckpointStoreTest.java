package com.example.verification.checkpoint;

import com.example.verification.aggregation.Accumulator;
import com.example.verification.exception.CheckpointCorruptException;
import com.example.verification.model.AccumulatorConfig;
import com.example.verification.model.AccumulatorId;
import com.example.verification.model.AccumulatorState;
import com.example.verification.model.EntityKey;
import com.example.verification.model.ProbabilityBins;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Consumer;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for FileCheckpointStore against a real temporary directory.
 *
 * <h2>File layout</h2>
 * <pre>
 * sha256=&lt;hex digest of the body&gt;
 * {"schemaVersion":2,"sequenceNumber":..., ...}
 * </pre>
 */
class FileCheckpointStoreTest {

    @TempDir
    Path dir;

    private static final AccumulatorConfig POP = AccumulatorConfig.continuous()
            .withThresholds(0.254, 2.54)
            .withProbabilities(ProbabilityBins.deciles(), 0.254)
            .withMissingValue(9999.0);

    private static List<Accumulator> sampleAccumulators() {
        Accumulator gridpoint = new Accumulator(
                AccumulatorId.of(EntityKey.gridpoint(10, 20, 39.7, -104.9), "APCP", "f024"), POP);
        gridpoint.update(new double[]{0.1, 3.3, 0.0, 9999}, new double[]{0.0, 2.8, 0.3, 1.0},
                new double[]{0.15, 0.85, 0.4, 0.2});
        Accumulator region = new Accumulator(
                AccumulatorId.of(EntityKey.region("CWA", "BOU", "Boulder"), "APCP", "f024"), POP);
        region.update(new double[]{1.7}, new double[]{Double.NaN}, new double[]{0.6});
        Accumulator empty = new Accumulator(AccumulatorId.of(EntityKey.station("KDEN", 39.8, -104.7), "APCP"), POP);
        return List.of(gridpoint, region, empty);
    }

    private static void writeWithHeader(Path file, byte[] body) throws Exception {
        String digest = HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(body));
        byte[] header = ("sha256=" + digest + "\n").getBytes(StandardCharsets.US_ASCII);
        byte[] bytes = new byte[header.length + body.length];
        System.arraycopy(header, 0, bytes, 0, header.length);
        System.arraycopy(body, 0, bytes, header.length, body.length);
        Files.write(file, bytes);
    }

    /**
     * Saves the sample accumulators, edits the state of the first one in the JSON
     * body and writes it back under a matching digest.
     */
    private static void saveWithEditedState(FileCheckpointStore store, Consumer<ObjectNode> edit)
            throws Exception {
        store.save(sampleAccumulators(), Set.of("chunk-1"));
        byte[] bytes = Files.readAllBytes(store.path());
        String content = new String(bytes, StandardCharsets.UTF_8);
        String body = content.substring(content.indexOf('\n') + 1);
        ObjectMapper mapper = new ObjectMapper();
        ObjectNode tree = (ObjectNode) mapper.readTree(body);
        edit.accept((ObjectNode) tree.get("accumulators").get(0).get("state"));
        writeWithHeader(store.path(), mapper.writeValueAsBytes(tree));
    }

    // =========================================================================
    // ROUND TRIP
    // =========================================================================

    /**
     * Restored accumulators must report exactly the metrics they had when saved.
     */
    @Test
    @DisplayName("Should restore accumulators with identical metrics")
    void shouldRoundTripMetrics() throws Exception {
        // Given
        FileCheckpointStore store = new FileCheckpointStore(dir, "apcp");
        List<Accumulator> saved = sampleAccumulators();

        // When
        long sequence = store.save(saved, Set.of("chunk-2", "chunk-1"));
        CheckpointRecord record = store.load().orElseThrow();

        // Then
        assertThat(sequence).isEqualTo(1);
        assertThat(record.schemaVersion()).isEqualTo(CheckpointCodec.SCHEMA_VERSION);
        assertThat(record.completedChunkIds()).containsExactly("chunk-1", "chunk-2");
        List<Accumulator> restored = record.accumulators().stream()
                .map(AccumulatorSnapshot::toAccumulator)
                .collect(Collectors.toList());
        assertThat(restored).hasSize(3);
        for (int i = 0; i < saved.size(); i++) {
            assertThat(restored.get(i).id()).isEqualTo(saved.get(i).id());
            assertThat(restored.get(i).config()).isEqualTo(saved.get(i).config());
            assertThat(restored.get(i).state()).isEqualTo(saved.get(i).state());
            assertThat(restored.get(i).computeMetrics()).isEqualTo(saved.get(i).computeMetrics());
        }
    }

    @Test
    @DisplayName("Should return empty when nothing was saved")
    void shouldReturnEmptyWithoutFile() throws Exception {
        FileCheckpointStore store = new FileCheckpointStore(dir.resolve("nested"), "none");

        assertThat(store.exists()).isFalse();
        assertThat(store.load()).isEqualTo(Optional.empty());
    }

    @Test
    @DisplayName("Should leave no temporary files behind")
    void shouldLeaveNoTemporaryFiles() throws Exception {
        FileCheckpointStore store = new FileCheckpointStore(dir, "apcp");

        store.save(sampleAccumulators(), Set.of("a"));
        store.save(sampleAccumulators(), Set.of("a", "b"));

        try (var files = Files.list(dir)) {
            assertThat(files.map(p -> p.getFileName().toString())).containsExactly("apcp.checkpoint");
        }
    }

    // =========================================================================
    // SEQUENCE NUMBERS
    // =========================================================================

    @Test
    @DisplayName("Should increase the sequence number across saves and store instances")
    void shouldIncreaseSequence() throws Exception {
        // Given
        FileCheckpointStore first = new FileCheckpointStore(dir, "seq");
        first.save(List.of(), Set.of());
        first.save(List.of(), Set.of());

        // When
        long third = new FileCheckpointStore(dir, "seq").save(List.of(), Set.of());

        // Then
        assertThat(third).isEqualTo(3);
    }

    @Test
    @DisplayName("Should restart numbering after delete")
    void shouldRestartAfterDelete() throws Exception {
        FileCheckpointStore store = new FileCheckpointStore(dir, "seq");
        store.save(List.of(), Set.of());

        store.delete();

        assertThat(store.exists()).isFalse();
        assertThat(store.load()).isEmpty();
        assertThat(store.save(List.of(), Set.of())).isEqualTo(1);
    }

    // =========================================================================
    // CORRUPTION
    // =========================================================================

    @Test
    @DisplayName("Should detect a modified body")
    void shouldDetectModifiedBody() throws Exception {
        // Given
        FileCheckpointStore store = new FileCheckpointStore(dir, "apcp");
        store.save(sampleAccumulators(), Set.of("chunk-1"));
        String content = Files.readString(store.path());
        Files.writeString(store.path(), content.replace("chunk-1", "chunk-9"));

        // When / Then
        assertThatThrownBy(store::load)
                .isInstanceOf(CheckpointCorruptException.class)
                .hasMessageContaining("integrity");
    }

    @Test
    @DisplayName("Should detect a file without header")
    void shouldDetectMissingHeader() throws Exception {
        FileCheckpointStore store = new FileCheckpointStore(dir, "apcp");
        Files.writeString(store.path(), "{\"schemaVersion\":2}");

        assertThatThrownBy(store::load).isInstanceOf(CheckpointCorruptException.class);
    }

    @Test
    @DisplayName("Should refuse a snapshot from a newer schema")
    void shouldRefuseNewerSchema() throws Exception {
        FileCheckpointStore store = new FileCheckpointStore(dir, "apcp");
        writeWithHeader(store.path(), "{\"schemaVersion\":99,\"sequenceNumber\":1}".getBytes(StandardCharsets.UTF_8));

        assertThatThrownBy(store::load)
                .isInstanceOf(CheckpointCorruptException.class)
                .hasMessageContaining("newer");
    }

    @Test
    @DisplayName("Should refuse duplicate accumulators")
    void shouldRefuseDuplicateAccumulators() throws Exception {
        // Given
        FileCheckpointStore store = new FileCheckpointStore(dir, "apcp");
        AccumulatorSnapshot snapshot = AccumulatorSnapshot.of(sampleAccumulators().get(0));
        CheckpointRecord record = new CheckpointRecord(
                CheckpointCodec.SCHEMA_VERSION, 1, Set.of(), List.of(snapshot, snapshot));
        writeWithHeader(store.path(), new CheckpointCodec().encode(record));

        // When / Then
        assertThatThrownBy(store::load)
                .isInstanceOf(CheckpointCorruptException.class)
                .hasMessageContaining("twice");
    }

    @Test
    @DisplayName("Should refuse a state that does not fit its configuration")
    void shouldRefuseMisshapenState() throws Exception {
        FileCheckpointStore store = new FileCheckpointStore(dir, "apcp");
        AccumulatorSnapshot snapshot = new AccumulatorSnapshot(
                AccumulatorId.of(EntityKey.station("KDEN"), "APCP"),
                POP,
                AccumulatorState.empty(AccumulatorConfig.continuous()));
        CheckpointRecord record = new CheckpointRecord(CheckpointCodec.SCHEMA_VERSION, 1, Set.of(), List.of(snapshot));
        writeWithHeader(store.path(), new CheckpointCodec().encode(record));

        assertThatThrownBy(store::load)
                .isInstanceOf(CheckpointCorruptException.class)
                .hasMessageContaining("does not match");
    }

    @Test
    @DisplayName("Should replace a corrupt snapshot on the next save")
    void shouldReplaceCorruptSnapshot() throws Exception {
        FileCheckpointStore store = new FileCheckpointStore(dir, "apcp");
        Files.writeString(store.path(), "garbage");

        long sequence = new FileCheckpointStore(dir, "apcp").save(sampleAccumulators(), Set.of("x"));

        assertThat(sequence).isEqualTo(1);
        assertThat(store.load().orElseThrow().completedChunkIds()).containsExactly("x");
    }

    @Test
    @DisplayName("Should refuse a state with a null contingency table")
    void shouldRefuseNullContingencyTable() throws Exception {
        // Given a body whose digest is valid but whose first table is null
        FileCheckpointStore store = new FileCheckpointStore(dir, "apcp");
        saveWithEditedState(store, state -> state.withArray("contingency").set(0, state.nullNode()));

        // When / Then
        assertThatThrownBy(store::load)
                .isInstanceOf(CheckpointCorruptException.class)
                .hasMessageContaining("missing contingency table 0");
    }

    @Test
    @DisplayName("Should refuse negative counters and non-finite sums")
    void shouldRefuseImpossibleStatistics() throws Exception {
        FileCheckpointStore store = new FileCheckpointStore(dir, "apcp");

        saveWithEditedState(store, state -> state.put("sampleCount", -3));
        assertThatThrownBy(store::load)
                .isInstanceOf(CheckpointCorruptException.class)
                .hasMessageContaining("negative counter");

        saveWithEditedState(store, state -> state.put("sumAbsError", new BigDecimal("1e400")));
        assertThatThrownBy(store::load)
                .isInstanceOf(CheckpointCorruptException.class)
                .hasMessageContaining("malformed");
    }
}
