package com.example.verification.processing;

import com.example.verification.exception.ConfigurationException;
import com.example.verification.routing.GridChunk;
import com.example.verification.routing.GridRange;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;
import reactor.test.StepVerifier;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for ParallelVerificationRunner.
 *
 * <h2>Equivalence</h2>
 * <p>Spreading chunks over rails with private accumulator sets and merging at
 * the end must give the same accumulators as one sequential pass.</p>
 *
 * <pre>{@code
 * runner.run(Flux.fromIterable(chunks))    // Mono<RunResult>
 *     .block();
 * }</pre>
 */
class ParallelVerificationRunnerTest {

    private static RunResult sequential(List<GridChunk> chunks) throws Exception {
        return new VerificationRun(Fixtures.router(), Fixtures.factory(), new InMemoryCheckpointStore(), 100)
                .run(chunks);
    }

    private static ParallelVerificationRunner runner(InMemoryCheckpointStore store, int workers) {
        return new ParallelVerificationRunner(Fixtures.router(), Fixtures.factory(), store, workers);
    }

    // =========================================================================
    // EQUIVALENCE WITH A SEQUENTIAL RUN
    // =========================================================================

    @Test
    @DisplayName("Should produce the same accumulators as a sequential run")
    void shouldMatchSequentialRun() throws Exception {
        // Given
        List<GridChunk> chunks = Fixtures.chunks(24);
        RunResult expected = sequential(chunks);
        InMemoryCheckpointStore store = new InMemoryCheckpointStore();

        // When / Then
        StepVerifier.create(runner(store, 4).run(Flux.fromIterable(chunks)))
                .assertNext(result -> {
                    assertThat(result.applied()).isEqualTo(24);
                    assertThat(result.completedChunkIds()).isEqualTo(expected.completedChunkIds());
                    assertThat(result.completeness().insufficient())
                            .containsExactlyInAnyOrderElementsOf(expected.completeness().insufficient());
                    assertThat(Fixtures.statesOf(result.accumulators()))
                            .containsExactlyInAnyOrderEntriesOf(Fixtures.statesOf(expected.accumulators()));
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should write exactly one checkpoint after merging")
    void shouldCheckpointOnce() {
        InMemoryCheckpointStore store = new InMemoryCheckpointStore();

        RunResult result = runner(store, 3).run(Flux.fromIterable(Fixtures.chunks(10))).block();

        assertThat(store.saves()).isEqualTo(1);
        assertThat(result.checkpointSequence()).isEqualTo(1);
        assertThat(store.load().orElseThrow().accumulators()).hasSize(result.accumulators().size());
    }

    // =========================================================================
    // RESUME AND DUPLICATES
    // =========================================================================

    @Test
    @DisplayName("Should skip chunks completed in the checkpoint")
    void shouldResumeFromCheckpoint() throws Exception {
        // Given a sequential run that stopped after six chunks
        List<GridChunk> chunks = Fixtures.chunks(12);
        InMemoryCheckpointStore store = new InMemoryCheckpointStore();
        new VerificationRun(Fixtures.router(), Fixtures.factory(), store, 100).run(chunks.subList(0, 6));
        RunResult expected = sequential(chunks);

        // When / Then
        StepVerifier.create(runner(store, 2).run(Flux.fromIterable(chunks)))
                .assertNext(result -> {
                    assertThat(result.skipped()).isEqualTo(6);
                    assertThat(result.applied()).isEqualTo(6);
                    assertThat(Fixtures.statesOf(result.accumulators()))
                            .containsExactlyInAnyOrderEntriesOf(Fixtures.statesOf(expected.accumulators()));
                })
                .verifyComplete();
    }

    @Test
    @DisplayName("Should process a repeated chunk id once")
    void shouldProcessDuplicateOnce() throws Exception {
        List<GridChunk> chunks = Fixtures.chunks(4);
        List<GridChunk> withDuplicates = new ArrayList<>(chunks);
        withDuplicates.addAll(chunks);
        RunResult expected = sequential(chunks);

        RunResult result = runner(new InMemoryCheckpointStore(), 4).run(Flux.fromIterable(withDuplicates)).block();

        assertThat(result.applied()).isEqualTo(4);
        assertThat(Fixtures.statesOf(result.accumulators()))
                .containsExactlyInAnyOrderEntriesOf(Fixtures.statesOf(expected.accumulators()));
    }

    // =========================================================================
    // FAILURES
    // =========================================================================

    @Test
    @DisplayName("Should count malformed chunks as rejected")
    void shouldCountRejectedChunks() {
        List<GridChunk> chunks = new ArrayList<>(Fixtures.chunks(3));
        chunks.add(GridChunk.of("bad", Fixtures.VARIABLE, new GridRange(0, 1, 0, 3), 1,
                new double[1], new double[3]));

        RunResult result = runner(new InMemoryCheckpointStore(), 2).run(Flux.fromIterable(chunks)).block();

        assertThat(result.rejected()).isEqualTo(1);
        assertThat(result.completedChunkIds()).doesNotContain("bad");
    }

    @Test
    @DisplayName("Should fail the run for an unconfigured variable without checkpointing")
    void shouldFailOnConfigurationError() {
        InMemoryCheckpointStore store = new InMemoryCheckpointStore();
        GridChunk unknown = GridChunk.of("apcp", "APCP", new GridRange(0, 1, 0, 1), 1,
                new double[]{1}, new double[]{1});

        StepVerifier.create(runner(store, 2).run(Flux.just(unknown)))
                .expectError(ConfigurationException.class)
                .verify();

        assertThat(store.saves()).isZero();
    }
}
