package com.example.verification.processing;

import com.example.verification.aggregation.AccumulatorFactory;
import com.example.verification.aggregation.AccumulatorSet;
import com.example.verification.aggregation.Merger;
import com.example.verification.checkpoint.CheckpointStore;
import com.example.verification.model.CompletenessPolicy;
import com.example.verification.qc.CompletenessCheck;
import com.example.verification.routing.ChunkRouter;
import com.example.verification.routing.VerificationChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Parallel run over a chunk stream using Project Reactor.
 *
 * <p>Chunks are spread over {@code workers} rails. Each rail folds its chunks
 * into a private {@link AccumulatorSet}, so no accumulator is shared between
 * threads. When the stream completes, the rail sets are merged with the
 * restored checkpoint state through {@link Merger#mergeSets} and a single
 * checkpoint is written.
 *
 * <p>Chunks already completed in the checkpoint are filtered out before they
 * reach a rail, and a chunk id appearing twice in the stream is processed once.
 *
 * <p>Example usage:
 * <pre>{@code
 * ParallelVerificationRunner runner = new ParallelVerificationRunner(router, factory, store, 8);
 * RunResult result = runner.run(Flux.fromIterable(chunks)).block();
 * }</pre>
 */
public class ParallelVerificationRunner {

    private static final Logger log = LoggerFactory.getLogger(ParallelVerificationRunner.class);

    private final ChunkRouter router;
    private final AccumulatorFactory factory;
    private final CheckpointStore store;
    private final int workers;
    private final Scheduler scheduler;
    private final CompletenessCheck completenessCheck;

    public ParallelVerificationRunner(ChunkRouter router, AccumulatorFactory factory, CheckpointStore store,
                                      int workers) {
        this(router, factory, store, workers, Schedulers.parallel(), CompletenessPolicy.defaults());
    }

    public ParallelVerificationRunner(ChunkRouter router, AccumulatorFactory factory, CheckpointStore store,
                                      int workers, Scheduler scheduler, CompletenessPolicy completenessPolicy) {
        if (workers < 1) {
            throw new IllegalArgumentException("workers must be >= 1, got " + workers);
        }
        this.router = router;
        this.factory = factory;
        this.store = store;
        this.workers = workers;
        this.scheduler = scheduler;
        this.completenessCheck = new CompletenessCheck(completenessPolicy);
    }

    /**
     * Processes the chunks and emits the merged result after the checkpoint is written.
     * Errors from the store or from a worker terminate the returned Mono.
     */
    public Mono<RunResult> run(Flux<? extends VerificationChunk> chunks) {
        return Mono.fromCallable(() -> ResumePoint.load(store, factory))
                .subscribeOn(Schedulers.boundedElastic())
                .flatMap(resume -> process(resume, chunks));
    }

    private Mono<RunResult> process(ResumePoint resume, Flux<? extends VerificationChunk> chunks) {
        AtomicInteger skipped = new AtomicInteger();
        return chunks
                .filter(chunk -> {
                    if (resume.completedChunkIds().contains(chunk.chunkId())) {
                        skipped.incrementAndGet();
                        return false;
                    }
                    return true;
                })
                .distinct(VerificationChunk::chunkId)
                .parallel(workers)
                .runOn(scheduler)
                .reduce(() -> new Worker(router, factory), Worker::accept)
                .sequential()
                .collectList()
                .map(rails -> combine(resume, rails, skipped.get()))
                .flatMap(this::checkpoint);
    }

    private RunResult combine(ResumePoint resume, List<Worker> rails, int skipped) {
        List<AccumulatorSet> sets = new ArrayList<>(rails.size() + 1);
        sets.add(resume.accumulators());
        Set<String> completed = new LinkedHashSet<>(resume.completedChunkIds());
        int applied = 0;
        int rejected = 0;
        for (Worker rail : rails) {
            sets.add(rail.processor.accumulators());
            completed.addAll(rail.processor.completedChunkIds());
            applied += rail.applied;
            rejected += rail.rejected;
        }
        AccumulatorSet merged = Merger.mergeSets(factory, sets);
        return new RunResult(merged, completed, applied, skipped, rejected, false, 0,
                completenessCheck.checkAll(merged));
    }

    private Mono<RunResult> checkpoint(RunResult result) {
        return Mono.fromCallable(() -> {
                    long sequence = store.save(result.accumulators().snapshot(), result.completedChunkIds());
                    log.info("parallel_run.finished workers={} applied={} skipped={} rejected={} seq={}",
                            workers, result.applied(), result.skipped(), result.rejected(), sequence);
                    return new RunResult(result.accumulators(), result.completedChunkIds(),
                            result.applied(), result.skipped(), result.rejected(), false, sequence,
                            result.completeness());
                })
                .subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * State of one rail. Only ever touched by the rail's own thread.
     */
    private static final class Worker {
        private final ChunkProcessor processor;
        private int applied;
        private int rejected;

        Worker(ChunkRouter router, AccumulatorFactory factory) {
            this.processor = new ChunkProcessor(router, new AccumulatorSet(factory));
        }

        Worker accept(VerificationChunk chunk) {
            ChunkOutcome outcome = processor.process(chunk);
            if (outcome == ChunkOutcome.APPLIED) {
                applied++;
            } else if (outcome == ChunkOutcome.REJECTED) {
                rejected++;
            }
            return this;
        }
    }
}
