package com.example.verification.processing;

import com.example.verification.aggregation.AccumulatorFactory;
import com.example.verification.checkpoint.CheckpointStore;
import com.example.verification.model.CompletenessPolicy;
import com.example.verification.qc.CompletenessCheck;
import com.example.verification.qc.CompletenessReport;
import com.example.verification.routing.ChunkRouter;
import com.example.verification.routing.VerificationChunk;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Sequential run over a chunk sequence with periodic checkpoints.
 *
 * <p>{@link #run} resumes from whatever the store holds: restored accumulators
 * are kept and chunks recorded as completed are skipped, so an interrupted run
 * continued this way ends in the same state as an uninterrupted one. A snapshot
 * is written after every {@code checkpointEvery} applied chunks and once at the
 * end. Finished accumulators are checked against a {@link CompletenessPolicy}
 * and the entities short of samples are reported in the result.
 *
 * <p>Example usage:
 * <pre>{@code
 * VerificationRun run = new VerificationRun(router, factory, store, 50);
 * RunResult result = run.run(chunks);
 * result.accumulators().toRecords().forEach(writer::write);
 * }</pre>
 */
public class VerificationRun {

    private static final Logger log = LoggerFactory.getLogger(VerificationRun.class);

    private final ChunkRouter router;
    private final AccumulatorFactory factory;
    private final CheckpointStore store;
    private final int checkpointEvery;
    private final CompletenessCheck completenessCheck;
    private final AtomicBoolean stopRequested = new AtomicBoolean();

    public VerificationRun(ChunkRouter router, AccumulatorFactory factory, CheckpointStore store,
                           int checkpointEvery) {
        this(router, factory, store, checkpointEvery, CompletenessPolicy.defaults());
    }

    public VerificationRun(ChunkRouter router, AccumulatorFactory factory, CheckpointStore store,
                           int checkpointEvery, CompletenessPolicy completenessPolicy) {
        if (checkpointEvery < 1) {
            throw new IllegalArgumentException("checkpointEvery must be >= 1, got " + checkpointEvery);
        }
        this.router = router;
        this.factory = factory;
        this.store = store;
        this.checkpointEvery = checkpointEvery;
        this.completenessCheck = new CompletenessCheck(completenessPolicy);
    }

    /**
     * Runs from the last checkpoint, or from scratch if there is none.
     *
     * @throws com.example.verification.exception.CheckpointCorruptException if the stored snapshot is invalid
     * @throws IOException if the store cannot be read or written
     */
    public RunResult run(Iterable<? extends VerificationChunk> chunks) throws IOException {
        return execute(ResumePoint.load(store, factory), chunks);
    }

    /**
     * Runs from empty accumulators, ignoring and eventually replacing any stored snapshot.
     */
    public RunResult runFromScratch(Iterable<? extends VerificationChunk> chunks) throws IOException {
        log.info("run.from_scratch");
        return execute(ResumePoint.fresh(factory), chunks);
    }

    /**
     * Asks the run to stop after the chunk in progress. The run then writes a
     * final checkpoint and returns normally with {@link RunResult#stopped()} set.
     * The request is cleared when that run returns, so a later {@link #run} on
     * this instance resumes normally.
     */
    public void requestStop() {
        stopRequested.set(true);
    }

    private RunResult execute(ResumePoint resume, Iterable<? extends VerificationChunk> chunks) throws IOException {
        try {
            return process(resume, chunks);
        } finally {
            stopRequested.set(false);
        }
    }

    private RunResult process(ResumePoint resume, Iterable<? extends VerificationChunk> chunks) throws IOException {
        ChunkProcessor processor = new ChunkProcessor(router, resume.accumulators(), resume.completedChunkIds());
        int applied = 0;
        int skipped = 0;
        int rejected = 0;
        int sinceCheckpoint = 0;
        long sequence = 0;
        boolean stopped = false;

        log.info("run.started restored_accumulators={} restored_chunks={}",
                resume.accumulators().size(), resume.completedChunkIds().size());

        for (VerificationChunk chunk : chunks) {
            if (stopRequested.get()) {
                stopped = true;
                break;
            }
            ChunkOutcome outcome = processor.process(chunk);
            if (outcome == ChunkOutcome.APPLIED) {
                applied++;
                sinceCheckpoint++;
            } else if (outcome == ChunkOutcome.SKIPPED) {
                skipped++;
            } else {
                rejected++;
            }
            if (sinceCheckpoint >= checkpointEvery) {
                sequence = store.save(processor.accumulators().snapshot(), processor.completedChunkIds());
                sinceCheckpoint = 0;
            }
        }

        if (sinceCheckpoint > 0) {
            sequence = store.save(processor.accumulators().snapshot(), processor.completedChunkIds());
        }
        if (stopped) {
            log.warn("run.stopped applied={} skipped={} rejected={}", applied, skipped, rejected);
        } else {
            log.info("run.finished applied={} skipped={} rejected={} accumulators={}",
                    applied, skipped, rejected, processor.accumulators().size());
        }
        CompletenessReport completeness = stopped
                ? CompletenessReport.empty()
                : completenessCheck.checkAll(processor.accumulators());
        return new RunResult(processor.accumulators(), processor.completedChunkIds(),
                applied, skipped, rejected, stopped, sequence, completeness);
    }
}
