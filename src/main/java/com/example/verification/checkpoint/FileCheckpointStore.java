package com.example.verification.checkpoint;

import com.example.verification.aggregation.Accumulator;
import com.example.verification.exception.CheckpointCorruptException;
import com.example.verification.exception.VerificationException;
import com.example.verification.model.AccumulatorId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.HexFormat;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * {@link CheckpointStore} keeping one named snapshot as a file.
 *
 * <p>File layout: a header line {@code sha256=<hex>} followed by the JSON body
 * produced by {@link CheckpointCodec}. The digest covers the body bytes, so a
 * truncated or edited file is detected on load.
 *
 * <p>Saving writes a temporary file in the same directory, forces it to disk
 * and renames it over the previous snapshot, so readers only ever see the old
 * or the new snapshot in full.
 *
 * <p>Example usage:
 * <pre>{@code
 * CheckpointStore store = new FileCheckpointStore(Path.of("/output/checkpoints"), "TMP_2m_00Z");
 * store.save(accumulators.snapshot(), completedChunkIds);
 * Optional<CheckpointRecord> resumed = store.load();
 * }</pre>
 */
public final class FileCheckpointStore implements CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(FileCheckpointStore.class);

    private static final String SUFFIX = ".checkpoint";
    private static final String HEADER_PREFIX = "sha256=";

    private final Path file;
    private final CheckpointCodec codec;
    private long lastSequence = -1;

    public FileCheckpointStore(Path directory, String name) throws IOException {
        this(directory, name, new CheckpointCodec());
    }

    public FileCheckpointStore(Path directory, String name, CheckpointCodec codec) throws IOException {
        Files.createDirectories(directory);
        this.file = directory.resolve(name + SUFFIX);
        this.codec = codec;
    }

    @Override
    public synchronized long save(Collection<Accumulator> accumulators, Set<String> completedChunkIds)
            throws IOException {
        long sequence = nextSequence();
        List<AccumulatorSnapshot> snapshots = new ArrayList<>(accumulators.size());
        for (Accumulator accumulator : accumulators) {
            snapshots.add(AccumulatorSnapshot.of(accumulator));
        }
        CheckpointRecord record = new CheckpointRecord(
                CheckpointCodec.SCHEMA_VERSION, sequence, completedChunkIds, snapshots);

        byte[] body = codec.encode(record);
        byte[] header = (HEADER_PREFIX + digest(body) + "\n").getBytes(StandardCharsets.US_ASCII);

        Path tmp = Files.createTempFile(file.getParent(), file.getFileName().toString(), ".tmp");
        try {
            try (FileChannel channel = FileChannel.open(tmp, StandardOpenOption.WRITE,
                    StandardOpenOption.TRUNCATE_EXISTING)) {
                writeFully(channel, ByteBuffer.wrap(header));
                writeFully(channel, ByteBuffer.wrap(body));
                channel.force(true);
            }
            moveIntoPlace(tmp);
        } finally {
            Files.deleteIfExists(tmp);
        }

        lastSequence = sequence;
        log.info("checkpoint.saved path={} seq={} accumulators={} chunks={}",
                file, sequence, snapshots.size(), record.completedChunkIds().size());
        return sequence;
    }

    @Override
    public synchronized Optional<CheckpointRecord> load() throws IOException {
        if (!Files.exists(file)) {
            log.info("checkpoint.missing path={}", file);
            return Optional.empty();
        }
        CheckpointRecord record = read();
        lastSequence = record.sequenceNumber();
        log.info("checkpoint.loaded path={} seq={} accumulators={} chunks={}",
                file, record.sequenceNumber(), record.accumulators().size(), record.completedChunkIds().size());
        return Optional.of(record);
    }

    @Override
    public boolean exists() {
        return Files.exists(file);
    }

    @Override
    public synchronized void delete() throws IOException {
        if (Files.deleteIfExists(file)) {
            log.info("checkpoint.deleted path={}", file);
        }
        lastSequence = 0;
    }

    public Path path() {
        return file;
    }

    private CheckpointRecord read() throws IOException {
        byte[] bytes = Files.readAllBytes(file);
        int newline = indexOf(bytes, (byte) '\n');
        if (newline < 0) {
            throw new CheckpointCorruptException("checkpoint " + file + " has no header");
        }
        String header = new String(bytes, 0, newline, StandardCharsets.US_ASCII);
        if (!header.startsWith(HEADER_PREFIX)) {
            throw new CheckpointCorruptException("checkpoint " + file + " has an unknown header");
        }
        byte[] body = Arrays.copyOfRange(bytes, newline + 1, bytes.length);
        if (!header.substring(HEADER_PREFIX.length()).equals(digest(body))) {
            throw new CheckpointCorruptException("checkpoint " + file + " failed its integrity check");
        }

        CheckpointRecord record = codec.decode(body);
        validate(record);
        return record;
    }

    private void validate(CheckpointRecord record) throws CheckpointCorruptException {
        if (record.sequenceNumber() < 1) {
            throw new CheckpointCorruptException("checkpoint " + file + " has invalid sequence " + record.sequenceNumber());
        }
        Set<AccumulatorId> seen = new HashSet<>();
        for (AccumulatorSnapshot snapshot : record.accumulators()) {
            if (!seen.add(snapshot.id())) {
                throw new CheckpointCorruptException("checkpoint " + file + " holds " + snapshot.id() + " twice");
            }
            if (!snapshot.state().hasShapeOf(snapshot.config())) {
                throw new CheckpointCorruptException(
                        "checkpoint " + file + " state of " + snapshot.id() + " does not match its configuration");
            }
            Optional<String> defect = snapshot.state().defect();
            if (defect.isPresent()) {
                throw new CheckpointCorruptException(
                        "checkpoint " + file + " state of " + snapshot.id() + " is malformed: " + defect.get());
            }
            try {
                snapshot.toAccumulator();
            } catch (RuntimeException e) {
                throw new CheckpointCorruptException(
                        "checkpoint " + file + " cannot restore " + snapshot.id() + ": " + e.getMessage(), e);
            }
        }
    }

    private long nextSequence() {
        if (lastSequence < 0) {
            lastSequence = peekSequence();
        }
        return lastSequence + 1;
    }

    /**
     * Sequence of the snapshot on disk, 0 if there is none or it cannot be read.
     * An unreadable snapshot is about to be replaced, so it only restarts numbering.
     */
    private long peekSequence() {
        if (!Files.exists(file)) {
            return 0;
        }
        try {
            return read().sequenceNumber();
        } catch (IOException e) {
            log.warn("checkpoint.sequence_unreadable path={} error={}", file, e.getMessage());
            return 0;
        }
    }

    private void moveIntoPlace(Path tmp) throws IOException {
        try {
            Files.move(tmp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            log.warn("checkpoint.atomic_move_unsupported path={}", file);
            Files.move(tmp, file, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void writeFully(FileChannel channel, ByteBuffer buffer) throws IOException {
        while (buffer.hasRemaining()) {
            channel.write(buffer);
        }
    }

    private static int indexOf(byte[] bytes, byte b) {
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == b) {
                return i;
            }
        }
        return -1;
    }

    private static String digest(byte[] body) {
        try {
            return HexFormat.of().formatHex(MessageDigest.getInstance("SHA-256").digest(body));
        } catch (NoSuchAlgorithmException e) {
            throw new VerificationException("SHA-256 is not available", e);
        }
    }
}
