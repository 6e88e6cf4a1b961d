package com.example.verification.checkpoint;

import com.example.verification.exception.CheckpointCorruptException;
import com.example.verification.model.AccumulatorId;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.util.Map;
import java.util.function.UnaryOperator;

/**
 * JSON encoding of {@link CheckpointRecord} with explicit schema migrations.
 *
 * <p>Older snapshots are read as a JSON tree and upgraded one version at a time
 * by a registered migration before binding. A version with no migration path,
 * or newer than this code, is rejected instead of being read optimistically.
 *
 * <p>Schema history:
 * <ul>
 *   <li>1: accumulator ids had no temporal group</li>
 *   <li>2: accumulator ids carry {@code group}</li>
 * </ul>
 */
public class CheckpointCodec {

    public static final int SCHEMA_VERSION = 2;

    private final ObjectMapper objectMapper;
    private final Map<Integer, UnaryOperator<ObjectNode>> migrations;

    public CheckpointCodec() {
        this(new ObjectMapper());
    }

    public CheckpointCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.migrations = Map.of(1, CheckpointCodec::addDefaultGroup);
    }

    public byte[] encode(CheckpointRecord record) throws IOException {
        return objectMapper.writeValueAsBytes(record);
    }

    /**
     * Parses, migrates and binds a snapshot body.
     *
     * @throws CheckpointCorruptException if the body is not a readable snapshot of a supported version
     */
    public CheckpointRecord decode(byte[] body) throws CheckpointCorruptException {
        JsonNode tree;
        try {
            tree = objectMapper.readTree(body);
        } catch (IOException e) {
            throw new CheckpointCorruptException("checkpoint body is not valid JSON", e);
        }
        if (tree == null || !tree.isObject()) {
            throw new CheckpointCorruptException("checkpoint body is not a JSON object");
        }
        JsonNode versionNode = tree.get("schemaVersion");
        if (versionNode == null || !versionNode.canConvertToInt()) {
            throw new CheckpointCorruptException("checkpoint has no schema version");
        }

        ObjectNode node = (ObjectNode) tree;
        int version = versionNode.asInt();
        if (version > SCHEMA_VERSION) {
            throw new CheckpointCorruptException(
                    "checkpoint schema " + version + " is newer than supported " + SCHEMA_VERSION);
        }
        while (version < SCHEMA_VERSION) {
            UnaryOperator<ObjectNode> migration = migrations.get(version);
            if (migration == null) {
                throw new CheckpointCorruptException("no migration from checkpoint schema " + version);
            }
            node = migration.apply(node);
            version++;
            node.put("schemaVersion", version);
        }

        try {
            return objectMapper.treeToValue(node, CheckpointRecord.class);
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new CheckpointCorruptException("checkpoint does not match schema " + SCHEMA_VERSION, e);
        }
    }

    private static ObjectNode addDefaultGroup(ObjectNode node) {
        JsonNode accumulators = node.get("accumulators");
        if (accumulators != null) {
            for (JsonNode accumulator : accumulators) {
                JsonNode id = accumulator.get("id");
                if (id instanceof ObjectNode && !id.has("group")) {
                    ((ObjectNode) id).put("group", AccumulatorId.DEFAULT_GROUP);
                }
            }
        }
        return node;
    }
}
