package io.logictree.serialization;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.logictree.core.LogicTreeConfig;
import io.logictree.core.exception.LogicTreeFormatException;
import io.logictree.core.storage.BranchRecord;
import io.logictree.core.storage.DatasetStore;
import io.logictree.core.tree.Branch;
import io.logictree.core.tree.BranchSet;
import io.logictree.core.tree.LogicTree;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Converts logic trees to and from their persisted form.
///
/// A tree is stored as two pieces:
/// - a flat list of {@link BranchRecord}s, concatenated in branch-set then branch order
/// - a JSON blob mapping each `bsid` to its attributes, without the `bsid` key itself
///
/// Decoding groups the records by `bsid` in order of first appearance, rebuilds each
/// branch-set with the attributes found in the blob, and re-runs linking, so
/// `decode(encode(tree))` equals `tree` including its child links.
///
/// ### Usage
/// {@snippet :
/// // Encode / decode
/// EncodedLogicTree encoded = LogicTreeCodec.encode(tree);
/// LogicTree restored = LogicTreeCodec.decode(encoded);
///
/// // Through a store
/// LogicTreeCodec.save(tree, store, "source_model_lt");
/// LogicTree reloaded = LogicTreeCodec.load(store, "source_model_lt");
/// }
///
/// @implNote Thread-safe. The mapper is created per call via `createMapper()`.
///
/// @see LogicTreeJacksonModule for the registered type handlers
public final class LogicTreeCodec {

    private static final Logger logger = Logger.getLogger(LogicTreeCodec.class.getName());

    public static final String BRANCHES_SLOT = "branches";
    public static final String BRANCH_SETS_SLOT = "branchsets";

    private static final TypeReference<LinkedHashMap<String, LinkedHashMap<String, String>>>
            ATTRIBUTES_TYPE = new TypeReference<>() {};

    private LogicTreeCodec() {}

    /// Encodes a tree.
    ///
    /// @param tree the tree to encode, not null
    /// @return records plus attributes blob, never null
    /// @throws LogicTreeFormatException if the attributes cannot be serialized
    public static EncodedLogicTree encode(LogicTree tree) {
        Objects.requireNonNull(tree, "tree must not be null");
        Map<String, Map<String, String>> attributesById = new LinkedHashMap<>();
        List<BranchRecord> records = new ArrayList<>();

        for (BranchSet branchSet : tree.getBranchSets().values()) {
            Map<String, String> attributes = new LinkedHashMap<>(branchSet.getAttributes());
            attributes.remove(BranchSet.BSID);
            attributesById.put(branchSet.getId(), attributes);
            for (Branch branch : branchSet.getBranches()) {
                records.add(BranchRecord.of(branch));
            }
        }

        try {
            String blob = createMapper().writeValueAsString(attributesById);
            return new EncodedLogicTree(records, blob);
        } catch (JsonProcessingException e) {
            throw new LogicTreeFormatException(
                    "Failed to serialize branch-set attributes: " + e.getMessage(), e);
        }
    }

    /// Decodes a tree with the default configuration.
    ///
    /// @param encoded persisted form, not null
    /// @return rebuilt and re-linked tree, never null
    /// @throws LogicTreeFormatException if the blob is unreadable or out of sync with the
    /// records
    public static LogicTree decode(EncodedLogicTree encoded) {
        return decode(encoded, LogicTreeConfig.defaults());
    }

    /// Decodes a tree.
    ///
    /// @param encoded persisted form, not null
    /// @param config configuration of the rebuilt tree, not null
    /// @return rebuilt and re-linked tree, never null
    /// @throws LogicTreeFormatException if the blob is unreadable or out of sync with the
    /// records
    public static LogicTree decode(EncodedLogicTree encoded, LogicTreeConfig config) {
        Objects.requireNonNull(encoded, "encoded must not be null");
        Map<String, LinkedHashMap<String, String>> attributesById =
                readAttributes(encoded.branchSets());

        Map<String, BranchSet.Builder> groups = new LinkedHashMap<>();
        for (BranchRecord record : encoded.branches()) {
            BranchSet.Builder builder =
                    groups.computeIfAbsent(
                            record.bsid(),
                            bsid -> {
                                Map<String, String> attributes = attributesById.get(bsid);
                                if (attributes == null) {
                                    throw new LogicTreeFormatException(
                                            "No attributes stored for branch-set '" + bsid + "'");
                                }
                                return BranchSet.builder(bsid).attributes(attributes);
                            });
            try {
                builder.branch(record.brid(), record.uncertainty(), record.weight());
            } catch (IllegalArgumentException e) {
                throw new LogicTreeFormatException("Invalid stored branch " + record, e);
            }
        }

        for (String bsid : attributesById.keySet()) {
            if (!groups.containsKey(bsid)) {
                throw new LogicTreeFormatException(
                        "Attributes stored for branch-set '" + bsid + "' without any branch");
            }
        }

        List<BranchSet> branchSets = new ArrayList<>(groups.size());
        for (BranchSet.Builder builder : groups.values()) {
            branchSets.add(builder.build());
        }
        return new LogicTree(branchSets, config);
    }

    /// Encodes a tree and writes it to the `<name>/branches` and `<name>/branchsets` slots
    /// in a single {@link DatasetStore#putAll} call.
    ///
    /// @param tree the tree to save, not null
    /// @param store destination store, not null
    /// @param name slot prefix, not null
    public static void save(LogicTree tree, DatasetStore store, String name) {
        Objects.requireNonNull(store, "store must not be null");
        Objects.requireNonNull(name, "name must not be null");
        EncodedLogicTree encoded = encode(tree);
        store.putAll(
                Map.of(slot(name, BRANCHES_SLOT), encoded.branches()),
                Map.of(slot(name, BRANCH_SETS_SLOT), encoded.branchSets()));
        logger.info(
                "Saved "
                        + tree
                        + " as '"
                        + name
                        + "' ("
                        + encoded.branches().size()
                        + " branches)");
    }

    /// Reads a tree saved by {@link #save}, with the default configuration.
    ///
    /// @param store source store, not null
    /// @param name slot prefix, not null
    /// @return rebuilt tree, never null
    /// @throws LogicTreeFormatException if either slot is missing or the content is invalid
    public static LogicTree load(DatasetStore store, String name) {
        return load(store, name, LogicTreeConfig.defaults());
    }

    /// Reads a tree saved by {@link #save}.
    ///
    /// @param store source store, not null
    /// @param name slot prefix, not null
    /// @param config configuration of the rebuilt tree, not null
    /// @return rebuilt tree, never null
    /// @throws LogicTreeFormatException if either slot is missing or the content is invalid
    public static LogicTree load(DatasetStore store, String name, LogicTreeConfig config) {
        Objects.requireNonNull(store, "store must not be null");
        String branchesSlot = slot(name, BRANCHES_SLOT);
        String branchSetsSlot = slot(name, BRANCH_SETS_SLOT);
        List<BranchRecord> records =
                store.getRecords(branchesSlot)
                        .orElseThrow(
                                () ->
                                        new LogicTreeFormatException(
                                                "Missing slot '" + branchesSlot + "'"));
        String blob =
                store.getBlob(branchSetsSlot)
                        .orElseThrow(
                                () ->
                                        new LogicTreeFormatException(
                                                "Missing slot '" + branchSetsSlot + "'"));
        LogicTree tree = decode(new EncodedLogicTree(records, blob), config);
        logger.info("Loaded " + tree + " from '" + name + "'");
        return tree;
    }

    /// Returns the slot name used for one part of a saved tree.
    ///
    /// @param name slot prefix, not null
    /// @param part `branches` or `branchsets`
    /// @return `name + "/" + part`
    public static String slot(String name, String part) {
        return name + "/" + part;
    }

    /// Creates an ObjectMapper configured for logic tree serialization.
    ///
    /// Registers:
    /// - `LogicTreeJacksonModule` for compact branch records
    /// - `FAIL_ON_UNKNOWN_PROPERTIES` disabled for forward compatibility
    ///
    /// @return configured ObjectMapper, never null
    public static ObjectMapper createMapper() {
        return new ObjectMapper()
                .registerModule(new LogicTreeJacksonModule())
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    }

    private static Map<String, LinkedHashMap<String, String>> readAttributes(String blob) {
        try {
            Map<String, LinkedHashMap<String, String>> attributes =
                    createMapper().readValue(blob, ATTRIBUTES_TYPE);
            if (attributes == null) {
                throw new LogicTreeFormatException("Branch-set attributes blob is empty");
            }
            return attributes;
        } catch (JsonProcessingException e) {
            throw new LogicTreeFormatException(
                    "Failed to deserialize branch-set attributes: " + e.getMessage(), e);
        }
    }
}
