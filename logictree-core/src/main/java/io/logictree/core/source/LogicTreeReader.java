package io.logictree.core.source;

import io.logictree.core.LogicTreeConfig;
import io.logictree.core.exception.InvalidLogicTreeException;
import io.logictree.core.exception.LogicTreeFormatException;
import io.logictree.core.tree.BranchSet;
import io.logictree.core.tree.LogicTree;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Logger;

/// Builds a {@link LogicTree} from an already parsed {@link SourceNode} document.
///
/// ### Accepted shape
/// The root is either the document element (containing a `logicTree` child) or the
/// `logicTree` node itself. Each child of `logicTree` is one of:
/// - a legacy `logicTreeBranchingLevel`, which must hold exactly one branch-set
/// - a `logicTreeBranchSet`
///
/// Each branch-set holds `logicTreeBranch` children carrying a `branchID` attribute and
/// `uncertaintyModel` / `uncertaintyWeight` child elements.
///
/// ### Attribute normalization
/// The source `branchSetID` attribute becomes the canonical `bsid`; every other branch-set
/// attribute is passed through unchanged.
///
/// @implNote Stateless; safe to share across threads.
///
/// @see LogicTree for linking semantics
public class LogicTreeReader {

    private static final Logger logger = Logger.getLogger(LogicTreeReader.class.getName());

    static final String LOGIC_TREE = "logicTree";
    static final String BRANCHING_LEVEL = "logicTreeBranchingLevel";
    static final String BRANCH_SET = "logicTreeBranchSet";
    static final String BRANCH = "logicTreeBranch";
    static final String BRANCHING_LEVEL_ID = "branchingLevelID";
    static final String BRANCH_SET_ID = "branchSetID";
    static final String BRANCH_ID = "branchID";
    static final String UNCERTAINTY_MODEL = "uncertaintyModel";
    static final String UNCERTAINTY_WEIGHT = "uncertaintyWeight";

    private final LogicTreeConfig config;

    public LogicTreeReader() {
        this(LogicTreeConfig.defaults());
    }

    public LogicTreeReader(LogicTreeConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /// Reads a logic tree.
    ///
    /// @param sourceName name of the source document, used in error messages, not null
    /// @param root document element or `logicTree` node, not null
    /// @return linked logic tree, never null
    /// @throws InvalidLogicTreeException if a level does not hold exactly one branch-set or
    /// the resulting tree is malformed
    /// @throws LogicTreeFormatException if a node has an unexpected tag or lacks a required
    /// attribute or child
    public LogicTree read(String sourceName, SourceNode root) {
        Objects.requireNonNull(root, "root must not be null");
        SourceNode logicTree = findLogicTree(sourceName, root);

        List<BranchSet> branchSets = new ArrayList<>();
        for (SourceNode level : logicTree.children()) {
            SourceNode branchSetNode = singleBranchSet(sourceName, level);
            branchSets.add(readBranchSet(sourceName, branchSetNode));
        }
        if (branchSets.isEmpty()) {
            throw new InvalidLogicTreeException(sourceName + ": logic tree has no branch-sets");
        }

        LogicTree tree = new LogicTree(branchSets, config);
        logger.info("Read " + tree + " from " + sourceName);
        return tree;
    }

    private SourceNode findLogicTree(String sourceName, SourceNode root) {
        if (root.isA(LOGIC_TREE)) {
            return root;
        }
        return root.children().stream()
                .filter(c -> c.isA(LOGIC_TREE))
                .findFirst()
                .orElseThrow(
                        () ->
                                new LogicTreeFormatException(
                                        sourceName + ": expected a logicTree node in " + root));
    }

    // legacy documents wrap each branch-set in a branching level
    private SourceNode singleBranchSet(String sourceName, SourceNode node) {
        if (node.isA(BRANCHING_LEVEL)) {
            List<SourceNode> nodes = node.children();
            if (nodes.size() != 1) {
                throw new InvalidLogicTreeException(
                        sourceName
                                + ": Branching level "
                                + node.attribute(BRANCHING_LEVEL_ID)
                                + (nodes.isEmpty()
                                        ? " has no branchset"
                                        : " has multiple branchsets"));
            }
            SourceNode only = nodes.get(0);
            if (!only.isA(BRANCH_SET)) {
                throw new LogicTreeFormatException(
                        sourceName + ": Expected BranchSet inside BranchingLevel, got " + only);
            }
            return only;
        } else if (node.isA(BRANCH_SET)) {
            return node;
        }
        throw new LogicTreeFormatException(
                sourceName + ": Expected BranchingLevel/BranchSet, got " + node);
    }

    private BranchSet readBranchSet(String sourceName, SourceNode node) {
        String bsid = node.attribute(BRANCH_SET_ID);
        if (bsid == null || bsid.isBlank()) {
            throw new LogicTreeFormatException(
                    sourceName + ": branch-set without " + BRANCH_SET_ID + ": " + node);
        }

        try {
            BranchSet.Builder builder = BranchSet.builder(bsid);
            for (Map.Entry<String, String> attr : node.attributes().entrySet()) {
                if (!BRANCH_SET_ID.equals(attr.getKey())) {
                    builder.attribute(attr.getKey(), attr.getValue());
                }
            }
            for (SourceNode branchNode : node.children()) {
                readBranch(sourceName, bsid, branchNode, builder);
            }
            return builder.build();
        } catch (IllegalArgumentException e) {
            throw new InvalidLogicTreeException(sourceName + ": " + e.getMessage(), e);
        }
    }

    private void readBranch(
            String sourceName, String bsid, SourceNode node, BranchSet.Builder builder) {
        if (!node.isA(BRANCH)) {
            throw new LogicTreeFormatException(
                    sourceName + ": Expected Branch in branch-set " + bsid + ", got " + node);
        }
        String branchId = node.attribute(BRANCH_ID);
        if (branchId == null || branchId.isBlank()) {
            throw new LogicTreeFormatException(
                    sourceName + ": branch without " + BRANCH_ID + " in branch-set " + bsid);
        }
        String model = requiredText(sourceName, branchId, node, UNCERTAINTY_MODEL);
        String rawWeight = requiredText(sourceName, branchId, node, UNCERTAINTY_WEIGHT);

        double weight;
        try {
            weight = Double.parseDouble(rawWeight);
        } catch (NumberFormatException e) {
            throw new LogicTreeFormatException(
                    sourceName
                            + ": branch "
                            + branchId
                            + " has non-numeric "
                            + UNCERTAINTY_WEIGHT
                            + " '"
                            + rawWeight
                            + "'",
                    e);
        }
        builder.branch(branchId, model, weight);
    }

    private static String requiredText(
            String sourceName, String branchId, SourceNode node, String childName) {
        String text = node.child(childName).map(SourceNode::text).orElse(null);
        if (text == null || text.isBlank()) {
            throw new LogicTreeFormatException(
                    sourceName + ": branch " + branchId + " has no " + childName);
        }
        return text.trim();
    }
}
