package io.logictree.cli.commands;

import io.logictree.core.tree.Branch;
import io.logictree.core.tree.BranchSet;
import io.logictree.core.tree.LinkedTraversal;
import io.logictree.core.tree.LogicTree;
import java.nio.file.Path;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Parameters;

/// Lists the leaves reachable from one branch through the linked view of a saved tree.
///
/// ### Usage
/// ```bash
/// logictree leaves dataset.json bs1 b1
/// ```
@Command(name = "leaves", description = "List the leaves reachable from a branch")
class LeavesCommand extends LogicTreeCommand {

    @Parameters(index = "0", description = "Dataset file written by import")
    private Path file;

    @Parameters(index = "1", description = "Branch-set id")
    private String branchSetId;

    @Parameters(index = "2", description = "Branch id")
    private String branchId;

    @Override
    protected int execute() {
        try {
            LogicTree tree = loadTree(file);
            BranchSet branchSet =
                    tree.getBranchSet(branchSetId)
                            .orElseThrow(
                                    () ->
                                            new IllegalArgumentException(
                                                    "Unknown branch-set '" + branchSetId + "'"));
            Branch start =
                    branchSet
                            .findBranch(branchId)
                            .orElseThrow(
                                    () ->
                                            new IllegalArgumentException(
                                                    "Unknown branch '"
                                                            + branchId
                                                            + "' in branch-set '"
                                                            + branchSetId
                                                            + "'"));

            for (Branch leaf : LinkedTraversal.enumerateLeaves(start)) {
                System.out.printf(
                        "  %s/%s  %s%n",
                        leaf.getBranchSetId(), leaf.getBranchId(), leaf.getUncertainty());
            }
            System.out.println(
                    " [OK] "
                            + LinkedTraversal.countRealizations(start)
                            + " paths below "
                            + branchSetId
                            + "/"
                            + branchId);
            return ExitCode.OK;
        } catch (Exception e) {
            System.err.println(" [FAIL] Leaf enumeration failed: " + e.getMessage());
            return ExitCode.SOFTWARE;
        }
    }
}
