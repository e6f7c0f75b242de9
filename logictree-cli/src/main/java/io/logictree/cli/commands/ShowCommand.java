package io.logictree.cli.commands;

import io.logictree.core.tree.Branch;
import io.logictree.core.tree.BranchSet;
import io.logictree.core.tree.LogicTree;
import java.nio.file.Path;
import java.util.Objects;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Parameters;

/// Prints the structure of a saved logic tree.
///
/// Lists every branch-set with its uncertainty type, filter and branches, followed by the
/// flat and linked realization counts. A warning is printed when the two counts differ,
/// which happens whenever an `applyToBranches` filter leaves some parent branch unlinked.
///
/// ### Usage
/// ```bash
/// logictree show dataset.json [--name lt] [--lenient]
/// ```
@Command(name = "show", description = "Show the branch-sets of a saved logic tree")
class ShowCommand extends LogicTreeCommand {

    @Parameters(index = "0", description = "Dataset file written by import")
    private Path file;

    @Override
    protected int execute() {
        try {
            LogicTree tree = loadTree(file);

            System.out.println(tree);
            for (BranchSet branchSet : tree.getBranchSets().values()) {
                System.out.printf(
                        "  %s (%s)%s%n",
                        branchSet.getId(),
                        Objects.requireNonNullElse(branchSet.getUncertaintyType(), "?"),
                        branchSet
                                .getApplyToBranches()
                                .map(ids -> " applies to " + ids)
                                .orElse(""));
                for (Branch branch : branchSet.getBranches()) {
                    System.out.printf(
                            "    %-12s %-30s %s%n",
                            branch.getBranchId(), branch.getUncertainty(), branch.getWeight());
                }
            }

            long flat = tree.flatPathCount();
            long linked = tree.countLinkedRealizations();
            System.out.println("   Full enumeration: " + flat + " realizations");
            System.out.println("   Linked paths: " + linked);
            if (flat != linked) {
                System.out.println(
                        " [WARN] applyToBranches filters are not applied by full enumeration");
            }
            return ExitCode.OK;
        } catch (Exception e) {
            System.err.println(" [FAIL] Show failed: " + e.getMessage());
            return ExitCode.SOFTWARE;
        }
    }
}
