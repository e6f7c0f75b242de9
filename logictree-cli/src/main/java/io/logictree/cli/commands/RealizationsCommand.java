package io.logictree.cli.commands;

import io.logictree.core.LogicTreeConfig;
import io.logictree.core.realization.Realization;
import io.logictree.core.tree.LogicTree;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.stream.Stream;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Prints the realizations of a saved logic tree.
///
/// With `--samples 0` every combination is enumerated; otherwise `n` realizations are
/// drawn by weighted sampling. Each line shows the ordinal, weight, path and values.
///
/// ### Usage
/// ```bash
/// logictree rlzs dataset.json                     # full enumeration
/// logictree rlzs dataset.json -n 100 --seed 7     # weighted sampling
/// ```
@Command(name = "rlzs", description = "Enumerate or sample the realizations of a logic tree")
class RealizationsCommand extends LogicTreeCommand {

    @Parameters(index = "0", description = "Dataset file written by import")
    private Path file;

    @Option(
            names = {"-n", "--samples"},
            defaultValue = "0",
            description = "Number of samples, 0 for full enumeration (default: ${DEFAULT-VALUE})")
    private int samples;

    @Option(
            names = {"--seed"},
            defaultValue = "42",
            description = "Seed of the first branch-set (default: ${DEFAULT-VALUE})")
    private long seed = LogicTreeConfig.DEFAULT_SEED;

    @Override
    protected int execute() {
        try {
            LogicTree tree = loadTree(file);

            System.out.printf("%-8s %-24s %-30s %s%n", "ORDINAL", "WEIGHT", "PATH", "VALUE");
            System.out.println("-".repeat(80));
            int count = 0;
            try (Stream<Realization> realizations = tree.generateRealizations(samples, seed)) {
                Iterator<Realization> it = realizations.iterator();
                while (it.hasNext()) {
                    Realization rlz = it.next();
                    System.out.printf(
                            "%-8d %-24s %-30s %s%n",
                            rlz.ordinal(),
                            rlz.weight(),
                            rlz.pathKey(),
                            String.join(", ", rlz.value()));
                    count++;
                }
            }
            String mode = samples == 0 ? "enumerated" : "sampled";
            System.out.println(" [OK] " + count + " realizations " + mode);
            return ExitCode.OK;
        } catch (Exception e) {
            System.err.println(" [FAIL] Realization generation failed: " + e.getMessage());
            return ExitCode.SOFTWARE;
        }
    }
}
