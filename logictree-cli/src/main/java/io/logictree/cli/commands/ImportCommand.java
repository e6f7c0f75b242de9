package io.logictree.cli.commands;

import io.logictree.cli.xml.XmlSourceReader;
import io.logictree.core.source.LogicTreeReader;
import io.logictree.core.source.SourceNode;
import io.logictree.core.tree.LogicTree;
import io.logictree.serialization.JsonFileDatasetStore;
import io.logictree.serialization.LogicTreeCodec;
import java.nio.file.Path;
import picocli.CommandLine.Command;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

/// Reads a logic tree XML document and saves it into a dataset file.
///
/// ### Usage
/// ```bash
/// logictree import source_model_logic_tree.xml -o dataset.json [--name lt] [--lenient]
/// ```
@Command(name = "import", description = "Import a logic tree XML document into a dataset file")
class ImportCommand extends LogicTreeCommand {

    @Parameters(index = "0", description = "Logic tree XML document")
    private Path source;

    @Option(
            names = {"-o", "--output"},
            required = true,
            description = "Dataset file to write")
    private Path output;

    @Override
    protected int execute() {
        try {
            SourceNode root = XmlSourceReader.read(source);
            LogicTree tree = new LogicTreeReader(config()).read(source.toString(), root);

            LogicTreeCodec.save(tree, JsonFileDatasetStore.open(output), name);

            System.out.println(" [OK] Imported " + tree);
            System.out.println("   Branch-sets: " + tree.getBranchSets().size());
            System.out.println("   Saved as: " + name + " in " + output);
            return ExitCode.OK;
        } catch (Exception e) {
            System.err.println(" [FAIL] Import failed: " + e.getMessage());
            return ExitCode.SOFTWARE;
        }
    }
}
