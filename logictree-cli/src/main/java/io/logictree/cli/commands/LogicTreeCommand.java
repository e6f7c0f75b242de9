package io.logictree.cli.commands;

import io.logictree.cli.exception.DatasetNotFoundException;
import io.logictree.core.LogicTreeConfig;
import io.logictree.core.exception.InvalidLogicTreeException;
import io.logictree.core.tree.LogicTree;
import io.logictree.serialization.JsonFileDatasetStore;
import io.logictree.serialization.LogicTreeCodec;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.Callable;
import picocli.CommandLine.ExitCode;
import picocli.CommandLine.Option;

/// Base class for all logic tree CLI commands.
///
/// Owns the {@link #call()} / {@link #execute()} contract and the options shared by every
/// command that reads or writes a dataset file.
///
/// ### Exit codes
/// - `0` ({@link ExitCode#OK}) when the command succeeds
/// - `1` ({@link ExitCode#SOFTWARE}) after a ` [FAIL]` line on stderr
/// - `2` ({@link ExitCode#USAGE}) for invalid arguments, reported by picocli
///
/// ### Defaults
/// Option defaults come from `logictree-cli.properties` on the classpath, keyed by the long
/// option name without dashes (`name`, `lenient`, `seed`, `samples`). The annotation
/// defaults apply when the file does not set a key.
///
/// ### Lenient trees
/// A tree imported with `--lenient` keeps `applyToBranches` ids that its parent lacks, so
/// reading it back needs `--lenient` as well.
///
/// @implNote Subclasses must be package-private and annotated with `@Command`.
/// @see ImportCommand
/// @see ShowCommand
/// @see RealizationsCommand
/// @see LeavesCommand
public abstract class LogicTreeCommand implements Callable<Integer> {

    static final String DEFAULT_NAME = "lt";

    @Option(
            names = {"--name"},
            defaultValue = DEFAULT_NAME,
            description = "Slot prefix of the tree in the dataset file (default: ${DEFAULT-VALUE})")
    protected String name = DEFAULT_NAME;

    @Option(
            names = {"--lenient"},
            description = "Warn instead of failing when applyToBranches names unknown branches")
    protected boolean lenient;

    @Override
    public final Integer call() {
        return execute();
    }

    /// Runs the command.
    ///
    /// @return {@link ExitCode#OK}, or {@link ExitCode#SOFTWARE} after reporting a failure
    protected abstract int execute();

    /// Returns the tree configuration selected by the shared options.
    ///
    /// @return new configuration, never null
    protected LogicTreeConfig config() {
        return LogicTreeConfig.builder().strictApplyToBranches(!lenient).build();
    }

    /// Loads the tree saved under {@link #name} in a dataset file.
    ///
    /// @param file dataset file written by `import`, not null
    /// @param config configuration of the loaded tree, not null
    /// @return decoded and re-linked tree, never null
    /// @throws DatasetNotFoundException if the file does not exist
    protected LogicTree loadTree(Path file, LogicTreeConfig config)
            throws DatasetNotFoundException {
        if (!Files.isRegularFile(file)) {
            throw new DatasetNotFoundException("Dataset file not found: " + file);
        }
        return LogicTreeCodec.load(JsonFileDatasetStore.open(file), name, config);
    }

    /// Loads the tree saved under {@link #name} with the configuration from {@link #config()}.
    ///
    /// @param file dataset file written by `import`, not null
    /// @return decoded and re-linked tree, never null
    /// @throws DatasetNotFoundException if the file does not exist
    /// @throws InvalidLogicTreeException if the stored tree does not link; the message
    /// points at `--lenient` when it was not given
    protected LogicTree loadTree(Path file) throws DatasetNotFoundException {
        try {
            return loadTree(file, config());
        } catch (InvalidLogicTreeException e) {
            if (lenient) {
                throw e;
            }
            throw new InvalidLogicTreeException(
                    e.getMessage() + " (use --lenient for trees imported with --lenient)", e);
        }
    }
}
