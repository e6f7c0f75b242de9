package io.logictree.cli.exception;

import java.io.Serial;

/// Thrown when a command is pointed at a dataset file that does not exist.
///
/// @see io.logictree.cli.commands.LogicTreeCommand
public class DatasetNotFoundException extends Exception {

    @Serial private static final long serialVersionUID = 4620153968830417725L;

    /// Creates an exception with the specified detail message.
    ///
    /// @param message description of the missing dataset, not null
    public DatasetNotFoundException(String message) {
        super(message);
    }
}
