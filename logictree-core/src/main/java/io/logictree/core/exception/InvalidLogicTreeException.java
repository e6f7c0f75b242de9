package io.logictree.core.exception;

import java.io.Serial;

/// Thrown when a logic tree definition breaks a structural rule.
///
/// Common causes:
/// - A legacy branching level holding more (or fewer) than one branch-set
/// - Duplicate branch-set ids, or duplicate branch ids within one branch-set
/// - An `applyToBranches` filter naming branches absent from the parent branch-set
/// - An empty tree or an empty branch-set
///
/// The whole build aborts; no partially linked tree is ever returned.
public class InvalidLogicTreeException extends LogicTreeException {

    @Serial private static final long serialVersionUID = -2851461309957032117L;

    /// Creates exception with message.
    ///
    /// @param message description of the broken rule
    public InvalidLogicTreeException(String message) {
        super(message);
    }

    /// Creates exception with message and cause.
    ///
    /// @param message description of the broken rule
    /// @param cause the underlying exception
    public InvalidLogicTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
