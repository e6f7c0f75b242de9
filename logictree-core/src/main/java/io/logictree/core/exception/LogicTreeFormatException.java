package io.logictree.core.exception;

import java.io.Serial;

/// Thrown when a source node or a persisted payload does not have the expected shape.
///
/// Raised for nodes that are neither a branching level nor a branch-set, for missing
/// identifiers or weights, and for attribute blobs that cannot be decoded.
public class LogicTreeFormatException extends LogicTreeException {

    @Serial private static final long serialVersionUID = 7764201958812290316L;

    public LogicTreeFormatException(String message) {
        super(message);
    }

    public LogicTreeFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
