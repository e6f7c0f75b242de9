package io.logictree.core.exception;

import java.io.Serial;

/// Base type for failures raised while building, reading, persisting or sampling a logic tree.
///
/// All subclasses describe programming or data errors, never transient faults, so callers are
/// not expected to retry. A failed build or sampling call must stop any downstream hazard
/// computation.
///
/// @see InvalidLogicTreeException
/// @see LogicTreeFormatException
/// @see SamplingException
public class LogicTreeException extends RuntimeException {

    @Serial private static final long serialVersionUID = 3120918426611874520L;

    public LogicTreeException(String message) {
        super(message);
    }

    public LogicTreeException(String message, Throwable cause) {
        super(message, cause);
    }
}
