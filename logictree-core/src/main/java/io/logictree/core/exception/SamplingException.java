package io.logictree.core.exception;

import java.io.Serial;

/// Thrown when weighted sampling is undefined for a branch-set.
///
/// Sampling aborts entirely: no realization of the failed call is ever produced.
public class SamplingException extends LogicTreeException {

    @Serial private static final long serialVersionUID = -4032981157744602905L;

    public SamplingException(String message) {
        super(message);
    }

    public SamplingException(String message, Throwable cause) {
        super(message, cause);
    }
}
