package com.cohortaccel.service.execution;

import com.cohortaccel.model.enums.ExecutionErrorKind;
import lombok.Getter;

/**
 * Raised when a count that the caller cannot continue without fails.
 * Plan execution itself reports failures through {@code ExecutionResult}.
 */
@Getter
public class ExecutionException extends RuntimeException {

    private final ExecutionErrorKind kind;

    public ExecutionException(ExecutionErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ExecutionException(ExecutionErrorKind kind, String message) {
        this(kind, message, null);
    }
}
