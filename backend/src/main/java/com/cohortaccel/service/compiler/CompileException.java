package com.cohortaccel.service.compiler;

import com.cohortaccel.model.enums.CompileErrorKind;
import lombok.Getter;

import java.util.List;

/**
 * Raised when a criteria set cannot be compiled into a query plan.
 */
@Getter
public class CompileException extends RuntimeException {

    private final CompileErrorKind kind;
    private final List<String> predicateIds;

    public CompileException(CompileErrorKind kind, List<String> predicateIds, String message) {
        super(message);
        this.kind = kind;
        this.predicateIds = predicateIds == null ? List.of() : List.copyOf(predicateIds);
    }

    public CompileException(CompileErrorKind kind, String predicateId, String message) {
        this(kind, predicateId != null ? List.of(predicateId) : List.of(), message);
    }
}
