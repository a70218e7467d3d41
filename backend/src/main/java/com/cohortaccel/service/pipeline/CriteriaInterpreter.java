package com.cohortaccel.service.pipeline;

import com.cohortaccel.model.criteria.CriteriaSet;

/**
 * Boundary to the text-interpretation service that turns protocol text and
 * operator feedback into structured criteria.
 */
public interface CriteriaInterpreter {

    CriteriaSet interpret(String criteriaText);

    /**
     * Apply free-text feedback to the current criteria. Predicate ids must stay stable.
     */
    CriteriaSet revise(CriteriaSet current, String feedback);
}
