package com.cohortaccel.concept;

import com.cohortaccel.model.criteria.ConceptResolution;
import com.cohortaccel.model.enums.ClinicalDomain;
import com.cohortaccel.model.enums.CodeSystem;

/**
 * Maps a clinical concept label to code values. Implementations may block on
 * a remote service; callers bound each call with a timeout.
 */
public interface ConceptResolver {

    /**
     * @param codeSystemHint preferred code system, or {@code null}
     * @return a resolution; {@code resolved=false} (possibly with alternatives)
     *         when no confident mapping exists
     */
    ConceptResolution resolve(String conceptLabel, ClinicalDomain domain, CodeSystem codeSystemHint);
}
