package com.cohortaccel.service.pipeline;

import com.cohortaccel.dto.mapper.CriteriaDocumentMapper;
import com.cohortaccel.model.criteria.CriteriaSet;

/**
 * Interpreter used when no text-interpretation service is wired in: accepts
 * criteria documents (and edited documents as revisions) in JSON form only.
 */
public class JsonCriteriaInterpreter implements CriteriaInterpreter {

    private final CriteriaDocumentMapper mapper;

    public JsonCriteriaInterpreter(CriteriaDocumentMapper mapper) {
        this.mapper = mapper;
    }

    @Override
    public CriteriaSet interpret(String criteriaText) {
        requireDocument(criteriaText);
        return mapper.read(criteriaText);
    }

    @Override
    public CriteriaSet revise(CriteriaSet current, String feedback) {
        requireDocument(feedback);
        CriteriaSet revised = mapper.read(feedback);
        if (!revised.studyId().equals(current.studyId())) {
            throw new IllegalArgumentException(
                "Revision is for study " + revised.studyId() + ", session holds " + current.studyId());
        }
        return revised;
    }

    private void requireDocument(String text) {
        if (text == null || !text.trim().startsWith("{")) {
            throw new IllegalArgumentException(
                "Free-text criteria need a text-interpretation service; submit a JSON criteria document");
        }
    }
}
