package com.cohortaccel.model.criteria;

import com.cohortaccel.model.enums.CodeSystem;
import com.cohortaccel.model.enums.ConfidenceLevel;
import com.cohortaccel.model.enums.MatchingLogic;
import lombok.Builder;

import java.util.ArrayList;
import java.util.List;

/**
 * Mapping from a clinical concept label to dataset code values.
 * Code values keep their order; wildcard codes end in {@code *} or {@code %}.
 */
@Builder(toBuilder = true)
public record ConceptResolution(
    boolean resolved,
    CodeSystem codeSystem,
    List<String> codeValues,
    MatchingLogic matchingLogic,
    ConfidenceLevel confidence,
    List<AlternativeMapping> alternatives,
    String notes
) {
    public ConceptResolution {
        codeValues = codeValues == null ? List.of() : List.copyOf(codeValues);
        alternatives = alternatives == null ? List.of() : List.copyOf(alternatives);
        if (matchingLogic == null) {
            matchingLogic = MatchingLogic.EXACT;
        }
        if (confidence == null) {
            confidence = ConfidenceLevel.LOW;
        }
        if (resolved && codeValues.stream().anyMatch(c -> c == null || c.isBlank())) {
            throw new IllegalArgumentException("Resolved concept contains a blank code value");
        }
    }

    public static ConceptResolution unresolved(String notes, List<AlternativeMapping> alternatives) {
        return ConceptResolution.builder()
            .resolved(false)
            .notes(notes)
            .alternatives(alternatives)
            .confidence(ConfidenceLevel.LOW)
            .build();
    }

    /**
     * Promote the alternative at {@code index} to primary. The previous primary,
     * if it had codes, is kept as an alternative so the choice stays reversible.
     */
    public ConceptResolution selectAlternative(int index) {
        if (index < 0 || index >= alternatives.size()) {
            throw new IllegalArgumentException("No alternative mapping at index " + index);
        }
        AlternativeMapping chosen = alternatives.get(index);
        List<AlternativeMapping> remaining = new ArrayList<>(alternatives);
        remaining.remove(index);
        if (!codeValues.isEmpty()) {
            remaining.add(0, new AlternativeMapping(
                codeValues, codeSystem, matchingLogic, "Previous primary mapping",
                List.of(), List.of(), confidence));
        }
        return new ConceptResolution(
            true,
            chosen.codeSystem() != null ? chosen.codeSystem() : codeSystem,
            chosen.codeValues(),
            chosen.matchingLogic() != null ? chosen.matchingLogic() : matchingLogic,
            chosen.confidence(),
            remaining,
            chosen.description()
        );
    }
}
