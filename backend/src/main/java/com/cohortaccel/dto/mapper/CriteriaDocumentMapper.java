package com.cohortaccel.dto.mapper;

import com.cohortaccel.dto.CriteriaDocument;
import com.cohortaccel.dto.CriteriaDocument.*;
import com.cohortaccel.model.criteria.*;
import com.cohortaccel.model.enums.*;
import com.cohortaccel.service.pipeline.ResultBundle;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.*;

/**
 * Mapper between the JSON criteria document and the typed criteria model.
 * Model validation runs while mapping, so a document that reads successfully
 * is a valid {@link CriteriaSet}.
 */
@Component
public class CriteriaDocumentMapper {

    static final String INDEX_EVENT_KEY = "index_event";

    private final ObjectMapper objectMapper;

    public CriteriaDocumentMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    // ========================================================================
    // JSON I/O
    // ========================================================================

    public CriteriaSet read(String json) {
        try {
            return toCriteriaSet(objectMapper.readValue(json, CriteriaDocument.class));
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Malformed criteria document: " + e.getOriginalMessage(), e);
        }
    }

    public String write(CriteriaSet criteriaSet) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDocument(criteriaSet));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize criteria set " + criteriaSet.studyId(), e);
        }
    }

    /**
     * Serialize a result bundle. The criteria snapshot is written in document
     * shape so the bundle can be fed back as a revision.
     */
    public String writeBundle(ResultBundle bundle) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("session_id", bundle.sessionId());
        root.put("stage", bundle.stage().getValue());
        root.set("criteria", objectMapper.valueToTree(toDocument(bundle.criteriaSet())));
        if (bundle.plan() != null) {
            ObjectNode plan = root.putObject("plan");
            plan.put("plan_id", bundle.plan().planId());
            plan.put("version", bundle.plan().version());
            if (bundle.plan().parentVersion() != null) {
                plan.put("parent_version", bundle.plan().parentVersion());
            }
            plan.put("sql_cohort", bundle.plan().cohortSql());
            plan.put("sql_count", bundle.plan().countSql());
            plan.put("sql_funnel_counts", bundle.plan().funnelSql());
            ArrayNode manifest = plan.putArray("cte_manifest");
            bundle.plan().fragments().forEach(f -> manifest.addObject()
                .put("name", f.cteName())
                .put("predicate_id", f.predicateId())
                .put("purpose", f.description())
                .put("logic", f.logicSummary()));
        }
        root.set("execution", objectMapper.valueToTree(bundle.execution()));
        root.set("funnel", objectMapper.valueToTree(bundle.funnel()));
        root.set("gaps", objectMapper.valueToTree(bundle.gaps()));
        root.set("warnings", objectMapper.valueToTree(bundle.warnings()));
        root.set("assumptions", objectMapper.valueToTree(bundle.assumptions()));
        root.set("repair_attempts", objectMapper.valueToTree(bundle.repairAttempts()));
        root.set("failures", objectMapper.valueToTree(bundle.failures()));
        root.set("transitions", objectMapper.valueToTree(bundle.transitions()));
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize result bundle " + bundle.sessionId(), e);
        }
    }

    // ========================================================================
    // Document -> Model
    // ========================================================================

    public CriteriaSet toCriteriaSet(CriteriaDocument document) {
        if (document == null) {
            throw new IllegalArgumentException("Criteria document is empty");
        }
        Set<String> nonRwd = document.nonRwdGates() != null ? new HashSet<>(document.nonRwdGates()) : Set.of();

        List<Predicate> predicates = new ArrayList<>();
        if (document.inclusion() != null) {
            document.inclusion().forEach(p -> predicates.add(toPredicate(p, Polarity.INCLUSION, nonRwd)));
        }
        if (document.exclusion() != null) {
            document.exclusion().forEach(p -> predicates.add(toPredicate(p, Polarity.EXCLUSION, nonRwd)));
        }

        List<AnchorRule> anchors = new ArrayList<>();
        String indexAnchor = null;
        if (document.anchors() != null) {
            for (Map.Entry<String, AnchorDocument> entry : document.anchors().entrySet()) {
                AnchorRule rule = toAnchorRule(entry.getKey(), entry.getValue());
                anchors.add(rule);
                if (INDEX_EVENT_KEY.equals(entry.getKey())) {
                    indexAnchor = rule.name();
                }
            }
        }

        List<Gap> gaps = new ArrayList<>();
        if (document.assumptionsAndGaps() != null) {
            document.assumptionsAndGaps().forEach(g -> gaps.add(new Gap(
                g.predicateId(), GapKind.fromValue(g.kind()), g.issue(), g.proposedResolution(), g.requiresUserInput())));
        }

        return CriteriaSet.builder()
            .studyId(document.studyId())
            .version(document.version())
            .revision(document.revision() != null ? document.revision() : 0)
            .predicates(predicates)
            .anchorRules(anchors)
            .indexAnchor(indexAnchor)
            .gaps(gaps)
            .assumptions(document.assumptions())
            .build();
    }

    private Predicate toPredicate(PredicateDocument doc, Polarity polarity, Set<String> nonRwd) {
        Verifiability verifiability = nonRwd.contains(doc.id())
            ? Verifiability.NON_RWD
            : doc.verifiability() != null ? Verifiability.fromValue(doc.verifiability()) : Verifiability.RWD;

        return Predicate.builder()
            .id(doc.id())
            .description(doc.description())
            .polarity(polarity)
            .domain(doc.domain() != null ? ClinicalDomain.fromValue(doc.domain()) : null)
            .concept(doc.concept())
            .conceptResolution(toResolution(doc.conceptResolution()))
            .temporalWindow(doc.temporal() != null ? new TemporalWindow(
                doc.temporal().reference(), doc.temporal().beforeDays(),
                doc.temporal().afterDays(), doc.temporal().during()) : null)
            .valueConstraint(toValueConstraint(doc.id(), doc.valueConstraint()))
            .countConstraint(toCountConstraint(doc.id(), doc.countConstraint()))
            .verifiability(verifiability)
            .needsDefinition(Boolean.TRUE.equals(doc.needsDefinition()))
            .candidateDefinitions(doc.candidateDefinitions())
            .build();
    }

    private ConceptResolution toResolution(ConceptResolutionDocument doc) {
        if (doc == null) {
            return null;
        }
        List<AlternativeMapping> alternatives = doc.alternatives() == null ? List.of() : doc.alternatives().stream()
            .map(a -> new AlternativeMapping(
                a.conceptIds(),
                a.codeSystem() != null ? CodeSystem.fromCode(a.codeSystem()) : null,
                a.matchingLogic() != null ? MatchingLogic.fromValue(a.matchingLogic()) : null,
                a.description(),
                a.pros(),
                a.cons(),
                a.confidence() != null ? ConfidenceLevel.fromValue(a.confidence()) : ConfidenceLevel.LOW))
            .toList();

        return ConceptResolution.builder()
            .resolved(doc.resolved())
            .codeSystem(doc.codeSystem() != null ? CodeSystem.fromCode(doc.codeSystem()) : null)
            .codeValues(doc.conceptIds())
            .matchingLogic(doc.matchingLogic() != null ? MatchingLogic.fromValue(doc.matchingLogic()) : null)
            .confidence(doc.confidence() != null ? ConfidenceLevel.fromValue(doc.confidence()) : null)
            .alternatives(alternatives)
            .notes(doc.notes())
            .build();
    }

    private ValueConstraint toValueConstraint(String predicateId, ValueConstraintDocument doc) {
        if (doc == null) {
            return null;
        }
        ComparisonOperator operator = ComparisonOperator.fromValue(doc.operator());
        JsonNode value = doc.value();
        if (value == null || value.isNull()) {
            throw new IllegalArgumentException("Predicate " + predicateId + ": value constraint has no value");
        }
        if (value.isArray()) {
            if (value.size() != 2) {
                throw new IllegalArgumentException(
                    "Predicate " + predicateId + ": range value must have exactly two elements");
            }
            return new ValueConstraint(operator, decimal(predicateId, value.get(0)),
                decimal(predicateId, value.get(1)), doc.unit());
        }
        return new ValueConstraint(operator, decimal(predicateId, value), null, doc.unit());
    }

    private CountConstraint toCountConstraint(String predicateId, CountConstraintDocument doc) {
        if (doc == null) {
            return null;
        }
        ComparisonOperator operator = ComparisonOperator.fromValue(doc.operator());
        JsonNode count = doc.count();
        int low;
        Integer high = null;
        if (count == null || count.isNull()) {
            low = 1;
        } else if (count.isArray()) {
            if (count.size() != 2) {
                throw new IllegalArgumentException(
                    "Predicate " + predicateId + ": count range must have exactly two elements");
            }
            low = whole(predicateId, count.get(0));
            high = whole(predicateId, count.get(1));
        } else {
            low = whole(predicateId, count);
        }
        return new CountConstraint(operator, low, high, doc.withinDays(), doc.proportion());
    }

    private int whole(String predicateId, JsonNode node) {
        if (node.isIntegralNumber() && node.canConvertToInt()) {
            return node.intValue();
        }
        if (node.isTextual()) {
            try {
                return Integer.parseInt(node.asText().trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException(
                    "Predicate " + predicateId + ": count is not a whole number: " + node.asText(), e);
            }
        }
        throw new IllegalArgumentException("Predicate " + predicateId + ": count is not a whole number: " + node);
    }

    private BigDecimal decimal(String predicateId, JsonNode node) {
        if (node.isNumber()) {
            return node.decimalValue();
        }
        try {
            return new BigDecimal(node.asText().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                "Predicate " + predicateId + ": value is not numeric: " + node.asText(), e);
        }
    }

    private AnchorRule toAnchorRule(String key, AnchorDocument doc) {
        String name = doc != null && doc.name() != null && !doc.name().isBlank() ? doc.name() : key;
        if (doc == null) {
            return AnchorRule.enrollmentStart(name);
        }
        AnchorKind kind;
        if (doc.kind() != null) {
            kind = AnchorKind.fromValue(doc.kind());
        } else if (doc.predicateId() != null) {
            kind = AnchorKind.FIRST_QUALIFYING_EVENT;
        } else if (doc.fixedDate() != null) {
            kind = AnchorKind.FIXED_DATE;
        } else {
            kind = AnchorKind.ENROLLMENT_START;
        }
        LocalDate fixedDate = null;
        if (doc.fixedDate() != null) {
            try {
                fixedDate = LocalDate.parse(doc.fixedDate());
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Anchor '" + name + "' has an invalid fixed date: " + doc.fixedDate(), e);
            }
        }
        String description = doc.description() != null ? doc.description() : doc.derivationLogic();
        return new AnchorRule(name, kind, description, doc.predicateId(), fixedDate);
    }

    // ========================================================================
    // Model -> Document
    // ========================================================================

    public CriteriaDocument toDocument(CriteriaSet criteriaSet) {
        Map<String, AnchorDocument> anchors = new LinkedHashMap<>();
        for (AnchorRule rule : criteriaSet.anchorRules()) {
            String key = rule.name().equals(criteriaSet.indexAnchor()) ? INDEX_EVENT_KEY : rule.name();
            anchors.put(key, new AnchorDocument(
                rule.name(),
                rule.description(),
                null,
                rule.kind().getValue(),
                rule.predicateId(),
                rule.fixedDate() != null ? rule.fixedDate().toString() : null));
        }

        List<String> nonRwd = criteriaSet.predicates().stream()
            .filter(p -> p.verifiability() == Verifiability.NON_RWD)
            .map(Predicate::id)
            .toList();

        return new CriteriaDocument(
            criteriaSet.studyId(),
            criteriaSet.version(),
            criteriaSet.revision(),
            anchors,
            criteriaSet.inclusions().stream().map(this::toPredicateDocument).toList(),
            criteriaSet.exclusions().stream().map(this::toPredicateDocument).toList(),
            criteriaSet.gaps().stream().map(g -> new GapDocument(
                g.predicateId(), g.kind().getValue(), g.issue(), g.proposedResolution(), g.requiresUserInput()))
                .toList(),
            nonRwd,
            criteriaSet.assumptions()
        );
    }

    private PredicateDocument toPredicateDocument(Predicate predicate) {
        TemporalWindow window = predicate.temporalWindow();
        return new PredicateDocument(
            predicate.id(),
            predicate.description(),
            predicate.domain().getValue(),
            predicate.concept(),
            toResolutionDocument(predicate.conceptResolution()),
            window != null ? new TemporalDocument(
                window.reference(), window.beforeDays(), window.afterDays(), window.during()) : null,
            toValueDocument(predicate.valueConstraint()),
            toCountDocument(predicate.countConstraint()),
            predicate.verifiability().getValue(),
            predicate.needsDefinition(),
            predicate.candidateDefinitions().isEmpty() ? null : predicate.candidateDefinitions()
        );
    }

    private ConceptResolutionDocument toResolutionDocument(ConceptResolution resolution) {
        if (resolution == null) {
            return null;
        }
        List<AlternativeDocument> alternatives = resolution.alternatives().stream()
            .map(a -> new AlternativeDocument(
                a.codeValues(),
                a.codeSystem() != null ? a.codeSystem().getCode() : null,
                a.matchingLogic() != null ? a.matchingLogic().getValue() : null,
                a.description(),
                a.pros(),
                a.cons(),
                a.confidence() != null ? a.confidence().getValue() : null))
            .toList();
        return new ConceptResolutionDocument(
            resolution.resolved(),
            resolution.codeValues(),
            resolution.codeSystem() != null ? resolution.codeSystem().getCode() : null,
            resolution.matchingLogic().getValue(),
            resolution.confidence().getValue(),
            alternatives.isEmpty() ? null : alternatives,
            resolution.notes()
        );
    }

    private ValueConstraintDocument toValueDocument(ValueConstraint constraint) {
        if (constraint == null) {
            return null;
        }
        JsonNode value;
        if (constraint.operator().isRange()) {
            ArrayNode range = objectMapper.createArrayNode();
            range.add(constraint.value());
            range.add(constraint.upperValue());
            value = range;
        } else {
            value = objectMapper.getNodeFactory().numberNode(constraint.value());
        }
        return new ValueConstraintDocument(constraint.operator().getValue(), value, constraint.unit());
    }

    private CountConstraintDocument toCountDocument(CountConstraint constraint) {
        if (constraint == null) {
            return null;
        }
        JsonNode count;
        if (constraint.operator().isRange()) {
            ArrayNode range = objectMapper.createArrayNode();
            range.add(constraint.count());
            range.add(constraint.upperCount());
            count = range;
        } else {
            count = objectMapper.getNodeFactory().numberNode(constraint.count());
        }
        return new CountConstraintDocument(
            constraint.operator().getValue(), count, constraint.withinDays(), constraint.proportion());
    }
}
