package com.cohortaccel.concept;

import com.cohortaccel.config.CohortProperties;
import com.cohortaccel.model.criteria.AlternativeMapping;
import com.cohortaccel.model.criteria.ConceptResolution;
import com.cohortaccel.model.enums.*;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Resolves concepts by searching the description column of the domain's
 * reference table (ICD-10, CPT, NDC style lookups).
 * <p>
 * Match score: exact description = high, description prefix = medium,
 * substring = low. Codes of the best-scoring tier become the primary
 * resolution; the next tier is offered as an alternative. Drug matches
 * resolve to ingredient groups when the reference table has one.
 */
@Slf4j
public class ReferenceTableConceptResolver implements ConceptResolver {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final JdbcTemplate jdbcTemplate;
    private final CohortProperties properties;

    public ReferenceTableConceptResolver(JdbcTemplate jdbcTemplate, CohortProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
    }

    @Override
    public ConceptResolution resolve(String conceptLabel, ClinicalDomain domain, CodeSystem codeSystemHint) {
        CohortProperties.Domain settings = properties.getCatalog().getDomains().get(domain.getValue());
        if (settings == null || settings.getReferenceTable() == null
                || settings.getReferenceCodeColumn() == null || settings.getReferenceDescriptionColumn() == null) {
            return ConceptResolution.unresolved("No reference table is configured for domain " + domain.getValue(), null);
        }
        String label = conceptLabel == null ? "" : conceptLabel.trim();
        if (label.isEmpty()) {
            return ConceptResolution.unresolved("Empty concept label", null);
        }

        String table = identifier(settings.getReferenceTable());
        String codeColumn = identifier(settings.getReferenceCodeColumn());
        String descriptionColumn = identifier(settings.getReferenceDescriptionColumn());
        String groupColumn = settings.getReferenceGroupColumn() != null
            ? identifier(settings.getReferenceGroupColumn()) : null;

        String sql = String.format("""
            select R.%s as code, R.%s as description%s
            from %s R
            where upper(R.%s) like ?
            order by R.%s""",
            codeColumn, descriptionColumn, groupColumn != null ? ", R." + groupColumn + " as code_group" : "",
            table, descriptionColumn, codeColumn);

        List<Match> matches = jdbcTemplate.query(sql,
            (rs, rowNum) -> new Match(
                rs.getString("code"),
                rs.getString("description"),
                groupColumn != null ? rs.getString("code_group") : null,
                score(label, rs.getString("description"))),
            "%" + label.toUpperCase(Locale.ROOT) + "%");

        if (matches.isEmpty()) {
            log.debug("No reference entries for '{}' in {}", label, table);
            return ConceptResolution.unresolved("No " + table + " entries match '" + label + "'", null);
        }

        ConfidenceLevel best = strongest(matches);
        List<Match> primary = matches.stream().filter(m -> m.confidence() == best).toList();
        List<Match> broader = matches.stream().filter(m -> m.confidence() != best).toList();

        CodeSystem codeSystem = codeSystemHint != null ? codeSystemHint
            : settings.getCodeSystem() != null ? CodeSystem.fromCode(settings.getCodeSystem()) : null;
        boolean byIngredient = domain == ClinicalDomain.DRUG && groupColumn != null;
        MatchingLogic logic = byIngredient ? MatchingLogic.INGREDIENT
            : domain == ClinicalDomain.DIAGNOSIS ? MatchingLogic.WILDCARD : MatchingLogic.EXACT;

        List<AlternativeMapping> alternatives = new ArrayList<>();
        if (!broader.isEmpty()) {
            alternatives.add(new AlternativeMapping(
                codeValues(broader, byIngredient),
                codeSystem,
                logic,
                "Broader match on description text",
                List.of("Captures " + broader.size() + " additional reference entries"),
                List.of("Lower specificity for '" + label + "'"),
                strongest(broader)
            ));
        }

        List<String> codes = codeValues(primary, byIngredient);
        log.debug("Resolved '{}' ({}) to {} codes with {} confidence", label, domain.getValue(), codes.size(), best.getValue());
        return ConceptResolution.builder()
            .resolved(true)
            .codeSystem(codeSystem)
            .codeValues(codes)
            .matchingLogic(logic)
            .confidence(best)
            .alternatives(alternatives)
            .notes("Matched " + primary.size() + " " + table + " entries on description")
            .build();
    }

    private List<String> codeValues(List<Match> matches, boolean byIngredient) {
        return matches.stream()
            .map(m -> byIngredient && m.group() != null ? m.group() : m.code())
            .filter(Objects::nonNull)
            .distinct()
            .limit(properties.getConcepts().getMaxCodes())
            .toList();
    }

    private ConfidenceLevel strongest(List<Match> matches) {
        return matches.stream().map(Match::confidence)
            .min(Comparator.comparingInt(ConfidenceLevel::ordinal))
            .orElse(ConfidenceLevel.LOW);
    }

    private ConfidenceLevel score(String label, String description) {
        String d = description == null ? "" : description.trim().toLowerCase(Locale.ROOT);
        String l = label.toLowerCase(Locale.ROOT);
        if (d.equals(l)) {
            return ConfidenceLevel.HIGH;
        }
        if (d.startsWith(l)) {
            return ConfidenceLevel.MEDIUM;
        }
        return ConfidenceLevel.LOW;
    }

    private String identifier(String name) {
        if (!IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid reference identifier: " + name);
        }
        return name;
    }

    private record Match(String code, String description, String group, ConfidenceLevel confidence) {}
}
