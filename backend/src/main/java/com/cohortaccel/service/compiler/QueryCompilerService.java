package com.cohortaccel.service.compiler;

import com.cohortaccel.catalog.CatalogSchema;
import com.cohortaccel.catalog.DomainMapping;
import com.cohortaccel.catalog.PopulationMapping;
import com.cohortaccel.config.CohortProperties;
import com.cohortaccel.model.criteria.*;
import com.cohortaccel.model.enums.*;
import com.cohortaccel.model.plan.AnchorExpression;
import com.cohortaccel.model.plan.QueryFragment;
import com.cohortaccel.model.plan.QueryPlan;
import com.cohortaccel.service.compiler.SqlFragmentTemplateService.AttritionRow;
import com.cohortaccel.service.compiler.SqlFragmentTemplateService.CountSpec;
import com.cohortaccel.service.compiler.SqlFragmentTemplateService.FragmentSpec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Query Compiler
 *
 * Turns a criteria set into an immutable {@link QueryPlan}:
 * - one fragment per compilable predicate (code, temporal, value and count filters)
 * - anchors derived once per plan from the anchor rules
 * - final = (base ∩ inclusions) − (∪ exclusions), projected with the index date
 *
 * Skipped, non_rwd and needs_definition predicates become plan gaps. Only the
 * primary concept resolution is compiled; alternatives are ignored until the
 * caller promotes one.
 */
@Slf4j
@Service
public class QueryCompilerService {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");
    private static final String ENROLLMENT_PERIOD = "enrollment";
    private static final String ENROLLMENT_START_ANCHOR = "enrollment_start";
    private static final Map<String, String> ATTRIBUTE_SYNONYMS = Map.of(
        "sex", "gender",
        "dob", "date_of_birth",
        "birth_date", "date_of_birth"
    );

    private final SqlFragmentTemplateService templates;
    private final LabUnitNormalizer unitNormalizer;
    private final CohortProperties properties;

    public QueryCompilerService(
            SqlFragmentTemplateService templates,
            LabUnitNormalizer unitNormalizer,
            CohortProperties properties) {
        this.templates = templates;
        this.unitNormalizer = unitNormalizer;
        this.properties = properties;
    }

    // ========================================================================
    // Public API
    // ========================================================================

    public QueryPlan compile(CriteriaSet criteriaSet, CatalogSchema catalog) {
        return compile(criteriaSet, catalog, null);
    }

    /**
     * Compile a new plan version. When {@code previous} is given the result is
     * its successor ({@code version + 1}, {@code parentVersion} set).
     *
     * @throws CompileException when a required predicate is unresolved, the
     *                          catalog lacks a mapping, or a temporal reference is invalid
     */
    public QueryPlan compile(CriteriaSet criteriaSet, CatalogSchema catalog, QueryPlan previous) {
        int version = previous == null ? 1 : previous.version() + 1;
        Compilation c = new Compilation(criteriaSet, catalog);

        PopulationMapping population = catalog.population();
        Refs baseRefs = new Refs(c, null);
        baseRefs.column(population.table(), population.subjectColumn());

        // Partition predicates into compilable ones and gaps
        List<Predicate> compilable = new ArrayList<>();
        List<String> unresolved = new ArrayList<>();
        for (Predicate predicate : criteriaSet.predicates()) {
            if (criteriaSet.isSkipped(predicate.id())) {
                continue;
            }
            if (!predicate.verifiability().isQueryable()) {
                c.gap(new Gap(predicate.id(), GapKind.NON_RWD,
                    "Not verifiable from real-world data; retained for documentation only", null, false));
                continue;
            }
            if (predicate.needsDefinition()) {
                String proposal = predicate.candidateDefinitions().isEmpty()
                    ? "Propose an operational definition"
                    : "Choose one of: " + String.join(" | ", predicate.candidateDefinitions());
                c.gap(new Gap(predicate.id(), GapKind.NEEDS_DEFINITION,
                    "Clinically ambiguous; needs an operational definition before it can be queried", proposal, true));
                continue;
            }
            if (predicate.requiresConceptResolution()
                    && (!predicate.isResolved() || predicate.conceptResolution().codeValues().isEmpty())) {
                unresolved.add(predicate.id());
                continue;
            }
            if (predicate.verifiability() == Verifiability.PARTIAL_RWD) {
                c.gap(new Gap(predicate.id(), GapKind.ASSUMPTION,
                    "Only partially verifiable; the query enforces the data-derivable part", null, false));
            }
            compilable.add(predicate);
        }
        if (!unresolved.isEmpty()) {
            throw new CompileException(CompileErrorKind.UNRESOLVED_REQUIRED_PREDICATE, unresolved,
                "Predicates need a resolved concept before compilation: " + unresolved);
        }

        String indexAnchorCte = criteriaSet.indexAnchorRule()
            .map(rule -> anchor(c, rule, null).cteName())
            .orElse(null);

        Set<String> usedNames = new HashSet<>();
        List<QueryFragment> fragments = new ArrayList<>();
        for (Predicate predicate : compilable) {
            fragments.add(compileFragment(c, predicate, uniqueName("P_" + sanitize(predicate.id()), usedNames)));
        }

        return assemble(c, version, previous != null ? previous.version() : null, indexAnchorCte, fragments);
    }

    /**
     * Count query over an arbitrary combination of already-compiled fragments.
     * Fragments are reused verbatim; nothing is recompiled.
     */
    public String combinationCountSql(QueryPlan plan, List<QueryFragment> inclusions, List<QueryFragment> exclusions) {
        List<QueryFragment> used = new ArrayList<>(inclusions);
        used.addAll(exclusions);

        List<String> ctes = new ArrayList<>();
        ctes.add(templates.cte(QueryPlan.BASE_CTE, null, plan.basePopulationBody()));
        ctes.addAll(anchorCtes(plan, used));
        used.forEach(f -> ctes.add(templates.cte(f.cteName(), null, f.body())));

        ctes.add(templates.cte("WHATIF_INCLUDED", null, templates.intersect(QueryPlan.BASE_CTE,
            inclusions.stream().map(QueryFragment::cteName).toList())));
        String result = "WHATIF_INCLUDED";
        if (!exclusions.isEmpty()) {
            ctes.add(templates.cte("WHATIF_EXCLUDED", null,
                templates.union(exclusions.stream().map(QueryFragment::cteName).toList())));
            ctes.add(templates.cte("WHATIF_RESULT", null, templates.except("WHATIF_INCLUDED", "WHATIF_EXCLUDED")));
            result = "WHATIF_RESULT";
        }
        return templates.withClause(null, ctes, templates.countSelect(result));
    }

    /**
     * Count query for a single fragment, used to localize failures.
     */
    public String fragmentCountSql(QueryPlan plan, QueryFragment fragment) {
        List<String> ctes = new ArrayList<>(anchorCtes(plan, List.of(fragment)));
        ctes.add(templates.cte(fragment.cteName(), null, fragment.body()));
        return templates.withClause(null, ctes, templates.countSelect(fragment.cteName()));
    }

    // ========================================================================
    // Fragment Compilation
    // ========================================================================

    private QueryFragment compileFragment(Compilation c, Predicate predicate, String cteName) {
        Refs refs = new Refs(c, predicate.id());
        List<String> logic = new ArrayList<>();
        List<String> anchorDeps = new ArrayList<>();

        String body = switch (predicate.domain()) {
            case DEMOGRAPHIC -> demographicFragment(c, predicate, refs, logic);
            case ENROLLMENT -> enrollmentFragment(c, predicate, refs, logic, anchorDeps);
            default -> eventFragment(c, predicate, refs, logic, anchorDeps);
        };

        return new QueryFragment(
            predicate.id(),
            cteName,
            predicate.polarity(),
            predicate.label(),
            String.join("; ", logic),
            body,
            anchorDeps,
            refs.tables,
            refs.columns
        );
    }

    private String eventFragment(Compilation c, Predicate predicate, Refs refs,
                                 List<String> logic, List<String> anchorDeps) {
        DomainMapping mapping = domainMapping(c, predicate);
        refs.column(mapping.table(), mapping.subjectColumn());

        List<String> joins = new ArrayList<>();
        List<String> conditions = new ArrayList<>();
        conditions.add(codeCondition(c, predicate, mapping, "E", refs, logic));

        TemporalWindow window = predicate.temporalWindow();
        if (window != null) {
            String dateColumn = requireColumn(refs, mapping.table(), mapping.dateColumn(),
                "Domain " + predicate.domain().getValue() + " has no date column for temporal filtering");
            if (window.isNamedPeriod() && ENROLLMENT_PERIOD.equalsIgnoreCase(window.during().trim())) {
                PopulationMapping population = requireEnrollment(c, refs);
                joins.add(templates.populationJoin("E", mapping.subjectColumn(), population));
                conditions.addAll(templates.withinEnrollment("E", dateColumn, population));
                logic.add("during enrollment");
            } else {
                int[] bounds = bounds(predicate.id(), window);
                AnchorExpression anchor = anchor(c, window.reference(), predicate.id());
                joins.add(templates.anchorJoin("E", mapping.subjectColumn(), anchor.cteName()));
                conditions.addAll(templates.window("E", dateColumn, bounds[0], bounds[1]));
                anchorDeps.add(anchor.cteName());
                logic.add(String.format("%s within [-%d, +%d] days of %s",
                    dateColumn, bounds[0], bounds[1], anchor.name()));
            }
        }

        String valueCondition = null;
        ValueConstraint value = predicate.valueConstraint();
        if (value != null) {
            String valueColumn = requireColumn(refs, mapping.table(), mapping.valueColumn(),
                "Domain " + predicate.domain().getValue() + " has no value column");
            if (predicate.domain() == ClinicalDomain.LAB || predicate.domain() == ClinicalDomain.OBSERVATION) {
                LabUnitNormalizer.Normalized normalized = unitNormalizer.normalize(predicate.concept(), value);
                value = normalized.constraint();
                if (normalized.assumption() != null) {
                    c.assume(predicate.id() + ": " + normalized.assumption());
                }
            }
            valueCondition = templates.comparison("E." + valueColumn, value);
            logic.add(valueCondition);
        }

        CountSpec countSpec = null;
        CountConstraint count = predicate.countConstraint();
        if (count != null) {
            if (count.operator() == ComparisonOperator.LESS || count.operator() == ComparisonOperator.LESS_OR_EQUAL
                    || (count.operator() == ComparisonOperator.EQUAL && count.count() == 0)
                    || (count.operator() == ComparisonOperator.BETWEEN && count.count() == 0)) {
                c.assume(predicate.id() + ": subjects without any event are not counted by the upper bound");
            }
            Integer withinDays = count.withinDays();
            if (count.hasProportion()) {
                if (withinDays != null) {
                    c.assume(predicate.id() + ": within_days is not applied to proportion constraints");
                    withinDays = null;
                }
                if (valueCondition == null) {
                    c.assume(predicate.id() + ": proportion without a value constraint counts every event");
                }
                logic.add(String.format("at least %s of events satisfy the value constraint", count.proportion()));
            } else {
                if (valueCondition != null) {
                    conditions.add(valueCondition);
                }
                if (withinDays != null) {
                    requireColumn(refs, mapping.table(), mapping.dateColumn(),
                        "Domain " + predicate.domain().getValue() + " has no date column for within_days");
                    logic.add("distinct event dates within any " + withinDays + "-day window");
                }
            }
            countSpec = new CountSpec(count.operator(), count.count(), count.upperCount(), withinDays,
                count.proportion(), count.hasProportion() ? valueCondition : null);
            logic.add(templates.countComparison("event count", count.operator(), count.count(), count.upperCount()));
        } else if (valueCondition != null) {
            conditions.add(valueCondition);
        }

        return templates.fragment(new FragmentSpec(
            mapping.table(), "E", mapping.subjectColumn(), mapping.dateColumn(), joins, conditions, countSpec));
    }

    private String demographicFragment(Compilation c, Predicate predicate, Refs refs, List<String> logic) {
        PopulationMapping population = c.catalog.population();
        DomainMapping mapping = c.catalog.domainMapping(ClinicalDomain.DEMOGRAPHIC).orElse(null);
        String table = identifier(predicate.id(), mapping != null ? mapping.table() : population.table());
        String subject = identifier(predicate.id(), mapping != null ? mapping.subjectColumn() : population.subjectColumn());
        refs.column(table, subject);

        String attribute = attributeColumn(predicate.concept());
        String expression;
        boolean plainColumn = true;
        if (exposes(mapping, attribute) && c.catalog.hasColumn(table, attribute)) {
            refs.column(table, attribute);
            expression = "P." + attribute;
        } else if ("age".equals(attribute) && exposes(mapping, population.birthDateColumn())
                && c.catalog.hasColumn(table, population.birthDateColumn())) {
            refs.column(table, population.birthDateColumn());
            expression = templates.ageInYears("P", population.birthDateColumn());
            plainColumn = false;
            c.assume(predicate.id() + ": age computed from " + population.birthDateColumn() + " at query time");
        } else {
            throw new CompileException(CompileErrorKind.MISSING_CATALOG_MAPPING, predicate.id(),
                "Catalog has no demographic attribute '" + attribute + "' in table " + table
                    + (mapping != null && !mapping.attributeColumns().isEmpty()
                        ? " among the mapped attribute columns " + mapping.attributeColumns() : ""));
        }

        List<String> conditions = new ArrayList<>();
        if (predicate.valueConstraint() != null) {
            conditions.add(templates.comparison(expression, predicate.valueConstraint()));
        }
        ConceptResolution resolution = predicate.conceptResolution();
        if (plainColumn && resolution != null && resolution.resolved() && !resolution.codeValues().isEmpty()) {
            conditions.add(templates.upperIn("P", attribute, resolution.codeValues()));
        }
        if (conditions.isEmpty()) {
            conditions.add(expression + " is not null");
        }
        if (predicate.temporalWindow() != null) {
            c.assume(predicate.id() + ": temporal window is not applied to demographic attributes");
        }
        if (predicate.countConstraint() != null) {
            c.assume(predicate.id() + ": count constraint is not applied to demographic attributes");
        }
        logic.addAll(conditions);

        return templates.fragment(new FragmentSpec(table, "P", subject, null, List.of(), conditions, null));
    }

    /**
     * A demographic mapping with attribute columns limits queryable attributes to that list.
     */
    private static boolean exposes(DomainMapping mapping, String column) {
        if (column == null) {
            return false;
        }
        return mapping == null || mapping.attributeColumns().isEmpty()
            || mapping.attributeColumns().stream().anyMatch(column::equalsIgnoreCase);
    }

    private String enrollmentFragment(Compilation c, Predicate predicate, Refs refs,
                                      List<String> logic, List<String> anchorDeps) {
        String table;
        String subject;
        String start;
        String end;
        Optional<DomainMapping> mapping = c.catalog.domainMapping(ClinicalDomain.ENROLLMENT);
        if (mapping.isPresent() && mapping.get().dateColumn() != null && mapping.get().endDateColumn() != null) {
            table = mapping.get().table();
            subject = mapping.get().subjectColumn();
            start = mapping.get().dateColumn();
            end = mapping.get().endDateColumn();
        } else {
            PopulationMapping population = requireEnrollment(c, refs);
            table = population.table();
            subject = population.subjectColumn();
            start = population.enrollmentStartColumn();
            end = population.enrollmentEndColumn();
        }
        refs.column(table, subject);
        refs.column(table, start);
        refs.column(table, end);

        List<String> joins = new ArrayList<>();
        List<String> conditions = new ArrayList<>();
        TemporalWindow window = predicate.temporalWindow();
        if (window != null && !(window.isNamedPeriod() && ENROLLMENT_PERIOD.equalsIgnoreCase(window.during().trim()))) {
            int[] bounds = bounds(predicate.id(), window);
            AnchorExpression anchor = anchor(c, window.reference(), predicate.id());
            joins.add(templates.anchorJoin("P", subject, anchor.cteName()));
            conditions.addAll(templates.continuousEnrollment("P", start, end, bounds[0], bounds[1]));
            anchorDeps.add(anchor.cteName());
            logic.add(String.format("continuously enrolled over [-%d, +%d] days of %s",
                bounds[0], bounds[1], anchor.name()));
        }

        ValueConstraint value = predicate.valueConstraint();
        if (value != null) {
            value = enrollmentDays(c, predicate.id(), value);
            conditions.add(templates.comparison(templates.enrollmentDays("P", start, end), value));
            logic.add("enrollment length " + value.operator().getValue() + " " + templates.number(value.value()) + " days");
        }
        if (conditions.isEmpty()) {
            conditions.add("P." + start + " is not null");
            logic.add("has an enrollment period");
        }

        return templates.fragment(new FragmentSpec(table, "P", subject, start, joins, conditions, null));
    }

    private ValueConstraint enrollmentDays(Compilation c, String predicateId, ValueConstraint value) {
        String unit = value.unit() == null ? "days" : value.unit().trim().toLowerCase(Locale.ROOT);
        BigDecimal factor;
        if (unit.startsWith("day")) {
            return value;
        } else if (unit.startsWith("month")) {
            factor = BigDecimal.valueOf(30);
        } else if (unit.startsWith("year")) {
            factor = BigDecimal.valueOf(365);
        } else {
            c.assume(predicateId + ": enrollment length unit '" + value.unit() + "' read as days");
            return value;
        }
        c.assume(predicateId + ": enrollment length converted from " + unit + " at " + factor + " days each");
        return value.withValues(
            value.value().multiply(factor),
            value.upperValue() != null ? value.upperValue().multiply(factor) : null,
            "days");
    }

    // ========================================================================
    // Code Matching
    // ========================================================================

    private String codeCondition(Compilation c, Predicate predicate, DomainMapping mapping, String alias,
                                 Refs refs, List<String> logic) {
        if (mapping.codeColumns().isEmpty()) {
            throw new CompileException(CompileErrorKind.MISSING_CATALOG_MAPPING, predicate.id(),
                "Domain " + predicate.domain().getValue() + " has no code columns");
        }
        mapping.codeColumns().forEach(column -> refs.column(mapping.table(), column));

        ConceptResolution resolution = predicate.conceptResolution();
        List<String> codes = resolution.codeValues();
        MatchingLogic matching = resolution.matchingLogic();
        List<String> perColumn = new ArrayList<>();

        switch (matching) {
            case EXACT -> {
                List<String> plain = codes.stream().filter(code -> !isWildcard(code)).toList();
                List<String> prefixes = codes.stream().filter(this::isWildcard).map(this::stripWildcard).toList();
                for (String column : mapping.codeColumns()) {
                    List<String> parts = new ArrayList<>();
                    if (!plain.isEmpty()) {
                        parts.add(templates.exactCodes(alias, column, plain));
                    }
                    if (!prefixes.isEmpty()) {
                        parts.add(templates.prefixCodes(alias, column, prefixes));
                    }
                    perColumn.add(templates.anyOf(parts));
                }
            }
            case WILDCARD -> {
                List<String> prefixes = codes.stream().map(this::stripWildcard).toList();
                mapping.codeColumns().forEach(column -> perColumn.add(templates.prefixCodes(alias, column, prefixes)));
            }
            case HIERARCHY -> {
                List<String> roots = codes.stream().map(this::stripWildcard).toList();
                if (mapping.hasReferenceTable() && c.catalog.hasColumn(mapping.referenceTable(), mapping.referenceCodeColumn())) {
                    refs.column(mapping.referenceTable(), mapping.referenceCodeColumn());
                    mapping.codeColumns().forEach(column ->
                        perColumn.add(templates.hierarchyCodes(alias, column, mapping, roots)));
                } else {
                    c.assume(predicate.id() + ": no reference table for " + predicate.domain().getValue()
                        + "; hierarchy matched by code prefix");
                    mapping.codeColumns().forEach(column -> perColumn.add(templates.prefixCodes(alias, column, roots)));
                }
            }
            case INGREDIENT -> {
                if (!mapping.hasReferenceTable() || mapping.referenceGroupColumn() == null) {
                    throw new CompileException(CompileErrorKind.MISSING_CATALOG_MAPPING, predicate.id(),
                        "Ingredient matching needs a reference table with a grouping column for domain "
                            + predicate.domain().getValue());
                }
                refs.column(mapping.referenceTable(), mapping.referenceCodeColumn());
                refs.column(mapping.referenceTable(), mapping.referenceGroupColumn());
                mapping.codeColumns().forEach(column ->
                    perColumn.add(templates.ingredientCodes(alias, column, mapping, codes)));
            }
        }

        logic.add(String.format("%s %s codes %s on %s.%s",
            predicate.domain().getValue(), matching.getValue(), codes, mapping.table(),
            String.join("|", mapping.codeColumns())));
        return templates.anyOf(perColumn);
    }

    private boolean isWildcard(String code) {
        return code.endsWith("*") || code.endsWith("%");
    }

    private String stripWildcard(String code) {
        String stripped = code;
        while (stripped.endsWith("*") || stripped.endsWith("%")) {
            stripped = stripped.substring(0, stripped.length() - 1);
        }
        return stripped;
    }

    // ========================================================================
    // Anchors and Temporal Bounds
    // ========================================================================

    private AnchorExpression anchor(Compilation c, String reference, String predicateId) {
        AnchorRule rule = c.criteriaSet.anchor(reference)
            .or(() -> ENROLLMENT_START_ANCHOR.equalsIgnoreCase(reference)
                ? Optional.of(AnchorRule.enrollmentStart(ENROLLMENT_START_ANCHOR))
                : Optional.empty())
            .orElseThrow(() -> new CompileException(CompileErrorKind.INVALID_TEMPORAL_REFERENCE, predicateId,
                "Predicate " + predicateId + " references unknown anchor '" + reference + "'"));
        return anchor(c, rule, predicateId);
    }

    private AnchorExpression anchor(Compilation c, AnchorRule rule, String predicateId) {
        String key = rule.name().toLowerCase(Locale.ROOT);
        AnchorExpression existing = c.anchors.get(key);
        if (existing != null) {
            return existing;
        }
        PopulationMapping population = c.catalog.population();
        Refs refs = new Refs(c, predicateId);
        String body = switch (rule.kind()) {
            case ENROLLMENT_START -> {
                requireEnrollment(c, refs);
                yield templates.enrollmentStartAnchor(population);
            }
            case FIXED_DATE -> templates.fixedDateAnchor(population, rule.fixedDate());
            case FIRST_QUALIFYING_EVENT -> {
                Predicate source = c.criteriaSet.predicate(rule.predicateId()).orElseThrow();
                if (c.criteriaSet.isSkipped(source.id()) || !source.verifiability().isQueryable()
                        || !source.domain().isCodeBased() || !source.isResolved()
                        || source.conceptResolution().codeValues().isEmpty()) {
                    throw new CompileException(CompileErrorKind.INVALID_TEMPORAL_REFERENCE,
                        predicateId != null ? List.of(predicateId, source.id()) : List.of(source.id()),
                        "Anchor '" + rule.name() + "' derives from predicate " + source.id()
                            + " which has no usable code mapping");
                }
                DomainMapping mapping = domainMapping(c, source);
                requireColumn(new Refs(c, source.id()), mapping.table(), mapping.dateColumn(),
                    "Domain " + source.domain().getValue() + " has no date column to anchor on");
                yield templates.firstEventAnchor(mapping,
                    codeCondition(c, source, mapping, "E", new Refs(c, source.id()), new ArrayList<>()));
            }
        };
        AnchorExpression expression = new AnchorExpression(
            rule.name(), "ANCHOR_" + sanitize(rule.name()), rule.kind(), body);
        c.anchors.put(key, expression);
        return expression;
    }

    /**
     * @return {@code [beforeDays, afterDays]}; a named period is looked up in configuration
     */
    private int[] bounds(String predicateId, TemporalWindow window) {
        if (!window.isNamedPeriod()) {
            return new int[]{window.beforeDaysOrZero(), window.afterDaysOrZero()};
        }
        String name = window.during().trim().toLowerCase(Locale.ROOT).replace(' ', '_').replace('-', '_');
        CohortProperties.Period period = properties.getPeriods().entrySet().stream()
            .filter(e -> e.getKey().equalsIgnoreCase(name))
            .map(Map.Entry::getValue)
            .findFirst()
            .orElseThrow(() -> new CompileException(CompileErrorKind.INVALID_TEMPORAL_REFERENCE, predicateId,
                "Predicate " + predicateId + " uses unknown period '" + window.during() + "'"));
        return new int[]{period.getBeforeDays(), period.getAfterDays()};
    }

    // ========================================================================
    // Plan Assembly
    // ========================================================================

    private QueryPlan assemble(Compilation c, int version, Integer parentVersion, String indexAnchorCte,
                               List<QueryFragment> fragments) {
        CriteriaSet criteriaSet = c.criteriaSet;
        PopulationMapping population = c.catalog.population();
        String baseBody = templates.basePopulation(population);

        List<QueryFragment> inclusions = fragments.stream().filter(f -> f.polarity() == Polarity.INCLUSION).toList();
        List<QueryFragment> exclusions = fragments.stream().filter(f -> f.polarity() == Polarity.EXCLUSION).toList();

        List<String> shared = new ArrayList<>();
        shared.add(templates.cte(QueryPlan.BASE_CTE, "Base population: every subject in " + population.table(), baseBody));
        c.anchors.values().forEach(a -> shared.add(templates.cte(a.cteName(), "Anchor: " + a.name(), a.body())));
        fragments.forEach(f -> shared.add(templates.cte(f.cteName(), f.description(), f.body())));
        String excludedCte = templates.cte(SqlFragmentTemplateService.EXCLUDED_CTE,
            "Union of exclusion fragments", templates.union(cteNames(exclusions)));

        List<String> countCtes = new ArrayList<>(shared);
        countCtes.add(templates.cte(SqlFragmentTemplateService.INCLUDED_CTE,
            "Intersection of the base population and inclusion fragments",
            templates.intersect(QueryPlan.BASE_CTE, cteNames(inclusions))));
        countCtes.add(excludedCte);
        countCtes.add(templates.cte(SqlFragmentTemplateService.FINAL_CTE, "Included minus excluded",
            templates.except(SqlFragmentTemplateService.INCLUDED_CTE, SqlFragmentTemplateService.EXCLUDED_CTE)));

        List<String> cohortCtes = new ArrayList<>(countCtes);
        cohortCtes.add(templates.cte(SqlFragmentTemplateService.COHORT_CTE, "Final cohort with index date",
            templates.cohort(SqlFragmentTemplateService.FINAL_CTE, indexAnchorCte)));

        String cohortSql = templates.withClause(
            templates.header("Cohort query", criteriaSet.studyId(), criteriaSet.revision(), version),
            cohortCtes, "select subject_id, index_date from " + SqlFragmentTemplateService.COHORT_CTE);
        String countSql = templates.withClause(
            templates.header("Cohort count", criteriaSet.studyId(), criteriaSet.revision(), version),
            countCtes, templates.countSelect(SqlFragmentTemplateService.FINAL_CTE));

        // Attrition: cumulative inclusion steps, then one subtractive exclusion step
        List<String> funnelCtes = new ArrayList<>(shared);
        funnelCtes.add(excludedCte);
        List<AttritionRow> rows = new ArrayList<>();
        rows.add(new AttritionRow(0, "base", "Base population", QueryPlan.BASE_CTE));
        String previous = QueryPlan.BASE_CTE;
        int step = 1;
        for (QueryFragment inclusion : inclusions) {
            String stepCte = "STEP_" + step;
            funnelCtes.add(templates.cte(stepCte, null, templates.intersect(previous, List.of(inclusion.cteName()))));
            rows.add(new AttritionRow(step, inclusion.predicateId(), inclusion.description(), stepCte));
            previous = stepCte;
            step++;
        }
        funnelCtes.add(templates.cte("STEP_FINAL", null,
            templates.except(previous, SqlFragmentTemplateService.EXCLUDED_CTE)));
        rows.add(new AttritionRow(step, "final", "After exclusions", "STEP_FINAL"));
        String funnelSql = templates.withClause(
            templates.header("Attrition counts", criteriaSet.studyId(), criteriaSet.revision(), version),
            funnelCtes, templates.attritionSelect(rows));

        List<String> assumptions = new ArrayList<>(criteriaSet.assumptions());
        c.assumptions.stream().filter(a -> !assumptions.contains(a)).forEach(assumptions::add);

        QueryPlan plan = new QueryPlan(
            criteriaSet.studyId(),
            criteriaSet.revision(),
            version,
            parentVersion,
            baseBody,
            new ArrayList<>(c.anchors.values()),
            indexAnchorCte,
            fragments,
            inclusions.stream().map(QueryFragment::predicateId).toList(),
            exclusions.stream().map(QueryFragment::predicateId).toList(),
            c.gaps,
            assumptions,
            cohortSql,
            countSql,
            funnelSql
        );
        log.info("Compiled plan {}: {} fragments ({} inclusion, {} exclusion), {} gaps, {} assumptions",
            plan.planId(), fragments.size(), inclusions.size(), exclusions.size(), c.gaps.size(), assumptions.size());
        log.debug("Cohort SQL for {}:\n{}", plan.planId(), cohortSql);
        return plan;
    }

    private List<String> anchorCtes(QueryPlan plan, List<QueryFragment> fragments) {
        Set<String> needed = fragments.stream()
            .flatMap(f -> f.anchorDependencies().stream())
            .collect(Collectors.toSet());
        return plan.anchors().stream()
            .filter(a -> needed.contains(a.cteName()))
            .map(a -> templates.cte(a.cteName(), null, a.body()))
            .toList();
    }

    private List<String> cteNames(List<QueryFragment> fragments) {
        return fragments.stream().map(QueryFragment::cteName).toList();
    }

    // ========================================================================
    // Catalog Helpers
    // ========================================================================

    private DomainMapping domainMapping(Compilation c, Predicate predicate) {
        DomainMapping mapping = c.catalog.domainMapping(predicate.domain())
            .orElseThrow(() -> new CompileException(CompileErrorKind.MISSING_CATALOG_MAPPING, predicate.id(),
                "Catalog has no mapping for domain " + predicate.domain().getValue()));
        identifier(predicate.id(), mapping.table());
        identifier(predicate.id(), mapping.subjectColumn());
        return mapping;
    }

    private PopulationMapping requireEnrollment(Compilation c, Refs refs) {
        PopulationMapping population = c.catalog.population();
        if (!population.hasEnrollment()) {
            throw new CompileException(CompileErrorKind.MISSING_CATALOG_MAPPING, refs.predicateId,
                "Population table " + population.table() + " has no enrollment period columns");
        }
        refs.column(population.table(), population.enrollmentStartColumn());
        refs.column(population.table(), population.enrollmentEndColumn());
        return population;
    }

    private String requireColumn(Refs refs, String table, String column, String message) {
        if (column == null) {
            throw new CompileException(CompileErrorKind.MISSING_CATALOG_MAPPING, refs.predicateId, message);
        }
        refs.column(table, column);
        return column;
    }

    private String attributeColumn(String concept) {
        String normalized = concept.trim().toLowerCase(Locale.ROOT)
            .replaceAll("[^a-z0-9]+", "_")
            .replaceAll("^_+|_+$", "");
        return ATTRIBUTE_SYNONYMS.getOrDefault(normalized, normalized);
    }

    private static String identifier(String predicateId, String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new CompileException(CompileErrorKind.MISSING_CATALOG_MAPPING, predicateId,
                "Invalid catalog identifier: " + name);
        }
        return name;
    }

    private static String sanitize(String name) {
        return name.toUpperCase(Locale.ROOT).replaceAll("[^A-Z0-9_]", "_");
    }

    private static String uniqueName(String candidate, Set<String> used) {
        String name = candidate;
        int suffix = 2;
        while (!used.add(name)) {
            name = candidate + "_" + suffix++;
        }
        return name;
    }

    // ========================================================================
    // Compilation State
    // ========================================================================

    private static final class Compilation {
        final CriteriaSet criteriaSet;
        final CatalogSchema catalog;
        final Map<String, AnchorExpression> anchors = new LinkedHashMap<>();
        final List<Gap> gaps;
        final List<String> assumptions = new ArrayList<>();

        Compilation(CriteriaSet criteriaSet, CatalogSchema catalog) {
            this.criteriaSet = criteriaSet;
            this.catalog = catalog;
            this.gaps = new ArrayList<>(criteriaSet.gaps());
        }

        void gap(Gap gap) {
            boolean present = gaps.stream()
                .anyMatch(g -> g.predicateId().equals(gap.predicateId()) && g.kind() == gap.kind());
            if (!present) {
                gaps.add(gap);
            }
        }

        void assume(String assumption) {
            if (!assumptions.contains(assumption)) {
                assumptions.add(assumption);
            }
        }
    }

    /**
     * Tables and columns a fragment reads. Every reference is checked against
     * the catalog as it is recorded.
     */
    private static final class Refs {
        final Compilation compilation;
        final String predicateId;
        final Set<String> tables = new LinkedHashSet<>();
        final Set<String> columns = new LinkedHashSet<>();

        Refs(Compilation compilation, String predicateId) {
            this.compilation = compilation;
            this.predicateId = predicateId;
        }

        void column(String table, String column) {
            identifier(predicateId, table);
            identifier(predicateId, column);
            if (!compilation.catalog.hasTable(table)) {
                throw new CompileException(CompileErrorKind.MISSING_CATALOG_MAPPING, predicateId,
                    "Catalog has no table " + table);
            }
            if (!compilation.catalog.hasColumn(table, column)) {
                throw new CompileException(CompileErrorKind.MISSING_CATALOG_MAPPING, predicateId,
                    "Catalog has no column " + table + "." + column);
            }
            tables.add(table.toLowerCase(Locale.ROOT));
            columns.add((table + "." + column).toLowerCase(Locale.ROOT));
        }
    }
}
