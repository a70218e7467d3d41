package com.cohortaccel.service.compiler;

import com.cohortaccel.catalog.DomainMapping;
import com.cohortaccel.catalog.PopulationMapping;
import com.cohortaccel.model.criteria.ValueConstraint;
import com.cohortaccel.model.enums.ComparisonOperator;
import com.cohortaccel.model.plan.QueryPlan;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * SQL templates for cohort plans.
 *
 * Every fragment and anchor is a CTE body selecting {@code subject_id}
 * (anchors add {@code anchor_date}). Plans are assembled as:
 * - BASE_POPULATION: every subject of the population table
 * - ANCHOR_*: one reference date per subject
 * - P_*: one fragment per compiled predicate
 * - INCLUDED / EXCLUDED / FINAL_COHORT: INTERSECT, UNION and EXCEPT over fragments
 * - COHORT: final subjects with their index date
 *
 * Output is deterministic for a given input: no timestamps, stable ordering.
 */
@Service
public class SqlFragmentTemplateService {

    public static final String INCLUDED_CTE = "INCLUDED";
    public static final String EXCLUDED_CTE = "EXCLUDED";
    public static final String FINAL_CTE = "FINAL_COHORT";
    public static final String COHORT_CTE = "COHORT";

    // ========================================================================
    // Base Population and Anchors
    // ========================================================================

    public String basePopulation(PopulationMapping population) {
        return String.format("""
            select distinct
              P.%s as subject_id
            from %s P
            where
              P.%s is not null""", population.subjectColumn(), population.table(), population.subjectColumn());
    }

    public String enrollmentStartAnchor(PopulationMapping population) {
        return String.format("""
            select
              P.%s as subject_id
              , min(P.%s) as anchor_date
            from %s P
            where
              P.%s is not null
            group by P.%s""",
            population.subjectColumn(), population.enrollmentStartColumn(), population.table(),
            population.enrollmentStartColumn(), population.subjectColumn());
    }

    public String fixedDateAnchor(PopulationMapping population, LocalDate date) {
        return String.format("""
            select distinct
              P.%s as subject_id
              , DATE '%s' as anchor_date
            from %s P""", population.subjectColumn(), date, population.table());
    }

    public String firstEventAnchor(DomainMapping mapping, String codeCondition) {
        return String.format("""
            select
              E.%s as subject_id
              , min(E.%s) as anchor_date
            from %s E
            where
              E.%s is not null
                and %s
            group by E.%s""",
            mapping.subjectColumn(), mapping.dateColumn(), mapping.table(),
            mapping.dateColumn(), codeCondition, mapping.subjectColumn());
    }

    // ========================================================================
    // Code Matching
    // ========================================================================

    public String exactCodes(String alias, String column, List<String> codes) {
        return String.format("%s.%s in (%s)", alias, column, literals(codes));
    }

    public String prefixCodes(String alias, String column, List<String> prefixes) {
        return anyOf(prefixes.stream()
            .map(p -> String.format("%s.%s like '%s%%'", alias, column, escapeSQL(p)))
            .toList());
    }

    public String hierarchyCodes(String alias, String column, DomainMapping mapping, List<String> roots) {
        String descendants = roots.stream()
            .map(r -> String.format("R.%s like '%s%%'", mapping.referenceCodeColumn(), escapeSQL(r)))
            .collect(Collectors.joining("\n        or "));
        return String.format("""
            %s.%s in (
                  select R.%s from %s R
                  where %s
                )""", alias, column, mapping.referenceCodeColumn(), mapping.referenceTable(), descendants);
    }

    public String ingredientCodes(String alias, String column, DomainMapping mapping, List<String> ingredients) {
        String groups = ingredients.stream()
            .map(i -> "'" + escapeSQL(i.toUpperCase(Locale.ROOT)) + "'")
            .collect(Collectors.joining(", "));
        return String.format("""
            %s.%s in (
                  select R.%s from %s R
                  where upper(R.%s) in (%s)
                )""", alias, column, mapping.referenceCodeColumn(), mapping.referenceTable(),
            mapping.referenceGroupColumn(), groups);
    }

    public String anyOf(List<String> conditions) {
        if (conditions.size() == 1) {
            return conditions.get(0);
        }
        return "(" + String.join("\n      or ", conditions) + ")";
    }

    // ========================================================================
    // Temporal and Value Conditions
    // ========================================================================

    public String anchorJoin(String alias, String subjectColumn, String anchorCte) {
        return String.format("""
            inner join %s A
              on %s.%s = A.subject_id""", anchorCte, alias, subjectColumn);
    }

    public String populationJoin(String alias, String subjectColumn, PopulationMapping population) {
        return String.format("""
            inner join %s EP
              on %s.%s = EP.%s""", population.table(), alias, subjectColumn, population.subjectColumn());
    }

    /**
     * Event date within {@code [anchor - before, anchor + after]}, both ends inclusive.
     */
    public List<String> window(String alias, String dateColumn, int beforeDays, int afterDays) {
        return List.of(
            String.format("%s.%s >= DATEADD(DAY, -%d, A.anchor_date)", alias, dateColumn, beforeDays),
            String.format("%s.%s <= DATEADD(DAY, %d, A.anchor_date)", alias, dateColumn, afterDays)
        );
    }

    public List<String> withinEnrollment(String alias, String dateColumn, PopulationMapping population) {
        return List.of(
            String.format("%s.%s >= EP.%s", alias, dateColumn, population.enrollmentStartColumn()),
            String.format("%s.%s <= EP.%s", alias, dateColumn, population.enrollmentEndColumn())
        );
    }

    /**
     * Enrollment period covering the whole window around the anchor.
     */
    public List<String> continuousEnrollment(String alias, String startColumn, String endColumn,
                                             int beforeDays, int afterDays) {
        return List.of(
            String.format("%s.%s <= DATEADD(DAY, -%d, A.anchor_date)", alias, startColumn, beforeDays),
            String.format("%s.%s >= DATEADD(DAY, %d, A.anchor_date)", alias, endColumn, afterDays)
        );
    }

    public String enrollmentDays(String alias, String startColumn, String endColumn) {
        return String.format("DATEDIFF(DAY, %s.%s, %s.%s)", alias, startColumn, alias, endColumn);
    }

    /**
     * Completed years; DATEDIFF alone counts year boundaries crossed.
     */
    public String ageInYears(String alias, String birthDateColumn) {
        String dob = alias + "." + birthDateColumn;
        return String.format(
            "(DATEDIFF(YEAR, %s, CURRENT_DATE) - case when DATEADD(YEAR, DATEDIFF(YEAR, %s, CURRENT_DATE), %s) > CURRENT_DATE then 1 else 0 end)",
            dob, dob, dob);
    }

    public String comparison(String expression, ValueConstraint constraint) {
        if (constraint.operator() == ComparisonOperator.BETWEEN) {
            return String.format("%s between %s and %s",
                expression, number(constraint.value()), number(constraint.upperValue()));
        }
        return String.format("%s %s %s", expression, constraint.operator().getValue(), number(constraint.value()));
    }

    public String countComparison(String expression, ComparisonOperator operator, int count, Integer upper) {
        if (operator == ComparisonOperator.BETWEEN) {
            return String.format("%s between %d and %d", expression, count, upper);
        }
        return String.format("%s %s %d", expression, operator.getValue(), count);
    }

    public String upperIn(String alias, String column, List<String> values) {
        String list = values.stream()
            .map(v -> "'" + escapeSQL(v.toUpperCase(Locale.ROOT)) + "'")
            .collect(Collectors.joining(", "));
        return String.format("upper(%s.%s) in (%s)", alias, column, list);
    }

    // ========================================================================
    // Fragment Bodies
    // ========================================================================

    /**
     * Render a predicate fragment. Without a count constraint this is a
     * distinct-subject filter; with one, events are grouped per subject, and
     * with {@code withinDays} per rolling window of distinct event dates.
     */
    public String fragment(FragmentSpec spec) {
        String joins = spec.joins().isEmpty() ? "" : "\n" + String.join("\n", spec.joins());
        String where = whereClause(spec.conditions());
        String alias = spec.alias();
        CountSpec count = spec.count();

        if (count == null) {
            return String.format("""
                select distinct
                  %s.%s as subject_id
                from %s %s%s%s""", alias, spec.subjectColumn(), spec.table(), alias, joins, where);
        }

        if (count.withinDays() != null && count.proportion() == null) {
            String events = indent(String.format("""
                select distinct
                  %s.%s as subject_id
                  , %s.%s as event_date
                from %s %s%s%s""", alias, spec.subjectColumn(), alias, spec.dateColumn(),
                spec.table(), alias, joins, where), 2);
            return String.format("""
                -- rolling %d-day windows starting at each event date
                select distinct
                  S.subject_id
                from (
                %s
                ) S
                inner join (
                %s
                ) T
                  on T.subject_id = S.subject_id
                  and T.event_date >= S.event_date
                  and T.event_date <= DATEADD(DAY, %d, S.event_date)
                group by S.subject_id, S.event_date
                having %s""", count.withinDays(), events, events, count.withinDays(),
                countComparison("count(*)", count.operator(), count.count(), count.upperCount()));
        }

        String having = countComparison("count(*)", count.operator(), count.count(), count.upperCount());
        if (count.proportion() != null) {
            having = having + String.format(
                "\n  and sum(case when %s then 1 else 0 end) >= CEIL(%s * count(*))",
                count.matchingCondition() != null ? count.matchingCondition() : "1 = 1",
                number(BigDecimal.valueOf(count.proportion())));
        }
        return String.format("""
            select
              %s.%s as subject_id
            from %s %s%s%s
            group by %s.%s
            having %s""", alias, spec.subjectColumn(), spec.table(), alias, joins, where,
            alias, spec.subjectColumn(), having);
    }

    // ========================================================================
    // Plan Assembly
    // ========================================================================

    public String cte(String name, String description, String body) {
        String comment = description != null && !description.isBlank()
            ? "-- " + description.replaceAll("[\\r\\n]+", " ") + "\n" : "";
        return String.format("%s%s as (\n%s\n)", comment, name, indent(body, 2));
    }

    public String intersect(String first, List<String> others) {
        StringBuilder sql = new StringBuilder("select subject_id from " + first);
        others.forEach(o -> sql.append("\nintersect\nselect subject_id from ").append(o));
        return sql.toString();
    }

    public String union(List<String> ctes) {
        if (ctes.isEmpty()) {
            return "select subject_id from " + QueryPlan.BASE_CTE + " where 1 = 0";
        }
        return ctes.stream()
            .map(c -> "select subject_id from " + c)
            .collect(Collectors.joining("\nunion\n"));
    }

    public String except(String included, String excluded) {
        return String.format("""
            select subject_id from %s
            except
            select subject_id from %s""", included, excluded);
    }

    public String cohort(String finalCte, String indexAnchorCte) {
        if (indexAnchorCte == null) {
            return String.format("""
                select
                  F.subject_id
                  , cast(null as date) as index_date
                from %s F""", finalCte);
        }
        return String.format("""
            select
              F.subject_id
              , A.anchor_date as index_date
            from %s F
            left join %s A
              on F.subject_id = A.subject_id""", finalCte, indexAnchorCte);
    }

    public String withClause(String header, List<String> ctes, String finalSelect) {
        return String.format("%swith %s\n%s", header != null ? header : "",
            String.join(",\n--\n", ctes), finalSelect);
    }

    public String header(String title, String studyId, int revision, int version) {
        return String.format("""
            -- ============================================================================
            -- %s
            -- Study: %s (criteria revision %d, plan v%d)
            -- ============================================================================
            """, title, studyId.replaceAll("[\\r\\n]+", " "), revision, version);
    }

    public String countSelect(String cte) {
        return "select count(*) as subject_count from " + cte;
    }

    public String attritionSelect(List<AttritionRow> rows) {
        return rows.stream()
            .map(r -> String.format("select %d as step_order, '%s' as predicate_id, '%s' as step_label, count(*) as subject_count from %s",
                r.order(), escapeSQL(r.predicateId()), escapeSQL(r.label()), r.cte()))
            .collect(Collectors.joining("\nunion all\n")) + "\norder by step_order";
    }

    public String preview(String cohortSql, int limit) {
        return String.format("%s\norder by subject_id\nfetch first %d rows only", cohortSql, limit);
    }

    // ========================================================================
    // Helper Methods
    // ========================================================================

    public String whereClause(List<String> conditions) {
        if (conditions.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        conditions.forEach(c -> appendCondition(sb, c));
        return "\nwhere\n  " + sb;
    }

    private void appendCondition(StringBuilder sb, String condition) {
        if (sb.length() > 0) {
            sb.append("\n    and ");
        }
        sb.append(condition);
    }

    private String literals(List<String> values) {
        return values.stream().map(v -> "'" + escapeSQL(v) + "'").collect(Collectors.joining(", "));
    }

    public String number(BigDecimal value) {
        return value.stripTrailingZeros().toPlainString();
    }

    public String escapeSQL(String s) {
        return s.replace("'", "''");
    }

    private String indent(String text, int spaces) {
        String pad = " ".repeat(spaces);
        return text.lines().map(l -> l.isEmpty() ? l : pad + l).collect(Collectors.joining("\n"));
    }

    // ========================================================================
    // Supporting Records
    // ========================================================================

    public record FragmentSpec(
        String table,
        String alias,
        String subjectColumn,
        String dateColumn,
        List<String> joins,
        List<String> conditions,
        CountSpec count
    ) {
        public FragmentSpec {
            joins = List.copyOf(joins);
            conditions = List.copyOf(conditions);
        }
    }

    /**
     * @param matchingCondition per-event condition counted against {@code proportion}
     */
    public record CountSpec(
        ComparisonOperator operator,
        int count,
        Integer upperCount,
        Integer withinDays,
        Double proportion,
        String matchingCondition
    ) {}

    public record AttritionRow(int order, String predicateId, String label, String cte) {}
}
