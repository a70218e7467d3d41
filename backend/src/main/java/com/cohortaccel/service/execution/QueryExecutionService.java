package com.cohortaccel.service.execution;

import com.cohortaccel.config.CohortProperties;
import com.cohortaccel.model.enums.ExecutionErrorKind;
import com.cohortaccel.model.enums.ExecutionMode;
import com.cohortaccel.model.enums.FunnelWarningKind;
import com.cohortaccel.model.execution.ExecutionResult;
import com.cohortaccel.model.funnel.FunnelStep;
import com.cohortaccel.model.funnel.FunnelWarning;
import com.cohortaccel.model.plan.QueryPlan;
import com.cohortaccel.service.compiler.SqlFragmentTemplateService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.ColumnMapRowMapper;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.PreparedStatementCreator;
import org.springframework.jdbc.core.RowMapperResultSetExtractor;
import org.springframework.stereotype.Service;

import java.sql.PreparedStatement;
import java.time.Duration;
import java.util.*;

/**
 * Runs compiled plans against the clinical data store.
 * <p>
 * Count-first: the count query always runs, and completes, before any row is
 * requested. Query failures are classified and returned as error results;
 * nothing is retried here.
 */
@Slf4j
@Service
public class QueryExecutionService {

    private final JdbcTemplate jdbcTemplate;
    private final SqlSafetyGuard safetyGuard;
    private final ExecutionErrorClassifier classifier;
    private final SqlFragmentTemplateService templates;
    private final CohortProperties properties;

    public QueryExecutionService(
            JdbcTemplate jdbcTemplate,
            SqlSafetyGuard safetyGuard,
            ExecutionErrorClassifier classifier,
            SqlFragmentTemplateService templates,
            CohortProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.safetyGuard = safetyGuard;
        this.classifier = classifier;
        this.templates = templates;
        this.properties = properties;
    }

    // ========================================================================
    // Public API
    // ========================================================================

    public ExecutionResult execute(QueryPlan plan, ExecutionMode mode) {
        return execute(plan, mode, properties.getExecution().getQueryTimeout());
    }

    public ExecutionResult execute(QueryPlan plan, ExecutionMode mode, Duration timeout) {
        long start = System.nanoTime();
        int limit = Math.min(properties.getExecution().getPreviewRowLimit(), 1000);
        String previewSql = templates.preview(plan.cohortSql(), limit);

        for (String sql : mode == ExecutionMode.PREVIEW ? List.of(plan.countSql(), previewSql) : List.of(plan.countSql())) {
            Optional<String> violation = safetyGuard.findViolation(sql);
            if (violation.isPresent()) {
                log.error("Plan {} rejected by safety check: {}", plan.planId(), violation.get());
                return ExecutionResult.error(mode, plan.version(), elapsedMs(start),
                    ExecutionErrorKind.SAFETY_VIOLATION, violation.get());
            }
        }

        try {
            long count = queryCount(plan.countSql(), timeout);
            List<Map<String, Object>> rows = List.of();
            List<String> warnings = new ArrayList<>();
            if (mode == ExecutionMode.PREVIEW && count > 0) {
                rows = queryRows(previewSql, limit, timeout);
                if (count > rows.size()) {
                    warnings.add(String.format("Preview shows %d of %d subjects", rows.size(), count));
                }
            }
            double timing = elapsedMs(start);
            log.info("Plan {} {} -> {} subjects in {} ms", plan.planId(), mode.getValue(), count, Math.round(timing));
            return ExecutionResult.ok(mode, plan.version(), count, timing, rows, cohortFlags(count), warnings);
        } catch (DataAccessException e) {
            ExecutionErrorKind kind = classifier.classify(e);
            String message = rootMessage(e);
            log.warn("Plan {} failed with {}: {}", plan.planId(), kind.getValue(), message);
            return ExecutionResult.error(mode, plan.version(), elapsedMs(start), kind, message);
        }
    }

    /**
     * Run a single-value count query.
     *
     * @throws ExecutionException when the statement is unsafe or fails
     */
    public long count(String sql, Duration timeout) {
        Optional<String> violation = safetyGuard.findViolation(sql);
        if (violation.isPresent()) {
            throw new ExecutionException(ExecutionErrorKind.SAFETY_VIOLATION, violation.get());
        }
        try {
            return queryCount(sql, timeout);
        } catch (DataAccessException e) {
            ExecutionErrorKind kind = classifier.classify(e);
            throw new ExecutionException(kind, rootMessage(e), e);
        }
    }

    public long count(String sql) {
        return count(sql, properties.getExecution().getQueryTimeout());
    }

    /**
     * Flags that depend only on the final cohort size.
     */
    public List<FunnelWarning> cohortFlags(long count) {
        List<FunnelWarning> flags = new ArrayList<>();
        if (count == 0) {
            flags.add(new FunnelWarning(FunnelWarningKind.EMPTY_COHORT, FunnelStep.FINAL,
                "Final cohort is empty"));
        }
        long ceiling = properties.getExecution().getHugeCohortCeiling();
        if (count > ceiling) {
            flags.add(new FunnelWarning(FunnelWarningKind.HUGE_COHORT, FunnelStep.FINAL,
                String.format("Final cohort of %d subjects exceeds the ceiling of %d", count, ceiling)));
        }
        return flags;
    }

    // ========================================================================
    // JDBC
    // ========================================================================

    private long queryCount(String sql, Duration timeout) {
        Long count = jdbcTemplate.query(statement(sql, timeout, 1), rs -> rs.next() ? rs.getLong(1) : 0L);
        return count != null ? count : 0L;
    }

    private List<Map<String, Object>> queryRows(String sql, int limit, Duration timeout) {
        List<Map<String, Object>> rows = jdbcTemplate.query(statement(sql, timeout, limit),
            new RowMapperResultSetExtractor<>(new ColumnMapRowMapper()));
        List<Map<String, Object>> result = new ArrayList<>();
        if (rows != null) {
            for (Map<String, Object> row : rows) {
                Map<String, Object> normalized = new LinkedHashMap<>();
                row.forEach((key, value) -> normalized.put(key.toLowerCase(Locale.ROOT), value));
                result.add(normalized);
            }
        }
        return result;
    }

    private PreparedStatementCreator statement(String sql, Duration timeout, int maxRows) {
        return con -> {
            PreparedStatement ps = con.prepareStatement(sql);
            ps.setQueryTimeout((int) Math.max(1, timeout.toSeconds()));
            ps.setMaxRows(maxRows);
            return ps;
        };
    }

    private static double elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000.0;
    }

    private static String rootMessage(Throwable e) {
        Throwable root = e;
        while (root.getCause() != null && root.getCause() != root) {
            root = root.getCause();
        }
        return root.getMessage() != null ? root.getMessage() : e.getMessage();
    }
}
