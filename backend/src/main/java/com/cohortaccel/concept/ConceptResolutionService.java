package com.cohortaccel.concept;

import com.cohortaccel.config.CohortProperties;
import com.cohortaccel.model.criteria.ConceptResolution;
import com.cohortaccel.model.criteria.CriteriaSet;
import com.cohortaccel.model.criteria.Gap;
import com.cohortaccel.model.criteria.Predicate;
import com.cohortaccel.model.enums.CodeSystem;
import com.cohortaccel.model.enums.GapKind;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.*;

/**
 * Concept stage of a session: resolves every predicate that still needs codes.
 * <p>
 * Each resolver call is bounded by {@code cohort.concepts.resolution-timeout}.
 * A predicate that cannot be resolved (no mapping, resolver failure, timeout)
 * is recorded as a skip gap on the criteria set instead of failing the stage,
 * so after this call {@link CriteriaSet#pendingConceptResolutions()} is empty.
 */
@Slf4j
@Service
public class ConceptResolutionService {

    private final ConceptResolver resolver;
    private final ExecutorService executor;
    private final CohortProperties properties;

    public ConceptResolutionService(
            ConceptResolver resolver,
            @Qualifier("conceptResolutionExecutor") ExecutorService executor,
            CohortProperties properties) {
        this.resolver = resolver;
        this.executor = executor;
        this.properties = properties;
    }

    public CriteriaSet resolvePending(CriteriaSet criteriaSet) {
        CriteriaSet current = criteriaSet;
        for (Predicate predicate : criteriaSet.pendingConceptResolutions()) {
            current = resolve(current, predicate);
        }
        return current;
    }

    private CriteriaSet resolve(CriteriaSet criteriaSet, Predicate predicate) {
        ConceptResolution existing = predicate.conceptResolution();
        if (existing != null && !existing.resolved()) {
            // An earlier resolution attempt already failed; keep it and skip the predicate.
            log.info("Predicate {} carries an unresolved mapping; skipping", predicate.id());
            return criteriaSet.withGap(unresolvedGap(predicate, existing));
        }

        CodeSystem hint = existing != null ? existing.codeSystem() : null;
        Duration timeout = properties.getConcepts().getResolutionTimeout();
        Future<ConceptResolution> future = executor.submit(
            () -> resolver.resolve(predicate.concept(), predicate.domain(), hint));
        try {
            ConceptResolution resolution = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (resolution == null || !resolution.resolved()) {
                ConceptResolution unresolved = resolution != null
                    ? resolution : ConceptResolution.unresolved("Resolver returned no mapping", null);
                log.info("Concept '{}' for predicate {} is unresolved", predicate.concept(), predicate.id());
                return criteriaSet
                    .withPredicate(predicate.id(), p -> p.toBuilder().conceptResolution(unresolved).build())
                    .withGap(unresolvedGap(predicate, unresolved));
            }
            log.info("Resolved predicate {} to {} {} codes ({} confidence)", predicate.id(),
                resolution.codeValues().size(),
                resolution.codeSystem() != null ? resolution.codeSystem().getCode() : "uncoded",
                resolution.confidence().getValue());
            return criteriaSet.withResolution(predicate.id(), resolution);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Concept resolution for predicate {} timed out after {}", predicate.id(), timeout);
            return criteriaSet.withGap(new Gap(predicate.id(), GapKind.RESOLUTION_TIMEOUT,
                "Concept resolution for '" + predicate.concept() + "' timed out after " + timeout.toSeconds() + "s",
                "Supply a manual code mapping or retry the resolution", true));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Concept resolution for predicate {} failed: {}", predicate.id(), cause.getMessage());
            return criteriaSet.withGap(new Gap(predicate.id(), GapKind.UNRESOLVED_CONCEPT,
                "Concept resolution for '" + predicate.concept() + "' failed: " + cause.getMessage(),
                "Supply a manual code mapping", true));
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while resolving predicate " + predicate.id(), e);
        }
    }

    private Gap unresolvedGap(Predicate predicate, ConceptResolution resolution) {
        String proposal = resolution.alternatives().isEmpty()
            ? "Supply a manual code mapping"
            : "Select one of " + resolution.alternatives().size() + " alternative mappings or supply a manual one";
        String issue = "Concept '" + predicate.concept() + "' could not be mapped to codes"
            + (resolution.notes() != null ? ": " + resolution.notes() : "");
        return new Gap(predicate.id(), GapKind.UNRESOLVED_CONCEPT, issue, proposal, true);
    }
}
