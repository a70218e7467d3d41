package com.cohortaccel.service.pipeline;

import com.cohortaccel.catalog.CatalogAdapter;
import com.cohortaccel.concept.ConceptResolutionService;
import com.cohortaccel.config.CohortProperties;
import com.cohortaccel.service.compiler.QueryCompilerService;
import com.cohortaccel.service.execution.PlanRepairService;
import com.cohortaccel.service.execution.QueryExecutionService;
import com.cohortaccel.service.funnel.FunnelService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.UUID;

/**
 * Creates cohort sessions wired to the shared pipeline services. Sessions are
 * stateful and are not Spring beans.
 */
@Slf4j
@Component
public class CohortSessionFactory {

    private final CriteriaInterpreter interpreter;
    private final ConceptResolutionService conceptService;
    private final CatalogAdapter catalogAdapter;
    private final QueryCompilerService compiler;
    private final QueryExecutionService executionService;
    private final PlanRepairService repairService;
    private final FunnelService funnelService;
    private final CohortProperties properties;

    public CohortSessionFactory(
            CriteriaInterpreter interpreter,
            ConceptResolutionService conceptService,
            CatalogAdapter catalogAdapter,
            QueryCompilerService compiler,
            QueryExecutionService executionService,
            PlanRepairService repairService,
            FunnelService funnelService,
            CohortProperties properties) {
        this.interpreter = interpreter;
        this.conceptService = conceptService;
        this.catalogAdapter = catalogAdapter;
        this.compiler = compiler;
        this.executionService = executionService;
        this.repairService = repairService;
        this.funnelService = funnelService;
        this.properties = properties;
    }

    public CohortSession create() {
        return create(UUID.randomUUID().toString());
    }

    public CohortSession create(String sessionId) {
        log.debug("Opening cohort session {}", sessionId);
        return new CohortSession(sessionId, interpreter, conceptService, catalogAdapter, compiler,
            executionService, repairService, funnelService, properties);
    }
}
