package com.cohortaccel.config;

import com.cohortaccel.concept.ConceptResolver;
import com.cohortaccel.concept.ReferenceTableConceptResolver;
import com.cohortaccel.dto.mapper.CriteriaDocumentMapper;
import com.cohortaccel.service.pipeline.CriteriaInterpreter;
import com.cohortaccel.service.pipeline.JsonCriteriaInterpreter;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Pipeline wiring.
 * The concept resolver and criteria interpreter are seams: a deployment with a
 * terminology service or a text-interpretation service registers its own bean
 * and these defaults back off.
 */
@Configuration
public class CohortConfig {

    @Bean(name = "conceptResolutionExecutor", destroyMethod = "shutdown")
    public ExecutorService conceptResolutionExecutor() {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "concept-resolution-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
    }

    @Bean
    @ConditionalOnMissingBean
    public ConceptResolver conceptResolver(JdbcTemplate jdbcTemplate, CohortProperties properties) {
        return new ReferenceTableConceptResolver(jdbcTemplate, properties);
    }

    @Bean
    @ConditionalOnMissingBean
    public CriteriaInterpreter criteriaInterpreter(CriteriaDocumentMapper mapper) {
        return new JsonCriteriaInterpreter(mapper);
    }
}
