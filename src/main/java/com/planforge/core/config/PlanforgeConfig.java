package com.planforge.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.planforge.core.persistence.JsonSupport;
import com.planforge.core.policy.FailurePolicy;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Spring {@link Configuration} for the shared infrastructure beans.
 * <p>
 * A {@link MeterRegistry} is normally contributed by an observability stack; when none is
 * present an in-memory {@link SimpleMeterRegistry} is used so metrics calls stay cheap no-ops
 * for export purposes.
 */
@Configuration
public class PlanforgeConfig {

    private static final Logger log = LoggerFactory.getLogger(PlanforgeConfig.class);

    @Bean
    @ConditionalOnMissingBean(MeterRegistry.class)
    public MeterRegistry simpleMeterRegistry() {
        log.debug("No MeterRegistry configured; using in-memory registry");
        return new SimpleMeterRegistry();
    }

    @Bean
    @ConditionalOnMissingBean(Clock.class)
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ObjectMapper objectMapper() {
        return JsonSupport.newObjectMapper();
    }

    @Bean
    public FailurePolicy failurePolicy(PlanforgeProperties properties) {
        var workflow = properties.getWorkflow();
        return new FailurePolicy(workflow.getMaxRetries(), workflow.getBackoffSecs(), workflow.getOnAllReviewersFailed());
    }
}
