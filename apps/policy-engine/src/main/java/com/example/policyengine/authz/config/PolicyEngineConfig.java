package com.example.policyengine.authz.config;

import com.example.policyengine.authz.engine.PolicyEvaluator;
import com.example.policyengine.authz.model.PolicyRecord;
import com.example.policyengine.authz.source.InMemoryPolicySource;
import com.example.policyengine.authz.source.PolicySource;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Wires the evaluator and a policy source seeded from configuration.
 * A persistent {@link PolicySource} bean replaces the in-memory one.
 */
@Slf4j
@Configuration
public class PolicyEngineConfig {

    @Bean
    public PolicyEvaluator policyEvaluator() {
        return new PolicyEvaluator();
    }

    @Bean
    @ConditionalOnMissingBean(PolicySource.class)
    public InMemoryPolicySource inMemoryPolicySource(PolicyEngineProperties properties) {
        List<PolicyRecord> seeded = properties.policies().stream()
                .map(PolicyEngineProperties.PolicyDefinition::toPolicyRecord)
                .toList();

        log.info("Loaded {} access policies from configuration", seeded.size());
        seeded.forEach(p -> log.debug("  - {} (priority={}): {} {} -> {} {} {}",
                p.id(), p.priority(), p.subjectKind().label(), p.subjectId(),
                p.resourceKind().label(), p.isGlobal() ? "*" : p.resourceId(), p.actions()));

        return new InMemoryPolicySource(seeded);
    }
}
