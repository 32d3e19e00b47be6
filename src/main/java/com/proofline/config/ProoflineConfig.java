package com.proofline.config;

import com.proofline.verifier.ProcessVerifier;
import com.proofline.verifier.Verifier;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class ProoflineConfig {

    @Bean
    @ConditionalOnProperty(name = "proofline.verifier", havingValue = "process", matchIfMissing = true)
    public Verifier processVerifier(ProoflineProperties properties) {
        return new ProcessVerifier(properties.getCommands(), properties.workingPath());
    }

    @Bean
    @ConditionalOnMissingBean
    public MeterRegistry meterRegistry() {
        return new SimpleMeterRegistry();
    }
}
