package com.bank.mulegraph.config;

import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Turns {@code @Observed} methods into observations (timer {@code graph.evaluate_transaction}
 * and its long-task counterpart in the meter registry).
 */
@Configuration
public class ObservationConfig {

    @Bean
    public ObservedAspect observedAspect(ObjectProvider<ObservationRegistry> observationRegistry) {
        return new ObservedAspect(observationRegistry.getIfAvailable(() -> ObservationRegistry.NOOP));
    }
}
