package com.bank.mulegraph.service;

import com.bank.mulegraph.config.GraphFeatureConfig;
import com.bank.mulegraph.config.MetricsConfig;
import com.bank.mulegraph.engine.diversity.DiversityCalculator;
import com.bank.mulegraph.engine.proximity.ProximityEngine;
import com.bank.mulegraph.model.TransactionRiskEvaluation;
import com.bank.mulegraph.repository.GraphStore;
import com.bank.mulegraph.testutil.TestDataFactory;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.observation.DefaultMeterObservationHandler;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.micrometer.observation.ObservationRegistry;
import io.micrometer.observation.aop.ObservedAspect;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.aop.aspectj.annotation.AspectJProxyFactory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TransactionRiskQueryServiceObservationTest {

    @Mock private FeatureStore featureStore;
    @Mock private GraphStore graphStore;
    @Mock private MetricsConfig metricsConfig;

    private SimpleMeterRegistry meterRegistry;
    private TransactionRiskQueryService observedService;

    @BeforeEach
    void setUp() {
        GraphFeatureConfig config = TestDataFactory.createConfig();
        config.getQuery().setRealtimeDiversity(false);
        TransactionRiskQueryService target = new TransactionRiskQueryService(featureStore, graphStore,
                new DiversityCalculator(config), new ProximityEngine(config), config, metricsConfig);

        meterRegistry = new SimpleMeterRegistry();
        ObservationRegistry observationRegistry = ObservationRegistry.create();
        observationRegistry.observationConfig().observationHandler(new DefaultMeterObservationHandler(meterRegistry));

        AspectJProxyFactory factory = new AspectJProxyFactory(target);
        factory.setProxyTargetClass(true);
        factory.addAspect(new ObservedAspect(observationRegistry));
        observedService = factory.getProxy();
    }

    @Test
    void evaluateTransaction_recordsObservationTimer() {
        when(featureStore.current()).thenReturn(FeatureSnapshot.empty());

        TransactionRiskEvaluation evaluation = observedService.evaluateTransaction("SRC", "TGT");

        assertThat(evaluation.getSource().isKnown()).isFalse();
        Timer timer = meterRegistry.find("graph.evaluate_transaction").timer();
        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(1);
    }
}
