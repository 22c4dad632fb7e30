package com.calibrationplatform.calibration.config;

import com.calibrationplatform.calibration.engine.CalibrationEngine;
import com.calibrationplatform.common.certificate.CertificateBuilder;
import com.calibrationplatform.common.config.CalibrationConfiguration;
import com.calibrationplatform.common.config.DecisionPolicy;
import com.calibrationplatform.common.decision.ValidationDecisionLayer;
import com.calibrationplatform.common.fusion.ChoquetFusionOperator;
import com.calibrationplatform.common.fusion.FusionOperator;
import com.calibrationplatform.common.registry.IntrinsicScoreRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ResourceLoader;

import java.time.Clock;

/**
 * Wires the pure calibration logic from common-lib into Spring.
 * The configuration and intrinsic registry are loaded once at startup; a load failure
 * stops the application context.
 */
@Configuration
public class CalibrationServiceConfig {

    @Value("${calibration.config-location:classpath:calibration/calibration-config.json}")
    private String configLocation;

    @Value("${calibration.intrinsic-location:classpath:calibration/intrinsic-scores.json}")
    private String intrinsicLocation;

    @Value("${spring.application.version:1.0.0}")
    private String validatorVersion;

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        return mapper;
    }

    @Bean
    public Clock calibrationClock() {
        return Clock.systemUTC();
    }

    @Bean
    public CalibrationConfigurationProvider calibrationConfigurationProvider(ObjectMapper objectMapper,
                                                                            ResourceLoader resourceLoader) {
        return new CalibrationConfigurationProvider(
            new CalibrationConfigurationLoader(objectMapper, resourceLoader), configLocation);
    }

    @Bean
    public CalibrationConfiguration calibrationConfiguration(CalibrationConfigurationProvider provider) {
        return provider.get();
    }

    @Bean
    public IntrinsicScoreRegistry intrinsicScoreRegistry(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        return new IntrinsicScoreLoader(objectMapper, resourceLoader).load(intrinsicLocation);
    }

    @Bean
    public FusionOperator fusionOperator() {
        return new ChoquetFusionOperator();
    }

    @Bean
    public CertificateBuilder certificateBuilder(FusionOperator fusionOperator, Clock calibrationClock) {
        return new CertificateBuilder(fusionOperator, calibrationClock, validatorVersion);
    }

    @Bean
    public CalibrationEngine calibrationEngine(CalibrationConfiguration configuration,
                                               IntrinsicScoreRegistry intrinsicScoreRegistry,
                                               FusionOperator fusionOperator,
                                               CertificateBuilder certificateBuilder) {
        return new CalibrationEngine(configuration, intrinsicScoreRegistry, fusionOperator, certificateBuilder);
    }

    @Bean
    public DecisionPolicy decisionPolicy(CalibrationConfiguration configuration) {
        return configuration.decisionPolicy();
    }

    @Bean
    public ValidationDecisionLayer validationDecisionLayer(DecisionPolicy decisionPolicy) {
        return new ValidationDecisionLayer(decisionPolicy);
    }
}
