package com.rev.saas.engine.config;

import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Tunables for the decision engine services.
 */
@Getter
@Setter
@Component
@ConfigurationProperties("decision.engine")
public class DecisionEngineConfig {

    private int defaultPageSize = 20;
    private int maxPageSize = 100;

    // compare-and-swap attempts for context/verdict appends
    private int versionAppendMaxAttempts = 5;
    // insert attempts for a new scenario set version (unique index races)
    private int scenarioInsertMaxAttempts = 3;

    private int defaultHorizonDays = 90;

    private int compareMin = 2;
    private int compareMax = 3;
}
