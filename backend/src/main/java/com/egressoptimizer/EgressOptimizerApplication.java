package com.egressoptimizer;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Egress Optimizer
 *
 * Analyzes collected network egress metrics: trend and seasonality, statistical
 * anomalies, tiered cost estimates and ranked optimization recommendations.
 */
@SpringBootApplication
public class EgressOptimizerApplication {

    public static void main(String[] args) {
        SpringApplication.run(EgressOptimizerApplication.class, args);
    }
}
