package dev.evalforge;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Entry point for the EvalForge evaluation engine.
 *
 * <p>Runs without a web server; callers drive evaluations through
 * {@link dev.evalforge.evaluation.EvaluationOrchestrator} and manage custom metrics through
 * {@link dev.evalforge.custom.CustomMetricService}.
 */
@SpringBootApplication
public class EvalForgeApplication {
    public static void main(String[] args) {
        SpringApplication.run(EvalForgeApplication.class, args);
    }
}
