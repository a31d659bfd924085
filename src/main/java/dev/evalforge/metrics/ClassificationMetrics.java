package dev.evalforge.metrics;

import java.util.Map;

/**
 * Classification quality over a set of (predicted, expected) label pairs.
 *
 * @param accuracy fraction of pairs where prediction equals ground truth
 * @param precision per-class precision
 * @param recall per-class recall
 * @param f1Score per-class harmonic mean of precision and recall
 * @param macroF1 unweighted mean of the per-class F1 values
 * @param weightedF1 support-weighted mean of the per-class F1 values
 * @param confusionMatrix true class to (predicted class to count)
 * @param support number of pairs per true class
 */
public record ClassificationMetrics(
    double accuracy,
    Map<String, Double> precision,
    Map<String, Double> recall,
    Map<String, Double> f1Score,
    double macroF1,
    double weightedF1,
    Map<String, Map<String, Integer>> confusionMatrix,
    Map<String, Integer> support) {}
