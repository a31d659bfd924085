package dev.evalforge.metrics;

/**
 * Text-generation quality averaged over prediction/reference pairs.
 *
 * <p>{@code bertScore} and {@code perplexity} are derived from ROUGE-1 ({@code bertScore =
 * rouge1}, {@code perplexity = max(1, 100 - rouge1 * 100)}); no semantic model is involved.
 */
public record GenerationMetrics(
    double bleu,
    double rouge1,
    double rouge2,
    double rougeL,
    double bertScore,
    double perplexity,
    double diversity,
    double coherence,
    double relevance) {}
