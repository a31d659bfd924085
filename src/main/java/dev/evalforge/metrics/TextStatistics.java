package dev.evalforge.metrics;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Simplified text-similarity statistics used for generation metrics.
 *
 * <p>All methods are pure functions over lowercase whitespace-separated tokens. They approximate
 * BLEU and ROUGE with unigram, bigram and longest-common-subsequence overlap rather than
 * replicating the published algorithms. Every degenerate input (empty text, no tokens) yields 0.0.
 */
public final class TextStatistics {

  private TextStatistics() {}

  /** Per-pair scores for one prediction/reference pair. */
  public record PairScores(
      double bleu, double rouge1, double rouge2, double rougeL, double relevance) {}

  /** Lowercases and splits on runs of whitespace. */
  public static List<String> tokenize(String text) {
    if (text == null) {
      return List.of();
    }
    String trimmed = text.strip().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return List.of();
    }
    return Arrays.asList(trimmed.split("\\s+"));
  }

  /**
   * BLEU-like score: clipped unigram precision times a brevity penalty.
   *
   * <p>Each predicted token may consume one occurrence of the same reference token, so repeated
   * predictions are not double counted. When the prediction is shorter than the reference, the
   * precision is multiplied by {@code exp(1 - refLen / predLen)}.
   */
  public static double bleu(String prediction, String reference) {
    List<String> predTokens = tokenize(prediction);
    List<String> refTokens = tokenize(reference);
    if (predTokens.isEmpty() || refTokens.isEmpty()) {
      return 0.0;
    }

    Map<String, Integer> remaining = new HashMap<>();
    for (String token : refTokens) {
      remaining.merge(token, 1, Integer::sum);
    }
    int matches = 0;
    for (String token : predTokens) {
      int count = remaining.getOrDefault(token, 0);
      if (count > 0) {
        matches++;
        remaining.put(token, count - 1);
      }
    }

    double precision = (double) matches / predTokens.size();
    double brevityPenalty = 1.0;
    if (predTokens.size() < refTokens.size()) {
      brevityPenalty = Math.exp(1.0 - (double) refTokens.size() / predTokens.size());
    }
    return brevityPenalty * precision;
  }

  /**
   * Recall-oriented overlap: the fraction of reference items that also occur anywhere in the
   * prediction.
   */
  public static double overlap(List<String> predicted, List<String> reference) {
    if (predicted.isEmpty() || reference.isEmpty()) {
      return 0.0;
    }
    Set<String> predictedSet = new HashSet<>(predicted);
    long found = reference.stream().filter(predictedSet::contains).count();
    return (double) found / reference.size();
  }

  /** Adjacent token pairs joined by a single space. */
  public static List<String> bigrams(List<String> tokens) {
    if (tokens.size() < 2) {
      return List.of();
    }
    List<String> bigrams = new ArrayList<>(tokens.size() - 1);
    for (int i = 0; i < tokens.size() - 1; i++) {
      bigrams.add(tokens.get(i) + " " + tokens.get(i + 1));
    }
    return bigrams;
  }

  /** ROUGE-1: unigram overlap. */
  public static double rouge1(String prediction, String reference) {
    return overlap(tokenize(prediction), tokenize(reference));
  }

  /** ROUGE-2: bigram overlap, 0.0 unless both sides have at least two tokens. */
  public static double rouge2(String prediction, String reference) {
    List<String> predTokens = tokenize(prediction);
    List<String> refTokens = tokenize(reference);
    if (predTokens.size() < 2 || refTokens.size() < 2) {
      return 0.0;
    }
    return overlap(bigrams(predTokens), bigrams(refTokens));
  }

  /** ROUGE-L: LCS length over the longer token sequence. */
  public static double rougeL(String prediction, String reference) {
    return rougeL(tokenize(prediction), tokenize(reference));
  }

  static double rougeL(List<String> predTokens, List<String> refTokens) {
    if (predTokens.isEmpty() || refTokens.isEmpty()) {
      return 0.0;
    }
    int lcs = longestCommonSubsequence(predTokens, refTokens);
    return (double) lcs / Math.max(predTokens.size(), refTokens.size());
  }

  /** Classic O(m*n) dynamic-programming longest common subsequence length. */
  public static int longestCommonSubsequence(List<String> a, List<String> b) {
    int m = a.size();
    int n = b.size();
    int[][] dp = new int[m + 1][n + 1];
    for (int i = 1; i <= m; i++) {
      for (int j = 1; j <= n; j++) {
        if (a.get(i - 1).equals(b.get(j - 1))) {
          dp[i][j] = dp[i - 1][j - 1] + 1;
        } else {
          dp[i][j] = Math.max(dp[i - 1][j], dp[i][j - 1]);
        }
      }
    }
    return dp[m][n];
  }

  /** Type-token ratio: unique tokens over total tokens. */
  public static double lexicalDiversity(String text) {
    List<String> tokens = tokenize(text);
    if (tokens.isEmpty()) {
      return 0.0;
    }
    return (double) new HashSet<>(tokens).size() / tokens.size();
  }

  /**
   * Sentence-length regularity: {@code max(0, 1 - cv / 2)} where cv is the coefficient of variation
   * of per-sentence word counts. Text with fewer than two non-empty sentences scores 1.0.
   */
  public static double coherence(String text) {
    if (text == null) {
      return 1.0;
    }
    List<Integer> lengths = new ArrayList<>();
    for (String sentence : text.split("\\.")) {
      String trimmed = sentence.strip();
      if (!trimmed.isEmpty()) {
        lengths.add(trimmed.split("\\s+").length);
      }
    }
    if (lengths.size() < 2) {
      return 1.0;
    }

    double mean = lengths.stream().mapToInt(Integer::intValue).average().orElse(0.0);
    if (mean == 0.0) {
      return 1.0;
    }
    double variance = 0.0;
    for (int length : lengths) {
      variance += (length - mean) * (length - mean);
    }
    variance /= lengths.size();

    double cv = Math.sqrt(variance) / mean;
    return Math.max(0.0, 1.0 - cv / 2.0);
  }

  /** All overlap scores for one pair, tokenizing each side once. */
  public static PairScores score(String prediction, String reference) {
    List<String> predTokens = tokenize(prediction);
    List<String> refTokens = tokenize(reference);
    double rouge1 = overlap(predTokens, refTokens);
    double rouge2 =
        predTokens.size() > 1 && refTokens.size() > 1
            ? overlap(bigrams(predTokens), bigrams(refTokens))
            : 0.0;
    return new PairScores(
        bleu(prediction, reference), rouge1, rouge2, rougeL(predTokens, refTokens), rouge1);
  }
}
