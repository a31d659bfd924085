package dev.evalforge.evaluation;

import org.jspecify.annotations.Nullable;

/**
 * Paging and filtering for evaluation listings.
 *
 * @param limit maximum rows, 0 for no limit
 * @param offset rows to skip
 * @param status only evaluations in this status, {@code null} for all
 * @param newestFirst order by creation time descending when true, ascending otherwise
 */
public record ListOptions(
    int limit, int offset, @Nullable EvaluationStatus status, boolean newestFirst) {

  public ListOptions {
    if (limit < 0) {
      throw new IllegalArgumentException("limit must be >= 0, got " + limit);
    }
    if (offset < 0) {
      throw new IllegalArgumentException("offset must be >= 0, got " + offset);
    }
  }

  /** Newest first, unfiltered. */
  public static ListOptions firstPage(int limit) {
    return new ListOptions(limit, 0, null, true);
  }
}
