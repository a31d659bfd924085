package dev.evalforge.evaluation;

import org.jspecify.annotations.Nullable;

/** A stage did not produce a usable result. Never escapes the orchestrator. */
final class StageException extends Exception {

  static final String CANCELLED = "cancelled";

  private final PipelineStage stage;
  private final boolean cancelled;

  StageException(PipelineStage stage, String reason, @Nullable Throwable cause) {
    this(stage, reason, cause, false);
  }

  private StageException(
      PipelineStage stage, String reason, @Nullable Throwable cause, boolean cancelled) {
    super(reason, cause);
    this.stage = stage;
    this.cancelled = cancelled;
  }

  static StageException cancelled(PipelineStage stage, @Nullable Throwable cause) {
    return new StageException(stage, CANCELLED, cause, true);
  }

  PipelineStage stage() {
    return stage;
  }

  /** Cancellation is never degraded to a fallback. */
  boolean isCancelled() {
    return cancelled;
  }
}
