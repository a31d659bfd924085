package dev.evalforge.evaluation;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle status of an {@link Evaluation}.
 *
 * <p>Transitions: PENDING → RUNNING → COMPLETED or FAILED. Both end states are terminal; a
 * run is never restarted.
 */
public enum EvaluationStatus {

    /** Created, pipeline not started. */
    PENDING("pending"),

    /** Pipeline in progress. */
    RUNNING("running"),

    /** All stages finished; degradable stages may have used fallbacks. */
    COMPLETED("completed"),

    /** A mandatory stage failed, timed out, or the run was cancelled. */
    FAILED("failed");

    private final String wireName;

    EvaluationStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    /** Whether the lifecycle allows moving from this status to {@code target}. */
    public boolean canTransitionTo(EvaluationStatus target) {
        if (this == PENDING) {
            return target == RUNNING;
        }
        if (this == RUNNING) {
            return target == COMPLETED || target == FAILED;
        }
        return false;
    }

    @JsonCreator
    public static EvaluationStatus fromWireName(String value) {
        for (EvaluationStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown evaluation status: " + value);
    }
}
