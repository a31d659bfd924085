package dev.evalforge.suggestion;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Review state of an optimization suggestion.
 */
public enum SuggestionStatus {

    /** Produced by the optimizer, not reviewed yet. */
    PENDING("pending"),

    /** Accepted by a reviewer but not applied to the prompt. */
    ACCEPTED("accepted"),

    /** Dismissed by a reviewer. */
    REJECTED("rejected"),

    /** The new prompt text has been adopted. */
    APPLIED("applied");

    private final String wireName;

    SuggestionStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static SuggestionStatus fromWireName(String value) {
        for (SuggestionStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown suggestion status: " + value);
    }
}
