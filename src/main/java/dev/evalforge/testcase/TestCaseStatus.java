package dev.evalforge.testcase;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Outcome of executing a single test case.
 */
public enum TestCaseStatus {

    /** Not executed yet. */
    PENDING("pending"),

    /** Executed and met expectations. */
    PASSED("passed"),

    /** Executed but did not meet expectations. */
    FAILED("failed"),

    /** Execution itself failed (timeout, malformed output, provider error). */
    ERROR("error");

    private final String wireName;

    TestCaseStatus(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static TestCaseStatus fromWireName(String value) {
        for (TestCaseStatus status : values()) {
            if (status.wireName.equalsIgnoreCase(value)) {
                return status;
            }
        }
        throw new IllegalArgumentException("Unknown test case status: " + value);
    }
}
