package dev.evalforge.testcase;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which kind of input a test case probes.
 *
 * <p>Category drives both the simulated pass probability and the score multiplier applied when no
 * real executor is configured.
 */
public enum TestCaseCategory {

    /** Ordinary, representative input. */
    NORMAL("normal"),

    /** Boundary input: empty, very long, unusual formatting. */
    EDGE_CASE("edge_case"),

    /** Input crafted to mislead or break the prompt. */
    ADVERSARIAL("adversarial");

    private final String wireName;

    TestCaseCategory(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    @JsonCreator
    public static TestCaseCategory fromWireName(String value) {
        for (TestCaseCategory category : values()) {
            if (category.wireName.equalsIgnoreCase(value) || category.name().equalsIgnoreCase(value)) {
                return category;
            }
        }
        throw new IllegalArgumentException("Unknown test case category: " + value);
    }
}
