package org.smchecker.dataflow.analysis;

/** What a path knows about the truth of one condition. */
public enum FactValue {
    /** Nothing is known; both branches on the condition are feasible. */
    UNKNOWN,
    /** The condition was true on an edge this path took. */
    TRUE,
    /** The condition was false on an edge this path took. */
    FALSE;

    public static FactValue of(boolean value) {
        return value ? TRUE : FALSE;
    }

    public boolean isKnown() {
        return this != UNKNOWN;
    }

    /**
     * Whether a requirement that the condition be {@code value} is consistent with this fact.
     * Unknown facts are consistent with both values.
     */
    public boolean admits(boolean value) {
        return this == UNKNOWN || this == of(value);
    }
}
