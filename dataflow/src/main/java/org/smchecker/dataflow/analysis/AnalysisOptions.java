package org.smchecker.dataflow.analysis;

import java.util.Map;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Exploration budgets and switches of a {@link PathSensitiveAnalysis}. Instances are immutable and
 * can be shared by analyses running at the same time.
 *
 * <p>Options can be given programmatically through {@link #builder()}, or as the key/value pairs a
 * checker receives on the command line ({@code -Asmchecker.maxPaths=500}), see {@link
 * #fromMap(Map)}.
 */
public final class AnalysisOptions {

    public static final String MAX_PATHS = "smchecker.maxPaths";
    public static final String MAX_STEPS_PER_PATH = "smchecker.maxStepsPerPath";
    public static final String PARALLELISM = "smchecker.parallelism";
    public static final String MERGE_JOIN_POINTS = "smchecker.mergeJoinPoints";

    public static final int DEFAULT_MAX_PATHS = 10_000;
    public static final int DEFAULT_MAX_STEPS_PER_PATH = 1_000;

    private static final AnalysisOptions DEFAULTS = builder().build();

    private final int maxPaths;
    private final int maxStepsPerPath;
    private final int parallelism;
    private final boolean mergeJoinPoints;

    private AnalysisOptions(Builder builder) {
        this.maxPaths = builder.maxPaths;
        this.maxStepsPerPath = builder.maxStepsPerPath;
        this.parallelism = builder.parallelism;
        this.mergeJoinPoints = builder.mergeJoinPoints;
    }

    public static AnalysisOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Read options from key/value pairs. Keys that are absent keep their default; unrelated keys
     * are ignored.
     *
     * @throws IllegalArgumentException if a value cannot be parsed or is out of range
     */
    public static AnalysisOptions fromMap(Map<String, String> options) {
        Builder builder = builder();
        String value = options.get(MAX_PATHS);
        if (value != null) {
            builder.maxPaths(parseInt(MAX_PATHS, value));
        }
        value = options.get(MAX_STEPS_PER_PATH);
        if (value != null) {
            builder.maxStepsPerPath(parseInt(MAX_STEPS_PER_PATH, value));
        }
        value = options.get(PARALLELISM);
        if (value != null) {
            builder.parallelism(parseInt(PARALLELISM, value));
        }
        value = options.get(MERGE_JOIN_POINTS);
        if (value != null) {
            builder.mergeJoinPoints(parseBoolean(MERGE_JOIN_POINTS, value));
        }
        return builder.build();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Option " + key + " expects an integer, got '" + value + "'", e);
        }
    }

    private static boolean parseBoolean(String key, String value) {
        String v = value.trim();
        if (v.equalsIgnoreCase("true")) {
            return true;
        }
        if (v.equalsIgnoreCase("false")) {
            return false;
        }
        throw new IllegalArgumentException(
                "Option " + key + " expects true or false, got '" + value + "'");
    }

    /** @return the maximum number of paths one analysis run may start */
    public int getMaxPaths() {
        return maxPaths;
    }

    /** @return the maximum number of blocks one path may visit */
    public int getMaxStepsPerPath() {
        return maxStepsPerPath;
    }

    /** @return the number of threads used to explore paths; 1 means sequential */
    public int getParallelism() {
        return parallelism;
    }

    /** @return whether equal paths meeting at a join block continue as one */
    public boolean isMergeJoinPoints() {
        return mergeJoinPoints;
    }

    @Override
    public boolean equals(@Nullable Object obj) {
        if (!(obj instanceof AnalysisOptions)) {
            return false;
        }
        AnalysisOptions other = (AnalysisOptions) obj;
        return maxPaths == other.maxPaths
                && maxStepsPerPath == other.maxStepsPerPath
                && parallelism == other.parallelism
                && mergeJoinPoints == other.mergeJoinPoints;
    }

    @Override
    public int hashCode() {
        int result = maxPaths;
        result = 31 * result + maxStepsPerPath;
        result = 31 * result + parallelism;
        return 31 * result + (mergeJoinPoints ? 1 : 0);
    }

    @Override
    public String toString() {
        return "AnalysisOptions{maxPaths="
                + maxPaths
                + ", maxStepsPerPath="
                + maxStepsPerPath
                + ", parallelism="
                + parallelism
                + ", mergeJoinPoints="
                + mergeJoinPoints
                + "}";
    }

    /** Builder for {@link AnalysisOptions}. */
    public static final class Builder {
        private int maxPaths = DEFAULT_MAX_PATHS;
        private int maxStepsPerPath = DEFAULT_MAX_STEPS_PER_PATH;
        private int parallelism = 1;
        private boolean mergeJoinPoints = true;

        private Builder() {}

        public Builder maxPaths(int maxPaths) {
            if (maxPaths < 1) {
                throw new IllegalArgumentException(
                        "Option " + MAX_PATHS + " must be at least 1, got " + maxPaths);
            }
            this.maxPaths = maxPaths;
            return this;
        }

        public Builder maxStepsPerPath(int maxStepsPerPath) {
            if (maxStepsPerPath < 1) {
                throw new IllegalArgumentException(
                        "Option "
                                + MAX_STEPS_PER_PATH
                                + " must be at least 1, got "
                                + maxStepsPerPath);
            }
            this.maxStepsPerPath = maxStepsPerPath;
            return this;
        }

        public Builder parallelism(int parallelism) {
            if (parallelism < 1) {
                throw new IllegalArgumentException(
                        "Option " + PARALLELISM + " must be at least 1, got " + parallelism);
            }
            this.parallelism = parallelism;
            return this;
        }

        public Builder mergeJoinPoints(boolean mergeJoinPoints) {
            this.mergeJoinPoints = mergeJoinPoints;
            return this;
        }

        public AnalysisOptions build() {
            return new AnalysisOptions(this);
        }
    }
}
