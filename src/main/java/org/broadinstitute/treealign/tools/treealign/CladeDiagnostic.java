package org.broadinstitute.treealign.tools.treealign;

import org.broadinstitute.treealign.utils.Utils;

/**
 * Why the traversal stopped (or pruned a child) at a clade, with the threshold that was missed.
 */
public final class CladeDiagnostic {

    public enum Category {
        /** Not enough cells, leaves, levels or features to go on. */
        INSUFFICIENT_DATA,
        /** The clone assigner was not confident enough. */
        INSUFFICIENT_CONFIDENCE
    }

    public enum StopReason {
        LEVEL_LIMIT_EXCEEDED(Category.INSUFFICIENT_DATA),
        TOO_FEW_ELIGIBLE_CELLS(Category.INSUFFICIENT_DATA),
        TOO_FEW_LEAVES(Category.INSUFFICIENT_DATA),
        CHILD_TOO_FEW_LEAVES(Category.INSUFFICIENT_DATA),
        NO_CLEAN_CHILD(Category.INSUFFICIENT_DATA),
        NO_USABLE_INPUT(Category.INSUFFICIENT_DATA),
        TOO_FEW_DISCRIMINATING_FEATURES(Category.INSUFFICIENT_DATA),
        RECORD_FREQUENCY_NOT_REACHED(Category.INSUFFICIENT_CONFIDENCE),
        PROCEED_FREQUENCY_NOT_REACHED(Category.INSUFFICIENT_CONFIDENCE);

        private final Category category;

        StopReason(final Category category) {
            this.category = category;
        }

        public Category getCategory() {
            return category;
        }
    }

    private final String cladeName;
    private final int level;
    private final StopReason reason;
    private final String threshold;
    private final double actual;
    private final double required;

    public CladeDiagnostic(final String cladeName, final int level, final StopReason reason,
                           final String threshold, final double actual, final double required) {
        this.cladeName = Utils.nonNull(cladeName);
        this.level = level;
        this.reason = Utils.nonNull(reason);
        this.threshold = Utils.nonNull(threshold);
        this.actual = actual;
        this.required = required;
    }

    public String getCladeName() {
        return cladeName;
    }

    public int getLevel() {
        return level;
    }

    public StopReason getReason() {
        return reason;
    }

    /**
     * @return the argument name of the threshold that was missed.
     */
    public String getThreshold() {
        return threshold;
    }

    public double getActual() {
        return actual;
    }

    public double getRequired() {
        return required;
    }

    @Override
    public String toString() {
        return String.format("At %s (level %d): %s, %s is %s but %s is required.",
                cladeName, level, reason, threshold, format(actual), format(required));
    }

    private static String format(final double value) {
        return value == Math.rint(value) && !Double.isInfinite(value) ? String.valueOf((long) value) : String.valueOf(value);
    }
}
