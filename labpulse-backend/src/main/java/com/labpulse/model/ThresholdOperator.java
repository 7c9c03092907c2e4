package com.labpulse.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Comparison applied by a notification rule.
 */
public enum ThresholdOperator {
    GT("gt", ">"),
    GTE("gte", ">="),
    LT("lt", "<"),
    LTE("lte", "<="),
    EQ("eq", "==");

    private final String tag;
    private final String symbol;

    ThresholdOperator(String tag, String symbol) {
        this.tag = tag;
        this.symbol = symbol;
    }

    public String tag() {
        return tag;
    }

    public String symbol() {
        return symbol;
    }

    public boolean test(double value, double threshold) {
        return switch (this) {
            case GT -> value > threshold;
            case GTE -> value >= threshold;
            case LT -> value < threshold;
            case LTE -> value <= threshold;
            case EQ -> value == threshold;
        };
    }

    public static Optional<ThresholdOperator> fromTag(String tag) {
        if (tag == null) {
            return Optional.empty();
        }
        String normalized = tag.trim().toLowerCase(Locale.ROOT);
        for (ThresholdOperator op : values()) {
            if (op.tag.equals(normalized)) {
                return Optional.of(op);
            }
        }
        return Optional.empty();
    }
}
