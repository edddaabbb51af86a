package in.sitewatch.domain.rule;

import java.util.Locale;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Comparison applied between a sampled metric value and a rule threshold.
 */
public enum ConditionOperator {
    GT {
        @Override
        public boolean test(Object value, Object threshold) {
            return compareNumbers(value, threshold) > 0;
        }
    },
    GTE {
        @Override
        public boolean test(Object value, Object threshold) {
            return compareNumbers(value, threshold) >= 0;
        }
    },
    LT {
        @Override
        public boolean test(Object value, Object threshold) {
            return compareNumbers(value, threshold) < 0;
        }
    },
    LTE {
        @Override
        public boolean test(Object value, Object threshold) {
            return compareNumbers(value, threshold) <= 0;
        }
    },
    EQ {
        @Override
        public boolean test(Object value, Object threshold) {
            return areEqual(value, threshold);
        }
    },
    NE {
        @Override
        public boolean test(Object value, Object threshold) {
            return !areEqual(value, threshold);
        }
    },
    CONTAINS {
        @Override
        public boolean test(Object value, Object threshold) {
            requirePresent(value, threshold);
            return String.valueOf(value).contains(String.valueOf(threshold));
        }
    },
    REGEX {
        @Override
        public boolean test(Object value, Object threshold) {
            requirePresent(value, threshold);
            try {
                return Pattern.compile(String.valueOf(threshold)).matcher(String.valueOf(value)).find();
            } catch (PatternSyntaxException e) {
                throw new IllegalArgumentException("Invalid regex threshold: " + threshold, e);
            }
        }
    };

    /**
     * Evaluate the operator.
     *
     * @throws IllegalArgumentException if the operands cannot be compared
     */
    public abstract boolean test(Object value, Object threshold);

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ConditionOperator fromWire(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Operator is required");
        }
        return valueOf(value.trim().toUpperCase(Locale.ROOT));
    }

    private static int compareNumbers(Object value, Object threshold) {
        return Double.compare(toNumber(value, "value"), toNumber(threshold, "threshold"));
    }

    private static boolean areEqual(Object value, Object threshold) {
        requirePresent(value, threshold);
        Double left = tryNumber(value);
        Double right = tryNumber(threshold);
        if (left != null && right != null) {
            return Double.compare(left, right) == 0;
        }
        return String.valueOf(value).equals(String.valueOf(threshold));
    }

    private static double toNumber(Object operand, String role) {
        Double number = tryNumber(operand);
        if (number == null) {
            throw new IllegalArgumentException("Non-numeric " + role + ": " + operand);
        }
        return number;
    }

    private static Double tryNumber(Object operand) {
        if (operand instanceof Number) {
            return ((Number) operand).doubleValue();
        }
        if (operand instanceof String) {
            try {
                return Double.parseDouble(((String) operand).trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    private static void requirePresent(Object value, Object threshold) {
        if (value == null || threshold == null) {
            throw new IllegalArgumentException("Operands must not be null");
        }
    }
}
