package com.userstats.platform.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Conjunctive predicate over hash fields. Every predicate can render itself in RediSearch query
 * syntax for the index path and evaluate itself against a field map for the scan path, so both
 * paths share one definition of what matches.
 */
public interface FieldPredicate {

    String toQuery();

    boolean test(Map<String, String> fields);

    static FieldPredicate tagEquals(String field, String value) {
        return new TagIn(field, Collections.singleton(value));
    }

    static FieldPredicate tagIn(String field, String... values) {
        return new TagIn(field, new LinkedHashSet<>(List.of(values)));
    }

    static FieldPredicate numericRange(String field, double min, double max) {
        return new NumericRange(field, min, max);
    }

    static FieldPredicate and(FieldPredicate... predicates) {
        return new And(List.of(predicates));
    }

    final class TagIn implements FieldPredicate {
        private final String field;
        private final Set<String> values;

        TagIn(String field, Set<String> values) {
            if (values.isEmpty()) {
                throw new IllegalArgumentException("Tag predicate on " + field + " needs at least one value");
            }
            this.field = field;
            this.values = values;
        }

        @Override
        public String toQuery() {
            return "@" + field + ":{" + values.stream()
                .map(TagIn::escape)
                .collect(Collectors.joining(" | ")) + "}";
        }

        @Override
        public boolean test(Map<String, String> fields) {
            String actual = fields.get(field);
            return actual != null && values.contains(actual);
        }

        static String escape(String value) {
            StringBuilder escaped = new StringBuilder(value.length());
            for (char ch : value.toCharArray()) {
                if (!Character.isLetterOrDigit(ch) && ch != '_') {
                    escaped.append('\\');
                }
                escaped.append(ch);
            }
            return escaped.toString();
        }

        @Override
        public String toString() {
            return toQuery();
        }
    }

    /**
     * Inclusive on both ends. A missing or non-numeric field never matches; only plain decimal
     * notation counts as numeric, so forms such as {@code 42d} or {@code 0x2Ap0} are rejected.
     */
    final class NumericRange implements FieldPredicate {
        private static final Pattern DECIMAL = Pattern.compile("[+-]?(\\d+(\\.\\d*)?|\\.\\d+)([eE][+-]?\\d+)?");

        private final String field;
        private final double min;
        private final double max;

        NumericRange(String field, double min, double max) {
            if (min > max) {
                throw new IllegalArgumentException("Range on " + field + " has min > max");
            }
            this.field = field;
            this.min = min;
            this.max = max;
        }

        @Override
        public String toQuery() {
            return "@" + field + ":[" + format(min) + " " + format(max) + "]";
        }

        @Override
        public boolean test(Map<String, String> fields) {
            String raw = fields.get(field);
            if (!isDecimal(raw)) {
                return false;
            }
            double value = Double.parseDouble(raw);
            return value >= min && value <= max;
        }

        static boolean isDecimal(String raw) {
            return raw != null && DECIMAL.matcher(raw).matches();
        }

        private static String format(double value) {
            if (value == Math.rint(value) && !Double.isInfinite(value)) {
                return Long.toString((long) value);
            }
            return Double.toString(value);
        }

        @Override
        public String toString() {
            return toQuery();
        }
    }

    final class And implements FieldPredicate {
        private final List<FieldPredicate> predicates;

        And(List<FieldPredicate> predicates) {
            if (predicates.isEmpty()) {
                throw new IllegalArgumentException("AND needs at least one predicate");
            }
            this.predicates = new ArrayList<>(predicates);
        }

        @Override
        public String toQuery() {
            return predicates.stream()
                .map(FieldPredicate::toQuery)
                .collect(Collectors.joining(" "));
        }

        @Override
        public boolean test(Map<String, String> fields) {
            for (FieldPredicate predicate : predicates) {
                if (!predicate.test(fields)) {
                    return false;
                }
            }
            return true;
        }

        @Override
        public String toString() {
            return toQuery();
        }
    }
}
