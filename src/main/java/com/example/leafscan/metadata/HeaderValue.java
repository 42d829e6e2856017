package com.example.leafscan.metadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * A header or footer value after best-effort literal coercion: an integer, a float, a tuple of
 * numbers, or the raw text when none of those apply.
 */
public interface HeaderValue {
    Pattern INTEGER = Pattern.compile("[+-]?(?:0+|[1-9][0-9]*)");
    Pattern FLOAT = Pattern.compile(
            "[+-]?(?:(?:[0-9]+\\.[0-9]*|\\.[0-9]+)(?:[eE][+-]?[0-9]+)?|[0-9]+[eE][+-]?[0-9]+)");

    /**
     * Numeric view of the value. Text and tuples have none.
     */
    default OptionalDouble asDouble() {
        return OptionalDouble.empty();
    }

    /**
     * Tuple view of the value. Only tuples have one.
     */
    default Optional<List<Number>> asTuple() {
        return Optional.empty();
    }

    /**
     * The value as it would be printed.
     */
    String text();

    record IntegerValue(long value) implements HeaderValue {
        @Override
        public OptionalDouble asDouble() {
            return OptionalDouble.of(value);
        }

        @Override
        public String text() {
            return Long.toString(value);
        }
    }

    record FloatValue(double value) implements HeaderValue {
        @Override
        public OptionalDouble asDouble() {
            return OptionalDouble.of(value);
        }

        @Override
        public String text() {
            return Double.toString(value);
        }
    }

    record TupleValue(List<Number> values) implements HeaderValue {
        public TupleValue {
            values = List.copyOf(values);
        }

        @Override
        public Optional<List<Number>> asTuple() {
            return Optional.of(values);
        }

        @Override
        public String text() {
            StringBuilder builder = new StringBuilder("(");
            for (int i = 0; i < values.size(); i++) {
                if (i > 0) {
                    builder.append(", ");
                }
                builder.append(values.get(i));
            }
            if (values.size() == 1) {
                builder.append(',');
            }
            return builder.append(')').toString();
        }
    }

    record TextValue(String value) implements HeaderValue {
        @Override
        public String text() {
            return value;
        }
    }

    /**
     * Coerces a stripped value to the most specific literal it spells, falling back to text.
     */
    static HeaderValue parse(String raw) {
        String value = raw.strip();
        Optional<Number> number = parseNumber(value);
        if (number.isPresent()) {
            return number.get() instanceof Long
                    ? new IntegerValue(number.get().longValue())
                    : new FloatValue(number.get().doubleValue());
        }
        Optional<List<Number>> tuple = parseTuple(value);
        if (tuple.isPresent()) {
            return new TupleValue(tuple.get());
        }
        if (value.length() >= 2) {
            char first = value.charAt(0);
            char last = value.charAt(value.length() - 1);
            if ((first == '\'' || first == '"') && first == last
                    && value.indexOf(first, 1) == value.length() - 1) {
                return new TextValue(value.substring(1, value.length() - 1));
            }
        }
        return new TextValue(value);
    }

    private static Optional<Number> parseNumber(String value) {
        if (INTEGER.matcher(value).matches()) {
            try {
                return Optional.of(Long.parseLong(value));
            } catch (NumberFormatException ex) {
                return Optional.of(Double.parseDouble(value));
            }
        }
        if (FLOAT.matcher(value).matches()) {
            return Optional.of(Double.parseDouble(value));
        }
        return Optional.empty();
    }

    private static Optional<List<Number>> parseTuple(String value) {
        String body = value;
        boolean parenthesised = body.startsWith("(") && body.endsWith(")");
        if (parenthesised) {
            body = body.substring(1, body.length() - 1).strip();
            if (body.isEmpty()) {
                return Optional.of(List.of());
            }
        }
        if (!body.contains(",")) {
            return Optional.empty();
        }
        String[] parts = body.split(",", -1);
        int count = parts.length;
        // one trailing comma is allowed, as in "(5,)" or "1, 2,"
        if (parts[count - 1].isBlank()) {
            count--;
        }
        List<Number> numbers = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            Optional<Number> number = parseNumber(parts[i].strip());
            if (number.isEmpty()) {
                return Optional.empty();
            }
            numbers.add(number.get());
        }
        return numbers.isEmpty() ? Optional.empty() : Optional.of(numbers);
    }
}
