package com.furnaceintel.pipeline.service;

import com.furnaceintel.pipeline.model.FieldIdentity;
import com.furnaceintel.pipeline.model.MappingTable;

import java.util.List;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Maps raw API variable names to (measurement, field) using the loaded rename tables.
 *
 * The API exposes far more variables than are modelled, so a miss is normal and returns
 * {@link Optional#empty()}.
 */
public class FieldClassifier {

    private static final Pattern DECIMAL =
            Pattern.compile("[+-]?(\\d+\\.?\\d*|\\.\\d+)([eE][+-]?\\d+)?");

    private final List<MappingTable> tables;
    private final Set<String> stringFields;

    public FieldClassifier(List<MappingTable> tables, Set<String> stringFields) {
        this.tables = List.copyOf(tables);
        this.stringFields = Set.copyOf(stringFields);
    }

    public Optional<FieldIdentity> classify(String rawName) {
        if (rawName == null) return Optional.empty();
        for (MappingTable table : tables) {
            String field = table.fields().get(rawName);
            if (field != null) {
                return Optional.of(new FieldIdentity(table.measurement(), field));
            }
        }
        return Optional.empty();
    }

    /** Fields that are reserved as strings and never coerced. */
    public boolean isForcedString(String field) {
        return stringFields.contains(field);
    }

    public List<MappingTable> tables() {
        return tables;
    }

    /**
     * Coerces a raw value to a double. Blank, unparsable and non-finite input is "no value",
     * never zero.
     */
    public static OptionalDouble toNumeric(Object value) {
        if (value == null) return OptionalDouble.empty();
        if (value instanceof Boolean b) return OptionalDouble.of(b ? 1.0 : 0.0);
        if (value instanceof Number n) return finite(n.doubleValue());

        String text = value.toString().trim();
        if (text.isEmpty() || !DECIMAL.matcher(text).matches()) {
            return OptionalDouble.empty();
        }
        try {
            return finite(Double.parseDouble(text));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private static OptionalDouble finite(double d) {
        return Double.isFinite(d) ? OptionalDouble.of(d) : OptionalDouble.empty();
    }
}
