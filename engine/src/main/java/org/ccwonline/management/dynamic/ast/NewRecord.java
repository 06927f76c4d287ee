package org.ccwonline.management.dynamic.ast;

import org.ccwonline.management.dynamic.types.RecordType;

import java.util.List;
import java.util.Objects;

/**
 * Projection {@code new(Name, Price * 2 as Total)} producing a dynamic record.
 *
 * @param type   The record type from the class factory
 * @param values One value per property, in property order
 */
public record NewRecord(RecordType type, List<Expression> values) implements Expression {

    public NewRecord {
        Objects.requireNonNull(type, "Type cannot be null");
        values = List.copyOf(values);
        if (values.size() != type.properties().size()) {
            throw new IllegalArgumentException("Expected " + type.properties().size()
                    + " values but got " + values.size());
        }
    }

    @Override
    public <T> T accept(ExpressionVisitor<T> visitor) {
        return visitor.visitNewRecord(this);
    }
}
