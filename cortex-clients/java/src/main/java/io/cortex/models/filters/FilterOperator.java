package io.cortex.models.filters;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/** The shape names the value fields an operator reads. It is never enforced on build. */
public enum FilterOperator {
    EQUALS("equals", Shape.SINGLE),
    NOT_EQUALS("not_equals", Shape.SINGLE),
    GREATER_THAN("greater_than", Shape.SINGLE),
    GREATER_THAN_EQUALS("greater_than_equals", Shape.SINGLE),
    LESS_THAN("less_than", Shape.SINGLE),
    LESS_THAN_EQUALS("less_than_equals", Shape.SINGLE),
    IN("in", Shape.MULTIPLE),
    NOT_IN("not_in", Shape.MULTIPLE),
    LIKE("like", Shape.SINGLE),
    NOT_LIKE("not_like", Shape.SINGLE),
    IS_NULL("is_null", Shape.NONE),
    IS_NOT_NULL("is_not_null", Shape.NONE),
    BETWEEN("between", Shape.RANGE),
    NOT_BETWEEN("not_between", Shape.RANGE);

    public enum Shape {
        SINGLE,
        MULTIPLE,
        RANGE,
        NONE
    }

    private final String value;
    private final Shape shape;

    FilterOperator(String value, Shape shape) {
        this.value = value;
        this.shape = shape;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Shape getShape() {
        return shape;
    }

    @JsonCreator
    public static FilterOperator fromValue(String value) {
        for (FilterOperator operator : values()) {
            if (operator.value.equalsIgnoreCase(value)) {
                return operator;
            }
        }
        throw new IllegalArgumentException("Unknown filter operator: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
