package io.cortex.models.filters;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum FilterType {
    WHERE("where"),
    HAVING("having");

    private final String value;

    FilterType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static FilterType fromValue(String value) {
        for (FilterType type : values()) {
            if (type.value.equalsIgnoreCase(value)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown filter type: " + value);
    }

    @Override
    public String toString() {
        return value;
    }
}
