package io.cortex.models.filters;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One filter condition in the form the query builder consumes.
 *
 * <p>Instances are immutable. Value fields are stored as given: nothing here checks that they
 * fit the operator's {@link FilterOperator.Shape} or the {@link FilterValueType}.
 *
 * <p>Inactive filters stay in filter lists; skipping them is the query builder's job.
 */
@Value
@JsonIgnoreProperties(ignoreUnknown = true)
public class SemanticFilter {
    private static final String NAME_PREFIX = "filter_";

    String name;
    String query;
    String table;
    FilterOperator operator;
    Object value;
    List<Object> values;
    @JsonProperty("min_value")
    Object minValue;
    @JsonProperty("max_value")
    Object maxValue;
    @JsonProperty("value_type")
    FilterValueType valueType;
    @JsonProperty("filter_type")
    FilterType filterType;
    @JsonProperty("is_active")
    boolean active;

    @Builder(toBuilder = true)
    @JsonCreator
    public SemanticFilter(@JsonProperty("name") String name,
                          @JsonProperty("query") String query,
                          @JsonProperty("table") String table,
                          @JsonProperty("operator") FilterOperator operator,
                          @JsonProperty("value") Object value,
                          @JsonProperty("values") List<Object> values,
                          @JsonProperty("min_value") Object minValue,
                          @JsonProperty("max_value") Object maxValue,
                          @JsonProperty("value_type") FilterValueType valueType,
                          @JsonProperty("filter_type") FilterType filterType,
                          @JsonProperty("is_active") Boolean active) {
        this.name = name != null ? name : defaultName(query, operator);
        this.query = query;
        this.table = table;
        this.operator = operator;
        this.value = value;
        this.values = values != null ? Collections.unmodifiableList(new ArrayList<>(values)) : null;
        this.minValue = minValue;
        this.maxValue = maxValue;
        this.valueType = valueType != null ? valueType : FilterValueType.STRING;
        this.filterType = filterType != null ? filterType : FilterType.WHERE;
        this.active = active != null ? active : true;
    }

    /** The filtered column, field or expression; same as {@link #getQuery()}. */
    @JsonIgnore
    public String getDimension() {
        return query;
    }

    /**
     * Name given to a filter built without one, e.g. {@code filter_price_between}. Filters on the
     * same dimension with the same operator share it, so a later one overrides an earlier one on
     * merge.
     */
    public static String defaultName(String dimension, FilterOperator operator) {
        return NAME_PREFIX + dimension + "_" + (operator != null ? operator.getValue() : null);
    }
}
