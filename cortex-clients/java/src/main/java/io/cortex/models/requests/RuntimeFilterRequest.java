package io.cortex.models.requests;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSetter;
import com.fasterxml.jackson.annotation.Nulls;
import io.cortex.models.filters.FilterOperator;
import io.cortex.models.filters.FilterType;
import io.cortex.models.filters.FilterValueType;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.util.List;

/**
 * A filter supplied at execution time, overriding or extending the filters stored on a metric
 * without changing the metric itself.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class RuntimeFilterRequest {
    private String dimension;
    private String table;
    @JsonSetter(nulls = Nulls.FAIL)
    private FilterOperator operator = FilterOperator.EQUALS;
    private Object value;
    private List<Object> values;
    @JsonProperty("min_value")
    private Object minValue;
    @JsonProperty("max_value")
    private Object maxValue;
    @JsonProperty("value_type")
    @JsonSetter(nulls = Nulls.FAIL)
    private FilterValueType valueType = FilterValueType.STRING;
    @JsonProperty("filter_type")
    @JsonSetter(nulls = Nulls.FAIL)
    private FilterType filterType = FilterType.WHERE;
    @JsonProperty("is_active")
    @JsonSetter(nulls = Nulls.FAIL)
    private boolean active = true;

    public RuntimeFilterRequest(String dimension, FilterOperator operator, Object value) {
        this.dimension = dimension;
        this.operator = operator;
        this.value = value;
    }
}
