package io.cortex.filters;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import io.cortex.models.filters.FilterOperator;
import io.cortex.models.filters.FilterType;
import io.cortex.models.filters.FilterValueType;
import io.cortex.models.filters.SemanticFilter;
import io.cortex.models.requests.RuntimeFilterRequest;

/**
 * Builds {@link SemanticFilter}s from runtime inputs: explicit parameters, simple
 * {@code dimension -> value} maps and {@link RuntimeFilterRequest}s.
 *
 * <p>None of these check that the supplied value fields fit the operator.
 */
public final class FilterConverter {

    private FilterConverter() {
    }

    /**
     * Copies the given fields into a new filter.
     *
     * @param name filter name, or {@code null} to use {@link SemanticFilter#defaultName}
     * @param valueType value type, or {@code null} for {@link FilterValueType#STRING}
     * @param filterType filter type, or {@code null} for {@link FilterType#WHERE}
     */
    public static SemanticFilter runtimeFilterToSemantic(String dimension, FilterOperator operator,
                                                         Object value, List<?> values,
                                                         Object minValue, Object maxValue,
                                                         String table, FilterValueType valueType,
                                                         FilterType filterType, boolean isActive,
                                                         String name) {
        return SemanticFilter.builder()
                .name(name)
                .query(dimension)
                .table(table)
                .operator(operator)
                .value(value)
                .values(values != null ? new ArrayList<Object>(values) : null)
                .minValue(minValue)
                .maxValue(maxValue)
                .valueType(valueType)
                .filterType(filterType)
                .active(isActive)
                .build();
    }

    public static SemanticFilter runtimeFilterToSemantic(String dimension, FilterOperator operator, Object value) {
        return runtimeFilterToSemantic(dimension, operator, value, null, null, null,
                null, null, null, true, null);
    }

    /**
     * Turns a {@code dimension -> value} map into equality filters, in the map's iteration order.
     *
     * <p>A {@link List} value becomes an {@code IN} filter over its elements. Every other value
     * becomes an {@code EQUALS} filter, including strings, maps, arrays and {@code null}.
     */
    public static List<SemanticFilter> dictToSemanticFilters(Map<String, ?> filters) {
        List<SemanticFilter> result = new ArrayList<>();
        if (filters == null) {
            return result;
        }
        for (Map.Entry<String, ?> entry : filters.entrySet()) {
            Object value = entry.getValue();
            if (value instanceof List) {
                result.add(runtimeFilterToSemantic(entry.getKey(), FilterOperator.IN, null, (List<?>) value,
                        null, null, null, null, null, true, null));
            } else {
                result.add(runtimeFilterToSemantic(entry.getKey(), FilterOperator.EQUALS, value));
            }
        }
        return result;
    }

    public static SemanticFilter fromRuntimeFilter(RuntimeFilterRequest request) {
        return runtimeFilterToSemantic(
                request.getDimension(),
                request.getOperator(),
                request.getValue(),
                request.getValues(),
                request.getMinValue(),
                request.getMaxValue(),
                request.getTable(),
                request.getValueType(),
                request.getFilterType(),
                request.isActive(),
                null
        );
    }

    public static List<SemanticFilter> fromRuntimeFilters(List<RuntimeFilterRequest> requests) {
        List<SemanticFilter> result = new ArrayList<>();
        if (requests == null) {
            return result;
        }
        for (RuntimeFilterRequest request : requests) {
            result.add(fromRuntimeFilter(request));
        }
        return result;
    }
}
