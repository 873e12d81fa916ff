package io.cortex.filters;

import java.util.List;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.cortex.models.filters.SemanticFilter;
import io.cortex.models.requests.DashboardExecutionWithFiltersRequest;
import io.cortex.models.requests.WidgetExecutionWithFiltersRequest;

/** Reads and writes filters and execution overrides as JSON. */
public class FilterJson {

    private final ObjectMapper objectMapper;

    public FilterJson() {
        this(new ObjectMapper());
    }

    public FilterJson(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(Object object) {
        try {
            return objectMapper.writeValueAsString(object);
        } catch (Exception e) {
            throw new RuntimeException("Failed to serialize object to JSON", e);
        }
    }

    public List<SemanticFilter> readFilters(String json) {
        try {
            return objectMapper.readValue(json,
                    objectMapper.getTypeFactory().constructCollectionType(List.class, SemanticFilter.class));
        } catch (Exception e) {
            throw new RuntimeException("Failed to deserialize filters", e);
        }
    }

    public WidgetExecutionWithFiltersRequest readWidgetRequest(String json) {
        try {
            return objectMapper.readValue(json, WidgetExecutionWithFiltersRequest.class);
        } catch (Exception e) {
            throw new RuntimeException("Failed to deserialize widget request", e);
        }
    }

    public DashboardExecutionWithFiltersRequest readDashboardRequest(String json) {
        try {
            return objectMapper.readValue(json, DashboardExecutionWithFiltersRequest.class);
        } catch (Exception e) {
            throw new RuntimeException("Failed to deserialize dashboard request", e);
        }
    }
}
