package io.cortex.models.requests;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.util.List;
import java.util.Map;

/**
 * Runtime overrides for executing a whole dashboard: filters for every widget plus filters for
 * individual widgets, keyed by widget alias or id. Widgets named in {@code ignore_global_filters}
 * (by alias or id) skip the global filters.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class DashboardExecutionWithFiltersRequest {
    @JsonProperty("global_filters")
    private List<RuntimeFilterRequest> globalFilters;
    @JsonProperty("widget_filters")
    private Map<String, List<RuntimeFilterRequest>> widgetFilters;
    private Map<String, Object> parameters;
    @JsonProperty("context_id")
    private String contextId;
    @JsonProperty("ignore_global_filters")
    private List<String> ignoreGlobalFilters;

    public DashboardExecutionWithFiltersRequest(List<RuntimeFilterRequest> globalFilters,
                                                Map<String, List<RuntimeFilterRequest>> widgetFilters) {
        this.globalFilters = globalFilters;
        this.widgetFilters = widgetFilters;
    }
}
