package io.cortex.models.requests;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import java.util.List;
import java.util.Map;

/** Runtime overrides for executing a single dashboard widget. */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class WidgetExecutionWithFiltersRequest {
    private List<RuntimeFilterRequest> filters;
    private Map<String, Object> parameters;
    @JsonProperty("context_id")
    private String contextId;
    private Integer limit;

    public WidgetExecutionWithFiltersRequest(List<RuntimeFilterRequest> filters) {
        this.filters = filters;
    }
}
