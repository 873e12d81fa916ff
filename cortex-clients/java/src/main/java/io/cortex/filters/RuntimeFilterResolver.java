package io.cortex.filters;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import io.cortex.models.filters.SemanticFilter;
import io.cortex.models.requests.DashboardExecutionWithFiltersRequest;
import io.cortex.models.requests.RuntimeFilterRequest;
import io.cortex.models.requests.WidgetExecutionWithFiltersRequest;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns widget and dashboard execution overrides into the runtime filter list for one widget's
 * metric query, and applies it over the metric's stored filters.
 */
@Slf4j
public final class RuntimeFilterResolver {

    private RuntimeFilterResolver() {
    }

    public static List<SemanticFilter> widgetFilters(WidgetExecutionWithFiltersRequest request) {
        if (request == null) {
            return new ArrayList<>();
        }
        return FilterConverter.fromRuntimeFilters(request.getFilters());
    }

    /**
     * Runtime filters for one widget of a dashboard execution. The widget's entry is looked up by
     * alias, then by id.
     *
     * <p>An active widget filter replaces the filter on the same dimension and table in place,
     * whatever its operator; other widget filters are appended. An inactive widget filter never
     * replaces anything and is dropped when it would. Widgets listed in
     * {@code ignore_global_filters} get only their own filters.
     */
    public static List<SemanticFilter> dashboardFilters(DashboardExecutionWithFiltersRequest request,
                                                        String widgetAlias, String widgetId) {
        if (request == null) {
            return new ArrayList<>();
        }
        boolean ignoreGlobal = matchesWidget(request.getIgnoreGlobalFilters(), widgetAlias, widgetId);
        List<SemanticFilter> effective = ignoreGlobal
                ? new ArrayList<>()
                : FilterConverter.fromRuntimeFilters(request.getGlobalFilters());
        List<SemanticFilter> own = FilterConverter.fromRuntimeFilters(
                findWidgetFilters(request.getWidgetFilters(), widgetAlias, widgetId));
        log.debug("Widget {} ({}) has {} global and {} own runtime filters, ignoreGlobal={}",
                widgetAlias, widgetId, effective.size(), own.size(), ignoreGlobal);

        for (SemanticFilter widgetFilter : own) {
            int existing = indexOfDimension(effective, widgetFilter);
            if (existing < 0) {
                effective.add(widgetFilter);
            } else if (widgetFilter.isActive()) {
                effective.set(existing, widgetFilter);
            }
        }
        return effective;
    }

    /** Applies runtime filters over a metric's stored filters. */
    public static List<SemanticFilter> resolve(List<SemanticFilter> baseline, List<SemanticFilter> runtime,
                                               boolean replace) {
        List<SemanticFilter> resolved = FilterMerger.merge(baseline, runtime, replace);
        log.debug("Resolved {} filters (replace={})", resolved.size(), replace);
        return resolved;
    }

    private static int indexOfDimension(List<SemanticFilter> filters, SemanticFilter target) {
        for (int i = 0; i < filters.size(); i++) {
            SemanticFilter filter = filters.get(i);
            if (Objects.equals(filter.getQuery(), target.getQuery())
                    && Objects.equals(filter.getTable(), target.getTable())) {
                return i;
            }
        }
        return -1;
    }

    private static boolean matchesWidget(List<String> widgetKeys, String widgetAlias, String widgetId) {
        if (widgetKeys == null) {
            return false;
        }
        return (widgetAlias != null && widgetKeys.contains(widgetAlias))
                || (widgetId != null && widgetKeys.contains(widgetId));
    }

    private static List<RuntimeFilterRequest> findWidgetFilters(Map<String, List<RuntimeFilterRequest>> widgetFilters,
                                                                String widgetAlias, String widgetId) {
        if (widgetFilters == null) {
            return null;
        }
        if (widgetAlias != null && widgetFilters.containsKey(widgetAlias)) {
            return widgetFilters.get(widgetAlias);
        }
        if (widgetId != null) {
            return widgetFilters.get(widgetId);
        }
        return null;
    }
}
