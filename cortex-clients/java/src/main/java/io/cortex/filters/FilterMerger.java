package io.cortex.filters;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import io.cortex.models.filters.SemanticFilter;
import lombok.extern.slf4j.Slf4j;

/**
 * Combines a metric's stored filters with filters supplied at execution time.
 *
 * <p>Filters are matched by name. A runtime filter replaces the baseline filter of the same name
 * in place; runtime filters with new names are appended after the baseline ones, in runtime
 * order. Neither input list is modified.
 */
@Slf4j
public final class FilterMerger {

    private FilterMerger() {
    }

    public static List<SemanticFilter> merge(List<SemanticFilter> baseline, List<SemanticFilter> runtime) {
        return merge(baseline, runtime, false);
    }

    /**
     * @param baseline stored filters, may be {@code null}
     * @param runtime execution-time filters, {@code null} is read as empty
     * @param replace if {@code true}, {@code runtime} is returned and {@code baseline} ignored
     */
    public static List<SemanticFilter> merge(List<SemanticFilter> baseline, List<SemanticFilter> runtime,
                                             boolean replace) {
        List<SemanticFilter> runtimeFilters = runtime != null ? runtime : new ArrayList<>();
        if (replace) {
            log.debug("Replacing baseline filters with {} runtime filters", runtimeFilters.size());
            return runtimeFilters;
        }
        if (baseline == null || baseline.isEmpty()) {
            return runtimeFilters;
        }
        if (runtimeFilters.isEmpty()) {
            return baseline;
        }

        // LinkedHashMap keeps a key's original position when its value is replaced
        Map<String, SemanticFilter> merged = new LinkedHashMap<>();
        for (SemanticFilter filter : baseline) {
            merged.put(filter.getName(), filter);
        }
        int overridden = 0;
        for (SemanticFilter filter : runtimeFilters) {
            if (merged.put(filter.getName(), filter) != null) {
                overridden++;
            }
        }
        log.debug("Merged {} baseline and {} runtime filters, {} overridden",
                baseline.size(), runtimeFilters.size(), overridden);
        return new ArrayList<>(merged.values());
    }
}
