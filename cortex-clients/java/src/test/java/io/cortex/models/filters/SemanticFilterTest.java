package io.cortex.models.filters;

import org.junit.jupiter.api.Test;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;

public class SemanticFilterTest {

    @Test
    public void shouldApplyDefaults() {
        SemanticFilter filter = SemanticFilter.builder()
                .query("status")
                .operator(FilterOperator.EQUALS)
                .value("active")
                .build();

        assertEquals("filter_status_equals", filter.getName());
        assertEquals("status", filter.getDimension());
        assertEquals(FilterValueType.STRING, filter.getValueType());
        assertEquals(FilterType.WHERE, filter.getFilterType());
        assertTrue(filter.isActive());
        assertNull(filter.getTable());
        assertNull(filter.getValues());
    }

    @Test
    public void shouldKeepExplicitName() {
        SemanticFilter filter = SemanticFilter.builder()
                .name("recent_orders")
                .query("order_date")
                .operator(FilterOperator.GREATER_THAN)
                .value("2024-01-01")
                .build();

        assertEquals("recent_orders", filter.getName());
    }

    @Test
    public void shouldNotBeAffectedByLaterChangesToValuesList() {
        List<Object> regions = new ArrayList<>(List.of("US", "EU"));
        SemanticFilter filter = SemanticFilter.builder()
                .query("region")
                .operator(FilterOperator.IN)
                .values(regions)
                .build();

        regions.add("APAC");

        assertEquals(List.of("US", "EU"), filter.getValues());
        assertThrows(UnsupportedOperationException.class, () -> filter.getValues().add("APAC"));
    }

    @Test
    public void shouldCopyWithChangesThroughToBuilder() {
        SemanticFilter filter = SemanticFilter.builder()
                .query("status")
                .operator(FilterOperator.EQUALS)
                .value("active")
                .build();

        SemanticFilter inactive = filter.toBuilder().active(false).build();

        assertTrue(filter.isActive());
        assertFalse(inactive.isActive());
        assertEquals(filter.getName(), inactive.getName());
        assertNotEquals(filter, inactive);
    }

    @Test
    public void shouldNotCheckValuesAgainstOperator() {
        SemanticFilter filter = SemanticFilter.builder()
                .query("price")
                .operator(FilterOperator.BETWEEN)
                .value(10)
                .valueType(FilterValueType.BOOLEAN)
                .build();

        assertEquals(10, filter.getValue());
        assertNull(filter.getMinValue());
        assertNull(filter.getMaxValue());
    }

    @Test
    public void shouldParseWireValuesIgnoringCase() {
        assertEquals(FilterOperator.NOT_IN, FilterOperator.fromValue("not_in"));
        assertEquals(FilterOperator.BETWEEN, FilterOperator.fromValue("BETWEEN"));
        assertEquals(FilterValueType.NUMBER, FilterValueType.fromValue("number"));
        assertEquals(FilterType.HAVING, FilterType.fromValue("Having"));
        assertThrows(IllegalArgumentException.class, () -> FilterOperator.fromValue("contains"));
    }

    @Test
    public void shouldReportOperatorShapes() {
        assertEquals(FilterOperator.Shape.SINGLE, FilterOperator.EQUALS.getShape());
        assertEquals(FilterOperator.Shape.MULTIPLE, FilterOperator.NOT_IN.getShape());
        assertEquals(FilterOperator.Shape.RANGE, FilterOperator.BETWEEN.getShape());
        assertEquals(FilterOperator.Shape.NONE, FilterOperator.IS_NULL.getShape());
    }
}
