package com.asiainfo.kpietl.application.extract;

import com.asiainfo.kpietl.domain.model.CategoryDefinition;
import org.junit.jupiter.api.Test;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 选表测试
 */
class TableSelectorTest {

    private static CategoryDefinition category(String name, String tablePattern) {
        return new CategoryDefinition(name, tablePattern, "^([A-Z]+)", null, null, null, null, null);
    }

    private final TableSelector selector = new TableSelector(List.of(
            category("5min", "^CALIS_5_S\\d+_A\\d{4}$"),
            category("15min", "^CALIS_15_S\\d+_A\\d{4}$"),
            category("any", "^CALIS_.*$")),
            LocalDate.of(2024, 3, 1));

    @Test
    void testResolveWeekStart() {
        // 2024-01-01 是周一
        assertEquals(LocalDate.of(2024, 1, 1), TableSelector.resolveWeekStart(2024, 1));
        assertEquals(LocalDate.of(2024, 3, 18), TableSelector.resolveWeekStart(2024, 12));
        // 2023-01-01 是周日，第 1 周从 01-02 开始
        assertEquals(LocalDate.of(2023, 1, 2), TableSelector.resolveWeekStart(2023, 1));
        assertEquals(LocalDate.of(2022, 12, 26), TableSelector.resolveWeekStart(2023, 0));
        assertEquals(LocalDate.of(2024, 12, 30), TableSelector.resolveWeekStart(2024, 53));
    }

    @Test
    void testResolveWeekStartOutOfRange() {
        assertThrows(DateTimeException.class, () -> TableSelector.resolveWeekStart(2024, 54));
        assertThrows(DateTimeException.class, () -> TableSelector.resolveWeekStart(2024, -1));
    }

    @Test
    void testParseWeekYear() {
        assertEquals(Optional.of(new TableSelector.WeekYear(2024, 12)), TableSelector.parseWeekYear("CALIS_5_S12_A2024"));
        assertEquals(Optional.of(new TableSelector.WeekYear(2025, 3)), TableSelector.parseWeekYear("x_s03_a2025"));
        assertTrue(TableSelector.parseWeekYear("CALIS_5").isEmpty());
        assertTrue(TableSelector.parseWeekYear("CALIS_5_S12_A24").isEmpty());
    }

    @Test
    void testSelectFiltersByCutoffAndSortsByYearThenWeek() {
        TableSelector.Selection selection = selector.select(List.of(
                "CALIS_5_S1_A2025",
                "CALIS_5_S12_A2024",
                "CALIS_5_S2_A2024",
                "CALIS_5_S54_A2024",
                "CALIS_5_S9_A2024",
                "CALIS_5_S10_A2024",
                "UNRELATED_S20_A2024"), List.of("5min"));

        assertEquals(List.of("CALIS_5_S10_A2024", "CALIS_5_S12_A2024", "CALIS_5_S1_A2025"),
                selection.byCategory().get("5min"));
        assertEquals(selection.byCategory().get("5min"), selection.workingSet());
    }

    @Test
    void testTableGoesToFirstMatchingCategoryOnly() {
        TableSelector.Selection selection = selector.select(List.of(
                "CALIS_15_S20_A2024",
                "CALIS_X_S20_A2024"), List.of("15min", "any"));

        assertEquals(List.of("CALIS_15_S20_A2024"), selection.byCategory().get("15min"));
        assertEquals(List.of("CALIS_X_S20_A2024"), selection.byCategory().get("any"));
        assertTrue(selection.byCategory().get("5min").isEmpty());
        assertEquals(2, selection.total());
    }

    @Test
    void testWorkingSetOnlyContainsWorkingCategories() {
        TableSelector.Selection selection = selector.select(List.of(
                "CALIS_5_S20_A2024",
                "CALIS_15_S10_A2024"), List.of("15min", "unknown"));

        assertEquals(List.of("CALIS_15_S10_A2024"), selection.workingSet());
        assertEquals(List.of("CALIS_5_S20_A2024"), selection.byCategory().get("5min"));
    }

    @Test
    void testWorkingSetAcrossCategoriesIsSortedByWeekYear() {
        TableSelector.Selection selection = selector.select(List.of(
                "CALIS_5_S20_A2024",
                "CALIS_15_S10_A2024",
                "CALIS_5_S11_A2024"), List.of("5min", "15min"));

        assertEquals(List.of("CALIS_15_S10_A2024", "CALIS_5_S11_A2024", "CALIS_5_S20_A2024"), selection.workingSet());
    }

    @Test
    void testNoTables() {
        TableSelector.Selection selection = selector.select(List.of(), List.of("5min"));

        assertEquals(0, selection.total());
        assertTrue(selection.workingSet().isEmpty());
        assertEquals(3, selection.byCategory().size());
    }
}
