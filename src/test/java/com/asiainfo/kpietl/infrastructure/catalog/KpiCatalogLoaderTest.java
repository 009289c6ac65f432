package com.asiainfo.kpietl.infrastructure.catalog;

import com.asiainfo.kpietl.domain.model.CategoryDefinition;
import com.asiainfo.kpietl.domain.model.FormulaType;
import com.asiainfo.kpietl.domain.model.KpiCatalog;
import com.asiainfo.kpietl.domain.model.KpiDefinition;
import com.asiainfo.kpietl.domain.model.KpiTableGroup;
import com.asiainfo.kpietl.shared.PipelineException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * KPI 目录加载与校验测试
 */
class KpiCatalogLoaderTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    private KpiCatalog readBundled() throws Exception {
        try (InputStream in = getClass().getClassLoader().getResourceAsStream("kpi-catalog.json")) {
            assertNotNull(in);
            return KpiCatalogLoader.read(in, objectMapper);
        }
    }

    private KpiCatalog read(String json) throws Exception {
        return KpiCatalogLoader.read(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), objectMapper);
    }

    @Test
    void testBundledCatalog() throws Exception {
        KpiCatalog catalog = readBundled();

        assertEquals(List.of("5min", "15min", "mgw"), catalog.categories().stream().map(CategoryDefinition::name).toList());

        CategoryDefinition fiveMin = catalog.category("5min").orElseThrow();
        assertEquals(List.of("traffic_entree", "traffic_sortie"),
                fiveMin.tableGroups().stream().map(KpiTableGroup::name).toList());
        assertTrue(fiveMin.compiledTablePattern().matcher("calis-apg43_5_S12_A2024").matches());
        assertFalse(fiveMin.compiledTablePattern().matcher("CALIS_APG43_15_S12_A2024").matches());

        assertFalse(catalog.category("15min").orElseThrow().hasTableGroups());

        KpiTableGroup mgw = catalog.category("mgw").orElseThrow().tableGroups().get(0);
        assertEquals(11, mgw.kpis().size());
        KpiDefinition bandwidth = mgw.kpis().stream().filter(k -> k.name().equals("TotalBwForSig")).findFirst().orElseThrow();
        assertEquals(FormulaType.SCALED_SUM, bandwidth.formula());
        assertEquals(8 * 100 * 1.2 / (1_000_000.0 * 900), bandwidth.factorOrDefault(), 1e-18);
        // 带宽 KPI 是有意计算的，说明中要写明与旧版本恒为 NULL 的差异
        assertTrue(bandwidth.description().contains("always stored NULL"), bandwidth.description());
    }

    @Test
    void testCategoriesInheritCatalogDefaults() throws Exception {
        KpiCatalog catalog = readBundled();

        for (CategoryDefinition category : catalog.categories()) {
            assertEquals(8, category.suffixOperators().size(), category.name());
            assertEquals(List.of("M"), category.ignoredSuffixes(), category.name());
        }
    }

    @Test
    void testCategoryOverridesDefaults() throws Exception {
        KpiCatalog catalog = read("""
                {
                  "suffixOperators": [{"pattern": "nw", "operator": "Inwi"}],
                  "ignoredSuffixes": ["M"],
                  "categories": [
                    {"name": "a", "tablePattern": "^A_S\\\\d+_A\\\\d{4}$", "nodePattern": "^(A)",
                     "suffixOperators": [{"pattern": "mt", "operator": "Maroc Telecom"}], "ignoredSuffixes": []}
                  ]
                }
                """);

        CategoryDefinition a = catalog.category("a").orElseThrow();
        assertEquals("Maroc Telecom", a.suffixOperators().get(0).operator());
        assertTrue(a.ignoredSuffixes().isEmpty());
    }

    @Test
    void testDuplicateCategoryRejected() {
        assertThrows(PipelineException.class, () -> read("""
                {"categories": [
                  {"name": "a", "tablePattern": "a", "nodePattern": "(a)"},
                  {"name": "a", "tablePattern": "b", "nodePattern": "(b)"}
                ]}
                """));
    }

    @Test
    void testInvalidPatternRejected() {
        assertThrows(PipelineException.class, () -> read("""
                {"categories": [{"name": "a", "tablePattern": "([", "nodePattern": "(a)"}]}
                """));
    }

    @Test
    void testUnsafeKpiNameRejected() {
        assertThrows(PipelineException.class, () -> read("""
                {"categories": [{"name": "a", "tablePattern": "a", "nodePattern": "(a)",
                  "sourceDb": "staging", "destinationDb": "kpi",
                  "tableGroups": [{"name": "g", "kpis": [
                    {"name": "x; DROP TABLE y", "numerator": ["c"], "formula": "SUM"}]}]}]}
                """));
    }

    @Test
    void testRatioWithoutDenominatorRejected() {
        assertThrows(PipelineException.class, () -> read("""
                {"categories": [{"name": "a", "tablePattern": "a", "nodePattern": "(a)",
                  "sourceDb": "staging", "destinationDb": "kpi",
                  "tableGroups": [{"name": "g", "kpis": [
                    {"name": "r", "numerator": ["c"], "formula": "RATIO_PERCENT"}]}]}]}
                """));
    }

    @Test
    void testScaledSumWithoutFactorRejected() {
        assertThrows(PipelineException.class, () -> read("""
                {"categories": [{"name": "a", "tablePattern": "a", "nodePattern": "(a)",
                  "sourceDb": "staging", "destinationDb": "kpi",
                  "tableGroups": [{"name": "g", "kpis": [
                    {"name": "bw", "numerator": ["c"], "denominator": [], "formula": "SCALED_SUM"}]}]}]}
                """));
    }

    @Test
    void testGroupsWithoutDatabasesRejected() {
        assertThrows(PipelineException.class, () -> read("""
                {"categories": [{"name": "a", "tablePattern": "a", "nodePattern": "(a)",
                  "tableGroups": [{"name": "g", "kpis": [{"name": "s", "numerator": ["c"], "formula": "SUM"}]}]}]}
                """));
    }
}
