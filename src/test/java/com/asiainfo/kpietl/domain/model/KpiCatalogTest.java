package com.asiainfo.kpietl.domain.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 配置目录默认值继承测试
 */
class KpiCatalogTest {

    private static final List<SuffixMapping> ROOT_OPERATORS = List.of(
            new SuffixMapping("ORANGE", "Orange"),
            new SuffixMapping("MOOV", "Moov"));
    private static final List<String> ROOT_IGNORED = List.of("TOTAL");

    private static CategoryDefinition category(String name, List<SuffixMapping> operators, List<String> ignored) {
        return new CategoryDefinition(name, "CALIS_.*", "^(CALIS_[A-Z0-9]+)", "staging", "kpi",
                operators, ignored, null);
    }

    @Test
    void testCategoryWithoutOverridesInheritsRootDefaults() {
        KpiCatalog catalog = new KpiCatalog(ROOT_OPERATORS, ROOT_IGNORED,
                List.of(category("5min", null, null)));

        CategoryDefinition resolved = catalog.category("5min").orElseThrow();
        assertEquals(ROOT_OPERATORS, resolved.suffixOperators());
        assertEquals(ROOT_IGNORED, resolved.ignoredSuffixes());
        assertTrue(resolved.tableGroups().isEmpty());
    }

    @Test
    void testCategoryOverridesAreKept() {
        List<SuffixMapping> own = List.of(new SuffixMapping("MTN", "MTN"));
        KpiCatalog catalog = new KpiCatalog(ROOT_OPERATORS, ROOT_IGNORED,
                List.of(category("mgw", own, List.of())));

        CategoryDefinition resolved = catalog.category("mgw").orElseThrow();
        assertEquals(own, resolved.suffixOperators());
        assertTrue(resolved.ignoredSuffixes().isEmpty());
    }

    @Test
    void testNullRootListsBecomeEmpty() {
        KpiCatalog catalog = new KpiCatalog(null, null, List.of(category("15min", null, null)));

        assertTrue(catalog.suffixOperators().isEmpty());
        assertTrue(catalog.ignoredSuffixes().isEmpty());
        CategoryDefinition resolved = catalog.category("15min").orElseThrow();
        assertNotNull(resolved.suffixOperators());
        assertTrue(resolved.suffixOperators().isEmpty());
        assertNotNull(resolved.ignoredSuffixes());
    }

    @Test
    void testNullCategoriesBecomeEmpty() {
        KpiCatalog catalog = new KpiCatalog(ROOT_OPERATORS, ROOT_IGNORED, null);

        assertTrue(catalog.categories().isEmpty());
        assertTrue(catalog.category("5min").isEmpty());
    }
}
