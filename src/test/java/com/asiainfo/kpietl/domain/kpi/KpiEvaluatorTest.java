package com.asiainfo.kpietl.domain.kpi;

import com.asiainfo.kpietl.domain.model.FormulaType;
import com.asiainfo.kpietl.domain.model.KpiDefinition;
import com.asiainfo.kpietl.domain.model.KpiTableGroup;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * KPI 求值测试
 */
class KpiEvaluatorTest {

    private final KpiEvaluator evaluator = new KpiEvaluator();

    @Test
    void testZeroDenominatorGivesNull() {
        KpiDefinition kpi = KpiDefinition.of("ratio", List.of("a"), List.of("b"), FormulaType.RATIO_PERCENT);

        assertNull(evaluator.evaluate(kpi, Map.of("a", 10.0, "b", 0.0)));
    }

    @Test
    void testMissingCountersDefaultToZero() {
        KpiDefinition sum = KpiDefinition.of("total", List.of("a", "missing"), FormulaType.SUM);
        KpiDefinition ratio = KpiDefinition.of("ratio", List.of("a"), List.of("missing"), FormulaType.RATIO);

        assertEquals(10.0, evaluator.evaluate(sum, Map.of("a", 10.0)));
        assertNull(evaluator.evaluate(ratio, Map.of("a", 10.0)));
    }

    @Test
    void testFormulaErrorGivesNull() {
        KpiDefinition broken = KpiDefinition.of("diff", List.of("a"), FormulaType.DIFFERENCE);

        assertNull(evaluator.evaluate(broken, Map.of("a", 1.0)));
    }

    @Test
    void testScaledSumWithEmptyDenominator() {
        KpiDefinition bw = new KpiDefinition("TotalBwForSig", List.of("sent", "retrans"), List.of(),
                FormulaType.SCALED_SUM, 2.0, null);

        assertEquals(10.0, evaluator.evaluate(bw, Map.of("sent", 3.0, "retrans", 2.0)));
    }

    @Test
    void testGroupKeepsDeclarationOrderAndNulls() {
        KpiTableGroup group = new KpiTableGroup("g", List.of(
                KpiDefinition.of("z_sum", List.of("a"), FormulaType.SUM),
                KpiDefinition.of("a_none", List.of(), FormulaType.NONE),
                KpiDefinition.of("m_ratio", List.of("a"), List.of("b"), FormulaType.RATIO_PERCENT)));

        Map<String, Double> values = evaluator.evaluate(group, Map.of("a", 1.0, "b", 4.0));

        assertEquals(List.of("z_sum", "a_none", "m_ratio"), List.copyOf(values.keySet()));
        assertEquals(1.0, values.get("z_sum"));
        assertNull(values.get("a_none"));
        assertEquals(25.0, values.get("m_ratio"));
    }
}
