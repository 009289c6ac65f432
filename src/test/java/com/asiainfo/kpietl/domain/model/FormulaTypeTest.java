package com.asiainfo.kpietl.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 公式类型单元测试
 */
class FormulaTypeTest {

    private static final double[] NONE = new double[0];

    @Test
    void testHiLoReconstruction() {
        assertEquals(2147483648d + 5, FormulaType.reconstructHiLo(1, 5));
        assertEquals(2147483653d, FormulaType.HI_LO.apply(new double[]{1, 5}, NONE, 1.0));
    }

    @Test
    void testRatioPercentWithZeroDenominatorIsNull() {
        assertNull(FormulaType.RATIO_PERCENT.apply(new double[]{10}, new double[]{0}, 1.0));
        assertNull(FormulaType.RATIO.apply(new double[]{10}, new double[]{0, 0}, 1.0));
        assertNull(FormulaType.COMPLEMENT_RATIO_PERCENT.apply(new double[]{1}, new double[]{0}, 1.0));
    }

    @Test
    void testRatios() {
        assertEquals(25.0, FormulaType.RATIO_PERCENT.apply(new double[]{1}, new double[]{4}, 1.0));
        assertEquals(0.25, FormulaType.RATIO.apply(new double[]{1}, new double[]{1, 3}, 1.0));
        assertEquals(75.0, FormulaType.COMPLEMENT_RATIO_PERCENT.apply(new double[]{1}, new double[]{2, 2}, 1.0));
    }

    @Test
    void testHiLoLossPercent() {
        // 总数 = (0 * 2^31 + 90) + 10 = 100
        assertEquals(5.0, FormulaType.HI_LO_LOSS_PERCENT.apply(new double[]{3, 2}, new double[]{0, 90, 10}, 1.0));
        assertNull(FormulaType.HI_LO_LOSS_PERCENT.apply(new double[]{3}, new double[]{0, 0, 0}, 1.0));
    }

    @Test
    void testSumDifferenceAndScaledSum() {
        assertEquals(6.0, FormulaType.SUM.apply(new double[]{1, 2, 3}, NONE, 1.0));
        assertEquals(0.0, FormulaType.SUM.apply(NONE, NONE, 1.0));
        assertEquals(7.0, FormulaType.DIFFERENCE.apply(new double[]{10, 3}, NONE, 1.0));
        assertEquals(9e8 * 1.0666666666666667E-6,
                FormulaType.SCALED_SUM.apply(new double[]{4e8, 5e8}, NONE, 1.0666666666666667E-6), 1e-9);
    }

    @Test
    void testNoneIsAlwaysNull() {
        assertNull(FormulaType.NONE.apply(new double[]{1}, NONE, 1.0));
    }

    @Test
    void testDifferenceRequiresTwoCounters() {
        assertThrows(IllegalArgumentException.class, () -> FormulaType.DIFFERENCE.apply(new double[]{1}, NONE, 1.0));
    }
}
