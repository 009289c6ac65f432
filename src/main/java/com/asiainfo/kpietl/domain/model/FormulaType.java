package com.asiainfo.kpietl.domain.model;

import com.asiainfo.kpietl.shared.PipelineConstants;

/**
 * KPI 公式类型
 * 每种类型是分子/分母取值列表上的纯函数，返回 null 表示该 KPI 无法计算（如分母为 0）
 */
public enum FormulaType {

    /** sum(num) */
    SUM {
        @Override
        public Double apply(double[] num, double[] den, double factor) {
            return sum(num);
        }
    },

    /** sum(num) / sum(den) */
    RATIO {
        @Override
        public Double apply(double[] num, double[] den, double factor) {
            double d = sum(den);
            return d != 0 ? sum(num) / d : null;
        }
    },

    /** sum(num) / sum(den) * 100 */
    RATIO_PERCENT {
        @Override
        public Double apply(double[] num, double[] den, double factor) {
            double d = sum(den);
            return d != 0 ? sum(num) / d * 100 : null;
        }
    },

    /** (1 - sum(num) / sum(den)) * 100 */
    COMPLEMENT_RATIO_PERCENT {
        @Override
        public Double apply(double[] num, double[] den, double factor) {
            double d = sum(den);
            return d != 0 ? (1 - sum(num) / d) * 100 : null;
        }
    },

    /** num[0] - num[1] */
    DIFFERENCE {
        @Override
        public Double apply(double[] num, double[] den, double factor) {
            requireLength(num, 2, "numerator");
            return num[0] - num[1];
        }
    },

    /** num[0] * 2^31 + num[1] */
    HI_LO {
        @Override
        public Double apply(double[] num, double[] den, double factor) {
            requireLength(num, 2, "numerator");
            return reconstructHiLo(num[0], num[1]);
        }
    },

    /** sum(num) / ((den[0] * 2^31 + den[1]) + den[2]) * 100 */
    HI_LO_LOSS_PERCENT {
        @Override
        public Double apply(double[] num, double[] den, double factor) {
            requireLength(den, 3, "denominator");
            double total = reconstructHiLo(den[0], den[1]) + den[2];
            return total != 0 ? sum(num) / total * 100 : null;
        }
    },

    /** sum(num) * factor */
    SCALED_SUM {
        @Override
        public Double apply(double[] num, double[] den, double factor) {
            return sum(num) * factor;
        }
    },

    /** 占位 KPI，始终为 null */
    NONE {
        @Override
        public Double apply(double[] num, double[] den, double factor) {
            return null;
        }
    };

    public abstract Double apply(double[] num, double[] den, double factor);

    public static double reconstructHiLo(double hi, double lo) {
        return hi * PipelineConstants.HI_LO_SPLIT + lo;
    }

    static double sum(double[] values) {
        double total = 0;
        for (double v : values) {
            total += v;
        }
        return total;
    }

    static void requireLength(double[] values, int length, String side) {
        if (values.length < length) {
            throw new IllegalArgumentException(
                    "Expected at least " + length + " " + side + " counters, got " + values.length);
        }
    }
}
