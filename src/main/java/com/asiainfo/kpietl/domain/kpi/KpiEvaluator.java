package com.asiainfo.kpietl.domain.kpi;

import com.asiainfo.kpietl.domain.model.KpiDefinition;
import com.asiainfo.kpietl.domain.model.KpiTableGroup;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * KPI 公式求值
 * 缺失的计数器按 0 处理；公式异常、除零、NaN/Infinity 均记为 null，不向上抛出
 */
public class KpiEvaluator {

    private static final Logger log = LoggerFactory.getLogger(KpiEvaluator.class);

    /**
     * 计算一个明细表分组的全部 KPI，结果按 KPI 声明顺序
     */
    public Map<String, Double> evaluate(KpiTableGroup group, Map<String, Double> counters) {
        Map<String, Double> values = new LinkedHashMap<>();
        for (KpiDefinition kpi : group.kpis()) {
            values.put(kpi.name(), evaluate(kpi, counters));
        }
        return values;
    }

    public Double evaluate(KpiDefinition kpi, Map<String, Double> counters) {
        try {
            double[] num = resolve(kpi.numerator(), counters);
            double[] den = kpi.hasDenominator() ? resolve(kpi.denominator(), counters) : new double[0];
            Double value = kpi.formula().apply(num, den, kpi.factorOrDefault());
            if (value == null || value.isNaN() || value.isInfinite()) {
                return null;
            }
            return value;
        } catch (RuntimeException e) {
            log.debug("[KPI] {} evaluation failed: {}", kpi.name(), e.getMessage());
            return null;
        }
    }

    private static double[] resolve(List<String> names, Map<String, Double> counters) {
        double[] values = new double[names.size()];
        for (int i = 0; i < names.size(); i++) {
            Double v = counters.get(names.get(i));
            values[i] = v != null ? v : 0.0;
        }
        return values;
    }
}
