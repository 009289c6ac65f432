package com.asiainfo.kpietl.domain.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * KPI 明细表分组：一张明细表对应一组 KPI 列
 */
public record KpiTableGroup(String name, List<KpiDefinition> kpis) {

    public KpiTableGroup {
        kpis = kpis == null ? List.of() : List.copyOf(kpis);
    }

    /**
     * 本组用到的全部计数器前缀（分子 + 分母，保持声明顺序）
     */
    public Set<String> counterPrefixes() {
        Set<String> prefixes = new LinkedHashSet<>();
        for (KpiDefinition kpi : kpis) {
            prefixes.addAll(kpi.numerator());
            if (kpi.hasDenominator()) {
                prefixes.addAll(kpi.denominator());
            }
        }
        return prefixes;
    }

    public List<String> kpiNames() {
        return kpis.stream().map(KpiDefinition::name).toList();
    }
}
