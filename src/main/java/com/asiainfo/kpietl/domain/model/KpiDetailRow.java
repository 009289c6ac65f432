package com.asiainfo.kpietl.domain.model;

import java.util.Map;
import java.util.Objects;

/**
 * KPI 明细行，values 中 null 表示该 KPI 无法计算
 */
public record KpiDetailRow(long summaryId, String operator, String suffix, Map<String, Double> values) {

    public boolean hasAnyValue() {
        return values.values().stream().anyMatch(Objects::nonNull);
    }
}
