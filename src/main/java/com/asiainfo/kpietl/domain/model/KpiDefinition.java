package com.asiainfo.kpietl.domain.model;

import java.util.List;

/**
 * KPI 定义
 * 分子/分母为有序的计数器前缀列表，公式按列表顺序取值（缺失的计数器取 0）
 *
 * @param name        KPI 名称，同时是明细表中的列名
 * @param numerator   分子计数器
 * @param denominator 分母计数器，null 表示公式不使用分母
 * @param formula     公式类型
 * @param factor      SCALED_SUM 的系数，其它公式忽略
 * @param description 公式说明
 */
public record KpiDefinition(
        String name,
        List<String> numerator,
        List<String> denominator,
        FormulaType formula,
        Double factor,
        String description) {

    public KpiDefinition {
        numerator = numerator == null ? List.of() : List.copyOf(numerator);
        denominator = denominator == null ? null : List.copyOf(denominator);
    }

    public static KpiDefinition of(String name, List<String> numerator, FormulaType formula) {
        return new KpiDefinition(name, numerator, null, formula, null, null);
    }

    public static KpiDefinition of(String name, List<String> numerator, List<String> denominator, FormulaType formula) {
        return new KpiDefinition(name, numerator, denominator, formula, null, null);
    }

    public boolean hasDenominator() {
        return denominator != null;
    }

    public double factorOrDefault() {
        return factor != null ? factor : 1.0;
    }
}
