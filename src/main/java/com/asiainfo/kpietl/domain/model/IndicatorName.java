package com.asiainfo.kpietl.domain.model;

/**
 * 指标名称拆分结果：prefix.suffix
 * prefix 为计数器族，suffix 为厂商/节点自定义标记（保留完整字符串）
 * 没有 '.' 的名称 suffix 为 null，不参与汇总
 */
public record IndicatorName(String prefix, String suffix) {

    public static IndicatorName parse(String indicator) {
        if (indicator == null) {
            throw new IllegalArgumentException("Indicator name must not be null");
        }
        int dot = indicator.indexOf('.');
        if (dot < 0) {
            return new IndicatorName(indicator, null);
        }
        return new IndicatorName(indicator.substring(0, dot), indicator.substring(dot + 1));
    }

    public boolean hasSuffix() {
        return suffix != null;
    }
}
