package com.asiainfo.kpietl.application.transform;

import java.util.List;

/**
 * KPI 计算阶段结果
 */
public record TransformReport(
        boolean success,
        String message,
        List<CategoryResult> categories) {

    public static TransformReport success(List<CategoryResult> categories) {
        return new TransformReport(true, "Transform finished for " + categories.size() + " category(ies)", categories);
    }

    public static TransformReport error(String message) {
        return new TransformReport(false, message, List.of());
    }

    public long detailRows() {
        return categories.stream().mapToLong(CategoryResult::detailRows).sum();
    }
}
