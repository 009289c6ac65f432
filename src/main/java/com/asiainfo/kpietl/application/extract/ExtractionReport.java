package com.asiainfo.kpietl.application.extract;

import java.util.List;
import java.util.Map;

/**
 * 抽取阶段结果
 */
public record ExtractionReport(
        boolean success,
        String message,
        Map<String, Integer> selectedPerCategory,
        List<TableCopyResult> tables) {

    public static ExtractionReport of(Map<String, Integer> selectedPerCategory, List<TableCopyResult> tables) {
        long failed = tables.stream().filter(TableCopyResult::isFailure).count();
        if (failed > 0) {
            return new ExtractionReport(false, failed + " table(s) failed", selectedPerCategory, tables);
        }
        return new ExtractionReport(true, "Extraction finished for " + tables.size() + " table(s)",
                selectedPerCategory, tables);
    }

    public long rowsCopied() {
        return tables.stream().mapToLong(TableCopyResult::rowsCopied).sum();
    }
}
