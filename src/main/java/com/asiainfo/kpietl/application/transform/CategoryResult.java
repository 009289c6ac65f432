package com.asiainfo.kpietl.application.transform;

import java.util.List;

/**
 * 单个分类的 KPI 计算结果
 *
 * @param category         分类
 * @param tablesProcessed  已处理的表
 * @param tablesSkipped    因数据形态问题跳过的表
 * @param datesProcessed   处理的时间点数
 * @param detailRows       写入的明细行数
 * @param droppedNullRows  全部 KPI 为 null 而丢弃的行数
 */
public record CategoryResult(
        String category,
        List<String> tablesProcessed,
        List<String> tablesSkipped,
        long datesProcessed,
        long detailRows,
        long droppedNullRows) {

    public static CategoryResult skipped(String category) {
        return new CategoryResult(category, List.of(), List.of(), 0, 0, 0);
    }
}
