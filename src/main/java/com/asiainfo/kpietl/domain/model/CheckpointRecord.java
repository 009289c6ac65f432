package com.asiainfo.kpietl.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 单表抽取断点
 * 不变量：批次之外 offset == totalExtracted；completed 只在读到空批次或 totalExtracted >= totalRows 后置位
 *
 * @param offset         下一批次的起始行偏移
 * @param totalExtracted 累计已写入目标库的行数
 * @param totalRows      本次运行开始时源表的行数快照
 * @param percentage     进度百分比（保留两位小数）
 * @param completed      是否已全部抽取
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CheckpointRecord(
        @JsonProperty("offset") long offset,
        @JsonProperty("total_extracted") long totalExtracted,
        @JsonProperty("total_rows") long totalRows,
        @JsonProperty("percentage") double percentage,
        @JsonProperty("completed") boolean completed) {

    /**
     * 新表或续传时的初始断点，totalRows 为本次开始时的快照
     */
    public static CheckpointRecord start(long offset, long totalRows) {
        return new CheckpointRecord(offset, offset, totalRows, percentage(offset, totalRows), false);
    }

    public CheckpointRecord advance(int rows) {
        long extracted = totalExtracted + rows;
        return new CheckpointRecord(offset + rows, extracted, totalRows, percentage(extracted, totalRows), false);
    }

    public CheckpointRecord complete() {
        return new CheckpointRecord(offset, totalExtracted, totalRows, percentage, true);
    }

    public boolean reachedTotal() {
        return totalExtracted >= totalRows;
    }

    static double percentage(long extracted, long totalRows) {
        if (totalRows <= 0) {
            return 0;
        }
        return Math.round(extracted * 10000.0 / totalRows) / 100.0;
    }
}
