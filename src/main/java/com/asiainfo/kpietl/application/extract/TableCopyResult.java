package com.asiainfo.kpietl.application.extract;

import com.asiainfo.kpietl.domain.model.CheckpointRecord;

/**
 * 单表抽取结果
 *
 * @param table      表名
 * @param status     结果状态
 * @param rowsCopied 本次运行写入的行数
 * @param checkpoint 结束时的断点（跳过/无进度时可能为 null）
 * @param message    说明
 */
public record TableCopyResult(
        String table,
        Status status,
        long rowsCopied,
        CheckpointRecord checkpoint,
        String message) {

    public enum Status {
        /** 本次运行抽取完成 */
        COMPLETED,
        /** 断点已标记完成，未做任何读取 */
        SKIPPED_COMPLETED,
        /** 缺少指标映射，断点未推进 */
        SKIPPED_NO_MAPPING,
        /** 读取重试耗尽，断点停在最后一次成功的批次 */
        FAILED
    }

    public static TableCopyResult completed(String table, long rowsCopied, CheckpointRecord checkpoint) {
        return new TableCopyResult(table, Status.COMPLETED, rowsCopied, checkpoint, "Extraction completed");
    }

    public static TableCopyResult alreadyCompleted(String table, CheckpointRecord checkpoint) {
        return new TableCopyResult(table, Status.SKIPPED_COMPLETED, 0, checkpoint, "Already fully processed");
    }

    public static TableCopyResult noMapping(String table, long rowsCopied, CheckpointRecord checkpoint, String message) {
        return new TableCopyResult(table, Status.SKIPPED_NO_MAPPING, rowsCopied, checkpoint, message);
    }

    public static TableCopyResult failed(String table, long rowsCopied, CheckpointRecord checkpoint, String message) {
        return new TableCopyResult(table, Status.FAILED, rowsCopied, checkpoint, message);
    }

    public boolean isFailure() {
        return status == Status.FAILED;
    }
}
