package com.asiainfo.kpietl.application.pipeline;

import com.asiainfo.kpietl.domain.model.CheckpointRecord;
import com.asiainfo.kpietl.infrastructure.checkpoint.CheckpointStore;
import com.asiainfo.kpietl.shared.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;

/**
 * 抽取完成闸门：决定 KPI 计算阶段能否开始
 * - 断点文件不存在/为空/为 {}：没有待处理的表，放行
 * - 任一表未标记 completed：拦截，并列出这些表
 * - 文件无法解析：拦截
 */
public class ExtractionGate {

    private static final Logger log = LoggerFactory.getLogger(ExtractionGate.class);

    private final CheckpointStore checkpointStore;

    public ExtractionGate(CheckpointStore checkpointStore) {
        this.checkpointStore = checkpointStore;
    }

    public record GateResult(boolean open, String message, List<String> pendingTables) {

        public static GateResult open(String message) {
            return new GateResult(true, message, List.of());
        }

        public static GateResult closed(String message, List<String> pendingTables) {
            return new GateResult(false, message, pendingTables);
        }
    }

    public GateResult check() {
        Map<String, CheckpointRecord> checkpoints;
        try {
            checkpoints = checkpointStore.loadStrict();
        } catch (PipelineException e) {
            log.error("[Gate] Cannot read checkpoint file: {}", e.getMessage());
            return GateResult.closed("Checkpoint file unreadable: " + e.getMessage(), List.of());
        }

        if (checkpoints.isEmpty()) {
            log.info("[Gate] No checkpoint entries, nothing pending");
            return GateResult.open("No tables pending");
        }

        List<String> pending = checkpoints.entrySet().stream()
                .filter(e -> e.getValue() == null || !e.getValue().completed())
                .map(Map.Entry::getKey)
                .toList();
        if (!pending.isEmpty()) {
            log.warn("[Gate] Extraction not completed for {} table(s): {}", pending.size(), pending);
            return GateResult.closed("Extraction not completed for table " + pending.get(0), pending);
        }
        log.info("[Gate] All {} table(s) completed", checkpoints.size());
        return GateResult.open("All " + checkpoints.size() + " table(s) completed");
    }
}
