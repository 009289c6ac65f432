package com.asiainfo.kpietl.application.pipeline;

import com.asiainfo.kpietl.application.extract.ExtractionReport;
import com.asiainfo.kpietl.application.extract.ExtractionService;
import com.asiainfo.kpietl.application.transform.TransformReport;
import com.asiainfo.kpietl.application.transform.TransformService;
import com.asiainfo.kpietl.domain.model.CheckpointRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * 流水线编排：抽取 → 闸门 → KPI 计算
 * 各阶段也可单独调用；致命错误记录后继续上抛，由调用方决定退出码/响应
 */
@ApplicationScoped
public class PipelineService {

    private static final Logger log = LoggerFactory.getLogger(PipelineService.class);

    @Inject
    ExtractionService extractionService;

    @Inject
    TransformService transformService;

    /**
     * 整体运行结果
     */
    public record PipelineResult(
            boolean success,
            String message,
            ExtractionReport extraction,
            ExtractionGate.GateResult gate,
            TransformReport transform) {

        public static PipelineResult success(ExtractionReport extraction, ExtractionGate.GateResult gate,
                                             TransformReport transform) {
            return new PipelineResult(true, "Pipeline completed", extraction, gate, transform);
        }

        public static PipelineResult error(String message, ExtractionReport extraction, ExtractionGate.GateResult gate) {
            return new PipelineResult(false, message, extraction, gate, null);
        }
    }

    public ExtractionReport runExtraction() {
        return extractionService.runExtraction();
    }

    public TransformReport runTransform() {
        return transformService.runTransform();
    }

    public ExtractionGate.GateResult checkGate() {
        return new ExtractionGate(extractionService.checkpointStore()).check();
    }

    public Map<String, CheckpointRecord> checkpoints() {
        return extractionService.checkpoints();
    }

    public PipelineResult runPipeline() {
        long start = System.currentTimeMillis();
        ExtractionReport extraction = runExtraction();

        ExtractionGate.GateResult gate = checkGate();
        if (!gate.open()) {
            log.warn("[Pipeline] Transform held back: {}", gate.message());
            return PipelineResult.error("Transform held back: " + gate.message(), extraction, gate);
        }

        TransformReport transform = runTransform();
        log.info("[Pipeline] Completed in {}ms: {} rows copied, {} detail rows written",
                System.currentTimeMillis() - start, extraction.rowsCopied(), transform.detailRows());
        return PipelineResult.success(extraction, gate, transform);
    }
}
