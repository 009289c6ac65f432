package com.asiainfo.kpietl.api;

import com.asiainfo.kpietl.api.dto.PipelineRunResponse;
import com.asiainfo.kpietl.application.extract.ExtractionReport;
import com.asiainfo.kpietl.application.pipeline.ExtractionGate;
import com.asiainfo.kpietl.application.pipeline.PipelineService;
import com.asiainfo.kpietl.application.transform.TransformReport;
import com.asiainfo.kpietl.domain.model.CheckpointRecord;
import io.smallrye.common.annotation.Blocking;
import jakarta.inject.Inject;
import jakarta.ws.rs.GET;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.MediaType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.function.Supplier;

/**
 * 流水线触发 REST API
 * 供外部调度调用：抽取、KPI 计算、整体运行，以及断点/闸门查询
 */
@Path("/api/v1/pipeline")
@Produces(MediaType.APPLICATION_JSON)
public class PipelineResource {

    private static final Logger log = LoggerFactory.getLogger(PipelineResource.class);

    @Inject
    PipelineService pipelineService;

    @POST
    @Path("/extract")
    @Blocking
    public PipelineRunResponse extract() {
        return execute("extract", () -> {
            ExtractionReport report = pipelineService.runExtraction();
            return new Outcome(report.success(), report.message(), report);
        });
    }

    @POST
    @Path("/transform")
    @Blocking
    public PipelineRunResponse transform() {
        return execute("transform", () -> {
            TransformReport report = pipelineService.runTransform();
            return new Outcome(report.success(), report.message(), report);
        });
    }

    /**
     * 抽取 → 闸门 → KPI 计算
     */
    @POST
    @Path("/run")
    @Blocking
    public PipelineRunResponse run() {
        return execute("run", () -> {
            PipelineService.PipelineResult result = pipelineService.runPipeline();
            return new Outcome(result.success(), result.message(), result);
        });
    }

    @GET
    @Path("/checkpoints")
    @Blocking
    public Map<String, CheckpointRecord> checkpoints() {
        return pipelineService.checkpoints();
    }

    @GET
    @Path("/gate")
    @Blocking
    public ExtractionGate.GateResult gate() {
        return pipelineService.checkGate();
    }

    private record Outcome(boolean success, String message, Object result) {
    }

    private PipelineRunResponse execute(String phase, Supplier<Outcome> action) {
        log.info("[API] Pipeline {} triggered", phase);
        long start = System.currentTimeMillis();
        try {
            Outcome outcome = action.get();
            long elapsed = System.currentTimeMillis() - start;
            log.info("[API] Pipeline {} finished in {}ms: {}", phase, elapsed, outcome.message());
            return outcome.success()
                    ? PipelineRunResponse.success(outcome.message(), elapsed, outcome.result())
                    : PipelineRunResponse.failed(outcome.message(), elapsed, outcome.result());
        } catch (Exception e) {
            log.error("[API] Pipeline {} failed", phase, e);
            return PipelineRunResponse.error(phase + " failed: " + e.getMessage(), System.currentTimeMillis() - start);
        }
    }
}
