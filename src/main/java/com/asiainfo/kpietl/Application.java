package com.asiainfo.kpietl;

import com.asiainfo.kpietl.application.extract.ExtractionReport;
import com.asiainfo.kpietl.application.pipeline.PipelineService;
import com.asiainfo.kpietl.application.transform.TransformReport;
import io.quarkus.runtime.Quarkus;
import io.quarkus.runtime.QuarkusApplication;
import io.quarkus.runtime.annotations.QuarkusMain;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * 应用程序主类
 * 无参数：提供 REST 接口直到退出
 * extract / transform / pipeline：执行一次对应阶段后退出（0 成功，1 失败），供外部调度调用
 */
@QuarkusMain
public class Application {

    public static void main(String[] args) {
        Quarkus.run(App.class, args);
    }

    /**
     * 应用程序实例
     */
    public static class App implements QuarkusApplication {

        private static final Logger log = LoggerFactory.getLogger(App.class);

        @Inject
        PipelineService pipelineService;

        @Override
        public int run(String... args) {
            if (args.length == 0) {
                log.info("KPI ETL pipeline started, waiting for triggers on /api/v1/pipeline");
                Quarkus.waitForExit();
                return 0;
            }

            String mode = args[0];
            try {
                return switch (mode) {
                    case "extract" -> {
                        ExtractionReport report = pipelineService.runExtraction();
                        log.info("Extraction: {}", report.message());
                        yield report.success() ? 0 : 1;
                    }
                    case "transform" -> {
                        TransformReport report = pipelineService.runTransform();
                        log.info("Transform: {}", report.message());
                        yield report.success() ? 0 : 1;
                    }
                    case "pipeline" -> {
                        PipelineService.PipelineResult result = pipelineService.runPipeline();
                        log.info("Pipeline: {}", result.message());
                        yield result.success() ? 0 : 1;
                    }
                    default -> {
                        log.error("Unknown mode '{}', expected one of: extract, transform, pipeline", mode);
                        yield 2;
                    }
                };
            } catch (RuntimeException e) {
                log.error("Pipeline mode '{}' failed", mode, e);
                return 1;
            }
        }
    }
}
