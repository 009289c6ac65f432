package com.asiainfo.kpietl.api.dto;

/**
 * 阶段触发接口响应体
 *
 * @param status          SUCCESS / FAILED / ERROR
 * @param message         说明
 * @param executionTimeMs 执行耗时
 * @param result          阶段结果（ExtractionReport / TransformReport / PipelineResult）
 */
public record PipelineRunResponse(
        String status,
        String message,
        long executionTimeMs,
        Object result) {

    public static PipelineRunResponse success(String message, long executionTimeMs, Object result) {
        return new PipelineRunResponse("SUCCESS", message, executionTimeMs, result);
    }

    /**
     * 阶段执行完毕但结果不成功（有表失败、闸门未放行）
     */
    public static PipelineRunResponse failed(String message, long executionTimeMs, Object result) {
        return new PipelineRunResponse("FAILED", message, executionTimeMs, result);
    }

    public static PipelineRunResponse error(String message, long executionTimeMs) {
        return new PipelineRunResponse("ERROR", message, executionTimeMs, null);
    }
}
