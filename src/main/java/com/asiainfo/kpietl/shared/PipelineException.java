package com.asiainfo.kpietl.shared;

/**
 * 流水线致命错误
 * 由组件抛出并携带上下文（表名、分类、数据库），由顶层编排记录后继续上抛
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
