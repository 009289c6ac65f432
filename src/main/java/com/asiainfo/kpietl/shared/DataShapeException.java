package com.asiainfo.kpietl.shared;

/**
 * 数据形态错误：表名中提取不到节点、中间表不存在等
 * 只跳过当前表，不中断整次运行
 */
public class DataShapeException extends PipelineException {

    public DataShapeException(String message) {
        super(message);
    }
}
