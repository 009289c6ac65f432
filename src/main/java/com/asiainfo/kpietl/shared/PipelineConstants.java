package com.asiainfo.kpietl.shared;

import java.util.regex.Pattern;

public class PipelineConstants {
    // 表名末尾的周/年标记，如 CALIS_APG43_5_S12_A2024
    public static final Pattern WEEK_YEAR_SUFFIX = Pattern.compile("_S(\\d+)_A(\\d{4})$", Pattern.CASE_INSENSITIVE);

    // 建表/插入时拼接的表名、列名只允许这些字符
    public static final Pattern SAFE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    // 指标ID在映射文件中不存在时写入的名称
    public static final String UNKNOWN_INDICATOR = "Unknown";

    // 后缀未匹配任何运营商时的标签
    public static final String OTHER_OPERATOR = "Other";

    // 32位 hi/lo 计数器拼接常量：value = hi * 2^31 + lo
    public static final double HI_LO_SPLIT = 2147483648d;

    private PipelineConstants() {}
}
