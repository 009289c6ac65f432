package com.asiainfo.kpietl.domain.model;

/**
 * 后缀 → 运营商映射项：后缀中（忽略大小写）包含 pattern 即命中
 */
public record SuffixMapping(String pattern, String operator) {
}
