package com.asiainfo.kpietl.domain.model;

import java.util.Map;

/**
 * 同一时间点、同一后缀下按前缀求和后的计数器
 */
public record SuffixAggregate(String suffix, String operator, Map<String, Double> counters) {
}
