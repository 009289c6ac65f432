package com.asiainfo.kpietl.domain.kpi;

import com.asiainfo.kpietl.domain.model.SuffixMapping;
import com.asiainfo.kpietl.shared.PipelineConstants;

import java.util.List;
import java.util.Locale;

/**
 * 后缀 → 运营商映射
 * 按声明顺序匹配，第一个被后缀（忽略大小写）包含的 pattern 胜出，未命中返回 "Other"
 */
public class SuffixOperatorMapper {

    private final List<SuffixMapping> mappings;

    public SuffixOperatorMapper(List<SuffixMapping> mappings) {
        this.mappings = mappings.stream()
                .filter(m -> m.pattern() != null && !m.pattern().isEmpty())
                .map(m -> new SuffixMapping(m.pattern().toLowerCase(Locale.ROOT), m.operator()))
                .toList();
    }

    public String operatorOf(String suffix) {
        String lower = suffix.toLowerCase(Locale.ROOT);
        for (SuffixMapping mapping : mappings) {
            if (lower.contains(mapping.pattern())) {
                return mapping.operator();
            }
        }
        return PipelineConstants.OTHER_OPERATOR;
    }

    public boolean isMapped(String suffix) {
        return !PipelineConstants.OTHER_OPERATOR.equals(operatorOf(suffix));
    }
}
