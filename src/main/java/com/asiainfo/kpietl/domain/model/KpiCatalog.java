package com.asiainfo.kpietl.domain.model;

import java.util.List;
import java.util.Optional;

/**
 * 静态配置目录：分类、后缀映射、KPI 公式表
 * 运行前加载，运行中只读
 */
public record KpiCatalog(
        List<SuffixMapping> suffixOperators,
        List<String> ignoredSuffixes,
        List<CategoryDefinition> categories) {

    public KpiCatalog {
        List<SuffixMapping> defaultOperators = suffixOperators == null ? List.of() : List.copyOf(suffixOperators);
        List<String> defaultIgnored = ignoredSuffixes == null ? List.of() : List.copyOf(ignoredSuffixes);
        suffixOperators = defaultOperators;
        ignoredSuffixes = defaultIgnored;
        categories = categories == null ? List.of() : categories.stream()
                .map(c -> c.withDefaults(defaultOperators, defaultIgnored))
                .toList();
    }

    public Optional<CategoryDefinition> category(String name) {
        return categories.stream().filter(c -> c.name().equals(name)).findFirst();
    }
}
