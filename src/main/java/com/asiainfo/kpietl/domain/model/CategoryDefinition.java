package com.asiainfo.kpietl.domain.model;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * 表分类定义（5min / 15min / mgw ...）
 *
 * @param name            分类名称
 * @param tablePattern    源表命名规则（忽略大小写，整名匹配）
 * @param nodePattern     从表名开头提取节点的规则，第 1 组为节点
 * @param sourceDb        KPI 计算读取的数据库（即抽取的中间库）
 * @param destinationDb   KPI 结果写入的数据库
 * @param suffixOperators 后缀 → 运营商映射，按声明顺序匹配；null 时使用目录级默认值
 * @param ignoredSuffixes 非数据后缀，null 时使用目录级默认值
 * @param tableGroups     KPI 明细表分组
 */
public record CategoryDefinition(
        String name,
        String tablePattern,
        String nodePattern,
        String sourceDb,
        String destinationDb,
        List<SuffixMapping> suffixOperators,
        List<String> ignoredSuffixes,
        List<KpiTableGroup> tableGroups) {

    public CategoryDefinition {
        suffixOperators = suffixOperators == null ? null : List.copyOf(suffixOperators);
        ignoredSuffixes = ignoredSuffixes == null ? null : List.copyOf(ignoredSuffixes);
        tableGroups = tableGroups == null ? List.of() : List.copyOf(tableGroups);
    }

    public CategoryDefinition withDefaults(List<SuffixMapping> defaultOperators, List<String> defaultIgnored) {
        return new CategoryDefinition(name, tablePattern, nodePattern, sourceDb, destinationDb,
                suffixOperators != null ? suffixOperators : defaultOperators,
                ignoredSuffixes != null ? ignoredSuffixes : defaultIgnored,
                tableGroups);
    }

    public Pattern compiledTablePattern() {
        return Pattern.compile(tablePattern, Pattern.CASE_INSENSITIVE);
    }

    public Pattern compiledNodePattern() {
        return Pattern.compile(nodePattern, Pattern.CASE_INSENSITIVE);
    }

    /**
     * 本分类需要抽取的计数器全集
     */
    public Set<String> allCounters() {
        Set<String> counters = new LinkedHashSet<>();
        tableGroups.forEach(group -> counters.addAll(group.counterPrefixes()));
        return counters;
    }

    public boolean hasTableGroups() {
        return !tableGroups.isEmpty();
    }
}
