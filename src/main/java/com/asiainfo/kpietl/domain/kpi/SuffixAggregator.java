package com.asiainfo.kpietl.domain.kpi;

import com.asiainfo.kpietl.domain.model.CounterRow;
import com.asiainfo.kpietl.domain.model.IndicatorName;
import com.asiainfo.kpietl.domain.model.SuffixAggregate;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * 单个时间点的计数器按后缀聚合
 * - 指标名按第一个 '.' 拆成 (前缀, 后缀)，无后缀或后缀属于非数据标记的行丢弃
 * - 同一后缀下按前缀求和，未出现的前缀补 0
 * - 映射到 "Other" 的后缀单独记录
 */
public class SuffixAggregator {

    private final SuffixOperatorMapper operatorMapper;
    private final Set<String> ignoredSuffixes;

    public SuffixAggregator(SuffixOperatorMapper operatorMapper, Collection<String> ignoredSuffixes) {
        this.operatorMapper = operatorMapper;
        this.ignoredSuffixes = Set.copyOf(ignoredSuffixes);
    }

    /**
     * 聚合结果：按后缀排序的聚合值 + 未映射后缀
     */
    public record Result(Map<String, SuffixAggregate> bySuffix, SortedSet<String> unmappedSuffixes) {

        public boolean isEmpty() {
            return bySuffix.isEmpty();
        }
    }

    /**
     * @param rows     同一时间点的原始计数器行
     * @param prefixes 需要的计数器前缀，决定每个后缀输出哪些键
     */
    public Result aggregate(List<CounterRow> rows, Collection<String> prefixes) {
        Map<String, Map<String, Double>> sums = new TreeMap<>();
        for (CounterRow row : rows) {
            if (row.indicator() == null) {
                continue;
            }
            IndicatorName name = IndicatorName.parse(row.indicator());
            if (!name.hasSuffix() || ignoredSuffixes.contains(name.suffix())) {
                continue;
            }
            Map<String, Double> counters = sums.computeIfAbsent(name.suffix(), s -> newCounterMap(prefixes));
            if (row.value() != null && counters.containsKey(name.prefix())) {
                counters.merge(name.prefix(), row.value(), Double::sum);
            }
        }

        Map<String, SuffixAggregate> bySuffix = new TreeMap<>();
        SortedSet<String> unmapped = new TreeSet<>();
        for (Map.Entry<String, Map<String, Double>> entry : sums.entrySet()) {
            String suffix = entry.getKey();
            String operator = operatorMapper.operatorOf(suffix);
            if (!operatorMapper.isMapped(suffix)) {
                unmapped.add(suffix);
            }
            bySuffix.put(suffix, new SuffixAggregate(suffix, operator, Collections.unmodifiableMap(entry.getValue())));
        }
        return new Result(Collections.unmodifiableMap(bySuffix), Collections.unmodifiableSortedSet(unmapped));
    }

    private static Map<String, Double> newCounterMap(Collection<String> prefixes) {
        Map<String, Double> counters = new LinkedHashMap<>();
        for (String prefix : prefixes) {
            counters.put(prefix, 0.0);
        }
        return counters;
    }
}
