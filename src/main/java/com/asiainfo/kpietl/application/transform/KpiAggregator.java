package com.asiainfo.kpietl.application.transform;

import com.asiainfo.kpietl.domain.kpi.KpiEvaluator;
import com.asiainfo.kpietl.domain.kpi.SuffixAggregator;
import com.asiainfo.kpietl.domain.kpi.SuffixOperatorMapper;
import com.asiainfo.kpietl.domain.model.CategoryDefinition;
import com.asiainfo.kpietl.domain.model.CounterRow;
import com.asiainfo.kpietl.domain.model.KpiDetailRow;
import com.asiainfo.kpietl.domain.model.KpiTableGroup;
import com.asiainfo.kpietl.domain.model.SuffixAggregate;
import com.asiainfo.kpietl.infrastructure.persistence.ConnectionFactory;
import com.asiainfo.kpietl.infrastructure.persistence.KpiRepository;
import com.asiainfo.kpietl.infrastructure.persistence.StagingCounterReader;
import com.asiainfo.kpietl.shared.DataShapeException;
import com.asiainfo.kpietl.shared.PipelineException;
import com.asiainfo.kpietl.shared.RetryExecutor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * 单个分类的 KPI 计算
 *
 * 逐表、逐日期批次顺序处理：
 * 1. 从表名开头提取节点，提取不到则跳过该表
 * 2. 读取中间表全部时间点，按 dateBatchSize 分批，按计数器前缀读取原始行（固定间隔重试，耗尽即整次失败）
 * 3. 每个时间点：查找/创建汇总行 → 按后缀聚合 → 逐明细表分组计算 KPI → 缓冲
 * 4. 缓冲达到 insertBatchSize 时写入，全部表处理完后写入剩余行
 *
 * 构造时打开两个独占连接（中间库、结果库）并建表，close 时释放
 */
public class KpiAggregator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(KpiAggregator.class);

    private final CategoryDefinition category;
    private final Connection sourceConn;
    private final Connection destinationConn;
    private final StagingCounterReader reader;
    private final KpiRepository repository;
    private final RetryExecutor extractRetry;
    private final int dateBatchSize;
    private final int insertBatchSize;
    private final boolean replaceExistingDetails;

    private final Pattern nodePattern;
    private final List<String> counters;
    private final SuffixAggregator suffixAggregator;
    private final KpiEvaluator evaluator = new KpiEvaluator();

    private final Map<String, List<KpiDetailRow>> buffers = new LinkedHashMap<>();
    private final Set<Long> clearedSummaries = new HashSet<>();

    private final Counter detailRowsCounter;
    private final Timer dateBatchTimer;

    private long detailRows;
    private long droppedNullRows;

    public KpiAggregator(CategoryDefinition category,
                         Connection sourceConn,
                         Connection destinationConn,
                         RetryExecutor extractRetry,
                         int dateBatchSize,
                         int insertBatchSize,
                         boolean replaceExistingDetails,
                         MeterRegistry registry) {
        if (dateBatchSize <= 0 || insertBatchSize <= 0) {
            throw new IllegalArgumentException("Batch sizes must be positive");
        }
        this.category = category;
        this.sourceConn = sourceConn;
        this.destinationConn = destinationConn;
        this.reader = new StagingCounterReader(sourceConn);
        this.repository = new KpiRepository(destinationConn);
        this.extractRetry = extractRetry;
        this.dateBatchSize = dateBatchSize;
        this.insertBatchSize = insertBatchSize;
        this.replaceExistingDetails = replaceExistingDetails;

        this.nodePattern = category.compiledNodePattern();
        this.counters = List.copyOf(category.allCounters());
        this.suffixAggregator = new SuffixAggregator(
                new SuffixOperatorMapper(category.suffixOperators()), category.ignoredSuffixes());
        category.tableGroups().forEach(group -> buffers.put(group.name(), new ArrayList<>()));

        this.detailRowsCounter = Counter.builder("pipeline.transform.detail.rows")
                .tag("category", category.name())
                .register(registry);
        this.dateBatchTimer = Timer.builder("pipeline.transform.date-batch.time")
                .tag("category", category.name())
                .register(registry);

        repository.createTables(category.tableGroups());
    }

    public CategoryResult process(List<String> tables) {
        List<String> processed = new ArrayList<>();
        List<String> skipped = new ArrayList<>();
        long dates = 0;

        for (String table : tables) {
            String node;
            try {
                node = checkProcessable(table);
            } catch (DataShapeException e) {
                log.warn("[Transform] Skipping table '{}': {}", table, e.getMessage());
                skipped.add(table);
                continue;
            }
            log.info("[Transform] Processing table '{}' (node {})", table, node);
            dates += processTable(table, node);
            processed.add(table);
        }

        flushAll();
        log.info("[Transform] Category {} finished: {} table(s), {} skipped, {} date(s), {} detail rows, {} all-null rows dropped",
                category.name(), processed.size(), skipped.size(), dates, detailRows, droppedNullRows);
        return new CategoryResult(category.name(), processed, skipped, dates, detailRows, droppedNullRows);
    }

    private long processTable(String table, String node) {
        List<LocalDateTime> dates = extractRetry.execute("distinct dates of " + table,
                () -> reader.distinctDates(table));
        log.info("[Transform] Table '{}' has {} distinct date(s)", table, dates.size());

        long processedDates = 0;
        for (int from = 0; from < dates.size(); from += dateBatchSize) {
            List<LocalDateTime> batch = dates.subList(from, Math.min(from + dateBatchSize, dates.size()));
            Timer.Sample sample = Timer.start();
            List<CounterRow> rows = extractRetry.execute("counters of " + table + " for " + batch.size() + " date(s)",
                    () -> reader.fetchCounters(table, batch, counters));

            Map<LocalDateTime, List<CounterRow>> byDate = new TreeMap<>();
            for (CounterRow row : rows) {
                byDate.computeIfAbsent(row.timestamp(), d -> new ArrayList<>()).add(row);
            }
            for (Map.Entry<LocalDateTime, List<CounterRow>> entry : byDate.entrySet()) {
                processDate(entry.getKey(), node, entry.getValue());
                processedDates++;
            }
            sample.stop(dateBatchTimer);
            log.debug("[Transform] Table '{}': date batch {}-{} done ({} rows)",
                    table, from, from + batch.size() - 1, rows.size());
        }
        return processedDates;
    }

    void processDate(LocalDateTime date, String node, List<CounterRow> rows) {
        long summaryId = repository.findOrCreateSummary(date, node);
        if (replaceExistingDetails && clearedSummaries.add(summaryId)) {
            int deleted = repository.deleteDetails(category.tableGroups(), summaryId);
            if (deleted > 0) {
                log.info("[Transform] Replaced {} existing detail row(s) for {} / {}", deleted, date, node);
            }
        }

        SuffixAggregator.Result aggregated = suffixAggregator.aggregate(rows, counters);
        if (!aggregated.unmappedSuffixes().isEmpty()) {
            log.warn("[Transform] Unmapped suffixes at {} ({}): {}", date, node, aggregated.unmappedSuffixes());
        }

        for (KpiTableGroup group : category.tableGroups()) {
            List<KpiDetailRow> buffer = buffers.get(group.name());
            for (SuffixAggregate suffix : aggregated.bySuffix().values()) {
                Map<String, Double> values = evaluator.evaluate(group, suffix.counters());
                KpiDetailRow row = new KpiDetailRow(summaryId, suffix.operator(), suffix.suffix(), values);
                if (!row.hasAnyValue()) {
                    log.warn("[Transform] All KPIs null for {} suffix '{}' at {}, row dropped",
                            group.name(), suffix.suffix(), date);
                    droppedNullRows++;
                    continue;
                }
                buffer.add(row);
                if (buffer.size() >= insertBatchSize) {
                    flush(group);
                }
            }
        }
    }

    Optional<String> extractNode(String table) {
        Matcher m = nodePattern.matcher(table);
        if (!m.lookingAt()) {
            return Optional.empty();
        }
        String node = m.groupCount() >= 1 && m.group(1) != null ? m.group(1) : m.group();
        return node.isEmpty() ? Optional.empty() : Optional.of(node.toUpperCase(Locale.ROOT));
    }

    /**
     * @return 表对应的节点
     * @throws DataShapeException 提取不到节点或中间表不存在
     */
    private String checkProcessable(String table) {
        String node = extractNode(table)
                .orElseThrow(() -> new DataShapeException("no node extracted from table name"));
        boolean exists;
        try {
            exists = reader.tableExists(table);
        } catch (SQLException e) {
            throw new PipelineException("Failed to inspect staging table " + table, e);
        }
        if (!exists) {
            throw new DataShapeException("staging table does not exist");
        }
        return node;
    }

    private void flush(KpiTableGroup group) {
        List<KpiDetailRow> buffer = buffers.get(group.name());
        if (buffer.isEmpty()) {
            return;
        }
        int inserted = repository.insertDetails(group, buffer);
        detailRows += inserted;
        detailRowsCounter.increment(inserted);
        buffer.clear();
    }

    private void flushAll() {
        category.tableGroups().forEach(this::flush);
    }

    @Override
    public void close() {
        ConnectionFactory.closeQuietly(sourceConn);
        ConnectionFactory.closeQuietly(destinationConn);
    }
}
