package com.asiainfo.kpietl.application.extract;

import com.asiainfo.kpietl.domain.model.CheckpointRecord;
import com.asiainfo.kpietl.domain.model.CounterRow;
import com.asiainfo.kpietl.domain.model.RawCounterRow;
import com.asiainfo.kpietl.infrastructure.checkpoint.CheckpointStore;
import com.asiainfo.kpietl.infrastructure.indicator.IndicatorMappingRepository;
import com.asiainfo.kpietl.infrastructure.persistence.ConnectionFactory;
import com.asiainfo.kpietl.infrastructure.persistence.SourceTableRepository;
import com.asiainfo.kpietl.infrastructure.persistence.StagingTableWriter;
import com.asiainfo.kpietl.shared.PipelineConstants;
import com.asiainfo.kpietl.shared.RetryExecutor;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * 断点续传批量复制：源表 → 中间库
 *
 * 单线程、逐表、逐批：
 * 1. 从断点 offset 开始按 date_heure 排序读取一批（读取失败指数回退重试）
 * 2. 指标 ID 替换为名称（缺少映射则跳过该表），NaN 写为 NULL
 * 3. 写入中间库（表不存在时创建），推进并保存断点
 * 4. 读到空批次或累计行数达到开始时的总行数后标记 completed
 *
 * 构造时持有两个独占连接，close 时释放
 */
public class BatchCopier implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BatchCopier.class);

    private final Connection sourceConn;
    private final Connection destinationConn;
    private final SourceTableRepository source;
    private final StagingTableWriter writer;
    private final CheckpointStore checkpointStore;
    private final IndicatorMappingRepository indicators;
    private final RetryExecutor fetchRetry;
    private final Counter rowsCounter;
    private final Timer batchTimer;

    public BatchCopier(Connection sourceConn,
                       Connection destinationConn,
                       CheckpointStore checkpointStore,
                       IndicatorMappingRepository indicators,
                       RetryExecutor fetchRetry,
                       MeterRegistry registry) {
        this.sourceConn = sourceConn;
        this.destinationConn = destinationConn;
        this.source = new SourceTableRepository(sourceConn);
        this.writer = new StagingTableWriter(destinationConn);
        this.checkpointStore = checkpointStore;
        this.indicators = indicators;
        this.fetchRetry = fetchRetry;
        this.rowsCounter = Counter.builder("pipeline.extract.rows")
                .description("Rows copied into the staging database")
                .register(registry);
        this.batchTimer = Timer.builder("pipeline.extract.batch.time")
                .description("Fetch + insert time of one extraction batch")
                .register(registry);
    }

    public SourceTableRepository source() {
        return source;
    }

    public TableCopyResult copyTable(String table, int batchSize) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive: " + batchSize);
        }
        Map<String, CheckpointRecord> checkpoints = checkpointStore.load();
        CheckpointRecord existing = checkpoints.get(table);
        if (existing != null && existing.completed()) {
            log.info("[Extract] Skipping table '{}' - already fully processed", table);
            return TableCopyResult.alreadyCompleted(table, existing);
        }

        long offset = existing != null ? existing.offset() : 0L;
        if (offset > 0) {
            log.info("[Extract] Resuming extraction for '{}' from offset {}", table, offset);
        }

        long totalRows;
        try {
            totalRows = fetchRetry.execute("count " + table, () -> source.countRows(table));
        } catch (RetryExecutor.RetryExhaustedException e) {
            log.error("[Extract] Cannot count rows of '{}', aborting table", table, e);
            return TableCopyResult.failed(table, 0, existing, e.getMessage());
        }
        log.info("[Extract] Total rows in table '{}': {}", table, totalRows);

        CheckpointRecord checkpoint = CheckpointRecord.start(offset, totalRows);
        Map<Long, String> mapping = null;
        boolean tableReady = false;
        long copied = 0;

        while (true) {
            long batchOffset = checkpoint.offset();
            Timer.Sample sample = Timer.start();
            List<RawCounterRow> batch;
            try {
                batch = fetchRetry.execute("fetch " + table + " at offset " + batchOffset,
                        () -> source.fetchBatch(table, batchOffset, batchSize));
            } catch (RetryExecutor.RetryExhaustedException e) {
                log.error("[Extract] Max retries reached for table '{}' at offset {}", table, batchOffset, e);
                return TableCopyResult.failed(table, copied, checkpoints.get(table), e.getMessage());
            }

            if (batch.isEmpty()) {
                log.info("[Extract] No more data to process for table '{}'", table);
                break;
            }

            if (mapping == null) {
                mapping = indicators.mappingFor(table);
                if (mapping.isEmpty()) {
                    String message = "No indicator mapping for " + table + " (" + indicators.csvPathFor(table) + ")";
                    log.error("[Extract] Cannot proceed without indicator mapping for '{}', skipping table", table);
                    return TableCopyResult.noMapping(table, copied, checkpoints.get(table), message);
                }
            }
            if (!tableReady) {
                writer.ensureTable(table);
                tableReady = true;
            }

            int written = writer.insertBatch(table, annotate(batch, mapping));
            checkpoint = checkpoint.advance(written);
            checkpoints.put(table, checkpoint);
            checkpointStore.save(checkpoints);

            copied += written;
            rowsCounter.increment(written);
            sample.stop(batchTimer);
            log.info("[Extract] Progress: Extracted {}/{} rows ({}%) from '{}'",
                    checkpoint.totalExtracted(), checkpoint.totalRows(), checkpoint.percentage(), table);

            if (checkpoint.reachedTotal()) {
                log.info("[Extract] Table '{}' fully extracted ({}/{} rows)",
                        table, checkpoint.totalExtracted(), checkpoint.totalRows());
                break;
            }
        }

        checkpoint = checkpoint.complete();
        checkpoints.put(table, checkpoint);
        checkpointStore.save(checkpoints);
        return TableCopyResult.completed(table, copied, checkpoint);
    }

    static List<CounterRow> annotate(List<RawCounterRow> batch, Map<Long, String> mapping) {
        List<CounterRow> rows = new ArrayList<>(batch.size());
        for (RawCounterRow raw : batch) {
            String name = raw.indicatorId() != null ? mapping.get(raw.indicatorId()) : null;
            rows.add(new CounterRow(raw.timestamp(),
                    name != null ? name : PipelineConstants.UNKNOWN_INDICATOR,
                    raw.value()));
        }
        return rows;
    }

    @Override
    public void close() {
        ConnectionFactory.closeQuietly(sourceConn);
        ConnectionFactory.closeQuietly(destinationConn);
    }
}
