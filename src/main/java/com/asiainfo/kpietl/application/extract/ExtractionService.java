package com.asiainfo.kpietl.application.extract;

import com.asiainfo.kpietl.config.PipelineConfig;
import com.asiainfo.kpietl.domain.model.CheckpointRecord;
import com.asiainfo.kpietl.infrastructure.catalog.KpiCatalogLoader;
import com.asiainfo.kpietl.infrastructure.catalog.ManifestFiles;
import com.asiainfo.kpietl.infrastructure.checkpoint.CheckpointLock;
import com.asiainfo.kpietl.infrastructure.checkpoint.CheckpointStore;
import com.asiainfo.kpietl.infrastructure.indicator.IndicatorMappingRepository;
import com.asiainfo.kpietl.infrastructure.persistence.ConnectionFactory;
import com.asiainfo.kpietl.shared.PipelineException;
import com.asiainfo.kpietl.shared.RetryExecutor;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 抽取阶段编排
 * 1. 持有断点文件锁，保证单一写者
 * 2. 列出源库全部表并落盘，按分类选表并写清单
 * 3. 逐表断点续传复制；单表失败不影响后续表，最终结果标记失败
 */
@ApplicationScoped
public class ExtractionService {

    private static final Logger log = LoggerFactory.getLogger(ExtractionService.class);

    @Inject
    PipelineConfig config;

    @Inject
    KpiCatalogLoader catalogLoader;

    @Inject
    ConnectionFactory connectionFactory;

    @Inject
    ObjectMapper objectMapper;

    @Inject
    MeterRegistry registry;

    private IndicatorMappingRepository indicators;

    @PostConstruct
    void init() {
        indicators = new IndicatorMappingRepository(config.getIndicatorDir(), config.getIndicatorCacheMaxSize());
    }

    public CheckpointStore checkpointStore() {
        return new CheckpointStore(config.getCheckpointFile(), objectMapper);
    }

    public Map<String, CheckpointRecord> checkpoints() {
        return checkpointStore().load();
    }

    public ExtractionReport runExtraction() {
        log.info("[Extract] Starting extraction run");
        try (CheckpointLock lock = CheckpointLock.acquire(config.getCheckpointFile());
             BatchCopier copier = openCopier()) {

            List<String> allTables = listTables(copier);
            ManifestFiles.write(config.getTablesFile(), allTables);

            TableSelector selector = new TableSelector(catalogLoader.getCatalog().categories(), config.getStartDate());
            TableSelector.Selection selection = selector.select(allTables, config.getExtractCategories());

            Map<String, Integer> selectedPerCategory = new LinkedHashMap<>();
            selection.byCategory().forEach((category, tables) -> {
                ManifestFiles.write(ManifestFiles.manifestFor(config.getManifestDir(), category), tables);
                selectedPerCategory.put(category, tables.size());
            });
            log.info("[Extract] Total tables found: {}, working set: {}", selection.total(), selection.workingSet().size());

            List<TableCopyResult> results = new ArrayList<>();
            for (String table : selection.workingSet()) {
                log.info("[Extract] Starting full extraction for table '{}'", table);
                results.add(copier.copyTable(table, config.getExtractBatchSize()));
            }

            ExtractionReport report = ExtractionReport.of(selectedPerCategory, results);
            log.info("[Extract] Extraction run finished: {} ({} rows copied)", report.message(), report.rowsCopied());
            return report;
        } catch (PipelineException e) {
            log.error("[Extract] Error during orchestration", e);
            throw e;
        }
    }

    BatchCopier openCopier() {
        Connection source = connectionFactory.open(config.getExtractSourceDb());
        Connection destination;
        try {
            destination = connectionFactory.open(config.getExtractDestinationDb());
        } catch (RuntimeException e) {
            ConnectionFactory.closeQuietly(source);
            throw e;
        }
        RetryExecutor fetchRetry = RetryExecutor.exponential(
                config.getExtractMaxRetries() + 1,
                config.getExtractInitialDelayMs(),
                0);
        return new BatchCopier(source, destination, checkpointStore(), indicators, fetchRetry, registry);
    }

    private static List<String> listTables(BatchCopier copier) {
        try {
            List<String> tables = copier.source().listTables();
            log.info("[Extract] Extracted {} table names", tables.size());
            return tables;
        } catch (SQLException e) {
            throw new PipelineException("Failed to list source tables", e);
        }
    }
}
