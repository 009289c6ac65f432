package com.asiainfo.kpietl.config;

import com.asiainfo.kpietl.shared.PipelineException;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.Config;
import org.eclipse.microprofile.config.ConfigProvider;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.List;

/**
 * 流水线配置
 * 固定键通过 @ConfigProperty 注入，命名数据库连接（pipeline.db.&lt;name&gt;.*）按需从 ConfigProvider 读取
 */
@ApplicationScoped
public class PipelineConfig {

    private static final Logger log = LoggerFactory.getLogger(PipelineConfig.class);

    // ========== 抽取 ==========

    @ConfigProperty(name = "pipeline.extract.batch-size", defaultValue = "500000")
    int extractBatchSize;

    @ConfigProperty(name = "pipeline.extract.start-date", defaultValue = "2024-01-01")
    LocalDate startDate;

    @ConfigProperty(name = "pipeline.extract.categories", defaultValue = "5min")
    List<String> extractCategories;

    @ConfigProperty(name = "pipeline.extract.source-db", defaultValue = "source")
    String extractSourceDb;

    @ConfigProperty(name = "pipeline.extract.destination-db", defaultValue = "staging")
    String extractDestinationDb;

    @ConfigProperty(name = "pipeline.extract.retry.max-retries", defaultValue = "3")
    int extractMaxRetries;

    @ConfigProperty(name = "pipeline.extract.retry.initial-delay-ms", defaultValue = "4000")
    long extractInitialDelayMs;

    // ========== 文件 ==========

    @ConfigProperty(name = "pipeline.files.checkpoint", defaultValue = "./data/last_extracted.json")
    String checkpointFile;

    @ConfigProperty(name = "pipeline.files.tables", defaultValue = "./data/our_tables/tables.txt")
    String tablesFile;

    @ConfigProperty(name = "pipeline.files.indicator-dir", defaultValue = "./data/indicators")
    String indicatorDir;

    @ConfigProperty(name = "pipeline.files.manifest-dir", defaultValue = "./data/our_data")
    String manifestDir;

    // ========== KPI 计算 ==========

    @ConfigProperty(name = "pipeline.transform.categories", defaultValue = "5min")
    List<String> transformCategories;

    @ConfigProperty(name = "pipeline.transform.date-batch-size", defaultValue = "500")
    int dateBatchSize;

    @ConfigProperty(name = "pipeline.transform.insert-batch-size", defaultValue = "98000")
    int insertBatchSize;

    @ConfigProperty(name = "pipeline.transform.retry.max-attempts", defaultValue = "3")
    int transformMaxAttempts;

    @ConfigProperty(name = "pipeline.transform.retry.delay-ms", defaultValue = "2000")
    long transformRetryDelayMs;

    @ConfigProperty(name = "pipeline.transform.replace-existing-details", defaultValue = "false")
    boolean replaceExistingDetails;

    // ========== 连接 ==========

    @ConfigProperty(name = "pipeline.connection.retry.max-attempts", defaultValue = "3")
    int connectionMaxAttempts;

    @ConfigProperty(name = "pipeline.connection.retry.initial-delay-ms", defaultValue = "4000")
    long connectionInitialDelayMs;

    @ConfigProperty(name = "pipeline.connection.retry.max-delay-ms", defaultValue = "10000")
    long connectionMaxDelayMs;

    // ========== 其它 ==========

    @ConfigProperty(name = "pipeline.catalog", defaultValue = "kpi-catalog.json")
    String catalogResource;

    @ConfigProperty(name = "pipeline.indicator-cache.max-size", defaultValue = "500")
    long indicatorCacheMaxSize;

    @PostConstruct
    void init() {
        log.info("[Config] extract: batchSize={}, startDate={}, categories={}, {} -> {}",
                extractBatchSize, startDate, extractCategories, extractSourceDb, extractDestinationDb);
        log.info("[Config] transform: categories={}, dateBatch={}, insertBatch={}, replaceExistingDetails={}",
                transformCategories, dateBatchSize, insertBatchSize, replaceExistingDetails);
        log.info("[Config] files: checkpoint={}, manifests={}, indicators={}",
                checkpointFile, manifestDir, indicatorDir);
    }

    /**
     * 读取命名数据库连接，url 必填
     */
    public ConnectionSettings connection(String name) {
        Config cfg = ConfigProvider.getConfig();
        String prefix = "pipeline.db." + name + ".";
        String url = cfg.getOptionalValue(prefix + "url", String.class)
                .orElseThrow(() -> new PipelineException("No JDBC url configured for database '" + name + "'"));
        String user = cfg.getOptionalValue(prefix + "user", String.class).orElse(null);
        String password = cfg.getOptionalValue(prefix + "password", String.class).orElse(null);
        return new ConnectionSettings(name, url, user, password);
    }

    public int getExtractBatchSize() {
        return extractBatchSize;
    }

    public LocalDate getStartDate() {
        return startDate;
    }

    public List<String> getExtractCategories() {
        return extractCategories;
    }

    public String getExtractSourceDb() {
        return extractSourceDb;
    }

    public String getExtractDestinationDb() {
        return extractDestinationDb;
    }

    public int getExtractMaxRetries() {
        return extractMaxRetries;
    }

    public long getExtractInitialDelayMs() {
        return extractInitialDelayMs;
    }

    public Path getCheckpointFile() {
        return Path.of(checkpointFile);
    }

    public Path getTablesFile() {
        return Path.of(tablesFile);
    }

    public Path getIndicatorDir() {
        return Path.of(indicatorDir);
    }

    public Path getManifestDir() {
        return Path.of(manifestDir);
    }

    public List<String> getTransformCategories() {
        return transformCategories;
    }

    public int getDateBatchSize() {
        return dateBatchSize;
    }

    public int getInsertBatchSize() {
        return insertBatchSize;
    }

    public int getTransformMaxAttempts() {
        return transformMaxAttempts;
    }

    public long getTransformRetryDelayMs() {
        return transformRetryDelayMs;
    }

    public boolean isReplaceExistingDetails() {
        return replaceExistingDetails;
    }

    public int getConnectionMaxAttempts() {
        return connectionMaxAttempts;
    }

    public long getConnectionInitialDelayMs() {
        return connectionInitialDelayMs;
    }

    public long getConnectionMaxDelayMs() {
        return connectionMaxDelayMs;
    }

    public String getCatalogResource() {
        return catalogResource;
    }

    public long getIndicatorCacheMaxSize() {
        return indicatorCacheMaxSize;
    }
}
