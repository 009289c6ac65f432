package com.asiainfo.kpietl.application.transform;

import com.asiainfo.kpietl.config.CategoryExecutorConfig;
import com.asiainfo.kpietl.config.PipelineConfig;
import com.asiainfo.kpietl.domain.model.CategoryDefinition;
import com.asiainfo.kpietl.infrastructure.catalog.KpiCatalogLoader;
import com.asiainfo.kpietl.infrastructure.catalog.ManifestFiles;
import com.asiainfo.kpietl.infrastructure.persistence.ConnectionFactory;
import com.asiainfo.kpietl.shared.PipelineException;
import com.asiainfo.kpietl.shared.RetryExecutor;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.sql.Connection;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * KPI 计算阶段：每个分类一个任务，提交到共享的分类线程池并行执行
 * 每个线程使用自己的连接；等待全部分类结束后，若有失败则抛出第一个错误（其余作为 suppressed）
 */
@ApplicationScoped
public class TransformService {

    private static final Logger log = LoggerFactory.getLogger(TransformService.class);

    static final String MDC_CATEGORY = "category";

    @Inject
    PipelineConfig config;

    @Inject
    KpiCatalogLoader catalogLoader;

    @Inject
    ConnectionFactory connectionFactory;

    @Inject
    MeterRegistry registry;

    @Inject
    CategoryExecutorConfig executorConfig;

    public TransformReport runTransform() {
        List<CategoryDefinition> targets = resolveCategories();
        if (targets.isEmpty()) {
            log.warn("[Transform] No category to process");
            return TransformReport.success(List.of());
        }

        ExecutorService pool = executorConfig.getCategoryExecutor();
        Map<String, Future<CategoryResult>> futures = new LinkedHashMap<>();
        for (CategoryDefinition category : targets) {
            futures.put(category.name(), pool.submit(() -> runCategory(category)));
        }

        List<CategoryResult> results = new ArrayList<>();
        List<Throwable> errors = new ArrayList<>();
        for (Map.Entry<String, Future<CategoryResult>> entry : futures.entrySet()) {
            try {
                results.add(entry.getValue().get());
            } catch (ExecutionException e) {
                log.error("[Transform] Category {} failed", entry.getKey(), e.getCause());
                errors.add(e.getCause());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new PipelineException("Interrupted while waiting for category " + entry.getKey(), e);
            }
        }

        if (!errors.isEmpty()) {
            PipelineException failure = new PipelineException(
                    errors.size() + " category(ies) failed: " + errors.get(0).getMessage(), errors.get(0));
            errors.stream().skip(1).forEach(failure::addSuppressed);
            throw failure;
        }
        log.info("[Transform] All {} category(ies) finished", results.size());
        return TransformReport.success(results);
    }

    List<CategoryDefinition> resolveCategories() {
        List<CategoryDefinition> targets = new ArrayList<>();
        for (String name : config.getTransformCategories()) {
            Optional<CategoryDefinition> category = catalogLoader.getCatalog().category(name);
            if (category.isEmpty()) {
                log.warn("[Transform] Unknown category {}, skipping", name);
            } else if (!category.get().hasTableGroups()) {
                log.warn("[Transform] No tables config for category {}, skipping", name);
            } else {
                targets.add(category.get());
            }
        }
        return targets;
    }

    CategoryResult runCategory(CategoryDefinition category) {
        MDC.put(MDC_CATEGORY, category.name());
        try {
            log.info("[Transform] Starting transformation for {}", category.name());
            List<String> tables = ManifestFiles.read(
                    ManifestFiles.manifestFor(config.getManifestDir(), category.name()));
            try (KpiAggregator aggregator = openAggregator(category)) {
                return aggregator.process(tables);
            }
        } finally {
            MDC.remove(MDC_CATEGORY);
        }
    }

    KpiAggregator openAggregator(CategoryDefinition category) {
        Connection source = connectionFactory.open(category.sourceDb());
        Connection destination = null;
        try {
            destination = connectionFactory.open(category.destinationDb());
            RetryExecutor retry = RetryExecutor.fixed(config.getTransformMaxAttempts(), config.getTransformRetryDelayMs());
            return new KpiAggregator(category, source, destination, retry,
                    config.getDateBatchSize(), config.getInsertBatchSize(),
                    config.isReplaceExistingDetails(), registry);
        } catch (RuntimeException e) {
            ConnectionFactory.closeQuietly(source);
            ConnectionFactory.closeQuietly(destination);
            throw e;
        }
    }
}
