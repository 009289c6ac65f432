package com.asiainfo.kpietl.infrastructure.indicator;

import com.asiainfo.kpietl.shared.PipelineConstants;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * 指标 ID → 指标名称映射
 * 每个源表按去掉 _S{week}_A{year} 后的基础名对应一个 CSV：indicateur_&lt;base&gt;.csv
 * 表头：ID_indicateur,indicateur[,type]
 *
 * 映射按基础名缓存（Caffeine），空映射不缓存，文件补齐后下次即可读到
 */
public class IndicatorMappingRepository {

    private static final Logger log = LoggerFactory.getLogger(IndicatorMappingRepository.class);

    static final String ID_COLUMN = "ID_indicateur";
    static final String NAME_COLUMN = "indicateur";

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setTrim(true)
            .setIgnoreEmptyLines(true)
            .build();

    private final Path directory;
    private final Cache<String, Map<Long, String>> cache;

    public IndicatorMappingRepository(Path directory, long maxSize) {
        this.directory = directory;
        this.cache = Caffeine.newBuilder()
                .maximumSize(maxSize)
                .build();
    }

    /**
     * 表名去掉周/年后缀，如 CALIS_APG43_5_S12_A2024 → CALIS_APG43_5
     */
    public static String baseName(String table) {
        return PipelineConstants.WEEK_YEAR_SUFFIX.matcher(table).replaceFirst("");
    }

    public Path csvPathFor(String table) {
        return directory.resolve("indicateur_" + baseName(table) + ".csv");
    }

    /**
     * @return 不可修改的映射，文件不存在或无法解析时返回空映射
     */
    public Map<Long, String> mappingFor(String table) {
        String base = baseName(table);
        Map<Long, String> cached = cache.getIfPresent(base);
        if (cached != null) {
            return cached;
        }
        Map<Long, String> loaded = load(directory.resolve("indicateur_" + base + ".csv"));
        if (!loaded.isEmpty()) {
            cache.put(base, loaded);
        }
        return loaded;
    }

    private Map<Long, String> load(Path csv) {
        if (!Files.exists(csv)) {
            log.warn("[Indicator] CSV not found: {}", csv);
            return Map.of();
        }
        Map<Long, String> mapping = new HashMap<>();
        try (Reader reader = Files.newBufferedReader(csv, StandardCharsets.UTF_8);
             CSVParser parser = FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                mapping.put(Long.parseLong(record.get(ID_COLUMN)), record.get(NAME_COLUMN));
            }
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            log.error("[Indicator] Failed to load {}: {}", csv, e.getMessage());
            return Map.of();
        }
        log.info("[Indicator] Loaded {} entries from {}", mapping.size(), csv);
        return Collections.unmodifiableMap(mapping);
    }
}
