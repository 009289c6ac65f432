package com.asiainfo.kpietl.infrastructure.checkpoint;

import com.asiainfo.kpietl.domain.model.CheckpointRecord;
import com.asiainfo.kpietl.shared.PipelineException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * 抽取断点文件
 * JSON 对象：表名 → {offset, total_extracted, total_rows, percentage, completed}
 *
 * 1. load()：文件不存在/为空/损坏均视为“尚无进度”
 * 2. save()：每个批次后整体重写，先写临时文件再原子替换，避免中途崩溃留下半个文件
 */
public class CheckpointStore {

    private static final Logger log = LoggerFactory.getLogger(CheckpointStore.class);

    private static final TypeReference<LinkedHashMap<String, CheckpointRecord>> CHECKPOINTS_TYPE =
            new TypeReference<>() {
            };

    private final Path file;
    private final ObjectMapper objectMapper;

    public CheckpointStore(Path file, ObjectMapper objectMapper) {
        this.file = file;
        this.objectMapper = objectMapper;
    }

    public Path getFile() {
        return file;
    }

    /**
     * 宽松读取，供抽取阶段使用
     */
    public Map<String, CheckpointRecord> load() {
        try {
            return loadStrict();
        } catch (PipelineException e) {
            log.error("[Checkpoint] {} is corrupt, starting without progress: {}", file, e.getMessage());
            return new LinkedHashMap<>();
        }
    }

    /**
     * 严格读取：文件不存在/为空返回空表，内容无法解析时抛出异常
     */
    public Map<String, CheckpointRecord> loadStrict() {
        String content;
        try {
            content = Files.readString(file, StandardCharsets.UTF_8).trim();
        } catch (NoSuchFileException e) {
            log.info("[Checkpoint] {} not found, no progress yet", file);
            return new LinkedHashMap<>();
        } catch (IOException e) {
            throw new PipelineException("Failed to read checkpoint file " + file, e);
        }

        if (content.isEmpty()) {
            log.warn("[Checkpoint] {} is empty, no progress yet", file);
            return new LinkedHashMap<>();
        }

        try {
            Map<String, CheckpointRecord> checkpoints = objectMapper.readValue(content, CHECKPOINTS_TYPE);
            if (checkpoints == null) {
                return new LinkedHashMap<>();
            }
            log.debug("[Checkpoint] Loaded {} table(s) from {}", checkpoints.size(), file);
            return checkpoints;
        } catch (JsonProcessingException e) {
            throw new PipelineException("Invalid checkpoint JSON in " + file + ": " + e.getOriginalMessage(), e);
        }
    }

    public void save(Map<String, CheckpointRecord> checkpoints) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Path temp = Files.createTempFile(parent, "checkpoint_", ".tmp");
            try {
                byte[] json = objectMapper.writer(SerializationFeature.INDENT_OUTPUT).writeValueAsBytes(checkpoints);
                Files.write(temp, json);
                Files.move(temp, file, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
            } finally {
                Files.deleteIfExists(temp);
            }
            log.debug("[Checkpoint] Saved {} table(s) to {}", checkpoints.size(), file);
        } catch (IOException e) {
            log.error("[Checkpoint] Failed to save {}", file, e);
            throw new PipelineException("Failed to save checkpoint file " + file, e);
        }
    }
}
