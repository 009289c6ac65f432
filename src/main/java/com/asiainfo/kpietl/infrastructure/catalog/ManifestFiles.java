package com.asiainfo.kpietl.infrastructure.catalog;

import com.asiainfo.kpietl.shared.PipelineException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.List;

/**
 * 表清单文件：每行一个表名
 * 选表阶段写入，KPI 计算阶段读取
 */
public final class ManifestFiles {

    private static final Logger log = LoggerFactory.getLogger(ManifestFiles.class);

    private ManifestFiles() {
    }

    public static Path manifestFor(Path manifestDir, String category) {
        return manifestDir.resolve("result_" + category + ".txt");
    }

    public static void write(Path file, List<String> tables) {
        try {
            Path parent = file.toAbsolutePath().getParent();
            Files.createDirectories(parent);
            Files.writeString(file, String.join("\n", tables), StandardCharsets.UTF_8);
            log.info("[Manifest] Stored {} table(s) to {}", tables.size(), file);
        } catch (IOException e) {
            throw new PipelineException("Failed to write manifest " + file, e);
        }
    }

    public static List<String> read(Path file) {
        try {
            List<String> tables = Files.readAllLines(file, StandardCharsets.UTF_8).stream()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .toList();
            log.info("[Manifest] Loaded {} table(s) from {}", tables.size(), file);
            return tables;
        } catch (NoSuchFileException e) {
            throw new PipelineException("Manifest not found: " + file, e);
        } catch (IOException e) {
            throw new PipelineException("Failed to read manifest " + file, e);
        }
    }
}
