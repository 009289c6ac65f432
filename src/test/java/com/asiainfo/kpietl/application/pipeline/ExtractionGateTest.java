package com.asiainfo.kpietl.application.pipeline;

import com.asiainfo.kpietl.domain.model.CheckpointRecord;
import com.asiainfo.kpietl.infrastructure.checkpoint.CheckpointStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 抽取完成闸门测试
 */
class ExtractionGateTest {

    @TempDir
    Path tempDir;

    private Path file;
    private CheckpointStore store;
    private ExtractionGate gate;

    @BeforeEach
    void setUp() {
        file = tempDir.resolve("last_extracted.json");
        store = new CheckpointStore(file, new ObjectMapper());
        gate = new ExtractionGate(store);
    }

    @Test
    void testMissingFileOpens() {
        assertTrue(gate.check().open());
    }

    @Test
    void testEmptyOrWhitespaceFileOpens() throws Exception {
        Files.writeString(file, "");
        assertTrue(gate.check().open());

        Files.writeString(file, " \n\t ");
        assertTrue(gate.check().open());
    }

    @Test
    void testEmptyObjectOpens() throws Exception {
        Files.writeString(file, "{}");

        ExtractionGate.GateResult result = gate.check();
        assertTrue(result.open());
        assertTrue(result.pendingTables().isEmpty());
    }

    @Test
    void testIncompleteTableCloses() {
        Map<String, CheckpointRecord> checkpoints = new LinkedHashMap<>();
        checkpoints.put("A_S1_A2024", CheckpointRecord.start(0, 5).advance(5).complete());
        checkpoints.put("B_S2_A2024", CheckpointRecord.start(0, 10).advance(4));
        store.save(checkpoints);

        ExtractionGate.GateResult result = gate.check();

        assertFalse(result.open());
        assertEquals(List.of("B_S2_A2024"), result.pendingTables());
        assertEquals("Extraction not completed for table B_S2_A2024", result.message());
    }

    @Test
    void testEntryWithoutCompletedFlagCloses() throws Exception {
        Files.writeString(file, "{\"A_S1_A2024\": {\"offset\": 5, \"total_extracted\": 5, \"total_rows\": 5}}");

        assertFalse(gate.check().open());
    }

    @Test
    void testAllCompletedOpens() {
        store.save(Map.of(
                "A_S1_A2024", CheckpointRecord.start(0, 5).advance(5).complete(),
                "B_S2_A2024", CheckpointRecord.start(0, 0).complete()));

        ExtractionGate.GateResult result = gate.check();

        assertTrue(result.open());
        assertEquals("All 2 table(s) completed", result.message());
    }

    @Test
    void testCorruptFileCloses() throws Exception {
        Files.writeString(file, "not json");

        ExtractionGate.GateResult result = gate.check();

        assertFalse(result.open());
        assertTrue(result.message().startsWith("Checkpoint file unreadable"));
    }
}
