package com.asiainfo.kpietl.infrastructure.indicator;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * IndicatorMappingRepository 单元测试
 */
class IndicatorMappingRepositoryTest {

    @TempDir
    Path tempDir;

    @Test
    void testBaseNameStripsWeekYearSuffix() {
        assertEquals("CALIS_APG43_5", IndicatorMappingRepository.baseName("CALIS_APG43_5_S12_A2024"));
        assertEquals("CALIS-APG43_5", IndicatorMappingRepository.baseName("CALIS-APG43_5_s3_a2025"));
        assertEquals("NO_SUFFIX", IndicatorMappingRepository.baseName("NO_SUFFIX"));
    }

    @Test
    void testLoadsMappingSharedAcrossWeeks() throws Exception {
        Files.writeString(tempDir.resolve("indicateur_CALIS_APG43_5.csv"),
                "ID_indicateur,indicateur,type\n"
                        + "1, VoiproITRALAC.x-nw ,counter\n"
                        + "\n"
                        + "2,VoiproNCALLSI.x-mt,counter\n");
        IndicatorMappingRepository repository = new IndicatorMappingRepository(tempDir, 10);

        Map<Long, String> week12 = repository.mappingFor("CALIS_APG43_5_S12_A2024");
        Map<Long, String> week13 = repository.mappingFor("CALIS_APG43_5_S13_A2024");

        assertEquals(Map.of(1L, "VoiproITRALAC.x-nw", 2L, "VoiproNCALLSI.x-mt"), week12);
        assertSame(week12, week13);
    }

    @Test
    void testMissingFileGivesEmptyMappingAndIsRetried() throws Exception {
        IndicatorMappingRepository repository = new IndicatorMappingRepository(tempDir, 10);

        assertTrue(repository.mappingFor("MEIND_APG43_5_S1_A2024").isEmpty());

        Files.writeString(repository.csvPathFor("MEIND_APG43_5_S1_A2024"), "ID_indicateur,indicateur\n7,X.nw\n");
        assertEquals(Map.of(7L, "X.nw"), repository.mappingFor("MEIND_APG43_5_S1_A2024"));
    }

    @Test
    void testUnparseableFileGivesEmptyMapping() throws Exception {
        Files.writeString(tempDir.resolve("indicateur_BAD.csv"), "ID_indicateur,indicateur\nnot-a-number,X\n");
        IndicatorMappingRepository repository = new IndicatorMappingRepository(tempDir, 10);

        assertTrue(repository.mappingFor("BAD_S1_A2024").isEmpty());
    }

    @Test
    void testCsvPathUsesBaseName() {
        IndicatorMappingRepository repository = new IndicatorMappingRepository(tempDir, 10);

        assertEquals(tempDir.resolve("indicateur_RAIND_APG43_15.csv"),
                repository.csvPathFor("RAIND_APG43_15_S40_A2023"));
    }
}
