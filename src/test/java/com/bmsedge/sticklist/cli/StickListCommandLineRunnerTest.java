package com.bmsedge.sticklist.cli;

import com.bmsedge.sticklist.dto.ReconciliationOptions;
import com.bmsedge.sticklist.dto.ReconciliationSummary;
import com.bmsedge.sticklist.dto.TransformResult;
import com.bmsedge.sticklist.service.StickListTransformService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.boot.DefaultApplicationArguments;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

/**
 * Unit tests for the command line entry point
 */
class StickListCommandLineRunnerTest {

    @Mock
    private StickListTransformService transformService;

    @InjectMocks
    private StickListCommandLineRunner runner;

    @TempDir
    Path tempDir;

    private Path source;
    private Path template;

    @BeforeEach
    void setUp() throws Exception {
        MockitoAnnotations.openMocks(this);
        when(transformService.defaultOptions()).thenReturn(new ReconciliationOptions());

        source = Files.write(tempDir.resolve("Renee(A).xlsx"), new byte[]{1});
        template = Files.write(tempDir.resolve("Renee(B).xlsx"), new byte[]{2});
    }

    @Test
    @DisplayName("Should do nothing without --a")
    void testNoSourceOption() throws Exception {
        runner.run(new DefaultApplicationArguments("--server.port=8085"));

        verifyNoInteractions(transformService);
    }

    @Test
    @DisplayName("Should write the workbook and diff report to the given paths")
    void testRunWritesOutputs() throws Exception {
        // Arrange
        Path out = tempDir.resolve("Stick_List.xlsx");
        Path diff = tempDir.resolve("diff_report.csv");
        when(transformService.transform(any(), any(), any(ReconciliationOptions.class)))
                .thenReturn(result(new byte[]{7, 7}, new byte[]{8}));
        ArgumentCaptor<ReconciliationOptions> optionsCaptor = ArgumentCaptor.forClass(ReconciliationOptions.class);

        // Act
        runner.run(new DefaultApplicationArguments(
                "--a=" + source, "--b=" + template, "--out=" + out, "--diff-csv=" + diff,
                "--no-defect-exclusion"));

        // Assert
        verify(transformService).transform(eq(new byte[]{1}), eq(new byte[]{2}), optionsCaptor.capture());
        assertFalse(optionsCaptor.getValue().isDefectExclusionEnabled());
        assertTrue(optionsCaptor.getValue().isFilldownEnabled());
        assertTrue(optionsCaptor.getValue().isDiffReportEnabled());
        assertArrayEquals(new byte[]{7, 7}, Files.readAllBytes(out));
        assertArrayEquals(new byte[]{8}, Files.readAllBytes(diff));
    }

    @Test
    @DisplayName("Should honour --no-filldown-b-template and skip the diff report")
    void testRunWithoutFilldown() throws Exception {
        // Arrange
        Path out = tempDir.resolve("Stick_List.xlsx");
        when(transformService.transform(any(), any(), any(ReconciliationOptions.class)))
                .thenReturn(result(new byte[]{7}, null));
        ArgumentCaptor<ReconciliationOptions> optionsCaptor = ArgumentCaptor.forClass(ReconciliationOptions.class);

        // Act
        runner.run(new DefaultApplicationArguments(
                "--a=" + source, "--b=" + template, "--out=" + out, "--no-filldown-b-template"));

        // Assert
        verify(transformService).transform(any(), any(), optionsCaptor.capture());
        assertTrue(optionsCaptor.getValue().isDefectExclusionEnabled());
        assertFalse(optionsCaptor.getValue().isFilldownEnabled());
        assertFalse(optionsCaptor.getValue().isDiffReportEnabled());
        assertTrue(Files.exists(out));
    }

    @Test
    @DisplayName("Should write the diff report next to the output when diffing is on by default")
    void testRunWithDiffReportDefault() throws Exception {
        // Arrange
        Path out = tempDir.resolve("Stick_List.xlsx");
        when(transformService.defaultOptions()).thenReturn(new ReconciliationOptions(true, true, true));
        when(transformService.transform(any(), any(), any(ReconciliationOptions.class)))
                .thenReturn(result(new byte[]{7}, new byte[]{5, 5}));

        // Act
        runner.run(new DefaultApplicationArguments("--a=" + source, "--b=" + template, "--out=" + out));

        // Assert
        assertArrayEquals(new byte[]{5, 5},
                Files.readAllBytes(tempDir.resolve(StickListCommandLineRunner.DEFAULT_DIFF_FILE)));
    }

    @Test
    @DisplayName("Should fail when a required option is missing")
    void testMissingRequiredOption() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> runner.run(new DefaultApplicationArguments("--a=" + source, "--b=" + template)));

        assertEquals("Missing required option --out", e.getMessage());
    }

    private TransformResult result(byte[] workbook, byte[] diffReport) {
        TransformResult result = new TransformResult();
        result.setWorkbook(workbook);
        result.setSummary(new ReconciliationSummary());
        result.setDiffReport(diffReport);
        return result;
    }
}
