package com.bmsedge.sticklist.controller;

import com.bmsedge.sticklist.dto.InventoryLine;
import com.bmsedge.sticklist.dto.ReconciliationOptions;
import com.bmsedge.sticklist.dto.ReconciliationSummary;
import com.bmsedge.sticklist.dto.TransformResult;
import com.bmsedge.sticklist.exception.GlobalExceptionHandler;
import com.bmsedge.sticklist.exception.ResourceNotFoundException;
import com.bmsedge.sticklist.model.CanonicalKey;
import com.bmsedge.sticklist.model.InventoryTotal;
import com.bmsedge.sticklist.service.StickListTransformService;
import com.bmsedge.sticklist.service.TemplateStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

/**
 * Web layer tests for StickListController
 */
class StickListControllerTest {

    private static final byte[] WORKBOOK = {1, 2, 3};

    @Mock
    private StickListTransformService transformService;

    @Mock
    private TemplateStore templateStore;

    @InjectMocks
    private StickListController controller;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        mockMvc = MockMvcBuilders.standaloneSetup(controller)
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
        when(transformService.defaultOptions()).thenReturn(new ReconciliationOptions());
    }

    @Test
    @DisplayName("Should return the generated workbook as an attachment")
    void testTransform() throws Exception {
        // Arrange
        when(transformService.transform(any(), isNull(), any(ReconciliationOptions.class)))
                .thenReturn(result(null));

        // Act & Assert
        mockMvc.perform(multipart("/api/sticklist/transform").file(upload("file", "Renee(A).xlsx")))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition",
                        "attachment; filename=\"Stick_List_2024-03-09.xlsx\""))
                .andExpect(header().string("X-Rows-Matched", "4"))
                .andExpect(header().string("X-Rows-Unmatched", "2"))
                .andExpect(header().doesNotExist("X-Diff-Count"))
                .andExpect(content().contentType(StickListController.XLSX))
                .andExpect(content().bytes(WORKBOOK));
    }

    @Test
    @DisplayName("Should pass the uploaded template and option overrides to the service")
    void testTransformWithTemplateAndOverrides() throws Exception {
        // Arrange
        when(transformService.transform(any(), any(), any(ReconciliationOptions.class)))
                .thenReturn(result(null));
        ArgumentCaptor<byte[]> templateCaptor = ArgumentCaptor.forClass(byte[].class);
        ArgumentCaptor<ReconciliationOptions> optionsCaptor = ArgumentCaptor.forClass(ReconciliationOptions.class);

        // Act
        mockMvc.perform(multipart("/api/sticklist/transform")
                        .file(upload("file", "Renee(A).xlsx"))
                        .file(new MockMultipartFile("template", "Renee(B).xlsx", null, new byte[]{9, 9}))
                        .param("defectExclusion", "false")
                        .param("filldown", "false"))
                .andExpect(status().isOk());

        // Assert
        verify(transformService).transform(any(), templateCaptor.capture(), optionsCaptor.capture());
        assertArrayEquals(new byte[]{9, 9}, templateCaptor.getValue());
        assertFalse(optionsCaptor.getValue().isDefectExclusionEnabled());
        assertFalse(optionsCaptor.getValue().isFilldownEnabled());
        assertFalse(optionsCaptor.getValue().isDiffReportEnabled());
    }

    @Test
    @DisplayName("Should report the diff size on transform when diffing is on by default")
    void testTransformWithDiffReportDefault() throws Exception {
        // Arrange
        when(transformService.defaultOptions()).thenReturn(new ReconciliationOptions(true, true, true));
        when(transformService.transform(any(), isNull(), any(ReconciliationOptions.class)))
                .thenReturn(result("row,column,original,generated\r\n".getBytes(StandardCharsets.UTF_8)));
        ArgumentCaptor<ReconciliationOptions> optionsCaptor = ArgumentCaptor.forClass(ReconciliationOptions.class);

        // Act
        mockMvc.perform(multipart("/api/sticklist/transform").file(upload("file", "Renee(A).xlsx")))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Diff-Count", "1"))
                .andExpect(content().bytes(WORKBOOK));

        // Assert
        verify(transformService).transform(any(), isNull(), optionsCaptor.capture());
        assertTrue(optionsCaptor.getValue().isDiffReportEnabled());
    }

    @Test
    @DisplayName("Should reject uploads that are not .xlsx files")
    void testTransformRejectsNonXlsx() throws Exception {
        mockMvc.perform(multipart("/api/sticklist/transform").file(upload("file", "stock.csv")))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Business Logic Error"));

        verify(transformService, never()).transform(any(), any(), any());
    }

    @Test
    @DisplayName("Should reject an empty upload")
    void testTransformRejectsEmptyFile() throws Exception {
        MockMultipartFile empty = new MockMultipartFile("file", "Renee(A).xlsx", null, new byte[0]);

        mockMvc.perform(multipart("/api/sticklist/transform").file(empty))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Uploaded file is empty"));
    }

    @Test
    @DisplayName("Should answer 422 when a workbook cannot be read")
    void testTransformUnreadableWorkbook() throws Exception {
        when(transformService.transform(any(), any(), any(ReconciliationOptions.class)))
                .thenThrow(new IOException("Can't open workbook - unsupported file type: UNKNOWN"));

        mockMvc.perform(multipart("/api/sticklist/transform").file(upload("file", "Renee(A).xlsx")))
                .andExpect(status().isUnprocessableEntity())
                .andExpect(jsonPath("$.error").value("Unreadable Workbook"));
    }

    @Test
    @DisplayName("Should answer 404 when no default template exists")
    void testTransformMissingDefaultTemplate() throws Exception {
        when(transformService.transform(any(), isNull(), any(ReconciliationOptions.class)))
                .thenThrow(new ResourceNotFoundException("Missing template file: templates/Renee(B).xlsx"));

        mockMvc.perform(multipart("/api/sticklist/transform").file(upload("file", "Renee(A).xlsx")))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value(404));
    }

    @Test
    @DisplayName("Should return the diff report as CSV")
    void testDiffReport() throws Exception {
        // Arrange
        byte[] csv = "row,column,original,generated\r\n2,Left,40,15\r\n".getBytes(StandardCharsets.UTF_8);
        when(transformService.transform(any(), isNull(), any(ReconciliationOptions.class)))
                .thenReturn(result(csv));
        ArgumentCaptor<ReconciliationOptions> optionsCaptor = ArgumentCaptor.forClass(ReconciliationOptions.class);

        // Act
        mockMvc.perform(multipart("/api/sticklist/diff-report").file(upload("file", "Renee(A).xlsx")))
                .andExpect(status().isOk())
                .andExpect(header().string("Content-Disposition", "attachment; filename=\"diff_report.csv\""))
                .andExpect(header().string("X-Diff-Count", "1"))
                .andExpect(content().bytes(csv));

        // Assert
        verify(transformService).transform(any(), isNull(), optionsCaptor.capture());
        assertTrue(optionsCaptor.getValue().isDiffReportEnabled());
    }

    @Test
    @DisplayName("Should list aggregated inventory lines")
    void testPreviewInventory() throws Exception {
        // Arrange
        InventoryLine line = new InventoryLine(
                new CanonicalKey("FT8 Pro", "RED", "L92", 85), new InventoryTotal(15, null));
        when(transformService.previewInventory(any(), eq(true))).thenReturn(List.of(line));

        // Act & Assert
        mockMvc.perform(multipart("/api/sticklist/inventory").file(upload("file", "Renee(A).xlsx")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].model").value("FT8 Pro"))
                .andExpect(jsonPath("$[0].style").value("RED"))
                .andExpect(jsonPath("$[0].flex").value(85))
                .andExpect(jsonPath("$[0].left").value(15))
                .andExpect(jsonPath("$[0].right").doesNotExist());
    }

    @Test
    @DisplayName("Should describe endpoints and defaults")
    void testGetInfo() throws Exception {
        when(templateStore.hasDefaultTemplate()).thenReturn(false);
        when(transformService.outputFileName()).thenReturn("Stick_List_2024-03-09.xlsx");

        mockMvc.perform(get("/api/sticklist/info"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.defaultTemplateAvailable").value(false))
                .andExpect(jsonPath("$.defaults.filldown").value(true))
                .andExpect(jsonPath("$.defaults.diffReport").value(false))
                .andExpect(jsonPath("$.outputFileName").value("Stick_List_2024-03-09.xlsx"));
    }

    private MockMultipartFile upload(String part, String fileName) {
        return new MockMultipartFile(part, fileName, null, WORKBOOK);
    }

    private TransformResult result(byte[] diffReport) {
        ReconciliationSummary summary = new ReconciliationSummary();
        summary.setRowsMatched(4);
        summary.setRowsUnmatched(2);

        TransformResult result = new TransformResult();
        result.setWorkbook(WORKBOOK);
        result.setFileName("Stick_List_2024-03-09.xlsx");
        result.setSummary(summary);
        if (diffReport != null) {
            result.setDiffReport(diffReport);
            result.setDiffCount(1);
        }
        return result;
    }
}
