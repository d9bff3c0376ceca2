package com.bmsedge.sticklist.controller;

import com.bmsedge.sticklist.dto.InventoryLine;
import com.bmsedge.sticklist.dto.ReconciliationOptions;
import com.bmsedge.sticklist.dto.TransformResult;
import com.bmsedge.sticklist.exception.BusinessException;
import com.bmsedge.sticklist.service.StickListTransformService;
import com.bmsedge.sticklist.service.TemplateStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.io.ByteArrayResource;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST Controller for the stick list transform
 * - Upload supplier sheet A (and optionally a template B)
 * - Download the generated stick list or a diff report against the template
 */
@RestController
@RequestMapping("/api/sticklist")
@CrossOrigin(origins = "*", maxAge = 3600)
public class StickListController {

    private static final Logger logger = LoggerFactory.getLogger(StickListController.class);

    static final MediaType XLSX = MediaType.parseMediaType(
            "application/vnd.openxmlformats-officedocument.spreadsheetml.sheet");
    static final MediaType CSV = MediaType.parseMediaType("text/csv");

    @Autowired
    private StickListTransformService transformService;

    @Autowired
    private TemplateStore templateStore;

    /**
     * Generate the stick list
     * POST /api/sticklist/transform
     */
    @PostMapping("/transform")
    public ResponseEntity<ByteArrayResource> transform(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "template", required = false) MultipartFile template,
            @RequestParam(required = false) Boolean defectExclusion,
            @RequestParam(required = false) Boolean filldown) throws IOException {

        logger.info("Transform request: file={}, template={}, defectExclusion={}, filldown={}",
                file.getOriginalFilename(), template != null ? template.getOriginalFilename() : "(default)",
                defectExclusion, filldown);

        ReconciliationOptions options = resolveOptions(defectExclusion, filldown, null);
        TransformResult result = runTransform(file, template, options);

        ResponseEntity.BodyBuilder response = ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"" + result.getFileName() + "\"")
                .header("X-Rows-Matched", String.valueOf(result.getSummary().getRowsMatched()))
                .header("X-Rows-Unmatched", String.valueOf(result.getSummary().getRowsUnmatched()));
        // the diff itself is served by /diff-report; here only its size is reported
        if (result.hasDiffReport()) {
            response.header("X-Diff-Count", String.valueOf(result.getDiffCount()));
        }

        return response
                .contentType(XLSX)
                .contentLength(result.getWorkbook().length)
                .body(new ByteArrayResource(result.getWorkbook()));
    }

    /**
     * Generate the stick list and return only its diff against the template
     * POST /api/sticklist/diff-report
     */
    @PostMapping("/diff-report")
    public ResponseEntity<ByteArrayResource> diffReport(
            @RequestParam("file") MultipartFile file,
            @RequestParam(value = "template", required = false) MultipartFile template,
            @RequestParam(required = false) Boolean defectExclusion,
            @RequestParam(required = false) Boolean filldown) throws IOException {

        logger.info("Diff report request: file={}", file.getOriginalFilename());

        ReconciliationOptions options = resolveOptions(defectExclusion, filldown, Boolean.TRUE);
        TransformResult result = runTransform(file, template, options);

        return ResponseEntity.ok()
                .header(HttpHeaders.CONTENT_DISPOSITION, "attachment; filename=\"diff_report.csv\"")
                .header("X-Diff-Count", String.valueOf(result.getDiffCount()))
                .contentType(CSV)
                .contentLength(result.getDiffReport().length)
                .body(new ByteArrayResource(result.getDiffReport()));
    }

    /**
     * Aggregated supplier stock without applying it to a template
     * POST /api/sticklist/inventory
     */
    @PostMapping("/inventory")
    public ResponseEntity<List<InventoryLine>> previewInventory(
            @RequestParam("file") MultipartFile file,
            @RequestParam(required = false) Boolean defectExclusion) throws IOException {

        validateWorkbookUpload(file, "file");
        boolean exclusion = defectExclusion != null
                ? defectExclusion : transformService.defaultOptions().isDefectExclusionEnabled();

        List<InventoryLine> lines = transformService.previewInventory(file.getBytes(), exclusion);
        logger.info("Inventory preview for {}: {} keys", file.getOriginalFilename(), lines.size());
        return ResponseEntity.ok(lines);
    }

    /**
     * GET /api/sticklist/info
     */
    @GetMapping("/info")
    public ResponseEntity<Map<String, Object>> getInfo() {
        ReconciliationOptions defaults = transformService.defaultOptions();
        Map<String, Object> info = new HashMap<>();

        info.put("endpoints", Map.of(
                "transform", "POST /api/sticklist/transform (file, template?, defectExclusion?, filldown?)",
                "diffReport", "POST /api/sticklist/diff-report (file, template?, defectExclusion?, filldown?)",
                "inventory", "POST /api/sticklist/inventory (file, defectExclusion?)"
        ));
        info.put("defaults", Map.of(
                "defectExclusion", defaults.isDefectExclusionEnabled(),
                "filldown", defaults.isFilldownEnabled(),
                "diffReport", defaults.isDiffReportEnabled()
        ));
        info.put("defaultTemplateAvailable", templateStore.hasDefaultTemplate());
        info.put("sourceLayout", "Blocks B-F, H-L, N-R (Model, Blade, Flex, Left, Right); data from row 5");
        info.put("templateLayout", "Model, Style/Color, Blade, Flex, Left, Right from column B; data from row 2");
        info.put("outputFileName", transformService.outputFileName());

        return ResponseEntity.ok(info);
    }

    private TransformResult runTransform(MultipartFile file, MultipartFile template,
                                         ReconciliationOptions options) throws IOException {
        validateWorkbookUpload(file, "file");
        byte[] templateBytes = null;
        if (template != null && !template.isEmpty()) {
            validateWorkbookUpload(template, "template");
            templateBytes = template.getBytes();
        }

        try {
            return transformService.transform(file.getBytes(), templateBytes, options);
        } catch (IOException e) {
            logger.error("Failed to transform {}: {}", file.getOriginalFilename(), e.getMessage(), e);
            throw e;
        }
    }

    // null keeps the configured default
    private ReconciliationOptions resolveOptions(Boolean defectExclusion, Boolean filldown, Boolean diffReport) {
        ReconciliationOptions options = transformService.defaultOptions();
        if (defectExclusion != null) {
            options.setDefectExclusionEnabled(defectExclusion);
        }
        if (filldown != null) {
            options.setFilldownEnabled(filldown);
        }
        if (diffReport != null) {
            options.setDiffReportEnabled(diffReport);
        }
        return options;
    }

    private void validateWorkbookUpload(MultipartFile file, String part) {
        if (file == null || file.isEmpty()) {
            throw new BusinessException("Uploaded " + part + " is empty");
        }
        String fileName = file.getOriginalFilename();
        if (fileName == null || !fileName.toLowerCase().endsWith(".xlsx")) {
            throw new BusinessException("Only Excel files (.xlsx) are supported for " + part + ". Got: " + fileName);
        }
    }
}
