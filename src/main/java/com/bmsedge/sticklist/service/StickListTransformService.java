package com.bmsedge.sticklist.service;

import com.bmsedge.sticklist.config.StickListProperties;
import com.bmsedge.sticklist.dto.CellDiff;
import com.bmsedge.sticklist.dto.InventoryLine;
import com.bmsedge.sticklist.dto.ReconciliationOptions;
import com.bmsedge.sticklist.dto.ReconciliationSummary;
import com.bmsedge.sticklist.dto.TransformResult;
import com.bmsedge.sticklist.model.CanonicalKey;
import com.bmsedge.sticklist.model.InventoryTotal;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Runs one full reconciliation: supplier sheet A is aggregated, the totals are written
 * into a fresh copy of template B, and optionally the result is diffed against B.
 * Every call works on its own workbooks; nothing is kept between runs.
 */
@Service
public class StickListTransformService {

    private static final Logger logger = LoggerFactory.getLogger(StickListTransformService.class);

    private static final DateTimeFormatter FILE_DATE = DateTimeFormatter.ofPattern("yyyy-MM-dd");

    @Autowired
    private InventoryAggregator inventoryAggregator;

    @Autowired
    private TemplateReconciler templateReconciler;

    @Autowired
    private DiffReportService diffReportService;

    @Autowired
    private TemplateStore templateStore;

    @Autowired
    private StickListProperties properties;

    @Autowired
    private Clock outputClock;

    public ReconciliationOptions defaultOptions() {
        return new ReconciliationOptions(
                properties.isDefectExclusionEnabled(),
                properties.isFilldownEnabled(),
                properties.isDiffReportEnabled());
    }

    /**
     * @param source   supplier workbook (A)
     * @param template template workbook (B), or null for the configured default
     * @throws IOException if either workbook cannot be read or the output cannot be written
     */
    public TransformResult transform(byte[] source, byte[] template, ReconciliationOptions options)
            throws IOException {
        logger.info("Starting stick list transform: {}", options);

        Map<CanonicalKey, InventoryTotal> totals = aggregate(source, options.isDefectExclusionEnabled());
        byte[] templateBytes = template != null ? template : templateStore.loadDefaultTemplate();

        TransformResult result = new TransformResult();
        result.setAggregatedKeys(totals.size());
        result.setFileName(outputFileName());

        try (Workbook workbook = open(templateBytes)) {
            Sheet sheet = workbook.getSheetAt(workbook.getActiveSheetIndex());
            ReconciliationSummary summary = templateReconciler.reconcile(sheet, totals, options.isFilldownEnabled());
            result.setSummary(summary);

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            workbook.write(out);
            result.setWorkbook(out.toByteArray());
        }

        if (options.isDiffReportEnabled()) {
            List<CellDiff> diffs = diff(templateBytes, result.getWorkbook());
            result.setDiffReport(diffReportService.toCsv(diffs));
            result.setDiffCount(diffs.size());
        }

        logger.info("Finished stick list transform: {} keys, {} rows matched, output {}",
                totals.size(), result.getSummary().getRowsMatched(), result.getFileName());
        return result;
    }

    public List<InventoryLine> previewInventory(byte[] source, boolean defectExclusionEnabled) throws IOException {
        Map<CanonicalKey, InventoryTotal> totals = aggregate(source, defectExclusionEnabled);
        List<InventoryLine> lines = new ArrayList<>();
        for (Map.Entry<CanonicalKey, InventoryTotal> entry : totals.entrySet()) {
            lines.add(new InventoryLine(entry.getKey(), entry.getValue()));
        }
        return lines;
    }

    public String outputFileName() {
        return properties.getOutputPrefix() + LocalDate.now(outputClock).format(FILE_DATE) + ".xlsx";
    }

    private Map<CanonicalKey, InventoryTotal> aggregate(byte[] source, boolean defectExclusionEnabled)
            throws IOException {
        try (Workbook workbook = open(source)) {
            return inventoryAggregator.aggregate(workbook, defectExclusionEnabled);
        }
    }

    private List<CellDiff> diff(byte[] template, byte[] generated) throws IOException {
        try (Workbook original = open(template);
             Workbook output = open(generated)) {
            return diffReportService.compare(
                    original.getSheetAt(original.getActiveSheetIndex()),
                    output.getSheetAt(output.getActiveSheetIndex()));
        }
    }

    private Workbook open(byte[] bytes) throws IOException {
        return WorkbookFactory.create(new ByteArrayInputStream(bytes));
    }
}
