package com.bmsedge.sticklist.service;

import com.bmsedge.sticklist.dto.CellDiff;
import com.bmsedge.sticklist.model.TemplateLayout;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import static com.bmsedge.sticklist.util.CellValueNormalizer.readCellValue;

/**
 * Cell-by-cell comparison of the original template against the generated one.
 * Columns are located per sheet, so a template that had no Style/Color column
 * compares as blank in that column.
 */
@Service
public class DiffReportService {

    private static final Logger logger = LoggerFactory.getLogger(DiffReportService.class);

    public static final String[] CSV_HEADER = {"row", "column", "original", "generated"};

    public List<CellDiff> compare(Sheet original, Sheet generated) {
        TemplateLayout originalLayout = TemplateLayout.detect(original);
        TemplateLayout generatedLayout = TemplateLayout.detect(generated);

        Map<String, int[]> columns = new LinkedHashMap<>();
        columns.put("Model", new int[]{originalLayout.getModelColumn(), generatedLayout.getModelColumn()});
        columns.put("Style/Color", new int[]{originalLayout.getStyleColumn(), generatedLayout.getStyleColumn()});
        columns.put("Blade", new int[]{originalLayout.getBladeColumn(), generatedLayout.getBladeColumn()});
        columns.put("Flex", new int[]{originalLayout.getFlexColumn(), generatedLayout.getFlexColumn()});
        columns.put("Left", new int[]{originalLayout.getLeftColumn(), generatedLayout.getLeftColumn()});
        columns.put("Right", new int[]{originalLayout.getRightColumn(), generatedLayout.getRightColumn()});

        int lastRow = originalLayout.lastPopulatedRow(original);
        List<CellDiff> diffs = new ArrayList<>();

        for (int r = TemplateLayout.HEADER_ROW; r <= lastRow; r++) {
            Row originalRow = original.getRow(r);
            Row generatedRow = generated.getRow(r);
            for (Map.Entry<String, int[]> column : columns.entrySet()) {
                Object before = value(originalRow, column.getValue()[0]);
                Object after = value(generatedRow, column.getValue()[1]);
                if (isBlankForDiff(before) && isBlankForDiff(after)) {
                    continue;
                }
                if (!sameValue(before, after)) {
                    diffs.add(new CellDiff(r + 1, column.getKey(), before, after));
                }
            }
        }

        logger.info("Diff report: {} changed cells over {} rows", diffs.size(), lastRow + 1);
        return diffs;
    }

    public byte[] toCsv(List<CellDiff> diffs) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        CSVFormat format = CSVFormat.DEFAULT.builder().setHeader(CSV_HEADER).build();
        try (Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(writer, format)) {
            for (CellDiff diff : diffs) {
                printer.printRecord(diff.getRow(), diff.getColumn(),
                        format(diff.getOriginal()), format(diff.getGenerated()));
            }
        }
        return out.toByteArray();
    }

    private Object value(Row row, int column) {
        if (row == null || column == TemplateLayout.NO_COLUMN) {
            return null;
        }
        return readCellValue(row.getCell(column));
    }

    private boolean isBlankForDiff(Object value) {
        return value == null || (value instanceof String && ((String) value).trim().isEmpty());
    }

    private boolean sameValue(Object a, Object b) {
        if (a instanceof Number && b instanceof Number) {
            return ((Number) a).doubleValue() == ((Number) b).doubleValue();
        }
        return Objects.equals(a, b);
    }

    private String format(Object value) {
        return value == null ? "" : String.valueOf(value);
    }
}
