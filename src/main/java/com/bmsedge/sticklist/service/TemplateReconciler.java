package com.bmsedge.sticklist.service;

import com.bmsedge.sticklist.dto.ReconciliationSummary;
import com.bmsedge.sticklist.model.CanonicalKey;
import com.bmsedge.sticklist.model.FillDownState;
import com.bmsedge.sticklist.model.InventoryTotal;
import com.bmsedge.sticklist.model.ModelStyle;
import com.bmsedge.sticklist.model.TemplateLayout;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.CellType;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.CellUtil;
import org.apache.poi.xssf.usermodel.XSSFSheet;
import org.apache.poi.xssf.usermodel.helpers.ColumnHelper;
import org.openxmlformats.schemas.spreadsheetml.x2006.main.CTCol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.Map;

import static com.bmsedge.sticklist.util.CellValueNormalizer.*;

/**
 * Writes aggregated stock into the stick list template (sheet "B") in place.
 *
 * Order matters: the Style/Color column is guaranteed first, then every Left/Right
 * cell is cleared, and only then are rows matched and written. A template row whose
 * key has no stock therefore ends blank instead of keeping a stale quantity.
 */
@Service
public class TemplateReconciler {

    private static final Logger logger = LoggerFactory.getLogger(TemplateReconciler.class);

    public static final String STYLE_HEADER = "Style/Color";

    public ReconciliationSummary reconcile(Sheet sheet, Map<CanonicalKey, InventoryTotal> totals,
                                           boolean filldownEnabled) {
        ReconciliationSummary summary = new ReconciliationSummary();
        summary.setStyleColumnInserted(ensureStyleColumn(sheet));

        TemplateLayout layout = TemplateLayout.withStyleColumn();
        int lastRow = findLastPopulatedRow(sheet, layout);
        if (lastRow < TemplateLayout.FIRST_DATA_ROW) {
            logger.warn("Template '{}' has no data rows below its header", sheet.getSheetName());
        }
        summary.setLastRow(lastRow + 1);
        summary.setRowsCleared(clearQuantities(sheet, layout, lastRow));

        FillDownState state = FillDownState.EMPTY;
        for (int r = TemplateLayout.FIRST_DATA_ROW; r <= lastRow; r++) {
            state = reconcileRow(sheet, r, layout, state, totals, filldownEnabled, summary);
        }

        logger.info("Reconciled template '{}': {}", sheet.getSheetName(), summary);
        return summary;
    }

    /**
     * Inserts a "Style/Color" column right after Model unless the header there already
     * mentions style or color. The new column takes the Model column's cell styles and
     * width. Every shifted column keeps its own width: explicit widths move with it and
     * a column that had the default width keeps the default at its new position.
     *
     * @return true if a column was inserted
     */
    public boolean ensureStyleColumn(Sheet sheet) {
        if (TemplateLayout.hasStyleHeader(sheet)) {
            return false;
        }

        int modelColumn = TemplateLayout.MODEL_COLUMN;
        int styleColumn = modelColumn + 1;
        int lastColumn = lastColumnIndex(sheet);

        Map<Integer, Integer> widths = new HashMap<>();
        for (int c = styleColumn; c <= lastColumn; c++) {
            Integer width = explicitWidth(sheet, c);
            if (width != null) {
                widths.put(c, width);
            }
        }
        Integer modelWidth = explicitWidth(sheet, modelColumn);

        if (lastColumn >= styleColumn) {
            sheet.shiftColumns(styleColumn, lastColumn, 1);
        }
        // shiftColumns moves cells only; column definitions stay where they were
        for (int c = lastColumn; c >= styleColumn; c--) {
            applyWidth(sheet, c + 1, widths.get(c));
        }
        applyWidth(sheet, styleColumn, modelWidth);

        for (int r = TemplateLayout.HEADER_ROW; r <= sheet.getLastRowNum(); r++) {
            Row row = sheet.getRow(r);
            if (row == null) {
                continue;
            }
            Cell modelCell = row.getCell(modelColumn);
            Cell styleCell = row.createCell(styleColumn);
            if (modelCell != null) {
                styleCell.setCellStyle(modelCell.getCellStyle());
            }
        }

        Row header = sheet.getRow(TemplateLayout.HEADER_ROW);
        if (header == null) {
            logger.warn("Template '{}' has no header row; creating one", sheet.getSheetName());
            header = sheet.createRow(TemplateLayout.HEADER_ROW);
        }
        CellUtil.getCell(header, styleColumn).setCellValue(STYLE_HEADER);

        logger.info("Inserted '{}' column into template '{}' (shifted columns {}-{})",
                STYLE_HEADER, sheet.getSheetName(), styleColumn + 1, lastColumn + 1);
        return true;
    }

    public int findLastPopulatedRow(Sheet sheet, TemplateLayout layout) {
        return layout.lastPopulatedRow(sheet);
    }

    /**
     * Blanks Left and Right for every data row up to {@code lastRow}.
     *
     * @return number of rows visited
     */
    public int clearQuantities(Sheet sheet, TemplateLayout layout, int lastRow) {
        int cleared = 0;
        for (int r = TemplateLayout.FIRST_DATA_ROW; r <= lastRow; r++) {
            Row row = sheet.getRow(r);
            cleared++;
            if (row == null) {
                continue;
            }
            blank(row.getCell(layout.getLeftColumn()));
            blank(row.getCell(layout.getRightColumn()));
        }
        return cleared;
    }

    FillDownState reconcileRow(Sheet sheet, int rowIndex, TemplateLayout layout, FillDownState state,
                               Map<CanonicalKey, InventoryTotal> totals, boolean filldownEnabled,
                               ReconciliationSummary summary) {
        Row row = sheet.getRow(rowIndex);

        ModelStyle split = splitModelAndStyle(value(row, layout.getModelColumn()));
        String modelHere = split.getBase();
        String styleCellHere = normalizeStyle(value(row, layout.getStyleColumn()));
        String styleHere = styleCellHere != null ? styleCellHere : normalizeStyle(split.getStyle());
        String bladeHere = normalizeBlade(value(row, layout.getBladeColumn()));
        Integer flex = parseFlex(value(row, layout.getFlexColumn()));

        // "FT8 Pro (RED)" in Model becomes Model "FT8 Pro" with the style in its own column
        if (split.hasStyle()) {
            writeText(row.getCell(layout.getModelColumn()), modelHere);
            summary.incrementModelsRewritten();
            if (styleCellHere == null && styleHere != null) {
                writeText(CellUtil.getCell(row, layout.getStyleColumn()), styleHere);
            }
        }

        // A new model without its own style must not inherit the previous model's style
        if (modelHere != null && !modelHere.equals(state.getCurrentModel()) && styleHere == null) {
            state = state.withoutStyle();
        }
        state = state.remember(modelHere, styleHere, bladeHere);

        String model = modelHere != null ? modelHere : (filldownEnabled ? state.getCurrentModel() : null);
        String style = styleHere != null ? styleHere : (filldownEnabled ? state.getCurrentStyle() : null);
        String blade = bladeHere != null ? bladeHere : (filldownEnabled ? state.getCurrentBlade() : null);

        if (filldownEnabled) {
            if (modelHere == null && model != null) {
                row = fillDown(sheet, row, rowIndex, layout.getModelColumn(), model, summary);
            }
            if (styleHere == null && style != null) {
                row = fillDown(sheet, row, rowIndex, layout.getStyleColumn(), style, summary);
            }
            if (bladeHere == null && blade != null) {
                row = fillDown(sheet, row, rowIndex, layout.getBladeColumn(), blade, summary);
            }
        }

        if (model == null || blade == null || flex == null) {
            summary.incrementRowsIncomplete();
            return state;
        }

        CanonicalKey key = new CanonicalKey(model, style, blade, flex);
        InventoryTotal total = totals.get(key);
        if (total == null) {
            summary.incrementRowsUnmatched();
            logger.debug("Row {}: no stock for {}", rowIndex + 1, key);
            return state;
        }

        writeQuantity(row, layout.getLeftColumn(), total.getLeft());
        writeQuantity(row, layout.getRightColumn(), total.getRight());
        summary.incrementRowsMatched();
        logger.debug("Row {}: {} -> L={} R={}", rowIndex + 1, key, total.getLeft(), total.getRight());
        return state;
    }

    private Row fillDown(Sheet sheet, Row row, int rowIndex, int column, String value,
                         ReconciliationSummary summary) {
        Row target = row != null ? row : sheet.createRow(rowIndex);
        writeText(CellUtil.getCell(target, column), value);
        summary.incrementCellsFilledDown();
        return target;
    }

    private void writeQuantity(Row row, int column, Integer quantity) {
        if (quantity == null) {
            blank(row.getCell(column));
            return;
        }
        CellUtil.getCell(row, column).setCellValue(quantity);
    }

    private Object value(Row row, int column) {
        if (row == null || column == TemplateLayout.NO_COLUMN) {
            return null;
        }
        return readCellValue(row.getCell(column));
    }

    // A formula would bring the old text back on the next recalculation
    private void writeText(Cell cell, String value) {
        if (cell.getCellType() == CellType.FORMULA) {
            cell.setBlank();
        }
        cell.setCellValue(value);
    }

    private void blank(Cell cell) {
        if (cell != null) {
            cell.setBlank();
        }
    }

    private int lastColumnIndex(Sheet sheet) {
        int last = -1;
        for (Row row : sheet) {
            last = Math.max(last, row.getLastCellNum() - 1);
        }
        return last;
    }

    /**
     * Gives {@code column} the width {@code width}, or back to the sheet default when
     * {@code width} is null.
     */
    private void applyWidth(Sheet sheet, int column, Integer width) {
        if (width != null) {
            sheet.setColumnWidth(column, width);
            return;
        }
        if (sheet instanceof XSSFSheet) {
            ColumnHelper helper = ((XSSFSheet) sheet).getColumnHelper();
            if (helper.getColumn(column, false) == null) {
                return;
            }
            CTCol col = helper.getColumn1Based(column + 1L, true);
            if (col.isSetWidth()) {
                col.unsetWidth();
            }
            if (col.isSetCustomWidth()) {
                col.unsetCustomWidth();
            }
            return;
        }
        sheet.setColumnWidth(column, sheet.getDefaultColumnWidth() * 256);
    }

    private Integer explicitWidth(Sheet sheet, int column) {
        if (sheet instanceof XSSFSheet) {
            CTCol col = ((XSSFSheet) sheet).getColumnHelper().getColumn(column, false);
            return col != null && col.isSetWidth() ? sheet.getColumnWidth(column) : null;
        }
        return sheet.getColumnWidth(column);
    }
}
