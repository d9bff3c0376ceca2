package com.bmsedge.sticklist.model;

import com.bmsedge.sticklist.util.CellValueNormalizer;
import lombok.Getter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;

import java.util.Locale;

/**
 * Column positions (0-based) of the stick list template. Model sits in column B;
 * Blade, Flex, Left and Right follow it, with an optional Style/Color column between
 * Model and Blade.
 */
@Getter
public final class TemplateLayout {

    public static final int HEADER_ROW = 0;
    public static final int FIRST_DATA_ROW = 1;
    public static final int MODEL_COLUMN = 1;
    public static final int NO_COLUMN = -1;

    private final int modelColumn;
    private final int styleColumn;
    private final int bladeColumn;
    private final int flexColumn;
    private final int leftColumn;
    private final int rightColumn;

    private TemplateLayout(boolean withStyleColumn) {
        int next = MODEL_COLUMN + 1;
        this.modelColumn = MODEL_COLUMN;
        this.styleColumn = withStyleColumn ? next++ : NO_COLUMN;
        this.bladeColumn = next++;
        this.flexColumn = next++;
        this.leftColumn = next++;
        this.rightColumn = next;
    }

    public static TemplateLayout withStyleColumn() {
        return new TemplateLayout(true);
    }

    public static TemplateLayout withoutStyleColumn() {
        return new TemplateLayout(false);
    }

    public static TemplateLayout detect(Sheet sheet) {
        return hasStyleHeader(sheet) ? withStyleColumn() : withoutStyleColumn();
    }

    /**
     * True when the header right after Model mentions "style" or "color".
     */
    public static boolean hasStyleHeader(Sheet sheet) {
        Row header = sheet.getRow(HEADER_ROW);
        if (header == null) {
            return false;
        }
        String text = CellValueNormalizer.normalizeText(
                CellValueNormalizer.readCellValue(header.getCell(MODEL_COLUMN + 1)));
        if (text == null) {
            return false;
        }
        String lower = text.toLowerCase(Locale.ROOT);
        return lower.contains("style") || lower.contains("color");
    }

    /**
     * Last row (0-based) with any value in the template columns; the header row if
     * there is no data at all.
     */
    public int lastPopulatedRow(Sheet sheet) {
        int last = sheet.getLastRowNum();
        while (last > HEADER_ROW && !rowHasAnyValue(sheet.getRow(last))) {
            last--;
        }
        return Math.max(last, HEADER_ROW);
    }

    public boolean rowHasAnyValue(Row row) {
        if (row == null) {
            return false;
        }
        for (int column : relevantColumns()) {
            if (!CellValueNormalizer.isBlank(CellValueNormalizer.readCellValue(row.getCell(column)))) {
                return true;
            }
        }
        return false;
    }

    public boolean hasStyleColumn() {
        return styleColumn != NO_COLUMN;
    }

    /** Columns a row must have a value in to count as populated. */
    public int[] relevantColumns() {
        if (hasStyleColumn()) {
            return new int[]{modelColumn, styleColumn, bladeColumn, flexColumn, leftColumn, rightColumn};
        }
        return new int[]{modelColumn, bladeColumn, flexColumn, leftColumn, rightColumn};
    }
}
