package com.bmsedge.sticklist.util;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.util.CellRangeAddress;

import java.util.List;

/**
 * Looks up the effective value of a cell, treating every cell of a merged region as
 * holding the region's top-left value.
 */
public class MergedRegionResolver {

    private final Sheet sheet;
    private final List<CellRangeAddress> mergedRegions;

    public MergedRegionResolver(Sheet sheet) {
        this.sheet = sheet;
        this.mergedRegions = sheet.getMergedRegions();
    }

    public Object resolve(int rowIndex, int columnIndex) {
        for (CellRangeAddress region : mergedRegions) {
            if (region.isInRange(rowIndex, columnIndex)) {
                return rawValue(region.getFirstRow(), region.getFirstColumn());
            }
        }
        return rawValue(rowIndex, columnIndex);
    }

    public int getRegionCount() {
        return mergedRegions.size();
    }

    private Object rawValue(int rowIndex, int columnIndex) {
        Row row = sheet.getRow(rowIndex);
        if (row == null) {
            return null;
        }
        return CellValueNormalizer.readCellValue(row.getCell(columnIndex));
    }
}
