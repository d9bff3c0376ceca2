package com.bmsedge.sticklist.service;

import com.bmsedge.sticklist.model.CanonicalKey;
import com.bmsedge.sticklist.model.FillDownState;
import com.bmsedge.sticklist.model.InventoryTotal;
import com.bmsedge.sticklist.model.ModelStyle;
import com.bmsedge.sticklist.model.StockBlock;
import com.bmsedge.sticklist.util.MergedRegionResolver;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.bmsedge.sticklist.util.CellValueNormalizer.*;

/**
 * Sums supplier stock (sheet "A") per canonical key across the three stick blocks.
 *
 * Each block is scanned on its own: Model and Blade labels fill down within the
 * block (merged cells resolve to their top-left value) and never leak into the next
 * block. Rows still missing model, blade or flex are skipped.
 */
@Service
public class InventoryAggregator {

    private static final Logger logger = LoggerFactory.getLogger(InventoryAggregator.class);

    /** Row 5 in the sheet; rows 1-4 hold titles and headers. */
    public static final int FIRST_DATA_ROW = 4;

    public Map<CanonicalKey, InventoryTotal> aggregate(Workbook workbook, boolean defectExclusionEnabled) {
        Sheet sheet = workbook.getSheetAt(workbook.getActiveSheetIndex());
        return aggregate(sheet, StockBlock.DEFAULT_BLOCKS, defectExclusionEnabled);
    }

    public Map<CanonicalKey, InventoryTotal> aggregate(Sheet sheet, List<StockBlock> blocks,
                                                       boolean defectExclusionEnabled) {
        logger.info("Aggregating sheet '{}' ({} blocks, rows {}-{}, defectExclusion={})",
                sheet.getSheetName(), blocks.size(), FIRST_DATA_ROW + 1, sheet.getLastRowNum() + 1,
                defectExclusionEnabled);
        if (sheet.getLastRowNum() < FIRST_DATA_ROW) {
            logger.warn("Sheet '{}' has no rows from row {} on; nothing to aggregate",
                    sheet.getSheetName(), FIRST_DATA_ROW + 1);
        }

        MergedRegionResolver resolver = new MergedRegionResolver(sheet);
        Map<CanonicalKey, long[]> sums = new LinkedHashMap<>();

        for (StockBlock block : blocks) {
            int contributing = scanBlock(sheet, resolver, block, defectExclusionEnabled, sums);
            logger.info("  {}: {} contributing rows", block, contributing);
        }

        Map<CanonicalKey, InventoryTotal> totals = new LinkedHashMap<>();
        for (Map.Entry<CanonicalKey, long[]> entry : sums.entrySet()) {
            long[] sideSums = entry.getValue();
            totals.put(entry.getKey(), InventoryTotal.fromSums(sideSums[0], sideSums[1]));
        }

        logger.info("Aggregated {} keys from sheet '{}'", totals.size(), sheet.getSheetName());
        return totals;
    }

    private int scanBlock(Sheet sheet, MergedRegionResolver resolver, StockBlock block,
                          boolean defectExclusionEnabled, Map<CanonicalKey, long[]> sums) {
        FillDownState state = FillDownState.EMPTY;
        int contributing = 0;

        for (int r = FIRST_DATA_ROW; r <= sheet.getLastRowNum(); r++) {
            String modelHere = normalizeText(resolver.resolve(r, block.getModelColumn()));
            String bladeHere = normalizeBlade(resolver.resolve(r, block.getBladeColumn()));
            state = state.remember(modelHere, null, bladeHere);

            String model = modelHere != null ? modelHere : state.getCurrentModel();
            String blade = bladeHere != null ? bladeHere : state.getCurrentBlade();

            ModelStyle split = splitModelAndStyle(model);
            String style = normalizeStyle(split.getStyle());

            Row row = sheet.getRow(r);
            Integer flex = parseFlex(cellValue(row, block.getFlexColumn()));

            if (split.getBase() == null || blade == null || flex == null) {
                continue;
            }

            Integer left = parseQuantity(cellValue(row, block.getLeftColumn()), defectExclusionEnabled);
            Integer right = parseQuantity(cellValue(row, block.getRightColumn()), defectExclusionEnabled);

            CanonicalKey key = new CanonicalKey(split.getBase(), style, blade, flex);
            long[] sideSums = sums.computeIfAbsent(key, k -> new long[2]);
            if (left != null) {
                sideSums[0] += left;
            }
            if (right != null) {
                sideSums[1] += right;
            }
            contributing++;

            if (logger.isDebugEnabled()) {
                logger.debug("    row {} -> {} L={} R={}", r + 1, key, left, right);
            }
        }
        return contributing;
    }

    private Object cellValue(Row row, int columnIndex) {
        return row == null ? null : readCellValue(row.getCell(columnIndex));
    }
}
