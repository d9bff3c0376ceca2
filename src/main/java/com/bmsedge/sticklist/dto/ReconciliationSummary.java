package com.bmsedge.sticklist.dto;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Counters collected while applying aggregated stock to a template.
 */
@Getter
@Setter
@ToString
public class ReconciliationSummary {

    private boolean styleColumnInserted;

    // 1-based, as shown in Excel
    private int lastRow;

    private int rowsCleared;
    private int rowsMatched;
    private int rowsUnmatched;
    private int rowsIncomplete;
    private int cellsFilledDown;
    private int modelsRewritten;

    public void incrementRowsMatched() {
        rowsMatched++;
    }

    public void incrementRowsUnmatched() {
        rowsUnmatched++;
    }

    public void incrementRowsIncomplete() {
        rowsIncomplete++;
    }

    public void incrementCellsFilledDown() {
        cellsFilledDown++;
    }

    public void incrementModelsRewritten() {
        modelsRewritten++;
    }
}
