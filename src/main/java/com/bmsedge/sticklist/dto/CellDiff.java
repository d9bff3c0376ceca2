package com.bmsedge.sticklist.dto;

import lombok.Getter;
import lombok.ToString;

/**
 * One template cell whose generated value differs from the original template.
 */
@Getter
@ToString
public class CellDiff {

    // 1-based
    private final int row;
    private final String column;
    private final Object original;
    private final Object generated;

    public CellDiff(int row, String column, Object original, Object generated) {
        this.row = row;
        this.column = column;
        this.original = original;
        this.generated = generated;
    }
}
