package com.bmsedge.sticklist.model;

import lombok.Getter;

import java.util.List;

/**
 * One Model/Blade/Flex/Left/Right column group of the supplier sheet.
 * Column indexes are 0-based.
 */
@Getter
public final class StockBlock {

    /** Blocks B-F, H-L and N-R. */
    public static final List<StockBlock> DEFAULT_BLOCKS = List.of(
            StockBlock.startingAt("B-F", 1),
            StockBlock.startingAt("H-L", 7),
            StockBlock.startingAt("N-R", 13)
    );

    private final String name;
    private final int modelColumn;
    private final int bladeColumn;
    private final int flexColumn;
    private final int leftColumn;
    private final int rightColumn;

    public StockBlock(String name, int modelColumn, int bladeColumn, int flexColumn,
                      int leftColumn, int rightColumn) {
        this.name = name;
        this.modelColumn = modelColumn;
        this.bladeColumn = bladeColumn;
        this.flexColumn = flexColumn;
        this.leftColumn = leftColumn;
        this.rightColumn = rightColumn;
    }

    public static StockBlock startingAt(String name, int modelColumn) {
        return new StockBlock(name, modelColumn, modelColumn + 1, modelColumn + 2,
                modelColumn + 3, modelColumn + 4);
    }

    @Override
    public String toString() {
        return "StockBlock[" + name + "]";
    }
}
