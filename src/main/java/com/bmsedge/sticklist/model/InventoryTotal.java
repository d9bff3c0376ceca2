package com.bmsedge.sticklist.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Aggregated Left/Right quantities for one key. A {@code null} side is written as a
 * blank cell; a zero sum is reported the same way.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class InventoryTotal {

    public static final InventoryTotal BLANK = new InventoryTotal(null, null);

    private final Integer left;
    private final Integer right;

    public InventoryTotal(Integer left, Integer right) {
        this.left = left;
        this.right = right;
    }

    /**
     * Builds the output total from raw side sums. Sums that are not positive collapse
     * to blank, so "summed to 0" and "nothing recorded" read the same.
     */
    public static InventoryTotal fromSums(long leftSum, long rightSum) {
        return new InventoryTotal(positiveOrNull(leftSum), positiveOrNull(rightSum));
    }

    public boolean isBlank() {
        return left == null && right == null;
    }

    private static Integer positiveOrNull(long sum) {
        if (sum <= 0) {
            return null;
        }
        return sum > Integer.MAX_VALUE ? Integer.MAX_VALUE : (int) sum;
    }
}
