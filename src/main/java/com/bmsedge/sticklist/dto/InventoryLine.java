package com.bmsedge.sticklist.dto;

import com.bmsedge.sticklist.model.CanonicalKey;
import com.bmsedge.sticklist.model.InventoryTotal;
import lombok.Getter;

/**
 * Aggregated supplier stock for one key, as returned by the preview endpoint.
 */
@Getter
public class InventoryLine {

    private final String model;
    private final String style;
    private final String blade;
    private final int flex;
    private final Integer left;
    private final Integer right;

    public InventoryLine(CanonicalKey key, InventoryTotal total) {
        this.model = key.getModelBase();
        this.style = key.getStyle();
        this.blade = key.getBlade();
        this.flex = key.getFlex();
        this.left = total.getLeft();
        this.right = total.getRight();
    }
}
