package com.bmsedge.sticklist.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Identity of one stock-keeping unit: model base, optional style, blade and flex.
 * Two rows with equal keys are the same stick regardless of sheet or position.
 */
@Getter
@EqualsAndHashCode
public final class CanonicalKey {

    private final String modelBase;
    private final String style;
    private final String blade;
    private final int flex;

    public CanonicalKey(String modelBase, String style, String blade, int flex) {
        this.modelBase = modelBase;
        this.style = style;
        this.blade = blade;
        this.flex = flex;
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder(modelBase);
        if (style != null) {
            sb.append(" (").append(style).append(")");
        }
        return sb.append(" / ").append(blade).append(" / ").append(flex).toString();
    }
}
