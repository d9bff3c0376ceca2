package com.bmsedge.sticklist.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * Last non-blank Model/Style/Blade seen while scanning down a block or the template.
 * Each row step takes a state and returns the next one; a fresh scan starts from
 * {@link #EMPTY}.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class FillDownState {

    public static final FillDownState EMPTY = new FillDownState(null, null, null);

    private final String currentModel;
    private final String currentStyle;
    private final String currentBlade;

    public FillDownState(String currentModel, String currentStyle, String currentBlade) {
        this.currentModel = currentModel;
        this.currentStyle = currentStyle;
        this.currentBlade = currentBlade;
    }

    /** Remembers every non-null value given; null arguments keep the current value. */
    public FillDownState remember(String model, String style, String blade) {
        return new FillDownState(
                model != null ? model : currentModel,
                style != null ? style : currentStyle,
                blade != null ? blade : currentBlade
        );
    }

    public FillDownState withoutStyle() {
        return new FillDownState(currentModel, null, currentBlade);
    }
}
