package com.bmsedge.sticklist.model;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

/**
 * A model label split into its base name and the style/color written in a trailing
 * parenthetical, e.g. "FT8 Pro (RED)" -> base "FT8 Pro", style "RED".
 */
@Getter
@ToString
@EqualsAndHashCode
public final class ModelStyle {

    public static final ModelStyle EMPTY = new ModelStyle(null, null);

    private final String base;

    // Raw parenthetical content, not yet upper-cased
    private final String style;

    public ModelStyle(String base, String style) {
        this.base = base;
        this.style = style;
    }

    public boolean hasStyle() {
        return style != null;
    }
}
