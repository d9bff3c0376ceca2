package com.bmsedge.sticklist.dto;

import lombok.Getter;
import lombok.Setter;

/**
 * Output of one run: the generated workbook, its download name and, when requested,
 * the diff report against the template.
 */
@Getter
@Setter
public class TransformResult {

    private byte[] workbook;
    private String fileName;
    private ReconciliationSummary summary;
    private int aggregatedKeys;

    // null unless the diff report was requested
    private byte[] diffReport;
    private int diffCount;

    public boolean hasDiffReport() {
        return diffReport != null;
    }
}
