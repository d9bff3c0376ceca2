package com.bmsedge.sticklist.dto;

import lombok.Getter;
import lombok.Setter;
import lombok.ToString;

/**
 * Switches for one run.
 */
@Setter
@Getter
@ToString
public class ReconciliationOptions {

    // Exclude quantity cells carrying non-ASCII annotations (defect marks)
    private boolean defectExclusionEnabled = true;

    // Propagate last-seen Model/Style/Blade into blank template cells
    private boolean filldownEnabled = true;

    private boolean diffReportEnabled = false;

    public ReconciliationOptions() {}

    public ReconciliationOptions(boolean defectExclusionEnabled, boolean filldownEnabled,
                                 boolean diffReportEnabled) {
        this.defectExclusionEnabled = defectExclusionEnabled;
        this.filldownEnabled = filldownEnabled;
        this.diffReportEnabled = diffReportEnabled;
    }
}
