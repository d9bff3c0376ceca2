package com.bmsedge.sticklist.config;

import jakarta.validation.constraints.NotBlank;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Defaults for a stick list run, bound from {@code sticklist.*}. Requests and the
 * command line may override the boolean options per run.
 */
@Getter
@Setter
@Validated
@ConfigurationProperties(prefix = "sticklist")
public class StickListProperties {

    /** Template used when a request does not upload its own. Filesystem first, then classpath. */
    @NotBlank
    private String templatePath = "templates/Renee(B).xlsx";

    private boolean defectExclusionEnabled = true;

    private boolean filldownEnabled = true;

    /**
     * Also diff each run against its template: {@code /transform} then reports the
     * number of changed cells and the command line writes {@code diff_report.csv}.
     */
    private boolean diffReportEnabled = false;

    /** Zone whose current date goes into the output file name. */
    @NotBlank
    private String outputZone = "America/New_York";

    @NotBlank
    private String outputPrefix = "Stick_List_";
}
