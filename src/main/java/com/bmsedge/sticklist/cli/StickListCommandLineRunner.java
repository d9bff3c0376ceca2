package com.bmsedge.sticklist.cli;

import com.bmsedge.sticklist.dto.ReconciliationOptions;
import com.bmsedge.sticklist.dto.TransformResult;
import com.bmsedge.sticklist.service.StickListTransformService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Runs a single transform from the command line when {@code --a} is given:
 *
 * <pre>
 * java -jar stick-list-service.jar --spring.main.web-application-type=none \
 *     --a=supplier.xlsx --b=template.xlsx --out=Stick_List.xlsx [--diff-csv=diff_report.csv]
 *     [--no-defect-exclusion] [--no-filldown-b-template]
 * </pre>
 *
 * Without {@code --diff-csv} a diff report is still written, as {@code diff_report.csv}
 * next to the output, when {@code sticklist.diff-report-enabled} is set. Without
 * {@code --a} the application starts as the web service only.
 */
@Component
public class StickListCommandLineRunner implements ApplicationRunner {

    private static final Logger logger = LoggerFactory.getLogger(StickListCommandLineRunner.class);

    static final String DEFAULT_DIFF_FILE = "diff_report.csv";

    @Autowired
    private StickListTransformService transformService;

    @Override
    public void run(ApplicationArguments args) throws IOException {
        if (!args.containsOption("a")) {
            return;
        }

        Path source = Paths.get(requiredOption(args, "a"));
        Path template = Paths.get(requiredOption(args, "b"));
        Path output = Paths.get(requiredOption(args, "out"));
        String diffCsv = optionalOption(args, "diff-csv");

        ReconciliationOptions options = transformService.defaultOptions();
        if (args.containsOption("no-defect-exclusion")) {
            options.setDefectExclusionEnabled(false);
        }
        if (args.containsOption("no-filldown-b-template")) {
            options.setFilldownEnabled(false);
        }

        // --diff-csv forces the report; otherwise it follows sticklist.diff-report-enabled
        Path diffPath = null;
        if (diffCsv != null) {
            diffPath = Paths.get(diffCsv);
        } else if (options.isDiffReportEnabled()) {
            diffPath = output.resolveSibling(DEFAULT_DIFF_FILE);
        }
        options.setDiffReportEnabled(diffPath != null);

        logger.info("Command line transform: a={}, b={}, out={}", source, template, output);
        TransformResult result = transformService.transform(
                Files.readAllBytes(source), Files.readAllBytes(template), options);

        Files.write(output, result.getWorkbook());
        logger.info("Wrote {} ({} rows matched, {} unmatched)", output,
                result.getSummary().getRowsMatched(), result.getSummary().getRowsUnmatched());

        if (diffPath != null) {
            Files.write(diffPath, result.getDiffReport());
            logger.info("Wrote diff report {} ({} changed cells)", diffPath, result.getDiffCount());
        }
    }

    private String requiredOption(ApplicationArguments args, String name) {
        String value = optionalOption(args, name);
        if (value == null) {
            throw new IllegalArgumentException("Missing required option --" + name);
        }
        return value;
    }

    private String optionalOption(ApplicationArguments args, String name) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty() || values.get(0).isBlank()) {
            return null;
        }
        return values.get(0);
    }
}
