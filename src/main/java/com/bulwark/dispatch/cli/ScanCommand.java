package com.bulwark.dispatch.cli;

import com.bulwark.core.baseline.BaselineLoader;
import com.bulwark.core.baseline.InputFormatException;
import com.bulwark.core.config.AuditProperties;
import com.bulwark.core.engine.AuditEngine;
import com.bulwark.core.model.AggregateReport;
import com.bulwark.core.model.Baseline;
import com.bulwark.core.model.CheckResult;
import com.bulwark.core.model.Issue;
import com.bulwark.core.report.ReportFormat;
import com.bulwark.core.report.ReportWriter;
import com.bulwark.core.snapshot.ProjectScanner;
import com.bulwark.core.snapshot.ProjectSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * CLI command: bulwark scan
 * <p>
 * Audits a project tree, prints per-check scores and the overall verdict,
 * and optionally writes the report. Exit code 0 means the project passed.
 */
@Command(name = "scan", mixinStandardHelpOptions = true, description = "Audit a project's security configuration")
@Component
public class ScanCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ScanCommand.class);

    static final int EXIT_PASS = 0;
    static final int EXIT_FAIL = 1;

    @Option(names = {"--project-root", "-p"}, description = "Project root to audit", defaultValue = ".")
    private Path projectRoot;

    @Option(names = {"--output", "-o"}, description = "Write the report to this file")
    private Path output;

    @Option(names = {"--format", "-f"}, description = "Report format: json, markdown", defaultValue = "json")
    private String format;

    @Option(names = {"--baseline", "-b"}, description = "Previous report or scorecard result to compare against")
    private Path baselinePath;

    @Option(names = "--fail-on-critical", description = "Fail when any critical issue is found")
    private boolean failOnCritical;

    private final ProjectScanner scanner;
    private final AuditEngine engine;
    private final BaselineLoader baselineLoader;
    private final ReportWriter reportWriter;
    private final AuditProperties properties;

    public ScanCommand(ProjectScanner scanner,
                       AuditEngine engine,
                       BaselineLoader baselineLoader,
                       ReportWriter reportWriter,
                       AuditProperties properties) {
        this.scanner = scanner;
        this.engine = engine;
        this.baselineLoader = baselineLoader;
        this.reportWriter = reportWriter;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        ReportFormat reportFormat;
        try {
            reportFormat = ReportFormat.fromString(format);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.fatal("Invalid format: " + format + ". Valid formats: json, markdown");
            return EXIT_FAIL;
        }

        AggregateReport report;
        try {
            Baseline baseline = baselinePath != null ? baselineLoader.load(baselinePath) : null;
            ProjectSnapshot snapshot = scanner.scan(projectRoot, properties.getComponents());
            ConsoleOutput.info("Auditing " + snapshot.root());
            report = engine.run(snapshot, baseline);
            if (output != null) {
                reportWriter.write(report, output, reportFormat);
            }
        } catch (InputFormatException e) {
            ConsoleOutput.fatal(e.getMessage());
            return EXIT_FAIL;
        } catch (IOException e) {
            log.debug("Scan aborted", e);
            ConsoleOutput.fatal("I/O failure: " + e.getMessage());
            return EXIT_FAIL;
        }

        System.out.println();
        for (CheckResult result : report.results().values()) {
            ConsoleOutput.checkScore(result);
            for (Issue issue : result.issues()) {
                ConsoleOutput.issue(issue);
            }
        }
        System.out.println();
        ConsoleOutput.summary(report.summary());
        if (output != null) {
            ConsoleOutput.success("Report written to " + output);
        }

        return verdict(report);
    }

    private int verdict(AggregateReport report) {
        boolean passed = true;
        if (report.percentage() < properties.getPassPercentage()) {
            ConsoleOutput.error("Below the pass threshold of " + properties.getPassPercentage() + "%");
            passed = false;
        }
        int critical = report.criticalIssues().size();
        if (failOnCritical && critical > 0) {
            ConsoleOutput.error(critical + " critical issue" + (critical != 1 ? "s" : "") + " found");
            passed = false;
        }
        if (passed) {
            ConsoleOutput.success("Security audit passed");
        }
        return passed ? EXIT_PASS : EXIT_FAIL;
    }
}
