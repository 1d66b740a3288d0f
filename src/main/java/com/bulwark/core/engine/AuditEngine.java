package com.bulwark.core.engine;

import com.bulwark.core.check.CheckRunner;
import com.bulwark.core.logging.MdcContext;
import com.bulwark.core.metrics.AuditMetrics;
import com.bulwark.core.model.AggregateReport;
import com.bulwark.core.model.Baseline;
import com.bulwark.core.model.CheckResult;
import com.bulwark.core.model.Issue;
import com.bulwark.core.model.Severity;
import com.bulwark.core.ranking.PriorityRanker;
import com.bulwark.core.report.ReportAssembler;
import com.bulwark.core.scoring.ScoreAggregator;
import com.bulwark.core.snapshot.ProjectSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Entry point of an audit run: checks, scoring, ranking, assembly.
 * Running twice over the same snapshot and baseline yields identical
 * reports apart from the timestamp.
 */
@Service
public class AuditEngine {

    private static final Logger log = LoggerFactory.getLogger(AuditEngine.class);

    private final CheckRunner checkRunner;
    private final ScoreAggregator scoreAggregator;
    private final PriorityRanker priorityRanker;
    private final ReportAssembler reportAssembler;
    private final Clock clock;
    private final AuditMetrics metrics;

    public AuditEngine(CheckRunner checkRunner,
                       ScoreAggregator scoreAggregator,
                       PriorityRanker priorityRanker,
                       ReportAssembler reportAssembler,
                       Clock clock,
                       @Autowired(required = false) AuditMetrics metrics) {
        this.checkRunner = checkRunner;
        this.scoreAggregator = scoreAggregator;
        this.priorityRanker = priorityRanker;
        this.reportAssembler = reportAssembler;
        this.clock = clock;
        this.metrics = metrics;
    }

    public AggregateReport run(ProjectSnapshot snapshot) {
        return run(snapshot, null);
    }

    /**
     * @param baseline previous scores, or {@code null}
     */
    public AggregateReport run(ProjectSnapshot snapshot, Baseline baseline) {
        String runId = UUID.randomUUID().toString().substring(0, 8);
        MdcContext.setRun(runId);
        try {
            log.info("Starting security audit of {} ({} checks)", snapshot.root(), checkRunner.checks().size());
            List<CheckResult> results = checkRunner.run(snapshot);
            var summary = scoreAggregator.aggregate(results);
            var comparisons = priorityRanker.compare(results, baseline);
            var actions = priorityRanker.rank(comparisons);
            Instant timestamp = clock.instant();

            AggregateReport report = reportAssembler.assemble(timestamp, results, summary, comparisons, actions);
            log.info("Audit complete: {}/{} ({}%), status {}",
                    summary.total(), summary.max(), String.format(Locale.ROOT, "%.1f", summary.percentage()),
                    summary.band().label());
            recordMetrics(report);
            return report;
        } finally {
            MdcContext.clear();
        }
    }

    private void recordMetrics(AggregateReport report) {
        if (metrics == null) {
            return;
        }
        for (Severity severity : Severity.values()) {
            int count = (int) report.issues().stream().map(Issue::severity).filter(severity::equals).count();
            if (count > 0) {
                metrics.recordIssues(severity.label(), count);
            }
        }
        metrics.recordRunResult(report.band().label());
    }
}
