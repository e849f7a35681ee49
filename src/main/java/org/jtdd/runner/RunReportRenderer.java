package org.jtdd.runner;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.jtdd.obs.JsonText;

/**
 * Renders run reports as CI-friendly markdown and JSON artifacts.
 */
public final class RunReportRenderer {
    public String toMarkdown(RunReport report) {
        Objects.requireNonNull(report, "report");
        StringBuilder sb = new StringBuilder();
        sb.append("# Test Run Report\n\n");
        sb.append("- runId: ").append(report.runId()).append('\n');
        sb.append("- generatedAt: ").append(report.generatedAt()).append('\n');
        sb.append("- overall: ").append(overallStatus(report)).append('\n');
        sb.append("- passed: ").append(report.passedCount()).append('\n');
        sb.append("- failed: ").append(report.failedCount()).append('\n');
        sb.append("- missedFailures: ").append(report.missedFailureCount()).append('\n');
        sb.append("- skipped: ").append(report.countOf(Verdict.SKIPPED)).append("\n\n");

        sb.append("## Results\n");
        String currentSuite = null;
        for (UnitResult result : report.results()) {
            if (!result.suiteName().equals(currentSuite)) {
                currentSuite = result.suiteName();
                sb.append("\n### ")
                    .append(currentSuite.isEmpty() ? TestRunner.SINGLE_TESTS_LABEL : currentSuite)
                    .append('\n');
            }
            sb.append("- ")
                .append(result.kind().name().toLowerCase(Locale.ROOT))
                .append(' ')
                .append(result.name())
                .append(": ")
                .append(result.verdict());
            result.line().ifPresent(line -> sb.append(" (line ").append(line).append(')'));
            sb.append('\n');
            result.reason().ifPresent(reason -> {
                for (String reasonLine : reason.split("\n", -1)) {
                    sb.append("  > ").append(reasonLine).append('\n');
                }
            });
        }
        return sb.toString();
    }

    public String toJson(RunReport report) {
        Objects.requireNonNull(report, "report");
        Map<String, Object> root = new LinkedHashMap<>();
        root.put("runId", report.runId());
        root.put("generatedAt", report.generatedAt().toString());
        root.put("overallStatus", overallStatus(report));
        root.put("aborted", report.aborted());

        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("passed", report.passedCount());
        summary.put("failed", report.failedCount());
        summary.put("missedFailures", report.missedFailureCount());
        summary.put("skipped", report.countOf(Verdict.SKIPPED));
        root.put("summary", summary);

        List<Map<String, Object>> units = new ArrayList<>();
        for (UnitResult result : report.results()) {
            Map<String, Object> unit = new LinkedHashMap<>();
            unit.put("suite", result.suiteName());
            unit.put("name", result.name());
            unit.put("kind", result.kind().name());
            unit.put("verdict", result.verdict().name());
            result.reason().ifPresent(reason -> unit.put("reason", reason));
            result.line().ifPresent(line -> unit.put("line", line));
            units.add(unit);
        }
        root.put("results", units);

        return JsonText.encode(root);
    }

    private static String overallStatus(RunReport report) {
        if (report.aborted()) {
            return "ABORTED";
        }
        return report.overallPassed() ? "PASS" : "FAIL";
    }
}
