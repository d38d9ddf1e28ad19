package com.ryuqq.fleet.cli.output;

import com.ryuqq.fleet.application.orchestrator.OperationResult;
import com.ryuqq.fleet.application.orchestrator.RunReport;
import com.ryuqq.fleet.core.model.HostName;
import com.ryuqq.fleet.core.outcome.Fail;
import com.ryuqq.fleet.core.outcome.HostOutcome;
import com.ryuqq.fleet.core.outcome.Skipped;
import com.ryuqq.fleet.core.statemachine.RunState;

import java.io.PrintWriter;
import java.util.Map;

/**
 * 실행 보고서 출력.
 *
 * <p><strong>출력 예시:</strong></p>
 * <pre>
 * --> Install nginx: 2 changed, 1 no change
 *     web2: COMMAND_FAILED Command exited with 100: apt-get install nginx
 * --> Run ABORTED (THRESHOLD_EXCEEDED): 1 operations, failed hosts [web2]
 * </pre>
 *
 * @author Fleet Team
 * @since 1.0.0
 */
public final class ReportPrinter {

    private final PrintWriter out;

    public ReportPrinter(PrintWriter out) {
        if (out == null) {
            throw new IllegalArgumentException("out cannot be null");
        }
        this.out = out;
    }

    /**
     * 보고서 출력.
     *
     * @param report 실행 보고서
     * @param dryRun dry run 여부 (요약 줄에 표시)
     */
    public void print(RunReport report, boolean dryRun) {
        if (report.errorMessage() != null) {
            out.println("--> Deploy evaluation failed: " + report.errorMessage());
        }
        for (OperationResult result : report.operations()) {
            printOperation(result);
        }
        StringBuilder summary = new StringBuilder("--> Run ").append(report.state());
        if (report.state() == RunState.ABORTED) {
            summary.append(" (").append(report.abortReason()).append(')');
        }
        summary.append(": ").append(report.operations().size()).append(" operations");
        if (!report.failedHosts().isEmpty()) {
            summary.append(", failed hosts ").append(report.failedHosts());
        }
        if (dryRun) {
            summary.append(" [dry run]");
        }
        out.println(summary);
        out.flush();
    }

    private void printOperation(OperationResult result) {
        StringBuilder line = new StringBuilder("--> ").append(result.names().display()).append(": ");
        line.append(result.changedCount()).append(" changed, ")
            .append(result.unchangedCount()).append(" no change");
        if (result.failedCount() > 0) {
            line.append(", ").append(result.failedCount()).append(" failed");
        }
        if (result.skippedCount() > 0) {
            line.append(", ").append(result.skippedCount()).append(" skipped");
        }
        out.println(line);
        for (Map.Entry<HostName, HostOutcome> entry : result.outcomes().entrySet()) {
            HostOutcome outcome = entry.getValue();
            if (outcome.isFail()) {
                Fail fail = (Fail) outcome;
                out.println("    " + entry.getKey() + ": " + fail.errorCode() + " " + fail.message());
            } else if (outcome.isSkipped()) {
                out.println("    " + entry.getKey() + ": skipped (" + ((Skipped) outcome).reason() + ")");
            }
        }
    }
}
