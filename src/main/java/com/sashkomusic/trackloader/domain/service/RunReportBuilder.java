package com.sashkomusic.trackloader.domain.service;

import com.sashkomusic.trackloader.domain.model.RunStatistics;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class RunReportBuilder {

    private static final String SEPARATOR = "=".repeat(60);

    public String build(RunStatistics stats) {
        StringBuilder report = new StringBuilder();
        report.append(SEPARATOR).append(System.lineSeparator());

        if (stats.getTotal() == 0) {
            report.append("Nothing to do: no tracks found at the source URL").append(System.lineSeparator());
            report.append(SEPARATOR);
            return report.toString();
        }

        report.append("Download Summary:").append(System.lineSeparator());
        report.append(String.format("Total: %d | Success: %d | Failed: %d | Cancelled: %d",
                stats.getTotal(), stats.getSucceeded(), stats.getFailed(), stats.getCancelled()));
        if (stats.getAlreadyPresent() > 0) {
            report.append(String.format(" (already present: %d)", stats.getAlreadyPresent()));
        }
        report.append(System.lineSeparator());

        appendSection(report, "Failed tracks:", stats.getFailedTracks());
        appendSection(report, "Cancelled tracks:", stats.getCancelledTracks());

        report.append(SEPARATOR);
        return report.toString();
    }

    private void appendSection(StringBuilder report, String heading, List<String> labels) {
        if (labels.isEmpty()) {
            return;
        }
        report.append(System.lineSeparator()).append(heading).append(System.lineSeparator());
        for (String label : labels) {
            report.append("  - ").append(label).append(System.lineSeparator());
        }
    }
}
