package com.example.AssessRec.evaluation;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

@Component
public class EvaluationReportWriter {

    private static final Logger log = LoggerFactory.getLogger(EvaluationReportWriter.class);

    private static final String RULE = "=".repeat(80);
    private static final String THIN_RULE = "-".repeat(80);

    public String render(MeanRecallReport report) {
        StringBuilder sb = new StringBuilder();
        sb.append(RULE).append('\n');
        sb.append("ASSESSMENT RECOMMENDATION SYSTEM - EVALUATION REPORT\n");
        sb.append("Mean Recall@K Metric\n");
        sb.append(RULE).append("\n\n");

        sb.append("SUMMARY\n").append(THIN_RULE).append('\n');
        sb.append("Queries Evaluated: ").append(report.queriesEvaluated()).append("\n\n");
        report.summary().forEach((k, s) -> {
            sb.append("recall@").append(k).append(":\n");
            sb.append("  Mean:  ").append(fmt(s.mean())).append('\n');
            sb.append("  Std:   ").append(fmt(s.std())).append('\n');
            sb.append("  Min:   ").append(fmt(s.min())).append('\n');
            sb.append("  Max:   ").append(fmt(s.max())).append("\n\n");
        });
        if (!report.skippedQueries().isEmpty()) {
            sb.append("Skipped (no predictions): ").append(report.skippedQueries().size()).append("\n\n");
        }

        sb.append("\nPER-QUERY RESULTS\n").append(THIN_RULE).append('\n');
        report.perQueryRecall().forEach((query, recalls) -> {
            sb.append(query).append(":\n");
            recalls.forEach((k, v) -> sb.append("  recall@").append(k).append(": ").append(fmt(v)).append('\n'));
        });
        sb.append('\n').append(RULE).append('\n');
        return sb.toString();
    }

    public Path write(Path file, MeanRecallReport report) {
        try {
            if (file.getParent() != null) {
                Files.createDirectories(file.getParent());
            }
            Files.writeString(file, render(report), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write evaluation report to " + file, e);
        }
        log.info("Saved evaluation report to {}", file);
        return file;
    }

    private static String fmt(double value) {
        return String.format(Locale.US, "%.4f", value);
    }
}
