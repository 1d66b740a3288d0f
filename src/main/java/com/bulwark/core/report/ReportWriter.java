package com.bulwark.core.report;

import com.bulwark.core.model.AggregateReport;
import com.bulwark.core.model.ReportSection;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Renders an {@link AggregateReport} as JSON or Markdown and writes it to disk.
 */
@Service
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper objectMapper;

    public ReportWriter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String toJson(AggregateReport report) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report.toMap());
        } catch (JsonProcessingException e) {
            throw new UncheckedIOException("Failed to serialise report", e);
        }
    }

    public String toMarkdown(AggregateReport report) {
        var sb = new StringBuilder();
        sb.append("# Security Audit Report\n\n");
        sb.append("Generated: ").append(report.timestamp()).append("\n\n");
        for (ReportSection section : report.sections()) {
            sb.append("## ").append(section.title()).append("\n\n");
            for (String line : section.lines()) {
                sb.append(line).append('\n');
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    public String render(AggregateReport report, ReportFormat format) {
        return switch (format) {
            case JSON -> toJson(report);
            case MARKDOWN -> toMarkdown(report);
        };
    }

    public void write(AggregateReport report, Path path, ReportFormat format) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, render(report, format), StandardCharsets.UTF_8);
        log.info("Wrote {} report to {}", format.name().toLowerCase(Locale.ROOT), path);
    }
}
