package com.microsoft.workspacereport.report;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.microsoft.workspacereport.config.ReportProperties;
import com.microsoft.workspacereport.domain.model.WorkspaceReport;
import com.microsoft.workspacereport.exception.ReportWriteException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

/**
 * Writes the report as a CSV file with a header row, one line per workspace.
 *
 * File name: {@code WorkSpacesReport_<region>_<yyyyMMdd-HHmmss>.csv} (UTC),
 * inside the configured output directory, which is created if missing.
 */
@Component
@Slf4j
public class CsvReportWriter implements ReportSink {

    private static final DateTimeFormatter FILE_TIMESTAMP =
            DateTimeFormatter.ofPattern("yyyyMMdd-HHmmss").withZone(ZoneOffset.UTC);

    private final CsvMapper csvMapper = new CsvMapper();
    private final CsvSchema schema = csvMapper.schemaFor(CsvReportLine.class).withHeader();
    private final Path outputDirectory;

    public CsvReportWriter(ReportProperties properties) {
        this.outputDirectory = properties.getOutputDirectory();
    }

    @Override
    public Path write(WorkspaceReport report) {
        Path target = outputDirectory.resolve(fileName(report));

        try {
            Files.createDirectories(outputDirectory);
            try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
                 SequenceWriter lines = csvMapper.writer(schema).writeValues(out)) {
                for (var row : report.rows()) {
                    lines.write(CsvReportLine.from(row));
                }
            }
        } catch (IOException e) {
            throw new ReportWriteException(target, e);
        }

        log.info("Wrote {} rows to {}", report.rows().size(), target);
        return target;
    }

    static String fileName(WorkspaceReport report) {
        return "WorkSpacesReport_" + report.region().getCode() + "_"
                + FILE_TIMESTAMP.format(report.generatedAt()) + ".csv";
    }
}
