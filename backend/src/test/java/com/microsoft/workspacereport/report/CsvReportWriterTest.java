package com.microsoft.workspacereport.report;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.microsoft.workspacereport.config.ReportProperties;
import com.microsoft.workspacereport.domain.model.ActivityVerdict;
import com.microsoft.workspacereport.domain.model.ConnectionStatus;
import com.microsoft.workspacereport.domain.model.DirectoryUserInfo;
import com.microsoft.workspacereport.domain.model.ReportRow;
import com.microsoft.workspacereport.domain.model.SubnetInfo;
import com.microsoft.workspacereport.domain.model.SupportedRegion;
import com.microsoft.workspacereport.domain.model.WorkspaceReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;
import java.util.Map;

import static com.microsoft.workspacereport.TestWorkspaces.NOW;
import static com.microsoft.workspacereport.TestWorkspaces.WINDOW;
import static com.microsoft.workspacereport.TestWorkspaces.workspace;
import static org.assertj.core.api.Assertions.assertThat;

class CsvReportWriterTest {

    @TempDir
    Path tempDir;

    private Path outputDirectory;
    private CsvReportWriter writer;

    @BeforeEach
    void setUp() {
        outputDirectory = tempDir.resolve("reports").resolve("nested");
        ReportProperties properties = new ReportProperties();
        properties.setOutputDirectory(outputDirectory);
        writer = new CsvReportWriter(properties);
    }

    @Test
    @DisplayName("Writes a header and one line per row into a newly created directory")
    void writesReport() throws IOException {
        ReportRow enriched = ReportRow.builder()
                .workspace(workspace("ws-1", "alice"))
                .user(new DirectoryUserInfo("alice", "Alice", "Finance", true, "alice@example.com", null, null))
                .connection(new ConnectionStatus("CONNECTED", Instant.parse("2026-10-01T11:00:00Z"), null))
                .subnet(new SubnetInfo("subnet-0a1b2c", "prod-a", "us-east-1a", "use1-az2", 187))
                .activity(new ActivityVerdict(true, WINDOW, 0, null))
                .directoryName("corp.example.com")
                .bundleName("Standard")
                .tags(Map.of("Team", "infra", "Owner", "ops"))
                .build();
        ReportRow failed = ReportRow.failed(workspace("ws-2", "bob"), "MetricsQueryFailedException: boom");

        Path written = writer.write(report(List.of(enriched, failed)));

        assertThat(written).exists().hasParent(outputDirectory);
        assertThat(written.getFileName().toString()).isEqualTo("WorkSpacesReport_us-east-1_20261001-120000.csv");

        List<String> lines = Files.readAllLines(written, StandardCharsets.UTF_8);
        assertThat(lines).hasSize(3);
        assertThat(lines.get(0).split(",")).startsWith("UserName", "FullName", "Department")
                .contains("WorkspaceId", "UnusedForPeriod", "SubnetName", "Tags")
                .endsWith("Region", "Tags", "EnrichmentError")
                .hasSize(36);

        List<Map<String, String>> records = read(written);
        Map<String, String> first = records.get(0);
        assertThat(first)
                .containsEntry("UserName", "alice")
                .containsEntry("FullName", "Alice")
                .containsEntry("Manager", "")
                .containsEntry("ComputerCreated", "")
                .containsEntry("ConnectionState", "CONNECTED")
                .containsEntry("StateCheckTimestamp", "2026-10-01T11:00:00Z")
                .containsEntry("LastConnectionTimestamp", "")
                .containsEntry("UnusedForPeriod", "true")
                .containsEntry("SubnetName", "prod-a")
                .containsEntry("SubnetAvailableIps", "187")
                .containsEntry("RootVolumeEncrypted", "true")
                .containsEntry("UserVolumeSizeGib", "50")
                .containsEntry("Region", "us-east-1")
                .containsEntry("Tags", "Owner:ops;Team:infra")
                .containsEntry("EnrichmentError", "");

        Map<String, String> second = records.get(1);
        assertThat(second)
                .containsEntry("WorkspaceId", "ws-2")
                .containsEntry("FullName", "")
                .containsEntry("UnusedForPeriod", "")
                .containsEntry("EnrichmentError", "MetricsQueryFailedException: boom");
    }

    private static WorkspaceReport report(List<ReportRow> rows) {
        return new WorkspaceReport(SupportedRegion.US_EAST_1, WINDOW, NOW, rows);
    }

    private static List<Map<String, String>> read(Path file) throws IOException {
        CsvMapper mapper = new CsvMapper();
        try (MappingIterator<Map<String, String>> it = mapper.readerFor(Map.class)
                .with(CsvSchema.emptySchema().withHeader())
                .readValues(file.toFile())) {
            return it.readAll();
        }
    }
}
