package com.microsoft.workspacereport.service;

import com.microsoft.workspacereport.adapters.WorkspaceInventory;
import com.microsoft.workspacereport.domain.model.ActivityWindow;
import com.microsoft.workspacereport.domain.model.EnrichmentResult;
import com.microsoft.workspacereport.domain.model.FailurePolicy;
import com.microsoft.workspacereport.domain.model.ReportRow;
import com.microsoft.workspacereport.domain.model.SupportedRegion;
import com.microsoft.workspacereport.domain.model.WorkspaceRecord;
import com.microsoft.workspacereport.domain.model.WorkspaceReport;
import com.microsoft.workspacereport.enrichment.EnrichmentPipeline;
import com.microsoft.workspacereport.exception.InventoryUnavailableException;
import com.microsoft.workspacereport.report.ReportAssembler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.ZoneOffset;
import java.util.List;

import static com.microsoft.workspacereport.TestWorkspaces.NOW;
import static com.microsoft.workspacereport.TestWorkspaces.row;
import static com.microsoft.workspacereport.TestWorkspaces.workspace;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class WorkspaceReportServiceTest {

    @Mock
    private WorkspaceInventory inventory;

    @Mock
    private EnrichmentPipeline pipeline;

    private WorkspaceReportService service;

    @BeforeEach
    void setUp() {
        service = new WorkspaceReportService(
                inventory, pipeline, new ReportAssembler(), Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    @DisplayName("Report covers the inventory with a trailing window ending now")
    void generatesReport() {
        List<WorkspaceRecord> workspaces = List.of(workspace("ws-1", "bob"), workspace("ws-2", "alice"));
        ActivityWindow expectedWindow = ActivityWindow.trailingDays(NOW, 90);
        when(inventory.listWorkspaces("eu-west-1")).thenReturn(workspaces);
        when(pipeline.run(workspaces, expectedWindow, FailurePolicy.ISOLATE_RESOURCE)).thenReturn(List.of(
                EnrichmentResult.success(0, row("ws-1", "bob", "corp")),
                EnrichmentResult.success(1, row("ws-2", "alice", "corp"))));

        WorkspaceReport report = service.generateReport(SupportedRegion.EU_WEST_1, 90, FailurePolicy.ISOLATE_RESOURCE);

        assertThat(report.region()).isEqualTo(SupportedRegion.EU_WEST_1);
        assertThat(report.window()).isEqualTo(expectedWindow);
        assertThat(report.generatedAt()).isEqualTo(NOW);
        assertThat(report.rows()).extracting(ReportRow::getWorkspaceId).containsExactly("ws-2", "ws-1");
        assertThat(report.failedCount()).isZero();
    }

    @Test
    @DisplayName("Inventory failure ends the run before any enrichment")
    void inventoryUnavailable() {
        when(inventory.listWorkspaces(any()))
                .thenThrow(new InventoryUnavailableException("us-east-1", new RuntimeException("AccessDenied")));

        assertThatThrownBy(() -> service.generateReport(SupportedRegion.US_EAST_1, 30, FailurePolicy.ABORT_RUN))
                .isInstanceOf(InventoryUnavailableException.class);
        verifyNoInteractions(pipeline);
    }
}
