package com.microsoft.workspacereport.enrichment;

import com.microsoft.workspacereport.domain.model.EnrichmentResult;
import com.microsoft.workspacereport.domain.model.FailurePolicy;
import com.microsoft.workspacereport.domain.model.ReportRow;
import com.microsoft.workspacereport.domain.model.WorkspaceRecord;
import com.microsoft.workspacereport.exception.EnrichmentAbortedException;
import com.microsoft.workspacereport.exception.MetricsQueryFailedException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.stream.IntStream;

import static com.microsoft.workspacereport.TestWorkspaces.WINDOW;
import static com.microsoft.workspacereport.TestWorkspaces.workspace;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for EnrichmentPipeline.
 *
 * Test strategy:
 * 1. One result per inventory entry, positioned by inventory order
 * 2. Abort policy stops at the first failed workspace and reports progress
 * 3. Isolate policy records failures as marked results and keeps going
 */
@ExtendWith(MockitoExtension.class)
class EnrichmentPipelineTest {

    @Mock
    private WorkspaceEnricher enricher;

    @InjectMocks
    private EnrichmentPipeline pipeline;

    private final List<WorkspaceRecord> inventory = IntStream.rangeClosed(1, 5)
            .mapToObj(i -> workspace("ws-" + i, "user" + i))
            .toList();

    @Test
    @DisplayName("Every inventory entry yields exactly one result, in inventory order")
    void oneResultPerWorkspace() {
        // Given
        when(enricher.enrich(any(), eq(WINDOW)))
                .thenAnswer(invocation -> enriched(invocation.getArgument(0)));

        // When
        List<EnrichmentResult> results = pipeline.run(inventory, WINDOW, FailurePolicy.ABORT_RUN);

        // Then
        assertThat(results).hasSize(5).allMatch(EnrichmentResult::succeeded);
        assertThat(results).extracting(result -> result.workspace().workspaceId())
                .containsExactly("ws-1", "ws-2", "ws-3", "ws-4", "ws-5");
        assertThat(results).extracting(EnrichmentResult::position).containsExactly(0, 1, 2, 3, 4);
    }

    @Test
    @DisplayName("Empty inventory gives an empty result")
    void emptyInventory() {
        // When
        List<EnrichmentResult> results = pipeline.run(List.of(), WINDOW, FailurePolicy.ISOLATE_RESOURCE);

        // Then
        assertThat(results).isEmpty();
    }

    @Nested
    @DisplayName("Abort run policy")
    class AbortPolicyTests {

        @Test
        @DisplayName("Failure on the third of five workspaces stops the run")
        void abortsRemainingEnumeration() {
            // Given
            when(enricher.enrich(any(), eq(WINDOW))).thenAnswer(invocation -> {
                WorkspaceRecord ws = invocation.getArgument(0);
                if (ws.workspaceId().equals("ws-3")) {
                    throw new MetricsQueryFailedException("ws-3", new RuntimeException("Rate exceeded"));
                }
                return enriched(ws);
            });

            // When / Then
            assertThatThrownBy(() -> pipeline.run(inventory, WINDOW, FailurePolicy.ABORT_RUN))
                    .isInstanceOfSatisfying(EnrichmentAbortedException.class, aborted -> {
                        assertThat(aborted.getWorkspaceId()).isEqualTo("ws-3");
                        assertThat(aborted.getCompletedRows()).isEqualTo(2);
                        assertThat(aborted.getInventorySize()).isEqualTo(5);
                        assertThat(aborted.getCause()).isInstanceOf(MetricsQueryFailedException.class);
                    });

            verify(enricher, never()).enrich(eq(inventory.get(3)), any());
            verify(enricher, never()).enrich(eq(inventory.get(4)), any());
        }
    }

    @Nested
    @DisplayName("Isolate resource policy")
    class IsolatePolicyTests {

        @Test
        @DisplayName("Single failure is recorded and the run continues")
        void isolatesSingleFailure() {
            // Given
            when(enricher.enrich(any(), eq(WINDOW))).thenAnswer(invocation -> {
                WorkspaceRecord ws = invocation.getArgument(0);
                if (ws.workspaceId().equals("ws-3")) {
                    throw new MetricsQueryFailedException("ws-3", new RuntimeException("Rate exceeded"));
                }
                return enriched(ws);
            });

            // When
            List<EnrichmentResult> results = pipeline.run(inventory, WINDOW, FailurePolicy.ISOLATE_RESOURCE);

            // Then
            assertThat(results).hasSize(5);
            assertThat(results).filteredOn(EnrichmentResult::succeeded).hasSize(4);
            EnrichmentResult failed = results.get(2);
            assertThat(failed.succeeded()).isFalse();
            assertThat(failed.workspace().workspaceId()).isEqualTo("ws-3");
            assertThat(failed.failureReason())
                    .startsWith("MetricsQueryFailedException: ")
                    .contains("Rate exceeded");
        }

        @Test
        @DisplayName("Metrics outage from the third workspace on leaves two enriched and three marked rows")
        void isolatesOutage() {
            // Given
            when(enricher.enrich(any(), eq(WINDOW))).thenAnswer(invocation -> {
                WorkspaceRecord ws = invocation.getArgument(0);
                if (inventory.indexOf(ws) >= 2) {
                    throw new MetricsQueryFailedException(ws.workspaceId(), new RuntimeException("Service unavailable"));
                }
                return enriched(ws);
            });

            // When
            List<EnrichmentResult> results = pipeline.run(inventory, WINDOW, FailurePolicy.ISOLATE_RESOURCE);

            // Then
            assertThat(results).hasSize(5);
            assertThat(results).extracting(EnrichmentResult::succeeded)
                    .containsExactly(true, true, false, false, false);
        }
    }

    private static ReportRow enriched(WorkspaceRecord workspace) {
        return ReportRow.builder().workspace(workspace).build();
    }
}
