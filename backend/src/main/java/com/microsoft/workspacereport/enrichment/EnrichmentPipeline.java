package com.microsoft.workspacereport.enrichment;

import com.microsoft.workspacereport.domain.model.ActivityWindow;
import com.microsoft.workspacereport.domain.model.EnrichmentResult;
import com.microsoft.workspacereport.domain.model.FailurePolicy;
import com.microsoft.workspacereport.domain.model.ReportRow;
import com.microsoft.workspacereport.domain.model.WorkspaceRecord;
import com.microsoft.workspacereport.exception.EnrichmentAbortedException;
import com.microsoft.workspacereport.exception.LookupFailedException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Arrays;
import java.util.List;

/**
 * Enriches an inventory in order, one workspace at a time.
 *
 * Results are stored by inventory position, so the returned list lines up
 * with the inventory regardless of how the lookups were scheduled.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class EnrichmentPipeline {

    private final WorkspaceEnricher enricher;

    /**
     * @return one result per inventory entry, in inventory order
     * @throws EnrichmentAbortedException under {@link FailurePolicy#ABORT_RUN}
     *         at the first workspace whose lookups fail
     */
    public List<EnrichmentResult> run(List<WorkspaceRecord> inventory,
                                      ActivityWindow window,
                                      FailurePolicy policy) {
        int total = inventory.size();
        EnrichmentResult[] slots = new EnrichmentResult[total];

        for (int position = 0; position < total; position++) {
            WorkspaceRecord workspace = inventory.get(position);
            try {
                ReportRow row = enricher.enrich(workspace, window);
                slots[position] = EnrichmentResult.success(position, row);
            } catch (LookupFailedException e) {
                if (policy == FailurePolicy.ABORT_RUN) {
                    throw new EnrichmentAbortedException(workspace.workspaceId(), position, total, e);
                }
                log.warn("Enrichment failed for workspace {} ({}): {}",
                        workspace.workspaceId(), e.getItem(), e.getMessage());
                slots[position] = EnrichmentResult.failed(position, workspace, describe(e));
            }

            log.info("Processed {} ({}), {} remaining",
                    workspace.workspaceId(), workspace.userName(), total - position - 1);
        }

        return Arrays.asList(slots);
    }

    static String describe(LookupFailedException e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }
}
