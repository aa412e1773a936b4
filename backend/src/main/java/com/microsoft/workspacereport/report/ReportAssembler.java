package com.microsoft.workspacereport.report;

import com.microsoft.workspacereport.domain.model.EnrichmentResult;
import com.microsoft.workspacereport.domain.model.ReportRow;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Turns pipeline results into the final row order.
 *
 * Rows are sorted by owner user name, then directory name, both case-insensitive
 * with missing values first. The sort is stable, so rows that tie keep their
 * inventory order.
 */
@Component
@Slf4j
public class ReportAssembler {

    static final Comparator<ReportRow> REPORT_ORDER = Comparator
            .comparing(ReportRow::getUserName, Comparator.nullsFirst(String.CASE_INSENSITIVE_ORDER))
            .thenComparing(ReportRow::getDirectoryName, Comparator.nullsFirst(String.CASE_INSENSITIVE_ORDER));

    public List<ReportRow> assemble(List<EnrichmentResult> results) {
        List<ReportRow> rows = new ArrayList<>(results.size());
        Set<String> seen = new HashSet<>();

        for (EnrichmentResult result : results) {
            ReportRow row = result.succeeded()
                    ? result.row()
                    : ReportRow.failed(result.workspace(), result.failureReason());
            if (!seen.add(row.getWorkspaceId())) {
                throw new IllegalStateException("Duplicate workspace in report: " + row.getWorkspaceId());
            }
            rows.add(row);
        }

        rows.sort(REPORT_ORDER);
        log.debug("Assembled {} report rows", rows.size());
        return rows;
    }
}
