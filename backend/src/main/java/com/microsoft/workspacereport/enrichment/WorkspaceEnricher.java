package com.microsoft.workspacereport.enrichment;

import com.microsoft.workspacereport.activity.MetricActivityClassifier;
import com.microsoft.workspacereport.adapters.DirectoryLookup;
import com.microsoft.workspacereport.adapters.NetworkTopologyLookup;
import com.microsoft.workspacereport.adapters.WorkspaceDetailsLookup;
import com.microsoft.workspacereport.config.ReportProperties;
import com.microsoft.workspacereport.domain.model.ActivityVerdict;
import com.microsoft.workspacereport.domain.model.ActivityWindow;
import com.microsoft.workspacereport.domain.model.ConnectionStatus;
import com.microsoft.workspacereport.domain.model.DirectoryComputerInfo;
import com.microsoft.workspacereport.domain.model.DirectoryUserInfo;
import com.microsoft.workspacereport.domain.model.ReportRow;
import com.microsoft.workspacereport.domain.model.SubnetInfo;
import com.microsoft.workspacereport.domain.model.WorkspaceRecord;
import com.microsoft.workspacereport.exception.LookupFailedException;
import com.microsoft.workspacereport.exception.LookupTimeoutException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Joins one inventory record with everything the other services know about it.
 *
 * The lookups are independent of each other and run on the lookup pool; each
 * fills a disjoint part of the row, which is only built once all of them
 * completed. The manager name depends on the user entry and is resolved inside
 * the directory lookup.
 *
 * TIMEOUTS:
 * When the lookups of a workspace fail or outlive {@code report.lookup-timeout}
 * the remaining ones are cancelled with interruption, so a hung call does not
 * keep its pool thread from the next workspace. Calls blocked in socket reads
 * that ignore interruption are bounded by the client timeouts instead
 * ({@code report.aws-call-timeout}, the JNDI read timeout).
 */
@Service
@Slf4j
public class WorkspaceEnricher {

    private final DirectoryLookup directoryLookup;
    private final WorkspaceDetailsLookup detailsLookup;
    private final NetworkTopologyLookup topologyLookup;
    private final MetricActivityClassifier activityClassifier;
    private final ExecutorService lookupExecutor;
    private final Duration lookupTimeout;

    public WorkspaceEnricher(DirectoryLookup directoryLookup,
                             WorkspaceDetailsLookup detailsLookup,
                             NetworkTopologyLookup topologyLookup,
                             MetricActivityClassifier activityClassifier,
                             @Qualifier("lookupExecutor") ExecutorService lookupExecutor,
                             ReportProperties properties) {
        this.directoryLookup = directoryLookup;
        this.detailsLookup = detailsLookup;
        this.topologyLookup = topologyLookup;
        this.activityClassifier = activityClassifier;
        this.lookupExecutor = lookupExecutor;
        this.lookupTimeout = properties.getLookupTimeout();
    }

    /**
     * @throws LookupFailedException if any lookup fails or the lookups time out
     */
    public ReportRow enrich(WorkspaceRecord workspace, ActivityWindow window) {
        String workspaceId = workspace.workspaceId();

        Future<Optional<DirectoryUserInfo>> user =
                submit(() -> directoryLookup.resolveUser(workspace.userName()));
        Future<Optional<DirectoryComputerInfo>> computer =
                submit(() -> directoryLookup.resolveComputer(workspace.computerName()));
        Future<ConnectionStatus> connection =
                submit(() -> detailsLookup.fetchConnectionStatus(workspaceId));
        Future<SubnetInfo> subnet = workspace.subnetId() == null
                ? CompletableFuture.completedFuture(null)
                : submit(() -> topologyLookup.resolveSubnet(workspace.subnetId()));
        Future<ActivityVerdict> activity =
                submit(() -> activityClassifier.classify(workspaceId, window));
        Future<Map<String, String>> tags =
                submit(() -> detailsLookup.fetchTags(workspaceId));
        Future<String> directoryName = workspace.directoryId() == null
                ? CompletableFuture.completedFuture(null)
                : submit(() -> detailsLookup.resolveDirectoryName(workspace.directoryId()));
        Future<String> bundleName = workspace.bundleId() == null
                ? CompletableFuture.completedFuture(null)
                : submit(() -> detailsLookup.resolveBundleName(workspace.bundleId()));

        await(workspaceId, List.of(user, computer, connection, subnet, activity, tags, directoryName, bundleName));

        return ReportRow.builder()
                .workspace(workspace)
                .user(completed(user).orElse(null))
                .computer(completed(computer).orElse(null))
                .connection(completed(connection))
                .subnet(completed(subnet))
                .activity(completed(activity))
                .tags(completed(tags))
                .directoryName(completed(directoryName))
                .bundleName(completed(bundleName))
                .build();
    }

    private <T> Future<T> submit(Callable<T> lookup) {
        return lookupExecutor.submit(lookup);
    }

    private void await(String workspaceId, List<Future<?>> lookups) {
        long deadline = System.nanoTime() + lookupTimeout.toNanos();
        try {
            for (Future<?> lookup : lookups) {
                lookup.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            }
        } catch (ExecutionException e) {
            cancel(lookups);
            throw rethrow(e.getCause());
        } catch (TimeoutException e) {
            cancel(lookups);
            log.debug("Lookups for {} exceeded {}, cancelling", workspaceId, lookupTimeout);
            throw new LookupTimeoutException(workspaceId, lookupTimeout);
        } catch (InterruptedException e) {
            cancel(lookups);
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while enriching " + workspaceId, e);
        }
    }

    // Only called once await() has seen every lookup finish
    private static <T> T completed(Future<T> lookup) {
        try {
            return lookup.get();
        } catch (ExecutionException e) {
            throw rethrow(e.getCause());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while reading a completed lookup", e);
        }
    }

    private static RuntimeException rethrow(Throwable cause) {
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return new IllegalStateException("Unexpected lookup failure", cause);
    }

    private static void cancel(List<Future<?>> lookups) {
        for (Future<?> lookup : lookups) {
            lookup.cancel(true);
        }
    }
}
