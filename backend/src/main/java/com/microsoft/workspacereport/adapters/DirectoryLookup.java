package com.microsoft.workspacereport.adapters;

import com.microsoft.workspacereport.domain.model.DirectoryComputerInfo;
import com.microsoft.workspacereport.domain.model.DirectoryUserInfo;

import java.util.Optional;

/**
 * Port for the user/computer directory.
 *
 * A missing entry is a normal outcome (owners get removed from the directory
 * while their workspace lives on) and is reported as an empty Optional.
 * Transport and service errors raise
 * {@link com.microsoft.workspacereport.exception.DirectoryQueryFailedException}.
 */
public interface DirectoryLookup {

    /**
     * Resolve a user by account name. The manager reference, when present, is
     * resolved to the manager's display name.
     */
    Optional<DirectoryUserInfo> resolveUser(String samAccountName);

    Optional<DirectoryComputerInfo> resolveComputer(String computerName);
}
