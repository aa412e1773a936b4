package com.microsoft.workspacereport.domain.model;

/**
 * Directory attributes of a workspace owner.
 *
 * Only ever built for a user that exists in the directory; a missing user is
 * represented by an empty {@code Optional} at the lookup boundary. Individual
 * attributes are null when the directory entry has no value for them.
 *
 * @param managerDisplayName display name of the manager entry, resolved from the
 *                           manager reference; null when no manager is set
 */
public record DirectoryUserInfo(
        String samAccountName,
        String fullName,
        String department,
        Boolean enabled,
        String email,
        String managerDisplayName,
        String mobilePhone
) {}
