package com.microsoft.workspacereport.exception;

/**
 * A remote lookup made while enriching one workspace failed at the transport or service level.
 *
 * This never means "not found"; lookups that can legitimately miss return an empty result.
 */
public abstract class LookupFailedException extends WorkspaceReportException {

    private final String item;

    protected LookupFailedException(String item, String message, Throwable cause) {
        super(message, cause);
        this.item = item;
    }

    /**
     * Identifier of the thing being looked up (workspace, user, computer, subnet...).
     */
    public String getItem() {
        return item;
    }
}
