package tech.flowcatalyst.directory.consistency;

import tech.flowcatalyst.directory.odata.ODataErrors;

/**
 * Named consistency retry policies.
 *
 * <p>A policy answers whether a non-success response is a symptom of replication lag in the
 * directory: an object written moments ago that the serving replica has not seen yet.
 * Policies never see success statuses.
 */
public final class ConsistencyRetryPolicies {

    private static final int BAD_REQUEST = 400;
    private static final int NOT_FOUND = 404;

    /**
     * Pure creates: nothing to wait for.
     */
    public static final ResponsePredicate NEVER = ResponsePredicate.never();

    /**
     * Default for object-by-id reads and writes.
     */
    public static final ResponsePredicate RETRY_ON_NOT_FOUND = ResponsePredicate.status(NOT_FOUND);

    /**
     * Application updates: not-found, plus the transient conflict reported while a disabled
     * permission scope or app role is still seen as enabled.
     */
    public static final ResponsePredicate APPLICATION_UPDATE = RETRY_ON_NOT_FOUND.or(
        ResponsePredicate.errorMatches(BAD_REQUEST, ODataErrors.CANNOT_DELETE_OR_UPDATE_ENABLED_ENTITLEMENT));

    private ConsistencyRetryPolicies() {
    }
}
