package tech.flowcatalyst.directory.consistency;

import tech.flowcatalyst.directory.odata.ODataErrors;

/**
 * Named outcome classifiers.
 *
 * <p>A classifier is consulted for statuses outside an operation's valid set; when it accepts,
 * the response counts as success because the desired end state already holds.
 */
public final class OutcomeClassifiers {

    private static final int BAD_REQUEST = 400;
    private static final int NOT_FOUND = 404;

    public static final ResponsePredicate NONE = ResponsePredicate.never();

    /**
     * Adding an edge that is already present.
     */
    public static final ResponsePredicate REFERENCE_ALREADY_EXISTS =
        ResponsePredicate.errorMatches(BAD_REQUEST, ODataErrors.ADDED_OBJECT_REFERENCES_ALREADY_EXIST);

    /**
     * Removing an edge the directory reports as absent.
     */
    public static final ResponsePredicate REFERENCE_DOES_NOT_EXIST =
        ResponsePredicate.errorMatches(BAD_REQUEST, ODataErrors.REMOVED_OBJECT_REFERENCES_DO_NOT_EXIST);

    /**
     * Removing an edge whose target resource is gone.
     */
    public static final ResponsePredicate RESOURCE_DOES_NOT_EXIST =
        ResponsePredicate.errorMatches(NOT_FOUND, ODataErrors.RESOURCE_DOES_NOT_EXIST);

    /**
     * Either form of "already removed".
     */
    public static final ResponsePredicate EDGE_ALREADY_REMOVED = REFERENCE_DOES_NOT_EXIST.or(RESOURCE_DOES_NOT_EXIST);

    private OutcomeClassifiers() {
    }
}
