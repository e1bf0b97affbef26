package tech.flowcatalyst.directory.reconcile;

/**
 * Result of reconciling one edge.
 *
 * @param targetId id of the object at the far end of the edge
 * @param outcome terminal state
 * @param status HTTP status of the mutation, or 0 when none was sent
 * @param requestIssued whether a mutating request was sent for this edge
 */
public record EdgeResult(String targetId, EdgeOutcome outcome, int status, boolean requestIssued) {

    static EdgeResult applied(String targetId, int status) {
        return new EdgeResult(targetId, EdgeOutcome.APPLIED, status, true);
    }

    static EdgeResult classified(String targetId, int status) {
        return new EdgeResult(targetId, EdgeOutcome.ALREADY_SATISFIED, status, true);
    }

    static EdgeResult skipped(String targetId) {
        return new EdgeResult(targetId, EdgeOutcome.ALREADY_SATISFIED, 0, false);
    }

    static EdgeResult failed(String targetId, int status) {
        return new EdgeResult(targetId, EdgeOutcome.FAILED, status, true);
    }
}
