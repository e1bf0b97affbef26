package tech.flowcatalyst.directory.exception;

import tech.flowcatalyst.directory.reconcile.EdgeResult;
import tech.flowcatalyst.directory.reconcile.Relation;

import java.util.List;

/**
 * Exception thrown when a reconciliation batch stops at an edge the directory rejected.
 *
 * <p>Edges processed before the failing one are not rolled back; they are listed in
 * {@link #getCompletedEdges()}. Status code and OData error are those of the failing edge.
 */
public class ReconcileException extends DirectoryException {

    private final Relation relation;
    private final String ownerId;
    private final EdgeResult failedEdge;
    private final List<EdgeResult> completedEdges;

    public ReconcileException(Relation relation, String ownerId, EdgeResult failedEdge,
                              List<EdgeResult> completedEdges, DirectoryException cause) {
        super("Reconciling " + relation.segment() + " of " + ownerId + " failed at " + failedEdge.targetId()
                + " after " + completedEdges.size() + " edge(s): " + cause.getMessage(),
            cause.getStatusCode(), cause, cause.getError().orElse(null));
        this.relation = relation;
        this.ownerId = ownerId;
        this.failedEdge = failedEdge;
        this.completedEdges = List.copyOf(completedEdges);
    }

    public Relation getRelation() {
        return relation;
    }

    public String getOwnerId() {
        return ownerId;
    }

    public EdgeResult getFailedEdge() {
        return failedEdge;
    }

    public List<EdgeResult> getCompletedEdges() {
        return completedEdges;
    }
}
