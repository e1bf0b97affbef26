package tech.flowcatalyst.directory.reconcile;

import java.util.List;

/**
 * Outcome of a completed reconciliation batch.
 *
 * @param relation relation that was reconciled
 * @param ownerId id of the owning application
 * @param status status of the last mutation sent, or 204 when no mutation was needed
 * @param edges per-edge results in request order
 */
public record ReconcileReport(Relation relation, String ownerId, int status, List<EdgeResult> edges) {

    static final int NO_CONTENT = 204;

    public ReconcileReport {
        edges = List.copyOf(edges);
    }

    public List<EdgeResult> withOutcome(EdgeOutcome outcome) {
        return edges.stream().filter(e -> e.outcome() == outcome).toList();
    }

    public long mutationsIssued() {
        return edges.stream().filter(EdgeResult::requestIssued).count();
    }
}
