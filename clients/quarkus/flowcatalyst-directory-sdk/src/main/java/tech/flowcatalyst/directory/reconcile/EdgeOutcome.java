package tech.flowcatalyst.directory.reconcile;

/**
 * Terminal state of a single edge operation.
 */
public enum EdgeOutcome {
    /** The directory performed the mutation. */
    APPLIED,
    /** The edge was already in the desired state; no mutation was needed. */
    ALREADY_SATISFIED,
    /** The directory rejected the mutation. */
    FAILED
}
