package tech.flowcatalyst.directory.reconcile;

/**
 * Many-to-many relations of an application that are mutated one {@code $ref} edge at a time.
 */
public enum Relation {

    /**
     * Owner links. Membership is checked per edge.
     */
    OWNERS("owners", Membership.PER_EDGE_LOOKUP),

    /**
     * Assigned token issuance policies. The live set is listed once per batch.
     */
    TOKEN_ISSUANCE_POLICIES("tokenIssuancePolicies", Membership.BULK_LIST);

    /**
     * How current membership of a relation is established.
     */
    public enum Membership {
        PER_EDGE_LOOKUP,
        BULK_LIST
    }

    private final String segment;
    private final Membership membership;

    Relation(String segment, Membership membership) {
        this.segment = segment;
        this.membership = membership;
    }

    /**
     * Navigation property name used in paths, e.g. {@code /applications/{id}/owners/$ref}.
     */
    public String segment() {
        return segment;
    }

    public Membership membership() {
        return membership;
    }
}
