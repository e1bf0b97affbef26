package tech.flowcatalyst.directory.reconcile;

import org.jboss.logging.Logger;
import tech.flowcatalyst.directory.client.DirectoryResponse;
import tech.flowcatalyst.directory.dto.DirectoryObjectRef;
import tech.flowcatalyst.directory.exception.DirectoryException;
import tech.flowcatalyst.directory.exception.PreconditionException;
import tech.flowcatalyst.directory.exception.ReconcileException;
import tech.flowcatalyst.directory.exception.RequestCancelledException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Adds and removes relationship edges one at a time, in caller order.
 *
 * <p>The directory has no multi-edge transaction, so a batch stops at the first edge it
 * rejects and throws {@link ReconcileException}; edges applied before it stay applied.
 * Edges already in the desired state are reported as {@link EdgeOutcome#ALREADY_SATISFIED},
 * whether that was known before the call (live set, membership check) or learned from the
 * directory's answer (outcome classifier).
 *
 * <p>Edges of one batch are never mutated concurrently. The reconciler holds no state between
 * calls and may be shared.
 */
public class RelationshipReconciler {

    private static final Logger LOG = Logger.getLogger(RelationshipReconciler.class);

    private final EdgeOperations operations;

    public RelationshipReconciler(EdgeOperations operations) {
        this.operations = operations;
    }

    /**
     * Ensure every target in {@code desired} is linked to {@code ownerId}.
     *
     * <p>For bulk-listable relations the live set is fetched once and present targets are
     * skipped. Otherwise every target is posted and a duplicate is classified by the directory's
     * "already exists" answer.
     *
     * <p>A reference needs an {@code id} or an {@code @odata.id}; when only the latter is given,
     * the id is its last path segment.
     */
    public ReconcileReport addEdges(String ownerId, Relation relation, Collection<DirectoryObjectRef> desired) {
        requireOwner("addEdges", ownerId, relation);
        if (desired == null) {
            throw PreconditionException.missingArgument("addEdges", relation.segment());
        }
        Map<String, DirectoryObjectRef> targets = distinctById(desired, relation);

        Set<String> live = relation.membership() == Relation.Membership.BULK_LIST
            ? operations.listTargetIds(ownerId, relation)
            : Set.of();

        List<EdgeResult> results = new ArrayList<>(targets.size());
        int status = ReconcileReport.NO_CONTENT;

        for (DirectoryObjectRef target : targets.values()) {
            if (live.contains(target.id())) {
                results.add(EdgeResult.skipped(target.id()));
                continue;
            }
            DirectoryResponse response;
            try {
                response = operations.addEdge(ownerId, relation, target);
            } catch (RequestCancelledException e) {
                throw e;
            } catch (DirectoryException e) {
                throw failure(ownerId, relation, target.id(), results, e);
            }
            status = response.status();
            results.add(response.classified()
                ? EdgeResult.classified(target.id(), status)
                : EdgeResult.applied(target.id(), status));
        }

        return report(ownerId, relation, status, results);
    }

    /**
     * Ensure none of {@code targetIds} is linked to {@code ownerId}.
     *
     * <p>Ids that are not currently linked are skipped without a mutation: bulk-listable
     * relations are checked against a single listing, others with a per-edge lookup that
     * short-circuits the delete once not-found outlasts its consistency retries. A delete that still finds the edge gone is
     * classified as already satisfied.
     */
    public ReconcileReport removeEdges(String ownerId, Relation relation, Collection<String> targetIds) {
        requireOwner("removeEdges", ownerId, relation);
        if (targetIds == null) {
            throw PreconditionException.missingArgument("removeEdges", relation.segment() + " ids");
        }
        Set<String> ids = new LinkedHashSet<>();
        for (String id : targetIds) {
            if (id == null || id.isBlank()) {
                throw PreconditionException.missingArgument("removeEdges", relation.segment() + " id");
            }
            ids.add(id);
        }

        boolean bulk = relation.membership() == Relation.Membership.BULK_LIST;
        Set<String> live = bulk ? operations.listTargetIds(ownerId, relation) : Set.of();
        if (bulk && live.isEmpty()) {
            List<EdgeResult> results = ids.stream().map(EdgeResult::skipped).toList();
            return report(ownerId, relation, ReconcileReport.NO_CONTENT, results);
        }

        List<EdgeResult> results = new ArrayList<>(ids.size());
        int status = ReconcileReport.NO_CONTENT;

        for (String id : ids) {
            boolean linked = bulk ? live.contains(id) : operations.hasEdge(ownerId, relation, id);
            if (!linked) {
                results.add(EdgeResult.skipped(id));
                continue;
            }
            DirectoryResponse response;
            try {
                response = operations.removeEdge(ownerId, relation, id);
            } catch (RequestCancelledException e) {
                throw e;
            } catch (DirectoryException e) {
                throw failure(ownerId, relation, id, results, e);
            }
            status = response.status();
            results.add(response.classified()
                ? EdgeResult.classified(id, status)
                : EdgeResult.applied(id, status));
        }

        return report(ownerId, relation, status, results);
    }

    private static void requireOwner(String operation, String ownerId, Relation relation) {
        if (relation == null) {
            throw PreconditionException.missingArgument(operation, "relation");
        }
        if (ownerId == null || ownerId.isBlank()) {
            throw PreconditionException.nullId(operation, "application");
        }
    }

    private static Map<String, DirectoryObjectRef> distinctById(Collection<DirectoryObjectRef> refs, Relation relation) {
        Map<String, DirectoryObjectRef> byId = new LinkedHashMap<>();
        for (DirectoryObjectRef ref : refs) {
            DirectoryObjectRef resolved = withId(ref);
            if (resolved == null) {
                throw PreconditionException.missingArgument("addEdges", relation.segment() + " reference id");
            }
            byId.putIfAbsent(resolved.id(), resolved);
        }
        return byId;
    }

    private static DirectoryObjectRef withId(DirectoryObjectRef ref) {
        if (ref == null) {
            return null;
        }
        if (ref.id() != null && !ref.id().isBlank()) {
            return ref;
        }
        if (ref.odataId() == null || ref.odataId().isBlank()) {
            return null;
        }
        String odataId = ref.odataId().strip();
        while (odataId.endsWith("/")) {
            odataId = odataId.substring(0, odataId.length() - 1);
        }
        String id = odataId.substring(odataId.lastIndexOf('/') + 1);
        return id.isEmpty() ? null : new DirectoryObjectRef(id, ref.odataId(), ref.odataType());
    }

    private static ReconcileException failure(String ownerId, Relation relation, String targetId,
                                              List<EdgeResult> completed, DirectoryException cause) {
        LOG.warnf("Edge %s/%s/%s rejected with status %d after %d completed edge(s)",
            ownerId, relation.segment(), targetId, cause.getStatusCode(), completed.size());
        return new ReconcileException(relation, ownerId,
            EdgeResult.failed(targetId, cause.getStatusCode()), completed, cause);
    }

    private static ReconcileReport report(String ownerId, Relation relation, int status, List<EdgeResult> results) {
        ReconcileReport report = new ReconcileReport(relation, ownerId, status, results);
        LOG.infof("Reconciled %s of %s: %d applied, %d already satisfied, %d request(s)",
            relation.segment(), ownerId,
            report.withOutcome(EdgeOutcome.APPLIED).size(),
            report.withOutcome(EdgeOutcome.ALREADY_SATISFIED).size(),
            report.mutationsIssued());
        return report;
    }
}
