package tech.flowcatalyst.directory.client.resources;

import tech.flowcatalyst.directory.client.DirectoryHttpClient;
import tech.flowcatalyst.directory.client.DirectoryRequest;
import tech.flowcatalyst.directory.client.DirectoryResponse;
import tech.flowcatalyst.directory.consistency.ConsistencyRetryPolicies;
import tech.flowcatalyst.directory.consistency.OutcomeClassifiers;
import tech.flowcatalyst.directory.dto.DirectoryObjectRef;
import tech.flowcatalyst.directory.exception.RemoteRejectionException;
import tech.flowcatalyst.directory.odata.ODataQuery;
import tech.flowcatalyst.directory.reconcile.EdgeOperations;
import tech.flowcatalyst.directory.reconcile.Relation;

import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * {@code $ref} edge calls on application relations.
 */
public class DirectoryEdgeOperations implements EdgeOperations {

    private static final int NOT_FOUND = 404;

    private final DirectoryHttpClient client;

    public DirectoryEdgeOperations(DirectoryHttpClient client) {
        this.client = client;
    }

    @Override
    public Set<String> listTargetIds(String ownerId, Relation relation) {
        var response = client.execute(DirectoryRequest.get(collectionPath(ownerId, relation))
            .query(ODataQuery.builder().select("id").build())
            .validStatus(200)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .paged()
            .build());

        Set<String> ids = new LinkedHashSet<>();
        client.getCodec().decodeList(response, DirectoryObjectRef.class).stream()
            .map(DirectoryObjectRef::id)
            .filter(Objects::nonNull)
            .forEach(ids::add);
        return ids;
    }

    /**
     * Membership lookup. A not-found answer is retried like any read by id, since an edge added
     * moments ago may not be visible yet; only a not-found that outlasts the retries means the
     * target is not linked.
     */
    @Override
    public boolean hasEdge(String ownerId, Relation relation, String targetId) {
        try {
            client.execute(DirectoryRequest.get(edgePath(ownerId, relation, targetId))
                .query(ODataQuery.builder().select("id", "url").build())
                .validStatus(200)
                .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
                .build());
            return true;
        } catch (RemoteRejectionException e) {
            if (e.getStatusCode() == NOT_FOUND) {
                return false;
            }
            throw e;
        }
    }

    @Override
    public DirectoryResponse addEdge(String ownerId, Relation relation, DirectoryObjectRef target) {
        String reference = target.odataId() != null ? target.odataId() : client.directoryObjectUri(target.id());
        byte[] body = client.getCodec().encode(Map.of("@odata.id", reference));

        return client.execute(DirectoryRequest.post(collectionPath(ownerId, relation) + "/$ref")
            .body(body)
            .validStatus(204)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .outcomeClassifier(OutcomeClassifiers.REFERENCE_ALREADY_EXISTS)
            .build());
    }

    @Override
    public DirectoryResponse removeEdge(String ownerId, Relation relation, String targetId) {
        return client.execute(DirectoryRequest.delete(edgePath(ownerId, relation, targetId))
            .validStatus(204)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .outcomeClassifier(OutcomeClassifiers.EDGE_ALREADY_REMOVED)
            .build());
    }

    private static String collectionPath(String ownerId, Relation relation) {
        return "/applications/" + ownerId + "/" + relation.segment();
    }

    private static String edgePath(String ownerId, Relation relation, String targetId) {
        return collectionPath(ownerId, relation) + "/" + targetId + "/$ref";
    }
}
