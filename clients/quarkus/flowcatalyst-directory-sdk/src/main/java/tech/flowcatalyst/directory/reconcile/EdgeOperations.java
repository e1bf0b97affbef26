package tech.flowcatalyst.directory.reconcile;

import tech.flowcatalyst.directory.client.DirectoryResponse;
import tech.flowcatalyst.directory.dto.DirectoryObjectRef;

import java.util.Set;

/**
 * Single-edge directory calls the reconciler is built from.
 *
 * <p>Implementations apply the consistency retry policy and outcome classifier of each call;
 * a rejected call surfaces as a {@link tech.flowcatalyst.directory.exception.DirectoryException}.
 */
public interface EdgeOperations {

    /**
     * Ids currently linked to {@code ownerId} through {@code relation}.
     */
    Set<String> listTargetIds(String ownerId, Relation relation);

    /**
     * Whether the edge currently exists. A not-found answer means it does not.
     */
    boolean hasEdge(String ownerId, Relation relation, String targetId);

    /**
     * Add the edge. A response accepted because the edge already exists is marked
     * {@link DirectoryResponse#classified()}.
     */
    DirectoryResponse addEdge(String ownerId, Relation relation, DirectoryObjectRef target);

    /**
     * Remove the edge. A response accepted because the edge is already gone is marked
     * {@link DirectoryResponse#classified()}.
     */
    DirectoryResponse removeEdge(String ownerId, Relation relation, String targetId);
}
