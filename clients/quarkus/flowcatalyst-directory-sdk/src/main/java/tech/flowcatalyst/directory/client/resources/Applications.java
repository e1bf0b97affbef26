package tech.flowcatalyst.directory.client.resources;

import tech.flowcatalyst.directory.client.DirectoryCodec;
import tech.flowcatalyst.directory.client.DirectoryHttpClient;
import tech.flowcatalyst.directory.client.DirectoryRequest;
import tech.flowcatalyst.directory.consistency.ConsistencyRetryPolicies;
import tech.flowcatalyst.directory.dto.Application;
import tech.flowcatalyst.directory.dto.ApplicationExtension;
import tech.flowcatalyst.directory.dto.DirectoryObjectRef;
import tech.flowcatalyst.directory.dto.DirectoryResult;
import tech.flowcatalyst.directory.dto.FederatedIdentityCredential;
import tech.flowcatalyst.directory.dto.PasswordCredential;
import tech.flowcatalyst.directory.dto.TokenIssuancePolicy;
import tech.flowcatalyst.directory.exception.PreconditionException;
import tech.flowcatalyst.directory.odata.ODataQuery;
import tech.flowcatalyst.directory.reconcile.ReconcileReport;
import tech.flowcatalyst.directory.reconcile.Relation;
import tech.flowcatalyst.directory.reconcile.RelationshipReconciler;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Resource for managing applications and their sub-resources.
 *
 * <p>Calls on an existing object retry while the directory answers not-found, since a freshly
 * created or restored application may not have reached the replica serving the request.
 * Creates do not retry.
 */
public class Applications {

    private static final String APPLICATIONS = "/applications";
    private static final String DELETED_ITEMS = "/directory/deletedItems";

    private final DirectoryHttpClient client;
    private final DirectoryCodec codec;
    private final RelationshipReconciler reconciler;

    public Applications(DirectoryHttpClient client) {
        this(client, new RelationshipReconciler(new DirectoryEdgeOperations(client)));
    }

    public Applications(DirectoryHttpClient client, RelationshipReconciler reconciler) {
        this.client = client;
        this.codec = client.getCodec();
        this.reconciler = reconciler;
    }

    /**
     * List applications, optionally queried using OData.
     */
    public DirectoryResult<List<Application>> list(ODataQuery query) {
        var response = client.execute(DirectoryRequest.get(APPLICATIONS)
            .query(query)
            .validStatus(200)
            .paged()
            .build());
        return DirectoryResult.of(codec.decodeList(response, Application.class), response.status());
    }

    /**
     * Create a new application.
     */
    public DirectoryResult<Application> create(Application application) {
        var response = client.execute(DirectoryRequest.post(APPLICATIONS)
            .body(codec.encode(application))
            .query(ODataQuery.builder().metadata(ODataQuery.Metadata.FULL).build())
            .validStatus(201)
            .build());
        return DirectoryResult.of(codec.decode(response, Application.class), response.status());
    }

    /**
     * Get an application by object id.
     */
    public DirectoryResult<Application> get(String id, ODataQuery query) {
        var response = client.execute(DirectoryRequest.get(applicationPath(id))
            .query(query)
            .validStatus(200)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .build());
        return DirectoryResult.of(codec.decode(response, Application.class), response.status());
    }

    /**
     * Get a soft-deleted application by object id.
     */
    public DirectoryResult<Application> getDeleted(String id, ODataQuery query) {
        var response = client.execute(DirectoryRequest.get(DELETED_ITEMS + "/" + id)
            .query(query)
            .validStatus(200)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .build());
        return DirectoryResult.of(codec.decode(response, Application.class), response.status());
    }

    /**
     * Update an existing application. Only the non-null fields of the payload are sent.
     *
     * @throws PreconditionException if the payload has no id
     */
    public DirectoryResult<Void> update(Application application) {
        if (application == null || application.id() == null) {
            throw PreconditionException.nullId("Applications.update", "application");
        }
        var response = client.execute(DirectoryRequest.patch(applicationPath(application.id()))
            .body(codec.encode(application))
            .validStatus(204)
            .consistencyPolicy(ConsistencyRetryPolicies.APPLICATION_UPDATE)
            .build());
        return DirectoryResult.status(response.status());
    }

    /**
     * Soft-delete an application.
     */
    public DirectoryResult<Void> delete(String id) {
        var response = client.execute(DirectoryRequest.delete(applicationPath(id))
            .validStatus(204)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .build());
        return DirectoryResult.status(response.status());
    }

    /**
     * Permanently remove a soft-deleted application.
     */
    public DirectoryResult<Void> deletePermanently(String id) {
        var response = client.execute(DirectoryRequest.delete(DELETED_ITEMS + "/" + id)
            .validStatus(204)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .build());
        return DirectoryResult.status(response.status());
    }

    /**
     * List recently deleted applications.
     */
    public DirectoryResult<List<Application>> listDeleted(ODataQuery query) {
        var response = client.execute(DirectoryRequest.get(DELETED_ITEMS + "/microsoft.graph.application")
            .query(query)
            .validStatus(200)
            .paged()
            .build());
        return DirectoryResult.of(codec.decodeList(response, Application.class), response.status());
    }

    /**
     * Restore a recently deleted application.
     */
    public DirectoryResult<Application> restoreDeleted(String id) {
        var response = client.execute(DirectoryRequest.post(DELETED_ITEMS + "/" + id + "/restore")
            .validStatus(200)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .build());
        return DirectoryResult.of(codec.decode(response, Application.class), response.status());
    }

    // Credentials

    /**
     * Add a password credential. The returned credential carries the generated secret text.
     */
    public DirectoryResult<PasswordCredential> addPassword(String applicationId, PasswordCredential credential) {
        var response = client.execute(DirectoryRequest.post(applicationPath(applicationId) + "/addPassword")
            .body(codec.encode(Map.of("passwordCredential", credential)))
            .validStatus(200, 201)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .build());
        return DirectoryResult.of(codec.decode(response, PasswordCredential.class), response.status());
    }

    public DirectoryResult<Void> removePassword(String applicationId, String keyId) {
        if (keyId == null) {
            throw PreconditionException.missingArgument("Applications.removePassword", "keyId");
        }
        var response = client.execute(DirectoryRequest.post(applicationPath(applicationId) + "/removePassword")
            .body(codec.encode(Map.of("keyId", keyId)))
            .validStatus(200, 204)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .build());
        return DirectoryResult.status(response.status());
    }

    // Owners

    /**
     * Object ids of the application's owners.
     */
    public DirectoryResult<List<String>> listOwners(String applicationId) {
        var response = client.execute(DirectoryRequest.get(applicationPath(applicationId) + "/owners")
            .query(ODataQuery.builder().select("id").build())
            .validStatus(200)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .paged()
            .build());
        var ids = codec.decodeList(response, DirectoryObjectRef.class).stream()
            .map(DirectoryObjectRef::id)
            .filter(Objects::nonNull)
            .toList();
        return DirectoryResult.of(ids, response.status());
    }

    /**
     * Get a single owner reference; answers with the owner's id.
     */
    public DirectoryResult<String> getOwner(String applicationId, String ownerId) {
        var response = client.execute(DirectoryRequest.get(applicationPath(applicationId) + "/owners/" + ownerId + "/$ref")
            .query(ODataQuery.builder().select("id", "url").build())
            .validStatus(200)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .build());
        return DirectoryResult.of(codec.decode(response, DirectoryObjectRef.class).id(), response.status());
    }

    /**
     * Link owners to the application, in the given order. Owners that are already linked
     * are reported as already satisfied. An owner given only by {@code @odata.id} is posted
     * with that reference as is.
     *
     * @throws tech.flowcatalyst.directory.exception.ReconcileException at the first owner the
     *         directory rejects; owners added before it remain added
     */
    public ReconcileReport addOwners(String applicationId, Collection<DirectoryObjectRef> owners) {
        return reconciler.addEdges(applicationId, Relation.OWNERS, owners);
    }

    /**
     * Unlink owners from the application. Ids that are not owners are skipped.
     */
    public ReconcileReport removeOwners(String applicationId, Collection<String> ownerIds) {
        return reconciler.removeEdges(applicationId, Relation.OWNERS, ownerIds);
    }

    // Extension properties

    public DirectoryResult<List<ApplicationExtension>> listExtensions(String applicationId, ODataQuery query) {
        var response = client.execute(DirectoryRequest.get(extensionsPath(applicationId))
            .query(query)
            .validStatus(200)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .paged()
            .build());
        return DirectoryResult.of(codec.decodeList(response, ApplicationExtension.class), response.status());
    }

    public DirectoryResult<ApplicationExtension> getExtension(String applicationId, String extensionId, ODataQuery query) {
        var response = client.execute(DirectoryRequest.get(extensionsPath(applicationId) + "/" + extensionId)
            .query(query)
            .validStatus(200)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .build());
        return DirectoryResult.of(codec.decode(response, ApplicationExtension.class), response.status());
    }

    public DirectoryResult<ApplicationExtension> createExtension(String applicationId, ApplicationExtension extension) {
        var response = client.execute(DirectoryRequest.post(extensionsPath(applicationId))
            .body(codec.encode(extension))
            .validStatus(201)
            .build());
        return DirectoryResult.of(codec.decode(response, ApplicationExtension.class), response.status());
    }

    /**
     * Update an extension property.
     *
     * @throws PreconditionException if the payload has no id
     */
    public DirectoryResult<Void> updateExtension(String applicationId, ApplicationExtension extension) {
        if (extension == null || extension.id() == null) {
            throw PreconditionException.nullId("Applications.updateExtension", "extension property");
        }
        var response = client.execute(DirectoryRequest.patch(extensionsPath(applicationId) + "/" + extension.id())
            .body(codec.encode(extension))
            .validStatus(204)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .build());
        return DirectoryResult.status(response.status());
    }

    public DirectoryResult<Void> deleteExtension(String applicationId, String extensionId) {
        var response = client.execute(DirectoryRequest.delete(extensionsPath(applicationId) + "/" + extensionId)
            .validStatus(204)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .build());
        return DirectoryResult.status(response.status());
    }

    // Logo

    /**
     * Upload the application logo; {@code contentType} is the image type (gif, jpeg or png).
     */
    public DirectoryResult<Void> uploadLogo(String applicationId, String contentType, byte[] logoData) {
        if (logoData == null) {
            throw PreconditionException.missingArgument("Applications.uploadLogo", "logoData");
        }
        var response = client.execute(DirectoryRequest.put(applicationPath(applicationId) + "/logo")
            .body(logoData)
            .contentType(contentType)
            .validStatus(204)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .build());
        return DirectoryResult.status(response.status());
    }

    // Federated identity credentials

    public DirectoryResult<List<FederatedIdentityCredential>> listFederatedIdentityCredentials(String applicationId, ODataQuery query) {
        var response = client.execute(DirectoryRequest.get(federatedCredentialsPath(applicationId))
            .query(query)
            .validStatus(200)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .paged()
            .build());
        return DirectoryResult.of(codec.decodeList(response, FederatedIdentityCredential.class), response.status());
    }

    public DirectoryResult<FederatedIdentityCredential> getFederatedIdentityCredential(String applicationId, String credentialId, ODataQuery query) {
        var response = client.execute(DirectoryRequest.get(federatedCredentialsPath(applicationId) + "/" + credentialId)
            .query(query)
            .validStatus(200)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .build());
        return DirectoryResult.of(codec.decode(response, FederatedIdentityCredential.class), response.status());
    }

    public DirectoryResult<FederatedIdentityCredential> createFederatedIdentityCredential(String applicationId, FederatedIdentityCredential credential) {
        var response = client.execute(DirectoryRequest.post(federatedCredentialsPath(applicationId))
            .body(codec.encode(credential))
            .validStatus(201)
            .build());
        return DirectoryResult.of(codec.decode(response, FederatedIdentityCredential.class), response.status());
    }

    /**
     * Update a federated identity credential.
     *
     * @throws PreconditionException if the payload has no id
     */
    public DirectoryResult<Void> updateFederatedIdentityCredential(String applicationId, FederatedIdentityCredential credential) {
        if (credential == null || credential.id() == null) {
            throw PreconditionException.nullId("Applications.updateFederatedIdentityCredential", "federated identity credential");
        }
        var response = client.execute(DirectoryRequest.patch(federatedCredentialsPath(applicationId) + "/" + credential.id())
            .body(codec.encode(credential))
            .validStatus(204)
            .build());
        return DirectoryResult.status(response.status());
    }

    public DirectoryResult<Void> deleteFederatedIdentityCredential(String applicationId, String credentialId) {
        var response = client.execute(DirectoryRequest.delete(federatedCredentialsPath(applicationId) + "/" + credentialId)
            .validStatus(204)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .build());
        return DirectoryResult.status(response.status());
    }

    // Token issuance policies

    /**
     * Assign token issuance policies. Policies already assigned are skipped without a request.
     */
    public ReconcileReport assignTokenIssuancePolicies(String applicationId, Collection<DirectoryObjectRef> policies) {
        return reconciler.addEdges(applicationId, Relation.TOKEN_ISSUANCE_POLICIES, policies);
    }

    public DirectoryResult<List<TokenIssuancePolicy>> listTokenIssuancePolicies(String applicationId) {
        var response = client.execute(DirectoryRequest.get(applicationPath(applicationId) + "/tokenIssuancePolicies")
            .validStatus(200)
            .consistencyPolicy(ConsistencyRetryPolicies.RETRY_ON_NOT_FOUND)
            .paged()
            .build());
        return DirectoryResult.of(codec.decodeList(response, TokenIssuancePolicy.class), response.status());
    }

    /**
     * Remove token issuance policy assignments. The assigned set is listed once; ids not in it
     * are skipped, and an empty assignment list completes with 204 without any delete.
     */
    public ReconcileReport removeTokenIssuancePolicies(String applicationId, Collection<String> policyIds) {
        return reconciler.removeEdges(applicationId, Relation.TOKEN_ISSUANCE_POLICIES, policyIds);
    }

    private static String applicationPath(String id) {
        return APPLICATIONS + "/" + id;
    }

    private static String extensionsPath(String applicationId) {
        return applicationPath(applicationId) + "/extensionProperties";
    }

    private static String federatedCredentialsPath(String applicationId) {
        return applicationPath(applicationId) + "/federatedIdentityCredentials";
    }
}
