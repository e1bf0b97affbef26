package tech.flowcatalyst.directory.client;

import tech.flowcatalyst.directory.consistency.ConsistencyRetryPolicies;
import tech.flowcatalyst.directory.consistency.OutcomeClassifiers;
import tech.flowcatalyst.directory.consistency.ResponsePredicate;
import tech.flowcatalyst.directory.odata.ODataQuery;

import java.util.Objects;
import java.util.Set;

/**
 * A single directory call: verb, entity path, query, body and the rules for judging its response.
 *
 * @param method HTTP verb
 * @param path entity path below the API version root, e.g. {@code /applications/{id}}
 * @param query OData query options
 * @param body request body, or null
 * @param contentType content type of the body
 * @param validStatusCodes statuses that count as success
 * @param consistencyPolicy decides whether a rejected response is retried as replication lag
 * @param outcomeClassifier decides whether a rejected response still counts as success
 * @param paged whether list pages are followed through {@code @odata.nextLink}
 */
public record DirectoryRequest(
    String method,
    String path,
    ODataQuery query,
    byte[] body,
    String contentType,
    Set<Integer> validStatusCodes,
    ResponsePredicate consistencyPolicy,
    ResponsePredicate outcomeClassifier,
    boolean paged
) {

    public static final String JSON = "application/json";

    public DirectoryRequest {
        Objects.requireNonNull(method, "method");
        Objects.requireNonNull(path, "path");
        if (validStatusCodes == null || validStatusCodes.isEmpty()) {
            throw new IllegalArgumentException("at least one valid status code is required");
        }
        validStatusCodes = Set.copyOf(validStatusCodes);
        query = query != null ? query : ODataQuery.empty();
        consistencyPolicy = consistencyPolicy != null ? consistencyPolicy : ConsistencyRetryPolicies.NEVER;
        outcomeClassifier = outcomeClassifier != null ? outcomeClassifier : OutcomeClassifiers.NONE;
    }

    public boolean followsPages() {
        return paged && "GET".equals(method) && !query.pagingDisabled();
    }

    public static Builder get(String path) {
        return new Builder("GET", path);
    }

    public static Builder post(String path) {
        return new Builder("POST", path);
    }

    public static Builder patch(String path) {
        return new Builder("PATCH", path);
    }

    public static Builder put(String path) {
        return new Builder("PUT", path);
    }

    public static Builder delete(String path) {
        return new Builder("DELETE", path);
    }

    public static final class Builder {
        private final String method;
        private final String path;
        private ODataQuery query;
        private byte[] body;
        private String contentType = JSON;
        private Set<Integer> validStatusCodes = Set.of();
        private ResponsePredicate consistencyPolicy;
        private ResponsePredicate outcomeClassifier;
        private boolean paged;

        private Builder(String method, String path) {
            this.method = method;
            this.path = path;
        }

        public Builder query(ODataQuery query) {
            this.query = query;
            return this;
        }

        public Builder body(byte[] body) {
            this.body = body;
            return this;
        }

        public Builder contentType(String contentType) {
            this.contentType = contentType;
            return this;
        }

        public Builder validStatus(Integer... statusCodes) {
            this.validStatusCodes = Set.of(statusCodes);
            return this;
        }

        public Builder consistencyPolicy(ResponsePredicate consistencyPolicy) {
            this.consistencyPolicy = consistencyPolicy;
            return this;
        }

        public Builder outcomeClassifier(ResponsePredicate outcomeClassifier) {
            this.outcomeClassifier = outcomeClassifier;
            return this;
        }

        public Builder paged() {
            this.paged = true;
            return this;
        }

        public DirectoryRequest build() {
            return new DirectoryRequest(method, path, query, body, contentType,
                validStatusCodes, consistencyPolicy, outcomeClassifier, paged);
        }
    }
}
