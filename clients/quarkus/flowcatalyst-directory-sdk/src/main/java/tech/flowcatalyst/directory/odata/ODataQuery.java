package tech.flowcatalyst.directory.odata;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * OData query options attached to a directory request.
 *
 * <p>Example usage:
 * <pre>{@code
 * var query = ODataQuery.builder()
 *     .filter("displayName eq 'billing'")
 *     .select("id", "appId")
 *     .top(10)
 *     .build();
 * }</pre>
 */
public record ODataQuery(
    List<String> select,
    List<String> expand,
    String filter,
    String orderBy,
    String search,
    int top,
    boolean count,
    ConsistencyLevel consistencyLevel,
    Metadata metadata
) {

    private static final ODataQuery EMPTY = builder().build();

    public ODataQuery {
        select = select != null ? List.copyOf(select) : List.of();
        expand = expand != null ? List.copyOf(expand) : List.of();
    }

    public static ODataQuery empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Following {@code @odata.nextLink} is skipped when the caller asked for a bounded page.
     */
    public boolean pagingDisabled() {
        return top > 0;
    }

    /**
     * Query string parameters, in a stable order.
     */
    public Map<String, String> parameters() {
        Map<String, String> params = new LinkedHashMap<>();
        if (!select.isEmpty()) {
            params.put("$select", String.join(",", select));
        }
        if (!expand.isEmpty()) {
            params.put("$expand", String.join(",", expand));
        }
        if (filter != null && !filter.isBlank()) {
            params.put("$filter", filter);
        }
        if (orderBy != null && !orderBy.isBlank()) {
            params.put("$orderby", orderBy);
        }
        if (search != null && !search.isBlank()) {
            params.put("$search", search);
        }
        if (top > 0) {
            params.put("$top", Integer.toString(top));
        }
        if (count) {
            params.put("$count", "true");
        }
        return params;
    }

    /**
     * Request headers implied by the query options.
     */
    public Map<String, String> headers() {
        Map<String, String> headers = new LinkedHashMap<>();
        if (consistencyLevel == ConsistencyLevel.EVENTUAL) {
            headers.put("ConsistencyLevel", "eventual");
        }
        if (metadata != null) {
            headers.put("Accept", "application/json; odata.metadata=" + metadata.value);
        }
        return headers;
    }

    public enum ConsistencyLevel {
        DEFAULT,
        EVENTUAL
    }

    public enum Metadata {
        NONE("none"),
        MINIMAL("minimal"),
        FULL("full");

        private final String value;

        Metadata(String value) {
            this.value = value;
        }
    }

    public static final class Builder {
        private final List<String> select = new ArrayList<>();
        private final List<String> expand = new ArrayList<>();
        private String filter;
        private String orderBy;
        private String search;
        private int top;
        private boolean count;
        private ConsistencyLevel consistencyLevel = ConsistencyLevel.DEFAULT;
        private Metadata metadata;

        private Builder() {
        }

        public Builder select(String... fields) {
            select.addAll(List.of(fields));
            return this;
        }

        public Builder expand(String... relations) {
            expand.addAll(List.of(relations));
            return this;
        }

        public Builder filter(String filter) {
            this.filter = filter;
            return this;
        }

        public Builder orderBy(String orderBy) {
            this.orderBy = orderBy;
            return this;
        }

        public Builder search(String search) {
            this.search = search;
            return this;
        }

        public Builder top(int top) {
            this.top = top;
            return this;
        }

        public Builder count(boolean count) {
            this.count = count;
            return this;
        }

        public Builder consistencyLevel(ConsistencyLevel consistencyLevel) {
            this.consistencyLevel = consistencyLevel;
            return this;
        }

        public Builder metadata(Metadata metadata) {
            this.metadata = metadata;
            return this;
        }

        public ODataQuery build() {
            return new ODataQuery(select, expand, filter, orderBy, search, top, count, consistencyLevel, metadata);
        }
    }
}
