package tech.flowcatalyst.directory.consistency;

import tech.flowcatalyst.directory.odata.ODataError;

import java.util.regex.Pattern;

/**
 * Decision over a non-success directory response, given its status and its decoded OData error.
 *
 * <p>Used in two roles: as a consistency retry policy (should this response be retried because
 * the directory has not caught up yet?) and as an outcome classifier (does this response mean
 * the desired state is already reached?). The error argument may be null.
 */
@FunctionalInterface
public interface ResponsePredicate {

    boolean test(int status, ODataError error);

    default ResponsePredicate or(ResponsePredicate other) {
        return (status, error) -> test(status, error) || other.test(status, error);
    }

    static ResponsePredicate never() {
        return (status, error) -> false;
    }

    static ResponsePredicate status(int expected) {
        return (status, error) -> status == expected;
    }

    /**
     * Matches when the status equals {@code expected} and a structured error matching
     * {@code pattern} is present.
     */
    static ResponsePredicate errorMatches(int expected, Pattern pattern) {
        return (status, error) -> status == expected && error != null && error.matches(pattern);
    }
}
