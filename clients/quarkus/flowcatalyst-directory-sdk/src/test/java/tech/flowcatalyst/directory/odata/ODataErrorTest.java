package tech.flowcatalyst.directory.odata;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for ODataError matching and formatting.
 */
class ODataErrorTest {

    @Test
    void matches_searchesCodeAndMessage() {
        var error = ODataError.of("Request_ResourceNotFound", "Resource 'x' does not exist.");

        assertTrue(error.matches(Pattern.compile("ResourceNotFound")));
        assertTrue(error.matches(Pattern.compile("does not exist")));
        assertFalse(error.matches(Pattern.compile("already exist")));
    }

    @Test
    void matches_searchesDetailsRecursively() {
        var inner = ODataError.of("ObjectConflict", "One or more added object references already exist");
        var middle = new ODataError("Wrapper", "outer", List.of(inner), null);
        var outer = new ODataError("Request_BadRequest", "Invalid request.", List.of(middle), null);

        assertTrue(outer.matches(ODataErrors.ADDED_OBJECT_REFERENCES_ALREADY_EXIST));
    }

    @Test
    void matches_nullPatternNeverMatches() {
        assertFalse(ODataError.of("code", "message").matches(null));
    }

    @Test
    void missingFields_areTolerated() {
        var error = new ODataError(null, null, null, null);

        assertTrue(error.details().isEmpty());
        assertFalse(error.matches(Pattern.compile(".*")));
        assertEquals("", error.toString());
    }

    @Test
    void toString_includesRequestId() {
        var error = new ODataError("Request_BadRequest", "Bad.", List.of(),
            new ODataError.InnerError("2024-01-01T00:00:00", "req-1", "client-1"));

        assertEquals("Request_BadRequest: Bad. (request-id req-1)", error.toString());
    }

    @Test
    void resourceDoesNotExistPattern_matchesDirectoryText() {
        var error = ODataError.of("Request_ResourceNotFound",
            "Resource '8a7b' does not exist or one of its queried reference-property objects are not present.");

        assertTrue(error.matches(ODataErrors.RESOURCE_DOES_NOT_EXIST));
    }
}
