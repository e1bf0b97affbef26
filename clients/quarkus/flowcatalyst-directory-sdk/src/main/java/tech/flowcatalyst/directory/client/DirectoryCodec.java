package tech.flowcatalyst.directory.client;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import tech.flowcatalyst.directory.exception.CodecException;
import tech.flowcatalyst.directory.odata.ODataError;

import java.io.IOException;
import java.util.List;

/**
 * JSON encoding of outgoing payloads and decoding of entity bodies, list envelopes and errors.
 */
public class DirectoryCodec {

    static final String VALUE = "value";
    static final String NEXT_LINK = "@odata.nextLink";

    private final ObjectMapper objectMapper;

    public DirectoryCodec() {
        this.objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .setSerializationInclusion(JsonInclude.Include.NON_NULL)
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public byte[] encode(Object payload) {
        try {
            return objectMapper.writeValueAsBytes(payload);
        } catch (JsonProcessingException e) {
            throw CodecException.encode(payload.getClass(), e);
        }
    }

    /**
     * Decode a flat entity body.
     */
    public <T> T decode(DirectoryResponse response, Class<T> type) {
        if (!response.hasBody()) {
            throw CodecException.decode(type.getSimpleName() + " from empty body", response.status(), null);
        }
        try {
            return objectMapper.readValue(response.body(), type);
        } catch (IOException e) {
            throw CodecException.decode(type.getSimpleName(), response.status(), e);
        }
    }

    /**
     * Decode a {@code {"value": [...]}} list envelope.
     */
    public <T> List<T> decodeList(DirectoryResponse response, Class<T> type) {
        if (!response.hasBody()) {
            return List.of();
        }
        try {
            JsonNode values = objectMapper.readTree(response.body()).path(VALUE);
            if (values.isMissingNode() || values.isNull()) {
                return List.of();
            }
            List<T> items = objectMapper.readerForListOf(type).readValue(values);
            return List.copyOf(items);
        } catch (IOException e) {
            throw CodecException.decode("list of " + type.getSimpleName(), response.status(), e);
        }
    }

    /**
     * Decode the structured error of a rejected response. Returns null when the body
     * carries none; a malformed error body is not itself an error.
     */
    public ODataError decodeError(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            JsonNode error = objectMapper.readTree(body).get("error");
            if (error == null || !error.isObject()) {
                return null;
            }
            return objectMapper.treeToValue(error, ODataError.class);
        } catch (IOException e) {
            return null;
        }
    }

    ObjectNode readPage(String body, int status) {
        try {
            JsonNode node = objectMapper.readTree(body);
            return node instanceof ObjectNode object ? object : null;
        } catch (IOException e) {
            throw CodecException.decode("list page", status, e);
        }
    }

    String writePages(ArrayNode values) {
        ObjectNode envelope = objectMapper.createObjectNode();
        envelope.set(VALUE, values);
        try {
            return objectMapper.writeValueAsString(envelope);
        } catch (JsonProcessingException e) {
            throw CodecException.encode(ObjectNode.class, e);
        }
    }

    ArrayNode newArray() {
        return objectMapper.createArrayNode();
    }

    public ObjectMapper getObjectMapper() {
        return objectMapper;
    }
}
