package io.stategraph.serialization.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stategraph.core.output.MapNodeOutputParser;
import io.stategraph.core.output.NodeOutput;
import io.stategraph.core.output.NodeOutputParseException;
import io.stategraph.core.output.NodeOutputParser;
import io.stategraph.core.util.JsonUtil;
import io.stategraph.serialization.SnapshotSerializer;
import java.util.Map;
import java.util.Objects;

/// Jackson-based implementation of {@link NodeOutputParser}.
///
/// Accepts, in order:
/// - `NodeOutput` and `Map` payloads (delegated to {@link MapNodeOutputParser})
/// - Jackson `JsonNode` objects
/// - text: the body of a fenced code block if present, otherwise the first balanced
///   `{...}` span, so model responses with prose around the JSON are understood
/// - any other object Jackson can convert to a map (POJOs, records)
///
/// Anything else (arrays, scalars, text without a JSON object, invalid JSON) is reported
/// as malformed.
///
/// @implNote Thread-safe if the supplied {@link ObjectMapper} is thread-safe.
///
/// @see NodeOutputParser for the interface contract
public class JacksonNodeOutputParser implements NodeOutputParser {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {};

    private final ObjectMapper objectMapper;

    /// Creates a parser backed by {@link SnapshotSerializer#createMapper()}.
    public JacksonNodeOutputParser() {
        this(SnapshotSerializer.createMapper());
    }

    /// Creates a parser backed by the given Jackson mapper.
    ///
    /// @param objectMapper the mapper to use for JSON deserialisation, not null
    public JacksonNodeOutputParser(ObjectMapper objectMapper) {
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
    }

    @Override
    public NodeOutput parse(Object payload) throws NodeOutputParseException {
        if (payload == null) {
            throw new NodeOutputParseException("Node returned no output");
        }
        if (payload instanceof NodeOutput || payload instanceof Map<?, ?>) {
            return MapNodeOutputParser.INSTANCE.parse(payload);
        }
        if (payload instanceof JsonNode node) {
            return fromTree(node);
        }
        if (payload instanceof CharSequence text) {
            return fromText(text.toString());
        }
        try {
            return NodeOutput.of(objectMapper.convertValue(payload, MAP_TYPE));
        } catch (IllegalArgumentException e) {
            throw new NodeOutputParseException(
                    "Cannot interpret " + payload.getClass().getSimpleName() + " as a record",
                    e);
        }
    }

    private NodeOutput fromTree(JsonNode node) throws NodeOutputParseException {
        if (!node.isObject()) {
            throw new NodeOutputParseException(
                    "Expected a JSON object but got " + node.getNodeType());
        }
        return NodeOutput.of(objectMapper.convertValue(node, MAP_TYPE));
    }

    private NodeOutput fromText(String text) throws NodeOutputParseException {
        String json = JsonUtil.extractFencedBlock(text);
        if (json == null || !json.startsWith("{")) {
            json = JsonUtil.extractJsonFromOutput(text);
        }
        if (json == null) {
            throw new NodeOutputParseException("No JSON object found in output");
        }
        try {
            return NodeOutput.of(objectMapper.readValue(json, MAP_TYPE));
        } catch (JsonProcessingException e) {
            throw new NodeOutputParseException(
                    "Invalid JSON in output: " + e.getOriginalMessage(), e);
        }
    }
}
