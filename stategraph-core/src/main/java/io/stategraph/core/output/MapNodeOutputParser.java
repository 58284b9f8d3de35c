package io.stategraph.core.output;

import java.util.LinkedHashMap;
import java.util.Map;

/// Default {@link NodeOutputParser} accepting already-structured payloads.
///
/// Accepts {@link NodeOutput} instances and `Map`s with string keys. Everything else,
/// including text, is reported as malformed. Text payloads need the Jackson parser from
/// {@code stategraph-serialization}.
public final class MapNodeOutputParser implements NodeOutputParser {

    public static final MapNodeOutputParser INSTANCE = new MapNodeOutputParser();

    @Override
    public NodeOutput parse(Object payload) throws NodeOutputParseException {
        if (payload instanceof NodeOutput output) {
            return output;
        }
        if (payload instanceof Map<?, ?> map) {
            Map<String, Object> fields = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                if (!(entry.getKey() instanceof String key)) {
                    throw new NodeOutputParseException(
                            "Output field names must be strings, got: " + entry.getKey());
                }
                fields.put(key, entry.getValue());
            }
            return NodeOutput.of(fields);
        }
        throw new NodeOutputParseException(
                "Unsupported output payload: "
                        + (payload == null ? "null" : payload.getClass().getName()));
    }
}
