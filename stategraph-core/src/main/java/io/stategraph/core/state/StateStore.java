package io.stategraph.core.state;

import io.stategraph.core.output.MapNodeOutputParser;
import io.stategraph.core.output.NodeOutput;
import io.stategraph.core.output.NodeOutputParseException;
import io.stategraph.core.output.NodeOutputParser;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/// Owner of one execution's global state, node records and change history.
///
/// Global state is mutated only here. Each node output is projected through the graph's
/// {@link FieldMapping}: mapped fields are validated, normalized and written; the whole
/// record is kept verbatim under `{nodeId}_result`; one {@link HistoryEntry} captures the
/// change set.
///
/// ### Contracts
/// - **Invariant**: history is append-only and totally ordered
/// - **Invariant**: a projection is fully applied before any reader can observe it
/// - **Invariant**: unmapped output fields never appear among global state fields
///
/// ### Thread Safety
/// @implNote Thread-safe. All mutators and readers synchronize on the store, so concurrent
/// projections never interleave their writes or history entries. One store belongs to
/// exactly one execution; there is no process-wide instance.
///
/// @see StateSnapshot for the immutable view handed to conditions
/// @see StateHistory for the change log
public final class StateStore {

    private static final Logger logger = Logger.getLogger(StateStore.class.getName());

    private final FieldMapping mapping;
    private final NodeOutputParser parser;

    private final Map<String, Object> fields = new LinkedHashMap<>();
    private final Map<String, Map<String, Object>> results = new LinkedHashMap<>();
    private final Map<String, UserInputRecord> userInputs = new LinkedHashMap<>();
    private final StateHistory history;

    /// Creates an empty store using the default map-only output parser.
    ///
    /// @param mapping the field mapping table, not null
    public StateStore(FieldMapping mapping) {
        this(mapping, MapNodeOutputParser.INSTANCE);
    }

    /// Creates an empty store.
    ///
    /// @param mapping the field mapping table, not null
    /// @param parser interprets raw node payloads, not null
    public StateStore(FieldMapping mapping, NodeOutputParser parser) {
        this(mapping, parser, new StateHistory());
    }

    private StateStore(FieldMapping mapping, NodeOutputParser parser, StateHistory history) {
        this.mapping = Objects.requireNonNull(mapping, "mapping must not be null");
        this.parser = Objects.requireNonNull(parser, "parser must not be null");
        this.history = history;
    }

    /// Rebuilds a store from persisted parts.
    ///
    /// @param mapping the field mapping table, not null
    /// @param parser interprets raw node payloads, not null
    /// @param snapshot persisted state, not null
    /// @param entries persisted history in order, not null
    /// @return a store equivalent to the one that was persisted, never null
    public static StateStore restore(
            FieldMapping mapping,
            NodeOutputParser parser,
            StateSnapshot snapshot,
            List<HistoryEntry> entries) {
        Objects.requireNonNull(snapshot, "snapshot must not be null");
        Objects.requireNonNull(entries, "entries must not be null");

        StateStore store = new StateStore(mapping, parser, new StateHistory(entries));
        store.fields.putAll(snapshot.fields());
        store.results.putAll(snapshot.results());
        store.userInputs.putAll(snapshot.userInputs());
        return store;
    }

    /// Interprets a raw payload and projects it into global state.
    ///
    /// A payload the parser rejects leaves global state untouched; a
    /// {@link HistoryOperation#PROJECTION_FAILURE} entry is appended and the returned result
    /// is marked malformed so the engine can apply its failure policy.
    ///
    /// @param nodeId the node that produced the payload, not null
    /// @param payload the raw payload, may be null
    /// @return the projection outcome, never null
    public synchronized ProjectionResult project(String nodeId, Object payload) {
        Objects.requireNonNull(nodeId, "nodeId must not be null");

        NodeOutput output;
        try {
            output = parser.parse(payload);
        } catch (NodeOutputParseException e) {
            logger.warning("Malformed output from node " + nodeId + ": " + e.getMessage());
            history.append(
                    HistoryEntry.builder()
                            .nodeId(nodeId)
                            .operation(HistoryOperation.PROJECTION_FAILURE)
                            .detail(e.getMessage())
                            .build());
            return ProjectionResult.malformed(nodeId, e.getMessage());
        }
        return project(nodeId, output);
    }

    /// Projects an already-parsed output record into global state.
    ///
    /// Every rule is normalized before any field is written. A normalizer that throws is
    /// treated as a rejection: the rule's default is used and a {@link FieldSubstitution}
    /// is recorded.
    ///
    /// @apiNote **Side effects**: writes mapped fields, replaces `{nodeId}_result`,
    /// appends exactly one {@link HistoryOperation#PROJECT} entry
    ///
    /// @param nodeId the node that produced the record, not null
    /// @param output the parsed record, not null
    /// @return changed fields and substitutions, never null
    public synchronized ProjectionResult project(String nodeId, NodeOutput output) {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(output, "output must not be null");

        Map<String, Object> staged = new LinkedHashMap<>();
        List<FieldSubstitution> substitutions = new ArrayList<>();

        for (FieldRule rule : mapping.getRules()) {
            Object raw;
            if (output.contains(rule.getSourceField())) {
                raw = output.fields().get(rule.getSourceField());
            } else if (rule.hasMissingDefault()) {
                raw = rule.missingDefaultFor(nodeId);
            } else {
                continue;
            }

            Object value;
            try {
                value = rule.getNormalizer().normalize(raw);
            } catch (RuntimeException e) {
                // normalizers are user code; anything they throw counts as a rejection
                value = rule.getDefaultValue();
                substitutions.add(
                        new FieldSubstitution(
                                rule.getTargetField(), raw, value, rejectionReason(e)));
                logger.warning(
                        "Field '"
                                + rule.getTargetField()
                                + "' from node "
                                + nodeId
                                + " failed validation, using default "
                                + value
                                + ": "
                                + rejectionReason(e));
            }
            staged.put(rule.getTargetField(), value);
        }

        Map<String, Object> changes = new LinkedHashMap<>();
        staged.forEach((field, value) -> write(field, value, changes));

        Map<String, Object> record = output.fields();
        if (!record.equals(results.get(nodeId))) {
            changes.put(StateKeys.resultKey(nodeId), record);
        }
        results.put(nodeId, record);

        history.append(
                HistoryEntry.builder()
                        .nodeId(nodeId)
                        .operation(HistoryOperation.PROJECT)
                        .changes(changes)
                        .substitutions(substitutions)
                        .build());

        logger.fine("Projected node " + nodeId + " changes " + changes.keySet());
        return ProjectionResult.applied(nodeId, changes, substitutions);
    }

    /// Writes a fallback record for a node whose output was malformed.
    ///
    /// Fallback values are written as state fields directly, bypassing the mapping.
    ///
    /// @param nodeId the node whose output was malformed, not null
    /// @param fallback field values to write, not null
    /// @return changed fields, never null
    public synchronized Map<String, Object> projectFallback(
            String nodeId, Map<String, Object> fallback) {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(fallback, "fallback must not be null");

        Map<String, Object> changes = new LinkedHashMap<>();
        fallback.forEach((field, value) -> write(field, value, changes));

        history.append(
                HistoryEntry.builder()
                        .nodeId(nodeId)
                        .operation(HistoryOperation.FALLBACK)
                        .changes(changes)
                        .build());
        logger.info("Applied fallback state for node " + nodeId + ": " + changes.keySet());
        return changes;
    }

    /// Records external input for a node.
    ///
    /// Creates or replaces the node's single `{nodeId}_user_input` record and appends a
    /// {@link HistoryOperation#USER_INPUT} entry. `{nodeId}_result` is not touched.
    ///
    /// @param nodeId the node that requested input, not null
    /// @param input the supplied value, may be null
    /// @param triggeringOutput the node output that caused the request, may be null
    /// @return the stored record, never null
    public synchronized UserInputRecord recordUserInput(
            String nodeId, Object input, Map<String, Object> triggeringOutput) {
        Objects.requireNonNull(nodeId, "nodeId must not be null");

        Map<String, Object> trigger =
                triggeringOutput != null
                        ? triggeringOutput
                        : results.getOrDefault(nodeId, Map.of());
        UserInputRecord record = new UserInputRecord(input, Instant.now(), nodeId, trigger, false);
        userInputs.put(nodeId, record);

        Map<String, Object> changes = new LinkedHashMap<>();
        changes.put(StateKeys.userInputKey(nodeId), input);
        history.append(
                HistoryEntry.builder()
                        .nodeId(nodeId)
                        .operation(HistoryOperation.USER_INPUT)
                        .timestamp(record.timestamp())
                        .changes(changes)
                        .build());

        logger.info("Recorded user input for node " + nodeId);
        return record;
    }

    /// Records external input for a node, using its latest output as the trigger.
    ///
    /// @param nodeId the node that requested input, not null
    /// @param input the supplied value, may be null
    /// @return the stored record, never null
    public UserInputRecord recordUserInput(String nodeId, Object input) {
        return recordUserInput(nodeId, input, null);
    }

    /// Marks a node's user-input record as consumed.
    ///
    /// @param nodeId the node whose record satisfied an edge, not null
    /// @return true if an unconsumed record existed and was marked
    public synchronized boolean markUserInputConsumed(String nodeId) {
        UserInputRecord record = userInputs.get(nodeId);
        if (record == null || record.consumed()) {
            return false;
        }
        userInputs.put(nodeId, record.markConsumed());
        history.append(
                HistoryEntry.builder()
                        .nodeId(nodeId)
                        .operation(HistoryOperation.USER_INPUT_CONSUMED)
                        .build());
        return true;
    }

    /// Reads a state field or reserved per-node key.
    ///
    /// @param key field name, `{nodeId}_result` or `{nodeId}_user_input`, not null
    /// @return the value, empty if absent
    public synchronized Optional<Object> get(String key) {
        return snapshot().get(key);
    }

    /// Returns a defensive copy of all state, including per-node records.
    ///
    /// @return a new map, never null; later changes to the store are not visible in it
    public synchronized Map<String, Object> getAll() {
        return snapshot().asMap();
    }

    /// Takes an immutable snapshot of the current state.
    ///
    /// @return the snapshot, never null
    public synchronized StateSnapshot snapshot() {
        return new StateSnapshot(fields, results, userInputs);
    }

    /// Returns the ordered change history.
    ///
    /// @return immutable copy of all entries, never null
    public synchronized List<HistoryEntry> history() {
        return history.entries();
    }

    public FieldMapping getMapping() {
        return mapping;
    }

    private static String rejectionReason(RuntimeException e) {
        if (e instanceof FieldValidationException) {
            return e.getMessage();
        }
        String type = e.getClass().getSimpleName();
        return e.getMessage() != null ? type + ": " + e.getMessage() : type;
    }

    private void write(String field, Object value, Map<String, Object> changes) {
        if (!fields.containsKey(field) || !Objects.equals(fields.get(field), value)) {
            changes.put(field, value);
        }
        fields.put(field, value);
    }
}
