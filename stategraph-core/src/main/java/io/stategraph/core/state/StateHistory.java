package io.stategraph.core.state;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/// Append-only, time-ordered log of state changes for one execution.
///
/// Entry order is the single source of truth for "most recent" state. No entry is ever
/// mutated or removed.
///
/// @implNote **Not thread-safe** on its own. The owning {@link StateStore} serializes
/// all appends. {@link #entries()} returns a copy that is safe to share.
public final class StateHistory {

    private final List<HistoryEntry> entries = new ArrayList<>();

    public StateHistory() {}

    /// Creates a history pre-populated with restored entries.
    ///
    /// @param entries previously persisted entries in order, not null
    public StateHistory(List<HistoryEntry> entries) {
        this.entries.addAll(entries);
    }

    /// Appends an entry.
    ///
    /// @apiNote **Side effects**: Modifies internal entry list
    ///
    /// @param entry the entry to record, not null
    void append(HistoryEntry entry) {
        entries.add(entry);
    }

    /// Returns all entries in append order.
    ///
    /// @return immutable copy, never null
    public List<HistoryEntry> entries() {
        return List.copyOf(entries);
    }

    /// Returns entries caused by one node, in append order.
    ///
    /// @param nodeId the node to filter by, not null
    /// @return immutable list, never null
    public List<HistoryEntry> entriesFor(String nodeId) {
        return entries.stream().filter(e -> e.getNodeId().equals(nodeId)).toList();
    }

    /// Returns the most recent entry.
    ///
    /// @return the last entry, or empty if nothing has been recorded
    public Optional<HistoryEntry> latest() {
        return entries.isEmpty() ? Optional.empty() : Optional.of(entries.get(entries.size() - 1));
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }
}
