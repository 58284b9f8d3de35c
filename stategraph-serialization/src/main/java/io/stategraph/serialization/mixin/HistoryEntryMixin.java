package io.stategraph.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import io.stategraph.core.state.HistoryEntry;

/// Jackson mixin that binds `HistoryEntry` deserialization to its builder.
///
/// @apiNote The companion mixin {@link HistoryEntryBuilderMixin} must also be registered so
/// Jackson knows how to invoke the builder's setters and `build()` method.
///
/// @see io.stategraph.serialization.StateGraphJacksonModule
@JsonDeserialize(builder = HistoryEntry.Builder.class)
public abstract class HistoryEntryMixin {}
