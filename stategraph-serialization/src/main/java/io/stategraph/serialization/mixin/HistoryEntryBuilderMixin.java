package io.stategraph.serialization.mixin;

import com.fasterxml.jackson.databind.annotation.JsonPOJOBuilder;

/// Jackson mixin for `HistoryEntry.Builder`.
///
/// Sets `withPrefix = ""` so JSON field names map directly to builder method names.
///
/// @see HistoryEntryMixin
@JsonPOJOBuilder(withPrefix = "")
public abstract class HistoryEntryBuilderMixin {}
