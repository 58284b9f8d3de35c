package io.stategraph.serialization.mixin;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/// Jackson mixin keeping derived flags of `ExecutionSnapshot` out of the JSON document.
///
/// `isSuspended()` and `isTerminal()` are computed from `status`; writing them would only
/// produce properties that are dropped again on read.
@JsonIgnoreProperties(
        value = {"suspended", "terminal"},
        ignoreUnknown = true)
public abstract class ExecutionSnapshotMixin {}
