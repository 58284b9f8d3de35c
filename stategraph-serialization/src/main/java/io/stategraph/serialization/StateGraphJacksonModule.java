package io.stategraph.serialization;

import com.fasterxml.jackson.databind.module.SimpleModule;
import io.stategraph.core.state.HistoryEntry;
import io.stategraph.core.storage.ExecutionSnapshot;
import io.stategraph.serialization.mixin.ExecutionSnapshotMixin;
import io.stategraph.serialization.mixin.HistoryEntryBuilderMixin;
import io.stategraph.serialization.mixin.HistoryEntryMixin;
import java.io.Serial;

/// Jackson `SimpleModule` that registers all state graph serialization configuration.
///
/// Records (`ExecutionSnapshot`, `UserInputRecord`, `FieldSubstitution`,
/// `PendingInteraction`, `EdgeRef`) bind through Jackson's native record support. Mixins
/// cover the rest:
/// - `HistoryEntry` + `HistoryEntry.Builder` (builder-pattern immutable type)
/// - `ExecutionSnapshot` (drops derived `suspended` / `terminal` flags)
///
/// @implNote All registrations are explicit; no classpath scanning.
/// @see SnapshotSerializer for the convenience factory API
public class StateGraphJacksonModule extends SimpleModule {

    @Serial private static final long serialVersionUID = 3391775092268410327L;

    public StateGraphJacksonModule() {
        super("StateGraphJacksonModule");
    }

    /// Applies mixin annotations to core domain types.
    ///
    /// @param context the setup context provided by Jackson, not null
    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        context.setMixInAnnotations(HistoryEntry.class, HistoryEntryMixin.class);
        context.setMixInAnnotations(HistoryEntry.Builder.class, HistoryEntryBuilderMixin.class);

        context.setMixInAnnotations(ExecutionSnapshot.class, ExecutionSnapshotMixin.class);
    }
}
