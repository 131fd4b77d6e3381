package io.stubhive.imposter.snapshot;

import io.stubhive.imposter.model.ImposterDefinition;
import java.util.List;

/**
 * Portable state of a registry: {@code {"imposters": [...]}}.
 */
public record SnapshotDocument(List<ImposterDefinition> imposters) {

    public SnapshotDocument {
        imposters = imposters == null ? List.of() : List.copyOf(imposters);
    }
}
