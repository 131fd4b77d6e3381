package io.stubhive.imposter.registry;

import io.stubhive.imposter.model.StubDefinition;

/**
 * A stub's declared form together with how often it matched.
 */
public record StubSnapshot(StubDefinition definition, long matches) {
}
