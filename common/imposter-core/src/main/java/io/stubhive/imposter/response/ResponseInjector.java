package io.stubhive.imposter.response;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stubhive.imposter.model.ImposterRequest;
import io.stubhive.imposter.model.InjectResponse;

/**
 * Computes the payload for an {@code inject} response.
 */
@FunctionalInterface
public interface ResponseInjector {

    ObjectNode inject(InjectResponse response, ImposterRequest request, ResponseContext imposter);
}
