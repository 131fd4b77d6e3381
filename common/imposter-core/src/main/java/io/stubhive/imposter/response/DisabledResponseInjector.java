package io.stubhive.imposter.response;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.stubhive.imposter.error.InvalidImposterException;
import io.stubhive.imposter.model.ImposterRequest;
import io.stubhive.imposter.model.InjectResponse;

public final class DisabledResponseInjector implements ResponseInjector {

    public static final DisabledResponseInjector INSTANCE = new DisabledResponseInjector();

    private DisabledResponseInjector() {
    }

    @Override
    public ObjectNode inject(InjectResponse response, ImposterRequest request, ResponseContext imposter) {
        throw new InvalidImposterException("no injector is installed; inject responses cannot be evaluated");
    }
}
