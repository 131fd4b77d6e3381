package io.stubhive.imposter.protocol;

import io.stubhive.imposter.model.ImposterRequest;
import io.stubhive.imposter.model.ImposterResponse;

@FunctionalInterface
public interface RequestHandler {

    ImposterResponse handle(ImposterRequest request);
}
