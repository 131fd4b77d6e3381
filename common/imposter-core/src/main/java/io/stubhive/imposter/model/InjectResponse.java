package io.stubhive.imposter.model;

/**
 * Opaque computed response. The engine hands {@code function} to a
 * {@code ResponseInjector} without interpreting it.
 */
public record InjectResponse(String function) implements ResponseSpec {

    @Override
    public <R> R accept(Visitor<R> visitor) {
        return visitor.visitInject(this);
    }
}
