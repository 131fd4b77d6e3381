package io.stubhive.imposter.model;

/**
 * One entry of a stub's response sequence: a literal payload, a forwarding
 * instruction or a computed response.
 */
public sealed interface ResponseSpec permits IsResponse, ProxyResponse, InjectResponse {

    <R> R accept(Visitor<R> visitor);

    /**
     * Exhaustive dispatch over the response variants.
     */
    interface Visitor<R> {

        R visitIs(IsResponse response);

        R visitProxy(ProxyResponse response);

        R visitInject(InjectResponse response);
    }
}
