package io.stubhive.imposter.model;

import java.time.Instant;

/**
 * Protocol-neutral envelope for a decoded inbound message. Predicates are
 * evaluated against the JSON form of the concrete record.
 */
public sealed interface ImposterRequest permits HttpImposterRequest, TcpImposterRequest, SmtpImposterRequest {

    /** Remote {@code address:port} the message came from. */
    String requestFrom();

    /** Remote address without the port. */
    String ip();

    Instant timestamp();
}
