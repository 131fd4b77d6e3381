package io.stubhive.imposter.model;

import java.time.Instant;
import java.util.List;

public record SmtpImposterRequest(
    String requestFrom,
    String ip,
    Instant timestamp,
    String envelopeFrom,
    List<String> envelopeTo,
    SmtpAddress from,
    List<SmtpAddress> to,
    List<SmtpAddress> cc,
    String subject,
    String text
) implements ImposterRequest {

    public SmtpImposterRequest {
        envelopeTo = envelopeTo == null ? List.of() : List.copyOf(envelopeTo);
        to = to == null ? List.of() : List.copyOf(to);
        cc = cc == null ? List.of() : List.copyOf(cc);
    }
}
