package io.stubhive.imposter.error;

public class InvalidProtocolException extends ImposterException {

    public InvalidProtocolException(String protocol) {
        super("invalid protocol", "the " + protocol + " protocol is not supported");
    }
}
