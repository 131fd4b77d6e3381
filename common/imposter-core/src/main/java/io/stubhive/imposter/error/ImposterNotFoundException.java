package io.stubhive.imposter.error;

public class ImposterNotFoundException extends ImposterException {

    public ImposterNotFoundException(String message) {
        super("no such resource", message);
    }

    public static ImposterNotFoundException forPort(int port) {
        return new ImposterNotFoundException("no imposter on port " + port);
    }
}
