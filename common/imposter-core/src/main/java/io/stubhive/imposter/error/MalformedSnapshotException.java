package io.stubhive.imposter.error;

public class MalformedSnapshotException extends ImposterException {

    public MalformedSnapshotException(String message) {
        super("bad data", message);
    }

    public MalformedSnapshotException(String message, Throwable cause) {
        super("bad data", message, cause);
    }
}
