package io.stubhive.imposter.snapshot;

/**
 * Which parts of a live imposter a document shows.
 *
 * @param replayable    configuration only, without request counters and recorded requests
 * @param removeProxies proxy entries replaced by what they recorded
 */
public record ImposterView(boolean replayable, boolean removeProxies) {

    public static final ImposterView FULL = new ImposterView(false, false);
    public static final ImposterView REPLAYABLE = new ImposterView(true, false);
    public static final ImposterView SNAPSHOT = new ImposterView(true, true);
}
