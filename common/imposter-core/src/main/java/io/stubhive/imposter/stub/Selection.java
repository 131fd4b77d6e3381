package io.stubhive.imposter.stub;

import io.stubhive.imposter.model.ResponseSpec;

/**
 * The response entry handed out for one match.
 *
 * @param slot position in the stub's response sequence, {@code -1} when the stub has none
 * @param spec the entry as it was when selected, {@code null} when the stub has none
 */
public record Selection(int slot, ResponseSpec spec) {

    static final Selection NONE = new Selection(-1, null);

    public boolean isEmpty() {
        return spec == null;
    }
}
