package com.roomdrawapp.roomdraw.domain.estimate;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Identities predicted to be absorbed by some pool before the primary draw reaches them.
 */
public record ClaimantSet(String label, Set<String> identities) {

    public ClaimantSet {
        identities = (identities == null || identities.isEmpty())
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(identities));
    }

    public static ClaimantSet empty(String label) {
        return new ClaimantSet(label, null);
    }

    public boolean contains(String identity) {
        return identity != null && identities.contains(identity);
    }

    public int size() {
        return identities.size();
    }

    public boolean isEmpty() {
        return identities.isEmpty();
    }
}
