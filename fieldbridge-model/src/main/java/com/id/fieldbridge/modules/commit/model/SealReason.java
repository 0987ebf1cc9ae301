package com.id.fieldbridge.modules.commit.model;

public enum SealReason {

    /** Every expected variant arrived. */
    COMPLETE,
    /** The window timer expired first. */
    TIMEOUT,
    /** Force-sealed to keep the number of open entries bounded. */
    EVICTED,
    /** Force-sealed while the service was stopping. */
    SHUTDOWN;

    public boolean isPartial() {
        return this != COMPLETE;
    }
}
