package org.netpreserve.domainprober;

public enum Outcome {
    /**
     * Responded with real content.
     */
    LIVE,
    /**
     * Responded, but with a placeholder: too short or a parking/for-sale page.
     */
    PARKED,
    /**
     * Non-200 status or no usable response at all.
     */
    EMPTY,
    /**
     * The probe itself failed unexpectedly.
     */
    ERROR;

    public boolean isLive() {
        return this == LIVE;
    }
}
