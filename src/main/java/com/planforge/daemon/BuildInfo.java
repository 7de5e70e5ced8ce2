package com.planforge.daemon;

/**
 * Identity of a daemon build, used for upgrade negotiation.
 *
 * @param sha       source revision the build was made from
 * @param timestamp build time in epoch seconds; 0 when unknown
 */
public record BuildInfo(String sha, long timestamp) {

    /**
     * Whether a caller built at {@code callerTimestamp} may retire a daemon of this build.
     * Only a strictly newer caller wins, and a daemon of unknown build time is never retired.
     */
    public boolean isSupersededBy(long callerTimestamp) {
        return timestamp > 0 && callerTimestamp > timestamp;
    }
}
