package com.questrail.booking.transport.lossy;

/**
 * Failure model applied by {@link LossyDatagramEndpoint}.
 *
 * @param dropProbability      probability in {@code [0, 1]} that an outbound
 *                             datagram is discarded
 * @param duplicateProbability probability in {@code [0, 1]} of each extra copy
 *                             of a datagram that survived the drop decision
 * @param dropInbound          whether received datagrams are also dropped with
 *                             {@code dropProbability}
 */
public record LossProfile(double dropProbability, double duplicateProbability, boolean dropInbound)
{
    /** Upper bound on copies sent for one datagram, original included. */
    public static final int MAX_COPIES = 8;

    public LossProfile {
        requireProbability("dropProbability", dropProbability);
        requireProbability("duplicateProbability", duplicateProbability);
    }

    public static LossProfile none() {
        return new LossProfile(0.0, 0.0, false);
    }

    public static LossProfile outbound(double dropProbability, double duplicateProbability) {
        return new LossProfile(dropProbability, duplicateProbability, false);
    }

    public boolean isLossless() {
        return dropProbability == 0.0 && duplicateProbability == 0.0;
    }

    private static void requireProbability(String name, double p) {
        if (Double.isNaN(p) || p < 0.0 || p > 1.0) {
            throw new IllegalArgumentException(name + " must be in [0, 1] (was " + p + ")");
        }
    }
}
