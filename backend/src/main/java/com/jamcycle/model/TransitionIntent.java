package com.jamcycle.model;

/**
 * One transition chosen by the scheduler, paired with the dedup token it writes when applied.
 */
public record TransitionIntent(
        PhaseIntent intent,
        String cycleKey,
        String token
) {
    public static TransitionIntent of(PhaseIntent intent, String cycleKey) {
        return new TransitionIntent(intent, cycleKey, intent.tokenFor(cycleKey));
    }
}
