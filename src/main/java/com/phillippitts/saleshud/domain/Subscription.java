package com.phillippitts.saleshud.domain;

/**
 * Handle for a registered listener. Cancelling twice has no effect.
 */
@FunctionalInterface
public interface Subscription {

    void cancel();
}
