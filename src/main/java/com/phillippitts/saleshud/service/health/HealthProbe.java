package com.phillippitts.saleshud.service.health;

/**
 * Lightweight reachability check for one dependency. Returning normally means healthy.
 */
@FunctionalInterface
public interface HealthProbe {

    void probe() throws Exception;
}
