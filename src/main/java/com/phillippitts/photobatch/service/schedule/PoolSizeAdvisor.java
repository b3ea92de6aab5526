package com.phillippitts.photobatch.service.schedule;

import java.util.OptionalInt;

/**
 * Source of worker-count recommendations, consulted by the scheduler between poll cycles.
 */
public interface PoolSizeAdvisor {

    /**
     * Takes the latest unconsumed recommendation, if any.
     *
     * @return the worker count the pool should be rebuilt with
     */
    OptionalInt takeRecommendation();

    static PoolSizeAdvisor none() {
        return OptionalInt::empty;
    }
}
