package com.riansoft.pickup_routing.solver;

import java.time.Duration;

public class SolveOptions {
    public final Duration timeLimit;
    public final int numThreads;

    public SolveOptions(Duration timeLimit, int numThreads) {
        this.timeLimit = timeLimit;
        this.numThreads = Math.max(1, numThreads);
    }

    public static SolveOptions unlimited() {
        return new SolveOptions(null, 1);
    }

    public boolean hasTimeLimit() {
        return timeLimit != null;
    }
}
