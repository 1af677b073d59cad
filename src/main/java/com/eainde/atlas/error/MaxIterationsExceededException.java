package com.eainde.atlas.error;

public class MaxIterationsExceededException extends AgentException {

    private final int maxIterations;

    public MaxIterationsExceededException(int maxIterations) {
        super(FailureKind.MAX_ITERATIONS_EXCEEDED,
                "No final answer after " + maxIterations + " reasoning/tool cycles");
        this.maxIterations = maxIterations;
    }

    public int getMaxIterations() {
        return maxIterations;
    }
}
