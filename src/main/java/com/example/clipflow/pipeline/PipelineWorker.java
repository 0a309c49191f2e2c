package com.example.clipflow.pipeline;

/**
 * Pulls claimable work units into the bounded worker slots and drives each claimed attempt through
 * its remaining stages.
 */
public interface PipelineWorker {

    /**
     * Hands up to the number of free worker slots of claimable units to the worker pool.
     *
     * @return number of units handed to the pool
     */
    int pollQueue();

    /**
     * Claims the unit and, if the claim is won, runs the attempt on the calling thread.
     *
     * @return true if this call won the claim
     */
    boolean claimAndRun(Long workUnitId);
}
